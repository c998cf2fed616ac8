package org.mcts.base.player.mcts.observer;

import com.google.gson.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mcts.base.player.mcts.event.TreeEvent;
import org.mcts.base.player.mcts.event.TreeStartEvent;
import org.mcts.base.player.mcts.model.SearchStatistics;
import org.mcts.base.player.mcts.model.State;
import org.mcts.base.util.observer.Event;
import org.mcts.base.util.observer.Observer;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a JSON snapshot of the root statistics after every move, one file per turn.
 */
public class TreeObserver implements Observer {

    private static final Logger LOGGER = LogManager.getLogger();

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .registerTypeHierarchyAdapter(State.class, new StateSerializer())
            .create();
    private final File parentFolder;
    private File folder;

    public TreeObserver() {
        this(new File("."));
    }

    public TreeObserver(File parentFolder) {
        this.parentFolder = parentFolder;
    }

    @Override
    public void observe(Event event) {
        try {
            if (event instanceof TreeStartEvent) {

                // Create the folder for this game's trees
                folder = new File(parentFolder, "Trees_" + System.currentTimeMillis());
                Files.createDirectories(folder.toPath());

            } else if (event instanceof TreeEvent) {

                if (folder == null) {
                    throw new IllegalStateException("Tree event received before the tree start event");
                }
                TreeEvent<?> treeEvent = (TreeEvent<?>) event;

                // Write the tree snapshot to a file
                File f = new File(folder, "Tree_" + treeEvent.getTurnNumber() + ".json");
                try (BufferedWriter bw = Files.newBufferedWriter(f.toPath(), StandardCharsets.UTF_8)) {
                    bw.write(toJson(treeEvent));
                }
                LOGGER.debug("Wrote tree snapshot " + f);

            }
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    public File getFolder() {
        return folder;
    }

    public <S extends State<S>> String toJson(TreeEvent<S> treeEvent) {
        return gson.toJson(snapshot(treeEvent));
    }

    private static <S extends State<S>> TreeSnapshot snapshot(TreeEvent<S> treeEvent) {
        SearchStatistics<S> statistics = treeEvent.getTree().getStatistics();
        S root = treeEvent.getRoot();

        TreeSnapshot result = new TreeSnapshot();
        result.turn = treeEvent.getTurnNumber();
        result.root = root;
        result.chosen = treeEvent.getChosen();
        result.numVisits = statistics.getNumVisits(root);
        result.totalReward = statistics.getTotalReward(root);
        result.children = new ArrayList<>();
        if (statistics.isExpanded(root)) {
            for (S child : statistics.getChildren(root)) {
                ChildSnapshot childSnapshot = new ChildSnapshot();
                childSnapshot.state = child;
                childSnapshot.numVisits = statistics.getNumVisits(child);
                childSnapshot.totalReward = statistics.getTotalReward(child);
                if (childSnapshot.numVisits > 0) {
                    childSnapshot.averageReward = statistics.getAverageReward(child);
                }
                result.children.add(childSnapshot);
            }
        }
        return result;
    }

    static class TreeSnapshot {
        int turn;
        State<?> root;
        State<?> chosen;
        int numVisits;
        double totalReward;
        List<ChildSnapshot> children;
    }

    static class ChildSnapshot {
        State<?> state;
        int numVisits;
        double totalReward;
        Double averageReward; // Absent for unvisited children
    }

    static class StateSerializer implements JsonSerializer<State<?>> {
        @Override
        public JsonElement serialize(State<?> src, Type typeOfSrc, JsonSerializationContext context) {
            return new JsonPrimitive(src.toString());
        }
    }
}
