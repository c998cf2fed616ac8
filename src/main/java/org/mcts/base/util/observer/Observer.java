package org.mcts.base.util.observer;

public interface Observer {
    void observe(Event event);
}
