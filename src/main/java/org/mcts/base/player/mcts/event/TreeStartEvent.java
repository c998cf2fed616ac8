package org.mcts.base.player.mcts.event;

import org.mcts.base.util.observer.Event;

public class TreeStartEvent extends Event {
}
