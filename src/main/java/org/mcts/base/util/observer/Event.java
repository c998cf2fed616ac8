package org.mcts.base.util.observer;

public abstract class Event {
}
