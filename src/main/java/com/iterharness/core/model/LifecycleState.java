package com.iterharness.core.model;

/**
 * Lifecycle of a test environment. Transitions only move forward; STOPPED is terminal.
 * An environment that is closed without being started goes straight to STOPPED.
 */
public enum LifecycleState {
    CREATED,
    STARTED,
    STOPPED;

    public boolean canTransitionTo(LifecycleState next) {
        return switch (this) {
            case CREATED -> next == STARTED || next == STOPPED;
            case STARTED -> next == STOPPED;
            case STOPPED -> false;
        };
    }
}
