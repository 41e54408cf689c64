package com.iterharness.process;

public enum SupervisorState {
    NOT_STARTED,
    STARTING,
    READY,
    STOPPING,
    STOPPED,
    FAILED
}
