package com.phillippitts.adaptiveencoder.service.encode;

/**
 * Lifecycle states of a pass plan.
 */
public enum PassState {
    IDLE,
    SINGLE_PASS_RUNNING,
    PASS1_RUNNING,
    PASS1_COMPLETE,
    PASS2_RUNNING,
    COMPLETE,
    FAILED;

    public boolean isRunning() {
        return this == SINGLE_PASS_RUNNING || this == PASS1_RUNNING || this == PASS2_RUNNING;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
