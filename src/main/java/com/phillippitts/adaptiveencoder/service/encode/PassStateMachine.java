package com.phillippitts.adaptiveencoder.service.encode;

import com.phillippitts.adaptiveencoder.domain.EncodingMode;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state machine for one pass plan.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * CRF:     IDLE → SINGLE_PASS_RUNNING → COMPLETE
 * ABR/CBR: IDLE → PASS1_RUNNING → PASS1_COMPLETE → PASS2_RUNNING → COMPLETE
 * any running state → FAILED
 * </pre>
 *
 * <p>Invalid transitions throw {@link IllegalStateException}; in particular pass 2 cannot begin
 * unless pass 1 completed.
 */
public final class PassStateMachine {

    private final Lock lock = new ReentrantLock();
    private final EncodingMode mode;
    private PassState state = PassState.IDLE;

    public PassStateMachine(EncodingMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    /**
     * Moves into the running state of the given pass.
     *
     * @param passIndex 1-based pass number
     * @throws IllegalStateException if the pass cannot start from the current state
     */
    public void begin(int passIndex) {
        lock.lock();
        try {
            PassState next;
            if (!mode.isTwoPass() && passIndex == 1 && state == PassState.IDLE) {
                next = PassState.SINGLE_PASS_RUNNING;
            } else if (mode.isTwoPass() && passIndex == 1 && state == PassState.IDLE) {
                next = PassState.PASS1_RUNNING;
            } else if (mode.isTwoPass() && passIndex == 2 && state == PassState.PASS1_COMPLETE) {
                next = PassState.PASS2_RUNNING;
            } else {
                throw new IllegalStateException("Cannot begin pass " + passIndex + " of " + mode + " from " + state);
            }
            state = next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records successful completion of the running pass.
     *
     * @throws IllegalStateException if the given pass is not running
     */
    public void complete(int passIndex) {
        lock.lock();
        try {
            if (state == PassState.SINGLE_PASS_RUNNING && passIndex == 1) {
                state = PassState.COMPLETE;
            } else if (state == PassState.PASS1_RUNNING && passIndex == 1) {
                state = PassState.PASS1_COMPLETE;
            } else if (state == PassState.PASS2_RUNNING && passIndex == 2) {
                state = PassState.COMPLETE;
            } else {
                throw new IllegalStateException("Pass " + passIndex + " is not running (state " + state + ")");
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the plan failed. Only valid while a pass is running.
     *
     * @throws IllegalStateException if no pass is running
     */
    public void fail() {
        lock.lock();
        try {
            if (!state.isRunning()) {
                throw new IllegalStateException("Cannot fail from " + state);
            }
            state = PassState.FAILED;
        } finally {
            lock.unlock();
        }
    }

    public PassState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }
}
