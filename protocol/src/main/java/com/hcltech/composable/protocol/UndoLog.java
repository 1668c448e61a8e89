package com.hcltech.composable.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Inverse actions for the mutations applied so far by one operation. On failure they are
 * replayed newest first, leaving graph, ledger and event log as they were before the operation.
 */
final class UndoLog {
    private static final Logger log = LoggerFactory.getLogger(UndoLog.class);

    private record Step(String description, Runnable inverse) {
    }

    private final Deque<Step> steps = new ArrayDeque<>();

    void record(String description, Runnable inverse) {
        steps.push(new Step(description, inverse));
    }

    int size() {
        return steps.size();
    }

    /** Undoes every recorded step. A step that fails to undo is attached to {@code cause} as suppressed. */
    void rollback(Throwable cause) {
        while (!steps.isEmpty()) {
            Step step = steps.pop();
            try {
                step.inverse().run();
                log.debug("Rolled back {}", step.description());
            } catch (RuntimeException e) {
                log.error("Rollback of {} failed; state may be inconsistent", step.description(), e);
                cause.addSuppressed(e);
            }
        }
    }
}
