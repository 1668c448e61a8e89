package com.hcltech.composable.protocol.event;

import java.util.List;

public interface CompositionEventLog {
    void append(CompositionEvent event);

    /**
     * Takes back the most recent append, which must be {@code event}. Called when the operation
     * that produced the event fails after appending it.
     */
    void retract(CompositionEvent event);

    /** Every event in append order. */
    List<CompositionEvent> getAll();
}
