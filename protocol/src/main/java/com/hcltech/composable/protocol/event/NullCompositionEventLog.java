package com.hcltech.composable.protocol.event;

import java.util.List;

/** No-op log: never writes, always empty when read. */
public final class NullCompositionEventLog implements CompositionEventLog {
    @Override
    public void append(CompositionEvent event) {
        // do nothing
    }

    @Override
    public void retract(CompositionEvent event) {
        // nothing was written
    }

    @Override
    public List<CompositionEvent> getAll() {
        return List.of();
    }
}
