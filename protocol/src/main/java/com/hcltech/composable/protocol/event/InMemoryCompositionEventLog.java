package com.hcltech.composable.protocol.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class InMemoryCompositionEventLog implements CompositionEventLog {
    private final List<CompositionEvent> events = new ArrayList<>();

    @Override
    public void append(CompositionEvent event) {
        events.add(Objects.requireNonNull(event));
    }

    @Override
    public void retract(CompositionEvent event) {
        if (events.isEmpty() || events.get(events.size() - 1) != event)
            throw new IllegalStateException("can only retract the latest event, not " + event);
        events.remove(events.size() - 1);
    }

    @Override
    public List<CompositionEvent> getAll() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }
}
