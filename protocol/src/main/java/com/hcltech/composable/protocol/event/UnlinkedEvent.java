package com.hcltech.composable.protocol.event;

import com.hcltech.composable.graph.NodeId;

public record UnlinkedEvent(long sequence, long timestamp, String actor, Payload payload,
                            NodeId previousTarget, String recipient,
                            byte[] annotation) implements CompositionEvent {
}
