package com.hcltech.composable.protocol.event;

import com.hcltech.composable.graph.NodeId;

public record LinkedEvent(long sequence, long timestamp, String actor, Payload payload, NodeId target,
                          byte[] annotation) implements CompositionEvent {
}
