package com.hcltech.composable.protocol.event;

import com.hcltech.composable.graph.NodeId;

/** For leaf payloads the previous target is the node the amount was taken from. */
public record TargetUpdatedEvent(long sequence, long timestamp, String actor, Payload payload,
                                 NodeId previousTarget, NodeId newTarget,
                                 byte[] annotation) implements CompositionEvent {
}
