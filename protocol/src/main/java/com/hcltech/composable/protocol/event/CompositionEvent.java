package com.hcltech.composable.protocol.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.hcltech.composable.common.codec.Codec;

/**
 * The single notification emitted by a successful mutating operation. Sequence numbers are
 * assigned in commit order, starting at 1.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LinkedEvent.class, name = "linked"),
        @JsonSubTypes.Type(value = TargetUpdatedEvent.class, name = "targetUpdated"),
        @JsonSubTypes.Type(value = UnlinkedEvent.class, name = "unlinked")
})
public interface CompositionEvent {

    Codec<CompositionEvent, String> codec = Codec.clazzCodec(CompositionEvent.class);

    long sequence();

    long timestamp();

    String actor();

    Payload payload();

    /** Opaque bytes supplied by the caller; never interpreted here. */
    byte[] annotation();
}
