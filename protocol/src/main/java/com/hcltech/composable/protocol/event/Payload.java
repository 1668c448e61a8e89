package com.hcltech.composable.protocol.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.hcltech.composable.protocol.Family;

/**
 * What an operation moves: a node, or an amount of a fungible resource. The same records
 * describe the affected resource in the notifications.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NonFungiblePayload.class, name = "nonFungible"),
        @JsonSubTypes.Type(value = FungiblePayload.class, name = "fungible"),
        @JsonSubTypes.Type(value = CountedAssetPayload.class, name = "countedAsset")
})
public interface Payload {

    Family family();
}
