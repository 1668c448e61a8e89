package com.hcltech.composable.protocol;

import com.hcltech.composable.protocol.collaborator.CountedAssets;
import com.hcltech.composable.protocol.collaborator.FungibleAssets;
import com.hcltech.composable.protocol.collaborator.NonFungibleAssets;

import java.util.Objects;

/** The external asset contracts the protocol moves custody through. */
public record CompositionCollaborators(NonFungibleAssets nonFungibles, FungibleAssets fungibles,
                                       CountedAssets countedAssets) {
    public CompositionCollaborators {
        Objects.requireNonNull(nonFungibles, "nonFungibles");
        Objects.requireNonNull(fungibles, "fungibles");
        Objects.requireNonNull(countedAssets, "countedAssets");
    }
}
