package com.hcltech.composable.protocol;

import com.hcltech.composable.graph.CompositionException;
import com.hcltech.composable.graph.ErrorKind;
import com.hcltech.composable.graph.NodeId;
import com.hcltech.composable.protocol.collaborator.NonFungibleAssets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Existence and holder lookups, always answered by the non-fungible collaborator. Nothing is
 * cached because tokens can be burnt at any time.
 */
public final class NodeRegistry {
    private static final Logger log = LoggerFactory.getLogger(NodeRegistry.class);

    private final NonFungibleAssets assets;

    public NodeRegistry(NonFungibleAssets assets) {
        this.assets = Objects.requireNonNull(assets);
    }

    /** Lower-cased holder, or empty if the collaborator does not know the node. */
    public Optional<String> holderOf(NodeId node) {
        Objects.requireNonNull(node);
        try {
            return assets.ownerOf(node).map(h -> h.toLowerCase(Locale.ROOT));
        } catch (RuntimeException e) {
            // a failing ownership query is how collaborators report unknown ids
            log.debug("ownerOf({}) failed, treating node as absent: {}: {}",
                    node, e.getClass().getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    public boolean exists(NodeId node) {
        return holderOf(node).isPresent();
    }

    public void requireExists(NodeId node) {
        if (!exists(node)) throw new CompositionException(ErrorKind.NOT_FOUND, node + " does not exist", node);
    }
}
