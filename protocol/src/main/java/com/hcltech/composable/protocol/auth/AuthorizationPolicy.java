package com.hcltech.composable.protocol.auth;

import com.hcltech.composable.graph.CompositionException;
import com.hcltech.composable.graph.ErrorKind;
import com.hcltech.composable.graph.LinkGraph;
import com.hcltech.composable.graph.NodeId;
import com.hcltech.composable.protocol.NodeRegistry;
import com.hcltech.composable.protocol.Operation;
import com.hcltech.composable.protocol.event.Payload;

import java.util.Locale;

/**
 * Decides whether an actor may perform an operation. The subject is the node whose
 * controller must agree: the source for non-fungible operations, the target for a leaf
 * link, and the current owner node for leaf updateTarget and unlink.
 */
@FunctionalInterface
public interface AuthorizationPolicy {

    /** @throws CompositionException UNAUTHORIZED */
    void authorize(String actor, Operation operation, Payload payload, NodeId subject);

    static AuthorizationPolicy allowAll() {
        return (actor, operation, payload, subject) -> {
        };
    }

    /** The actor must hold the root of the subject's tree. */
    static AuthorizationPolicy rootOwner(LinkGraph graph, NodeRegistry registry) {
        return (actor, operation, payload, subject) -> {
            NodeId root = graph.findRoot(subject);
            String holder = registry.holderOf(root).orElse(null);
            if (holder == null || actor == null || !holder.equals(actor.toLowerCase(Locale.ROOT)))
                throw new CompositionException(ErrorKind.UNAUTHORIZED,
                        actor + " does not hold " + root + ", the root of " + subject, subject, root);
        };
    }
}
