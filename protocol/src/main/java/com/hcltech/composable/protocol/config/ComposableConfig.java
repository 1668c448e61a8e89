package com.hcltech.composable.protocol.config;

import com.hcltech.composable.common.IEnvGetter;
import com.hcltech.composable.graph.InMemoryLinkGraph;

import java.util.Locale;
import java.util.Objects;

/**
 * @param custodyAddress    the address under which this system holds linked assets
 * @param maxDepth          defensive bound on root resolution
 * @param custodyPolicy     custody handling for non-fungible nodes
 * @param acceptUnsolicited whether receiver callbacks accept transfers no operation asked for
 */
public record ComposableConfig(String custodyAddress, int maxDepth, CustodyPolicy custodyPolicy,
                               boolean acceptUnsolicited) {

    public static final String CUSTODY_ADDRESS = "COMPOSABLE_CUSTODY_ADDRESS";
    public static final String MAX_DEPTH = "COMPOSABLE_MAX_DEPTH";
    public static final String CUSTODY_POLICY = "COMPOSABLE_CUSTODY_POLICY";
    public static final String ACCEPT_UNSOLICITED = "COMPOSABLE_ACCEPT_UNSOLICITED";

    public ComposableConfig {
        Objects.requireNonNull(custodyAddress, "custodyAddress");
        Objects.requireNonNull(custodyPolicy, "custodyPolicy");
        if (custodyAddress.isBlank()) throw new IllegalArgumentException("custodyAddress must not be blank");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        custodyAddress = custodyAddress.trim().toLowerCase(Locale.ROOT);
    }

    public static ComposableConfig defaults(String custodyAddress) {
        return new ComposableConfig(custodyAddress, InMemoryLinkGraph.DEFAULT_MAX_DEPTH, CustodyPolicy.ESCROW, true);
    }

    public static ComposableConfig fromEnv(IEnvGetter env) {
        return new ComposableConfig(
                IEnvGetter.getString(env, CUSTODY_ADDRESS),
                IEnvGetter.getIntOr(env, MAX_DEPTH, InMemoryLinkGraph.DEFAULT_MAX_DEPTH),
                IEnvGetter.getEnumOr(env, CUSTODY_POLICY, CustodyPolicy.class, CustodyPolicy.ESCROW),
                IEnvGetter.getBooleanOr(env, ACCEPT_UNSOLICITED, true));
    }

    public ComposableConfig withCustodyPolicy(CustodyPolicy policy) {
        return new ComposableConfig(custodyAddress, maxDepth, policy, acceptUnsolicited);
    }

    public ComposableConfig withMaxDepth(int depth) {
        return new ComposableConfig(custodyAddress, depth, custodyPolicy, acceptUnsolicited);
    }

    public ComposableConfig withAcceptUnsolicited(boolean accept) {
        return new ComposableConfig(custodyAddress, maxDepth, custodyPolicy, accept);
    }
}
