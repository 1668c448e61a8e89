package com.hcltech.composable.protocol;

import com.hcltech.composable.common.ITimeService;
import com.hcltech.composable.common.metrics.InMemoryMetrics;
import com.hcltech.composable.graph.InMemoryLinkGraph;
import com.hcltech.composable.graph.LinkGraph;
import com.hcltech.composable.graph.NodeId;
import com.hcltech.composable.ledger.AttachmentLedger;
import com.hcltech.composable.ledger.InMemoryAttachmentLedger;
import com.hcltech.composable.protocol.auth.AuthorizationPolicy;
import com.hcltech.composable.protocol.collaborator.CountedAssets;
import com.hcltech.composable.protocol.collaborator.FungibleAssets;
import com.hcltech.composable.protocol.collaborator.NonFungibleAssets;
import com.hcltech.composable.protocol.config.ComposableConfig;
import com.hcltech.composable.protocol.event.InMemoryCompositionEventLog;

import java.math.BigInteger;

/** Shared wiring for protocol tests: a protocol over in-memory graph, ledger and event log. */
final class ProtocolFixture {
    static final String CUSTODY = "0xc0570d1";
    static final String ALICE = "0xa11ce";
    static final String BOB = "0xb0b";
    static final String USDC = "0x05dc";
    static final String ITEMS = "0x1155";
    static final BigInteger POTION = BigInteger.valueOf(42);
    static final byte[] NOTE = {1, 2, 3};

    static final NodeId A = NodeId.of("0xaaaa", 1);
    static final NodeId B = NodeId.of("0xaaaa", 2);
    static final NodeId C = NodeId.of("0xcccc", 1);
    static final NodeId GHOST = NodeId.of("0xaaaa", 999);

    final ComposableConfig config;
    final LinkGraph graph;
    final AttachmentLedger ledger = new InMemoryAttachmentLedger();
    final InMemoryCompositionEventLog events = new InMemoryCompositionEventLog();
    final InMemoryMetrics metrics = new InMemoryMetrics();
    final CompositionProtocol protocol;

    ProtocolFixture(ComposableConfig config, NonFungibleAssets nfts, FungibleAssets coins, CountedAssets items,
                    AuthorizationPolicy authorization) {
        this(config, null, nfts, coins, items, authorization);
    }

    /** A null graph means a fresh one bounded by the config's depth. */
    ProtocolFixture(ComposableConfig config, LinkGraph graph, NonFungibleAssets nfts, FungibleAssets coins,
                    CountedAssets items, AuthorizationPolicy authorization) {
        this.config = config;
        this.graph = graph != null ? graph : new InMemoryLinkGraph(config.maxDepth(), metrics);
        this.protocol = new CompositionProtocol(config, graph, ledger,
                new CompositionCollaborators(nfts, coins, items), authorization, events,
                ITimeService.fixed(1_700_000_000_000L), metrics);
    }

    /** Fake assets with A, B, C minted to Alice and the protocol registered as custody receiver. */
    static ProtocolFixture withFakeAssets(ComposableConfig config, InMemoryAssets assets) {
        return withFakeAssets(config, null, assets);
    }

    static ProtocolFixture withFakeAssets(ComposableConfig config, LinkGraph graph, InMemoryAssets assets) {
        assets.mint(A, ALICE);
        assets.mint(B, ALICE);
        assets.mint(C, ALICE);
        var fixture = new ProtocolFixture(config, graph, assets, assets, assets, AuthorizationPolicy.allowAll());
        assets.registerReceiver(CUSTODY, fixture.protocol);
        return fixture;
    }

    static ComposableConfig defaultConfig() {
        return ComposableConfig.defaults(CUSTODY);
    }

    static BigInteger n(long v) {
        return BigInteger.valueOf(v);
    }
}
