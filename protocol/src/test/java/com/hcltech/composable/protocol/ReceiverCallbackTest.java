package com.hcltech.composable.protocol;

import com.hcltech.composable.graph.NodeId;
import com.hcltech.composable.protocol.auth.AuthorizationPolicy;
import com.hcltech.composable.protocol.collaborator.CountedAssetReceiver;
import com.hcltech.composable.protocol.collaborator.CountedAssets;
import com.hcltech.composable.protocol.collaborator.NonFungibleAssets;
import com.hcltech.composable.protocol.collaborator.NonFungibleReceiver;
import com.hcltech.composable.protocol.event.CountedAssetPayload;
import com.hcltech.composable.protocol.event.NonFungiblePayload;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.hcltech.composable.protocol.ProtocolFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class ReceiverCallbackTest {

    @Test
    void acknowledgesWithMagicValuesByDefault() {
        var f = ProtocolFixture.withFakeAssets(defaultConfig(), new InMemoryAssets());
        assertEquals(NonFungibleReceiver.MAGIC, f.protocol.onNonFungibleReceived(ALICE, ALICE, A, NOTE));
        assertEquals(CountedAssetReceiver.MAGIC, f.protocol.onCountedAssetReceived(ALICE, ALICE, ITEMS, POTION, n(1), NOTE));
    }

    @Test
    void rejectsUnsolicitedTransfersWhenConfigured() {
        var assets = new InMemoryAssets();
        var f = ProtocolFixture.withFakeAssets(defaultConfig().withAcceptUnsolicited(false), assets);

        assertEquals(0, f.protocol.onNonFungibleReceived(ALICE, ALICE, A, NOTE));
        assertEquals(0, f.protocol.onCountedAssetReceived(ALICE, ALICE, ITEMS, POTION, n(1), NOTE));
        assertThrows(IllegalStateException.class, () -> assets.transfer(ALICE, CUSTODY, C, NOTE));
        assertEquals(Optional.of(ALICE), assets.ownerOf(C));
    }

    @Test
    void acceptsTransfersItInitiatesEvenWhenUnsolicitedAreRejected() {
        var assets = new InMemoryAssets();
        var f = ProtocolFixture.withFakeAssets(defaultConfig().withAcceptUnsolicited(false), assets);

        f.protocol.link(ALICE, new NonFungiblePayload(A), B, NOTE);

        assertEquals(Optional.of(CUSTODY), assets.ownerOf(A));
        assertEquals(1, f.events.getAll().size());
    }

    @Test
    void onlyTheTransferInProgressIsAcknowledged_andOnlyOnce() {
        var assets = new InMemoryAssets();
        List<Integer> replies = new ArrayList<>();
        List<CompositionProtocol> self = new ArrayList<>();
        var nfts = new NonFungibleAssets() {
            @Override
            public Optional<String> ownerOf(NodeId node) {
                return assets.ownerOf(node);
            }

            @Override
            public void transfer(String from, String to, NodeId node, byte[] data) {
                CompositionProtocol protocol = self.get(0);
                replies.add(protocol.onNonFungibleReceived(BOB, BOB, node, data));
                replies.add(protocol.onNonFungibleReceived(from, from, C, data));
                assets.transfer(from, to, node, data);
                replies.add(protocol.onNonFungibleReceived(from, from, node, data));
            }
        };
        assets.mint(A, ALICE);
        assets.mint(B, ALICE);
        assets.mint(C, ALICE);
        var f = new ProtocolFixture(defaultConfig().withAcceptUnsolicited(false), nfts, assets, assets,
                AuthorizationPolicy.allowAll());
        self.add(f.protocol);
        assets.registerReceiver(CUSTODY, f.protocol);

        f.protocol.link(ALICE, new NonFungiblePayload(A), B, NOTE);

        assertEquals(List.of(0, 0, 0), replies);
        assertEquals(Optional.of(CUSTODY), assets.ownerOf(A));
    }

    @Test
    void countedDepositIsAcknowledgedOnlyForTheAmountBeingBooked() {
        var assets = new InMemoryAssets();
        List<Integer> replies = new ArrayList<>();
        List<CompositionProtocol> self = new ArrayList<>();
        var items = new CountedAssets() {
            @Override
            public void transfer(String contract, String from, String to, BigInteger assetId, BigInteger amount,
                                 byte[] data) {
                replies.add(self.get(0).onCountedAssetReceived(from, from, contract, assetId, amount.add(BigInteger.ONE), data));
                assets.transfer(contract, from, to, assetId, amount, data);
            }

            @Override
            public BigInteger balanceOf(String contract, String holder, BigInteger assetId) {
                return assets.balanceOf(contract, holder, assetId);
            }
        };
        assets.mint(A, ALICE);
        assets.mintCounted(ITEMS, POTION, ALICE, 10);
        var f = new ProtocolFixture(defaultConfig().withAcceptUnsolicited(false), assets, assets, items,
                AuthorizationPolicy.allowAll());
        self.add(f.protocol);
        assets.registerReceiver(CUSTODY, f.protocol);

        f.protocol.link(ALICE, CountedAssetPayload.deposit(ITEMS, POTION, n(4)), A, NOTE);

        assertEquals(List.of(0), replies);
        assertEquals(n(4), assets.balanceOf(ITEMS, CUSTODY, POTION));
        assertEquals(n(4), f.protocol.balanceOfCountedAsset(A, ITEMS, POTION));
    }
}
