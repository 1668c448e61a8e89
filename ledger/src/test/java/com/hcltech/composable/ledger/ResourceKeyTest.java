package com.hcltech.composable.ledger;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResourceKeyTest {

    @Test
    void currencyHasNoAssetId() {
        var key = ResourceKey.currency("0xUSDC");
        assertEquals(ResourceKind.CURRENCY, key.kind());
        assertEquals("0xusdc", key.contract());
        assertNull(key.assetId());
        assertThrows(IllegalArgumentException.class,
                () -> new ResourceKey(ResourceKind.CURRENCY, "0xusdc", BigInteger.ONE));
    }

    @Test
    void countedAssetNeedsNonNegativeAssetId() {
        assertEquals("0x1155/4", ResourceKey.countedAsset("0x1155", 4).toString());
        assertThrows(IllegalArgumentException.class,
                () -> new ResourceKey(ResourceKind.COUNTED_ASSET, "0x1155", null));
        assertThrows(IllegalArgumentException.class, () -> ResourceKey.countedAsset("0x1155", -4));
    }

    @Test
    void sameContractDifferentAssetIdsAreDifferentResources() {
        assertNotEquals(ResourceKey.countedAsset("0x1155", 1), ResourceKey.countedAsset("0x1155", 2));
        assertTrue(ResourceKey.currency("0xff").compareTo(ResourceKey.countedAsset("0x00", 0)) < 0);
    }
}
