package com.hcltech.composable.protocol.collaborator;

import java.math.BigInteger;

/** Counted-asset counterpart of {@link NonFungibleReceiver}. */
public interface CountedAssetReceiver {
    int MAGIC = 0xf23a6e61;

    int onCountedAssetReceived(String operator, String from, String contract, BigInteger assetId,
                               BigInteger amount, byte[] data);
}
