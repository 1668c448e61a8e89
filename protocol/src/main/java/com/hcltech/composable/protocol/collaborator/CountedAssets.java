package com.hcltech.composable.protocol.collaborator;

import java.math.BigInteger;

/** Multi-asset contracts holding counted units per asset id. */
public interface CountedAssets {

    /** Moves units of one asset id. Throws if the transfer is refused. */
    void transfer(String contract, String from, String to, BigInteger assetId, BigInteger amount, byte[] data);

    BigInteger balanceOf(String contract, String holder, BigInteger assetId);
}
