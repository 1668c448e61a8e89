package com.hcltech.composable.protocol.collaborator;

import java.math.BigInteger;

/** Currency contracts. */
public interface FungibleAssets {

    /** Moves an amount of a currency. Throws if the transfer is refused. */
    void transfer(String currency, String from, String to, BigInteger amount);

    BigInteger balanceOf(String currency, String holder);
}
