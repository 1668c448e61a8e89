package com.hcltech.composable.ledger;

import com.hcltech.composable.graph.CompositionException;
import com.hcltech.composable.graph.ErrorKind;
import com.hcltech.composable.graph.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public final class InMemoryAttachmentLedger implements AttachmentLedger {
    private static final Logger log = LoggerFactory.getLogger(InMemoryAttachmentLedger.class);

    // zero balances are removed, never stored
    private final Map<AttachmentKey, BigInteger> balances = new HashMap<>();
    private final Map<ResourceKey, BigInteger> totals = new HashMap<>();

    @Override
    public void deposit(ResourceKey resource, NodeId owner, BigInteger amount) {
        var key = new AttachmentKey(resource, owner);
        requirePositive(amount, key);
        balances.merge(key, amount, BigInteger::add);
        totals.merge(resource, amount, BigInteger::add);
        log.debug("Deposited {} of {} on {}", amount, resource, owner);
    }

    @Override
    public BigInteger withdrawAll(ResourceKey resource, NodeId owner) {
        var key = new AttachmentKey(resource, owner);
        BigInteger balance = balances.remove(key);
        if (balance == null)
            throw new CompositionException(ErrorKind.NOT_FOUND, "no " + resource + " attached to " + owner, owner);
        subtractTotal(resource, balance);
        log.debug("Withdrew all {} of {} from {}", balance, resource, owner);
        return balance;
    }

    @Override
    public BigInteger withdraw(ResourceKey resource, NodeId owner, BigInteger amount) {
        var key = new AttachmentKey(resource, owner);
        BigInteger balance = balances.get(key);
        if (balance == null)
            throw new CompositionException(ErrorKind.NOT_FOUND, "no " + resource + " attached to " + owner, owner);
        requirePositive(amount, key);
        if (amount.compareTo(balance) > 0)
            throw new CompositionException(ErrorKind.INVALID_AMOUNT,
                    "cannot withdraw " + amount + " of " + resource + " from " + owner + ", balance is " + balance, owner);
        BigInteger left = balance.subtract(amount);
        if (left.signum() == 0) balances.remove(key);
        else balances.put(key, left);
        subtractTotal(resource, amount);
        log.debug("Withdrew {} of {} from {}, {} left", amount, resource, owner, left);
        return left;
    }

    @Override
    public BigInteger balanceOf(ResourceKey resource, NodeId owner) {
        return balances.getOrDefault(new AttachmentKey(resource, owner), BigInteger.ZERO);
    }

    @Override
    public BigInteger totalOf(ResourceKey resource) {
        return totals.getOrDefault(Objects.requireNonNull(resource), BigInteger.ZERO);
    }

    @Override
    public Map<ResourceKey, BigInteger> attachmentsOf(NodeId owner) {
        Objects.requireNonNull(owner);
        Map<ResourceKey, BigInteger> out = new TreeMap<>();
        balances.forEach((k, v) -> {
            if (k.owner().equals(owner)) out.put(k.resource(), v);
        });
        return Collections.unmodifiableMap(out);
    }

    @Override
    public Map<AttachmentKey, BigInteger> snapshot() {
        return Map.copyOf(balances);
    }

    private static void requirePositive(BigInteger amount, AttachmentKey key) {
        if (amount == null || amount.signum() <= 0)
            throw new CompositionException(ErrorKind.INVALID_AMOUNT,
                    "amount of " + key.resource() + " for " + key.owner() + " must be positive, was " + amount, key.owner());
    }

    private void subtractTotal(ResourceKey resource, BigInteger amount) {
        BigInteger left = totals.get(resource).subtract(amount);
        if (left.signum() == 0) totals.remove(resource);
        else totals.put(resource, left);
    }
}
