package com.hcltech.composable.protocol;

import com.hcltech.composable.common.ITimeService;
import com.hcltech.composable.common.errorsor.ErrorsOr;
import com.hcltech.composable.common.metrics.Metrics;
import com.hcltech.composable.graph.CompositionException;
import com.hcltech.composable.graph.ErrorKind;
import com.hcltech.composable.graph.ForestValidation;
import com.hcltech.composable.graph.LinkGraph;
import com.hcltech.composable.graph.NodeId;
import com.hcltech.composable.ledger.AttachmentLedger;
import com.hcltech.composable.ledger.ResourceKey;
import com.hcltech.composable.ledger.ResourceKind;
import com.hcltech.composable.protocol.auth.AuthorizationPolicy;
import com.hcltech.composable.protocol.collaborator.CountedAssetReceiver;
import com.hcltech.composable.protocol.collaborator.NonFungibleReceiver;
import com.hcltech.composable.protocol.config.ComposableConfig;
import com.hcltech.composable.protocol.config.CustodyPolicy;
import com.hcltech.composable.protocol.event.CompositionEvent;
import com.hcltech.composable.protocol.event.CompositionEventLog;
import com.hcltech.composable.protocol.event.LeafPayload;
import com.hcltech.composable.protocol.event.LinkedEvent;
import com.hcltech.composable.protocol.event.NonFungiblePayload;
import com.hcltech.composable.protocol.event.Payload;
import com.hcltech.composable.protocol.event.TargetUpdatedEvent;
import com.hcltech.composable.protocol.event.UnlinkedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Sequences every mutating call: validate, book the ledger, change the graph, record exactly one
 * {@link CompositionEvent}, then move custody. Custody goes last because it is the one step that
 * cannot be taken back here. Any failure undoes what was already applied, so a refused call leaves
 * no trace, emits nothing and consumes no sequence number.
 * <p>
 * The protocol is the only writer of its {@link LinkGraph} and {@link AttachmentLedger}.
 * It does no locking: the host must run one call at a time.
 */
public final class CompositionProtocol implements NonFungibleReceiver, CountedAssetReceiver {
    private static final Logger log = LoggerFactory.getLogger(CompositionProtocol.class);

    private final ComposableConfig config;
    private final LinkGraph graph;
    private final AttachmentLedger ledger;
    private final CompositionCollaborators collaborators;
    private final NodeRegistry registry;
    private final AuthorizationPolicy authorization;
    private final CompositionEventLog events;
    private final ITimeService time;
    private final Metrics metrics;

    private final Set<NodeId> quarantined = new HashSet<>();
    private long sequence;
    private Incoming expectedIncoming;

    public CompositionProtocol(ComposableConfig config, LinkGraph graph, AttachmentLedger ledger,
                               CompositionCollaborators collaborators, AuthorizationPolicy authorization,
                               CompositionEventLog events, ITimeService time, Metrics metrics) {
        this.config = Objects.requireNonNull(config);
        this.graph = Objects.requireNonNull(graph);
        this.ledger = Objects.requireNonNull(ledger);
        this.collaborators = Objects.requireNonNull(collaborators);
        this.registry = new NodeRegistry(collaborators.nonFungibles());
        this.authorization = Objects.requireNonNull(authorization);
        this.events = Objects.requireNonNull(events);
        this.time = Objects.requireNonNull(time);
        this.metrics = Objects.requireNonNull(metrics);
    }

    public NodeRegistry registry() {
        return registry;
    }

    public ComposableConfig config() {
        return config;
    }

    // ------------------------------------------------------------------------
    // Mutating surface
    // ------------------------------------------------------------------------

    /**
     * Links a node under a target, or deposits an amount of a leaf resource onto it.
     *
     * @throws CompositionException if the call is refused; nothing has changed
     */
    public CompositionEvent link(String actor, Payload payload, NodeId target, byte[] annotation) {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(target, "target");
        byte[] note = copy(annotation);
        return execute(payload.family(), Operation.LINK, undo -> {
            if (payload instanceof NonFungiblePayload nf) return linkNode(undo, actor, nf, target, note);
            return linkLeaf(undo, actor, (LeafPayload) payload, target, note);
        });
    }

    /**
     * Moves an existing edge or attachment to a new target.
     *
     * @throws CompositionException if the call is refused; nothing has changed
     */
    public CompositionEvent updateTarget(String actor, Payload payload, NodeId newTarget, byte[] annotation) {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(newTarget, "newTarget");
        byte[] note = copy(annotation);
        return execute(payload.family(), Operation.UPDATE_TARGET, undo -> {
            if (payload instanceof NonFungiblePayload nf) return updateNode(undo, actor, nf, newTarget, note);
            return updateLeaf(undo, actor, (LeafPayload) payload, newTarget, note);
        });
    }

    /**
     * Removes an existing edge or attachment, releasing any custody to the recipient.
     *
     * @throws CompositionException if the call is refused; nothing has changed
     */
    public CompositionEvent unlink(String actor, String recipient, Payload payload, byte[] annotation) {
        Objects.requireNonNull(payload, "payload");
        if (recipient == null || recipient.isBlank()) throw new IllegalArgumentException("recipient must not be blank");
        byte[] note = copy(annotation);
        return execute(payload.family(), Operation.UNLINK, undo -> {
            if (payload instanceof NonFungiblePayload nf) return unlinkNode(undo, actor, recipient, nf, note);
            return unlinkLeaf(undo, actor, recipient, (LeafPayload) payload, note);
        });
    }

    public ErrorsOr<CompositionEvent> tryLink(String actor, Payload payload, NodeId target, byte[] annotation) {
        return ErrorsOr.trying(() -> link(actor, payload, target, annotation), CompositionProtocol::describe);
    }

    public ErrorsOr<CompositionEvent> tryUpdateTarget(String actor, Payload payload, NodeId newTarget, byte[] annotation) {
        return ErrorsOr.trying(() -> updateTarget(actor, payload, newTarget, annotation), CompositionProtocol::describe);
    }

    public ErrorsOr<CompositionEvent> tryUnlink(String actor, String recipient, Payload payload, byte[] annotation) {
        return ErrorsOr.trying(() -> unlink(actor, recipient, payload, annotation), CompositionProtocol::describe);
    }

    // ------------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------------

    public NodeId findRootToken(NodeId node) {
        try {
            return graph.findRoot(node);
        } catch (CompositionException e) {
            if (e.kind() == ErrorKind.GRAPH_CORRUPTED) quarantine(e.nodes());
            throw e;
        }
    }

    public Optional<NodeId> getTarget(NodeId node) {
        return graph.getTarget(node);
    }

    public BigInteger balanceOfFungible(NodeId owner, String currency) {
        return ledger.balanceOf(ResourceKey.currency(currency), owner);
    }

    public BigInteger balanceOfCountedAsset(NodeId owner, String contract, BigInteger assetId) {
        return ledger.balanceOf(ResourceKey.countedAsset(contract, assetId), owner);
    }

    public Set<NodeId> getChildren(NodeId node) {
        return graph.getChildren(node);
    }

    public List<NodeId> getSubtree(NodeId node) {
        return graph.getSubtree(node);
    }

    public int depthOf(NodeId node) {
        return graph.depthOf(node);
    }

    /** Holder of the node's root, i.e. whoever ultimately controls the node. */
    public Optional<String> rootOwnerOf(NodeId node) {
        return registry.holderOf(findRootToken(node));
    }

    public Map<ResourceKey, BigInteger> attachmentsOf(NodeId node) {
        return ledger.attachmentsOf(node);
    }

    public BigInteger totalAttached(ResourceKey resource) {
        return ledger.totalOf(resource);
    }

    /** The ledger must never book more of a resource than the custody address really holds. */
    public ErrorsOr<Boolean> auditConservation(ResourceKey resource) {
        BigInteger booked = ledger.totalOf(resource);
        BigInteger held = resource.kind() == ResourceKind.CURRENCY
                ? collaborators.fungibles().balanceOf(resource.contract(), config.custodyAddress())
                : collaborators.countedAssets().balanceOf(resource.contract(), config.custodyAddress(), resource.assetId());
        if (booked.compareTo(held) > 0)
            return ErrorsOr.error("Ledger books " + booked + " of " + resource + " but custody holds " + held);
        return ErrorsOr.lift(Boolean.TRUE);
    }

    public ErrorsOr<Boolean> auditForest() {
        return ForestValidation.validate(graph);
    }

    public boolean isQuarantined(NodeId node) {
        return quarantined.contains(node);
    }

    /** Lets mutations touch the node again after an operator has investigated a GRAPH_CORRUPTED. */
    public void releaseQuarantine(NodeId node) {
        if (quarantined.remove(node)) log.warn("Quarantine released for {}", node);
    }

    // ------------------------------------------------------------------------
    // Receiver callbacks
    // ------------------------------------------------------------------------

    @Override
    public int onNonFungibleReceived(String operator, String from, NodeId node, byte[] data) {
        return acceptIncoming(new Incoming(from, node, BigInteger.ONE)) ? NonFungibleReceiver.MAGIC : 0;
    }

    @Override
    public int onCountedAssetReceived(String operator, String from, String contract, BigInteger assetId,
                                      BigInteger amount, byte[] data) {
        Incoming incoming = new Incoming(from, ResourceKey.countedAsset(contract, assetId), amount);
        return acceptIncoming(incoming) ? CountedAssetReceiver.MAGIC : 0;
    }

    // The transfer this protocol is making is acknowledged once; anything else is unsolicited.
    private boolean acceptIncoming(Incoming incoming) {
        if (incoming.equals(expectedIncoming)) {
            expectedIncoming = null;
            return true;
        }
        if (config.acceptUnsolicited()) return true;
        log.warn("Rejected unsolicited transfer of {} {} from {}", incoming.amount(), incoming.asset(), incoming.from());
        return false;
    }

    // ------------------------------------------------------------------------
    // Non-fungible family
    // ------------------------------------------------------------------------

    private Staged linkNode(UndoLog undo, String actor, NonFungiblePayload payload, NodeId target, byte[] note) {
        NodeId source = payload.node();
        requireUsable(source, target);
        registry.requireExists(source);
        registry.requireExists(target);
        authorization.authorize(actor, Operation.LINK, payload, source);

        graph.link(source, target);
        undo.record("link " + source + " -> " + target, () -> graph.unlink(source));

        Custody custody = null;
        if (config.custodyPolicy() == CustodyPolicy.ESCROW) {
            String holder = registry.holderOf(source)
                    .orElseThrow(() -> new CompositionException(ErrorKind.NOT_FOUND, source + " does not exist", source));
            if (!holder.equals(config.custodyAddress()))
                custody = new Custody("escrow of " + source, new Incoming(holder, source, BigInteger.ONE),
                        () -> collaborators.nonFungibles().transfer(holder, config.custodyAddress(), source, note));
        }
        return new Staged((seq, at) -> new LinkedEvent(seq, at, actor, payload, target, note), custody);
    }

    private Staged updateNode(UndoLog undo, String actor, NonFungiblePayload payload, NodeId newTarget, byte[] note) {
        NodeId source = payload.node();
        requireUsable(source, newTarget);
        registry.requireExists(newTarget);
        authorization.authorize(actor, Operation.UPDATE_TARGET, payload, source);

        NodeId previous = graph.updateTarget(source, newTarget);
        undo.record("retarget " + source + " -> " + newTarget, () -> graph.updateTarget(source, previous));
        return Staged.withoutCustody((seq, at) -> new TargetUpdatedEvent(seq, at, actor, payload, previous, newTarget, note));
    }

    private Staged unlinkNode(UndoLog undo, String actor, String recipient, NonFungiblePayload payload, byte[] note) {
        NodeId source = payload.node();
        requireUsable(source);
        authorization.authorize(actor, Operation.UNLINK, payload, source);

        NodeId previous = graph.unlink(source);
        undo.record("unlink " + source + " -> " + previous, () -> graph.link(source, previous));

        Custody custody = null;
        if (config.custodyPolicy() == CustodyPolicy.ESCROW
                && registry.holderOf(source).filter(config.custodyAddress()::equals).isPresent())
            custody = new Custody("release of " + source + " to " + recipient, null,
                    () -> collaborators.nonFungibles().transfer(config.custodyAddress(), recipient, source, note));
        return new Staged((seq, at) -> new UnlinkedEvent(seq, at, actor, payload, previous, recipient, note), custody);
    }

    // ------------------------------------------------------------------------
    // Fungible and counted-asset families
    // ------------------------------------------------------------------------

    private Staged linkLeaf(UndoLog undo, String actor, LeafPayload payload, NodeId target, byte[] note) {
        if (payload.owner() != null)
            throw new IllegalArgumentException("a link deposits from the actor and must not name an owner node: " + payload);
        ResourceKey resource = payload.resource();
        BigInteger amount = payload.amount();
        requireUsable(target);
        requirePositive(amount, resource, target);
        registry.requireExists(target);
        authorization.authorize(actor, Operation.LINK, payload, target);

        ledger.deposit(resource, target, amount);
        undo.record("deposit " + amount + " of " + resource + " on " + target,
                () -> ledger.withdraw(resource, target, amount));

        Incoming expected = resource.kind() == ResourceKind.COUNTED_ASSET ? new Incoming(actor, resource, amount) : null;
        Custody custody = new Custody("deposit of " + amount + " " + resource + " from " + actor, expected,
                () -> moveLeaf(resource, actor, config.custodyAddress(), amount, note));
        return new Staged((seq, at) -> new LinkedEvent(seq, at, actor, payload, target, note), custody);
    }

    private Staged updateLeaf(UndoLog undo, String actor, LeafPayload payload, NodeId newTarget, byte[] note) {
        NodeId owner = Objects.requireNonNull(payload.owner(), "updateTarget needs the owner node of the attachment");
        ResourceKey resource = payload.resource();
        requireUsable(owner, newTarget);
        if (owner.equals(newTarget))
            throw new CompositionException(ErrorKind.SELF_LINK, resource + " is already attached to " + owner, owner);
        requireAttached(resource, owner);
        registry.requireExists(newTarget);
        authorization.authorize(actor, Operation.UPDATE_TARGET, payload, owner);

        BigInteger moved = take(undo, resource, owner, payload.amount());
        ledger.deposit(resource, newTarget, moved);
        undo.record("deposit " + moved + " of " + resource + " on " + newTarget,
                () -> ledger.withdraw(resource, newTarget, moved));
        return Staged.withoutCustody((seq, at) -> new TargetUpdatedEvent(seq, at, actor,
                payload.settled(moved, owner), owner, newTarget, note));
    }

    private Staged unlinkLeaf(UndoLog undo, String actor, String recipient, LeafPayload payload, byte[] note) {
        NodeId owner = Objects.requireNonNull(payload.owner(), "unlink needs the owner node of the attachment");
        ResourceKey resource = payload.resource();
        requireUsable(owner);
        requireAttached(resource, owner);
        authorization.authorize(actor, Operation.UNLINK, payload, owner);

        BigInteger moved = take(undo, resource, owner, payload.amount());
        Custody custody = new Custody("release of " + moved + " " + resource + " to " + recipient, null,
                () -> moveLeaf(resource, config.custodyAddress(), recipient, moved, note));
        return new Staged((seq, at) -> new UnlinkedEvent(seq, at, actor,
                payload.settled(moved, owner), owner, recipient, note), custody);
    }

    // null amount takes the whole balance
    private BigInteger take(UndoLog undo, ResourceKey resource, NodeId owner, BigInteger amount) {
        BigInteger moved;
        if (amount == null) {
            moved = ledger.withdrawAll(resource, owner);
        } else {
            ledger.withdraw(resource, owner, amount);
            moved = amount;
        }
        undo.record("withdraw " + moved + " of " + resource + " from " + owner,
                () -> ledger.deposit(resource, owner, moved));
        return moved;
    }

    private void moveLeaf(ResourceKey resource, String from, String to, BigInteger amount, byte[] note) {
        if (resource.kind() == ResourceKind.CURRENCY)
            collaborators.fungibles().transfer(resource.contract(), from, to, amount);
        else
            collaborators.countedAssets().transfer(resource.contract(), from, to, resource.assetId(), amount, note);
    }

    // ------------------------------------------------------------------------
    // Plumbing
    // ------------------------------------------------------------------------

    private CompositionEvent execute(Family family, Operation operation, Function<UndoLog, Staged> body) {
        String metric = "composable." + family.metricName() + "." + operation.metricName();
        UndoLog undo = new UndoLog();
        try {
            Staged staged = body.apply(undo);
            CompositionEvent event = staged.event().create(sequence + 1, time.currentTimeMillis());
            events.append(event);
            undo.record("event #" + event.sequence(), () -> events.retract(event));
            if (staged.custody() != null) transferCustody(staged.custody());
            sequence = event.sequence();
            metrics.increment(metric + ".success");
            log.info("{} #{} by {}: {}", metric, event.sequence(), event.actor(), event.payload());
            return event;
        } catch (RuntimeException e) {
            if (undo.size() > 0) {
                log.warn("{} failed after {} mutation(s); rolling back", metric, undo.size());
                undo.rollback(e);
            }
            if (e instanceof CompositionException ce) {
                if (ce.kind() == ErrorKind.GRAPH_CORRUPTED) quarantine(ce.nodes());
                metrics.increment(metric + ".failure." + ce.kind());
                log.warn("{} refused: {}", metric, ce.getMessage());
            } else {
                metrics.increment(metric + ".failure.other");
            }
            throw e;
        }
    }

    private void transferCustody(Custody custody) {
        expectedIncoming = custody.expected();
        try {
            custody.transfer().run();
        } catch (RuntimeException e) {
            throw new CompositionException(ErrorKind.CUSTODY_TRANSFER_FAILED,
                    custody.description() + " failed: " + e.getMessage(), List.of(), e);
        } finally {
            expectedIncoming = null;
        }
    }

    private void requireUsable(NodeId... nodes) {
        for (NodeId node : nodes) {
            if (quarantined.contains(node))
                throw new CompositionException(ErrorKind.GRAPH_CORRUPTED,
                        node + " is quarantined after a failed root resolution", node);
        }
    }

    private void requireAttached(ResourceKey resource, NodeId owner) {
        if (ledger.balanceOf(resource, owner).signum() == 0)
            throw new CompositionException(ErrorKind.NOT_FOUND, "no " + resource + " attached to " + owner, owner);
    }

    private static void requirePositive(BigInteger amount, ResourceKey resource, NodeId target) {
        if (amount == null || amount.signum() <= 0)
            throw new CompositionException(ErrorKind.INVALID_AMOUNT,
                    "amount of " + resource + " for " + target + " must be positive, was " + amount, target);
    }

    private void quarantine(Collection<NodeId> nodes) {
        if (quarantined.addAll(nodes))
            log.error("Quarantined {} after graph corruption; mutations on them are halted", nodes);
    }

    private static byte[] copy(byte[] annotation) {
        return annotation == null ? new byte[0] : annotation.clone();
    }

    private static String describe(Exception e) {
        return e instanceof CompositionException ? e.getMessage() : e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    @FunctionalInterface
    private interface EventFactory {
        CompositionEvent create(long sequence, long timestamp);
    }

    /** What an operation body leaves to {@link #execute}: its event, and the custody move if there is one. */
    private record Staged(EventFactory event, Custody custody) {
        static Staged withoutCustody(EventFactory event) {
            return new Staged(event, null);
        }
    }

    /** A call on an asset collaborator, and the receipt callback it makes on this protocol, if any. */
    private record Custody(String description, Incoming expected, Runnable transfer) {
    }

    /** One receipt callback: sender, node or counted asset, and amount. */
    private record Incoming(String from, Object asset, BigInteger amount) {
        Incoming {
            from = from == null ? null : from.toLowerCase(Locale.ROOT);
        }
    }
}
