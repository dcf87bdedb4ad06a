package io.fieldtree.incremental;

import com.fasterxml.jackson.databind.JsonNode;
import io.fieldtree.codec.DecodeListener;
import io.fieldtree.codec.ResponseDecoder;
import io.fieldtree.codec.Variables;
import io.fieldtree.core.ErrorKind;
import io.fieldtree.core.ResponsePath;
import io.fieldtree.core.model.Deferral;
import io.fieldtree.core.model.Field;
import io.fieldtree.core.tree.CanonicalTree;
import io.fieldtree.core.tree.FieldSlot;
import io.fieldtree.core.tree.ObjectShape;

import java.util.*;
import java.util.logging.Logger;

/**
 * Owns the result of one in-flight operation and grafts deferred pieces into it as
 * patches arrive.
 * <p>
 * Lifecycle:
 *  - {@link #start} decodes the base payload (deferred fields absent) and indexes every
 *    object in a {@link ResultArena}; each deferred field still missing becomes a pending
 *    delivery keyed by (label, path);
 *  - {@link #apply} resolves the patch path, decodes the data against the shape the
 *    deferred fields were compiled into and grafts it; objects inside the graft are indexed
 *    and their own deferred fields join the pending set;
 *  - the merger is COMPLETE once a final patch arrives with nothing left pending.
 * <p>
 * Notes:
 *  - a patch is decoded in full before anything is grafted, so a failing patch leaves the
 *    result and the pending set untouched;
 *  - not thread-safe: patches of one operation must be applied one at a time, in arrival order;
 *  - cancelling means no longer calling {@link #apply}; {@link #currentResult()} stays valid.
 */
public final class IncrementalDeliveryMerger {
    private static final Logger log = Logger.getLogger(IncrementalDeliveryMerger.class.getName());

    public enum State { PENDING, COMPLETE }

    /** Deferred fields of one object that arrive together. */
    private record Pending(DeliveryKey key, int objectIndex, Deferral deferral, List<FieldSlot> slots) {}

    /** Object reported by the decoder, registered in the arena once its patch commits. */
    private record Decoded(ResponsePath path, ObjectShape shape, Map<String, Object> value) {}

    private record Graft(ResultArena.Entry target, Map<String, Object> values) {}

    private final ResponseDecoder decoder;
    private final CanonicalTree tree;
    private final Variables variables;
    private final Map<String, Object> root;
    private final ResultArena arena = new ResultArena();
    private final Map<DeliveryKey, Pending> pending = new LinkedHashMap<>();

    private State state = State.PENDING;
    private int applied;

    private IncrementalDeliveryMerger(ResponseDecoder decoder, CanonicalTree tree, Variables variables,
                                      Map<String, Object> root) {
        this.decoder = decoder;
        this.tree = tree;
        this.variables = variables;
        this.root = root;
    }

    /**
     * Decode the base payload and open the delivery.
     *
     * @throws io.fieldtree.codec.CodecException if the base payload does not decode
     */
    public static IncrementalDeliveryMerger start(
            ResponseDecoder decoder,
            CanonicalTree tree,
            JsonNode basePayload,
            Variables variables
    ) {
        Objects.requireNonNull(decoder, "decoder");
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(variables, "variables");

        List<Decoded> objects = new ArrayList<>();
        Map<String, Object> root = decoder.decode(tree, basePayload, variables,
                (path, shape, value) -> objects.add(new Decoded(path, shape, value)));

        var merger = new IncrementalDeliveryMerger(decoder, tree, variables, root);
        merger.register(objects);
        if (merger.pending.isEmpty()) merger.state = State.COMPLETE;

        log.fine(() -> "started delivery of " + tree.name() + ": " + merger.arena.size() + " objects, "
                + merger.pending.size() + " pending " + merger.pending.keySet());
        return merger;
    }

    /**
     * Graft one patch.
     *
     * @throws PatchException UNRESOLVABLE_PATCH_PATH when nothing exists at the path,
     *                        DUPLICATE_PATCH when nothing is pending there under the label,
     *                        INCOMPLETE_DELIVERY when a final patch leaves deliveries pending
     *                        (the patch itself is grafted)
     * @throws io.fieldtree.codec.CodecException when the data does not decode; nothing is grafted
     */
    public void apply(IncrementalPatch patch) {
        Objects.requireNonNull(patch, "patch");
        ResponsePath path = patch.path();

        if (!resolvable(path)) {
            log.warning(() -> "rejected patch for " + tree.name() + ": nothing at " + path);
            throw new PatchException(ErrorKind.UNRESOLVABLE_PATCH_PATH, path, "no object or field at this path");
        }
        List<Pending> matched = match(patch);
        if (matched.isEmpty()) {
            log.warning(() -> "rejected patch for " + tree.name() + ": nothing pending at " + path
                    + " under " + label(patch.label()));
            throw new PatchException(ErrorKind.DUPLICATE_PATCH, path,
                    "no pending delivery " + label(patch.label()) + " here: already delivered or never deferred");
        }

        List<Decoded> nested = new ArrayList<>();
        DecodeListener buffer = (p, shape, value) -> nested.add(new Decoded(p, shape, value));
        List<Graft> grafts = new ArrayList<>(matched.size());
        for (Pending pd : matched) {
            grafts.add(decode(pd, patch, buffer));
        }

        for (Graft g : grafts) {
            g.target().value().putAll(g.values());
            reorder(g.target());
        }
        for (Pending pd : matched) {
            pending.remove(pd.key());
        }
        register(nested);
        applied++;
        log.fine(() -> "grafted " + matched.size() + " delivery(ies) at " + path + " for " + tree.name()
                + ", " + pending.size() + " pending");

        if (patch.isFinal()) {
            if (!pending.isEmpty()) {
                log.warning(() -> "final patch for " + tree.name() + " left " + pending.keySet() + " pending");
                throw new PatchException(ErrorKind.INCOMPLETE_DELIVERY, path,
                        "stream ended with " + pending.size() + " pending delivery(ies): " + pending.keySet());
            }
            state = State.COMPLETE;
            log.info(() -> "delivery of " + tree.name() + " complete after " + applied + " patch(es)");
        }
    }

    public State state() { return state; }

    public boolean isComplete() { return state == State.COMPLETE; }

    /** Live view of the result; deferred fields not delivered yet are absent. */
    public Map<String, Object> currentResult() {
        return Collections.unmodifiableMap(root);
    }

    /** Labels still awaited (unlabeled deferrals are not listed). */
    public Set<String> pendingLabels() {
        Set<String> out = new LinkedHashSet<>();
        for (DeliveryKey k : pending.keySet()) {
            if (k.label() != null) out.add(k.label());
        }
        return out;
    }

    public Set<DeliveryKey> pendingDeliveries() {
        return Set.copyOf(pending.keySet());
    }

    public CanonicalTree tree() { return tree; }

    // ---------- helpers ----------

    private void register(List<Decoded> objects) {
        for (Decoded d : objects) {
            discover(arena.add(d.path(), d.shape(), d.value()));
        }
    }

    /**
     * Adds a pending delivery for every included deferred field the object is still missing.
     * A deferral whose {@code if} is false was read with the base payload and is skipped.
     */
    private void discover(ResultArena.Entry entry) {
        Map<DeliveryKey, List<FieldSlot>> fragmentLevel = new LinkedHashMap<>();
        Map<DeliveryKey, Deferral> deferrals = new HashMap<>();

        for (FieldSlot slot : entry.shape().slots()) {
            Field f = slot.field();
            if (!f.isDeferred() || entry.value().containsKey(slot.responseKey())) continue;
            ResponsePath fieldPath = entry.path().append(slot.responseKey());
            if (!ResponseDecoder.isDeferred(f, variables, fieldPath)
                    || !ResponseDecoder.isIncluded(f, variables, fieldPath)) continue;

            Deferral d = f.deferral();
            if (d.isFieldLevel()) {
                var key = new DeliveryKey(d.label(), fieldPath);
                pending.put(key, new Pending(key, entry.index(), d, List.of(slot)));
            } else {
                var key = new DeliveryKey(d.label(), entry.path());
                fragmentLevel.computeIfAbsent(key, k -> new ArrayList<>()).add(slot);
                deferrals.put(key, d);
            }
        }
        for (var e : fragmentLevel.entrySet()) {
            pending.put(e.getKey(), new Pending(e.getKey(), entry.index(), deferrals.get(e.getKey()), e.getValue()));
        }
    }

    /**
     * Deliveries a patch carries: the one keyed exactly by its label and path, plus field-level
     * deferrals of the addressed object whose key is present in the data.
     */
    private List<Pending> match(IncrementalPatch patch) {
        List<Pending> out = new ArrayList<>();
        Pending exact = pending.get(new DeliveryKey(patch.label(), patch.path()));
        if (exact != null) out.add(exact);

        if (patch.data().isObject()) {
            for (Pending pd : pending.values()) {
                if (pd == exact || !pd.deferral().isFieldLevel()) continue;
                DeliveryKey k = pd.key();
                if (Objects.equals(k.label(), patch.label())
                        && k.path().parent().equals(patch.path())
                        && patch.data().has((String) k.path().last())) {
                    out.add(pd);
                }
            }
        }
        return out;
    }

    private Graft decode(Pending pd, IncrementalPatch patch, DecodeListener buffer) {
        ResultArena.Entry target = arena.get(pd.objectIndex());
        if (pd.deferral().isFieldLevel()) {
            FieldSlot slot = pd.slots().get(0);
            JsonNode data = patch.path().equals(pd.key().path())
                    ? patch.data()
                    : patch.data().get(slot.responseKey());
            Object value = decoder.decodeValue(slot, data, variables, pd.key().path(), buffer);
            Map<String, Object> values = new HashMap<>();
            values.put(slot.responseKey(), value);
            return new Graft(target, values);
        }
        Deferral d = pd.deferral();
        Map<String, Object> values = decoder.decodeSelected(target.shape(), patch.data(),
                f -> d.equals(f.deferral()), variables, target.path(), buffer);
        return new Graft(target, values);
    }

    /** An object registered at the path, or a slot of one. */
    private boolean resolvable(ResponsePath path) {
        if (arena.at(path).isPresent()) return true;
        if (!(path.last() instanceof String key)) return false;
        return arena.at(path.parent())
                .map(parent -> parent.shape().indexOf(key) >= 0)
                .orElse(false);
    }

    /** Restores canonical key order after late keys were appended. */
    private static void reorder(ResultArena.Entry entry) {
        Map<String, Object> value = entry.value();
        Map<String, Object> copy = new LinkedHashMap<>(value);
        value.clear();
        for (FieldSlot slot : entry.shape().slots()) {
            if (copy.containsKey(slot.responseKey())) {
                value.put(slot.responseKey(), copy.get(slot.responseKey()));
            }
        }
    }

    private static String label(String label) {
        return label == null ? "<unlabeled>" : "\"" + label + "\"";
    }
}
