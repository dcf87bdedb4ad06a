package io.fieldtree.core.tree;

import java.util.*;

/**
 * Precomputed decode/encode table for one object position of a canonical tree.
 * <p>
 * A shape is either:
 *  - flat: an ordered slot list plus a responseKey -> index map, or
 *  - polymorphic: a closed set of flat variants keyed by concrete type name, plus an
 *    optional catch-all variant. The discriminator picks a variant once; the variant is
 *    then used as a flat shape.
 * <p>
 * Built once by the tree compiler and never mutated, so any number of threads may
 * read it concurrently.
 */
public final class ObjectShape {

    private final String typeName;
    private final List<FieldSlot> slots;
    private final Map<String, Integer> index;
    private final boolean polymorphic;
    private final Map<String, ObjectShape> variants;
    private final ObjectShape catchAll;

    private ObjectShape(String typeName, List<FieldSlot> slots, boolean polymorphic,
                        Map<String, ObjectShape> variants, ObjectShape catchAll) {
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.slots = List.copyOf(slots);
        this.polymorphic = polymorphic;
        this.variants = Collections.unmodifiableMap(new LinkedHashMap<>(variants));
        this.catchAll = catchAll;

        Map<String, Integer> idx = new HashMap<>(slots.size() * 2);
        for (int i = 0; i < this.slots.size(); i++) {
            FieldSlot s = this.slots.get(i);
            if (s.index() != i) throw new IllegalArgumentException("slot " + s.responseKey() + " out of order");
            if (idx.put(s.responseKey(), i) != null) {
                throw new IllegalArgumentException("duplicate response key " + s.responseKey());
            }
        }
        this.index = Map.copyOf(idx);
    }

    static ObjectShape flat(String typeName, List<FieldSlot> slots) {
        return new ObjectShape(typeName, slots, false, Map.of(), null);
    }

    static ObjectShape polymorphic(String typeName, List<FieldSlot> baseSlots,
                                   Map<String, ObjectShape> variants, ObjectShape catchAll) {
        return new ObjectShape(typeName, baseSlots, true, variants, catchAll);
    }

    /** Declared type for a polymorphic shape, concrete type for a variant. */
    public String typeName() { return typeName; }

    /**
     * Slots in canonical order. For a polymorphic shape these are the fields shared by
     * every variant; decode and encode always go through {@link #resolve(String)} first.
     */
    public List<FieldSlot> slots() { return slots; }

    public int size() { return slots.size(); }

    public FieldSlot slot(int i) { return slots.get(i); }

    /** Slot index for a response key, or -1. */
    public int indexOf(String responseKey) {
        Integer i = index.get(responseKey);
        return i == null ? -1 : i;
    }

    /** Slot for a response key, or null. */
    public FieldSlot slot(String responseKey) {
        int i = indexOf(responseKey);
        return i < 0 ? null : slots.get(i);
    }

    public boolean isPolymorphic() { return polymorphic; }

    public Map<String, ObjectShape> variants() { return variants; }

    public Optional<ObjectShape> catchAll() { return Optional.ofNullable(catchAll); }

    /**
     * Flat shape to use for a value whose runtime type is {@code typename}:
     * this shape when not polymorphic, else the exact variant, else the catch-all.
     *
     * @return null when the type is unhandled
     */
    public ObjectShape resolve(String typename) {
        if (!polymorphic) return this;
        ObjectShape v = typename == null ? null : variants.get(typename);
        return v != null ? v : catchAll;
    }

    @Override
    public String toString() {
        return polymorphic
                ? typeName + variants.keySet() + (catchAll != null ? "+catchAll" : "")
                : typeName + index.keySet();
    }
}
