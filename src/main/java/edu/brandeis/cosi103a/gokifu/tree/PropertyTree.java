package edu.brandeis.cosi103a.gokifu.tree;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.brandeis.cosi103a.gokifu.board.Coordinates;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A game tree stored as an arena of nodes addressed by integer handles.
 *
 * <p>Each node holds an ordered map from property key to an ordered, non-empty list of
 * values, plus the handles of its children in creation order. Children are always created
 * fresh under an existing node, so the tree cannot contain cycles. Parent links exist only
 * while the tree is being built; {@link #seal()} discards them and forbids new nodes, after
 * which only property values may still change.
 */
public final class PropertyTree {

    private static final int NO_PARENT = -1;

    private final List<Slot> slots = new ArrayList<>();
    private boolean sealed;

    private static final class Slot {
        final Map<String, List<String>> properties = new LinkedHashMap<>();
        final List<Integer> children = new ArrayList<>();
        int parent;

        Slot(int parent) {
            this.parent = parent;
        }
    }

    public PropertyTree() {
        slots.add(new Slot(NO_PARENT));
    }

    /**
     * Handle of the root node.
     */
    public int root() {
        return 0;
    }

    /**
     * Appends a new, empty child to {@code parent}.
     *
     * @return the new node's handle
     * @throws IllegalStateException if the tree has been sealed
     */
    public int addChild(int parent) {
        if (sealed) {
            throw new IllegalStateException("Tree is sealed");
        }
        Slot parentSlot = slot(parent);
        int handle = slots.size();
        slots.add(new Slot(parent));
        parentSlot.children.add(handle);
        return handle;
    }

    /**
     * Parent of a node while the tree is under construction; empty for the root.
     *
     * @throws IllegalStateException if the tree has been sealed
     */
    public OptionalInt parent(int node) {
        if (sealed) {
            throw new IllegalStateException("Parent links are discarded once the tree is sealed");
        }
        int parent = slot(node).parent;
        return parent == NO_PARENT ? OptionalInt.empty() : OptionalInt.of(parent);
    }

    /**
     * Ends construction: drops parent links and rejects further {@link #addChild(int)} calls.
     */
    public PropertyTree seal() {
        sealed = true;
        for (Slot s : slots) {
            s.parent = NO_PARENT;
        }
        return this;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Replaces all values of {@code key} with the single given value.
     * The value is stored as-is; callers pass position codes or numbers, or already escaped text.
     */
    public void setValue(int node, String key, String value) {
        List<String> values = new ArrayList<>(1);
        values.add(value);
        slot(node).properties.put(key, values);
    }

    /**
     * Appends a value to {@code key} unless the key already holds an equal value.
     */
    public void addValue(int node, String key, String value) {
        List<String> values = slot(node).properties.computeIfAbsent(key, k -> new ArrayList<>());
        if (!values.contains(value)) {
            values.add(value);
        }
    }

    /**
     * Escapes free text and stores it as the single value of {@code key}.
     * An empty value removes the key instead.
     */
    public void commitText(int node, String key, String text) {
        String escaped = Coordinates.escapeValue(text);
        if (escaped.isEmpty()) {
            slot(node).properties.remove(key);
        } else {
            setValue(node, key, escaped);
        }
    }

    public boolean has(int node, String key) {
        return slot(node).properties.containsKey(key);
    }

    public Optional<String> firstValue(int node, String key) {
        List<String> values = slot(node).properties.get(key);
        return values == null ? Optional.empty() : Optional.of(values.get(0));
    }

    public ImmutableList<String> values(int node, String key) {
        List<String> values = slot(node).properties.get(key);
        return values == null ? ImmutableList.of() : ImmutableList.copyOf(values);
    }

    /**
     * Snapshot of a node's properties in insertion order.
     */
    public ImmutableMap<String, ImmutableList<String>> properties(int node) {
        ImmutableMap.Builder<String, ImmutableList<String>> builder = ImmutableMap.builder();
        for (Map.Entry<String, List<String>> e : slot(node).properties.entrySet()) {
            builder.put(e.getKey(), ImmutableList.copyOf(e.getValue()));
        }
        return builder.build();
    }

    public ImmutableList<Integer> children(int node) {
        return ImmutableList.copyOf(slot(node).children);
    }

    public int childCount(int node) {
        return slot(node).children.size();
    }

    /**
     * Total number of nodes, root included.
     */
    public int size() {
        return slots.size();
    }

    /**
     * Number of nodes below the root along the first-child line.
     */
    public int mainLineLength() {
        int count = 0;
        int node = root();
        while (childCount(node) > 0) {
            node = slot(node).children.get(0);
            count++;
        }
        return count;
    }

    private Slot slot(int node) {
        if (node < 0 || node >= slots.size()) {
            throw new IllegalArgumentException("No such node: " + node);
        }
        return slots.get(node);
    }
}
