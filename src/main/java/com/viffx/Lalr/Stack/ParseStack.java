package com.viffx.Lalr.Stack;

import com.viffx.Lalr.Symbols.Location;
import com.viffx.Lalr.Values.SemanticValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * The parser's state stack with its parallel semantic value and location stacks.
 * <p>
 * The three stacks always have the same depth and move together. The bottom entry (state 0)
 * is never popped, so the depth is at least 1.
 * <p>
 * Offsets used by {@link #stateAt(int)}, {@link #valueAt(int)} and {@link #locationAt(int)}
 * are relative to the top: 0 is the top entry, {@code -1} the one below it, and so on.
 */
public final class ParseStack {
    // ====== CONSTANTS ====== //
    /**
     * Number of entries added to the backing arrays each time they fill up.
     */
    public static final int EXPANSION = 16;

    // ====== INSTANCE FIELDS ====== //
    private int[] states = new int[EXPANSION];
    private SemanticValue[] values = new SemanticValue[EXPANSION];
    private Location[] locations = new Location[EXPANSION];

    /**
     * Index of the top entry.
     */
    private int top = -1;

    // ====== CONSTRUCTORS ====== //
    public ParseStack() {
        reset();
    }

    // ====== PUBLIC API ====== //

    /**
     * Drops every entry, clearing its value, and pushes state 0 with an empty value.
     */
    public void reset() {
        if (top >= 0) {
            for (int i = 0; i <= top; i++) {
                values[i].clear();
            }
            Arrays.fill(values, 0, top + 1, null);
            Arrays.fill(locations, 0, top + 1, null);
        }
        top = -1;
        push(0, new SemanticValue(), null);
    }

    /**
     * Pushes a new top entry. The content of {@code value} is moved into the stack, leaving
     * {@code value} empty.
     */
    public void push(int state, @NotNull SemanticValue value) {
        push(state, value, null);
    }

    /**
     * Pushes a new top entry. The content of {@code value} is moved into the stack, leaving
     * {@code value} empty.
     */
    public void push(int state, @NotNull SemanticValue value, @Nullable Location location) {
        if (top + 1 == states.length) grow();
        top++;

        SemanticValue slot = new SemanticValue();
        slot.moveFrom(value);

        states[top] = state;
        values[top] = slot;
        locations[top] = location;
    }

    public void pop() {
        pop(1);
    }

    /**
     * Removes {@code count} entries from the top and releases their values.
     *
     * @throws IllegalArgumentException if {@code count} is negative
     * @throws IllegalStateException    if fewer than one entry would remain
     */
    public void pop(int count) {
        if (count < 0) throw new IllegalArgumentException("Cannot pop " + count + " entries");
        if (count > top) {
            throw new IllegalStateException("Cannot pop " + count + " entries from a stack of depth " + depth());
        }
        if (count == 0) return;

        for (int i = top - count + 1; i <= top; i++) {
            values[i].clear();
        }
        Arrays.fill(values, top - count + 1, top + 1, null);
        Arrays.fill(locations, top - count + 1, top + 1, null);
        top -= count;
    }

    /**
     * Returns the state on top of the stack.
     */
    public int top() {
        return states[top];
    }

    public int depth() {
        return top + 1;
    }

    public int stateAt(int offset) {
        return states[index(offset)];
    }

    /**
     * Returns the value container at {@code offset}. The container stays owned by the stack;
     * callers may read it, assign it or move out of it.
     */
    public @NotNull SemanticValue valueAt(int offset) {
        return values[index(offset)];
    }

    public @Nullable Location locationAt(int offset) {
        return locations[index(offset)];
    }

    // ====== DEBUG INFO ====== //
    /**
     * Returns the length of the backing arrays.
     */
    public int capacity() {
        return states.length;
    }

    /**
     * Returns {@code true} if every slot above the top has been released.
     */
    public boolean releasedAboveTop() {
        for (int i = top + 1; i < values.length; i++) {
            if (values[i] != null || locations[i] != null) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("Stack now");
        for (int i = 0; i <= top; i++) {
            builder.append(' ').append(states[i]);
        }
        return builder.toString();
    }

    // ====== HELPERS ====== //
    private int index(int offset) {
        int index = top + offset;
        if (offset > 0 || index < 0) {
            throw new IndexOutOfBoundsException(
                    String.format("Index %d out of bounds for length %d",
                            offset,
                            depth()
                    )
            );
        }
        return index;
    }

    // existing containers are carried over, not cloned
    private void grow() {
        int capacity = states.length + EXPANSION;
        states = Arrays.copyOf(states, capacity);
        values = Arrays.copyOf(values, capacity);
        locations = Arrays.copyOf(locations, capacity);
    }
}
