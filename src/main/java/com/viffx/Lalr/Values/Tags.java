package com.viffx.Lalr.Values;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * The closed set of payload types a grammar declares for its semantic values.
 * <p>
 * A grammar declares every payload type once, then {@link #seal() seals} the set. After
 * sealing, no further tags can be declared:
 * <pre>
 *   Tags tags = new Tags();
 *   Tag&lt;Long&gt; NUMBER = tags.immutable("NUMBER", Long.class);
 *   Tag&lt;AstNode&gt; NODE = tags.declare("NODE", AstNode.class, AstNode::copy);
 *   tags.seal();
 * </pre>
 */
public final class Tags {
    private final List<Tag<?>> tags = new ArrayList<>();
    private boolean sealed = false;

    public Tags() {
        tags.add(Tag.EMPTY);
    }

    /**
     * Declares a payload type whose values are copied with {@code cloner}.
     *
     * @param name   a name used in diagnostics
     * @param type   the payload class
     * @param cloner returns an independent deep copy of a payload
     * @return the new tag
     * @throws IllegalStateException    if the set is already sealed
     * @throws IllegalArgumentException if {@code name} is already declared
     */
    public <T> Tag<T> declare(@NotNull String name, @NotNull Class<T> type, @NotNull UnaryOperator<T> cloner) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(cloner, "cloner cannot be null");
        if (sealed) throw new IllegalStateException("Cannot declare " + name + ": the tag set is sealed");
        for (Tag<?> tag : tags) {
            if (tag.name().equals(name)) throw new IllegalArgumentException("Tag " + name + " is already declared");
        }

        Tag<T> tag = new Tag<>(name, tags.size(), type, cloner);
        tags.add(tag);
        return tag;
    }

    /**
     * Declares a payload type whose values are immutable and may be shared by copies.
     */
    public <T> Tag<T> immutable(@NotNull String name, @NotNull Class<T> type) {
        return declare(name, type, UnaryOperator.identity());
    }

    public Tags seal() {
        sealed = true;
        return this;
    }

    public boolean sealed() {
        return sealed;
    }

    public boolean contains(Tag<?> tag) {
        return tag != null && tag.ordinal() < tags.size() && tags.get(tag.ordinal()) == tag;
    }

    public Tag<?> get(int ordinal) {
        return tags.get(ordinal);
    }

    /**
     * Returns the number of declared tags, {@link Tag#EMPTY} included.
     */
    public int size() {
        return tags.size();
    }

    public List<Tag<?>> asList() {
        return Collections.unmodifiableList(tags);
    }

    @Override
    public String toString() {
        return tags.toString();
    }
}
