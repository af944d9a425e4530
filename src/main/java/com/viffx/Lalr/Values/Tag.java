package com.viffx.Lalr.Values;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.function.UnaryOperator;

/**
 * Runtime type identifier of a {@link SemanticValue} payload.
 * <p>
 * Tags are only created through {@link Tags#declare(String, Class, UnaryOperator)}, so every
 * tag belongs to exactly one grammar's closed set of payload types. Two tags are equal only
 * when they are the same object.
 *
 * @param <T> the static type of the payload the tag stands for
 */
public final class Tag<T> {
    /**
     * The sentinel tag of an empty container.
     */
    public static final Tag<Void> EMPTY = new Tag<>("EMPTY", 0, Void.class, value -> value);

    private final String name;
    private final int ordinal;
    private final Class<T> type;
    private final UnaryOperator<T> cloner;

    Tag(String name, int ordinal, Class<T> type, UnaryOperator<T> cloner) {
        this.name = name;
        this.ordinal = ordinal;
        this.type = type;
        this.cloner = cloner;
    }

    public String name() {
        return name;
    }

    /**
     * Returns the position of this tag in its declaring {@link Tags} set. {@link #EMPTY} is 0.
     */
    public int ordinal() {
        return ordinal;
    }

    public Class<T> type() {
        return type;
    }

    /**
     * Casts {@code payload} to this tag's type.
     *
     * @throws TypeMismatchException if the payload is not an instance of {@link #type()}
     */
    T cast(Object payload) {
        if (payload != null && !type.isInstance(payload)) {
            throw new TypeMismatchException(this, payload.getClass());
        }
        return type.cast(payload);
    }

    /**
     * Produces an independent copy of {@code payload} using the clone function the tag was
     * declared with.
     */
    @Contract("null -> null")
    T deepCopy(T payload) {
        if (payload == null) return null;
        return cast(cloner.apply(payload));
    }

    @Override
    public @NotNull String toString() {
        return "Tag(" + name + ")";
    }
}
