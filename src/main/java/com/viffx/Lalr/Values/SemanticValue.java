package com.viffx.Lalr.Values;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A container holding at most one payload of a grammar-declared type, identified at runtime
 * by its {@link Tag}.
 * <p>
 * The container owns its payload. Ownership only changes hands through {@link #move()} and
 * {@link #moveFrom(SemanticValue)}, which leave the source empty, while {@link #copy()} and
 * {@link #copyFrom(SemanticValue)} produce an independent deep clone through the stored tag.
 * <p>
 * Reading a payload through a tag other than the stored one always throws
 * {@link TypeMismatchException}; there is no unchecked access path.
 * <p>
 * Instances are not thread safe.
 */
public final class SemanticValue {
    private Tag<?> tag = Tag.EMPTY;
    private Object payload = null;

    public SemanticValue() {}

    @Contract("_, _ -> new")
    public static <T> @NotNull SemanticValue of(@NotNull Tag<T> tag, T payload) {
        SemanticValue value = new SemanticValue();
        value.assign(tag, payload);
        return value;
    }

    // ====== ASSIGNMENT ====== //

    /**
     * Replaces the current content with {@code payload} tagged {@code tag}.
     *
     * @throws TypeMismatchException if {@code payload} is not an instance of the tag's type
     */
    public <T> void assign(@NotNull Tag<T> tag, T payload) {
        Objects.requireNonNull(tag, "tag cannot be null");
        // validate before touching the current content
        Object checked = tag.cast(payload);
        this.payload = checked;
        this.tag = tag;
    }

    /**
     * Builds a payload with {@code factory} and, only once it has been built, replaces the
     * current content with it. If the factory throws, this container is left unchanged.
     */
    public <T> void assign(@NotNull Tag<T> tag, @NotNull Supplier<? extends T> factory) {
        Objects.requireNonNull(factory, "factory cannot be null");
        T built = factory.get();
        assign(tag, built);
    }

    // ====== ACCESS ====== //

    /**
     * Returns the payload as the type of {@code tag}.
     *
     * @throws TypeMismatchException if the stored tag is not {@code tag}
     */
    public <T> T get(@NotNull Tag<T> tag) {
        if (this.tag != tag) throw new TypeMismatchException(tag, this.tag);
        return tag.type().cast(payload);
    }

    public Tag<?> tag() {
        return tag;
    }

    public boolean isEmpty() {
        return tag == Tag.EMPTY;
    }

    /**
     * Returns {@code true} if this container currently holds a payload tagged {@code tag}.
     */
    public boolean holds(Tag<?> tag) {
        return this.tag == tag;
    }

    // ====== COPY / MOVE ====== //

    /**
     * Returns a new container holding a deep clone of this container's payload.
     */
    @Contract("-> new")
    public @NotNull SemanticValue copy() {
        SemanticValue clone = new SemanticValue();
        clone.copyFrom(this);
        return clone;
    }

    /**
     * Replaces this container's content with a deep clone of {@code other}'s payload.
     * If cloning throws, this container is left unchanged.
     */
    public void copyFrom(@NotNull SemanticValue other) {
        if (other == this) return;
        copyTagged(other.tag, other.payload);
    }

    private <T> void copyTagged(Tag<T> source, Object sourcePayload) {
        T clone = source.deepCopy(source.cast(sourcePayload));
        this.payload = clone;
        this.tag = source;
    }

    /**
     * Transfers this container's payload to a new container and leaves this one empty.
     */
    @Contract("-> new")
    public @NotNull SemanticValue move() {
        SemanticValue target = new SemanticValue();
        target.moveFrom(this);
        return target;
    }

    /**
     * Takes over {@code other}'s payload and leaves {@code other} empty. No clone is made.
     */
    public void moveFrom(@NotNull SemanticValue other) {
        if (other == this) return;
        this.tag = other.tag;
        this.payload = other.payload;
        other.clear();
    }

    /**
     * Releases the payload. Clearing an empty container has no effect.
     */
    public void clear() {
        tag = Tag.EMPTY;
        payload = null;
    }

    @Override
    public String toString() {
        if (isEmpty()) return "SemanticValue{EMPTY}";
        return "SemanticValue{" + tag.name() + "=" + payload + '}';
    }
}
