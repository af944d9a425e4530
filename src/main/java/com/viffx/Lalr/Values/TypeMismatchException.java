package com.viffx.Lalr.Values;

/**
 * Thrown when a {@link SemanticValue} is read through a tag other than the one its payload
 * was assigned with. This is always a programming error in a semantic action.
 */
public class TypeMismatchException extends IllegalStateException {
    private final transient Tag<?> expected;
    private final transient Object actual;

    public TypeMismatchException(Tag<?> expected, Tag<?> actual) {
        super("Expected a value tagged " + expected.name() + " but found " + actual.name());
        this.expected = expected;
        this.actual = actual;
    }

    public TypeMismatchException(Tag<?> expected, Class<?> actual) {
        super("Tag " + expected.name() + " holds " + expected.type().getName() + ", not " + actual.getName());
        this.expected = expected;
        this.actual = actual;
    }

    public Tag<?> expected() {
        return expected;
    }

    /**
     * Returns the stored {@link Tag} or, for a payload of the wrong class, that {@link Class}.
     */
    public Object actual() {
        return actual;
    }
}
