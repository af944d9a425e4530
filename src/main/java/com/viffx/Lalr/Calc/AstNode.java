package com.viffx.Lalr.Calc;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A node of an expression tree. Leaves are numbers, inner nodes are operators; a node
 * standing for input the parser recovered from is an {@link Kind#ERROR} leaf.
 */
public final class AstNode {
    public enum Kind {
        NUMBER,
        ADD,
        MULTIPLY,
        ERROR
    }

    private final Kind kind;
    private final long value;
    private final List<AstNode> children = new ArrayList<>();

    private AstNode(Kind kind, long value) {
        this.kind = kind;
        this.value = value;
    }

    @Contract("_ -> new")
    public static @NotNull AstNode number(long value) {
        return new AstNode(Kind.NUMBER, value);
    }

    @Contract("-> new")
    public static @NotNull AstNode error() {
        return new AstNode(Kind.ERROR, 0);
    }

    @Contract("_, _, _ -> new")
    public static @NotNull AstNode binary(@NotNull Kind kind, @NotNull AstNode left, @NotNull AstNode right) {
        if (kind != Kind.ADD && kind != Kind.MULTIPLY) throw new IllegalArgumentException(kind + " is not a binary operator");
        AstNode node = new AstNode(kind, 0);
        node.add(Objects.requireNonNull(left, "left cannot be null"));
        node.add(Objects.requireNonNull(right, "right cannot be null"));
        return node;
    }

    public Kind kind() {
        return kind;
    }

    public long value() {
        return value;
    }

    public List<AstNode> children() {
        return children;
    }

    public void add(AstNode child) {
        children.add(child);
    }

    /**
     * Returns a copy of this tree that shares no nodes with it.
     */
    public AstNode copy() {
        AstNode copy = new AstNode(kind, value);
        for (AstNode child : children) {
            copy.add(child.copy());
        }
        return copy;
    }

    /**
     * Computes the value of the expression.
     *
     * @throws IllegalStateException if the tree contains an {@link Kind#ERROR} node
     */
    public long evaluate() {
        return switch (kind) {
            case NUMBER -> value;
            case ADD -> children.get(0).evaluate() + children.get(1).evaluate();
            case MULTIPLY -> children.get(0).evaluate() * children.get(1).evaluate();
            case ERROR -> throw new IllegalStateException("Cannot evaluate an expression that contains errors");
        };
    }

    public boolean containsErrors() {
        if (kind == Kind.ERROR) return true;
        for (AstNode child : children) {
            if (child.containsErrors()) return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AstNode that = (AstNode) o;
        return kind == that.kind && value == that.value && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, children);
    }

    /**
     * Renders the tree fully parenthesized, e.g. {@code (1 + (2 * 3))}.
     */
    @Override
    public String toString() {
        return switch (kind) {
            case NUMBER -> Long.toString(value);
            case ERROR -> "<error>";
            case ADD -> "(" + children.get(0) + " + " + children.get(1) + ")";
            case MULTIPLY -> "(" + children.get(0) + " * " + children.get(1) + ")";
        };
    }
}
