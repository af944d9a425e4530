package com.viffx.Lalr.Tables;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The transitions of a single parser state together with its {@link StateType} and optional
 * default reduction.
 */
public final class StateTable {
    private final StateType type;
    private final Transition[] transitions;
    private final int defaultReduction;

    private StateTable(StateType type, Transition[] transitions, int defaultReduction) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.transitions = transitions.clone();
        for (Transition transition : this.transitions) {
            Objects.requireNonNull(transition, "transitions cannot contain null");
        }
        this.defaultReduction = defaultReduction;
    }

    /**
     * Creates a state without a default reduction.
     */
    @Contract("_, _ -> new")
    public static @NotNull StateTable of(@NotNull StateType type, Transition @NotNull ... transitions) {
        return new StateTable(type, transitions, 0);
    }

    /**
     * Creates a state that reduces by {@code rule} whenever none of its transitions match.
     */
    @Contract("_, _, _ -> new")
    public static @NotNull StateTable withDefault(@NotNull StateType type, int rule, Transition @NotNull ... transitions) {
        if (rule <= 0) throw new IllegalArgumentException("Default reductions need a rule number >= 1, got " + rule);
        return new StateTable(type, transitions, rule);
    }

    public StateType type() {
        return type;
    }

    public List<Transition> transitions() {
        return List.of(transitions);
    }

    public int size() {
        return transitions.length;
    }

    public Transition transition(int index) {
        return transitions[index];
    }

    /**
     * Returns the rule reduced by default, or 0 if the state has none.
     */
    public int defaultReduction() {
        return defaultReduction;
    }

    /**
     * Returns the index of the entry for {@code token}, or -1. Entries are scanned in the
     * order they were declared.
     */
    public int find(int token) {
        for (int i = 0; i < transitions.length; i++) {
            if (transitions[i].token() == token) return i;
        }
        return -1;
    }

    @Override
    public String toString() {
        return "StateTable{" +
                "type=" + type +
                ", transitions=" + Arrays.toString(transitions) +
                (defaultReduction == 0 ? "" : ", default=" + defaultReduction) +
                '}';
    }
}
