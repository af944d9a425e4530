package com.viffx.Lalr.Tables;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Represents a parsing action in an LR parsing table.
 * <p>
 * An action consists of a type and an integer value whose meaning depends on the type:
 * <ul>
 *   <li>For {@link ActionType#SHIFT},  {@code data} is the target state to shift to.</li>
 *   <li>For {@link ActionType#GOTO},   {@code data} is the target state to transition to after a reduction.</li>
 *   <li>For {@link ActionType#REDUCE}, {@code data} is the rule number to reduce by.</li>
 *   <li>For {@link ActionType#ACCEPT} and {@link ActionType#ERROR}, {@code data} is unused (zero).</li>
 * </ul>
 * In a table an action is stored as a single int: negative values reduce by rule
 * {@code -value}, zero accepts and positive values shift to state {@code value}.
 *
 * @param type the kind of action to be performed
 * @param data an integer value whose interpretation depends on {@code type}
 */
public record Action(ActionType type, int data) {
    public static final Action ACCEPT = new Action(ActionType.ACCEPT, 0);
    public static final Action NONE = new Action(ActionType.ERROR, 0);

    @Contract("_ -> new")
    public static @NotNull Action shift(int state) {
        if (state <= 0) throw new IllegalArgumentException("Shift targets must be positive: " + state);
        return new Action(ActionType.SHIFT, state);
    }

    @Contract("_ -> new")
    public static @NotNull Action reduce(int rule) {
        if (rule <= 0) throw new IllegalArgumentException("Rules are numbered from 1: " + rule);
        return new Action(ActionType.REDUCE, rule);
    }

    /**
     * Decodes a table value. Shifts on nonterminals are returned as {@link ActionType#GOTO}
     * when {@code nonTerminal} is set.
     */
    public static @NotNull Action decode(int encoded, boolean nonTerminal) {
        if (encoded == 0) return ACCEPT;
        if (encoded < 0) return reduce(-encoded);
        return nonTerminal ? new Action(ActionType.GOTO, encoded) : shift(encoded);
    }

    /**
     * Returns the table encoding of this action.
     */
    public int encode() {
        return switch (type) {
            case SHIFT, GOTO -> data;
            case REDUCE -> -data;
            case ACCEPT -> 0;
            case ERROR -> throw new IllegalStateException("NONE has no table encoding");
        };
    }

    public boolean isError() {
        return type == ActionType.ERROR;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SHIFT -> "shift " + data;
            case GOTO -> "goto " + data;
            case REDUCE -> "reduce " + data;
            case ACCEPT -> "accept";
            case ERROR -> "error";
        };
    }
}
