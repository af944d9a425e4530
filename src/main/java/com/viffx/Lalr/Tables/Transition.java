package com.viffx.Lalr.Tables;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * One entry of a state's transition table: the action taken when {@code token} is the
 * lookahead (or, for a nonterminal id, the goto taken after a reduction).
 *
 * @param token  the terminal or nonterminal id the entry matches
 * @param action the encoded action, see {@link Action}
 */
public record Transition(int token, int action) {

    @Contract("_, _ -> new")
    public static @NotNull Transition shift(int token, int state) {
        return new Transition(token, Action.shift(state).encode());
    }

    /**
     * Alias of {@link #shift(int, int)} that reads better for nonterminal entries.
     */
    @Contract("_, _ -> new")
    public static @NotNull Transition goTo(int nonTerminal, int state) {
        return shift(nonTerminal, state);
    }

    @Contract("_, _ -> new")
    public static @NotNull Transition reduce(int token, int rule) {
        return new Transition(token, Action.reduce(rule).encode());
    }

    @Contract("_ -> new")
    public static @NotNull Transition accept(int token) {
        return new Transition(token, 0);
    }
}
