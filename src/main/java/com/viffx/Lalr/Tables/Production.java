package com.viffx.Lalr.Tables;

import org.jetbrains.annotations.Nullable;

/**
 * A grammar rule as the parser sees it: the nonterminal it produces, how many symbols its
 * right hand side has and the action run when it is reduced.
 *
 * @param lhs    the nonterminal id of the left hand side
 * @param length the number of right hand side symbols
 * @param action the semantic action, or {@code null} for the default {@code $$ = $1}
 */
public record Production(int lhs, int length, @Nullable SemanticAction action) {
    public Production {
        if (length < 0) throw new IllegalArgumentException("A production cannot have " + length + " symbols");
    }

    public boolean isEmpty() {
        return length == 0;
    }
}
