package com.viffx.Lalr.Tables;

import com.viffx.Lalr.Symbols.Location;
import com.viffx.Lalr.Values.SemanticValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * What a {@link SemanticAction} can see and request while its production is reduced.
 * <p>
 * For a rule {@code A > X1 X2 X3}, the value of {@code X3} is at offset 0 and the value of
 * {@code X1} at offset -2. {@link #rhs(int)} addresses the same values by their 1-based
 * position in the rule.
 * <p>
 * The requests ({@link #accept()}, {@link #abort()}, {@link #error()}) take effect after the
 * action returns.
 */
public interface ActionContext {
    /**
     * Returns the number of the rule being reduced.
     */
    int rule();

    Production production();

    /**
     * Returns the value at {@code offset} from the top of the stack.
     *
     * @throws IndexOutOfBoundsException if the offset reaches past either end of the stack
     */
    @NotNull SemanticValue valueAt(int offset);

    /**
     * Returns the value of the {@code position}-th right hand side symbol, counted from 1.
     *
     * @throws IndexOutOfBoundsException if {@code position} is not in {@code 1..length}
     */
    @NotNull SemanticValue rhs(int position);

    @Nullable Location locationAt(int offset);

    @Nullable Location rhsLocation(int position);

    /**
     * Returns the container that becomes the left hand side's value.
     */
    @NotNull SemanticValue result();

    /**
     * Returns the location the left hand side will get. Defaults to the span of the right
     * hand side.
     */
    @Nullable Location resultLocation();

    void setResultLocation(@Nullable Location location);

    /**
     * Returns the id of the lookahead token, {@link com.viffx.Lalr.Symbols.Tokens#UNDETERMINED}
     * if none has been read.
     */
    int lookahead();

    int errorCount();

    /**
     * Ends the parse successfully once the action returns.
     */
    void accept();

    /**
     * Ends the parse as aborted once the action returns.
     */
    void abort();

    /**
     * Starts error recovery once the action returns, as if a syntax error had been found.
     */
    void error();

    /**
     * Discards the current lookahead token so the next one is read from the input.
     */
    void clearLookahead();

    /**
     * Leaves error recovery mode immediately, so the next error is reported again.
     */
    void endRecovery();
}
