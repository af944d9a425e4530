package com.viffx.Lalr.Parser;

/**
 * How a call to {@link LalrParser#parse()} ended.
 * <ul>
 *   <li>{@link Accepted} - the input was parsed without errors, {@link #code()} is 0</li>
 *   <li>{@link SyntaxErrors} - the input was parsed after recovering from errors, {@link #code()}
 *       is the error count</li>
 *   <li>{@link Aborted} - parsing stopped early, {@link #code()} is {@link #ABORT}</li>
 * </ul>
 */
public sealed interface ParseResult permits ParseResult.Accepted, ParseResult.SyntaxErrors, ParseResult.Aborted {
    int ABORT = -1;

    int code();

    /**
     * Returns the number of syntax errors reported during the parse.
     */
    int errors();

    /**
     * Returns {@code true} unless the parse was aborted.
     */
    default boolean completed() {
        return !(this instanceof Aborted);
    }

    static ParseResult of(int errors) {
        return errors == 0 ? Accepted.INSTANCE : new SyntaxErrors(errors);
    }

    record Accepted() implements ParseResult {
        public static final Accepted INSTANCE = new Accepted();

        @Override
        public int code() {
            return 0;
        }

        @Override
        public int errors() {
            return 0;
        }
    }

    record SyntaxErrors(int count) implements ParseResult {
        public SyntaxErrors {
            if (count <= 0) throw new IllegalArgumentException("SyntaxErrors needs a positive count, got " + count);
        }

        @Override
        public int code() {
            return count;
        }

        @Override
        public int errors() {
            return count;
        }
    }

    record Aborted(AbortReason reason, int errors) implements ParseResult {
        @Override
        public int code() {
            return ABORT;
        }
    }

    enum AbortReason {
        /**
         * The stack was unwound to its bottom without finding a state that accepts the error token.
         */
        RECOVERY_EXHAUSTED,
        /**
         * The input ended while recovering, before any token could be shifted.
         */
        INPUT_EXHAUSTED,
        /**
         * A semantic action asked for the parse to stop.
         */
        ABORT_REQUESTED
    }
}
