package com.viffx.Lalr.Symbols;

import java.io.IOException;

/**
 * Supplies tokens to a parser, one per call, in input order.
 * <p>
 * Once the input is exhausted the source returns a token whose id is
 * {@link Tokens#END_OF_INPUT} (any id {@code <= 0} is treated the same way) and keeps
 * returning it if asked again.
 */
@FunctionalInterface
public interface TokenSource {
    Token nextToken() throws IOException;
}
