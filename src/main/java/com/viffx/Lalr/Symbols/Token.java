package com.viffx.Lalr.Symbols;

import com.viffx.Lalr.Values.SemanticValue;
import com.viffx.Lalr.Values.Tag;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A token delivered by a {@link TokenSource}: its id, its semantic value and, optionally,
 * where it was found.
 * <p>
 * The value container is handed over to the parser with the token; a scanner must not keep
 * using it after returning the token.
 */
public record Token(int id, @NotNull SemanticValue value, @Nullable Location location) {
    public Token {
        Objects.requireNonNull(value, "value cannot be null, use an empty SemanticValue");
    }

    @Contract("_ -> new")
    public static @NotNull Token of(int id) {
        return new Token(id, new SemanticValue(), null);
    }

    @Contract("_, _ -> new")
    public static @NotNull Token of(int id, @Nullable Location location) {
        return new Token(id, new SemanticValue(), location);
    }

    @Contract("_, _, _, _ -> new")
    public static <T> @NotNull Token of(int id, @NotNull Tag<T> tag, T payload, @Nullable Location location) {
        return new Token(id, SemanticValue.of(tag, payload), location);
    }

    @Contract("-> new")
    public static @NotNull Token endOfInput() {
        return of(Tokens.END_OF_INPUT);
    }

    public boolean isEndOfInput() {
        return id == Tokens.END_OF_INPUT;
    }

    @Override
    public String toString() {
        return "Token{" +
                "id=" + Tokens.describe(id) +
                (value.isEmpty() ? "" : ", value=" + value) +
                (location == null ? "" : ", at=" + location) +
                '}';
    }
}
