package com.viffx.Lalr.Utils;

import com.viffx.Lalr.Symbols.Location;
import org.jetbrains.annotations.NotNull;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.function.IntPredicate;

/**
 * Character source for hand written scanners: the current character, one character of
 * lookahead, and the line and column of the current character.
 * <p>
 * The end of the input is reached once the current character is {@code -1}. Subclasses can
 * observe every advance through {@link #onNextChar()}.
 */
public class LexicalCharacterBuffer {
    private static final int EOF = -1;

    // ====== INSTANCE FIELDS ====== //
    private final BufferedReader reader;

    private int current;
    private int lookahead;

    // 1-based position of the current character
    private int line = 1;
    private int column = 1;

    // ====== CONSTRUCTORS ====== //
    /**
     * @throws IOException if the first two characters cannot be read
     */
    public LexicalCharacterBuffer(@NotNull Reader source) throws IOException {
        reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        current = reader.read();
        lookahead = reader.read();
    }

    // ====== PUBLIC API METHODS ====== //
    public final boolean eof() {
        return current == EOF;
    }

    /**
     * Returns the current character. Meaningless once {@link #eof()} is {@code true}.
     */
    public final char crntChar() {
        return (char) current;
    }

    /**
     * Returns the character after the current one without consuming anything.
     */
    public final char peekChar() {
        return (char) lookahead;
    }

    public final int line() {
        return line;
    }

    public final int column() {
        return column;
    }

    /**
     * Returns the position of the current character as a single-character {@link Location}.
     */
    public final @NotNull Location location() {
        return Location.at(line, column);
    }

    /**
     * Consumes the current character and returns the one that takes its place.
     *
     * @throws IOException if the input is already exhausted or cannot be read
     */
    public final char nextChar() throws IOException {
        if (eof()) throw new IOException("Reached the end of the input at " + line + ":" + column);
        onNextChar();

        if (current == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        current = lookahead;
        lookahead = reader.read();
        return crntChar();
    }

    /**
     * Consumes characters as long as they match {@code predicate}.
     *
     * @return the number of characters consumed
     */
    public final int skipWhile(@NotNull IntPredicate predicate) throws IOException {
        int skipped = 0;
        while (!eof() && predicate.test(current)) {
            nextChar();
            skipped++;
        }
        return skipped;
    }

    // ====== API HOOKS ====== //
    /**
     * Runs right before each advance, while the consumed character is still current.
     */
    public void onNextChar() {}

    // ====== DEBUG INFO ====== //
    /**
     * Renders the current and the lookahead character, e.g. {@code ['a','\n']}.
     */
    public String buffer() {
        return "['" + render(current) + "','" + render(lookahead) + "']";
    }

    private static String render(int c) {
        return switch (c) {
            case EOF -> "EOF";
            case '\t' -> "\\t";
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\b' -> "\\b";
            case '\f' -> "\\f";
            default -> String.valueOf((char) c);
        };
    }
}
