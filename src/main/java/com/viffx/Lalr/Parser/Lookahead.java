package com.viffx.Lalr.Parser;

import com.viffx.Lalr.Symbols.Token;
import com.viffx.Lalr.Symbols.Tokens;
import org.jetbrains.annotations.Nullable;

/**
 * The current lookahead token plus one saved (pushed back) token.
 * <p>
 * A {@code null} slot is the undetermined token. At most one token can be saved at a time.
 */
final class Lookahead {
    private Token current = null;
    private Token saved = null;

    void reset() {
        current = null;
        saved = null;
    }

    boolean determined() {
        return current != null;
    }

    int id() {
        return current == null ? Tokens.UNDETERMINED : current.id();
    }

    /**
     * Returns the id of the token that will be looked at next: the current one, else the
     * saved one.
     */
    int pendingId() {
        if (current != null) return current.id();
        return saved == null ? Tokens.UNDETERMINED : saved.id();
    }

    @Nullable Token current() {
        return current;
    }

    void set(Token token) {
        current = token;
    }

    /**
     * Returns the current token and leaves the slot undetermined.
     */
    @Nullable Token consume() {
        Token token = current;
        current = null;
        return token;
    }

    /**
     * Makes {@code token} the current token and keeps the previous one in the saved slot.
     *
     * @throws IllegalStateException if a token is already saved
     */
    void pushBack(Token token) {
        if (saved != null) throw new IllegalStateException("A token is already pushed back: " + saved);
        saved = current;
        current = token;
    }

    /**
     * Moves the current token, if any, to the saved slot.
     */
    void save() {
        if (current == null) return;
        pushBack(null);
    }

    /**
     * Makes the saved token current again, if there is one.
     *
     * @return {@code true} if a saved token was restored
     */
    boolean restore() {
        if (saved == null) return false;
        if (current != null) throw new IllegalStateException("Cannot restore " + saved + " over " + current);
        current = saved;
        saved = null;
        return true;
    }

    void dropSaved() {
        saved = null;
    }

    @Override
    public String toString() {
        return "Lookahead{current=" + current + ", saved=" + saved + '}';
    }
}
