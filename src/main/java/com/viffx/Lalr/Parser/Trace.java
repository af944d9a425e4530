package com.viffx.Lalr.Parser;

import com.viffx.Lalr.Stack.ParseStack;
import com.viffx.Lalr.Tables.ParseTables;

import java.io.PrintStream;

/**
 * Per-parser debug output. Every method is a no-op while no stream is set.
 */
final class Trace {
    private final ParseTables tables;
    private PrintStream out = null;

    Trace(ParseTables tables) {
        this.tables = tables;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    void println(String line) {
        if (out != null) out.println(line);
    }

    void reading(int token) {
        if (out == null) return;
        out.println("Reading: " + tables.symbolName(token));
    }

    void shift(int token, int state) {
        if (out == null) return;
        out.println("Shift: " + tables.symbolName(token) + " -> state " + state);
    }

    void reduce(int rule, int lhs, int length, int state) {
        if (out == null) return;
        out.println("Reduce: " + tables.symbolName(lhs) + " <- " + length + " symbols (rule " + rule + "), goto " + state);
    }

    void stack(ParseStack stack) {
        if (out == null) return;
        out.println(stack);
    }

    void discard(int token) {
        if (out == null) return;
        out.println("Discard: " + tables.symbolName(token));
    }
}
