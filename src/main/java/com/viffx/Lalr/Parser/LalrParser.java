package com.viffx.Lalr.Parser;

import com.viffx.Lalr.Parser.ParseResult.AbortReason;
import com.viffx.Lalr.Stack.ParseStack;
import com.viffx.Lalr.Symbols.Token;
import com.viffx.Lalr.Symbols.TokenSource;
import com.viffx.Lalr.Symbols.Tokens;
import com.viffx.Lalr.Tables.Action;
import com.viffx.Lalr.Tables.ActionType;
import com.viffx.Lalr.Tables.ParseTables;
import com.viffx.Lalr.Tables.Production;
import com.viffx.Lalr.Tables.StateTable;
import com.viffx.Lalr.Values.SemanticValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;

/**
 * Table driven LALR(1) parser.
 * <p>
 * The parser repeatedly looks up the action for its current state and lookahead token in
 * its {@link ParseTables}, then shifts, reduces, accepts or starts error recovery. Parsers
 * for a particular grammar either use this class directly or extend it to override the
 * callbacks {@link #onSyntaxError()}, {@link #onException(Exception)} and
 * {@link #onTokenConsumed(Token)}.
 * <p>
 * An instance can run any number of parses one after the other, but it is not thread safe
 * and must never be driven by two parses at the same time. Calling {@link #parse()} from
 * inside one of its own semantic actions throws {@link IllegalStateException}.
 */
public class LalrParser {
    // ====== INSTANCE FIELDS ====== //
    private final ParseTables tables;
    private final TokenSource source;

    private final ParseStack stack = new ParseStack();
    private final RuntimeState runtime = new RuntimeState();
    private final Trace trace;
    private final ActionDispatcher dispatcher;
    private final ErrorRecovery recovery;

    private final SemanticValue value = new SemanticValue();

    // ====== CONSTRUCTORS ====== //
    public LalrParser(@NotNull ParseTables tables, @NotNull TokenSource source) {
        this.tables = Objects.requireNonNull(tables, "tables cannot be null");
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.trace = new Trace(tables);
        this.dispatcher = new ActionDispatcher(this, tables, stack, runtime);
        this.recovery = new ErrorRecovery(this, tables, stack, runtime, trace);
    }

    // ====== PUBLIC API ====== //

    /**
     * Parses the input supplied by the token source.
     * <p>
     * The stack and all counters are reset first. When the input is accepted, the value of
     * the start symbol is available from {@link #value()}.
     *
     * @return {@link ParseResult.Accepted}, {@link ParseResult.SyntaxErrors} with the number of
     * errors recovered from, or {@link ParseResult.Aborted}
     * @throws IOException if the token source fails
     * @throws Exception   anything a semantic action threw and {@link #onException(Exception)} re-threw
     */
    public ParseResult parse() throws Exception {
        if (runtime.running) throw new IllegalStateException("This parser is already running a parse");
        runtime.running = true;
        runtime.reset(tables.requiredTokens());
        stack.reset();
        value.clear();
        trace.println("Starting parse");

        try {
            return run();
        } finally {
            // releases every value still on the stack, whichever way the parse ended
            stack.reset();
            runtime.lookahead.reset();
            runtime.running = false;
        }
    }

    /**
     * Returns the value of the start symbol of the last accepted parse. Empty if the last
     * parse was aborted.
     */
    public @NotNull SemanticValue value() {
        return value;
    }

    public int errorCount() {
        return runtime.errors;
    }

    public RecoveryState recoveryState() {
        return runtime.recovery;
    }

    public ParseTables tables() {
        return tables;
    }

    /**
     * Sends a trace of every step to {@code out}, or turns tracing off for {@code null}.
     */
    public void setTrace(@Nullable PrintStream out) {
        trace.setOut(out);
    }

    // ====== CALLBACKS ====== //

    /**
     * Called once for every reported syntax error, before recovery starts. Errors absorbed
     * during recovery are not reported. The default writes a line to the trace stream.
     */
    protected void onSyntaxError() {
        trace.println("Syntax error in state " + stack.top() + " on " + tables.symbolName(lookaheadId()));
    }

    /**
     * Called with any exception thrown by a semantic action. The default re-throws it, which
     * ends the parse. If this method returns normally, the reduction goes on.
     */
    protected void onException(Exception exception) throws Exception {
        throw exception;
    }

    /**
     * Called when a token from the input is shifted, before its value moves onto the stack.
     */
    protected void onTokenConsumed(Token token) {}

    // ====== STATE ACCESS FOR SUBCLASSES ====== //

    /**
     * Returns the id of the lookahead token, {@link Tokens#UNDETERMINED} if none has been read.
     */
    protected final int lookaheadId() {
        return runtime.lookahead.pendingId();
    }

    protected final @Nullable Token lookahead() {
        return runtime.lookahead.current();
    }

    protected final ParseStack stack() {
        return stack;
    }

    // ====== DRIVER ====== //
    private ParseResult run() throws Exception {
        while (true) {
            int state = stack.top();
            StateTable table = tables.state(state);
            if (table.type().requiresToken() || !table.type().hasDefaultReduction()) fetchToken();

            Action action = tables.lookup(state, runtime.lookahead.id());
            switch (action.type()) {
                case SHIFT -> shift(action.data());
                case REDUCE -> {
                    ParseResult result = reduce(action.data());
                    if (result != null) return result;
                }
                case ACCEPT -> {
                    return accept();
                }
                case ERROR -> {
                    AbortReason reason = syntaxError();
                    if (reason != null) return abort(reason);
                }
                case GOTO -> throw new IllegalStateException(
                        "The token source returned nonterminal id " + tables.symbolName(runtime.lookahead.id()));
            }
        }
    }

    private void fetchToken() throws IOException {
        Lookahead lookahead = runtime.lookahead;
        if (lookahead.determined() || lookahead.restore()) return;

        Token token = source.nextToken();
        if (token == null) throw new IOException("The token source returned null");
        if (token.id() == Tokens.ERROR) throw new IllegalStateException("The token source returned the reserved error token");
        int id = Tokens.normalize(token.id());
        if (id != token.id()) token = new Token(id, token.value(), token.location());

        lookahead.set(token);
        trace.reading(id);
    }

    private void shift(int target) {
        Token token = runtime.lookahead.consume();
        if (token == null) throw new IllegalStateException("Shift to state " + target + " without a lookahead token");

        onTokenConsumed(token);
        stack.push(target, token.value(), token.location());
        runtime.tokenShifted();
        trace.shift(token.id(), target);
    }

    /**
     * @return {@code null} to go on parsing, otherwise the final result
     */
    private ParseResult reduce(int rule) throws Exception {
        Production production = tables.production(rule);
        ActionDispatcher.Request request = dispatcher.execute(rule);

        stack.pop(production.length());
        if (request == ActionDispatcher.Request.ERROR) {
            runtime.lookahead.restore();
            AbortReason reason = syntaxError();
            return reason == null ? null : abort(reason);
        }
        if (request == ActionDispatcher.Request.ABORT) {
            return abort(AbortReason.ABORT_REQUESTED);
        }

        int from = stack.top();
        Action next = tables.lookup(from, production.lhs());
        if (next.type() != ActionType.GOTO) {
            throw new IllegalStateException("State " + from + " has no goto for " + tables.symbolName(production.lhs()) + " (rule " + rule + ")");
        }
        stack.push(next.data(), dispatcher.result(), dispatcher.resultLocation());
        runtime.lookahead.restore();
        trace.reduce(rule, production.lhs(), production.length(), next.data());
        trace.stack(stack);

        return request == ActionDispatcher.Request.ACCEPT ? accept() : null;
    }

    private AbortReason syntaxError() throws IOException {
        // a retry right after the error token needs the token it will have to discard
        if (runtime.stalled()) fetchToken();
        return recovery.recover();
    }

    private ParseResult accept() {
        value.moveFrom(stack.valueAt(0));
        trace.println("ACCEPTED");
        return ParseResult.of(runtime.errors);
    }

    private ParseResult abort(AbortReason reason) {
        runtime.recovery = RecoveryState.ABORTED;
        trace.println("ABORTED: " + reason);
        return new ParseResult.Aborted(reason, runtime.errors);
    }
}
