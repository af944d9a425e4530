package com.viffx.Lalr.Parser;

import com.viffx.Lalr.Parser.ParseResult.AbortReason;
import com.viffx.Lalr.Stack.ParseStack;
import com.viffx.Lalr.Symbols.Location;
import com.viffx.Lalr.Symbols.Token;
import com.viffx.Lalr.Symbols.Tokens;
import com.viffx.Lalr.Tables.Action;
import com.viffx.Lalr.Tables.ActionType;
import com.viffx.Lalr.Tables.ParseTables;
import org.jetbrains.annotations.Nullable;

/**
 * Brings the parser back to a state from which it can go on after a syntax error.
 * <p>
 * The stack is unwound until its top state accepts the error token, the error token is
 * shifted in front of the offending lookahead, and parsing resumes. Until
 * {@link ParseTables#requiredTokens()} ordinary tokens have been shifted, further errors are
 * absorbed without being reported. An error right after the error token was shifted
 * discards the offending lookahead, so each retry consumes input.
 */
final class ErrorRecovery {
    private final LalrParser parser;
    private final ParseTables tables;
    private final ParseStack stack;
    private final RuntimeState runtime;
    private final Trace trace;

    ErrorRecovery(LalrParser parser, ParseTables tables, ParseStack stack, RuntimeState runtime, Trace trace) {
        this.parser = parser;
        this.tables = tables;
        this.stack = stack;
        this.runtime = runtime;
        this.trace = trace;
    }

    /**
     * Handles a syntax error detected in the current state.
     *
     * @return {@code null} if parsing can continue, otherwise why it has to stop
     */
    @Nullable AbortReason recover() {
        if (runtime.stalled()) {
            // nothing was shifted since the last attempt: drop the token it failed on
            Token offending = runtime.lookahead.consume();
            if (offending == null || offending.isEndOfInput()) {
                runtime.recovery = RecoveryState.ABORTED;
                trace.println("Aborted: end of input while recovering");
                return AbortReason.INPUT_EXHAUSTED;
            }
            trace.discard(offending.id());
        }

        if (runtime.absorbing()) {
            trace.println("Error absorbed while recovering");
        } else {
            runtime.errors++;
            parser.onSyntaxError();
        }
        runtime.recovery = RecoveryState.ERRORING;

        // pop until the top state can shift the error token
        while (!tables.state(stack.top()).type().errorItem()) {
            if (stack.depth() == 1) {
                runtime.recovery = RecoveryState.ABORTED;
                trace.println("Aborted: no state on the stack accepts the error token");
                return AbortReason.RECOVERY_EXHAUSTED;
            }
            stack.pop();
            trace.stack(stack);
        }

        shiftErrorToken();
        return null;
    }

    private void shiftErrorToken() {
        Lookahead lookahead = runtime.lookahead;
        Token offending = lookahead.current();
        Location location = offending == null ? stack.locationAt(0) : offending.location();

        // the error token goes in front of the offending one, which stays saved
        lookahead.pushBack(Token.of(Tokens.ERROR, location));
        Action action = tables.lookup(stack.top(), lookahead.id());
        if (action.type() != ActionType.SHIFT) {
            throw new IllegalStateException("State " + stack.top() + " is marked as an error state but does " + action + " on the error token");
        }

        Token error = lookahead.consume();
        stack.push(action.data(), error.value(), error.location());
        lookahead.restore();
        trace.shift(Tokens.ERROR, action.data());

        runtime.accepted = 0;
        runtime.recovery = RecoveryState.RECOVERING;
    }
}
