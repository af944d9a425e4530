package com.viffx.Lalr.Parser;

import com.viffx.Lalr.Stack.ParseStack;
import com.viffx.Lalr.Symbols.Location;
import com.viffx.Lalr.Tables.ActionContext;
import com.viffx.Lalr.Tables.ParseTables;
import com.viffx.Lalr.Tables.Production;
import com.viffx.Lalr.Tables.SemanticAction;
import com.viffx.Lalr.Values.SemanticValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Runs the semantic action of a rule that is about to be reduced.
 * <p>
 * The action sees the right hand side values still on the stack and writes the left hand
 * side value into {@link #result()}. The stack itself is not changed here; popping the
 * right hand side and pushing the result is left to the driver.
 */
final class ActionDispatcher {
    /**
     * What the driver should do once the action has run.
     */
    enum Request {
        CONTINUE,
        ACCEPT,
        ABORT,
        ERROR
    }

    private final LalrParser parser;
    private final ParseTables tables;
    private final ParseStack stack;
    private final RuntimeState runtime;
    private final Reduction reduction = new Reduction();

    ActionDispatcher(LalrParser parser, ParseTables tables, ParseStack stack, RuntimeState runtime) {
        this.parser = parser;
        this.tables = tables;
        this.stack = stack;
        this.runtime = runtime;
    }

    /**
     * Executes the action of {@code rule}.
     * <p>
     * A lookahead token that has been read but not shifted is pushed back first, so it is
     * still there after the reduction. Exceptions thrown by the action go to
     * {@link LalrParser#onException(Exception)}; if that returns, the reduction goes on with
     * whatever result was set.
     *
     * @throws Exception whatever the exception handler re-throws
     */
    Request execute(int rule) throws Exception {
        Production production = tables.production(rule);
        if (production.length() > stack.depth() - 1) {
            throw new IllegalStateException("Rule " + rule + " needs " + production.length() + " symbols but the stack holds " + (stack.depth() - 1));
        }

        runtime.lookahead.save();
        reduction.begin(rule, production);

        SemanticAction action = production.action();
        if (action == null) {
            // $$ = $1
            if (!production.isEmpty()) reduction.result.moveFrom(reduction.rhs(1));
            return Request.CONTINUE;
        }

        try {
            action.execute(reduction);
        } catch (Exception e) {
            parser.onException(e);
        }
        return reduction.request;
    }

    /**
     * Returns the value produced by the last executed action. The driver moves it onto the stack.
     */
    @NotNull SemanticValue result() {
        return reduction.result;
    }

    @Nullable Location resultLocation() {
        return reduction.resultLocation;
    }

    private final class Reduction implements ActionContext {
        private int rule;
        private Production production;
        private final SemanticValue result = new SemanticValue();
        private Location resultLocation;
        private Request request = Request.CONTINUE;

        void begin(int rule, Production production) {
            this.rule = rule;
            this.production = production;
            this.request = Request.CONTINUE;
            result.clear();
            resultLocation = production.isEmpty()
                    ? stack.locationAt(0)
                    : Location.span(rhsLocation(1), rhsLocation(production.length()));
        }

        @Override
        public int rule() {
            return rule;
        }

        @Override
        public Production production() {
            return production;
        }

        @Override
        public @NotNull SemanticValue valueAt(int offset) {
            return stack.valueAt(offset);
        }

        @Override
        public @NotNull SemanticValue rhs(int position) {
            return stack.valueAt(offset(position));
        }

        @Override
        public @Nullable Location locationAt(int offset) {
            return stack.locationAt(offset);
        }

        @Override
        public @Nullable Location rhsLocation(int position) {
            return stack.locationAt(offset(position));
        }

        @Override
        public @NotNull SemanticValue result() {
            return result;
        }

        @Override
        public @Nullable Location resultLocation() {
            return resultLocation;
        }

        @Override
        public void setResultLocation(@Nullable Location location) {
            resultLocation = location;
        }

        @Override
        public int lookahead() {
            // the unshifted token sits in the saved slot while the action runs
            return runtime.lookahead.pendingId();
        }

        @Override
        public int errorCount() {
            return runtime.errors;
        }

        @Override
        public void accept() {
            request = Request.ACCEPT;
        }

        @Override
        public void abort() {
            request = Request.ABORT;
        }

        @Override
        public void error() {
            request = Request.ERROR;
        }

        @Override
        public void clearLookahead() {
            runtime.lookahead.dropSaved();
        }

        @Override
        public void endRecovery() {
            runtime.recovery = RecoveryState.NORMAL;
            runtime.accepted = runtime.required;
        }

        private int offset(int position) {
            int length = production.length();
            if (position < 1 || position > length) {
                throw new IndexOutOfBoundsException(
                        String.format("Index %d out of bounds for length %d",
                                position,
                                length
                        )
                );
            }
            return position - length;
        }
    }
}
