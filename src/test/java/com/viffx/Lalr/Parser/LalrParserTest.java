package com.viffx.Lalr.Parser;

import com.viffx.Lalr.Parser.ParseResult.AbortReason;
import com.viffx.Lalr.Symbols.Location;
import com.viffx.Lalr.Symbols.Token;
import com.viffx.Lalr.Symbols.TokenSource;
import com.viffx.Lalr.Symbols.Tokens;
import com.viffx.Lalr.Tables.ParseTables;
import com.viffx.Lalr.Tables.SemanticAction;
import com.viffx.Lalr.Tables.StateType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LalrParserTest {
    /**
     * Logs shifted tokens and reported errors next to the reductions the actions log.
     */
    private static class RecordingParser extends LalrParser {
        final List<String> log;
        final List<Exception> handled = new ArrayList<>();
        boolean swallowExceptions = false;

        RecordingParser(ParseTables tables, TokenSource source, List<String> log) {
            super(tables, source);
            this.log = log;
        }

        @Override
        protected void onSyntaxError() {
            log.add("error in state " + stack().top() + " on " + tables().symbolName(lookaheadId()));
        }

        @Override
        protected void onException(Exception exception) throws Exception {
            handled.add(exception);
            if (!swallowExceptions) super.onException(exception);
        }

        @Override
        protected void onTokenConsumed(Token token) {
            log.add("shift " + tables().symbolName(token.id()));
        }
    }

    private final List<String> log = new ArrayList<>();
    private TokenQueue input;

    @BeforeEach
    public void setUp() {
        input = new TokenQueue();
    }

    private RecordingParser parser(ParseTables tables) {
        return new RecordingParser(tables, input, log);
    }

    // ====== SUCCESSFUL PARSES ====== //

    @Test
    public void testSumIsAccepted() throws Exception {
        RecordingParser parser = parser(Grammars.sums(log));
        input.number(1).symbol('+').number(2);

        ParseResult result = parser.parse();

        assertSame(ParseResult.Accepted.INSTANCE, result);
        assertEquals(0, result.code());
        assertTrue(result.completed());
        assertEquals(List.of(
                "shift NUMBER",
                "reduce E->NUMBER",
                "shift '+'",
                "shift NUMBER",
                "reduce E->NUMBER",
                "reduce E->E+E"
        ), log);
        assertEquals(3L, parser.value().get(Grammars.VALUE));
        assertEquals(RecoveryState.NORMAL, parser.recoveryState());
        assertEquals(0, parser.errorCount());
    }

    @Test
    public void testAdditionIsLeftAssociative() throws Exception {
        List<String> order = new ArrayList<>();
        SemanticAction add = context -> {
            long left = context.rhs(1).get(Grammars.VALUE);
            long right = context.rhs(3).get(Grammars.VALUE);
            order.add(left + "+" + right);
            context.result().assign(Grammars.VALUE, left + right);
        };
        RecordingParser parser = parser(Grammars.sums(add, Grammars.number(log), Grammars.error(log)));
        input.number(1).symbol('+').number(2).symbol('+').number(3);

        assertSame(ParseResult.Accepted.INSTANCE, parser.parse());
        assertEquals(List.of("1+2", "3+3"), order);
        assertEquals(6L, parser.value().get(Grammars.VALUE));
    }

    @Test
    public void testDefaultActionPassesFirstValue() throws Exception {
        LalrParser parser = new LalrParser(Grammars.single(), input);
        input.number(9);

        assertSame(ParseResult.Accepted.INSTANCE, parser.parse());
        assertEquals(9L, parser.value().get(Grammars.VALUE));
    }

    @Test
    public void testEmptyProduction() throws Exception {
        LalrParser parser = new LalrParser(Grammars.count(), input);
        assertSame(ParseResult.Accepted.INSTANCE, parser.parse());
        assertEquals(0L, parser.value().get(Grammars.VALUE));

        input.number(5).number(6).number(7);
        assertSame(ParseResult.Accepted.INSTANCE, parser.parse());
        assertEquals(3L, parser.value().get(Grammars.VALUE));
    }

    @Test
    public void testNonPositiveIdsEndTheInput() throws Exception {
        LalrParser parser = new LalrParser(Grammars.sums(log), input);
        input.number(4).add(Token.of(0)).number(5);

        assertSame(ParseResult.Accepted.INSTANCE, parser.parse());
        assertEquals(4L, parser.value().get(Grammars.VALUE));
        assertEquals(1, input.remaining());
    }

    @Test
    public void testNullTokenFails() {
        LalrParser parser = new LalrParser(Grammars.sums(log), () -> null);
        assertThrows(IOException.class, parser::parse);
    }

    @Test
    public void testSourceCannotDeliverTheErrorToken() throws Exception {
        LalrParser parser = new LalrParser(Grammars.sums(log), input);
        input.add(Token.of(Tokens.ERROR)).symbol('+').number(1);

        assertThrows(IllegalStateException.class, parser::parse);
        assertEquals(0, parser.errorCount());
        assertEquals(2, input.remaining());
    }

    @Test
    public void testConsumedTokensStillCarryTheirValue() throws Exception {
        List<Long> values = new ArrayList<>();
        LalrParser parser = new LalrParser(Grammars.sums(log), input) {
            @Override
            protected void onTokenConsumed(Token token) {
                if (token.id() == Grammars.NUMBER) values.add(token.value().get(Grammars.VALUE));
                else assertTrue(token.value().isEmpty());
            }
        };
        input.number(4).symbol('+').number(6);

        assertSame(ParseResult.Accepted.INSTANCE, parser.parse());
        assertEquals(List.of(4L, 6L), values);
        assertEquals(10L, parser.value().get(Grammars.VALUE));
    }

    @Test
    public void testSourceFailurePropagates() {
        LalrParser parser = new LalrParser(Grammars.sums(log), () -> {
            throw new IOException("disk on fire");
        });
        IOException e = assertThrows(IOException.class, parser::parse);
        assertEquals("disk on fire", e.getMessage());
    }

    @Test
    public void testLocationsSpanTheRightHandSide() throws Exception {
        List<Location> spans = new ArrayList<>();
        SemanticAction add = context -> {
            spans.add(context.resultLocation());
            context.result().assign(Grammars.VALUE, context.rhs(1).get(Grammars.VALUE) + context.rhs(3).get(Grammars.VALUE));
        };
        RecordingParser parser = parser(Grammars.sums(add, Grammars.number(log), Grammars.error(log)));
        input.text("1 + 2 + 3");

        assertSame(ParseResult.Accepted.INSTANCE, parser.parse());
        assertEquals(List.of(new Location(1, 1, 1, 5), new Location(1, 1, 1, 9)), spans);
    }

    @Test
    public void testActionsSeeTheLookahead() throws Exception {
        List<Integer> seen = new ArrayList<>();
        SemanticAction add = context -> {
            seen.add(context.lookahead());
            context.result().assign(Grammars.VALUE, 0L);
        };
        SemanticAction number = context -> {
            seen.add(context.lookahead());
            context.result().assign(Grammars.VALUE, 0L);
        };
        RecordingParser parser = parser(Grammars.sums(add, number, Grammars.error(log)));
        input.number(1).symbol('+').number(2);

        parser.parse();
        // states with a default reduction reduce without reading ahead
        assertEquals(List.of(Tokens.UNDETERMINED, Tokens.UNDETERMINED, Tokens.UNDETERMINED), seen);
    }

    @Test
    public void testLookaheadSurvivesTheReduction() throws Exception {
        List<Integer> seen = new ArrayList<>();
        SemanticAction add = context -> {
            seen.add(context.lookahead());
            context.result().assign(Grammars.VALUE, context.rhs(1).get(Grammars.VALUE) + context.rhs(3).get(Grammars.VALUE));
        };
        ParseTables tables = Grammars.sums(add, Grammars.number(log), Grammars.error(log), StateType.REQ_DEF);
        LalrParser parser = new LalrParser(tables, input);
        input.number(1).symbol('+').number(2).symbol('+').number(3);

        assertSame(ParseResult.Accepted.INSTANCE, parser.parse());
        assertEquals(List.of((int) '+', Tokens.END_OF_INPUT), seen);
        assertEquals(6L, parser.value().get(Grammars.VALUE));
        assertEquals(6, input.calls());
    }

    // ====== ERROR RECOVERY ====== //

    @Test
    public void testDoublePlusReportsOneError() throws Exception {
        RecordingParser parser = parser(Grammars.sums(log));
        input.number(1).symbol('+').symbol('+').number(2);

        ParseResult result = parser.parse();

        assertEquals(new ParseResult.SyntaxErrors(1), result);
        assertEquals(1, result.code());
        assertEquals(1, parser.errorCount());
        assertEquals(List.of(
                "shift NUMBER",
                "reduce E->NUMBER",
                "shift '+'",
                "error in state 4 on '+'",
                "reduce E->error",
                "reduce E->E+E",
                "shift '+'",
                "shift NUMBER",
                "reduce E->NUMBER",
                "reduce E->E+E"
        ), log);
        assertEquals(3L, parser.value().get(Grammars.VALUE));
    }

    @Test
    public void testCascadingErrorsAreAbsorbed() throws Exception {
        RecordingParser parser = parser(Grammars.sums(log));
        input.number(1).symbol('+').symbol('+').symbol('+').number(2);

        ParseResult result = parser.parse();

        assertEquals(new ParseResult.SyntaxErrors(1), result);
        assertEquals(1, log.stream().filter(line -> line.startsWith("error")).count());
    }

    @Test
    public void testErrorAfterRecoveryIsReported() throws Exception {
        RecordingParser parser = parser(Grammars.sums(log));
        input.number(1).symbol('+').symbol('+').number(2).symbol('+').number(3).symbol('+').symbol('+').number(4);

        ParseResult result = parser.parse();

        assertEquals(new ParseResult.SyntaxErrors(2), result);
        assertEquals(2, parser.errorCount());
        assertEquals(10L, parser.value().get(Grammars.VALUE));
    }

    @Test
    public void testRequiredTokensComeFromTheTables() throws Exception {
        ParseTables tables = ParseTables.builder()
                .name(Grammars.NUMBER, "NUMBER")
                .requiredTokens(0)
                .rule(Grammars.E, 3, Grammars.add(log))
                .rule(Grammars.E, 1, Grammars.number(log))
                .rule(Grammars.E, 1, Grammars.error(log))
                .state(Grammars.sums(log).state(0))
                .state(Grammars.sums(log).state(1))
                .state(Grammars.sums(log).state(2))
                .state(Grammars.sums(log).state(3))
                .state(Grammars.sums(log).state(4))
                .state(Grammars.sums(log).state(5))
                .build();
        RecordingParser parser = parser(tables);
        input.number(1).symbol('+').symbol('+').symbol('+').number(2);

        // nothing has to be shifted before errors count again
        assertEquals(new ParseResult.SyntaxErrors(2), parser.parse());
    }

    @Test
    public void testStalledRecoveryDiscardsTokens() throws Exception {
        RecordingParser parser = parser(Grammars.sums(log));
        input.number(1).number(2);

        ParseResult result = parser.parse();

        assertEquals(new ParseResult.SyntaxErrors(1), result);
        assertEquals(0L, parser.value().get(Grammars.VALUE));
        // the second number is dropped, never shifted
        assertEquals(List.of(
                "shift NUMBER",
                "reduce E->NUMBER",
                "error in state 1 on NUMBER",
                "reduce E->error",
                "reduce E->error"
        ), log);
    }

    @Test
    public void testRecoveryResumesAfterDiscarding() throws Exception {
        LalrParser parser = new LalrParser(Grammars.statement(), input);
        input.symbol('x').symbol('y').symbol(';');

        assertEquals(new ParseResult.SyntaxErrors(1), parser.parse());
        assertEquals(1L, parser.value().get(Grammars.VALUE));
    }

    @Test
    public void testEndOfInputWhileRecoveringAborts() throws Exception {
        LalrParser parser = new LalrParser(Grammars.statement(), input);
        input.symbol('x');

        ParseResult result = parser.parse();

        assertEquals(new ParseResult.Aborted(AbortReason.INPUT_EXHAUSTED, 1), result);
        assertEquals(ParseResult.ABORT, result.code());
        assertFalse(result.completed());
        assertEquals(RecoveryState.ABORTED, parser.recoveryState());
        assertTrue(parser.value().isEmpty());
    }

    @Test
    public void testNoErrorStateAborts() throws Exception {
        RecordingParser parser = parser(Grammars.single());
        input.number(1).number(2);

        ParseResult result = parser.parse();

        assertEquals(new ParseResult.Aborted(AbortReason.RECOVERY_EXHAUSTED, 1), result);
        assertEquals(-1, result.code());
        assertEquals(List.of("shift NUMBER", "error in state 1 on NUMBER"), log);
        assertEquals(RecoveryState.ABORTED, parser.recoveryState());
        assertEquals(1, parser.stack().depth());
    }

    @Test
    public void testErrorOnFirstTokenWithoutErrorState() throws Exception {
        LalrParser parser = new LalrParser(Grammars.single(), input);
        input.symbol('+');
        assertEquals(new ParseResult.Aborted(AbortReason.RECOVERY_EXHAUSTED, 1), parser.parse());
    }

    // ====== ACTION REQUESTS ====== //

    @Test
    public void testActionCanAccept() throws Exception {
        SemanticAction number = context -> {
            context.result().assign(Grammars.VALUE, context.rhs(1).get(Grammars.VALUE));
            context.accept();
        };
        RecordingParser parser = parser(Grammars.sums(Grammars.add(log), number, Grammars.error(log)));
        input.number(99).symbol('+').number(1);

        assertSame(ParseResult.Accepted.INSTANCE, parser.parse());
        assertEquals(99L, parser.value().get(Grammars.VALUE));
        assertEquals(2, input.remaining());
    }

    @Test
    public void testActionCanAbort() throws Exception {
        SemanticAction number = context -> context.abort();
        RecordingParser parser = parser(Grammars.sums(Grammars.add(log), number, Grammars.error(log)));
        input.number(66);

        assertEquals(new ParseResult.Aborted(AbortReason.ABORT_REQUESTED, 0), parser.parse());
        assertTrue(parser.value().isEmpty());
    }

    @Test
    public void testActionCanRaiseError() throws Exception {
        SemanticAction number = context -> {
            long value = context.rhs(1).get(Grammars.VALUE);
            if (value < 0) context.error();
            context.result().assign(Grammars.VALUE, value);
        };
        RecordingParser parser = parser(Grammars.sums(Grammars.add(log), number, Grammars.error(log)));
        input.number(-1);

        assertEquals(new ParseResult.SyntaxErrors(1), parser.parse());
        assertEquals(0L, parser.value().get(Grammars.VALUE));
        assertTrue(log.contains("reduce E->error"));
    }

    @Test
    public void testEndRecoveryReportsTheNextError() throws Exception {
        SemanticAction error = context -> {
            context.endRecovery();
            context.result().assign(Grammars.VALUE, 0L);
        };
        RecordingParser parser = parser(Grammars.sums(Grammars.add(log), Grammars.number(log), error));
        input.number(1).symbol('+').symbol('+').symbol('+').number(2);

        assertEquals(new ParseResult.SyntaxErrors(2), parser.parse());
    }

    @Test
    public void testClearLookaheadReadsAgain() throws Exception {
        SemanticAction add = context -> {
            context.clearLookahead();
            context.result().assign(Grammars.VALUE, 0L);
        };
        ParseTables tables = Grammars.sums(add, Grammars.number(log), Grammars.error(log), StateType.REQ_DEF);
        LalrParser parser = new LalrParser(tables, input);
        input.number(1).symbol('+').number(2);

        assertSame(ParseResult.Accepted.INSTANCE, parser.parse());
        // the end of input dropped by the action is read a second time
        assertEquals(5, input.calls());
    }

    // ====== EXCEPTIONS ====== //

    @Test
    public void testActionExceptionIsRethrownByDefault() {
        SemanticAction number = context -> {
            throw new IllegalArgumentException("unlucky number");
        };
        RecordingParser parser = parser(Grammars.sums(Grammars.add(log), number, Grammars.error(log)));
        input.number(13);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, parser::parse);
        assertEquals("unlucky number", e.getMessage());
        assertEquals(1, parser.handled.size());
        assertEquals(1, parser.stack().depth());
        assertTrue(parser.stack().releasedAboveTop());
    }

    @Test
    public void testSwallowedExceptionContinuesReduction() throws Exception {
        SemanticAction number = context -> {
            long value = context.rhs(1).get(Grammars.VALUE);
            context.result().assign(Grammars.VALUE, value);
            if (value == 13) throw new IllegalArgumentException("unlucky number");
        };
        RecordingParser parser = parser(Grammars.sums(Grammars.add(log), number, Grammars.error(log)));
        parser.swallowExceptions = true;
        input.number(13).symbol('+').number(1);

        assertSame(ParseResult.Accepted.INSTANCE, parser.parse());
        assertEquals(14L, parser.value().get(Grammars.VALUE));
        assertEquals(1, parser.handled.size());
    }

    @Test
    public void testParserCanBeReused() throws Exception {
        SemanticAction number = context -> {
            long value = context.rhs(1).get(Grammars.VALUE);
            if (value == 13) throw new IllegalArgumentException("unlucky number");
            context.result().assign(Grammars.VALUE, value);
        };
        RecordingParser parser = parser(Grammars.sums(Grammars.add(log), number, Grammars.error(log)));

        input.number(13);
        assertThrows(IllegalArgumentException.class, parser::parse);

        input.number(1).symbol('+').symbol('+').number(2);
        assertEquals(new ParseResult.SyntaxErrors(1), parser.parse());

        input.number(2).symbol('+').number(5);
        assertSame(ParseResult.Accepted.INSTANCE, parser.parse());
        assertEquals(0, parser.errorCount());
        assertEquals(7L, parser.value().get(Grammars.VALUE));
    }

    @Test
    public void testReentrantParseIsRejected() {
        AtomicReference<LalrParser> self = new AtomicReference<>();
        SemanticAction number = context -> self.get().parse();
        LalrParser parser = new LalrParser(Grammars.sums(Grammars.add(log), number, Grammars.error(log)), input);
        self.set(parser);
        input.number(1);

        assertThrows(IllegalStateException.class, parser::parse);
    }

    // ====== TRACE ====== //

    @Test
    public void testTraceOutput() throws Exception {
        LalrParser parser = new LalrParser(Grammars.sums(log), input);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        parser.setTrace(new PrintStream(out, true, StandardCharsets.UTF_8));
        input.number(1).symbol('+').number(2);

        parser.parse();
        String trace = out.toString(StandardCharsets.UTF_8);

        assertTrue(trace.contains("Reading: NUMBER"));
        assertTrue(trace.contains("Shift: NUMBER -> state 2"));
        assertTrue(trace.contains("Reduce: E <- 1 symbols (rule 2), goto 1"));
        assertTrue(trace.contains("Stack now 0 1 4 5"));
        assertTrue(trace.contains("Reduce: E <- 3 symbols (rule 1), goto 1"));
        assertTrue(trace.contains("ACCEPTED"));

        out.reset();
        parser.setTrace(null);
        input.number(3);
        parser.parse();
        assertEquals(0, out.size());
    }

    @Test
    public void testTraceShowsRecovery() throws Exception {
        LalrParser parser = new LalrParser(Grammars.sums(log), input);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        parser.setTrace(new PrintStream(out, true, StandardCharsets.UTF_8));
        input.number(1).number(2);

        parser.parse();
        String trace = out.toString(StandardCharsets.UTF_8);

        assertTrue(trace.contains("Syntax error in state 1 on NUMBER"));
        assertTrue(trace.contains("Shift: error -> state 3"));
        assertTrue(trace.contains("Discard: NUMBER"));
    }

    @Test
    public void testResultTypes() {
        assertInstanceOf(ParseResult.Accepted.class, ParseResult.of(0));
        assertEquals(new ParseResult.SyntaxErrors(4), ParseResult.of(4));
        assertThrows(IllegalArgumentException.class, () -> new ParseResult.SyntaxErrors(0));
        assertEquals(3, new ParseResult.Aborted(AbortReason.ABORT_REQUESTED, 3).errors());
    }
}
