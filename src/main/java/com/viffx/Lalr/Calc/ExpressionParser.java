package com.viffx.Lalr.Calc;

import com.viffx.Lalr.Parser.LalrParser;
import com.viffx.Lalr.Parser.ParseResult;
import com.viffx.Lalr.Symbols.Location;
import com.viffx.Lalr.Symbols.Token;
import com.viffx.Lalr.Symbols.TokenSource;
import com.viffx.Lalr.Symbols.Tokens;
import com.viffx.Lalr.Tables.ParseTables;
import com.viffx.Lalr.Tables.StateTable;
import com.viffx.Lalr.Tables.StateType;
import com.viffx.Lalr.Values.Tag;
import com.viffx.Lalr.Values.Tags;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.viffx.Lalr.Tables.Transition.accept;
import static com.viffx.Lalr.Tables.Transition.goTo;
import static com.viffx.Lalr.Tables.Transition.shift;

/**
 * Parser for sums and products of numbers.
 * <pre>
 *   E > E '+' E | E '*' E | NUMBER | error;
 * </pre>
 * {@code '*'} binds tighter than {@code '+'} and both are left associative. The parse builds
 * an {@link AstNode} tree; input the parser recovered from shows up as error nodes.
 */
public class ExpressionParser extends LalrParser {
    // Symbols
    public static final int EOF = Tokens.END_OF_INPUT;
    public static final int ERROR = Tokens.ERROR;
    public static final int PLUS = '+';
    public static final int TIMES = '*';
    public static final int NUMBER = Tokens.FIRST_NAMED;
    public static final int E = NUMBER + 1;

    // Semantic value types
    public static final Tags TAGS = new Tags();
    public static final Tag<Long> LITERAL = TAGS.immutable("LITERAL", Long.class);
    public static final Tag<AstNode> NODE = TAGS.declare("NODE", AstNode.class, AstNode::copy);

    static {
        TAGS.seal();
    }

    // Rules
    public static final int RULE_ADD = 1;
    public static final int RULE_MULTIPLY = 2;
    public static final int RULE_NUMBER = 3;
    public static final int RULE_ERROR = 4;

    public static final ParseTables TABLES = ParseTables.builder()
            .name(NUMBER, "NUMBER")
            .name(E, "E")
            .requiredTokens(3)
            // 1: E > E '+' E
            .rule(E, 3, context -> context.result().assign(NODE,
                    AstNode.binary(AstNode.Kind.ADD, context.rhs(1).get(NODE), context.rhs(3).get(NODE))))
            // 2: E > E '*' E
            .rule(E, 3, context -> context.result().assign(NODE,
                    AstNode.binary(AstNode.Kind.MULTIPLY, context.rhs(1).get(NODE), context.rhs(3).get(NODE))))
            // 3: E > NUMBER
            .rule(E, 1, context -> context.result().assign(NODE, AstNode.number(context.rhs(1).get(LITERAL))))
            // 4: E > error
            .rule(E, 1, context -> context.result().assign(NODE, AstNode.error()))
            // 0: START > . E
            .state(StateTable.of(StateType.ERR_REQ, shift(NUMBER, 2), shift(ERROR, 3), goTo(E, 1)))
            // 1: START > E . | E > E . '+' E | E > E . '*' E
            .state(StateTable.of(StateType.REQ_TOKEN, accept(EOF), shift(PLUS, 4), shift(TIMES, 5)))
            // 2: E > NUMBER .
            .state(StateTable.withDefault(StateType.DEF_RED, RULE_NUMBER))
            // 3: E > error .
            .state(StateTable.withDefault(StateType.DEF_RED, RULE_ERROR))
            // 4: E > E '+' . E
            .state(StateTable.of(StateType.ERR_REQ, shift(NUMBER, 2), shift(ERROR, 3), goTo(E, 6)))
            // 5: E > E '*' . E
            .state(StateTable.of(StateType.ERR_REQ, shift(NUMBER, 2), shift(ERROR, 3), goTo(E, 7)))
            // 6: E > E '+' E . | E > E . '*' E
            .state(StateTable.withDefault(StateType.REQ_DEF, RULE_ADD, shift(TIMES, 5)))
            // 7: E > E '*' E .
            .state(StateTable.withDefault(StateType.DEF_RED, RULE_MULTIPLY))
            .build();

    private final List<String> diagnostics = new ArrayList<>();

    public ExpressionParser(TokenSource source) {
        super(TABLES, source);
    }

    public static ExpressionParser of(String text) throws IOException {
        return new ExpressionParser(new ExpressionLexer(text));
    }

    @Override
    public ParseResult parse() throws Exception {
        diagnostics.clear();
        return super.parse();
    }

    /**
     * Returns the tree of the last completed parse, or {@code null} if there is none.
     */
    public AstNode tree() {
        return value().holds(NODE) ? value().get(NODE) : null;
    }

    /**
     * Returns one message per syntax error reported by the last parse.
     */
    public List<String> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    @Override
    protected void onSyntaxError() {
        super.onSyntaxError();
        Token token = lookahead();
        Location location = token == null ? null : token.location();
        diagnostics.add("Syntax error" + (location == null ? "" : " at " + location) + ": unexpected " + tables().symbolName(lookaheadId()));
    }
}
