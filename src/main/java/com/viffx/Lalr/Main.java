package com.viffx.Lalr;

import com.viffx.Lalr.Calc.AstNode;
import com.viffx.Lalr.Calc.ExpressionParser;
import com.viffx.Lalr.Parser.ParseResult;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Evaluates arithmetic expressions, one per argument or, without arguments, one per line of
 * standard input. Pass {@code --trace} first to print every parser step.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        boolean trace = args.length > 0 && args[0].equals("--trace");
        List<String> expressions = new ArrayList<>(Arrays.asList(args).subList(trace ? 1 : 0, args.length));

        if (expressions.isEmpty()) {
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) expressions.add(line);
            }
        }

        int failures = 0;
        for (String expression : expressions) {
            if (!evaluate(expression, trace)) failures++;
        }
        if (failures > 0) System.exit(1);
    }

    private static boolean evaluate(String expression, boolean trace) throws Exception {
        ExpressionParser parser;
        try {
            parser = ExpressionParser.of(expression);
        } catch (IOException e) {
            System.err.println(expression + ": " + e.getMessage());
            return false;
        }
        if (trace) parser.setTrace(System.out);

        ParseResult result;
        try {
            result = parser.parse();
        } catch (IOException e) {
            System.err.println(expression + ": " + e.getMessage());
            return false;
        }

        for (String diagnostic : parser.diagnostics()) {
            System.err.println(expression + ": " + diagnostic);
        }

        if (result instanceof ParseResult.Aborted aborted) {
            System.err.println(expression + ": parse aborted (" + aborted.reason() + ")");
            return false;
        }

        AstNode tree = parser.tree();
        if (tree == null || tree.containsErrors()) {
            System.out.println(tree + " (" + result.errors() + " error" + (result.errors() == 1 ? "" : "s") + ")");
            return false;
        }
        System.out.println(tree + " = " + tree.evaluate());
        return true;
    }
}
