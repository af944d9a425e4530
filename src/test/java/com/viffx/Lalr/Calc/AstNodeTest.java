package com.viffx.Lalr.Calc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AstNodeTest {
    @Test
    public void testEvaluate() {
        AstNode tree = AstNode.binary(AstNode.Kind.ADD,
                AstNode.number(1),
                AstNode.binary(AstNode.Kind.MULTIPLY, AstNode.number(2), AstNode.number(3)));
        assertEquals(7, tree.evaluate());
        assertEquals("(1 + (2 * 3))", tree.toString());
        assertFalse(tree.containsErrors());
    }

    @Test
    public void testErrorNodes() {
        AstNode tree = AstNode.binary(AstNode.Kind.ADD, AstNode.number(1), AstNode.error());
        assertTrue(tree.containsErrors());
        assertThrows(IllegalStateException.class, tree::evaluate);
        assertEquals("(1 + <error>)", tree.toString());
    }

    @Test
    public void testCopyIsDeep() {
        AstNode tree = AstNode.binary(AstNode.Kind.ADD, AstNode.number(1), AstNode.number(2));
        AstNode copy = tree.copy();

        assertEquals(tree, copy);
        assertEquals(tree.hashCode(), copy.hashCode());
        assertNotSame(tree.children().get(0), copy.children().get(0));

        copy.children().get(0).add(AstNode.number(5));
        assertEquals(0, tree.children().get(0).children().size());
    }

    @Test
    public void testBinaryNeedsOperator() {
        assertThrows(IllegalArgumentException.class, () -> AstNode.binary(AstNode.Kind.NUMBER, AstNode.number(1), AstNode.number(2)));
    }
}
