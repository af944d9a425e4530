package com.viffx.Lalr.Tables;

/**
 * User code run when a production is reduced.
 * <p>
 * The action reads the right hand side values through the {@link ActionContext} and stores
 * the left hand side value in {@link ActionContext#result()}. Anything it throws is handed
 * to the parser's exception handler.
 */
@FunctionalInterface
public interface SemanticAction {
    void execute(ActionContext context) throws Exception;
}
