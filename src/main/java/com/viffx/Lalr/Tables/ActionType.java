package com.viffx.Lalr.Tables;

public enum ActionType {
    SHIFT,
    GOTO,
    REDUCE,
    ACCEPT,
    /**
     * No entry matched and the state has no default reduction: a syntax error.
     */
    ERROR
}
