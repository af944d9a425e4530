package com.viffx.Lalr.Parser;

/**
 * The phases of error recovery.
 * <pre>
 *   NORMAL -&gt; ERRORING -&gt; RECOVERING -&gt; NORMAL
 *                  \             \
 *                   `-&gt; ABORTED &lt;-'
 * </pre>
 */
public enum RecoveryState {
    /**
     * No error pending; syntax errors are reported.
     */
    NORMAL,
    /**
     * A syntax error was just detected and the stack is being unwound.
     */
    ERRORING,
    /**
     * The error token has been shifted; fewer than the required number of tokens have been
     * shifted since. New errors are absorbed.
     */
    RECOVERING,
    /**
     * Recovery was impossible. Terminal.
     */
    ABORTED
}
