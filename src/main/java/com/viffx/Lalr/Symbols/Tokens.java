package com.viffx.Lalr.Symbols;

/**
 * The token id space shared by scanners, tables and the parser.
 * <ul>
 *   <li>{@code 1..255} - single character tokens, the id is the character code</li>
 *   <li>{@link #ERROR} - the error token injected during recovery</li>
 *   <li>{@link #FIRST_NAMED} and up - named grammar tokens, then nonterminals</li>
 *   <li>{@link #END_OF_INPUT}, {@link #UNDETERMINED} - negative sentinels</li>
 * </ul>
 */
public final class Tokens {
    /**
     * No token has been fetched yet, or the last one was consumed.
     */
    public static final int UNDETERMINED = -2;
    public static final int END_OF_INPUT = -1;
    public static final int ERROR = 256;
    public static final int FIRST_NAMED = 257;

    private Tokens() {}

    public static boolean isSentinel(int id) {
        return id == UNDETERMINED || id == END_OF_INPUT || id == ERROR;
    }

    public static boolean isCharacter(int id) {
        return id > 0 && id < ERROR;
    }

    /**
     * Scanners may signal end of input with any id {@code <= 0}; this folds them onto
     * {@link #END_OF_INPUT}.
     */
    public static int normalize(int id) {
        return id <= 0 ? END_OF_INPUT : id;
    }

    /**
     * Returns a display name for ids that carry one without a symbol table: sentinels and
     * character tokens. Other ids are rendered as {@code #id}.
     */
    public static String describe(int id) {
        return switch (id) {
            case UNDETERMINED -> "<undetermined>";
            case END_OF_INPUT -> "<EOF>";
            case ERROR -> "error";
            default -> {
                if (!isCharacter(id)) yield "#" + id;
                char c = (char) id;
                yield switch (c) {
                    case '\n' -> "'\\n'";
                    case '\t' -> "'\\t'";
                    case '\r' -> "'\\r'";
                    default -> "'" + c + "'";
                };
            }
        };
    }
}
