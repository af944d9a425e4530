package com.viffx.Lalr.Tables;

/**
 * Describes what a parser state needs and offers.
 * <ul>
 *   <li>{@code ERR} - the state contains an item with the error token after the dot, so error
 *       recovery can resume from it</li>
 *   <li>{@code REQ} - the state needs a lookahead token to choose its action</li>
 *   <li>{@code DEF} - the state has a default reduction used when no entry matches</li>
 * </ul>
 */
public enum StateType {
    NORMAL(false, false, false),
    ERR_ITEM(true, false, false),
    REQ_TOKEN(false, true, false),
    ERR_REQ(true, true, false),
    DEF_RED(false, false, true),
    ERR_DEF(true, false, true),
    REQ_DEF(false, true, true),
    ERR_REQ_DEF(true, true, true);

    private final boolean errorItem;
    private final boolean requiresToken;
    private final boolean defaultReduction;

    StateType(boolean errorItem, boolean requiresToken, boolean defaultReduction) {
        this.errorItem = errorItem;
        this.requiresToken = requiresToken;
        this.defaultReduction = defaultReduction;
    }

    public static StateType of(boolean errorItem, boolean requiresToken, boolean defaultReduction) {
        for (StateType type : values()) {
            if (type.errorItem == errorItem && type.requiresToken == requiresToken && type.defaultReduction == defaultReduction) {
                return type;
            }
        }
        throw new AssertionError("every flag combination has a constant");
    }

    public boolean errorItem() {
        return errorItem;
    }

    public boolean requiresToken() {
        return requiresToken;
    }

    public boolean hasDefaultReduction() {
        return defaultReduction;
    }
}
