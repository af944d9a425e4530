package com.viffx.Lalr.Parser;

/**
 * The mutable state of one parse. Reset at the start of every {@link LalrParser#parse()}.
 */
final class RuntimeState {
    final Lookahead lookahead = new Lookahead();
    RecoveryState recovery = RecoveryState.NORMAL;
    int errors = 0;

    /**
     * Ordinary tokens shifted since the last error token was shifted.
     */
    int accepted = 0;
    int required = 0;

    boolean running = false;

    void reset(int requiredTokens) {
        lookahead.reset();
        recovery = RecoveryState.NORMAL;
        errors = 0;
        required = requiredTokens;
        accepted = requiredTokens;
    }

    boolean absorbing() {
        return recovery == RecoveryState.RECOVERING && accepted < required;
    }

    /**
     * Returns {@code true} if the error token was shifted and no ordinary token after it.
     */
    boolean stalled() {
        return recovery == RecoveryState.RECOVERING && accepted == 0;
    }

    void tokenShifted() {
        accepted++;
        if (recovery == RecoveryState.RECOVERING && accepted >= required) recovery = RecoveryState.NORMAL;
    }

    @Override
    public String toString() {
        return "RuntimeState{" +
                "recovery=" + recovery +
                ", errors=" + errors +
                ", accepted=" + accepted + "/" + required +
                ", " + lookahead +
                '}';
    }
}
