package com.viffx.Lalr.Tables;

import com.viffx.Lalr.Symbols.Tokens;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The precomputed, immutable tables of one parser type: a {@link StateTable} per state, the
 * {@link Production} of every rule, the number of tokens that must be shifted before error
 * recovery ends, and display names for the symbols.
 * <p>
 * Rules are numbered from 1; rule 0 is the augmented start rule, which is never reduced
 * (reaching it is an accept). States are numbered from 0, the start state.
 * <p>
 * Instances are built once with a {@link Builder}, validated, and may then be shared by any
 * number of parsers.
 */
public final class ParseTables {
    // ====== INSTANCE FIELDS ====== //
    private final StateTable[] states;
    private final Production[] productions;
    private final Set<Integer> nonTerminals;
    private final int requiredTokens;
    private final Map<Integer, String> names;

    /**
     * {@code decoded[state][entry]} is the decoded action of that entry.
     */
    private final Action[][] decoded;
    private final Action[] defaults;

    // ====== CONSTRUCTORS ====== //
    private ParseTables(Builder builder) {
        this.states = builder.states.toArray(new StateTable[0]);
        this.productions = builder.productions.toArray(new Production[0]);
        this.requiredTokens = builder.requiredTokens;
        this.names = Collections.unmodifiableMap(new HashMap<>(builder.names));

        Set<Integer> nonTerminals = new HashSet<>();
        for (int rule = 1; rule < productions.length; rule++) {
            nonTerminals.add(productions[rule].lhs());
        }
        this.nonTerminals = Collections.unmodifiableSet(nonTerminals);

        validate();

        this.decoded = new Action[states.length][];
        this.defaults = new Action[states.length];
        for (int state = 0; state < states.length; state++) {
            StateTable table = states[state];
            decoded[state] = new Action[table.size()];
            for (int i = 0; i < table.size(); i++) {
                Transition transition = table.transition(i);
                decoded[state][i] = Action.decode(transition.action(), isNonTerminal(transition.token()));
            }
            defaults[state] = table.type().hasDefaultReduction() ? Action.reduce(table.defaultReduction()) : Action.NONE;
        }
    }

    @Contract("-> new")
    public static @NotNull Builder builder() {
        return new Builder();
    }

    // ====== PUBLIC API ====== //

    /**
     * Returns the action for {@code token} in {@code state}.
     * <p>
     * The state's entries are scanned in declaration order. If none matches, the state's
     * default reduction is returned, and without one {@link Action#NONE}.
     *
     * @throws IndexOutOfBoundsException if {@code state} is not a state of these tables
     */
    public @NotNull Action lookup(int state, int token) {
        StateTable table = state(state);
        int index = table.find(token);
        if (index >= 0) return decoded[state][index];
        return defaults[state];
    }

    public @NotNull StateTable state(int state) {
        if (state < 0 || state >= states.length) {
            throw new IndexOutOfBoundsException(String.format("State %d out of bounds for length %d", state, states.length));
        }
        return states[state];
    }

    public int stateCount() {
        return states.length;
    }

    /**
     * Returns the production of {@code rule}.
     *
     * @throws IndexOutOfBoundsException if {@code rule} is not in {@code 1..ruleCount()}
     */
    public @NotNull Production production(int rule) {
        if (rule < 1 || rule >= productions.length) {
            throw new IndexOutOfBoundsException(String.format("Rule %d out of bounds for length %d", rule, productions.length));
        }
        return productions[rule];
    }

    /**
     * Returns the number of reducible rules, the augmented start rule excluded.
     */
    public int ruleCount() {
        return productions.length - 1;
    }

    public boolean isNonTerminal(int symbol) {
        return nonTerminals.contains(symbol);
    }

    /**
     * Returns how many tokens must be shifted after an error before new errors are reported.
     */
    public int requiredTokens() {
        return requiredTokens;
    }

    /**
     * Returns the display name of a symbol: its registered name if any, otherwise the
     * generic rendering of {@link Tokens#describe(int)}.
     */
    public String symbolName(int symbol) {
        String name = names.get(symbol);
        return name != null ? name : Tokens.describe(symbol);
    }

    // ====== VALIDATION ====== //
    private void validate() {
        if (states.length == 0) throw new IllegalArgumentException("Parse tables need at least the start state");
        if (requiredTokens < 0) throw new IllegalArgumentException("requiredTokens cannot be negative: " + requiredTokens);

        for (int rule = 1; rule < productions.length; rule++) {
            int lhs = productions[rule].lhs();
            if (lhs < Tokens.FIRST_NAMED) {
                throw new IllegalArgumentException("Rule " + rule + ": nonterminal id " + lhs + " collides with the reserved or character token ids");
            }
        }

        for (int state = 0; state < states.length; state++) {
            StateTable table = states[state];
            StateType type = table.type();
            Set<Integer> seen = new HashSet<>();

            for (Transition transition : table.transitions()) {
                int token = transition.token();
                int action = transition.action();
                if (token == Tokens.UNDETERMINED) throw error(state, "has an entry for the undetermined token");
                if (!seen.add(token)) throw error(state, "has more than one entry for " + symbolName(token));
                if (action > 0 && action >= states.length) throw error(state, "shifts " + symbolName(token) + " to unknown state " + action);
                if (action < 0 && -action >= productions.length) throw error(state, "reduces by unknown rule " + -action);
                if (action <= 0 && isNonTerminal(token)) throw error(state, "has a non-goto entry for nonterminal " + symbolName(token));
            }

            if (type.hasDefaultReduction() != (table.defaultReduction() != 0)) {
                throw error(state, "is " + type + " but " + (table.defaultReduction() == 0 ? "has no" : "has a") + " default reduction");
            }
            if (table.defaultReduction() >= productions.length) {
                throw error(state, "reduces by unknown rule " + table.defaultReduction() + " by default");
            }
            if (type.errorItem()) {
                int index = table.find(Tokens.ERROR);
                if (index < 0 || table.transition(index).action() <= 0) throw error(state, "is marked " + type + " but does not shift the error token");
            }
        }
    }

    private static IllegalArgumentException error(int state, String message) {
        return new IllegalArgumentException("State " + state + " " + message);
    }

    // ====== BUILDER ====== //
    /**
     * Collects states and rules in numbering order. The first {@link #state(StateTable)} call
     * defines state 0, the first {@link #rule(int, int, SemanticAction)} call rule 1.
     */
    public static final class Builder {
        private final List<StateTable> states = new ArrayList<>();
        private final List<Production> productions = new ArrayList<>();
        private final Map<Integer, String> names = new HashMap<>();
        private int requiredTokens = 3;

        private Builder() {
            // rule 0, the augmented start rule
            productions.add(new Production(Integer.MAX_VALUE, 1, null));
        }

        public Builder state(@NotNull StateTable state) {
            states.add(Objects.requireNonNull(state, "state cannot be null"));
            return this;
        }

        public Builder rule(int lhs, int length, SemanticAction action) {
            productions.add(new Production(lhs, length, action));
            return this;
        }

        /**
         * Adds a rule that keeps the default {@code $$ = $1}.
         */
        public Builder rule(int lhs, int length) {
            return rule(lhs, length, null);
        }

        public Builder requiredTokens(int requiredTokens) {
            this.requiredTokens = requiredTokens;
            return this;
        }

        public Builder name(int symbol, @NotNull String name) {
            names.put(symbol, Objects.requireNonNull(name, "name cannot be null"));
            return this;
        }

        /**
         * Validates and freezes the tables.
         *
         * @throws IllegalArgumentException if the tables are inconsistent
         */
        public ParseTables build() {
            return new ParseTables(this);
        }
    }
}
