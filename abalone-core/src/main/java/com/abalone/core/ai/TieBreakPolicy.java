package com.abalone.core.ai;

import com.abalone.core.Move;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Decides whether a candidate whose value exactly equals the current best replaces it.
 */
public enum TieBreakPolicy {
    /** Prefer the move whose notation sorts first. */
    LEXICOGRAPHIC("lexicographic") {
        @Override
        public boolean prefers(Move candidate, Move incumbent) {
            return incumbent == null || candidate.notation().compareTo(incumbent.notation()) < 0;
        }
    },
    /** Keep the first move found under the search ordering. */
    FIRST("first") {
        @Override
        public boolean prefers(Move candidate, Move incumbent) {
            return incumbent == null;
        }
    };

    private static final Logger LOGGER = Logger.getLogger(TieBreakPolicy.class.getName());

    private final String policyName;

    TieBreakPolicy(String policyName) {
        this.policyName = policyName;
    }

    public String policyName() {
        return policyName;
    }

    public abstract boolean prefers(Move candidate, Move incumbent);

    /**
     * Resolves a policy by name. Unknown names resolve to {@link #FIRST}.
     */
    public static TieBreakPolicy fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (TieBreakPolicy policy : values()) {
                if (policy.policyName.equals(normalized)) {
                    return policy;
                }
            }
        }
        LOGGER.warning(() -> String.format("Unknown tie-break policy '%s', keeping the first best move", name));
        return FIRST;
    }
}
