package com.decisionledger.logic;

public enum ConflictType {
    /** Equal-priority rules whose conditions overlap but whose results differ. Blocks registration. */
    OVERLAPPING_CONDITIONS(true),
    /** Two rules share an id. Blocks registration. */
    DUPLICATE_RULE_ID(true),
    /** Overlap could not be excluded statically; a reviewer has to decide. */
    UNANALYZABLE(false),
    /** A condition names a field neither the input schema nor the feature binding provides. */
    UNKNOWN_FIELD(false);

    private final boolean blocking;

    ConflictType(boolean blocking) {
        this.blocking = blocking;
    }

    public boolean isBlocking() {
        return blocking;
    }
}
