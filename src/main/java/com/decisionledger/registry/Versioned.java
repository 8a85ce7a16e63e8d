package com.decisionledger.registry;

/**
 * A stored value with the revision it was read at. Revisions start at 1 and
 * grow by one per successful write.
 */
public record Versioned<T>(T value, long revision) {
}
