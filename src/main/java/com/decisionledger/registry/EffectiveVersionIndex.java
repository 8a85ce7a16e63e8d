package com.decisionledger.registry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, effective-dated history of which version of a function is in
 * force. Windows are ordered by start and never overlap, so resolution is a
 * pure lookup over {@code (function_id, as_of)}.
 */
public final class EffectiveVersionIndex {

    private final String functionId;
    private final List<EffectiveWindow> windows;

    private EffectiveVersionIndex(String functionId, List<EffectiveWindow> windows) {
        this.functionId = functionId;
        this.windows = List.copyOf(windows);
    }

    public static EffectiveVersionIndex empty(String functionId) {
        return new EffectiveVersionIndex(functionId, List.of());
    }

    public String functionId() {
        return functionId;
    }

    public List<EffectiveWindow> windows() {
        return windows;
    }

    public Optional<EffectiveWindow> resolve(Instant asOf) {
        for (int i = windows.size() - 1; i >= 0; i--) {
            EffectiveWindow window = windows.get(i);
            if (!asOf.isBefore(window.effectiveFrom())) {
                return window.contains(asOf) ? Optional.of(window) : Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<EffectiveWindow> windowOf(String version) {
        return windows.stream().filter(w -> w.version().equals(version)).findFirst();
    }

    /** The open-ended window at the tail, if any. */
    public Optional<EffectiveWindow> openWindow() {
        if (windows.isEmpty()) {
            return Optional.empty();
        }
        EffectiveWindow last = windows.get(windows.size() - 1);
        return last.isOpen() ? Optional.of(last) : Optional.empty();
    }

    /**
     * Adds an open window for {@code version} starting at {@code effectiveFrom},
     * closing the currently open window there.
     *
     * @throws IllegalArgumentException if the version already has a window or
     *         {@code effectiveFrom} does not come after every existing window start
     */
    public EffectiveVersionIndex withActivation(String version, Instant effectiveFrom) {
        if (windowOf(version).isPresent()) {
            throw new IllegalArgumentException(version + " already has an effective window");
        }
        List<EffectiveWindow> updated = new ArrayList<>(windows);
        if (!updated.isEmpty()) {
            int lastIndex = updated.size() - 1;
            EffectiveWindow last = updated.get(lastIndex);
            if (!effectiveFrom.isAfter(last.effectiveFrom())) {
                throw new IllegalArgumentException("effective_from " + effectiveFrom
                    + " must be after " + last.effectiveFrom() + " (start of " + last.version() + ")");
            }
            if (last.isOpen() || effectiveFrom.isBefore(last.effectiveUntil())) {
                updated.set(lastIndex, last.closedAt(effectiveFrom));
            }
        }
        updated.add(new EffectiveWindow(version, effectiveFrom, null));
        return new EffectiveVersionIndex(functionId, updated);
    }

    /**
     * Closes the window of {@code version} at {@code sunsetAt}. A window that
     * already ends earlier keeps its end.
     */
    public EffectiveVersionIndex withSunset(String version, Instant sunsetAt) {
        EffectiveWindow window = windowOf(version)
            .orElseThrow(() -> new IllegalArgumentException(version + " has no effective window"));
        if (sunsetAt.isBefore(window.effectiveFrom())) {
            throw new IllegalArgumentException("sunset " + sunsetAt + " precedes effective_from "
                + window.effectiveFrom() + " of " + version);
        }
        if (!window.isOpen() && !sunsetAt.isBefore(window.effectiveUntil())) {
            return this;
        }
        List<EffectiveWindow> updated = new ArrayList<>(windows);
        updated.set(updated.indexOf(window), window.closedAt(sunsetAt));
        return new EffectiveVersionIndex(functionId, updated);
    }
}
