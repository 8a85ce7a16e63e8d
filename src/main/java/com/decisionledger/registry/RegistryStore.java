package com.decisionledger.registry;

import java.util.List;
import java.util.Optional;

/**
 * Versioned key-value storage behind the registry. Writers never overwrite
 * blindly: every update names the revision it was computed from.
 */
public interface RegistryStore<T> {

    Optional<Versioned<T>> get(String key);

    /**
     * Stores the value at revision 1.
     *
     * @return false when the key already exists
     */
    boolean putIfAbsent(String key, T value);

    /**
     * @throws ConcurrentReleaseModificationException when the stored revision is
     *         no longer {@code expectedRevision}
     */
    Versioned<T> compareAndSet(String key, long expectedRevision, T value);

    /** @return false when the key is absent or no longer at {@code expectedRevision} */
    boolean remove(String key, long expectedRevision);

    List<String> keys(String prefix);
}
