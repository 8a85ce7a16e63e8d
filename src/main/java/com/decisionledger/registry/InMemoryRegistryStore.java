package com.decisionledger.registry;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryRegistryStore<T> implements RegistryStore<T> {

    private final ConcurrentMap<String, Versioned<T>> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<Versioned<T>> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public boolean putIfAbsent(String key, T value) {
        return entries.putIfAbsent(key, new Versioned<>(value, 1)) == null;
    }

    @Override
    public Versioned<T> compareAndSet(String key, long expectedRevision, T value) {
        Versioned<T> current = entries.get(key);
        if (current == null || current.revision() != expectedRevision) {
            throw new ConcurrentReleaseModificationException(key);
        }
        Versioned<T> next = new Versioned<>(value, expectedRevision + 1);
        if (!entries.replace(key, current, next)) {
            throw new ConcurrentReleaseModificationException(key);
        }
        return next;
    }

    @Override
    public boolean remove(String key, long expectedRevision) {
        Versioned<T> current = entries.get(key);
        return current != null && current.revision() == expectedRevision && entries.remove(key, current);
    }

    @Override
    public List<String> keys(String prefix) {
        return entries.keySet().stream()
            .filter(key -> key.startsWith(prefix))
            .sorted()
            .toList();
    }
}
