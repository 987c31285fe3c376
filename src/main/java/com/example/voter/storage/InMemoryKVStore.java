package com.example.voter.storage;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * An in-memory implementation of the KVStore interface using ConcurrentHashMap for thread-safe operations.
 */
@Component
@ConditionalOnProperty(name = "voter.store.type", havingValue = "memory")
public class InMemoryKVStore implements KVStore {
    private final Map<String, String> store;

    public InMemoryKVStore() {
        this.store = new ConcurrentHashMap<>();
    }

    @Override
    public String get(String key) {
        return store.get(key);
    }

    @Override
    public boolean putIfAbsent(String key, String value) {
        return store.putIfAbsent(key, value) == null;
    }

    @Override
    public boolean replace(String key, String value) {
        return store.replace(key, value) != null;
    }

    @Override
    public boolean compareAndSet(String key, String expected, String value) {
        return store.replace(key, expected, value);
    }

    @Override
    public boolean remove(String key) {
        return store.remove(key) != null;
    }

    @Override
    public List<String> keys(String prefix) {
        return store.keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public long removeAll(Collection<String> keys) {
        long removed = 0;
        for (String key : keys) {
            if (store.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }
}
