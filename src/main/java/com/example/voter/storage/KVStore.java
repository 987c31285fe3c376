package com.example.voter.storage;

import java.util.Collection;
import java.util.List;

/**
 * String-keyed document store. Each value is a complete serialized document;
 * there are no partial updates.
 */
public interface KVStore {
    String get(String key);
    boolean putIfAbsent(String key, String value);  // false if the key already exists
    boolean replace(String key, String value);      // false if the key does not exist
    boolean compareAndSet(String key, String expected, String value);
    boolean remove(String key);
    List<String> keys(String prefix);
    long removeAll(Collection<String> keys);
}
