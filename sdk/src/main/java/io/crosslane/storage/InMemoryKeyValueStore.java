package io.crosslane.storage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

// Keeps insertion order, so iteration over values is deterministic.
public class InMemoryKeyValueStore<K, V> implements KeyValueStore<K, V> {
    private final Map<K, V> entries = new LinkedHashMap<>();

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public V getOrElse(K key, V defaultValue) {
        return entries.getOrDefault(key, defaultValue);
    }

    @Override
    public void put(K key, V value) {
        entries.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
    }

    @Override
    public void remove(K key) {
        entries.remove(key);
    }

    @Override
    public boolean contains(K key) {
        return entries.containsKey(key);
    }

    @Override
    public List<V> values() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
