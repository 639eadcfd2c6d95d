package io.crosslane.storage;

import java.util.List;
import java.util.Optional;

/**
 * Typed key-value store owned by a single ledger component and handed to it explicitly.
 */
public interface KeyValueStore<K, V> {

    Optional<V> get(K key);

    V getOrElse(K key, V defaultValue);

    void put(K key, V value);

    void remove(K key);

    boolean contains(K key);

    List<V> values();

    boolean isEmpty();
}
