package uk.gegc.accessgate.features.billing.infra.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable keyed store backing the idempotency gate, customer records and onboarding markers.
 * Every operation is atomic on a single key; nothing spans keys.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void put(String key, String value);

    void put(String key, String value, Duration ttl);

    /**
     * Stores the value only when the key is absent (or expired).
     *
     * @return {@code true} if this call created the entry
     */
    boolean putIfAbsent(String key, String value, Duration ttl);

    /**
     * Replaces the value only if the current value equals {@code expected}.
     * A {@code null} expected value means the key must be absent. Any existing TTL is dropped.
     *
     * @return {@code true} if the swap was applied
     */
    boolean compareAndSet(String key, String expected, String newValue);

    /**
     * @return {@code true} if an entry was removed
     */
    boolean delete(String key);

    /**
     * All live keys starting with the prefix, in no particular order.
     */
    List<String> keys(String prefix);
}
