package uk.gegc.accessgate.features.billing.infra.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local store for tests and local runs. Expiry is evaluated lazily against the injected clock.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(live(key)).map(Entry::value);
    }

    @Override
    public void put(String key, String value) {
        entries.put(key, new Entry(value, null));
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, expiryFor(ttl)));
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        AtomicBoolean created = new AtomicBoolean(false);
        entries.compute(key, (k, current) -> {
            if (current != null && !current.isExpired(clock.instant())) {
                return current;
            }
            created.set(true);
            return new Entry(value, expiryFor(ttl));
        });
        return created.get();
    }

    @Override
    public boolean compareAndSet(String key, String expected, String newValue) {
        AtomicBoolean swapped = new AtomicBoolean(false);
        entries.compute(key, (k, current) -> {
            Entry live = current != null && !current.isExpired(clock.instant()) ? current : null;
            String currentValue = live == null ? null : live.value();
            if (!Objects.equals(currentValue, expected)) {
                return live;
            }
            swapped.set(true);
            return new Entry(newValue, null);
        });
        return swapped.get();
    }

    @Override
    public boolean delete(String key) {
        Entry removed = entries.remove(key);
        return removed != null && !removed.isExpired(clock.instant());
    }

    @Override
    public List<String> keys(String prefix) {
        Instant now = clock.instant();
        return entries.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix))
                .filter(e -> !e.getValue().isExpired(now))
                .map(java.util.Map.Entry::getKey)
                .toList();
    }

    /**
     * Remaining time to live, empty when the key is absent or has no expiry.
     */
    public Optional<Duration> ttl(String key) {
        Entry entry = live(key);
        if (entry == null || entry.expiresAt() == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(clock.instant(), entry.expiresAt()));
    }

    private Entry live(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return null;
        }
        return entry;
    }

    private Instant expiryFor(Duration ttl) {
        return ttl == null ? null : clock.instant().plus(ttl);
    }

    private record Entry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
