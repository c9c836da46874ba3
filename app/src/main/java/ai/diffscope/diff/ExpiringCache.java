package ai.diffscope.diff;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A map whose entries stop being returned once they are older than a fixed time-to-live. Expired entries are
 * removed lazily on lookup.
 */
public class ExpiringCache<K, V> {
    private record Entry<V>(V value, Instant storedAt) {}

    private final ConcurrentMap<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public ExpiringCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public ExpiringCache(Duration ttl, Clock clock) {
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("TTL cannot be negative: " + ttl);
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<V> get(K key) {
        var entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (clock.instant().isAfter(entry.storedAt().plus(ttl))) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void put(K key, V value) {
        entries.put(key, new Entry<>(value, clock.instant()));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
