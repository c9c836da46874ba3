package ai.diffscope.diff;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ExpiringCacheTest {

    /** Clock the test moves by hand. */
    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneId.of("UTC");
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    void testEntryIsReturnedWithinTtl() {
        var clock = new MutableClock();
        var cache = new ExpiringCache<String, Integer>(Duration.ofSeconds(60), clock);
        cache.put("HEAD:a.txt", 1);

        clock.advance(Duration.ofSeconds(59));

        assertEquals(Optional.of(1), cache.get("HEAD:a.txt"));
    }

    @Test
    void testEntryExpiresAfterTtl() {
        var clock = new MutableClock();
        var cache = new ExpiringCache<String, Integer>(Duration.ofSeconds(60), clock);
        cache.put("HEAD:a.txt", 1);

        clock.advance(Duration.ofSeconds(61));

        assertEquals(Optional.empty(), cache.get("HEAD:a.txt"));
        assertEquals(0, cache.size(), "expired entries are removed on lookup");
    }

    @Test
    void testPutRefreshesTimestamp() {
        var clock = new MutableClock();
        var cache = new ExpiringCache<String, Integer>(Duration.ofSeconds(60), clock);
        cache.put("k", 1);
        clock.advance(Duration.ofSeconds(50));
        cache.put("k", 2);
        clock.advance(Duration.ofSeconds(50));

        assertEquals(Optional.of(2), cache.get("k"));
    }

    @Test
    void testClearDropsEverything() {
        var cache = new ExpiringCache<String, Integer>(Duration.ofSeconds(60));
        cache.put("a", 1);
        cache.put("b", 2);

        cache.clear();

        assertTrue(cache.get("a").isEmpty());
        assertEquals(0, cache.size());
    }
}
