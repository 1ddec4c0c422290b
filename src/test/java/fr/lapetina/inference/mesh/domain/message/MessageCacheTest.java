package fr.lapetina.inference.mesh.domain.message;

import fr.lapetina.inference.mesh.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MessageCacheTest {

    private final MutableClock clock = new MutableClock();
    private final MessageCache cache = new MessageCache(clock);

    @Test
    @DisplayName("should report an id as new only the first time")
    void shouldDetectDuplicates() {
        assertThat(cache.markSeen("m-1")).isTrue();
        assertThat(cache.markSeen("m-1")).isFalse();
        assertThat(cache.contains("m-1")).isTrue();
        assertThat(cache.contains("m-2")).isFalse();
    }

    @Test
    @DisplayName("should purge only ids older than the max age")
    void shouldPurgeOldIds() {
        cache.markSeen("old");
        clock.advance(Duration.ofMinutes(59));
        cache.markSeen("recent");
        clock.advance(Duration.ofMinutes(2));

        int removed = cache.purgeOlderThan(Duration.ofHours(1));

        assertThat(removed).isEqualTo(1);
        assertThat(cache.contains("old")).isFalse();
        assertThat(cache.contains("recent")).isTrue();
        assertThat(cache.size()).isEqualTo(1);
    }
}
