package ai.foundrystack.backend.service;

import ai.foundrystack.backend.model.dto.BlueprintView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCacheServiceTest {

    private TestClock clock;
    private InMemoryCacheService cacheService;

    @BeforeEach
    void setUp() {
        clock = new TestClock(Instant.parse("2024-01-01T10:00:00Z"));
        cacheService = new InMemoryCacheService(clock);
    }

    @Test
    @DisplayName("Should return a value before its TTL and miss after it")
    void shouldExpireEntries() {
        cacheService.set("blueprint:1", "value", Duration.ofSeconds(300));

        clock.advance(Duration.ofSeconds(299));
        assertThat(cacheService.get("blueprint:1", String.class)).contains("value");

        clock.advance(Duration.ofSeconds(1));
        assertThat(cacheService.get("blueprint:1", String.class)).isEmpty();
        assertThat(cacheService.exists("blueprint:1")).isFalse();
    }

    @Test
    void readsShouldNotExtendExpiry() {
        cacheService.set("session:abc", "s", Duration.ofSeconds(10));

        for (int i = 0; i < 9; i++) {
            clock.advance(Duration.ofSeconds(1));
            cacheService.get("session:abc", String.class);
        }
        clock.advance(Duration.ofSeconds(1));

        assertThat(cacheService.get("session:abc", String.class)).isEmpty();
    }

    @Test
    void shouldRejectNonPositiveTtl() {
        assertThatThrownBy(() -> cacheService.set("draft:1", "x", Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cacheService.set("draft:1", "x", Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cacheService.set("draft:1", "x", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deleteShouldBeIdempotent() {
        cacheService.set("blueprint:1", "value", Duration.ofMinutes(1));

        assertThat(cacheService.delete("blueprint:1")).isTrue();
        assertThat(cacheService.delete("blueprint:1")).isFalse();
        assertThat(cacheService.delete("never-existed")).isFalse();
    }

    @Test
    @DisplayName("Increment should create the key with its TTL and keep that TTL afterwards")
    void incrementShouldSetTtlOnCreate() {
        assertThat(cacheService.increment("rate_limit:user:1", 1, Duration.ofSeconds(60))).isEqualTo(1);
        clock.advance(Duration.ofSeconds(30));
        assertThat(cacheService.increment("rate_limit:user:1", 2, Duration.ofSeconds(60))).isEqualTo(3);

        clock.advance(Duration.ofSeconds(30));
        assertThat(cacheService.exists("rate_limit:user:1")).isFalse();
        assertThat(cacheService.increment("rate_limit:user:1", 1, Duration.ofSeconds(60))).isEqualTo(1);
    }

    @Test
    void concurrentIncrementsShouldNotLoseUpdates() throws Exception {
        int threads = 8;
        int incrementsPerThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startSignal = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            executor.execute(() -> {
                try {
                    startSignal.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < incrementsPerThread; i++) {
                    cacheService.increment("rate_limit:hot", 1, Duration.ofMinutes(1));
                }
            });
        }

        startSignal.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(cacheService.increment("rate_limit:hot", 0, Duration.ofMinutes(1)))
                .isEqualTo((long) threads * incrementsPerThread);
    }

    @Test
    void keysShouldMatchGlobAndSkipExpired() {
        cacheService.set("blueprint:1", "a", Duration.ofSeconds(10));
        cacheService.set("blueprint:2", "b", Duration.ofSeconds(100));
        cacheService.set("pipeline:abc", "c", Duration.ofSeconds(100));

        clock.advance(Duration.ofSeconds(10));

        assertThat(cacheService.keys("blueprint:*")).containsExactly("blueprint:2");
        assertThat(cacheService.keys("*")).containsExactlyInAnyOrder("blueprint:2", "pipeline:abc");
        assertThat(cacheService.keys("pipeline:a?c")).containsExactly("pipeline:abc");
    }

    @Test
    void globShouldTreatRegexCharactersLiterally() {
        cacheService.set("draft:a.b", "x", Duration.ofSeconds(10));
        cacheService.set("draft:axb", "y", Duration.ofSeconds(10));

        assertThat(cacheService.keys("draft:a.b")).containsExactly("draft:a.b");
    }

    @Test
    void getShouldConvertMapsToRequestedType() {
        cacheService.set("blueprint:1", Map.of("id", "1", "title", "Test"), Duration.ofSeconds(10));

        assertThat(cacheService.get("blueprint:1", BlueprintView.class))
                .hasValueSatisfying(view -> assertThat(view.getTitle()).isEqualTo("Test"));
    }

    @Test
    void evictExpiredShouldRemoveDeadEntries() {
        cacheService.set("blueprint:1", "a", Duration.ofSeconds(10));
        cacheService.set("blueprint:2", "b", Duration.ofSeconds(100));
        clock.advance(Duration.ofSeconds(20));

        assertThat(cacheService.evictExpired()).isEqualTo(1);
        assertThat(cacheService.keys("*")).containsExactly("blueprint:2");
    }
}
