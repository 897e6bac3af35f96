package ai.foundrystack.backend.service;

import ai.foundrystack.backend.model.dto.CacheClearResponse;
import ai.foundrystack.backend.model.dto.CacheStatsResponse;
import ai.foundrystack.backend.model.dto.CacheWarmupResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CacheAdminServiceTest {

    private InMemoryCacheService cacheService;
    private CacheAdminService adminService;

    @BeforeEach
    void setUp() {
        TestClock clock = new TestClock(Instant.parse("2024-01-01T10:00:00Z"));
        cacheService = new InMemoryCacheService(clock);
        adminService = new CacheAdminService(cacheService, clock, List.of("mock-1", "mock-2", "mock-3"));
    }

    @Test
    void statsShouldCountKeysPerNamespace() {
        for (int i = 0; i < 12; i++) {
            cacheService.set("blueprint:" + i, "b" + i, Duration.ofMinutes(5));
        }
        cacheService.set("pipeline:abc", "p", Duration.ofMinutes(5));

        CacheStatsResponse stats = adminService.getStats();

        CacheStatsResponse.NamespaceStats blueprints = stats.getNamespaces().get("blueprint");
        assertThat(blueprints.getCount()).isEqualTo(12);
        assertThat(blueprints.getKeys()).hasSize(10);
        assertThat(blueprints.isHasMore()).isTrue();
        assertThat(stats.getNamespaces().get("pipeline").getCount()).isEqualTo(1);
        assertThat(stats.getNamespaces().get("draft").getCount()).isZero();
        assertThat(stats.getTotalKeys()).isEqualTo(13);
    }

    @Test
    @DisplayName("Clearing an empty namespace should report zero cleared keys")
    void clearEmptyNamespaceShouldReportZero() {
        CacheClearResponse response = adminService.clearNamespace(CacheNamespace.PIPELINE);

        assertThat(response.getStatus()).isEqualTo("success");
        assertThat(response.getCleared()).isZero();
        assertThat(response.getTotal()).isZero();
    }

    @Test
    void clearNamespaceShouldOnlyTouchThatNamespace() {
        cacheService.set("pipeline:a", "1", Duration.ofMinutes(5));
        cacheService.set("pipeline:b", "2", Duration.ofMinutes(5));
        cacheService.set("blueprint:1", "3", Duration.ofMinutes(5));

        CacheClearResponse response = adminService.clearNamespace(CacheNamespace.PIPELINE);

        assertThat(response.getCleared()).isEqualTo(2);
        assertThat(response.getTotal()).isEqualTo(2);
        assertThat(cacheService.keys("pipeline:*")).isEmpty();
        assertThat(cacheService.exists("blueprint:1")).isTrue();
    }

    @Test
    void clearAllShouldReportTotal() {
        cacheService.set("pipeline:a", "1", Duration.ofMinutes(5));
        cacheService.set("session:s", "2", Duration.ofMinutes(5));

        CacheClearResponse response = adminService.clearAll();

        assertThat(response.getCleared()).isEqualTo(2);
        assertThat(response.getTotal()).isEqualTo(2);
        assertThat(cacheService.keys("*")).isEmpty();
    }

    @Test
    void clearAllShouldRemoveKeysOutsideKnownNamespaces() {
        cacheService.set("blueprint:1", "b", Duration.ofMinutes(5));
        cacheService.set("user:42", "u", Duration.ofMinutes(5));

        CacheClearResponse response = adminService.clearAll();

        assertThat(response.getCleared()).isEqualTo(2);
        assertThat(response.getTotal()).isEqualTo(2);
        assertThat(cacheService.keys("*")).isEmpty();
    }

    @Test
    void clearAllShouldReportMatchedKeysSeparatelyFromDeleted() {
        CacheService racing = mock(CacheService.class);
        when(racing.keys("*")).thenReturn(Set.of("blueprint:1", "user:42"));
        when(racing.delete("blueprint:1")).thenReturn(true);
        when(racing.delete("user:42")).thenReturn(false);
        CacheAdminService service = new CacheAdminService(racing, new TestClock(Instant.now()), List.of());

        CacheClearResponse response = service.clearAll();

        assertThat(response.getCleared()).isEqualTo(1);
        assertThat(response.getTotal()).isEqualTo(2);
    }

    @Test
    void deleteKeyShouldReportMissingKey() {
        cacheService.set("draft:d1", "x", Duration.ofMinutes(5));

        assertThat(adminService.deleteKey("draft:d1").getCleared()).isEqualTo(1);
        assertThat(adminService.deleteKey("draft:d1").getCleared()).isZero();
    }

    @Test
    void warmupShouldReportCacheStatePerBlueprint() {
        cacheService.set("blueprint:mock-1", "cached", Duration.ofMinutes(5));

        CacheWarmupResponse response = adminService.warmup();

        assertThat(response.getResults())
                .extracting(CacheWarmupResponse.WarmupResult::getBlueprintId, CacheWarmupResponse.WarmupResult::getStatus)
                .containsExactly(
                        tuple("mock-1", "already_cached"),
                        tuple("mock-2", "would_cache"),
                        tuple("mock-3", "would_cache"));
    }

    @Test
    void warmupShouldReportErrorsPerBlueprint() {
        CacheService failing = mock(CacheService.class);
        when(failing.exists(anyString())).thenThrow(new CacheService.CacheServiceException("down"));
        CacheAdminService service = new CacheAdminService(failing, new TestClock(Instant.now()), List.of("mock-1"));

        CacheWarmupResponse response = service.warmup();

        assertThat(response.getResults()).singleElement()
                .extracting(CacheWarmupResponse.WarmupResult::getStatus)
                .isEqualTo("error");
    }
}
