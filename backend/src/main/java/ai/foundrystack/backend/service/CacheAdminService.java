package ai.foundrystack.backend.service;

import ai.foundrystack.backend.model.dto.CacheClearResponse;
import ai.foundrystack.backend.model.dto.CacheStatsResponse;
import ai.foundrystack.backend.model.dto.CacheWarmupResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Administrative operations over the cache: per-namespace statistics, targeted and bulk
 * invalidation, and the warmup check for frequently read blueprints.
 *
 * Bulk clears list the keys first and then delete them one by one; a concurrent write may
 * survive a clear.
 */
@Slf4j
@Service
public class CacheAdminService {

    private static final int SAMPLE_SIZE = 10;

    private final CacheService cacheService;
    private final Clock clock;
    private final List<String> warmupBlueprintIds;

    @Autowired
    public CacheAdminService(CacheService cacheService,
                             Clock clock,
                             @Value("${app.cache.warmup.blueprint-ids:}") List<String> warmupBlueprintIds) {
        this.cacheService = cacheService;
        this.clock = clock;
        this.warmupBlueprintIds = warmupBlueprintIds;
    }

    public CacheStatsResponse getStats() {
        Map<String, CacheStatsResponse.NamespaceStats> namespaces = new LinkedHashMap<>();
        long total = 0;
        for (CacheNamespace namespace : CacheNamespace.values()) {
            Set<String> keys = cacheService.keys(namespace.pattern());
            List<String> sample = keys.stream().sorted().limit(SAMPLE_SIZE).collect(Collectors.toList());
            namespaces.put(namespace.getTypeName(), CacheStatsResponse.NamespaceStats.builder()
                    .count(keys.size())
                    .keys(sample)
                    .hasMore(keys.size() > SAMPLE_SIZE)
                    .build());
            total += keys.size();
        }
        return CacheStatsResponse.builder()
                .namespaces(namespaces)
                .totalKeys(total)
                .timestamp(clock.instant())
                .build();
    }

    public CacheClearResponse deleteKey(String key) {
        boolean deleted = cacheService.delete(key);
        log.info("Cache key {} {}", key, deleted ? "deleted" : "was not present");
        return CacheClearResponse.builder()
                .status("success")
                .message(deleted ? "Deleted key " + key : "Key " + key + " not found")
                .cleared(deleted ? 1 : 0)
                .build();
    }

    public CacheClearResponse clearNamespace(CacheNamespace namespace) {
        Set<String> keys = cacheService.keys(namespace.pattern());
        long cleared = deleteAll(keys);
        log.info("Cleared {} of {} keys from cache namespace {}", cleared, keys.size(), namespace.getTypeName());
        return CacheClearResponse.builder()
                .status("success")
                .message("Cleared " + cleared + " " + namespace.getTypeName() + " entries")
                .cleared(cleared)
                .total((long) keys.size())
                .build();
    }

    /**
     * Deletes every key in the cache, including keys outside the known namespaces.
     * {@code total} is the number of keys matched, {@code cleared} the number actually removed.
     */
    public CacheClearResponse clearAll() {
        Set<String> keys = cacheService.keys("*");
        long cleared = deleteAll(keys);
        log.info("Cleared {} of {} keys from the whole cache", cleared, keys.size());
        return CacheClearResponse.builder()
                .status("success")
                .message("Cleared entire cache")
                .cleared(cleared)
                .total((long) keys.size())
                .build();
    }

    /**
     * Reports, for each configured blueprint, whether it is already cached.
     * Nothing is loaded into the cache here; entries are populated on first read.
     */
    public CacheWarmupResponse warmup() {
        List<CacheWarmupResponse.WarmupResult> results = new ArrayList<>();
        for (String blueprintId : warmupBlueprintIds) {
            if (blueprintId == null || blueprintId.isBlank()) {
                continue;
            }
            String status;
            try {
                status = cacheService.exists(CacheNamespace.BLUEPRINT.key(blueprintId)) ? "already_cached" : "would_cache";
            } catch (Exception e) {
                log.warn("Cache warmup check failed for blueprint {}: {}", blueprintId, e.getMessage());
                status = "error";
            }
            results.add(new CacheWarmupResponse.WarmupResult(blueprintId, status));
        }
        return CacheWarmupResponse.builder()
                .status("success")
                .results(results)
                .build();
    }

    private long deleteAll(Set<String> keys) {
        long cleared = 0;
        for (String key : keys) {
            if (cacheService.delete(key)) {
                cleared++;
            }
        }
        return cleared;
    }
}
