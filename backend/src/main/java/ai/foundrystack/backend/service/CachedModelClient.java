package ai.foundrystack.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Caching decorator around the Gemini client.
 *
 * Completions are stored in the pipeline namespace under a hash of prompt and temperature.
 * Any cache failure falls back to the uncached call; provider failures are never cached.
 */
@Slf4j
@Service
@Primary
@ConditionalOnProperty(name = "app.model.cache.enabled", havingValue = "true", matchIfMissing = true)
public class CachedModelClient implements ModelClient {

    private final GeminiModelClient delegateClient;
    private final CacheKeyGenerator cacheKeyGenerator;
    private final CacheService cacheService;
    private final Duration cacheTtl;

    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter cacheErrorCounter;
    private final Timer modelCallTimer;

    @Autowired
    public CachedModelClient(
            GeminiModelClient delegateClient,
            CacheKeyGenerator cacheKeyGenerator,
            CacheService cacheService,
            MeterRegistry meterRegistry,
            @Value("${app.model.cache.ttl-seconds:300}") long cacheTtlSeconds) {
        this.delegateClient = delegateClient;
        this.cacheKeyGenerator = cacheKeyGenerator;
        this.cacheService = cacheService;
        this.cacheTtl = Duration.ofSeconds(cacheTtlSeconds);

        this.cacheHitCounter = Counter.builder("model_cache_operations_total")
                .description("Model completion cache operations")
                .tag("operation", "hit")
                .register(meterRegistry);
        this.cacheMissCounter = Counter.builder("model_cache_operations_total")
                .description("Model completion cache operations")
                .tag("operation", "miss")
                .register(meterRegistry);
        this.cacheErrorCounter = Counter.builder("model_cache_operations_total")
                .description("Model completion cache operations")
                .tag("operation", "error")
                .register(meterRegistry);
        this.modelCallTimer = Timer.builder("model_call_duration_seconds")
                .description("Duration of uncached model calls")
                .tag("provider", delegateClient.getProviderName())
                .register(meterRegistry);

        log.info("CachedModelClient initialized - TTL: {}s", cacheTtlSeconds);
    }

    @Override
    public String complete(String prompt, double temperature) {
        String cacheKey = null;
        try {
            cacheKey = cacheKeyGenerator.generateCacheKey(prompt, temperature);
            Optional<String> cached = cacheService.get(cacheKey, String.class);
            if (cached.isPresent() && !cached.get().isBlank()) {
                cacheHitCounter.increment();
                log.debug("Model cache hit for key {}...", cacheKey.substring(0, Math.min(20, cacheKey.length())));
                return cached.get();
            }
        } catch (RuntimeException e) {
            cacheErrorCounter.increment();
            log.warn("Model cache lookup failed, calling provider directly: {}", e.getMessage());
        }

        cacheMissCounter.increment();
        String result = modelCallTimer.record(() -> delegateClient.complete(prompt, temperature));

        if (cacheKey != null && result != null && !result.isBlank()) {
            try {
                cacheService.set(cacheKey, result, cacheTtl);
            } catch (RuntimeException e) {
                cacheErrorCounter.increment();
                log.warn("Failed to store model completion in cache: {}", e.getMessage());
            }
        }
        return result;
    }

    @Override
    public String getProviderName() {
        return delegateClient.getProviderName();
    }

    @Override
    public void invalidate(String prompt, double temperature) {
        try {
            cacheService.delete(cacheKeyGenerator.generateCacheKey(prompt, temperature));
        } catch (RuntimeException e) {
            cacheErrorCounter.increment();
            log.warn("Failed to invalidate cached model completion: {}", e.getMessage());
        }
    }
}
