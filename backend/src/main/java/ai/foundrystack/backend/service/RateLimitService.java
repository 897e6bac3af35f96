package ai.foundrystack.backend.service;

import ai.foundrystack.backend.service.exception.RateLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Owns the two rate limiters of the service:
 * - request: bounds how many generation requests a client may submit per window
 * - model: bounds how many calls the agent chains may send to the model provider per window
 *
 * Rejections are also counted in the rate_limit cache namespace for diagnostics; failures of
 * that counter never affect the limiting decision.
 */
@Slf4j
@Service
public class RateLimitService {

    private final SlidingWindowRateLimiter requestLimiter;
    private final SlidingWindowRateLimiter modelLimiter;
    private final CacheService cacheService;

    @Autowired
    public RateLimitService(
            CacheService cacheService,
            Clock clock,
            @Value("${app.ratelimit.requests.max:5}") int maxRequests,
            @Value("${app.ratelimit.requests.window-seconds:60}") long requestWindowSeconds,
            @Value("${app.ratelimit.model.max:60}") int maxModelCalls,
            @Value("${app.ratelimit.model.window-seconds:60}") long modelWindowSeconds) {
        this(cacheService,
                new SlidingWindowRateLimiter(maxRequests, Duration.ofSeconds(requestWindowSeconds), clock),
                new SlidingWindowRateLimiter(maxModelCalls, Duration.ofSeconds(modelWindowSeconds), clock));
    }

    RateLimitService(CacheService cacheService,
                     SlidingWindowRateLimiter requestLimiter,
                     SlidingWindowRateLimiter modelLimiter) {
        this.cacheService = cacheService;
        this.requestLimiter = requestLimiter;
        this.modelLimiter = modelLimiter;
        log.info("Rate limits: {} requests per {}s, {} model calls per {}s",
                requestLimiter.getMaxRequests(), requestLimiter.getWindow().toSeconds(),
                modelLimiter.getMaxRequests(), modelLimiter.getWindow().toSeconds());
    }

    /**
     * Admits a client request or throws.
     *
     * @param clientId client identifier (user or address)
     * @throws RateLimitExceededException when the client exhausted its window
     */
    public void checkRequest(String clientId) {
        if (!requestLimiter.isAllowed(clientId)) {
            log.warn("Request rate limit exceeded for client {}", clientId);
            recordRejection("requests", clientId);
            throw new RateLimitExceededException(clientId, requestLimiter.resetAt(clientId));
        }
    }

    public int remainingRequests(String clientId) {
        return requestLimiter.remaining(clientId);
    }

    /**
     * Reserves one model call for the provider.
     *
     * @return false when the provider budget for the current window is used up
     */
    public boolean tryAcquireModelCall(String provider) {
        String identifier = "model:" + provider;
        if (modelLimiter.isAllowed(identifier)) {
            return true;
        }
        log.warn("Model rate limit reached for provider {}", provider);
        recordRejection("model", provider);
        return false;
    }

    @Scheduled(fixedDelayString = "${app.ratelimit.sweep-interval-ms:60000}")
    public void sweep() {
        int removed = requestLimiter.sweep() + modelLimiter.sweep();
        if (removed > 0) {
            log.debug("Removed {} idle rate limit windows", removed);
        }
    }

    private void recordRejection(String scope, String identifier) {
        try {
            cacheService.increment(CacheNamespace.RATE_LIMIT.key(identifier + ":" + scope), 1,
                    CacheNamespace.RATE_LIMIT.getDefaultTtl());
        } catch (Exception e) {
            log.warn("Failed to record rate limit rejection for {}: {}", identifier, e.getMessage());
        }
    }
}
