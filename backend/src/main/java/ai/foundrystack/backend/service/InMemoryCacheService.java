package ai.foundrystack.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * In-process CacheService used when Redis is disabled (local development, tests).
 * Expired entries behave as misses and are dropped lazily on access and by a periodic sweep.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "spring.data.redis.enabled", havingValue = "false")
public class InMemoryCacheService implements CacheService {

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ObjectMapper objectMapper;

    @Autowired
    public InMemoryCacheService(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.findAndRegisterModules();
        log.info("Redis disabled, using in-memory cache");
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = liveEntry(key);
        if (entry == null) {
            return Optional.empty();
        }
        Object value = entry.value;
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        try {
            return Optional.of(objectMapper.convertValue(value, type));
        } catch (IllegalArgumentException e) {
            log.warn("Cached value under {} could not be converted to {}: {}", key, type.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        requirePositive(ttl);
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public boolean delete(String key) {
        Entry removed = entries.remove(key);
        return removed != null && !removed.isExpired(clock.instant());
    }

    @Override
    public long increment(String key, long delta, Duration ttlOnCreate) {
        requirePositive(ttlOnCreate);
        Instant now = clock.instant();
        Entry updated = entries.compute(key, (k, current) -> {
            if (current == null || current.isExpired(now)) {
                return new Entry(delta, now.plus(ttlOnCreate));
            }
            if (!(current.value instanceof Number)) {
                throw new CacheServiceException("Value under " + key + " is not a counter");
            }
            return new Entry(((Number) current.value).longValue() + delta, current.expiresAt);
        });
        return ((Number) updated.value).longValue();
    }

    @Override
    public Set<String> keys(String pattern) {
        Pattern regex = globToRegex(pattern);
        Instant now = clock.instant();
        return entries.entrySet().stream()
                .filter(e -> !e.getValue().isExpired(now))
                .map(Map.Entry::getKey)
                .filter(k -> regex.matcher(k).matches())
                .collect(Collectors.toSet());
    }

    @Override
    public boolean exists(String key) {
        return liveEntry(key) != null;
    }

    /**
     * Periodically drops expired entries so the map does not grow with dead keys.
     *
     * @return number of entries removed
     */
    @Scheduled(fixedDelayString = "${app.cache.eviction-interval-ms:60000}")
    public int evictExpired() {
        Instant now = clock.instant();
        AtomicInteger removed = new AtomicInteger();
        entries.forEach((key, entry) -> {
            if (entry.isExpired(now) && entries.remove(key, entry)) {
                removed.incrementAndGet();
            }
        });
        if (removed.get() > 0) {
            log.debug("Evicted {} expired cache entries", removed.get());
        }
        return removed.get();
    }

    private Entry liveEntry(String key) {
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

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*':
                    regex.append(".*");
                    break;
                case '?':
                    regex.append('.');
                    break;
                case '\\':
                    if (i + 1 < glob.length()) {
                        regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
                    }
                    break;
                default:
                    regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache entries require a positive TTL");
        }
    }

    private static final class Entry {
        private final Object value;
        private final Instant expiresAt;

        private Entry(Object value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
