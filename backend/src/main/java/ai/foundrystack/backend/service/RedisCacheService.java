package ai.foundrystack.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.serializer.GenericToStringSerializer;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-based implementation of CacheService.
 * Expiry is delegated to Redis. Increments run as one Lua script so a counter never exists without a TTL.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "spring.data.redis.enabled", havingValue = "true", matchIfMissing = true)
public class RedisCacheService implements CacheService {

    /**
     * INCRBY, then PEXPIRE only when the key carries no expiry yet.
     */
    static final RedisScript<Long> INCREMENT_SCRIPT = new DefaultRedisScript<>(
            "local value = redis.call('INCRBY', KEYS[1], ARGV[1])\n"
                    + "if redis.call('PTTL', KEYS[1]) < 0 then\n"
                    + "  redis.call('PEXPIRE', KEYS[1], ARGV[2])\n"
                    + "end\n"
                    + "return value",
            Long.class);

    private static final RedisSerializer<String> ARGS_SERIALIZER = new StringRedisSerializer();
    private static final RedisSerializer<Long> RESULT_SERIALIZER = new GenericToStringSerializer<>(Long.class);

    private final RedisTemplate<String, Object> redisTemplate;
    private final ObjectMapper objectMapper;

    @Autowired
    public RedisCacheService(RedisTemplate<String, Object> redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.findAndRegisterModules();
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            Object value = redisTemplate.opsForValue().get(key);
            if (value == null) {
                return Optional.empty();
            }
            if (type.isInstance(value)) {
                return Optional.of(type.cast(value));
            }
            return Optional.of(objectMapper.convertValue(value, type));
        } catch (IllegalArgumentException e) {
            log.warn("Cached value under {} could not be converted to {}: {}", key, type.getSimpleName(), e.getMessage());
            return Optional.empty();
        } catch (Exception e) {
            throw new CacheServiceException("Failed to read cache key " + key, e);
        }
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        requirePositive(ttl);
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
            log.debug("Cached {} for {}s", key, ttl.toSeconds());
        } catch (Exception e) {
            throw new CacheServiceException("Failed to write cache key " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(key));
        } catch (Exception e) {
            throw new CacheServiceException("Failed to delete cache key " + key, e);
        }
    }

    @Override
    public long increment(String key, long delta, Duration ttlOnCreate) {
        requirePositive(ttlOnCreate);
        try {
            Long value = redisTemplate.execute(INCREMENT_SCRIPT, ARGS_SERIALIZER, RESULT_SERIALIZER,
                    Collections.singletonList(key), String.valueOf(delta), String.valueOf(ttlOnCreate.toMillis()));
            if (value == null) {
                throw new CacheServiceException("Increment returned no value for " + key);
            }
            return value;
        } catch (CacheServiceException e) {
            throw e;
        } catch (Exception e) {
            throw new CacheServiceException("Failed to increment cache key " + key, e);
        }
    }

    @Override
    public Set<String> keys(String pattern) {
        try {
            Set<String> keys = redisTemplate.keys(pattern);
            return keys != null ? keys : Collections.emptySet();
        } catch (Exception e) {
            throw new CacheServiceException("Failed to list keys for pattern " + pattern, e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(key));
        } catch (Exception e) {
            throw new CacheServiceException("Failed to check cache key " + key, e);
        }
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache entries require a positive TTL");
        }
    }
}
