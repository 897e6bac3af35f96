package ai.foundrystack.backend.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives pipeline cache keys from model prompts.
 *
 * Keys are the SHA-256 of the salted, whitespace-normalized prompt, so prompt text never
 * appears in the cache key space and equivalent prompts share an entry.
 */
@Component
public class CacheKeyGenerator {

    private static final String CACHE_KEY_PREFIX = CacheNamespace.PIPELINE.getPrefix();

    private final String salt;

    public CacheKeyGenerator(@Value("${app.cache.key-salt:foundry-stack}") String salt) {
        this.salt = salt;
    }

    /**
     * Keys a prompt together with the temperature it is sampled at.
     *
     * @param content prompt content to key
     * @param temperature sampling temperature of the call
     * @return {@code pipeline:} followed by 64 lowercase hex characters
     * @throws IllegalArgumentException if content is null or blank
     */
    public String generateCacheKey(String content, double temperature) {
        if (content == null || content.trim().isEmpty()) {
            throw new IllegalArgumentException("Cache key content must not be null or blank");
        }
        return CACHE_KEY_PREFIX + sha256(salt + ":" + temperature + ":" + normalize(content));
    }

    private static String normalize(String content) {
        return content.trim().replaceAll("\\s+", " ");
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
