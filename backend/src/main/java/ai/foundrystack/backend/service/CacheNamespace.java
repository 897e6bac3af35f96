package ai.foundrystack.backend.service;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Key spaces of the cache. Each namespace owns a key prefix and a default time-to-live.
 */
public enum CacheNamespace {
    BLUEPRINT("blueprint:", Duration.ofMinutes(5)),
    PIPELINE("pipeline:", Duration.ofMinutes(5)),
    RATE_LIMIT("rate_limit:", Duration.ofHours(1)),
    SESSION("session:", Duration.ofDays(1)),
    DRAFT("draft:", Duration.ofDays(7));

    private final String prefix;
    private final Duration defaultTtl;

    CacheNamespace(String prefix, Duration defaultTtl) {
        this.prefix = prefix;
        this.defaultTtl = defaultTtl;
    }

    public String getPrefix() {
        return prefix;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    /**
     * Name used by the admin API, e.g. "blueprint" or "rate_limit".
     */
    public String getTypeName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String key(String suffix) {
        return prefix + suffix;
    }

    public String pattern() {
        return prefix + "*";
    }

    public static Optional<CacheNamespace> fromTypeName(String typeName) {
        if (typeName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(ns -> ns.getTypeName().equalsIgnoreCase(typeName.trim()))
                .findFirst();
    }
}
