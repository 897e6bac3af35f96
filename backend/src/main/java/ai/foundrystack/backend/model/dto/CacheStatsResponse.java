package ai.foundrystack.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Key counts per cache namespace
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatsResponse {

    private Map<String, NamespaceStats> namespaces;

    private long totalKeys;

    private Instant timestamp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NamespaceStats {

        private long count;

        /**
         * Sample of at most ten keys
         */
        private List<String> keys;

        private boolean hasMore;
    }
}
