package ai.foundrystack.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheWarmupResponse {

    private String status;

    private List<WarmupResult> results;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WarmupResult {

        private String blueprintId;

        /**
         * already_cached, would_cache or error
         */
        private String status;
    }
}
