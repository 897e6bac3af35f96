package ai.foundrystack.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinanceStrategyResponse {

    private boolean success;

    /**
     * Merged output of the finance agent chain, keyed by the fields each agent produced
     */
    private Map<String, Object> strategy;

    /**
     * Share of the profile that was filled in (0.0 - 1.0)
     */
    private double dataCompleteness;

    private Instant generatedAt;

    private long processingTimeMs;

    /**
     * Free generations left for the caller, absent when the trial counter could not be updated
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Integer remainingTrials;
}
