package ai.foundrystack.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of a generation job held by the job processor.
 * Every mutation produces a new snapshot via toBuilder(), so a reader never observes a half-applied update.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobData {

    /**
     * Unique job identifier (UUID)
     */
    private String jobId;

    /**
     * Identifier of the blueprint record this job populates
     */
    private String subjectId;

    /**
     * Current job status
     */
    private JobStatus status;

    /**
     * Progress percentage (0-100), never decreases while the job is processing
     */
    @Builder.Default
    private int progress = 0;

    /**
     * Human-readable label of the active stage
     */
    private String currentStep;

    /**
     * Short error message, present only when FAILED
     */
    private String error;

    /**
     * Assembled chain output, present only when COMPLETED
     */
    private Map<String, Object> result;

    /**
     * Context accumulated by the agents that succeeded before a failure (diagnostics only)
     */
    private Map<String, Object> partialResult;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant startedAt;

    private Instant completedAt;

    /**
     * Job processing status
     */
    public enum JobStatus {
        PENDING("pending"),
        PROCESSING("processing"),
        COMPLETED("completed"),
        FAILED("failed");

        private final String value;

        JobStatus(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }
    }
}
