package ai.foundrystack.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Polling view of a job. The partial context of a failed job is deliberately not part of it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {

    private String jobId;

    private String subjectId;

    private JobData.JobStatus status;

    private int progress;

    private String currentStep;

    private String error;

    /**
     * Only populated once the job has COMPLETED
     */
    private Map<String, Object> result;

    private Instant createdAt;

    private Instant updatedAt;

    public static JobStatusResponse from(JobData job) {
        return JobStatusResponse.builder()
                .jobId(job.getJobId())
                .subjectId(job.getSubjectId())
                .status(job.getStatus())
                .progress(job.getProgress())
                .currentStep(job.getCurrentStep())
                .error(job.getStatus() == JobData.JobStatus.FAILED ? job.getError() : null)
                .result(job.getStatus() == JobData.JobStatus.COMPLETED ? job.getResult() : null)
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .build();
    }
}
