package ai.foundrystack.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response returned immediately after a generation job has been queued
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private String blueprintId;

    private String jobId;

    private JobData.JobStatus status;

    private Instant createdAt;

    /**
     * URL to poll for job status
     */
    private String statusUrl;

    private String message;
}
