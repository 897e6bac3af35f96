package ai.foundrystack.backend.controller;

import ai.foundrystack.backend.model.dto.BlueprintRequest;
import ai.foundrystack.backend.model.dto.BlueprintView;
import ai.foundrystack.backend.model.dto.ErrorResponse;
import ai.foundrystack.backend.model.dto.JobData;
import ai.foundrystack.backend.model.dto.JobResponse;
import ai.foundrystack.backend.model.dto.JobStatusResponse;
import ai.foundrystack.backend.model.dto.QueueStats;
import ai.foundrystack.backend.model.entity.Blueprint;
import ai.foundrystack.backend.service.BlueprintService;
import ai.foundrystack.backend.service.JobService;
import ai.foundrystack.backend.service.RateLimitService;
import ai.foundrystack.backend.service.exception.RateLimitExceededException;
import ai.foundrystack.backend.service.exception.SubjectBusyException;
import ai.foundrystack.backend.util.RequestUtils;

import io.micrometer.core.annotation.Timed;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for blueprint records and their generation jobs.
 * Creating a blueprint returns 202 with a job ID immediately; generation runs in the background.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
public class BlueprintJobController {

    private final BlueprintService blueprintService;
    private final JobService jobService;
    private final RateLimitService rateLimitService;
    private final Clock clock;

    @Autowired
    public BlueprintJobController(BlueprintService blueprintService,
                                  JobService jobService,
                                  RateLimitService rateLimitService,
                                  Clock clock) {
        this.blueprintService = blueprintService;
        this.jobService = jobService;
        this.rateLimitService = rateLimitService;
        this.clock = clock;
    }

    /**
     * Creates a blueprint record and queues its generation.
     *
     * @param jwt the decoded JWT token containing user identity
     * @param request validated title and idea
     * @return 202 with the blueprint and job IDs
     */
    @Timed(value = "http_request_duration_seconds", extraTags = {"endpoint", "/api/v1/blueprints", "operation", "create_blueprint"})
    @PostMapping("/blueprints")
    public ResponseEntity<?> createBlueprint(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody BlueprintRequest request,
            HttpServletRequest httpRequest) {
        String clientId = RequestUtils.resolveClientId(jwt, httpRequest);
        log.info("Received blueprint creation request from {}", clientId);

        try {
            rateLimitService.checkRequest(clientId);

            Blueprint blueprint = blueprintService.createBlueprint(RequestUtils.subjectOf(jwt), request);
            String blueprintId = blueprint.getId().toString();
            String jobId = jobService.createJob(blueprintId);

            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .header("X-RateLimit-Remaining", String.valueOf(rateLimitService.remainingRequests(clientId)))
                    .body(accepted(blueprintId, jobId, "Blueprint created, generation queued"));

        } catch (RateLimitExceededException e) {
            return tooManyRequests(e);
        } catch (JobService.JobServiceException e) {
            log.error("Failed to queue generation for {}: {}", clientId, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ErrorResponse.builder().error("Job processor unavailable").build());
        }
    }

    /**
     * Queues a new generation run for an existing blueprint.
     */
    @PostMapping("/blueprints/{id}/generate")
    public ResponseEntity<?> regenerateBlueprint(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable("id") String id,
            HttpServletRequest httpRequest) {
        String clientId = RequestUtils.resolveClientId(jwt, httpRequest);
        UUID blueprintId = parseId(id);
        if (blueprintId == null) {
            return ResponseEntity.badRequest().body(ErrorResponse.builder().error("Invalid blueprint ID").build());
        }

        try {
            rateLimitService.checkRequest(clientId);
            if (!blueprintService.isOwnedBy(blueprintId, RequestUtils.subjectOf(jwt))) {
                return ResponseEntity.notFound().build();
            }
            String jobId = jobService.createJob(blueprintId.toString());
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(accepted(blueprintId.toString(), jobId, "Generation queued"));

        } catch (RateLimitExceededException e) {
            return tooManyRequests(e);
        } catch (SubjectBusyException e) {
            log.info("Blueprint {} already has active job {}", blueprintId, e.getActiveJobId());
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ErrorResponse.builder()
                            .error("Generation already in progress")
                            .message("Active job: " + e.getActiveJobId())
                            .build());
        } catch (JobService.JobServiceException e) {
            log.error("Failed to queue generation for blueprint {}: {}", blueprintId, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ErrorResponse.builder().error("Job processor unavailable").build());
        }
    }

    @GetMapping("/blueprints")
    public ResponseEntity<List<BlueprintView>> listBlueprints(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(blueprintService.findByOwner(RequestUtils.subjectOf(jwt)));
    }

    /**
     * Blueprints of other users are reported as 404 so their IDs cannot be probed.
     */
    @GetMapping("/blueprints/{id}")
    public ResponseEntity<BlueprintView> getBlueprint(@AuthenticationPrincipal Jwt jwt, @PathVariable("id") String id) {
        UUID blueprintId = parseId(id);
        if (blueprintId == null) {
            return ResponseEntity.badRequest().build();
        }
        return blueprintService.findOwned(blueprintId, RequestUtils.subjectOf(jwt))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Status of the most recent generation job of a blueprint.
     */
    @GetMapping("/blueprints/{id}/job")
    public ResponseEntity<JobStatusResponse> getBlueprintJob(@AuthenticationPrincipal Jwt jwt, @PathVariable("id") String id) {
        UUID blueprintId = parseId(id);
        if (blueprintId == null || !blueprintService.isOwnedBy(blueprintId, RequestUtils.subjectOf(jwt))) {
            return ResponseEntity.notFound().build();
        }
        return jobService.getJobBySubject(blueprintId.toString())
                .map(JobStatusResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobStatusResponse> getJobStatus(@AuthenticationPrincipal Jwt jwt, @PathVariable("jobId") String jobId) {
        String owner = RequestUtils.subjectOf(jwt);
        return jobService.getJob(jobId)
                .filter(job -> ownsSubject(job.getSubjectId(), owner))
                .map(JobStatusResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/jobs/stats")
    public ResponseEntity<QueueStats> getQueueStats() {
        return ResponseEntity.ok(jobService.getQueueStats());
    }

    private JobResponse accepted(String blueprintId, String jobId, String message) {
        return JobResponse.builder()
                .blueprintId(blueprintId)
                .jobId(jobId)
                .status(JobData.JobStatus.PENDING)
                .createdAt(clock.instant())
                .statusUrl("/api/v1/jobs/" + jobId)
                .message(message)
                .build();
    }

    private ResponseEntity<ErrorResponse> tooManyRequests(RateLimitExceededException e) {
        long retryAfter = Math.max(1, Duration.between(clock.instant(), e.getResetAt()).toSeconds());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header("Retry-After", String.valueOf(retryAfter))
                .body(ErrorResponse.builder()
                        .error("Rate limit exceeded")
                        .message("Try again in " + retryAfter + " seconds")
                        .build());
    }

    private boolean ownsSubject(String subjectId, String owner) {
        UUID blueprintId = subjectId != null ? parseId(subjectId) : null;
        return blueprintId != null && blueprintService.isOwnedBy(blueprintId, owner);
    }

    private static UUID parseId(String id) {
        try {
            return UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
