package ai.foundrystack.backend.service;

import ai.foundrystack.backend.model.dto.JobData;
import ai.foundrystack.backend.model.dto.QueueStats;
import ai.foundrystack.backend.service.exception.AgentExecutionException;
import ai.foundrystack.backend.service.exception.SubjectBusyException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory FIFO job processor for blueprint generation.
 *
 * A single drain loop takes jobs off the queue one at a time; submissions made while it runs
 * are only appended. Each job runs on a pipeline thread under a wall-clock budget, and any
 * failure is recorded on that job only. At most one non-terminal job exists per subject.
 *
 * Queue, drain flag and subject leases are guarded by {@code queueLock}. Job snapshots are
 * replaced atomically per job, and a terminal snapshot is never replaced again.
 */
@Slf4j
@Service
public class BlueprintJobProcessor implements JobService {

    private static final int MAX_ERROR_LENGTH = 200;

    private final BlueprintGenerationService generationService;
    private final Clock clock;
    private final Duration maxJobDuration;
    private final Duration retention;

    private final Object queueLock = new Object();
    private final Deque<String> queue = new ArrayDeque<>();
    private final Map<String, String> activeJobBySubject = new HashMap<>();
    private boolean draining = false;
    private boolean running = false;

    private final Map<String, JobData> jobs = new ConcurrentHashMap<>();
    private final Map<String, String> latestJobBySubject = new ConcurrentHashMap<>();

    private ExecutorService drainExecutor;
    private ExecutorService pipelineExecutor;

    private final Counter jobsCreatedCounter;
    private final Counter jobsCompletedCounter;
    private final Counter jobsFailedCounter;

    @Autowired
    public BlueprintJobProcessor(
            BlueprintGenerationService generationService,
            Clock clock,
            MeterRegistry meterRegistry,
            @Value("${app.jobs.max-duration-seconds:300}") long maxDurationSeconds,
            @Value("${app.jobs.retention-hours:24}") long retentionHours) {
        this(generationService, clock, meterRegistry,
                Duration.ofSeconds(maxDurationSeconds), Duration.ofHours(retentionHours));
    }

    BlueprintJobProcessor(BlueprintGenerationService generationService,
                          Clock clock,
                          MeterRegistry meterRegistry,
                          Duration maxJobDuration,
                          Duration retention) {
        this.generationService = generationService;
        this.clock = clock;
        this.maxJobDuration = maxJobDuration;
        this.retention = retention;

        this.jobsCreatedCounter = Counter.builder("blueprint_jobs_total")
                .description("Blueprint generation jobs")
                .tag("outcome", "created")
                .register(meterRegistry);
        this.jobsCompletedCounter = Counter.builder("blueprint_jobs_total")
                .description("Blueprint generation jobs")
                .tag("outcome", "completed")
                .register(meterRegistry);
        this.jobsFailedCounter = Counter.builder("blueprint_jobs_total")
                .description("Blueprint generation jobs")
                .tag("outcome", "failed")
                .register(meterRegistry);
    }

    @PostConstruct
    public void start() {
        synchronized (queueLock) {
            if (running) {
                return;
            }
            drainExecutor = Executors.newSingleThreadExecutor(namedThreads("job-drain"));
            pipelineExecutor = Executors.newCachedThreadPool(namedThreads("job-pipeline"));
            running = true;
        }
        log.info("Blueprint job processor started (max job duration {}s, retention {}h)",
                maxJobDuration.toSeconds(), retention.toHours());
    }

    @PreDestroy
    public void stop() {
        ExecutorService drain;
        ExecutorService pipeline;
        synchronized (queueLock) {
            if (!running) {
                return;
            }
            running = false;
            String jobId;
            while ((jobId = queue.pollFirst()) != null) {
                failJob(jobId, "Job processor stopped before the job started", null);
            }
            drain = drainExecutor;
            pipeline = pipelineExecutor;
        }

        log.info("Stopping blueprint job processor");
        pipeline.shutdownNow();
        drain.shutdownNow();
        try {
            if (!drain.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Job drain loop did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Blueprint job processor stopped");
    }

    @Override
    public String createJob(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be blank");
        }

        synchronized (queueLock) {
            if (!running) {
                throw new JobServiceException("Job processor is not running");
            }
            String activeJobId = activeJobBySubject.get(subjectId);
            if (activeJobId != null) {
                throw new SubjectBusyException(subjectId, activeJobId);
            }

            String jobId = UUID.randomUUID().toString();
            Instant now = clock.instant();
            JobData job = JobData.builder()
                    .jobId(jobId)
                    .subjectId(subjectId)
                    .status(JobData.JobStatus.PENDING)
                    .progress(0)
                    .currentStep("Queued")
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            jobs.put(jobId, job);
            activeJobBySubject.put(subjectId, jobId);
            latestJobBySubject.put(subjectId, jobId);
            queue.addLast(jobId);
            jobsCreatedCounter.increment();
            log.info("Queued job {} for blueprint {} (queue length {})", jobId, subjectId, queue.size());

            if (!draining) {
                draining = true;
                drainExecutor.execute(this::drain);
            }
            return jobId;
        }
    }

    @Override
    public Optional<JobData> getJob(String jobId) {
        JobData job = jobs.get(jobId);
        return Optional.ofNullable(job).map(j -> j.toBuilder().build());
    }

    @Override
    public Optional<JobData> getJobBySubject(String subjectId) {
        String jobId = latestJobBySubject.get(subjectId);
        return jobId != null ? getJob(jobId) : Optional.empty();
    }

    @Override
    public QueueStats getQueueStats() {
        Map<String, Long> byStatus = jobs.values().stream()
                .collect(Collectors.groupingBy(job -> job.getStatus().getValue(), Collectors.counting()));
        synchronized (queueLock) {
            return QueueStats.builder()
                    .queueLength(queue.size())
                    .draining(draining)
                    .running(running)
                    .activeSubjects(activeJobBySubject.size())
                    .jobsByStatus(byStatus)
                    .build();
        }
    }

    @Override
    public int cleanupExpiredJobs(Duration retention) {
        Instant horizon = clock.instant().minus(retention);
        int removed = 0;
        for (Map.Entry<String, JobData> entry : jobs.entrySet()) {
            JobData job = entry.getValue();
            Instant finishedAt = job.getCompletedAt() != null ? job.getCompletedAt() : job.getUpdatedAt();
            if (job.getStatus().isTerminal() && finishedAt.isBefore(horizon)
                    && jobs.remove(entry.getKey(), job)) {
                latestJobBySubject.remove(job.getSubjectId(), job.getJobId());
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} finished jobs older than {}", removed, retention);
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${app.jobs.cleanup-interval-ms:600000}")
    public void scheduledCleanup() {
        try {
            cleanupExpiredJobs(retention);
        } catch (Exception e) {
            log.error("Job retention sweep failed: {}", e.getMessage(), e);
        }
    }

    private void drain() {
        while (true) {
            String jobId;
            synchronized (queueLock) {
                jobId = running ? queue.pollFirst() : null;
                if (jobId == null) {
                    draining = false;
                    return;
                }
            }

            try {
                processJob(jobId);
            } catch (Exception e) {
                log.error("Unexpected error while processing job {}: {}", jobId, e.getMessage(), e);
                failJob(jobId, "Unexpected processing error", null);
            }
        }
    }

    private void processJob(String jobId) {
        JobData job = jobs.get(jobId);
        if (job == null) {
            return;
        }

        Instant startedAt = clock.instant();
        JobData started = updateJob(jobId, current -> current.toBuilder()
                .status(JobData.JobStatus.PROCESSING)
                .progress(0)
                .currentStep("Starting blueprint generation")
                .startedAt(startedAt)
                .updatedAt(startedAt)
                .build());
        if (started == null || started.getStatus() != JobData.JobStatus.PROCESSING) {
            return;
        }
        log.info("Processing job {} for blueprint {}", jobId, job.getSubjectId());

        Future<Map<String, Object>> pipeline = pipelineExecutor.submit(
                () -> generationService.generate(job.getSubjectId(), (progress, step) -> reportProgress(jobId, progress, step)));

        try {
            Map<String, Object> result = pipeline.get(maxJobDuration.toMillis(), TimeUnit.MILLISECONDS);
            completeJob(jobId, result);
        } catch (TimeoutException e) {
            pipeline.cancel(true);
            failJob(jobId, "Job exceeded maximum duration of " + maxJobDuration.toSeconds() + "s", null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            Map<String, Object> partial = null;
            if (cause instanceof AgentExecutionException) {
                partial = ((AgentExecutionException) cause).getPartialContext();
            }
            log.warn("Job {} failed: {}", jobId, cause.getMessage());
            failJob(jobId, shortMessage(cause), partial);
        } catch (InterruptedException e) {
            pipeline.cancel(true);
            Thread.currentThread().interrupt();
            failJob(jobId, "Job processing was interrupted", null);
        }
    }

    private void reportProgress(String jobId, int progress, String step) {
        Instant now = clock.instant();
        updateJob(jobId, current -> {
            if (current.getStatus() != JobData.JobStatus.PROCESSING || progress < current.getProgress()) {
                return current;
            }
            return current.toBuilder()
                    .progress(Math.min(progress, 99))
                    .currentStep(step)
                    .updatedAt(now)
                    .build();
        });
    }

    private void completeJob(String jobId, Map<String, Object> result) {
        Instant now = clock.instant();
        JobData job = transition(jobId, current -> current.toBuilder()
                .status(JobData.JobStatus.COMPLETED)
                .progress(100)
                .currentStep("Completed")
                .result(result)
                .updatedAt(now)
                .completedAt(now)
                .build());
        if (job != null) {
            jobsCompletedCounter.increment();
            releaseSubject(job);
            log.info("Job {} completed for blueprint {}", jobId, job.getSubjectId());
        }
    }

    private void failJob(String jobId, String error, Map<String, Object> partialResult) {
        Instant now = clock.instant();
        JobData job = transition(jobId, current -> current.toBuilder()
                .status(JobData.JobStatus.FAILED)
                .currentStep("Failed")
                .error(error)
                .partialResult(partialResult)
                .updatedAt(now)
                .completedAt(now)
                .build());
        if (job != null) {
            jobsFailedCounter.increment();
            releaseSubject(job);
            log.info("Job {} failed for blueprint {}: {}", jobId, job.getSubjectId(), error);
        }
    }

    /**
     * Applies the update unless the job is already terminal.
     *
     * @return the stored snapshot after the call, or null if the job is unknown
     */
    private JobData updateJob(String jobId, UnaryOperator<JobData> update) {
        return jobs.computeIfPresent(jobId, (id, current) ->
                current.getStatus().isTerminal() ? current : update.apply(current));
    }

    /**
     * Moves a job into a terminal state.
     *
     * @return the new snapshot, or null if the job is unknown or was already terminal
     */
    private JobData transition(String jobId, UnaryOperator<JobData> update) {
        AtomicBoolean applied = new AtomicBoolean(false);
        JobData job = jobs.computeIfPresent(jobId, (id, current) -> {
            if (current.getStatus().isTerminal()) {
                return current;
            }
            applied.set(true);
            return update.apply(current);
        });
        return applied.get() ? job : null;
    }

    private void releaseSubject(JobData job) {
        synchronized (queueLock) {
            activeJobBySubject.remove(job.getSubjectId(), job.getJobId());
        }
    }

    private static String shortMessage(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) + "..." : message;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
