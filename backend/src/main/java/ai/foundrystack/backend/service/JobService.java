package ai.foundrystack.backend.service;

import ai.foundrystack.backend.model.dto.JobData;
import ai.foundrystack.backend.model.dto.QueueStats;

import java.time.Duration;
import java.util.Optional;

/**
 * Service interface for background generation jobs.
 * Jobs are processed one at a time in submission order.
 */
public interface JobService {

    /**
     * Queues a generation job for the subject and returns without waiting for it to run.
     *
     * @param subjectId the blueprint the job populates
     * @return the new job's ID
     * @throws ai.foundrystack.backend.service.exception.SubjectBusyException if the subject already has an active job
     * @throws JobServiceException if the processor is not accepting jobs
     */
    String createJob(String subjectId);

    /**
     * @param jobId the job ID
     * @return a snapshot of the job, or empty if unknown or already swept
     */
    Optional<JobData> getJob(String jobId);

    /**
     * @param subjectId the blueprint ID
     * @return a snapshot of the most recent job created for the subject
     */
    Optional<JobData> getJobBySubject(String subjectId);

    /**
     * Get queue statistics for monitoring
     */
    QueueStats getQueueStats();

    /**
     * Removes terminal jobs that finished longer ago than the retention period.
     *
     * @param retention how long finished jobs stay queryable
     * @return number of jobs removed
     */
    int cleanupExpiredJobs(Duration retention);

    /**
     * Exception thrown by job service operations
     */
    class JobServiceException extends RuntimeException {
        public JobServiceException(String message) {
            super(message);
        }

        public JobServiceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
