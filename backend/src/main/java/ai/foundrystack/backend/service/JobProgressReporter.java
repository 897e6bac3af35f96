package ai.foundrystack.backend.service;

/**
 * Receives advisory progress from a running job. Values lower than the job's current progress
 * are ignored by the processor.
 */
@FunctionalInterface
public interface JobProgressReporter {

    void report(int progress, String step);
}
