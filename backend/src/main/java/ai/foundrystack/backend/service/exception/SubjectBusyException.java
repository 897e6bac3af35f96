package ai.foundrystack.backend.service.exception;

/**
 * Raised when a job is requested for a subject that already has a non-terminal job.
 */
public class SubjectBusyException extends RuntimeException {

    private final String subjectId;
    private final String activeJobId;

    public SubjectBusyException(String subjectId, String activeJobId) {
        super("Subject " + subjectId + " already has an active job " + activeJobId);
        this.subjectId = subjectId;
        this.activeJobId = activeJobId;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getActiveJobId() {
        return activeJobId;
    }
}
