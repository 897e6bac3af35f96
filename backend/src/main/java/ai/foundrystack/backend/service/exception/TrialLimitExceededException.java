package ai.foundrystack.backend.service.exception;

public class TrialLimitExceededException extends RuntimeException {

    private final String userId;
    private final int limit;

    public TrialLimitExceededException(String userId, int limit) {
        super("User " + userId + " used all " + limit + " finance strategy trials");
        this.userId = userId;
        this.limit = limit;
    }

    public String getUserId() {
        return userId;
    }

    public int getLimit() {
        return limit;
    }
}
