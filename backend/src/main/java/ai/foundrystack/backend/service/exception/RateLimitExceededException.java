package ai.foundrystack.backend.service.exception;

import java.time.Instant;

public class RateLimitExceededException extends RuntimeException {

    private final String identifier;
    private final Instant resetAt;

    public RateLimitExceededException(String identifier, Instant resetAt) {
        super("Rate limit exceeded, retry after " + resetAt);
        this.identifier = identifier;
        this.resetAt = resetAt;
    }

    public String getIdentifier() {
        return identifier;
    }

    public Instant getResetAt() {
        return resetAt;
    }
}
