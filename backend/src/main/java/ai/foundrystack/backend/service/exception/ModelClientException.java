package ai.foundrystack.backend.service.exception;

/**
 * Failure reported by the AI model provider or while reaching it.
 */
public class ModelClientException extends RuntimeException {

    private final int statusCode;

    public ModelClientException(String message) {
        super(message);
        this.statusCode = 0;
    }

    public ModelClientException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public ModelClientException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public int getStatusCode() {
        return statusCode;
    }
}
