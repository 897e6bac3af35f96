package ai.foundrystack.backend.service.exception;

/**
 * Raised when a downstream agent service answers with a non-2xx status or cannot be reached.
 * The response body is kept for logging only; the message stays short.
 */
public class DownstreamServiceException extends RuntimeException {

    private final String serviceName;
    private final int statusCode;
    private final String responseBody;

    public DownstreamServiceException(String serviceName, int statusCode, String responseBody) {
        super(serviceName + " service returned HTTP " + statusCode);
        this.serviceName = serviceName;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public DownstreamServiceException(String serviceName, String message, Throwable cause) {
        super(serviceName + " service unavailable: " + message, cause);
        this.serviceName = serviceName;
        this.statusCode = 0;
        this.responseBody = null;
    }

    public String getServiceName() {
        return serviceName;
    }

    /**
     * @return the HTTP status, or 0 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
