package ai.foundrystack.backend.service.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when an agent in a chain fails. Carries the failing stage and the context accumulated
 * by the agents that completed before it. The message is short and safe to expose to clients.
 */
public class AgentExecutionException extends RuntimeException {

    /**
     * Failure classes of a single agent invocation.
     */
    public enum AgentFailureKind {
        /** Network, authentication, quota or provider-side error */
        MODEL_CALL,
        /** The model call exceeded the per-agent timeout */
        TIMEOUT,
        /** No JSON object could be extracted, or required fields are missing */
        MALFORMED_OUTPUT,
        /** The model returned no text */
        EMPTY_RESPONSE,
        /** The model rate limiter rejected the call */
        RATE_LIMITED
    }

    private final String agentName;
    private final int stage;
    private final int totalStages;
    private final AgentFailureKind kind;
    private final Map<String, Object> partialContext;

    public AgentExecutionException(String agentName, int stage, int totalStages, AgentFailureKind kind,
                                   String detail, Map<String, Object> partialContext, Throwable cause) {
        super(String.format("Stage %d/%d (%s) failed: %s", stage, totalStages, agentName, detail), cause);
        this.agentName = agentName;
        this.stage = stage;
        this.totalStages = totalStages;
        this.kind = kind;
        this.partialContext = partialContext != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(partialContext))
                : Collections.emptyMap();
    }

    public AgentExecutionException(String agentName, int stage, int totalStages, AgentFailureKind kind,
                                   String detail, Map<String, Object> partialContext) {
        this(agentName, stage, totalStages, kind, detail, partialContext, null);
    }

    public String getAgentName() {
        return agentName;
    }

    public int getStage() {
        return stage;
    }

    public int getTotalStages() {
        return totalStages;
    }

    public AgentFailureKind getKind() {
        return kind;
    }

    public Map<String, Object> getPartialContext() {
        return partialContext;
    }
}
