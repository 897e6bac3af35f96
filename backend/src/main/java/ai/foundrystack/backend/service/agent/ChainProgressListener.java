package ai.foundrystack.backend.service.agent;

/**
 * Callback notified as a chain moves through its agents. Stages are 1-based.
 */
public interface ChainProgressListener {

    ChainProgressListener NONE = new ChainProgressListener() {
    };

    default void onAgentStarted(String agentName, int stage, int totalStages) {
    }

    default void onAgentCompleted(String agentName, int stage, int totalStages) {
    }
}
