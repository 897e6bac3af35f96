package ai.foundrystack.backend.service.agent;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * Outcome of a completed agent chain.
 */
@Getter
@AllArgsConstructor
public class ChainResult {

    /**
     * Caller input merged with every agent output
     */
    private final Map<String, Object> context;

    /**
     * Entries written by the agents, including input keys an agent overwrote
     */
    private final Map<String, Object> produced;
}
