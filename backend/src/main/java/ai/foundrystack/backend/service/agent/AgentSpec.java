package ai.foundrystack.backend.service.agent;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Declarative description of one model-backed agent in a chain.
 */
@Getter
@Builder
@ToString(onlyExplicitlyIncluded = true)
public class AgentSpec {

    @ToString.Include
    private final String name;

    /**
     * Builds the agent's instructions from the accumulated context
     */
    private final Function<Map<String, Object>, String> promptBuilder;

    @ToString.Include
    private final double temperature;

    /**
     * Canonical JSON shape the agent must answer with, embedded verbatim in the prompt
     */
    private final String outputSchema;

    /**
     * Top-level keys that must be present in the agent's output
     */
    @Builder.Default
    private final List<String> requiredFields = List.of();
}
