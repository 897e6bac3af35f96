package ai.foundrystack.backend.service;

import ai.foundrystack.backend.model.entity.Blueprint;
import ai.foundrystack.backend.repository.BlueprintRepository;
import ai.foundrystack.backend.service.agent.AgentChainOrchestrator;
import ai.foundrystack.backend.service.agent.AgentSpec;
import ai.foundrystack.backend.service.agent.BlueprintAgents;
import ai.foundrystack.backend.service.agent.ChainProgressListener;
import ai.foundrystack.backend.service.agent.ChainResult;
import ai.foundrystack.backend.service.exception.BlueprintNotFoundException;
import ai.foundrystack.backend.service.exception.DownstreamServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Generates the content of one blueprint: loads the record, optionally enriches the idea through
 * the retriever, runs the blueprint agent chain and stores the result.
 *
 * Progress: 10 loading, 15 enriching, 20-90 spread over the agents, 95 saving.
 */
@Slf4j
@Service
public class BlueprintGenerationService {

    static final int PROGRESS_LOADING = 10;
    static final int PROGRESS_ENRICHING = 15;
    static final int PROGRESS_AGENTS_START = 20;
    static final int PROGRESS_AGENTS_END = 90;
    static final int PROGRESS_SAVING = 95;

    private final BlueprintRepository blueprintRepository;
    private final BlueprintService blueprintService;
    private final AgentChainOrchestrator orchestrator;
    private final DownstreamAgentClient downstreamAgentClient;

    @Autowired
    public BlueprintGenerationService(BlueprintRepository blueprintRepository,
                                      BlueprintService blueprintService,
                                      AgentChainOrchestrator orchestrator,
                                      DownstreamAgentClient downstreamAgentClient) {
        this.blueprintRepository = blueprintRepository;
        this.blueprintService = blueprintService;
        this.orchestrator = orchestrator;
        this.downstreamAgentClient = downstreamAgentClient;
    }

    /**
     * Runs the full generation for a blueprint.
     *
     * @param blueprintId the blueprint record ID
     * @param reporter receives progress updates
     * @return the sections produced by the agents
     * @throws BlueprintNotFoundException if the record does not exist
     * @throws ai.foundrystack.backend.service.exception.AgentExecutionException if an agent fails
     */
    public Map<String, Object> generate(String blueprintId, JobProgressReporter reporter) {
        reporter.report(PROGRESS_LOADING, "Loading blueprint");
        Blueprint blueprint = loadBlueprint(blueprintId);
        blueprintService.markGenerating(blueprint);

        try {
            Map<String, Object> input = new LinkedHashMap<>();
            input.put("title", blueprint.getTitle());
            input.put("idea", blueprint.getIdea());
            if (blueprint.getDescription() != null && !blueprint.getDescription().isBlank()) {
                input.put("description", blueprint.getDescription());
            }
            enrich(blueprint, input, reporter);

            List<AgentSpec> chain = BlueprintAgents.blueprintChain();
            ChainResult chainResult = orchestrator.runChain(chain, input, new ChainProgressListener() {
                @Override
                public void onAgentStarted(String agentName, int stage, int totalStages) {
                    int span = PROGRESS_AGENTS_END - PROGRESS_AGENTS_START;
                    int progress = PROGRESS_AGENTS_START + (stage - 1) * span / totalStages;
                    reporter.report(progress, "Running " + agentName + " (" + stage + "/" + totalStages + ")");
                }
            });

            reporter.report(PROGRESS_SAVING, "Saving blueprint");
            Map<String, Object> result = chainResult.getProduced();
            blueprintService.saveGeneratedContent(blueprint, result);
            log.info("Blueprint {} generated with sections {}", blueprintId, result.keySet());
            return result;

        } catch (RuntimeException e) {
            blueprintService.markFailed(blueprint);
            throw e;
        }
    }

    private Blueprint loadBlueprint(String blueprintId) {
        UUID id;
        try {
            id = UUID.fromString(blueprintId);
        } catch (IllegalArgumentException e) {
            throw new BlueprintNotFoundException(blueprintId);
        }
        return blueprintRepository.findById(id).orElseThrow(() -> new BlueprintNotFoundException(blueprintId));
    }

    /**
     * Adds retriever context to the chain input. A failing retriever only degrades the result.
     */
    private void enrich(Blueprint blueprint, Map<String, Object> input, JobProgressReporter reporter) {
        if (!downstreamAgentClient.isRetrieverEnabled()) {
            return;
        }
        reporter.report(PROGRESS_ENRICHING, "Enriching context");
        try {
            DownstreamAgentClient.EnrichmentResponse enrichment = downstreamAgentClient.enrichQuery(blueprint.getIdea());
            if (enrichment.getEnrichedQuery() != null) {
                input.put("enrichedQuery", enrichment.getEnrichedQuery());
            }
            if (enrichment.getContext() != null) {
                input.put("enrichedContext", enrichment.getContext());
            }
        } catch (DownstreamServiceException e) {
            log.warn("Continuing blueprint {} without enrichment: {}", blueprint.getId(), e.getMessage());
        }
    }
}
