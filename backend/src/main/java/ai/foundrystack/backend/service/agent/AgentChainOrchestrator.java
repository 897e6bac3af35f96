package ai.foundrystack.backend.service.agent;

import ai.foundrystack.backend.service.ModelClient;
import ai.foundrystack.backend.service.RateLimitService;
import ai.foundrystack.backend.service.exception.AgentExecutionException;
import ai.foundrystack.backend.service.exception.AgentExecutionException.AgentFailureKind;
import ai.foundrystack.backend.service.exception.ModelClientException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs an ordered list of agents, threading an accumulating context through them.
 *
 * Each agent sees the whole context built so far. Its output must contain a JSON object,
 * which is shallow-merged into the context (later keys win). Keys written by an agent are
 * reported as produced even when they replace a caller-supplied value. The first failing agent aborts
 * the chain with an {@link AgentExecutionException} naming the stage; later agents never run.
 */
@Slf4j
@Service
public class AgentChainOrchestrator {

    private final ModelClient modelClient;
    private final RateLimitService rateLimitService;
    private final JsonResponseExtractor extractor;
    private final MeterRegistry meterRegistry;
    private final Duration callTimeout;
    private final ObjectMapper objectMapper;
    private final ExecutorService callExecutor;

    @Autowired
    public AgentChainOrchestrator(ModelClient modelClient,
                                  RateLimitService rateLimitService,
                                  JsonResponseExtractor extractor,
                                  MeterRegistry meterRegistry,
                                  @Value("${app.agents.call-timeout-seconds:90}") long callTimeoutSeconds) {
        this(modelClient, rateLimitService, extractor, meterRegistry, Duration.ofSeconds(callTimeoutSeconds));
    }

    AgentChainOrchestrator(ModelClient modelClient,
                           RateLimitService rateLimitService,
                           JsonResponseExtractor extractor,
                           MeterRegistry meterRegistry,
                           Duration callTimeout) {
        this.modelClient = modelClient;
        this.rateLimitService = rateLimitService;
        this.extractor = extractor;
        this.meterRegistry = meterRegistry;
        this.callTimeout = callTimeout;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.findAndRegisterModules();

        AtomicInteger threadCounter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "agent-call-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public ChainResult runChain(List<AgentSpec> agents, Map<String, Object> initialInput) {
        return runChain(agents, initialInput, ChainProgressListener.NONE);
    }

    /**
     * Runs the agents in order.
     *
     * @param agents the chain, executed strictly sequentially
     * @param initialInput caller input, becomes the starting context
     * @param listener notified before and after every agent
     * @return the final merged context and the entries the agents produced
     * @throws AgentExecutionException when any agent fails
     */
    public ChainResult runChain(List<AgentSpec> agents, Map<String, Object> initialInput,
                                ChainProgressListener listener) {
        Map<String, Object> context = new LinkedHashMap<>(initialInput);
        Map<String, Object> produced = new LinkedHashMap<>();
        int total = agents.size();
        long chainStart = System.currentTimeMillis();

        for (int i = 0; i < total; i++) {
            AgentSpec agent = agents.get(i);
            int stage = i + 1;
            listener.onAgentStarted(agent.getName(), stage, total);
            log.info("Running agent {} ({}/{})", agent.getName(), stage, total);

            String prompt = buildPrompt(agent, context);

            if (!rateLimitService.tryAcquireModelCall(modelClient.getProviderName())) {
                throw failure(agent, stage, total, AgentFailureKind.RATE_LIMITED,
                        "model rate limit reached", context, null);
            }

            String raw = callModel(agent, stage, total, prompt, context);
            if (raw == null || raw.isBlank()) {
                throw failure(agent, stage, total, AgentFailureKind.EMPTY_RESPONSE,
                        "model returned an empty response", context, null);
            }

            Map<String, Object> output;
            try {
                output = extractor.extractObject(raw);
            } catch (JsonResponseExtractor.JsonExtractionException e) {
                modelClient.invalidate(prompt, agent.getTemperature());
                log.debug("Unparseable output from {}: {}", agent.getName(), raw);
                throw failure(agent, stage, total, AgentFailureKind.MALFORMED_OUTPUT,
                        "model returned malformed JSON", context, e);
            }

            List<String> missing = agent.getRequiredFields().stream()
                    .filter(field -> !output.containsKey(field))
                    .collect(Collectors.toList());
            if (!missing.isEmpty()) {
                modelClient.invalidate(prompt, agent.getTemperature());
                throw failure(agent, stage, total, AgentFailureKind.MALFORMED_OUTPUT,
                        "output is missing required fields " + missing, context, null);
            }

            context.putAll(output);
            produced.putAll(output);
            listener.onAgentCompleted(agent.getName(), stage, total);
        }

        log.info("Agent chain of {} agents completed in {}ms", total, System.currentTimeMillis() - chainStart);
        return new ChainResult(context, produced);
    }

    @PreDestroy
    public void shutdown() {
        callExecutor.shutdownNow();
    }

    String buildPrompt(AgentSpec agent, Map<String, Object> context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(agent.getPromptBuilder().apply(context).trim());
        prompt.append("\n\nReturn ONLY valid JSON matching exactly this shape:\n");
        prompt.append(agent.getOutputSchema().trim());
        prompt.append("\n\nContext:\n");
        prompt.append(serialize(context));
        return prompt.toString();
    }

    private String callModel(AgentSpec agent, int stage, int total, String prompt, Map<String, Object> context) {
        Timer.Sample sample = Timer.start(meterRegistry);
        Future<String> future = callExecutor.submit(() -> modelClient.complete(prompt, agent.getTemperature()));
        String outcome = "success";
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            outcome = "timeout";
            throw failure(agent, stage, total, AgentFailureKind.TIMEOUT,
                    "model call timed out after " + callTimeout.toSeconds() + "s", context, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            outcome = "error";
            log.error("Model call for agent {} failed: {}", agent.getName(), cause.getMessage());
            if (cause instanceof ModelClientException && ((ModelClientException) cause).getStatusCode() == 429) {
                throw failure(agent, stage, total, AgentFailureKind.RATE_LIMITED,
                        "model provider quota exceeded", context, cause);
            }
            throw failure(agent, stage, total, AgentFailureKind.MODEL_CALL,
                    "model call failed: " + cause.getMessage(), context, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            outcome = "interrupted";
            throw failure(agent, stage, total, AgentFailureKind.MODEL_CALL,
                    "model call interrupted", context, e);
        } finally {
            sample.stop(Timer.builder("agent_call_duration_seconds")
                    .description("Model call duration per agent")
                    .tag("agent", agent.getName())
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }

    private String serialize(Map<String, Object> context) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(context);
        } catch (JsonProcessingException e) {
            log.warn("Context could not be serialized as JSON, falling back to toString: {}", e.getMessage());
            return String.valueOf(context);
        }
    }

    private AgentExecutionException failure(AgentSpec agent, int stage, int total, AgentFailureKind kind,
                                            String detail, Map<String, Object> context, Throwable cause) {
        log.warn("Agent {} failed at stage {}/{} ({}): {}", agent.getName(), stage, total, kind, detail);
        return new AgentExecutionException(agent.getName(), stage, total, kind, detail, context, cause);
    }
}
