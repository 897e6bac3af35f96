package ai.foundrystack.backend.service;

import ai.foundrystack.backend.model.dto.FinanceStrategyRequest;
import ai.foundrystack.backend.model.dto.FinanceStrategyResponse;
import ai.foundrystack.backend.service.agent.AgentChainOrchestrator;
import ai.foundrystack.backend.service.agent.FinanceAgents;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generates a funding strategy synchronously by running the finance agent chain over a
 * startup profile.
 */
@Slf4j
@Service
public class FinanceStrategyService {

    private final AgentChainOrchestrator orchestrator;
    private final Clock clock;

    @Autowired
    public FinanceStrategyService(AgentChainOrchestrator orchestrator, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    /**
     * @throws ai.foundrystack.backend.service.exception.AgentExecutionException if an agent fails
     */
    public FinanceStrategyResponse generateStrategy(FinanceStrategyRequest request) {
        long start = clock.millis();
        log.info("Generating finance strategy for {} ({})", request.getStartupName(), request.getIndustry());

        Map<String, Object> input = toChainInput(request);
        Map<String, Object> strategy = orchestrator.runChain(FinanceAgents.financeChain(), input).getProduced();

        long elapsed = clock.millis() - start;
        log.info("Finance strategy for {} generated in {}ms", request.getStartupName(), elapsed);

        return FinanceStrategyResponse.builder()
                .success(true)
                .strategy(strategy)
                .dataCompleteness(calculateDataCompleteness(request))
                .generatedAt(clock.instant())
                .processingTimeMs(elapsed)
                .build();
    }

    /**
     * Half of the score comes from the required profile fields, half from the optional ones
     * (revenue, a growth rate of more than five characters, a traction summary of more than
     * twenty characters, funding goal).
     */
    static double calculateDataCompleteness(FinanceStrategyRequest request) {
        String[] required = {
                request.getStartupName(),
                request.getIndustry(),
                request.getGeography(),
                request.getBusinessModel(),
                request.getMainFinancialConcern()
        };
        int requiredPresent = 0;
        for (String value : required) {
            if (value != null && !value.trim().isEmpty()) {
                requiredPresent++;
            }
        }

        int optionalPresent = 0;
        if (request.getMonthlyRevenue() != null) {
            optionalPresent++;
        }
        if (request.getGrowthRate() != null && request.getGrowthRate().length() > 5) {
            optionalPresent++;
        }
        if (request.getTractionSummary() != null && request.getTractionSummary().length() > 20) {
            optionalPresent++;
        }
        if (request.getFundingGoal() != null) {
            optionalPresent++;
        }

        double score = 0.5 * requiredPresent / required.length + 0.5 * optionalPresent / 4.0;
        return Math.min(1.0, Math.max(0.0, score));
    }

    private static Map<String, Object> toChainInput(FinanceStrategyRequest request) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("startupName", request.getStartupName());
        input.put("industry", request.getIndustry());
        input.put("geography", request.getGeography());
        input.put("businessModel", request.getBusinessModel());
        input.put("mainFinancialConcern", request.getMainFinancialConcern());
        input.put("teamSize", request.getTeamSize());
        putIfPresent(input, "productStage", request.getProductStage());
        putIfPresent(input, "targetMarket", request.getTargetMarket());
        putIfPresent(input, "monthlyRevenue", request.getMonthlyRevenue());
        putIfPresent(input, "growthRate", request.getGrowthRate());
        putIfPresent(input, "tractionSummary", request.getTractionSummary());
        putIfPresent(input, "fundingGoal", request.getFundingGoal());
        return input;
    }

    private static void putIfPresent(Map<String, Object> input, String key, Object value) {
        if (value != null) {
            input.put(key, value);
        }
    }
}
