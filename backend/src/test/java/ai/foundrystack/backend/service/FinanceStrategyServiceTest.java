package ai.foundrystack.backend.service;

import ai.foundrystack.backend.model.dto.FinanceStrategyRequest;
import ai.foundrystack.backend.model.dto.FinanceStrategyResponse;
import ai.foundrystack.backend.service.agent.AgentChainOrchestrator;
import ai.foundrystack.backend.service.agent.AgentSpec;
import ai.foundrystack.backend.service.agent.ChainResult;
import ai.foundrystack.backend.service.exception.AgentExecutionException;
import ai.foundrystack.backend.service.exception.AgentExecutionException.AgentFailureKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FinanceStrategyServiceTest {

    @Mock
    private AgentChainOrchestrator orchestrator;

    private TestClock clock;
    private FinanceStrategyService service;

    @BeforeEach
    void setUp() {
        clock = new TestClock(Instant.parse("2024-01-01T10:00:00Z"));
        service = new FinanceStrategyService(orchestrator, clock);
    }

    private static FinanceStrategyRequest.FinanceStrategyRequestBuilder minimalRequest() {
        return FinanceStrategyRequest.builder()
                .startupName("PawPal")
                .industry("Pet care")
                .geography("Germany")
                .businessModel("Marketplace")
                .mainFinancialConcern("Runway")
                .teamSize(4);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRunFinanceChainAndReturnProducedEntries() {
        when(orchestrator.runChain(anyList(), anyMap())).thenAnswer(invocation -> {
            Map<String, Object> context = new LinkedHashMap<>((Map<String, Object>) invocation.getArgument(1));
            Map<String, Object> produced = new LinkedHashMap<>();
            produced.put("funding_stage", "Seed");
            produced.put("raise_amount", "$1.5M");
            produced.put("funding_narrative", "Raise a seed round to reach product-market fit");
            context.putAll(produced);
            return new ChainResult(context, produced);
        });

        FinanceStrategyResponse response = service.generateStrategy(minimalRequest().build());

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getStrategy()).containsOnlyKeys("funding_stage", "raise_amount", "funding_narrative");
        assertThat(response.getGeneratedAt()).isEqualTo(clock.instant());

        ArgumentCaptor<List<AgentSpec>> chain = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<Map<String, Object>> input = ArgumentCaptor.forClass(Map.class);
        verify(orchestrator).runChain(chain.capture(), input.capture());
        assertThat(chain.getValue().stream().map(AgentSpec::getName).collect(Collectors.toList()))
                .containsExactly("FundingStageAgent", "RaiseAmountAgent", "InvestorMatchAgent",
                        "RunwayAgent", "PriorityAgent", "SynthesisAgent");
        assertThat(input.getValue())
                .containsEntry("teamSize", 4)
                .doesNotContainKeys("productStage", "monthlyRevenue", "fundingGoal");
    }

    @Test
    void agentFailureShouldPropagate() {
        AgentExecutionException failure = new AgentExecutionException("RunwayAgent", 4, 6,
                AgentFailureKind.MALFORMED_OUTPUT, "model returned malformed JSON", Map.of());
        when(orchestrator.runChain(anyList(), anyMap())).thenThrow(failure);

        assertThatThrownBy(() -> service.generateStrategy(minimalRequest().build())).isSameAs(failure);
    }

    @Test
    void completenessWithOnlyRequiredFieldsShouldBeHalf() {
        assertThat(FinanceStrategyService.calculateDataCompleteness(minimalRequest().build()))
                .isCloseTo(0.5, within(1e-9));
    }

    @Test
    void completenessShouldRewardMeaningfulOptionalFields() {
        FinanceStrategyRequest request = minimalRequest()
                .monthlyRevenue(12000.0)
                .growthRate("15% month over month")
                .tractionSummary("300 paying customers in Berlin")
                .fundingGoal(1_500_000.0)
                .build();

        assertThat(FinanceStrategyService.calculateDataCompleteness(request)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shortOptionalTextShouldNotCount() {
        FinanceStrategyRequest request = minimalRequest()
                .growthRate("10%")
                .tractionSummary("some users")
                .monthlyRevenue(0.0)
                .build();

        assertThat(FinanceStrategyService.calculateDataCompleteness(request)).isCloseTo(0.625, within(1e-9));
    }

    @Test
    void blankRequiredFieldsShouldLowerScore() {
        FinanceStrategyRequest request = minimalRequest().geography(" ").businessModel(null).build();

        assertThat(FinanceStrategyService.calculateDataCompleteness(request)).isCloseTo(0.3, within(1e-9));
    }
}
