package ai.foundrystack.backend.service.agent;

import java.util.List;
import java.util.Map;

import static ai.foundrystack.backend.service.agent.BlueprintAgents.text;

/**
 * The funding strategy chain. Output keys are snake_case. FundingStageAgent and RaiseAmountAgent
 * both answer with a "rationale"; after the merge the raise rationale is the one kept.
 */
public final class FinanceAgents {

    private FinanceAgents() {
    }

    public static List<AgentSpec> financeChain() {
        return List.of(fundingStage(), raiseAmount(), investorMatch(), runway(), priorities(), synthesis());
    }

    public static AgentSpec fundingStage() {
        return AgentSpec.builder()
                .name("FundingStageAgent")
                .temperature(0.2)
                .promptBuilder(ctx -> "You are a finance advisor for startup founders. Based on the startup profile "
                        + "of " + text(ctx, "startupName") + " (" + text(ctx, "industry") + ", product stage "
                        + orDefault(ctx, "productStage", "unknown") + ", team of " + text(ctx, "teamSize")
                        + "), determine the most suitable funding stage.")
                .outputSchema("""
                        {
                          "funding_stage": "Pre-Seed | Seed | Series A | Series B | Growth",
                          "rationale": "Reason for this stage"
                        }""")
                .requiredFields(List.of("funding_stage", "rationale"))
                .build();
    }

    public static AgentSpec raiseAmount() {
        return AgentSpec.builder()
                .name("RaiseAmountAgent")
                .temperature(0.3)
                .promptBuilder(ctx -> "You are a startup funding calculator. For a " + text(ctx, "funding_stage")
                        + " round in " + text(ctx, "geography") + ", recommend how much to raise in USD and the "
                        + "top financial priorities. The founder's own goal is "
                        + orDefault(ctx, "fundingGoal", "not specified") + ".")
                .outputSchema("""
                        {
                          "raise_amount": "$1.5M",
                          "rationale": "Why this amount fits the stage",
                          "financial_priorities": ["Hire engineers", "Go-to-market"]
                        }""")
                .requiredFields(List.of("raise_amount", "rationale", "financial_priorities"))
                .build();
    }

    public static AgentSpec investorMatch() {
        return AgentSpec.builder()
                .name("InvestorMatchAgent")
                .temperature(0.3)
                .promptBuilder(ctx -> "You are a venture capital matchmaker. Match investor types to a "
                        + text(ctx, "funding_stage") + " " + text(ctx, "industry") + " startup raising "
                        + text(ctx, "raise_amount") + ". Rate the fit of each type from 0 to 1.")
                .outputSchema("""
                        {
                          "investor_types": [
                            {"type": "Angel Investors", "fit": 0.8, "reasoning": "...", "examples": ["..."]}
                          ]
                        }""")
                .requiredFields(List.of("investor_types"))
                .build();
    }

    public static AgentSpec runway() {
        return AgentSpec.builder()
                .name("RunwayAgent")
                .temperature(0.3)
                .promptBuilder(ctx -> "You are a startup financial planning advisor. Estimate the runway a "
                        + text(ctx, "teamSize") + "-person team in " + text(ctx, "geography") + " gets from raising "
                        + text(ctx, "raise_amount") + ", with current monthly revenue of "
                        + orDefault(ctx, "monthlyRevenue", "0") + " USD.")
                .outputSchema("""
                        {
                          "runway_months": 18,
                          "monthly_burn": {"conservative": 0, "realistic": 0, "aggressive": 0},
                          "burn_guidance": "...",
                          "key_assumptions": ["..."]
                        }""")
                .requiredFields(List.of("runway_months", "monthly_burn"))
                .build();
    }

    public static AgentSpec priorities() {
        return AgentSpec.builder()
                .name("PriorityAgent")
                .temperature(0.3)
                .promptBuilder(ctx -> "You are a startup CFO. Allocate the raise across spending categories for a "
                        + text(ctx, "funding_stage") + " startup whose main financial concern is: "
                        + text(ctx, "mainFinancialConcern") + ". Percentages must add up to 100.")
                .outputSchema("""
                        {
                          "allocation": [
                            {"category": "Product Development", "percentage": 40, "reasoning": "..."}
                          ]
                        }""")
                .requiredFields(List.of("allocation"))
                .build();
    }

    public static AgentSpec synthesis() {
        return AgentSpec.builder()
                .name("SynthesisAgent")
                .temperature(0.4)
                .promptBuilder(ctx -> "You are a pitch advisor. Synthesize the analysis in the context into a short "
                        + "funding narrative for " + text(ctx, "startupName") + ", list the key risks and the next "
                        + "milestones, and rate your overall confidence from 0 to 1.")
                .outputSchema("""
                        {
                          "funding_narrative": "...",
                          "key_risks": ["..."],
                          "next_milestones": ["..."],
                          "confidence": {"overall": 0.8, "market_clarity": 0.8, "stage_alignment": 0.9}
                        }""")
                .requiredFields(List.of("funding_narrative", "key_risks", "next_milestones"))
                .build();
    }

    private static String orDefault(Map<String, Object> context, String key, String fallback) {
        Object value = context.get(key);
        return value != null && !value.toString().isBlank() ? value.toString() : fallback;
    }
}
