package ai.foundrystack.backend.service.agent;

import java.util.List;
import java.util.Map;

/**
 * The blueprint chain: market analysis, then technical design, then an implementation plan,
 * then starter code templates. Each agent builds on the sections written before it.
 */
public final class BlueprintAgents {

    public static final String MARKET_ANALYSIS = "marketAnalysis";
    public static final String TECHNICAL_BLUEPRINT = "technicalBlueprint";
    public static final String IMPLEMENTATION_PLAN = "implementationPlan";
    public static final String CODE_TEMPLATES = "codeTemplates";

    private BlueprintAgents() {
    }

    public static List<AgentSpec> blueprintChain() {
        return List.of(marketAnalysis(), technicalBlueprint(), implementationPlan(), codeTemplates());
    }

    static AgentSpec marketAnalysis() {
        return AgentSpec.builder()
                .name("MarketAnalysisAgent")
                .temperature(0.7)
                .promptBuilder(ctx -> "You are a startup market analyst. Analyze the market for the startup idea \""
                        + text(ctx, "title") + "\".\n"
                        + "Idea: " + text(ctx, "idea") + "\n"
                        + "Use the enriched context when it is present. Identify the target audience, the main "
                        + "competitors, the market size and the opportunities and risks.")
                .outputSchema("""
                        {
                          "marketAnalysis": {
                            "targetAudience": ["..."],
                            "competitors": [{"name": "...", "strengths": ["..."], "weaknesses": ["..."]}],
                            "marketSize": {"tam": "...", "sam": "...", "som": "..."},
                            "opportunities": ["..."],
                            "risks": ["..."]
                          }
                        }""")
                .requiredFields(List.of(MARKET_ANALYSIS))
                .build();
    }

    static AgentSpec technicalBlueprint() {
        return AgentSpec.builder()
                .name("TechnicalBlueprintAgent")
                .temperature(0.5)
                .promptBuilder(ctx -> "You are a senior software architect. Design the technical architecture for \""
                        + text(ctx, "title") + "\" based on the market analysis in the context. Choose a tech stack, "
                        + "describe the core components, the data model and the third-party APIs to integrate.")
                .outputSchema("""
                        {
                          "technicalBlueprint": {
                            "techStack": {"frontend": ["..."], "backend": ["..."], "database": ["..."], "infrastructure": ["..."]},
                            "components": [{"name": "...", "responsibility": "..."}],
                            "dataModel": [{"entity": "...", "fields": ["..."]}],
                            "integrations": ["..."]
                          }
                        }""")
                .requiredFields(List.of(TECHNICAL_BLUEPRINT))
                .build();
    }

    static AgentSpec implementationPlan() {
        return AgentSpec.builder()
                .name("ImplementationPlanAgent")
                .temperature(0.5)
                .promptBuilder(ctx -> "You are an engineering manager. Turn the technical blueprint for \""
                        + text(ctx, "title") + "\" into a phased implementation plan with milestones, "
                        + "estimated durations and the team needed.")
                .outputSchema("""
                        {
                          "implementationPlan": {
                            "phases": [{"name": "...", "durationWeeks": 0, "deliverables": ["..."]}],
                            "team": [{"role": "...", "count": 0}],
                            "milestones": ["..."]
                          }
                        }""")
                .requiredFields(List.of(IMPLEMENTATION_PLAN))
                .build();
    }

    static AgentSpec codeTemplates() {
        return AgentSpec.builder()
                .name("CodeTemplateAgent")
                .temperature(0.4)
                .promptBuilder(ctx -> "You are a staff engineer. Write short starter code templates for the most "
                        + "important components of the technical blueprint for \"" + text(ctx, "title") + "\". "
                        + "Keep each template under 60 lines.")
                .outputSchema("""
                        {
                          "codeTemplates": [
                            {"component": "...", "language": "...", "filename": "...", "code": "..."}
                          ]
                        }""")
                .requiredFields(List.of(CODE_TEMPLATES))
                .build();
    }

    static String text(Map<String, Object> context, String key) {
        Object value = context.get(key);
        return value != null ? value.toString() : "";
    }
}
