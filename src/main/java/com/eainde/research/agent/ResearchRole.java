package com.eainde.research.agent;

/**
 * The model-backed roles of a research session. Each role has its own system prompt.
 */
public enum ResearchRole {

    FINDER("finder"),
    PLANNER("planner"),
    EVALUATOR("evaluator"),
    SYNTHESIZER("synthesizer");

    private final String agentName;

    ResearchRole(String agentName) {
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }

    public boolean isCritic() {
        return this != FINDER;
    }
}
