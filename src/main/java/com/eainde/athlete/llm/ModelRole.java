package com.eainde.athlete.llm;

import com.eainde.athlete.config.AgentProperties;

/**
 * The roles a model plays in the pipeline. Each role can be bound to a different model,
 * temperature and output budget.
 */
public enum ModelRole {
    CLASSIFIER("gemini-2.0-flash", 0.0, 512),
    PLANNER("gemini-2.0-flash", 0.0, 512),
    EXPANDER("gemini-2.0-flash", 0.4, 512),
    SYNTHESIZER("gemini-2.5-pro", 0.3, 2048),
    QUALITY("gemini-2.0-flash", 0.0, 768),
    ESCALATION("gemini-2.5-pro", 0.3, 1024),
    SUMMARY("gemini-2.0-flash", 0.0, 300);

    private final String defaultModel;
    private final double defaultTemperature;
    private final int defaultMaxOutputTokens;

    ModelRole(String defaultModel, double defaultTemperature, int defaultMaxOutputTokens) {
        this.defaultModel = defaultModel;
        this.defaultTemperature = defaultTemperature;
        this.defaultMaxOutputTokens = defaultMaxOutputTokens;
    }

    public AgentProperties.Model defaults() {
        return new AgentProperties.Model(defaultModel, defaultTemperature, defaultMaxOutputTokens);
    }
}
