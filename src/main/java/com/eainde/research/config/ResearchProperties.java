package com.eainde.research.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the research engine, bound from {@code research.*}.
 */
@Data
@ConfigurationProperties(prefix = "research")
public class ResearchProperties {

    /** Upper bound of Finder/Critic rounds per subtask. */
    private int maxIterations = 5;

    /** Minimum Critic score (0-10) for a satisfactory verdict to be accepted. */
    private int qualityThreshold = 5;

    /** Characters of previous findings quoted in a refinement prompt. */
    private int findingsPreviewLength = 2000;

    private double contentLossRatio = 0.5;

    private int contentLossMinBytes = 1000;

    /** Classpath folder holding {@code {agent}.system.txt} prompts. */
    private String promptLocation = "prompts/";
}
