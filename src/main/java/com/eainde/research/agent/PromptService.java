package com.eainde.research.agent;

/**
 * Source of the system prompt (role instructions) for each research role.
 */
public interface PromptService {

    String getSystemPrompt(ResearchRole role);
}
