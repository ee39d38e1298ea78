package com.eainde.research.agent;

import com.eainde.research.engine.Critic;
import com.eainde.research.engine.Finder;
import dev.langchain4j.model.chat.ChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the Finder and the Critic roles from chat models and system prompts.
 *
 * <p>The Finder and the Critic may use different models; all three Critic roles share one.</p>
 *
 * Usage in config:
 * <pre>
 *   Finder finder   = agentFactory.finder();
 *   Critic planner  = agentFactory.critic(ResearchRole.PLANNER);
 *   Critic reviewer = agentFactory.critic(ResearchRole.EVALUATOR);
 * </pre>
 */
public class ResearchAgentFactory {

    private static final Logger log = LoggerFactory.getLogger(ResearchAgentFactory.class);

    private final ChatModel finderModel;
    private final ChatModel criticModel;
    private final PromptService promptService;

    public ResearchAgentFactory(ChatModel finderModel, ChatModel criticModel, PromptService promptService) {
        this.finderModel = finderModel;
        this.criticModel = criticModel;
        this.promptService = promptService;
    }

    public Finder finder() {
        log.debug("Building agent: {}", ResearchRole.FINDER);
        return new ChatModelFinder(finderModel, promptService.getSystemPrompt(ResearchRole.FINDER));
    }

    /**
     * @param role PLANNER, EVALUATOR or SYNTHESIZER
     * @throws IllegalArgumentException for {@link ResearchRole#FINDER}
     */
    public Critic critic(ResearchRole role) {
        log.debug("Building agent: {}", role);
        return switch (role) {
            case PLANNER, EVALUATOR, SYNTHESIZER ->
                    new ChatModelCritic(criticModel, role, promptService.getSystemPrompt(role));
            case FINDER -> throw new IllegalArgumentException("FINDER is not a critic role, use finder()");
        };
    }
}
