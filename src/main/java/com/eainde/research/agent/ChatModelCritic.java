package com.eainde.research.agent;

import com.eainde.research.engine.Critic;
import dev.langchain4j.model.chat.ChatModel;

/**
 * {@link Critic} backed by a chat model; the role decides which instructions it follows.
 */
public class ChatModelCritic extends ChatModelAgent implements Critic {

    public ChatModelCritic(ChatModel chatModel, ResearchRole role, String systemPrompt) {
        super(chatModel, role, systemPrompt);
        if (!role.isCritic()) {
            throw new IllegalArgumentException(role + " is not a critic role");
        }
    }

    @Override
    public String evaluate(String prompt) {
        String text = ask(prompt);
        return text != null ? text : "";
    }
}
