package com.eainde.research.agent;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Base for the langchain4j-backed roles: one stateless system + user exchange per call.
 * Instances hold no conversation memory, so they can be shared between sessions.
 */
public abstract class ChatModelAgent {

    private static final Logger log = LoggerFactory.getLogger(ChatModelAgent.class);

    private final ChatModel chatModel;
    private final ResearchRole role;
    private final String systemPrompt;

    protected ChatModelAgent(ChatModel chatModel, ResearchRole role, String systemPrompt) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.role = Objects.requireNonNull(role, "role");
        this.systemPrompt = Objects.requireNonNull(systemPrompt, "systemPrompt");
    }

    /**
     * Sends the prompt and returns the reply text, or null when the model returned none.
     */
    protected String ask(String userPrompt) {
        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt))
                .build();

        log.debug("[{}] sending prompt ({} chars)", role, userPrompt.length());
        ChatResponse response = chatModel.chat(request);

        AiMessage message = response != null ? response.aiMessage() : null;
        String text = message != null ? message.text() : null;
        log.debug("[{}] received reply ({} chars)", role, text != null ? text.length() : 0);
        return text;
    }

    public ResearchRole getRole() {
        return role;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{role=" + role + '}';
    }
}
