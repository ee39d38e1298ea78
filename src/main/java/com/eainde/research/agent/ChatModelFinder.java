package com.eainde.research.agent;

import com.eainde.research.engine.Finder;
import com.eainde.research.engine.SubtaskRunner;
import dev.langchain4j.model.chat.ChatModel;

/**
 * {@link Finder} backed by a chat model. Tools, if any, are configured on the model itself.
 */
public class ChatModelFinder extends ChatModelAgent implements Finder {

    public ChatModelFinder(ChatModel chatModel, String systemPrompt) {
        super(chatModel, ResearchRole.FINDER, systemPrompt);
    }

    @Override
    public String find(String query) {
        String text = ask(query);
        return text != null ? text : SubtaskRunner.NO_FINDINGS;
    }
}
