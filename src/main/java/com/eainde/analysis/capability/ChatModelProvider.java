package com.eainde.analysis.capability;

import dev.langchain4j.model.chat.ChatModel;

/**
 * Supplies the {@link ChatModel} serving a given model id.
 */
@FunctionalInterface
public interface ChatModelProvider {

    ChatModel forModel(String modelId);
}
