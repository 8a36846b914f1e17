package com.eainde.verity.integration;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.log4j.Log4j2;

import java.util.List;

/**
 * {@link ReasoningClient} backed by a LangChain4j {@link ChatModel}.
 * Temperature is set per request; the model's own retry and timeout settings apply.
 */
@Log4j2
public class LangChainReasoningClient implements ReasoningClient {

    private final ChatModel chatModel;

    public LangChainReasoningClient(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public ReasoningResponse reason(String systemPrompt, String userMessage, double temperature) {
        ChatRequest request = ChatRequest.builder()
                .messages(List.of(SystemMessage.from(systemPrompt), UserMessage.from(userMessage)))
                .temperature(temperature)
                .build();

        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException e) {
            throw new CollaboratorException("Reasoning call failed: " + e.getMessage(), e);
        }
        if (response == null || response.aiMessage() == null) {
            throw new MalformedResponseException("Reasoning call returned no message");
        }

        TokenUsage usage = response.tokenUsage();
        int inputTokens = usage != null && usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
        int outputTokens = usage != null && usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
        log.debug("Reasoning call complete ({} in / {} out tokens)", inputTokens, outputTokens);
        return new ReasoningResponse(response.aiMessage().text(), inputTokens, outputTokens);
    }
}
