package com.talewright.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * {@link TextGenerator} backed by Spring AI's {@link ChatClient}.
 * <p>
 * Model and output budget are passed per call as {@link ChatOptions}, so one client serves
 * every run regardless of the model the run selected.
 */
@Service
public class SpringAiTextGenerator implements TextGenerator {

    private static final Logger log = LoggerFactory.getLogger(SpringAiTextGenerator.class);

    private final ChatClient chatClient;

    public SpringAiTextGenerator(ChatClient.Builder builder,
                                 @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        log.info("SpringAiTextGenerator initialized, OpenAI base-url: {}", baseUrl);
    }

    @Override
    public String complete(CompletionRequest request) {
        long start = System.currentTimeMillis();
        var options = ChatOptions.builder()
                .model(request.model())
                .maxTokens(request.maxTokens())
                .temperature(request.temperature())
                .build();
        String content = chatClient.prompt()
                .system(request.systemPrompt())
                .user(request.userPrompt())
                .options(options)
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.debug("Model {} responded in {}s ({} chars)", request.model(),
                String.format("%.1f", elapsed / 1000.0), content == null ? 0 : content.length());
        if (content == null || content.isBlank()) {
            throw new LlmEmptyResponseException("Model " + request.model() + " returned empty content");
        }
        return content;
    }
}
