package com.fundermatch.matching.ai;

import com.fundermatch.config.FunderMatchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

/**
 * Scores funders through Spring AI's {@link ChatClient} backed by the Anthropic Messages API.
 */
@Component
public class AnthropicScoringClient implements ScoringClient {
    private static final Logger log = LoggerFactory.getLogger(AnthropicScoringClient.class);

    private final ChatClient chatClient;
    private final FunderMatchProperties properties;

    public AnthropicScoringClient(ChatClient.Builder chatClientBuilder, FunderMatchProperties properties) {
        this.chatClient = chatClientBuilder.build();
        this.properties = properties;
    }

    @Override
    public String score(String systemPrompt, String userPrompt) {
        FunderMatchProperties.Matching matching = properties.getMatching();
        log.info("Calling scoring model {} (maxTokens={})", matching.getModel(), matching.getMaxTokens());
        return chatClient.prompt()
            .system(systemPrompt)
            .user(userPrompt)
            .options(AnthropicChatOptions.builder()
                .model(matching.getModel())
                .maxTokens(matching.getMaxTokens())
                .temperature(matching.getTemperature())
                .build())
            .call()
            .content();
    }
}
