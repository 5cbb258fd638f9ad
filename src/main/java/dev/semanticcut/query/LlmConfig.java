package dev.semanticcut.query;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LlmConfig {

    /**
     * OpenAI-compatible chat model for query understanding. Only created when an API key is set;
     * without it {@link QueryUnderstandingService} degrades to the raw query.
     *
     * <p>Retries are disabled: a slow or failing provider costs one attempt, then the fallback.
     */
    @Bean
    @ConditionalOnExpression("!'${semanticcut.llm.api-key:}'.isBlank()")
    public ChatModel queryUnderstandingChatModel(LlmProperties properties) {
        return OpenAiChatModel.builder()
                .baseUrl(properties.baseUrl())
                .apiKey(properties.apiKey())
                .modelName(properties.model())
                .temperature(properties.temperature())
                .maxTokens(properties.maxTokens())
                .timeout(properties.timeout())
                .maxRetries(0)
                .build();
    }
}
