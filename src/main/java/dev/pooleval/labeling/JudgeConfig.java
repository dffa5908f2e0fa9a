package dev.pooleval.labeling;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.pooleval.error.ConfigurationException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Wires the labeling capabilities: the judge's chat model and the judgment store.
 *
 * <p>The chat model is lazy so that pooling and metrics runs start without an API key.
 */
@Configuration
public class JudgeConfig {

    private static final Logger log = LoggerFactory.getLogger(JudgeConfig.class);

    /**
     * Creates the OpenAI-compatible chat model used by {@link LlmRelevanceJudge}.
     *
     * <p>Retries are disabled: a failed call is recorded and the document is picked up again by the
     * next resumed run.
     */
    @Bean
    @Lazy
    public ChatModel judgeChatModel(JudgeProperties properties) {
        if (properties.apiKey() == null || properties.apiKey().isBlank()) {
            throw new ConfigurationException("pooleval.judge.api-key must be set to label documents");
        }
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(properties.apiKey())
                .modelName(properties.modelName())
                .temperature(properties.temperature())
                .maxTokens(properties.maxTokens())
                .timeout(properties.timeout())
                .maxRetries(0);
        if (properties.baseUrl() != null && !properties.baseUrl().isBlank()) {
            builder.baseUrl(properties.baseUrl());
        }
        log.info("Judge chat model: {} ({})", properties.modelName(),
                properties.baseUrl() == null ? "default endpoint" : properties.baseUrl());
        return builder.build();
    }

    /**
     * Judgments go to the JSON Lines journal when {@code pooleval.labeling.journal} is set,
     * otherwise they live in memory.
     */
    @Bean
    @Lazy
    public JudgmentStore judgmentStore(LabelingProperties properties) {
        Path journal = properties.getJournal();
        if (journal == null) {
            return new InMemoryJudgmentStore();
        }
        try {
            return JsonLinesJudgmentStore.open(journal);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open judgment journal " + journal, e);
        }
    }
}
