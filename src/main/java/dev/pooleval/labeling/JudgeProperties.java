package dev.pooleval.labeling;

import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Chat model settings for the LLM relevance judge, bound from {@code pooleval.judge.*}.
 *
 * <p>The API key and endpoint are explicit values; nothing in the labeling code reads the process
 * environment. A blank {@code baseUrl} means the provider's default endpoint.
 */
@ConfigurationProperties(prefix = "pooleval.judge")
public record JudgeProperties(
        @Nullable String baseUrl,
        @Nullable String apiKey,
        @DefaultValue("gpt-4o-mini") String modelName,
        @DefaultValue("0.1") double temperature,
        @DefaultValue("200") int maxTokens,
        @DefaultValue("120s") Duration timeout
) {
}
