package dev.pooleval.labeling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.pooleval.error.ClassificationException;
import dev.pooleval.pool.RelevanceJudgment;

import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * {@link RelevanceJudge} backed by a chat model.
 *
 * <p>The model is asked for a JSON object {@code {"relevance": 0|1|2, "reason": "..."}}. Answers
 * wrapped in a Markdown code fence are accepted. Anything else is a {@link ClassificationException}.
 */
@Component
@Lazy
public class LlmRelevanceJudge implements RelevanceJudge {

    static final String SYSTEM_PROMPT =
            "You are a search quality expert. Always respond in valid JSON format.";

    static final String USER_PROMPT_TEMPLATE = """
            You are an expert in search quality evaluation. Assess how relevant the document is \
            to the search query.

            **Grading scale:**
            - 2 (highly relevant): the document gives a direct and complete answer to the query
            - 1 (partially relevant): the document is related to the query but is not a complete answer
            - 0 (not relevant): the document has nothing to do with the query

            **Query:**
            %s

            **Document title:**
            %s

            **Document content:**
            %s

            **Instructions:**
            1. Judge the relevance of the document to the query carefully
            2. Respond with JSON only
            3. Explain your grade briefly

            **Response format (JSON only):**
            {
              "relevance": 0 or 1 or 2,
              "reason": "one-sentence reason"
            }
            """;

    static final String MISSING_TITLE = "(no title)";
    static final String MISSING_CONTENT = "(no content)";

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final int maxContentChars;

    public LlmRelevanceJudge(@Qualifier("judgeChatModel") ChatModel chatModel,
                             ObjectMapper objectMapper,
                             LabelingProperties properties) {
        this(chatModel, objectMapper, properties.getMaxContentChars());
    }

    LlmRelevanceJudge(ChatModel chatModel, ObjectMapper objectMapper, int maxContentChars) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.maxContentChars = maxContentChars;
    }

    @Override
    public Classification classify(String query, DocumentContent content) {
        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(prompt(query, content)))
                .build();
        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException e) {
            throw new ClassificationException("Chat model call failed: " + e.getMessage(), e);
        }
        if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
            throw new ClassificationException("Chat model returned an empty response");
        }
        return parse(response.aiMessage().text());
    }

    String prompt(String query, DocumentContent content) {
        String title = content.title() == null ? MISSING_TITLE : content.title();
        String body = content.body() == null ? MISSING_CONTENT : truncate(content.body());
        return USER_PROMPT_TEMPLATE.formatted(query, title, body);
    }

    private String truncate(String body) {
        return body.length() <= maxContentChars ? body : body.substring(0, maxContentChars);
    }

    /**
     * Parse a judge answer into a classification.
     *
     * @throws ClassificationException on unparsable JSON, a missing grade or a grade outside 0..2
     */
    Classification parse(String answer) {
        String json = stripCodeFence(answer.strip());
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ClassificationException("Unparsable judge response: " + abbreviate(json), e);
        }
        if (root == null || !root.isObject()) {
            throw new ClassificationException(
                    "Judge response is not a JSON object: " + abbreviate(json));
        }
        JsonNode relevance = root.get("relevance");
        if (relevance == null || relevance.isNull()) {
            throw new ClassificationException("Missing 'relevance' field");
        }
        int grade = toGrade(relevance);
        if (grade < 0 || grade > RelevanceJudgment.MAX_GRADE) {
            throw new ClassificationException("Invalid relevance value: " + grade);
        }
        JsonNode reason = root.get("reason");
        return new Classification(grade, reason == null || reason.isNull() ? null : reason.asText());
    }

    private static int toGrade(JsonNode relevance) {
        if (relevance.isNumber()) {
            if (!relevance.canConvertToExactIntegral() || !relevance.canConvertToInt()) {
                throw new ClassificationException("Invalid relevance value: " + relevance);
            }
            return relevance.intValue();
        }
        if (relevance.isTextual()) {
            try {
                return Integer.parseInt(relevance.asText().strip());
            } catch (NumberFormatException e) {
                throw new ClassificationException("Invalid relevance value: " + relevance.asText(), e);
            }
        }
        throw new ClassificationException("Invalid relevance value: " + relevance);
    }

    static String stripCodeFence(String answer) {
        String fenced = between(answer, "```json");
        if (fenced == null) {
            fenced = between(answer, "```");
        }
        return fenced == null ? answer : fenced.strip();
    }

    private static @Nullable String between(String text, String openingFence) {
        int start = text.indexOf(openingFence);
        if (start < 0) {
            return null;
        }
        int from = start + openingFence.length();
        int end = text.indexOf("```", from);
        return end < 0 ? text.substring(from) : text.substring(from, end);
    }

    private static String abbreviate(String text) {
        return text.length() <= 120 ? text : text.substring(0, 120) + "...";
    }
}
