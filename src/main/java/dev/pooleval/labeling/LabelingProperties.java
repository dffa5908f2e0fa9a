package dev.pooleval.labeling;

import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for relevance labeling, bound from {@code pooleval.labeling.*}.
 *
 * <ul>
 *   <li>{@code concurrency} - maximum outstanding judge calls (default 10, bounded [1, 256])
 *   <li>{@code skip-already-judged} - resume by skipping documents that already carry a grade
 *   <li>{@code call-timeout} - per-call timeout (default 120s)
 *   <li>{@code labeled-by} - label written into each judgment
 *   <li>{@code body-fields} - content columns tried in order for the judged text
 *   <li>{@code title-field} - content column holding the title
 *   <li>{@code max-content-chars} - judged text is truncated to this length (default 2000)
 *   <li>{@code journal} - JSON Lines judgment journal; judgments stay in memory when unset
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "pooleval.labeling")
public class LabelingProperties {

    private int concurrency = 10;
    private boolean skipAlreadyJudged = true;
    private Duration callTimeout = Duration.ofSeconds(120);
    private String labeledBy = "AI-GPT4";
    private List<String> bodyFields = new ArrayList<>(List.of("merged_comment", "CONTENT"));
    private String titleField = "TITLE";
    private int maxContentChars = 2000;
    private @Nullable Path journal;

    /** Validates configuration at startup. Throws if values are out of allowed range. */
    @PostConstruct
    void validate() {
        if (concurrency < 1 || concurrency > 256) {
            throw new IllegalStateException(
                    "pooleval.labeling.concurrency must be in [1, 256], got: " + concurrency);
        }
        if (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalStateException(
                    "pooleval.labeling.call-timeout must be positive, got: " + callTimeout);
        }
        if (labeledBy == null || labeledBy.isBlank()) {
            throw new IllegalStateException("pooleval.labeling.labeled-by must not be blank");
        }
        if (bodyFields == null || bodyFields.isEmpty()) {
            throw new IllegalStateException("pooleval.labeling.body-fields must not be empty");
        }
        if (maxContentChars < 1) {
            throw new IllegalStateException(
                    "pooleval.labeling.max-content-chars must be positive, got: " + maxContentChars);
        }
    }

    /** Run options built from these defaults, with an optional document limit. */
    public LabelingOptions toOptions(@Nullable Integer limit) {
        return new LabelingOptions(concurrency, skipAlreadyJudged, limit, callTimeout, labeledBy);
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public boolean isSkipAlreadyJudged() {
        return skipAlreadyJudged;
    }

    public void setSkipAlreadyJudged(boolean skipAlreadyJudged) {
        this.skipAlreadyJudged = skipAlreadyJudged;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public String getLabeledBy() {
        return labeledBy;
    }

    public void setLabeledBy(String labeledBy) {
        this.labeledBy = labeledBy;
    }

    public List<String> getBodyFields() {
        return bodyFields;
    }

    public void setBodyFields(List<String> bodyFields) {
        this.bodyFields = bodyFields;
    }

    public String getTitleField() {
        return titleField;
    }

    public void setTitleField(String titleField) {
        this.titleField = titleField;
    }

    public int getMaxContentChars() {
        return maxContentChars;
    }

    public void setMaxContentChars(int maxContentChars) {
        this.maxContentChars = maxContentChars;
    }

    public @Nullable Path getJournal() {
        return journal;
    }

    public void setJournal(@Nullable Path journal) {
        this.journal = journal;
    }
}
