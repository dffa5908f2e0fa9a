package dev.pooleval.labeling;

import dev.pooleval.pool.RelevanceJudgment;
import org.jspecify.annotations.Nullable;

/**
 * Result of a single successful relevance classification.
 *
 * @param grade  relevance grade in [0, {@link RelevanceJudgment#MAX_GRADE}]
 * @param reason short explanation from the judge, if it gave one
 */
public record Classification(int grade, @Nullable String reason) {

    public Classification {
        if (grade < 0 || grade > RelevanceJudgment.MAX_GRADE) {
            throw new IllegalArgumentException("Grade must be 0, 1, or 2 but was " + grade);
        }
    }
}
