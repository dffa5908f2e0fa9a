package dev.pooleval.labeling;

import dev.pooleval.error.ClassificationException;

/**
 * Capability that grades how relevant a document is to a query.
 *
 * <p>Implementations may be slow, fail, or return different grades for the same input. The
 * orchestrator treats every call as fallible and never retries.
 */
public interface RelevanceJudge {

    /**
     * Classify one (query, document) pair.
     *
     * @param query   the query text
     * @param content the document text to judge
     * @return the grade (0, 1 or 2) and the judge's reasoning
     * @throws ClassificationException when the judge cannot produce a valid grade
     */
    Classification classify(String query, DocumentContent content);
}
