package dev.pooleval.labeling;

import dev.pooleval.pool.DocumentKey;
import dev.pooleval.pool.RelevanceJudgment;
import java.util.List;
import java.util.Optional;

/**
 * Persistence capability for relevance judgments, at most one per (query, docId).
 *
 * <p>Implementations must be safe for concurrent {@link #save} calls from labeling workers. A save
 * replaces any earlier judgment for the same key; judgments are never deleted.
 */
public interface JudgmentStore {

    Optional<RelevanceJudgment> find(DocumentKey key);

    void save(RelevanceJudgment judgment);

    /** All current judgments, ordered by key. */
    List<RelevanceJudgment> findAll();
}
