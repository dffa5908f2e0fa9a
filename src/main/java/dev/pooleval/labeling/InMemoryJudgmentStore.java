package dev.pooleval.labeling;

import dev.pooleval.pool.DocumentKey;
import dev.pooleval.pool.RelevanceJudgment;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/** Judgment store held in memory for the lifetime of the process. */
public class InMemoryJudgmentStore implements JudgmentStore {

    private final ConcurrentSkipListMap<DocumentKey, RelevanceJudgment> judgments =
            new ConcurrentSkipListMap<>();

    @Override
    public Optional<RelevanceJudgment> find(DocumentKey key) {
        return Optional.ofNullable(judgments.get(key));
    }

    @Override
    public void save(RelevanceJudgment judgment) {
        judgments.put(judgment.key(), judgment);
    }

    @Override
    public List<RelevanceJudgment> findAll() {
        return List.copyOf(judgments.values());
    }

    public int size() {
        return judgments.size();
    }
}
