package dev.pooleval.labeling;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;

import dev.pooleval.pool.DocumentKey;
import dev.pooleval.pool.RelevanceJudgment;
import org.junit.jupiter.api.Test;

class InMemoryJudgmentStoreTest {

    private static final Instant LABELED_AT = Instant.parse("2026-03-01T09:00:00Z");

    private final InMemoryJudgmentStore store = new InMemoryJudgmentStore();

    @Test
    void findReturnsEmptyForUnknownKey() {
        assertThat(store.find(new DocumentKey("laptop", "d1"))).isEmpty();
    }

    @Test
    void saveReplacesExistingJudgment() {
        store.save(new RelevanceJudgment("laptop", "d1", 0, "AI-TEST", LABELED_AT, null));
        store.save(new RelevanceJudgment("laptop", "d1", 2, "alice", LABELED_AT, "manual"));

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.find(new DocumentKey("laptop", "d1")).orElseThrow().labeledBy())
                .isEqualTo("alice");
    }

    @Test
    void findAllIsOrderedByKey() {
        store.save(new RelevanceJudgment("phone", "d1", 1, "AI-TEST", LABELED_AT, null));
        store.save(new RelevanceJudgment("laptop", "d2", 1, "AI-TEST", LABELED_AT, null));
        store.save(new RelevanceJudgment("laptop", "d1", 1, "AI-TEST", LABELED_AT, null));

        assertThat(store.findAll())
                .extracting(RelevanceJudgment::key)
                .containsExactly(
                        new DocumentKey("laptop", "d1"),
                        new DocumentKey("laptop", "d2"),
                        new DocumentKey("phone", "d1"));
    }
}
