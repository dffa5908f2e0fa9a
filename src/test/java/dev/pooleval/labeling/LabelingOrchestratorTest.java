package dev.pooleval.labeling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import dev.pooleval.error.ClassificationException;
import dev.pooleval.error.ConfigurationException;
import dev.pooleval.fixture.PooledDocumentBuilder;
import dev.pooleval.pool.DocumentKey;
import dev.pooleval.pool.PooledDocument;
import dev.pooleval.pool.RelevanceJudgment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LabelingOrchestratorTest {

    private static final Clock FIXED_CLOCK =
            Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneId.of("UTC"));

    private static final LabelingOptions OPTIONS = LabelingOptions.defaults("AI-TEST");

    private final InMemoryJudgmentStore store = new InMemoryJudgmentStore();
    private final LabelingProgressTracker tracker = new LabelingProgressTracker(FIXED_CLOCK);
    private final Queue<String> submitted = new ConcurrentLinkedQueue<>();

    private LabelingOrchestrator orchestrator;

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    private LabelingOrchestrator orchestratorWith(RelevanceJudge judge) {
        RelevanceJudge recording = (query, content) -> {
            submitted.add(content.docId());
            return judge.classify(query, content);
        };
        orchestrator = new LabelingOrchestrator(recording, store, tracker, FIXED_CLOCK,
                new LabelingProperties());
        return orchestrator;
    }

    private static List<PooledDocument> pool(int size) {
        List<PooledDocument> docs = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            docs.add(new PooledDocumentBuilder().docId("d" + i).rank("bm25", i + 1).build());
        }
        return docs;
    }

    private static RelevanceJudge constant(int grade) {
        return (query, content) -> new Classification(grade, "grade " + grade);
    }

    @Test
    void labelsEveryPendingDocument() {
        LabelingReport report = orchestratorWith(constant(2)).label(pool(3), OPTIONS);

        assertThat(report.totalDocuments()).isEqualTo(3);
        assertThat(report.alreadyJudged()).isZero();
        assertThat(report.attempted()).isEqualTo(3);
        assertThat(report.labeled()).isEqualTo(3);
        assertThat(report.failed()).isZero();
        assertThat(report.totalJudgedAfterRun()).isEqualTo(3);
        assertThat(report.gradeDistribution()).containsEntry(2, 3).containsEntry(0, 0);
        assertThat(report.successRate()).isEqualTo(1.0);

        RelevanceJudgment judgment = store.find(new DocumentKey("laptop", "d0")).orElseThrow();
        assertThat(judgment.relevance()).isEqualTo(2);
        assertThat(judgment.labeledBy()).isEqualTo("AI-TEST");
        assertThat(judgment.labeledAt()).isEqualTo(FIXED_CLOCK.instant());
        assertThat(judgment.notes()).isEqualTo("grade 2");
    }

    @Test
    void skipsDocumentsJudgedOnTheRowOrInTheStore() {
        List<PooledDocument> docs = List.of(
                new PooledDocumentBuilder().docId("row-judged").grade(1).build(),
                new PooledDocumentBuilder().docId("store-judged").build(),
                new PooledDocumentBuilder().docId("pending").build());
        store.save(new RelevanceJudgment("laptop", "store-judged", 0, "human", FIXED_CLOCK.instant(),
                null));

        LabelingReport report = orchestratorWith(constant(2)).label(docs, OPTIONS);

        assertThat(submitted).containsExactly("pending");
        assertThat(report.alreadyJudged()).isEqualTo(2);
        assertThat(report.pending()).isEqualTo(1);
        assertThat(report.totalJudgedAfterRun()).isEqualTo(3);
        assertThat(report.gradeDistribution())
                .containsEntry(0, 1)
                .containsEntry(1, 1)
                .containsEntry(2, 1);
    }

    @Test
    void failedJudgmentCountsAsPendingOnResume() {
        List<PooledDocument> docs = List.of(new PooledDocumentBuilder().docId("d0").build());
        store.save(RelevanceJudgment.failed(new DocumentKey("laptop", "d0"), "AI-TEST",
                FIXED_CLOCK.instant(), "timeout"));

        LabelingReport report = orchestratorWith(constant(1)).label(docs, OPTIONS);

        assertThat(submitted).containsExactly("d0");
        assertThat(report.labeled()).isEqualTo(1);
        assertThat(store.find(new DocumentKey("laptop", "d0")).orElseThrow().relevance()).isEqualTo(1);
    }

    @Test
    void skipDisabledResubmitsJudgedDocuments() {
        List<PooledDocument> docs = List.of(
                new PooledDocumentBuilder().docId("d0").grade(0).build(),
                new PooledDocumentBuilder().docId("d1").build());

        LabelingReport report = orchestratorWith(constant(2))
                .label(docs, OPTIONS.withSkipAlreadyJudged(false));

        assertThat(submitted).containsExactlyInAnyOrder("d0", "d1");
        assertThat(report.alreadyJudged()).isEqualTo(1);
        assertThat(report.attempted()).isEqualTo(2);
    }

    @Test
    void duplicateDocumentsAreSubmittedOnce() {
        PooledDocument doc = new PooledDocumentBuilder().docId("d0").build();

        LabelingReport report = orchestratorWith(constant(2)).label(List.of(doc, doc), OPTIONS);

        assertThat(submitted).containsExactly("d0");
        assertThat(report.totalDocuments()).isEqualTo(1);
    }

    @Test
    void neverExceedsConcurrencyLimit() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        RelevanceJudge slow = (query, content) -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            return new Classification(1, null);
        };

        LabelingReport report = orchestratorWith(slow).label(pool(30), OPTIONS.withConcurrency(4));

        assertThat(report.labeled()).isEqualTo(30);
        assertThat(maxInFlight.get()).isBetween(1, 4);
    }

    @Test
    void failedCallIsRecordedAndBatchContinues() {
        RelevanceJudge flaky = (query, content) -> {
            if (content.docId().equals("d1")) {
                throw new ClassificationException("Missing 'relevance' field");
            }
            return new Classification(2, null);
        };

        LabelingReport report = orchestratorWith(flaky).label(pool(3), OPTIONS);

        assertThat(report.labeled()).isEqualTo(2);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.sampledErrors()).singleElement().asString().contains("Missing 'relevance'");
        RelevanceJudgment failed = store.find(new DocumentKey("laptop", "d1")).orElseThrow();
        assertThat(failed.relevance()).isNull();
        assertThat(failed.notes()).contains("Missing 'relevance' field");
        assertThat(report.totalJudgedAfterRun()).isEqualTo(2);
    }

    @Test
    void keepsAtMostFiveDistinctSampledErrors() {
        RelevanceJudge failing = (query, content) -> {
            throw new IllegalStateException("boom " + content.docId());
        };

        LabelingReport report = orchestratorWith(failing).label(pool(10), OPTIONS);

        assertThat(report.failed()).isEqualTo(10);
        assertThat(report.sampledErrors()).hasSize(5).doesNotHaveDuplicates();
        assertThat(report.successRate()).isZero();
    }

    @Test
    void identicalErrorsAreSampledOnce() {
        RelevanceJudge failing = (query, content) -> {
            throw new ClassificationException("rate limited");
        };

        LabelingReport report = orchestratorWith(failing).label(pool(4), OPTIONS);

        assertThat(report.sampledErrors()).containsExactly("ClassificationException: rate limited");
    }

    @Test
    void limitedRunThenResumeLabelsEverythingOnce() {
        List<PooledDocument> docs = pool(5);
        LabelingOrchestrator labeling = orchestratorWith(constant(1));

        LabelingReport first = labeling.label(docs, OPTIONS.withLimit(2));
        assertThat(first.pending()).isEqualTo(5);
        assertThat(first.attempted()).isEqualTo(2);
        assertThat(List.copyOf(submitted)).containsExactlyInAnyOrder("d0", "d1");

        LabelingReport second = labeling.label(docs, OPTIONS);

        assertThat(second.alreadyJudged()).isEqualTo(2);
        assertThat(second.attempted()).isEqualTo(3);
        assertThat(second.totalJudgedAfterRun()).isEqualTo(5);
        assertThat(submitted).hasSize(5).doesNotHaveDuplicates();
    }

    @Test
    void timedOutCallIsRecordedAsFailure() {
        RelevanceJudge hanging = (query, content) -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new Classification(2, null);
        };

        LabelingReport report = orchestratorWith(hanging)
                .label(pool(1), OPTIONS.withCallTimeout(Duration.ofMillis(50)));

        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.labeled()).isZero();
        assertThat(store.find(new DocumentKey("laptop", "d0")).orElseThrow().notes())
                .startsWith("Timed out");
    }

    @Test
    void timedOutCallKeepsItsSlotUntilItReturns() {
        AtomicLong firstReturnedAt = new AtomicLong();
        AtomicLong secondStartedAt = new AtomicLong();
        RelevanceJudge judge = (query, content) -> {
            if (content.docId().equals("d0")) {
                long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(300);
                while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                }
                firstReturnedAt.set(System.nanoTime());
            } else {
                secondStartedAt.set(System.nanoTime());
            }
            return new Classification(1, null);
        };

        LabelingReport report = orchestratorWith(judge)
                .label(pool(2), OPTIONS.withConcurrency(1).withCallTimeout(Duration.ofMillis(50)));

        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.labeled()).isEqualTo(1);
        assertThat(secondStartedAt.get()).isGreaterThanOrEqualTo(firstReturnedAt.get());
    }

    @Test
    void labelAsyncExposesProgressWhileRunning() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        RelevanceJudge gated = (query, content) -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new Classification(2, null);
        };

        LabelingRun run = orchestratorWith(gated).labelAsync(pool(3), OPTIONS);

        LabelingProgress running = tracker.getProgress(run.runId()).orElseThrow();
        assertThat(running.status()).isEqualTo(LabelingProgress.Status.RUNNING);
        assertThat(running.totalPending()).isEqualTo(3);
        assertThat(running.settled()).isZero();

        release.countDown();
        LabelingReport report = run.completion().get(5, TimeUnit.SECONDS);

        assertThat(report.labeled()).isEqualTo(3);
        LabelingProgress done = tracker.getProgress(run.runId()).orElseThrow();
        assertThat(done.status()).isEqualTo(LabelingProgress.Status.COMPLETED);
        assertThat(done.completed()).isEqualTo(3);
    }

    @Test
    void emptyPoolProducesEmptyReport() {
        LabelingReport report = orchestratorWith(constant(2)).label(List.of(), OPTIONS);

        assertThat(report.attempted()).isZero();
        assertThat(report.successRate()).isEqualTo(1.0);
        assertThat(submitted).isEmpty();
    }

    @Test
    void overrideReplacesStoredJudgment() {
        LabelingOrchestrator labeling = orchestratorWith(constant(0));
        DocumentKey key = new DocumentKey("laptop", "d0");
        store.save(new RelevanceJudgment("laptop", "d0", 0, "AI-TEST", FIXED_CLOCK.instant(), null));

        RelevanceJudgment manual = labeling.override(key, 2, "alice", "checked by hand");

        assertThat(store.find(key)).contains(manual);
        assertThat(manual.relevance()).isEqualTo(2);
        assertThat(manual.labeledBy()).isEqualTo("alice");
    }

    @Test
    void overrideRejectsInvalidGrade() {
        LabelingOrchestrator labeling = orchestratorWith(constant(0));

        assertThatThrownBy(() -> labeling.override(new DocumentKey("laptop", "d0"), 3, "alice", null))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void attachJudgmentsPrefersStoredGrades() {
        LabelingOrchestrator labeling = orchestratorWith(constant(0));
        List<PooledDocument> docs = List.of(
                new PooledDocumentBuilder().docId("stored").grade(0).build(),
                new PooledDocumentBuilder().docId("row-only").grade(1).build(),
                new PooledDocumentBuilder().docId("failed").build(),
                new PooledDocumentBuilder().docId("untouched").build());
        store.save(new RelevanceJudgment("laptop", "stored", 2, "alice", FIXED_CLOCK.instant(), null));
        store.save(RelevanceJudgment.failed(new DocumentKey("laptop", "row-only"), "AI-TEST",
                FIXED_CLOCK.instant(), "timeout"));
        store.save(RelevanceJudgment.failed(new DocumentKey("laptop", "failed"), "AI-TEST",
                FIXED_CLOCK.instant(), "timeout"));

        List<PooledDocument> judged = labeling.attachJudgments(docs);

        assertThat(judged.get(0).relevance()).isEqualTo(2);
        assertThat(judged.get(1).relevance()).isEqualTo(1);
        assertThat(judged.get(2).judgment()).isNotNull();
        assertThat(judged.get(2).isJudged()).isFalse();
        assertThat(judged.get(3).judgment()).isNull();
    }

    @Test
    void optionsRejectInvalidValues() {
        assertThatThrownBy(() -> OPTIONS.withConcurrency(0)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> OPTIONS.withLimit(-1)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> OPTIONS.withCallTimeout(Duration.ZERO))
                .isInstanceOf(ConfigurationException.class);
    }
}
