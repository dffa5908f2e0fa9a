package dev.pooleval.labeling;

import dev.pooleval.error.ConfigurationException;
import dev.pooleval.pool.DocumentKey;
import dev.pooleval.pool.PooledDocument;
import dev.pooleval.pool.RelevanceJudgment;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

/**
 * Drives a {@link RelevanceJudge} over the unjudged documents of a pool with bounded concurrency.
 *
 * <p>The pending set is computed once, before scheduling: every pool document minus those that
 * already carry a grade (on the row or in the store). A fixed pool of {@code concurrency} workers
 * consumes it. Each worker passes an admission gate of the same size before calling the judge; the
 * permit is released when the judge call itself returns, so a call abandoned on timeout still
 * holds its permit until it finishes.
 *
 * <p>Every settled call is written to the {@link JudgmentStore} immediately. A failed or timed-out
 * call becomes a judgment with a null grade and the error in its notes; the run carries on. There
 * is no retry: lower the concurrency and run again, already-judged documents are skipped.
 */
@Service
@Lazy
public class LabelingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(LabelingOrchestrator.class);

    static final int MAX_SAMPLED_ERRORS = 5;

    private final RelevanceJudge judge;
    private final JudgmentStore store;
    private final LabelingProgressTracker progressTracker;
    private final Clock clock;
    private final LabelingProperties properties;
    private final ExecutorService runExecutor = Executors.newCachedThreadPool(named("labeling-run-"));

    public LabelingOrchestrator(RelevanceJudge judge, JudgmentStore store,
                                LabelingProgressTracker progressTracker, Clock clock,
                                LabelingProperties properties) {
        this.judge = judge;
        this.store = store;
        this.progressTracker = progressTracker;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Label the pending documents of {@code pool} and block until every call has settled.
     *
     * @param pool    the pooled documents, in pool order
     * @param options run options
     * @return the run report
     */
    public LabelingReport label(List<PooledDocument> pool, LabelingOptions options) {
        LabelingPlan plan = plan(pool, options);
        String runId = UUID.randomUUID().toString();
        progressTracker.startRun(runId, plan.scheduled().size());
        return execute(runId, pool, plan, options);
    }

    /**
     * Start labeling in the background. Progress is readable through
     * {@link LabelingProgressTracker#getProgress(String)} with the returned run ID.
     */
    public LabelingRun labelAsync(List<PooledDocument> pool, LabelingOptions options) {
        LabelingPlan plan = plan(pool, options);
        String runId = UUID.randomUUID().toString();
        progressTracker.startRun(runId, plan.scheduled().size());
        CompletableFuture<LabelingReport> completion = CompletableFuture.supplyAsync(
                () -> execute(runId, pool, plan, options), runExecutor);
        return new LabelingRun(runId, completion);
    }

    /**
     * Record a manual judgment, replacing whatever the store held for the key.
     *
     * @param key       the (query, docId) being judged
     * @param grade     relevance grade 0, 1 or 2
     * @param annotator who made the judgment
     * @param notes     optional free text
     * @return the stored judgment
     */
    public RelevanceJudgment override(DocumentKey key, int grade, String annotator,
                                      @Nullable String notes) {
        if (grade < 0 || grade > RelevanceJudgment.MAX_GRADE) {
            throw new ConfigurationException("Grade must be 0, 1, or 2 but was " + grade);
        }
        if (annotator == null || annotator.isBlank()) {
            throw new ConfigurationException("annotator must not be blank");
        }
        RelevanceJudgment judgment = new RelevanceJudgment(
                key.query(), key.docId(), grade, annotator, clock.instant(), notes);
        store.save(judgment);
        log.info("Manual override for {} by {}: grade {}", key, annotator, grade);
        return judgment;
    }

    /**
     * Attach the best known judgment to each pool document.
     *
     * <p>A graded judgment in the store wins over the row's own; a graded row wins over a failed
     * attempt in the store; a failed attempt is attached only to otherwise unjudged rows.
     */
    public List<PooledDocument> attachJudgments(List<PooledDocument> pool) {
        List<PooledDocument> judged = new ArrayList<>(pool.size());
        for (PooledDocument doc : pool) {
            RelevanceJudgment effective = effectiveJudgment(doc);
            judged.add(effective == doc.judgment() ? doc : doc.withJudgment(effective));
        }
        return judged;
    }

    LabelingPlan plan(List<PooledDocument> pool, LabelingOptions options) {
        Map<DocumentKey, PooledDocument> unique = new LinkedHashMap<>();
        for (PooledDocument doc : pool) {
            unique.putIfAbsent(doc.key(), doc);
        }
        int alreadyJudged = 0;
        List<PooledDocument> pending = new ArrayList<>();
        for (PooledDocument doc : unique.values()) {
            if (isAlreadyJudged(doc)) {
                alreadyJudged++;
                if (!options.skipAlreadyJudged()) {
                    pending.add(doc);
                }
            } else {
                pending.add(doc);
            }
        }
        int pendingCount = options.skipAlreadyJudged() ? pending.size() : unique.size() - alreadyJudged;
        List<PooledDocument> scheduled = options.limit() == null || options.limit() >= pending.size()
                ? pending
                : pending.subList(0, options.limit());
        log.info("Labeling plan: {} documents, {} already judged, {} pending, {} scheduled",
                unique.size(), alreadyJudged, pendingCount, scheduled.size());
        return new LabelingPlan(unique.size(), alreadyJudged, pendingCount, List.copyOf(scheduled));
    }

    private boolean isAlreadyJudged(PooledDocument doc) {
        if (doc.isJudged()) {
            return true;
        }
        return store.find(doc.key()).map(RelevanceJudgment::isJudged).orElse(false);
    }

    private LabelingReport execute(String runId, List<PooledDocument> pool, LabelingPlan plan,
                                   LabelingOptions options) {
        Instant started = clock.instant();
        RunState state = new RunState();
        int concurrency = options.concurrency();
        ThreadPoolExecutor workers = new ThreadPoolExecutor(
                concurrency,
                concurrency,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                named("labeling-worker-")
        );
        ExecutorService calls = Executors.newCachedThreadPool(named("labeling-call-"));
        Semaphore gate = new Semaphore(concurrency);
        try {
            List<Future<?>> tasks = new ArrayList<>(plan.scheduled().size());
            for (PooledDocument doc : plan.scheduled()) {
                tasks.add(workers.submit(() -> labelOne(runId, doc, options, gate, calls, state)));
            }
            for (Future<?> task : tasks) {
                task.get();
            }
            progressTracker.completeRun(runId);
        } catch (InterruptedException e) {
            progressTracker.failRun(runId);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Labeling run " + runId + " was interrupted", e);
        } catch (ExecutionException e) {
            progressTracker.failRun(runId);
            throw new IllegalStateException("Labeling run " + runId + " failed", e.getCause());
        } finally {
            shutdown(workers);
            // abandoned calls keep running until they return; nothing waits for them
            calls.shutdown();
        }

        Duration elapsed = Duration.between(started, clock.instant());
        LabelingReport report = buildReport(pool, plan, state, elapsed);
        log.info("Labeling run {} finished: {} labeled, {} failed of {} attempted ({} of {} judged)",
                runId, report.labeled(), report.failed(), report.attempted(),
                report.totalJudgedAfterRun(), report.totalDocuments());
        if (!report.sampledErrors().isEmpty()) {
            log.warn("Labeling run {} sampled errors: {}", runId, report.sampledErrors());
        }
        return report;
    }

    private void labelOne(String runId, PooledDocument doc, LabelingOptions options, Semaphore gate,
                          ExecutorService calls, RunState state) {
        DocumentKey key = doc.key();
        RelevanceJudgment judgment;
        try {
            Classification classification = callJudge(doc, options, gate, calls);
            judgment = classification == null
                    ? failure(runId, state, key, options, "Judge returned no classification")
                    : new RelevanceJudgment(key.query(), key.docId(), classification.grade(),
                            options.labeledBy(), clock.instant(), classification.reason());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(runId, state, key, "Interrupted");
            return;
        } catch (TimeoutException e) {
            judgment = failure(runId, state, key, options,
                    "Timed out after " + options.callTimeout().toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            judgment = failure(runId, state, key, options, describe(cause));
        }

        try {
            store.save(judgment);
        } catch (RuntimeException e) {
            log.error("Failed to store judgment for {}", key, e);
            if (judgment.isJudged()) {
                recordFailure(runId, state, key, describe(e));
            }
            return;
        }
        if (judgment.isJudged()) {
            state.labeled.incrementAndGet();
            progressTracker.recordCompleted(runId);
            log.debug("Labeled {} with grade {}", key, judgment.relevance());
        }
    }

    private @Nullable Classification callJudge(PooledDocument doc, LabelingOptions options,
                                               Semaphore gate, ExecutorService calls)
            throws InterruptedException, ExecutionException, TimeoutException {
        DocumentContent content = DocumentContent.from(doc, properties);
        gate.acquire();
        AtomicBoolean claimed = new AtomicBoolean();
        Future<Classification> call;
        try {
            call = calls.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    return judge.classify(doc.query(), content);
                } finally {
                    gate.release();
                }
            });
        } catch (RuntimeException e) {
            gate.release();
            throw e;
        }
        try {
            return call.get(options.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            // a call that never started gives its permit back here; a running one on return
            if (claimed.compareAndSet(false, true)) {
                gate.release();
            }
            call.cancel(true);
            throw e;
        }
    }

    private RelevanceJudgment failure(String runId, RunState state, DocumentKey key,
                                      LabelingOptions options, String error) {
        recordFailure(runId, state, key, error);
        return RelevanceJudgment.failed(key, options.labeledBy(), clock.instant(), error);
    }

    private void recordFailure(String runId, RunState state, DocumentKey key, String error) {
        state.failed.incrementAndGet();
        state.sample(error);
        progressTracker.recordFailed(runId, error);
        log.warn("Classification failed for {}: {}", key, error);
    }

    private LabelingReport buildReport(List<PooledDocument> pool, LabelingPlan plan, RunState state,
                                       Duration elapsed) {
        Map<Integer, Integer> distribution = new TreeMap<>();
        for (int grade = 0; grade <= RelevanceJudgment.MAX_GRADE; grade++) {
            distribution.put(grade, 0);
        }
        Set<DocumentKey> seen = new LinkedHashSet<>();
        int judged = 0;
        for (PooledDocument doc : pool) {
            if (!seen.add(doc.key())) {
                continue;
            }
            RelevanceJudgment effective = effectiveJudgment(doc);
            if (effective != null && effective.isJudged()) {
                judged++;
                distribution.merge(effective.relevance(), 1, Integer::sum);
            }
        }
        return new LabelingReport(
                plan.totalDocuments(),
                plan.alreadyJudged(),
                plan.pending(),
                plan.scheduled().size(),
                state.labeled.get(),
                state.failed.get(),
                state.sampledErrors(),
                distribution,
                judged,
                elapsed);
    }

    private @Nullable RelevanceJudgment effectiveJudgment(PooledDocument doc) {
        Optional<RelevanceJudgment> stored = store.find(doc.key());
        if (stored.isPresent() && stored.get().isJudged()) {
            return stored.get();
        }
        if (doc.isJudged()) {
            return doc.judgment();
        }
        return stored.orElse(doc.judgment());
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank()
                ? error.getClass().getSimpleName()
                : error.getClass().getSimpleName() + ": " + message;
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger threadCounter = new AtomicInteger(0);
        return r -> {
            Thread thread = new Thread(r, prefix + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Labeling workers did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** Stops the executor that runs asynchronous labeling runs. */
    @PreDestroy
    public void close() {
        shutdown(runExecutor);
    }

    /** Deterministic scheduling decision, computed once before any call is made. */
    record LabelingPlan(int totalDocuments, int alreadyJudged, int pending,
                        List<PooledDocument> scheduled) {
    }

    private static final class RunState {
        private final AtomicInteger labeled = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final Set<String> sampledErrors = Collections.synchronizedSet(new LinkedHashSet<>());

        void sample(String error) {
            synchronized (sampledErrors) {
                if (sampledErrors.size() < MAX_SAMPLED_ERRORS) {
                    sampledErrors.add(error);
                }
            }
        }

        List<String> sampledErrors() {
            synchronized (sampledErrors) {
                return List.copyOf(sampledErrors);
            }
        }
    }
}
