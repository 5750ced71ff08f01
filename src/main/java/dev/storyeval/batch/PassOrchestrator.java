package dev.storyeval.batch;

import dev.storyeval.trace.BatchTracing;
import io.opentelemetry.api.trace.Tracer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives a {@link BatchJob} to completion, one pass at a time.
 *
 * <p>Each pass computes the pending items, runs their remote calls through a {@link
 * PassScheduler}, waits for every call to resolve, merges the outcomes into the {@link
 * ResultStore} and rewrites the snapshot. Passes repeat, with a fixed delay between them, until
 * nothing is pending or the pass budget is spent. Items still failing at that point stay in the
 * snapshot with their last error, and the next invocation picks them up again.
 *
 * <p>A run that finds nothing pending makes no calls and leaves the snapshot untouched.
 */
@Slf4j
public final class PassOrchestrator {
    private final BatchJob job;
    private final int maxPasses;
    private final Duration retryDelay;
    private final Tracer tracer;
    private final SnapshotWriter snapshotWriter;

    private PassOrchestrator(Builder builder) {
        this.job = Objects.requireNonNull(builder.job);
        this.maxPasses = builder.maxPasses;
        this.retryDelay = builder.retryDelay;
        this.tracer = builder.tracer != null ? builder.tracer : BatchTracing.getTracer();
        this.snapshotWriter = builder.snapshotWriter;
    }

    /**
     * Run the job.
     *
     * @throws SourceException if there are no items, or required seed records are missing
     * @throws IOException if the snapshot cannot be read or written
     * @throws InterruptedException if interrupted during the delay between passes. The snapshot
     *     from the last finished pass is already on disk.
     */
    public RunResult run() throws IOException, InterruptedException {
        // loading
        var items = job.source().load();
        Map<Integer, Item> itemsById = new LinkedHashMap<>();
        items.forEach(item -> itemsById.put(item.id(), item));
        var store = loadStore();
        var orderedIds = orderedIds(itemsById, store);
        log.info("{}: {} items from {}", job.name(), items.size(), job.source().describe());

        List<PassReport> reports = new ArrayList<>();
        try (var scheduler = new PassScheduler(job.caller(), job.concurrency(), tracer)) {
            var pending = pending(items, store);
            while (!pending.isEmpty() && reports.size() < maxPasses) {
                var passNumber = reports.size() + 1;
                log.info(
                        "{} items pending; pass {} of at most {}",
                        pending.size(),
                        passNumber,
                        maxPasses);
                var outcomes = runPass(scheduler, passNumber, pending);
                // merging: every submitted task has resolved by now
                for (var outcome : outcomes) {
                    store.merge(outcome.id(), outcome.inputs(), outcome.results());
                }
                snapshotWriter.write(job.outputPath(), orderedIds, store, itemsById);
                pending = pending(items, store);
                var report = PassReport.of(passNumber, outcomes, pending.size());
                reports.add(report);
                log.info(
                        "pass {} done: {} calls, {} failed, {} items still pending",
                        passNumber,
                        report.calls(),
                        report.failedCalls(),
                        report.remaining());
                if (!pending.isEmpty() && reports.size() < maxPasses && !retryDelay.isZero()) {
                    Thread.sleep(retryDelay.toMillis());
                }
            }
            if (!reports.isEmpty()) {
                snapshotWriter.write(job.outputPath(), orderedIds, store, itemsById);
            }
            var stragglers = pending.stream().map(order -> order.item().id()).toList();
            if (!stragglers.isEmpty()) {
                log.warn(
                        "pass budget of {} reached with {} items incomplete; rerun to retry them",
                        maxPasses,
                        stragglers.size());
            }
            var result = new RunResult(items.size(), reports, stragglers, !reports.isEmpty());
            log.info(result.createReportString());
            return result;
        }
    }

    private List<ItemOutcome> runPass(
            PassScheduler scheduler, int passNumber, List<PassScheduler.WorkOrder> pending) {
        var span =
                tracer.spanBuilder(BatchTracing.PASS_SPAN)
                        .setAttribute(BatchTracing.JOB, job.name())
                        .setAttribute(BatchTracing.PASS, (long) passNumber)
                        .setAttribute(BatchTracing.PENDING, (long) pending.size())
                        .startSpan();
        try (var unused = span.makeCurrent()) {
            var outcomes = scheduler.run(pending);
            span.setAttribute(
                    BatchTracing.FAILED_CALLS,
                    outcomes.stream().mapToLong(ItemOutcome::failures).sum());
            return outcomes;
        } finally {
            span.end();
        }
    }

    private ResultStore loadStore() throws IOException {
        Path snapshot = Files.exists(job.outputPath()) ? job.outputPath() : job.seedPath();
        var store = ResultStore.load(snapshot, job.codec());
        if (job.requireSeedRecords() && store.isEmpty()) {
            throw new SourceException("No existing records found in " + snapshot);
        }
        return store;
    }

    private List<Integer> orderedIds(Map<Integer, Item> itemsById, ResultStore store) {
        if (!job.keepUnmatchedRecords()) {
            return List.copyOf(itemsById.keySet());
        }
        var ids = new TreeSet<>(store.ids());
        ids.addAll(itemsById.keySet());
        return List.copyOf(ids);
    }

    private List<PassScheduler.WorkOrder> pending(List<Item> items, ResultStore store) {
        List<PassScheduler.WorkOrder> pending = new ArrayList<>();
        for (var item : items) {
            var keys = store.pendingKeys(item, job.completion());
            if (!keys.isEmpty()) {
                pending.add(new PassScheduler.WorkOrder(item, keys));
            }
        }
        return pending;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for orchestrators. */
    public static final class Builder {
        private @Nullable BatchJob job;
        private int maxPasses = 5;
        private @Nonnull Duration retryDelay = Duration.ofSeconds(2);
        private @Nullable Tracer tracer;
        private @Nonnull SnapshotWriter snapshotWriter = new SnapshotWriter();

        public PassOrchestrator build() {
            Objects.requireNonNull(job, "job");
            if (maxPasses < 1) {
                throw new IllegalArgumentException("maxPasses must be at least 1: " + maxPasses);
            }
            return new PassOrchestrator(this);
        }

        public Builder job(@Nonnull BatchJob job) {
            this.job = Objects.requireNonNull(job);
            return this;
        }

        public Builder maxPasses(int maxPasses) {
            this.maxPasses = maxPasses;
            return this;
        }

        public Builder retryDelay(@Nonnull Duration retryDelay) {
            this.retryDelay = Objects.requireNonNull(retryDelay);
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder snapshotWriter(@Nonnull SnapshotWriter snapshotWriter) {
            this.snapshotWriter = Objects.requireNonNull(snapshotWriter);
            return this;
        }
    }
}
