package dev.storyeval.batch;

import dev.storyeval.remote.RemoteCaller;
import dev.storyeval.trace.BatchTracing;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one pass of remote calls with a global bound on how many are in flight.
 *
 * <p>Each item gets one task. An item that needs several sub-results issues those calls
 * concurrently, and each call still takes its own slot from the {@link ConcurrencyLimiter}. Any
 * failure of a call becomes a {@link SubResult.Failure} for that key. Sibling calls and sibling
 * items are never cancelled, and {@link #run} never throws because of a remote failure.
 */
@Slf4j
public final class PassScheduler implements AutoCloseable {
    /** The sub-result keys to request for one item this pass. */
    public record WorkOrder(@Nonnull Item item, @Nonnull Set<String> keys) {
        public WorkOrder {
            keys = Set.copyOf(keys);
        }
    }

    private final RemoteCaller caller;
    private final ConcurrencyLimiter limiter;
    private final ExecutorService workers;
    private final Tracer tracer;

    public PassScheduler(RemoteCaller caller, int concurrency, Tracer tracer) {
        this(caller, new ConcurrencyLimiter(concurrency), newWorkerPool(concurrency), tracer);
    }

    PassScheduler(
            RemoteCaller caller,
            ConcurrencyLimiter limiter,
            ExecutorService workers,
            Tracer tracer) {
        this.caller = caller;
        this.limiter = limiter;
        this.workers = Context.taskWrapping(workers);
        this.tracer = tracer;
    }

    public ConcurrencyLimiter limiter() {
        return limiter;
    }

    /**
     * Submit every work order and wait for all of them to resolve.
     *
     * @return one outcome per order, in submission order
     */
    public List<ItemOutcome> run(List<WorkOrder> work) {
        var futures = work.stream().map(this::submit).toList();
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private CompletableFuture<ItemOutcome> submit(WorkOrder order) {
        var item = order.item();
        Map<String, CompletableFuture<SubResult>> calls = new LinkedHashMap<>();
        // keep the item's own key order so records read the same on every run
        for (var key : item.resultKeys()) {
            if (order.keys().contains(key)) {
                calls.put(
                        key,
                        CompletableFuture.supplyAsync(() -> invoke(item, key), workers)
                                .exceptionally(SubResult::failure));
            }
        }
        return CompletableFuture.allOf(calls.values().toArray(CompletableFuture[]::new))
                .thenApply(
                        ignored -> {
                            Map<String, SubResult> results = new LinkedHashMap<>();
                            calls.forEach((key, call) -> results.put(key, call.join()));
                            var outcome = new ItemOutcome(item.id(), item.inputs(), results);
                            log.info("completed item {}", item.id());
                            return outcome;
                        });
    }

    private SubResult invoke(Item item, String key) {
        var span =
                tracer.spanBuilder(BatchTracing.REMOTE_CALL_SPAN)
                        .setAttribute(BatchTracing.ITEM_ID, (long) item.id())
                        .setAttribute(BatchTracing.RESULT_KEY, key)
                        .startSpan();
        try (var unused = span.makeCurrent()) {
            var payload = limiter.withSlot(() -> caller.call(item.targets().get(key)));
            if (payload == null || payload.isNull() || payload.isMissingNode()) {
                throw new IllegalStateException("remote call returned no result");
            }
            return SubResult.success(payload);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            BatchTracing.recordFailure(span, e);
            log.debug("call for item {} ({}) failed", item.id(), key, e);
            return SubResult.failure(e);
        } finally {
            span.end();
        }
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ExecutorService newWorkerPool(int concurrency) {
        var counter = new AtomicInteger();
        ThreadFactory threadFactory =
                runnable -> {
                    var thread =
                            new Thread(runnable, "storyeval-worker-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                };
        return Executors.newFixedThreadPool(concurrency, threadFactory);
    }
}
