package dev.storyeval.batch;

import java.util.List;

/**
 * What a full run did.
 *
 * @param totalItems items in the source
 * @param passes one report per pass that ran. Empty when nothing was pending.
 * @param stragglers ids still pending when the run stopped
 * @param snapshotWritten whether the output file was rewritten
 */
public record RunResult(
        int totalItems,
        List<PassReport> passes,
        List<Integer> stragglers,
        boolean snapshotWritten) {

    public RunResult {
        passes = List.copyOf(passes);
        stragglers = List.copyOf(stragglers);
    }

    public boolean isComplete() {
        return stragglers.isEmpty();
    }

    public long totalCalls() {
        return passes.stream().mapToLong(PassReport::calls).sum();
    }

    public String createReportString() {
        if (passes.isEmpty()) {
            return "All %d items already complete; nothing to do.".formatted(totalItems);
        }
        if (stragglers.isEmpty()) {
            return "All %d items complete after %d pass(es), %d remote calls."
                    .formatted(totalItems, passes.size(), totalCalls());
        }
        return "%d of %d items still incomplete after %d pass(es): %s"
                .formatted(stragglers.size(), totalItems, passes.size(), stragglers);
    }
}
