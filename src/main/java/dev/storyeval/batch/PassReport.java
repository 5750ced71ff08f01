package dev.storyeval.batch;

import java.util.List;

/**
 * Summary of one pass, folded from the scheduler's outcomes.
 *
 * @param pass 1-based pass number
 * @param attemptedItems items submitted this pass
 * @param calls remote calls made
 * @param failedCalls calls that ended in an error sub-result
 * @param remaining items still pending after merging this pass
 */
public record PassReport(
        int pass, int attemptedItems, long calls, long failedCalls, int remaining) {

    static PassReport of(int pass, List<ItemOutcome> outcomes, int remaining) {
        long calls = outcomes.stream().mapToLong(o -> o.results().size()).sum();
        long failed = outcomes.stream().mapToLong(ItemOutcome::failures).sum();
        return new PassReport(pass, outcomes.size(), calls, failed, remaining);
    }
}
