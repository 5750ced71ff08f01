package dev.storyeval;

import dev.storyeval.batch.PassOrchestrator;
import dev.storyeval.batch.SourceException;
import dev.storyeval.config.ConfigException;
import dev.storyeval.config.StoryEvalConfig;
import dev.storyeval.jobs.JobKind;
import java.io.IOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Command line entry point.
 *
 * <pre>
 * storyeval &lt;job&gt; [--input FILE] [--output FILE] [--seed FILE]
 *           [--concurrency N] [--max-passes N]
 * </pre>
 *
 * Flags override the matching environment variables. Exit status is 0 when the run finishes, even
 * if some items are still failing after the last pass, 1 when the run cannot start or the snapshot
 * cannot be written, and 2 for bad arguments.
 */
@Slf4j
public final class StoryEvalMain {
    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private static final Map<String, String> FLAGS =
            Map.of(
                    "--input", "STORYEVAL_INPUT_FILE",
                    "--output", "STORYEVAL_OUTPUT_FILE",
                    "--seed", "STORYEVAL_SEED_FILE",
                    "--concurrency", "STORYEVAL_CONCURRENCY",
                    "--max-passes", "STORYEVAL_MAX_PASSES");
    private static final List<String> NUMERIC_FLAGS = List.of("--concurrency", "--max-passes");

    private StoryEvalMain() {}

    public static void main(String[] args) {
        System.exit(run(List.of(args), Map.of()));
    }

    /**
     * Run one job.
     *
     * @param baseOverrides config overrides applied before the command line flags
     * @return the process exit status
     */
    static int run(List<String> args, Map<String, String> baseOverrides) {
        if (args.isEmpty()) {
            return usage("missing job name");
        }
        var kind = JobKind.fromCliName(args.get(0)).orElse(null);
        if (kind == null) {
            return usage("unknown job: " + args.get(0));
        }
        var overrides = new HashMap<>(baseOverrides);
        for (int i = 1; i < args.size(); i += 2) {
            var flag = args.get(i);
            var key = FLAGS.get(flag);
            if (key == null) {
                return usage("unknown option: " + flag);
            }
            if (i + 1 >= args.size()) {
                return usage("missing value for " + flag);
            }
            var value = args.get(i + 1);
            if (NUMERIC_FLAGS.contains(flag) && !value.matches("-?\\d+")) {
                return usage(flag + " needs a whole number: " + value);
            }
            overrides.put(key, value);
        }

        try {
            var config = StoryEvalConfig.of(overrides);
            var job = kind.createJob(config);
            var result =
                    PassOrchestrator.builder()
                            .job(job)
                            .maxPasses(config.maxPasses())
                            .retryDelay(config.retryDelay())
                            .build()
                            .run();
            log.debug("{} finished: {}", kind.cliName(), result);
            return EXIT_OK;
        } catch (ConfigException | SourceException e) {
            log.error(e.getMessage(), e.getCause());
            return EXIT_FATAL;
        } catch (IOException e) {
            log.error("Unable to read or write the snapshot", e);
            return EXIT_FATAL;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted; progress up to the last finished pass is saved");
            return EXIT_FATAL;
        }
    }

    private static int usage(String problem) {
        var jobs =
                Arrays.stream(JobKind.values())
                        .map(JobKind::cliName)
                        .collect(Collectors.joining(", "));
        System.err.println("storyeval: " + problem);
        System.err.println(
                "usage: storyeval <job> [--input FILE] [--output FILE] [--seed FILE]"
                        + " [--concurrency N] [--max-passes N]");
        System.err.println("jobs: " + jobs);
        return EXIT_USAGE;
    }
}
