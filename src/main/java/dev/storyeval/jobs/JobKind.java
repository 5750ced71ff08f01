package dev.storyeval.jobs;

import dev.storyeval.batch.BatchJob;
import dev.storyeval.batch.CompletionPredicate;
import dev.storyeval.batch.JsonlItemSource;
import dev.storyeval.batch.PromptListItemSource;
import dev.storyeval.batch.RecordCodec;
import dev.storyeval.config.StoryEvalConfig;
import dev.storyeval.prompt.PromptTemplate;
import dev.storyeval.remote.ChatCompletionCaller;
import dev.storyeval.remote.OpenRouterClients;
import dev.storyeval.remote.PangramClient;
import dev.storyeval.remote.QualityJudge;
import dev.storyeval.remote.QualityResponseParser;
import dev.storyeval.remote.RemoteCaller;
import dev.storyeval.remote.StoryWriter;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/**
 * The batch jobs the command line can run.
 *
 * <p>Every job goes through the same pass loop. A job only decides where its items come from,
 * which sub-results it owns, what counts as done and which remote service it calls.
 */
public enum JobKind {
    /** Literary-quality scores for original/rewritten pairs, or for single generated stories. */
    QUALITY("quality", 32) {
        @Override
        public BatchJob createJob(StoryEvalConfig config, RemoteCaller caller) {
            return builder(config, caller)
                    .source(
                            new JsonlItemSource(
                                    input(config, "unslopped_stories.jsonl"),
                                    StoryLines.pairsOrSingles(
                                            ORIGINAL_EVAL, UNSLOPPED_EVAL, STORY_EVAL)))
                    .codec(
                            new RecordCodec(
                                    STORY_ID,
                                    Set.of(ORIGINAL_EVAL, UNSLOPPED_EVAL, STORY_EVAL),
                                    ERROR))
                    .completion(QUALITY_SCORED)
                    .outputPath(output(config, "unslopped_stories_quality_te.jsonl"))
                    .build();
        }

        @Override
        public RemoteCaller createCaller(StoryEvalConfig config) {
            return qualityJudge(config);
        }
    },

    /** Quality scores for control stories, merged into an existing quality results file. */
    QUALITY_CONTROL("quality-control", 32) {
        @Override
        public BatchJob createJob(StoryEvalConfig config, RemoteCaller caller) {
            var seed = seed(config, "unslopped_stories_quality.jsonl");
            return builder(config, caller)
                    .source(
                            new JsonlItemSource(
                                    input(config, "unslopped_stories_control.jsonl"),
                                    StoryLines.controls(CONTROL_EVAL)))
                    .codec(new RecordCodec(STORY_ID, Set.of(CONTROL_EVAL), CONTROL_ERROR))
                    .completion(QUALITY_SCORED)
                    .seedPath(seed)
                    .outputPath(config.outputFile().map(Path::of).orElse(seed))
                    .requireSeedRecords(true)
                    .keepUnmatchedRecords(true)
                    .build();
        }

        @Override
        public RemoteCaller createCaller(StoryEvalConfig config) {
            return qualityJudge(config);
        }
    },

    /** Pangram AI-text detection for both stories of each pair. */
    PANGRAM("pangram", 8) {
        @Override
        public BatchJob createJob(StoryEvalConfig config, RemoteCaller caller) {
            return builder(config, caller)
                    .source(
                            new JsonlItemSource(
                                    input(config, "unslopped_stories.jsonl"),
                                    StoryLines.pairs(ORIGINAL_PANGRAM, UNSLOPPED_PANGRAM)))
                    .codec(
                            new RecordCodec(
                                    STORY_ID, Set.of(ORIGINAL_PANGRAM, UNSLOPPED_PANGRAM), ERROR))
                    .completion(PANGRAM_SCORED)
                    .outputPath(output(config, "unslopped_stories_pangram.jsonl"))
                    .build();
        }

        @Override
        public RemoteCaller createCaller(StoryEvalConfig config) {
            return new PangramClient(config);
        }
    },

    /** Pangram detection for control stories, merged into an existing Pangram results file. */
    PANGRAM_CONTROL("pangram-control", 8) {
        @Override
        public BatchJob createJob(StoryEvalConfig config, RemoteCaller caller) {
            var seed = seed(config, "unslopped_stories_pangram.jsonl");
            return builder(config, caller)
                    .source(
                            new JsonlItemSource(
                                    input(config, "unslopped_stories_control.jsonl"),
                                    StoryLines.controls(CONTROL_PANGRAM)))
                    .codec(new RecordCodec(STORY_ID, Set.of(CONTROL_PANGRAM), CONTROL_ERROR))
                    .completion(PANGRAM_SCORED)
                    .seedPath(seed)
                    .outputPath(config.outputFile().map(Path::of).orElse(seed))
                    .requireSeedRecords(true)
                    .keepUnmatchedRecords(true)
                    .build();
        }

        @Override
        public RemoteCaller createCaller(StoryEvalConfig config) {
            return new PangramClient(config);
        }
    },

    /** Short stories written from a list of prompts. */
    GENERATE("generate", 100) {
        @Override
        public BatchJob createJob(StoryEvalConfig config, RemoteCaller caller) {
            return builder(config, caller)
                    .source(
                            new PromptListItemSource(
                                    input(config, "writing_prompts.txt"),
                                    StoryLines.PROMPT,
                                    StoryLines.STORY))
                    .codec(new RecordCodec(StoryLines.PROMPT_ID, Set.of(StoryLines.STORY)))
                    .completion(CompletionPredicate.nonBlankText())
                    .outputPath(output(config, "short_stories.jsonl"))
                    .build();
        }

        @Override
        public RemoteCaller createCaller(StoryEvalConfig config) {
            return new StoryWriter(
                    new ChatCompletionCaller(
                            OpenRouterClients.create(config),
                            config.writerModel(),
                            PromptTemplate.STORY_SYSTEM,
                            PromptTemplate.STORY_USER,
                            "prompt",
                            0.9,
                            config.writerMaxTokens()));
        }
    };

    public static final String STORY_ID = "story_id";
    public static final String ORIGINAL_EVAL = "original_eval";
    public static final String UNSLOPPED_EVAL = "unslopped_eval";
    public static final String STORY_EVAL = "story_eval";
    public static final String CONTROL_EVAL = "control_eval";
    public static final String ORIGINAL_PANGRAM = "original_pangram";
    public static final String UNSLOPPED_PANGRAM = "unslopped_pangram";
    public static final String CONTROL_PANGRAM = "control_pangram";
    public static final String ERROR = "error";
    public static final String CONTROL_ERROR = "control_error";

    private static final CompletionPredicate QUALITY_SCORED =
            CompletionPredicate.allNumbers("scores", QualityResponseParser.SCORE_TAGS);
    private static final CompletionPredicate PANGRAM_SCORED =
            CompletionPredicate.hasField("fraction_ai");

    private final String cliName;
    private final int defaultConcurrency;

    JobKind(String cliName, int defaultConcurrency) {
        this.cliName = cliName;
        this.defaultConcurrency = defaultConcurrency;
    }

    public String cliName() {
        return cliName;
    }

    public int defaultConcurrency() {
        return defaultConcurrency;
    }

    /**
     * Wire the job against its real remote service.
     *
     * @throws dev.storyeval.config.ConfigException if the service credential is missing
     */
    public BatchJob createJob(StoryEvalConfig config) {
        return createJob(config, createCaller(config));
    }

    /** Wire the job with the given remote caller. */
    public abstract BatchJob createJob(StoryEvalConfig config, RemoteCaller caller);

    /** The remote caller this job uses in production. */
    public abstract RemoteCaller createCaller(StoryEvalConfig config);

    public static Optional<JobKind> fromCliName(String name) {
        return Arrays.stream(values()).filter(kind -> kind.cliName.equals(name)).findFirst();
    }

    BatchJob.Builder builder(StoryEvalConfig config, RemoteCaller caller) {
        return BatchJob.builder()
                .name(cliName)
                .caller(caller)
                .concurrency(config.concurrency().orElse(defaultConcurrency));
    }

    static Path input(StoryEvalConfig config, String defaultFile) {
        return Path.of(config.inputFile().orElse(defaultFile));
    }

    static Path output(StoryEvalConfig config, String defaultFile) {
        return Path.of(config.outputFile().orElse(defaultFile));
    }

    static Path seed(StoryEvalConfig config, String defaultFile) {
        return Path.of(config.seedFile().orElse(defaultFile));
    }

    static RemoteCaller qualityJudge(StoryEvalConfig config) {
        return new QualityJudge(
                new ChatCompletionCaller(
                        OpenRouterClients.create(config),
                        config.judgeModel(),
                        PromptTemplate.QUALITY_SYSTEM,
                        PromptTemplate.QUALITY_USER,
                        "story",
                        0.2,
                        config.judgeMaxTokens()));
    }
}
