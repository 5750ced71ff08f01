package dev.storyeval.batch;

import dev.storyeval.remote.RemoteCaller;
import java.nio.file.Path;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Everything that makes one batch job different from another: where items come from, how records
 * look on disk, what counts as done, and which remote call produces the results.
 *
 * @param name short job name for logs and traces
 * @param source the items to work through
 * @param codec snapshot record layout
 * @param completion which successful payloads count as done
 * @param caller the remote call made per sub-result
 * @param seedPath records to start from when {@code outputPath} does not exist yet
 * @param outputPath the snapshot file, read on resume and rewritten after every pass
 * @param concurrency maximum simultaneous remote calls
 * @param requireSeedRecords fail at startup if there are no existing records to merge into
 * @param keepUnmatchedRecords keep records whose ids are not in the source, and write ids in
 *     sorted order. Otherwise only source items are written, in source order.
 */
public record BatchJob(
        @Nonnull String name,
        @Nonnull ItemSource source,
        @Nonnull RecordCodec codec,
        @Nonnull CompletionPredicate completion,
        @Nonnull RemoteCaller caller,
        @Nonnull Path seedPath,
        @Nonnull Path outputPath,
        int concurrency,
        boolean requireSeedRecords,
        boolean keepUnmatchedRecords) {

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for batch jobs. The seed path defaults to the output path. */
    public static final class Builder {
        private String name = "batch";
        private ItemSource source;
        private RecordCodec codec;
        private CompletionPredicate completion = CompletionPredicate.anySuccess();
        private RemoteCaller caller;
        private Path seedPath;
        private Path outputPath;
        private int concurrency = 8;
        private boolean requireSeedRecords = false;
        private boolean keepUnmatchedRecords = false;

        public BatchJob build() {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(codec, "codec");
            Objects.requireNonNull(caller, "caller");
            Objects.requireNonNull(outputPath, "outputPath");
            if (concurrency < 1) {
                throw new IllegalArgumentException(
                        "concurrency must be at least 1: " + concurrency);
            }
            return new BatchJob(
                    name,
                    source,
                    codec,
                    completion,
                    caller,
                    seedPath != null ? seedPath : outputPath,
                    outputPath,
                    concurrency,
                    requireSeedRecords,
                    keepUnmatchedRecords);
        }

        public Builder name(@Nonnull String name) {
            this.name = Objects.requireNonNull(name);
            return this;
        }

        public Builder source(ItemSource source) {
            this.source = source;
            return this;
        }

        public Builder codec(RecordCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder completion(CompletionPredicate completion) {
            this.completion = completion;
            return this;
        }

        public Builder caller(RemoteCaller caller) {
            this.caller = caller;
            return this;
        }

        public Builder seedPath(Path seedPath) {
            this.seedPath = seedPath;
            return this;
        }

        public Builder outputPath(Path outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder requireSeedRecords(boolean requireSeedRecords) {
            this.requireSeedRecords = requireSeedRecords;
            return this;
        }

        public Builder keepUnmatchedRecords(boolean keepUnmatchedRecords) {
            this.keepUnmatchedRecords = keepUnmatchedRecords;
            return this;
        }
    }
}
