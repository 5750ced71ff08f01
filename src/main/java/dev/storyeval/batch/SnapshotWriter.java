package dev.storyeval.batch;

import dev.storyeval.json.StoryEvalJsonMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the whole {@link ResultStore} back to a snapshot file, one JSON object per line.
 *
 * <p>Lines follow {@code orderedIds} exactly, never the store's own iteration order, so two writes
 * of an unchanged store are byte-identical. An id without a stored record gets a placeholder
 * carrying just its echoed inputs, or only its id if the item is unknown too.
 *
 * <p>The file is written beside the destination and moved over it, so a crash mid-write leaves the
 * previous snapshot in place. A replaced snapshot keeps its POSIX permissions, and a new one gets
 * the process umask.
 */
@Slf4j
public final class SnapshotWriter {

    public void write(
            Path path, List<Integer> orderedIds, ResultStore store, Map<Integer, Item> items)
            throws IOException {
        var codec = store.codec();
        var mapper = StoryEvalJsonMapper.get();
        var target = path.toAbsolutePath();
        var dir = target.getParent();
        Files.createDirectories(dir);
        var tmp =
                Files.createFile(
                        dir.resolve("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp"));
        try {
            try (var writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                for (var id : orderedIds) {
                    var record =
                            store.get(id)
                                    .orElseGet(
                                            () -> {
                                                var item = items.get(id);
                                                return item != null
                                                        ? ResultRecord.placeholder(item)
                                                        : new ResultRecord(id, Map.of(), Map.of());
                                            });
                    writer.write(mapper.writeValueAsString(codec.encode(record)));
                    writer.write('\n');
                }
            }
            copyPermissions(target, tmp);
            moveIntoPlace(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("wrote {} records to {}", orderedIds.size(), target);
    }

    private static void copyPermissions(Path from, Path to) throws IOException {
        if (Files.exists(from)
                && Files.getFileStore(to).supportsFileAttributeView(PosixFileAttributeView.class)) {
            Files.setPosixFilePermissions(to, Files.getPosixFilePermissions(from));
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(
                    tmp,
                    target,
                    StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
