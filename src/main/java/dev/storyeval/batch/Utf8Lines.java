package dev.storyeval.batch;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads a text file line by line, decoding each line as UTF-8 on its own.
 *
 * <p>A line with invalid bytes comes back empty instead of failing the whole read, so callers can
 * skip it like any other unusable line. Lines end at {@code \n}; a trailing {@code \r} is dropped.
 */
final class Utf8Lines {
    private Utf8Lines() {}

    /** One entry per physical line, in file order. Line {@code n} is at index {@code n - 1}. */
    static List<Optional<String>> read(Path path) throws IOException {
        List<Optional<String>> lines = new ArrayList<>();
        try (var in = new BufferedInputStream(Files.newInputStream(path))) {
            var line = new ByteArrayOutputStream();
            int b;
            while ((b = in.read()) != -1) {
                if (b == '\n') {
                    lines.add(decode(line.toByteArray()));
                    line.reset();
                } else {
                    line.write(b);
                }
            }
            if (line.size() > 0) {
                lines.add(decode(line.toByteArray()));
            }
        }
        return lines;
    }

    static Optional<String> decode(byte[] bytes) {
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        var decoder =
                StandardCharsets.UTF_8
                        .newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return Optional.of(decoder.decode(ByteBuffer.wrap(bytes, 0, length)).toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }
}
