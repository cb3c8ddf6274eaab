package com.raditha.sweep.rewrite;

import com.raditha.sweep.model.RemovalSpan;
import com.raditha.sweep.parser.SourceLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.List;

/**
 * The only component that writes source files.
 * <p>
 * New content goes to a temporary file next to the target, which is then moved over
 * it. If anything fails the temporary file is deleted and the target keeps its
 * original bytes.
 */
public class FilePatcher {
    private static final Logger logger = LoggerFactory.getLogger(FilePatcher.class);

    static final String TEMP_PREFIX = ".sweeper-";
    static final String TEMP_SUFFIX = ".tmp";

    /**
     * Delete whole lines from a text, keeping every other byte and line terminator.
     *
     * @param spans sorted, non-overlapping line ranges within the text
     * @throws IllegalArgumentException if the spans are unsorted, overlap or fall outside the text
     */
    public String splice(String text, List<RemovalSpan> spans) {
        if (spans.isEmpty()) {
            return text;
        }
        SourceLines lines = SourceLines.of(text);
        int previousEnd = 0;
        for (RemovalSpan span : spans) {
            if (span.startLine() <= previousEnd) {
                throw new IllegalArgumentException("Spans must be sorted and non-overlapping: " + spans);
            }
            if (span.endLine() > lines.count()) {
                throw new IllegalArgumentException("Span " + span + " is beyond the end of a "
                        + lines.count() + "-line text");
            }
            previousEnd = span.endLine();
        }

        StringBuilder result = new StringBuilder(text.length());
        int spanIndex = 0;
        for (int line = 1; line <= lines.count(); line++) {
            while (spanIndex < spans.size() && spans.get(spanIndex).endLine() < line) {
                spanIndex++;
            }
            boolean removed = spanIndex < spans.size() && spans.get(spanIndex).startLine() <= line;
            if (!removed) {
                result.append(lines.lines().get(line - 1));
            }
        }
        return result.toString();
    }

    /**
     * Atomically replace the content of a file.
     */
    public void write(Path path, String content) throws IOException {
        Path target = path.toAbsolutePath();
        Path temp = Files.createTempFile(target.getParent(), TEMP_PREFIX, TEMP_SUFFIX);
        try {
            writeTemp(temp, content);
            copyPermissions(target, temp);
            moveIntoPlace(temp, target);
            logger.debug("Rewrote {}", target);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    /**
     * Replace the single occurrence of {@code before} in a file with {@code after}.
     *
     * @throws IllegalArgumentException if {@code before} is empty, missing, or occurs more than once;
     *                                  the file is not touched
     */
    public void patchRegion(Path path, String before, String after) throws IOException {
        if (before == null || before.isEmpty()) {
            throw new IllegalArgumentException("Region to replace must not be empty");
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        int first = content.indexOf(before);
        if (first < 0) {
            throw new IllegalArgumentException("Region not found in " + path);
        }
        if (content.indexOf(before, first + 1) >= 0) {
            throw new IllegalArgumentException("Region occurs more than once in " + path);
        }
        write(path, content.substring(0, first) + after + content.substring(first + before.length()));
    }

    protected void writeTemp(Path temp, String content) throws IOException {
        Files.writeString(temp, content, StandardCharsets.UTF_8);
    }

    protected void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to a plain replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void copyPermissions(Path from, Path to) throws IOException {
        if (Files.exists(from) && Files.getFileStore(from).supportsFileAttributeView(PosixFileAttributeView.class)) {
            Files.setPosixFilePermissions(to, Files.getPosixFilePermissions(from));
        }
    }
}
