package com.webdoc.core.stage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Finds the artifact a document tool invocation produced.
 *
 * <p>A stdout line {@code OUTPUT: <path>} naming an existing file wins. Otherwise the newest
 * regular file under the configured output location whose modification time is not earlier
 * than the invocation start (at one-second resolution, since some filesystems store no finer).
 */
public final class ArtifactLocator {

    private static final Logger log = LoggerFactory.getLogger(ArtifactLocator.class);

    public static final String OUTPUT_MARKER = "OUTPUT:";

    private ArtifactLocator() {}

    public static boolean isOutputLine(String line) {
        return line != null && line.stripLeading().startsWith(OUTPUT_MARKER);
    }

    /**
     * The path named by an {@code OUTPUT:} line, if it exists as a regular file. A relative
     * path is resolved against the tool's working directory. A value that is not a valid path
     * on this platform is treated like a missing file.
     */
    public static Optional<Path> fromOutputLine(String line, Path toolDir) {
        String value = line.stripLeading().substring(OUTPUT_MARKER.length()).strip();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Path path;
        try {
            path = toolDir == null ? Path.of(value) : toolDir.resolve(value);
        } catch (InvalidPathException e) {
            log.warn("Tool reported an unusable output path: {}", e.getReason());
            return Optional.empty();
        }
        if (Files.isRegularFile(path)) {
            return Optional.of(path);
        }
        log.warn("Tool reported output {} but no such file exists", value);
        return Optional.empty();
    }

    /** Newest file under {@code outputLocation} modified at or after {@code since}. */
    public static Optional<Path> newestSince(Path outputLocation, Instant since) {
        if (outputLocation == null || !Files.isDirectory(outputLocation)) {
            return Optional.empty();
        }
        FileTime threshold = FileTime.from(since.truncatedTo(ChronoUnit.SECONDS));
        try (Stream<Path> files = Files.walk(outputLocation)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> lastModified(p).compareTo(threshold) >= 0)
                    .max(Comparator.comparing(ArtifactLocator::lastModified));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan output location " + outputLocation, e);
        }
    }

    private static FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
