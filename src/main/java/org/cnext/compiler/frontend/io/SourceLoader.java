package org.cnext.compiler.frontend.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Centralizes file loading for the transpiler. Every file is identified by its canonical
 * absolute path so that the dependency resolver can deduplicate includes reached through
 * different relative spellings or symbolic links.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content      The file content (line endings normalized to {@code \n}).
     * @param logicalName  The canonical path used for deduplication and diagnostics.
     * @param lastModified The file modification time in milliseconds.
     */
    public record LoadResult(String content, String logicalName, long lastModified) {}

    private SourceLoader() {}

    /**
     * Loads content from a local filesystem path.
     *
     * @param path The path to load.
     * @return The loaded content and the canonical path as logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        Path canonical = canonicalize(path);
        String content = normalizeLineEndings(Files.readString(canonical, StandardCharsets.UTF_8));
        long lastModified = Files.getLastModifiedTime(canonical).toMillis();
        return new LoadResult(content, toLogicalName(canonical), lastModified);
    }

    /**
     * Resolves a path to its canonical absolute form. Symbolic links are followed when the
     * file exists; otherwise the path is only made absolute and normalized.
     */
    public static Path canonicalize(Path path) throws IOException {
        Path absolute = path.toAbsolutePath().normalize();
        if (Files.exists(absolute)) {
            return absolute.toRealPath();
        }
        return absolute;
    }

    /**
     * Returns the modification time of a file, or {@code -1} if it cannot be read.
     */
    public static long lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return -1L;
        }
    }

    /**
     * Converts a path to the forward-slash string form used as a logical file name.
     */
    public static String toLogicalName(Path path) {
        return path.toString().replace('\\', '/');
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
