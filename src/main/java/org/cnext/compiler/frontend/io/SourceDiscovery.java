package org.cnext.compiler.frontend.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves a command-line argument into the ordered list of C-Next source files to
 * compile. A file argument is returned as-is; a directory is walked recursively.
 */
public final class SourceDiscovery {

    private static final Logger log = LoggerFactory.getLogger(SourceDiscovery.class);

    /** File extension of C-Next sources. */
    public static final String CNEXT_EXTENSION = ".cnx";

    private SourceDiscovery() {}

    /**
     * Discovers the source files for the given argument.
     *
     * @param input A {@code .cnx} file or a directory.
     * @return The canonical paths of all sources, sorted by path.
     * @throws IOException If the input does not exist or cannot be walked.
     */
    public static List<Path> discover(Path input) throws IOException {
        if (!Files.exists(input)) {
            throw new IOException("Input not found: " + input.toAbsolutePath());
        }
        if (Files.isRegularFile(input)) {
            if (!isCNextSource(input)) {
                throw new IOException("Not a C-Next source file (expected " + CNEXT_EXTENSION + "): " + input);
            }
            return List.of(SourceLoader.canonicalize(input));
        }

        List<Path> sources;
        try (Stream<Path> walk = Files.walk(input)) {
            sources = walk.filter(Files::isRegularFile)
                    .filter(SourceDiscovery::isCNextSource)
                    .filter(p -> !isInsideHiddenDirectory(input, p))
                    .map(Path::toAbsolutePath)
                    .map(Path::normalize)
                    .sorted()
                    .collect(Collectors.toList());
        }
        log.debug("Discovered {} source file(s) under {}", sources.size(), input);
        return sources;
    }

    /**
     * Checks whether a path names a C-Next source file.
     */
    public static boolean isCNextSource(Path path) {
        return path.getFileName() != null && path.getFileName().toString().endsWith(CNEXT_EXTENSION);
    }

    // Skips the cache directory and other dot-directories below the input root.
    private static boolean isInsideHiddenDirectory(Path root, Path file) {
        Path relative = root.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize());
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (relative.getName(i).toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
