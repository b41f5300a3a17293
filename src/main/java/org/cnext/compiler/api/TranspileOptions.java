package org.cnext.compiler.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of one transpiler run.
 *
 * @param input                 A {@code .cnx} file or a directory of sources.
 * @param outputDirectory       Where {@code .c} files go, or {@code null} to write them next to their sources.
 * @param headerOutputDirectory Where {@code .h} files go, or {@code null} to write them next to the {@code .c} files.
 * @param includePaths          Additional directories searched for quoted and angle includes.
 * @param cacheEnabled          Whether the header symbol cache is read and written.
 * @param cacheDirectory        The cache directory, relative to the project root unless absolute.
 * @param sourceExtension       Extension of generated sources, including the dot.
 * @param headerExtension       Extension of generated headers, including the dot.
 */
public record TranspileOptions(Path input, Path outputDirectory, Path headerOutputDirectory, List<Path> includePaths,
                               boolean cacheEnabled, String cacheDirectory, String sourceExtension,
                               String headerExtension) {

    public TranspileOptions {
        includePaths = List.copyOf(includePaths);
    }

    public static Builder builder(Path input) {
        return new Builder(input);
    }

    public static final class Builder {

        private final Path input;
        private Path outputDirectory;
        private Path headerOutputDirectory;
        private final List<Path> includePaths = new ArrayList<>();
        private boolean cacheEnabled = true;
        private String cacheDirectory = ".cnx";
        private String sourceExtension = ".c";
        private String headerExtension = ".h";

        private Builder(Path input) {
            this.input = input;
        }

        public Builder outputDirectory(Path directory) {
            this.outputDirectory = directory;
            return this;
        }

        public Builder headerOutputDirectory(Path directory) {
            this.headerOutputDirectory = directory;
            return this;
        }

        public Builder includePaths(List<Path> paths) {
            this.includePaths.addAll(paths);
            return this;
        }

        public Builder cacheEnabled(boolean enabled) {
            this.cacheEnabled = enabled;
            return this;
        }

        public Builder cacheDirectory(String directory) {
            this.cacheDirectory = directory;
            return this;
        }

        public Builder sourceExtension(String extension) {
            this.sourceExtension = extension;
            return this;
        }

        public Builder headerExtension(String extension) {
            this.headerExtension = extension;
            return this;
        }

        public TranspileOptions build() {
            return new TranspileOptions(input, outputDirectory, headerOutputDirectory, includePaths, cacheEnabled,
                    cacheDirectory, sourceExtension, headerExtension);
        }
    }
}
