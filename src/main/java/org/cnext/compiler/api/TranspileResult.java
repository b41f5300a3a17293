package org.cnext.compiler.api;

import org.cnext.compiler.backend.codegen.GeneratedUnit;

import java.nio.file.Path;
import java.util.List;

/**
 * The outcome of a successful transpiler run.
 *
 * @param units          The generated units in compilation order (dependencies first).
 * @param headersScanned The number of foreign headers whose symbols were loaded.
 */
public record TranspileResult(List<UnitOutput> units, int headersScanned) {

    public TranspileResult {
        units = List.copyOf(units);
    }

    /**
     * One compiled {@code .cnx} file.
     *
     * @param source     The canonical path of the C-Next source.
     * @param sourceFile The written {@code .c} file.
     * @param headerFile The written {@code .h} file.
     * @param generated  The generated text of both files.
     */
    public record UnitOutput(Path source, Path sourceFile, Path headerFile, GeneratedUnit generated) {
    }
}
