package org.cnext.compiler.api;

import org.cnext.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when a transpiler run reports at least one diagnostic. Units without errors may
 * already have been written when this is thrown.
 */
public class CompilationException extends RuntimeException {

    private final List<Diagnostic> diagnostics;

    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
