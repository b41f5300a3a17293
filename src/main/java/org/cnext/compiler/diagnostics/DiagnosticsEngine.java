package org.cnext.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of a compilation. All diagnostics are errors: an unsafe
 * pattern must never compile silently, so there is no warning channel.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error without a suggested fix.
     */
    public void reportError(DiagnosticCode code, String message, String fileName, int line, int column) {
        report(new Diagnostic(code, message, fileName, line, column, null));
    }

    /**
     * Reports an error together with a suggested fix.
     */
    public void reportError(DiagnosticCode code, String message, String fileName, int line, int column,
                            String suggestion) {
        report(new Diagnostic(code, message, fileName, line, column, suggestion));
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * Copies every diagnostic of another engine into this one.
     */
    public void addAll(DiagnosticsEngine other) {
        diagnostics.addAll(other.diagnostics);
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Checks whether a diagnostic with the given code has been reported.
     */
    public boolean hasCode(DiagnosticCode code) {
        return diagnostics.stream().anyMatch(d -> d.code() == code);
    }

    public int errorCount() {
        return diagnostics.size();
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all diagnostics formatted one per entry, in report order.
     */
    public String summary() {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }
}
