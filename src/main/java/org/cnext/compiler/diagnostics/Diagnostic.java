package org.cnext.compiler.diagnostics;

/**
 * Represents a single diagnostic reported during compilation.
 *
 * @param code       The stable diagnostic code.
 * @param message    The human-readable message.
 * @param fileName   The file the diagnostic refers to.
 * @param line       The 1-based line number, or 0 if unknown.
 * @param column     The 1-based column number, or 0 if unknown.
 * @param suggestion An optional suggested fix, or {@code null}.
 */
public record Diagnostic(
        DiagnosticCode code,
        String message,
        String fileName,
        int line,
        int column,
        String suggestion
) {

    /**
     * Formats the diagnostic as {@code file:line:col error[CODE]: message}, followed by
     * an indented help line when a suggestion is present.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(fileName).append(':').append(line).append(':').append(column)
                .append(" error[").append(code.code()).append("]: ").append(message);
        if (suggestion != null && !suggestion.isBlank()) {
            sb.append("\n  help: ").append(suggestion);
        }
        return sb.toString();
    }
}
