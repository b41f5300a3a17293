package org.cnext.compiler.frontend.module;

/**
 * One {@code #include} line found by the dependency scan.
 *
 * @param target The include target as written, e.g. {@code lib/util.h}.
 * @param angled True for {@code <...>} includes, false for {@code "..."} includes.
 * @param line   The 1-based line of the directive.
 */
public record IncludeDirective(String target, boolean angled, int line) {

    /**
     * Returns the directive in source form, e.g. {@code #include <stdio.h>}.
     */
    public String text() {
        return angled ? "#include <" + target + ">" : "#include \"" + target + "\"";
    }
}
