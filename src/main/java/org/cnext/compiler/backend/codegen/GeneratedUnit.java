package org.cnext.compiler.backend.codegen;

/**
 * The C output of one C-Next unit.
 *
 * @param baseName The file name without extension, e.g. {@code motor}.
 * @param source   The text of the {@code .c} file.
 * @param header   The text of the {@code .h} file.
 */
public record GeneratedUnit(String baseName, String source, String header) {}
