package org.cnext.compiler.backend.register;

import org.cnext.compiler.frontend.semantics.TypeInfo;

/**
 * One field of a register block.
 *
 * @param name   The field name.
 * @param type   The field type; its bit width bounds bit accesses.
 * @param cType  The C spelling of the field type.
 * @param access The access mode.
 * @param offset The byte offset from the block base, as C text.
 */
public record RegisterField(String name, TypeInfo type, String cType, RegisterAccess access, String offset) {}
