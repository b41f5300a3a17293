package org.cnext.compiler.backend.codegen;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;
import org.cnext.compiler.frontend.semantics.TypeInfo;

import java.math.BigInteger;
import java.util.Locale;
import java.util.OptionalLong;

/**
 * Lowers bit indexing on integer scalars to shift and mask expressions. {@code x[i]} reads
 * or writes one bit, {@code x[s, w]} a range of {@code w} bits starting at bit {@code s}.
 * Constant positions are checked against the width of the operand.
 */
public class BitAccessGenerator {

    private final ConstantFolder folder;
    private final DiagnosticsEngine diagnostics;

    public BitAccessGenerator(ConstantFolder folder, DiagnosticsEngine diagnostics) {
        this.folder = folder;
        this.diagnostics = diagnostics;
    }

    /**
     * Emits a bit read: {@code ((x >> s) & mask)}.
     *
     * @param operand The C text of the scalar being read.
     * @param type    The operand type.
     * @param start   The C text of the start bit.
     */
    public String read(String operand, TypeInfo type, Expression.Index index, String start, String width) {
        checkBounds(type, index);
        return "((" + operand + " >> " + start + ") & " + mask(type, index, width) + ")";
    }

    /**
     * Emits a read-modify-write that replaces the addressed bits and keeps the others:
     * {@code x = (x & ~(mask << s)) | (((T)(v) & mask) << s)}.
     */
    public String readModifyWrite(String target, TypeInfo type, String cType, Expression.Index index,
                                  String start, String width, String value) {
        checkBounds(type, index);
        String mask = mask(type, index, width);
        return target + " = (" + target + " & ~(" + mask + " << " + start + ")) | (((" + cType + ")(" + value
                + ") & " + mask + ") << " + start + ")";
    }

    /**
     * Emits a write that does not read the target first, for write-only and write-one registers:
     * {@code R = (((T)(v) & mask) << s)}.
     */
    public String plainWrite(String target, TypeInfo type, String cType, Expression.Index index,
                             String start, String width, String value) {
        checkBounds(type, index);
        return target + " = (((" + cType + ")(" + value + ") & " + mask(type, index, width) + ") << " + start + ")";
    }

    private String mask(TypeInfo type, Expression.Index index, String width) {
        String suffix = type.bitWidth() == 64 ? "ULL" : "U";
        if (!index.isRange()) {
            return "1" + suffix;
        }
        OptionalLong folded = folder.fold(index.width());
        if (folded.isPresent() && folded.getAsLong() > 0 && folded.getAsLong() <= 64) {
            BigInteger mask = BigInteger.ONE.shiftLeft((int) folded.getAsLong()).subtract(BigInteger.ONE);
            return "0x" + mask.toString(16).toUpperCase(Locale.ROOT) + suffix;
        }
        return "((1" + suffix + " << " + width + ") - 1" + suffix + ")";
    }

    private void checkBounds(TypeInfo type, Expression.Index index) {
        int bits = type.bitWidth();
        OptionalLong start = folder.fold(index.index());
        OptionalLong width = index.isRange() ? folder.fold(index.width()) : OptionalLong.of(1);
        SourcePosition position = index.position();
        if (start.isPresent() && (start.getAsLong() < 0 || start.getAsLong() >= bits)) {
            report("Bit index " + start.getAsLong() + " is out of range for a " + bits + "-bit value", position);
        } else if (start.isPresent() && width.isPresent()
                && (width.getAsLong() <= 0 || start.getAsLong() + width.getAsLong() > bits)) {
            report("Bit range [" + start.getAsLong() + ", " + width.getAsLong() + "] exceeds a " + bits
                    + "-bit value", position);
        }
    }

    private void report(String message, SourcePosition position) {
        diagnostics.reportError(DiagnosticCode.BIT_INDEX_OUT_OF_RANGE, message, position.fileName(),
                position.line(), position.column(), "Valid bit positions are 0 to bit width - 1");
    }
}
