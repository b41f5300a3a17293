package org.cnext.compiler.backend.codegen;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;
import org.cnext.compiler.frontend.semantics.BuiltinTypes;
import org.cnext.compiler.frontend.semantics.TypeInfo;
import org.cnext.compiler.frontend.semantics.TypeKind;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;

/**
 * Emits numeric literals for a known target type.
 *
 * <p>Literals at the exact boundary of their target type are rejected in favor of the named
 * bounds ({@code T.MIN}, {@code T.MAX}), which compile to the {@code <stdint.h>} macros.
 * Literals outside the target range are rejected. Unsigned targets get a {@code U} or
 * {@code ULL} suffix, and negative hex or binary literals are rewritten to decimal.</p>
 */
public class LiteralGenerator {

    private static final BigInteger INT32_MAX = BigInteger.valueOf(Integer.MAX_VALUE);

    private final DiagnosticsEngine diagnostics;

    public LiteralGenerator(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Emits an integer literal.
     *
     * @param literal    The literal.
     * @param negated    True if the literal is the operand of a unary minus.
     * @param target     The type the value flows into, or {@code null} if unknown.
     * @param checkRange True if the literal is the whole value assigned to the target.
     */
    public String integer(Expression.Literal literal, boolean negated, TypeInfo target, boolean checkRange) {
        Optional<IntegerLiteral> parsed = IntegerLiteral.parse(literal.text());
        if (parsed.isEmpty()) {
            report(DiagnosticCode.SYNTAX_ERROR, "Malformed integer literal '" + literal.text() + "'",
                    literal.position(), null);
            return literal.text();
        }
        IntegerLiteral value = parsed.get();
        TypeInfo type = value.typeSuffix() != null
                ? BuiltinTypes.dslPrimitive(value.typeSuffix()).orElse(null)
                : target != null && target.kind().isInteger() && !target.isArray() ? target : null;
        BigInteger signedValue = negated ? value.magnitude().negate() : value.magnitude();

        if (checkRange && type != null) {
            checkRange(signedValue, type, literal.position());
        }

        StringBuilder text = new StringBuilder();
        boolean longLong = false;
        if (negated) {
            text.append('-').append(value.magnitude().toString(10));
            if (value.magnitude().compareTo(INT32_MAX) > 0) {
                text.append("LL");
                longLong = true;
            }
        } else if (value.radix() == 10) {
            text.append(value.magnitude().toString(10));
        } else {
            text.append("0x").append(value.magnitude().toString(16).toUpperCase(Locale.ROOT));
        }

        if (type != null && type.kind() == TypeKind.UNSIGNED && !negated) {
            text.append(type.bitWidth() == 64 ? "ULL" : "U");
        } else if (type != null && type.kind() == TypeKind.SIGNED && type.bitWidth() == 64 && !longLong
                && value.magnitude().compareTo(INT32_MAX) > 0) {
            text.append("LL");
        }
        return text.toString();
    }

    /**
     * Emits a floating-point literal; {@code f32} targets get an {@code f} suffix.
     */
    public String floating(Expression.Literal literal, TypeInfo target) {
        String text = literal.text();
        boolean single = target != null && target.kind() == TypeKind.FLOAT && target.bitWidth() == 32;
        if (text.endsWith("f32")) {
            text = text.substring(0, text.length() - 3);
            single = true;
        } else if (text.endsWith("f64")) {
            text = text.substring(0, text.length() - 3);
            single = false;
        }
        return single ? text + "f" : text;
    }

    /**
     * Emits {@code T.MIN} or {@code T.MAX} as the matching {@code <stdint.h>} macro.
     */
    public String boundary(TypeInfo type, String bound) {
        return BuiltinTypes.boundaryMacro(type, bound);
    }

    private void checkRange(BigInteger value, TypeInfo type, SourcePosition position) {
        int width = type.bitWidth();
        boolean signed = type.kind() == TypeKind.SIGNED;
        BigInteger min = signed ? BigInteger.ONE.shiftLeft(width - 1).negate() : BigInteger.ZERO;
        BigInteger max = signed
                ? BigInteger.ONE.shiftLeft(width - 1).subtract(BigInteger.ONE)
                : BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
        String typeName = BuiltinTypes.dslNameFor(type.kind(), width).orElse(type.baseType());
        if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            report(DiagnosticCode.LITERAL_OUT_OF_RANGE,
                    "Literal " + value + " does not fit in " + typeName + " (" + min + " to " + max + ")",
                    position, null);
        } else if (value.equals(max)) {
            report(DiagnosticCode.BOUNDARY_LITERAL,
                    "Literal " + value + " is the maximum value of " + typeName,
                    position, "Use " + typeName + ".MAX");
        } else if (signed && value.equals(min)) {
            report(DiagnosticCode.BOUNDARY_LITERAL,
                    "Literal " + value + " is the minimum value of " + typeName,
                    position, "Use " + typeName + ".MIN");
        }
    }

    private void report(DiagnosticCode code, String message, SourcePosition position, String suggestion) {
        diagnostics.reportError(code, message, position.fileName(), position.line(), position.column(), suggestion);
    }
}
