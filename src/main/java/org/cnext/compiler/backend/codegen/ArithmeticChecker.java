package org.cnext.compiler.backend.codegen;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;
import org.cnext.compiler.frontend.semantics.TypeInfo;
import org.cnext.compiler.frontend.semantics.TypeKind;

import java.util.OptionalLong;

/**
 * Compile-time checks on arithmetic and on integer values flowing into typed storage.
 *
 * <p>A divisor that folds to zero is rejected, as is {@code %} with a floating-point operand.
 * A declaration or plain assignment whose value is a named integer (a variable, field,
 * element, register field or call) may neither lose bits nor change signedness; the value
 * has to be narrowed explicitly with a bit range or a cast.</p>
 */
public class ArithmeticChecker {

    private final TypeResolver types;
    private final ConstantFolder folder;
    private final DiagnosticsEngine diagnostics;

    public ArithmeticChecker(TypeResolver types, ConstantFolder folder, DiagnosticsEngine diagnostics) {
        this.types = types;
        this.folder = folder;
        this.diagnostics = diagnostics;
    }

    /**
     * Checks one application of a binary operator, written or compound.
     */
    public void checkOperation(String operator, Expression left, Expression right, SourcePosition position) {
        if (!"/".equals(operator) && !"%".equals(operator)) {
            return;
        }
        OptionalLong divisor = folder.fold(right);
        if (divisor.isPresent() && divisor.getAsLong() == 0) {
            boolean division = "/".equals(operator);
            report(DiagnosticCode.DIVISION_BY_ZERO, (division ? "Division" : "Modulo") + " by zero", position,
                    "Guard the " + (division ? "division" : "modulo") + " with a check of the divisor");
        }
        if ("%".equals(operator) && (isFloat(left) || isFloat(right))) {
            report(DiagnosticCode.FLOAT_MODULO, "The % operator is not defined for floating-point operands", position,
                    "Use fmod() from <math.h> for a floating-point remainder");
        }
    }

    /**
     * Checks an integer value stored into a declaration or assignment target of type {@code target}.
     */
    public void checkConversion(Expression value, TypeInfo target, SourcePosition position) {
        if (target == null || !target.kind().isInteger() || target.isArray() || !isNamedValue(value)
                || folder.fold(value).isPresent()) {
            return;
        }
        TypeInfo source = types.typeOf(value);
        if (source == null || !source.kind().isInteger() || source.isArray()) {
            return;
        }
        String from = source.baseType();
        String to = target.baseType();
        if (source.bitWidth() > target.bitWidth()) {
            report(DiagnosticCode.NARROWING_CONVERSION,
                    "Cannot assign " + from + " to " + to + " (narrowing from " + source.bitWidth() + " to "
                            + target.bitWidth() + " bits)",
                    position, "Select the bits explicitly: value[0, " + target.bitWidth() + "]");
        } else if (source.kind() != target.kind()) {
            report(DiagnosticCode.SIGN_CONVERSION,
                    "Cannot assign " + from + " to " + to + " (sign change)",
                    position, "Convert explicitly with a cast: (" + to + ") value");
        }
    }

    // Operators, literals and casts follow C's arithmetic conversions and are left to the range checks.
    private static boolean isNamedValue(Expression value) {
        if (value instanceof Expression.Identifier || value instanceof Expression.Call) {
            return true;
        }
        if (value instanceof Expression.MemberAccess access) {
            return !"length".equals(access.member()) && !"capacity".equals(access.member());
        }
        return value instanceof Expression.Index index && !index.isRange();
    }

    private boolean isFloat(Expression expression) {
        TypeInfo type = types.typeOf(expression);
        return type != null && type.kind() == TypeKind.FLOAT;
    }

    private void report(DiagnosticCode code, String message, SourcePosition position, String suggestion) {
        diagnostics.reportError(code, message, position.fileName(), position.line(), position.column(), suggestion);
    }
}
