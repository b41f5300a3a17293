package org.cnext.compiler.frontend.semantics.flow;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.parser.ast.Declaration;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;
import org.cnext.compiler.frontend.parser.ast.Statement;
import org.cnext.compiler.frontend.parser.ast.TypeRef;
import org.cnext.compiler.frontend.semantics.SymbolTable;
import org.cnext.compiler.frontend.semantics.TypeInfo;
import org.cnext.compiler.frontend.semantics.TypeKind;

import java.util.Optional;
import java.util.Set;

/**
 * Null safety for the handles returned by C library functions.
 *
 * <p>Only a closed set of C functions is known to return NULL. Their results must be bound
 * to a variable whose name starts with {@code c_}, and such a variable may only be used on
 * paths where a comparison against {@code NULL} has proven it non-null. {@code NULL} itself
 * only appears as an operand of {@code =} or {@code !=}. Heap allocation functions are
 * rejected outright.</p>
 */
public class NullSafetyRule implements IFlowRule {

    /** C functions whose result may be NULL. */
    public static final Set<String> NULLABLE_FUNCTIONS = Set.of(
            "fgets", "fputs", "fgetc", "fputc", "gets", "fopen", "freopen", "tmpfile",
            "strstr", "strchr", "strrchr", "memchr", "getenv");

    /** Dynamic allocation is not available. */
    public static final Set<String> FORBIDDEN_FUNCTIONS = Set.of("malloc", "calloc", "realloc", "free");

    /** Name prefix marking a nullable variable. */
    public static final String NULLABLE_PREFIX = "c_";

    private final SymbolTable symbolTable;
    private final DiagnosticsEngine diagnostics;
    private boolean reporting = true;

    public NullSafetyRule(SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        this.symbolTable = symbolTable;
        this.diagnostics = diagnostics;
    }

    public static boolean isNullableName(String name) {
        return name != null && name.startsWith(NULLABLE_PREFIX);
    }

    @Override
    public void enterFunction(Declaration.FunctionDecl function, FlowState state) {
        for (Declaration.Parameter parameter : function.parameters()) {
            if (isNullableName(parameter.name()) && !isNullableType(parameter.type())) {
                report(DiagnosticCode.INVALID_NULLABLE_PREFIX,
                        "Parameter '" + parameter.name() + "' uses the c_ prefix but its type cannot be NULL",
                        parameter.position(), "Remove the c_ prefix");
            }
        }
    }

    @Override
    public void setReporting(boolean enabled) {
        this.reporting = enabled;
    }

    @Override
    public void declare(Statement.VariableDeclaration declaration, FlowState state) {
        bind(declaration.name(), declaration.type(), declaration.initializer(), declaration.position(), state);
    }

    @Override
    public void assign(Statement.Assignment assignment, FlowState state) {
        Expression target = assignment.target();
        if (target instanceof Expression.Identifier identifier && !assignment.isCompound()) {
            bind(identifier.name(), null, assignment.value(), assignment.position(), state);
            return;
        }
        check(target, state);
        check(assignment.value(), state);
    }

    @Override
    public void evaluate(Expression expression, FlowState state) {
        check(expression, state);
    }

    @Override
    public void refine(Expression condition, FlowState whenTrue, FlowState whenFalse) {
        if (condition instanceof Expression.Binary binary) {
            switch (binary.operator()) {
                case "!=":
                    nullCheckedName(binary).ifPresent(name -> whenTrue.setNullState(name, NullState.NOT_NULL));
                    break;
                case "=":
                    nullCheckedName(binary).ifPresent(name -> whenFalse.setNullState(name, NullState.NOT_NULL));
                    break;
                case "&&":
                    refine(binary.left(), whenTrue, whenTrue.copy());
                    refine(binary.right(), whenTrue, whenTrue.copy());
                    break;
                case "||":
                    refine(binary.left(), whenFalse.copy(), whenFalse);
                    refine(binary.right(), whenFalse.copy(), whenFalse);
                    break;
                default:
                    break;
            }
        } else if (condition instanceof Expression.Unary unary && "!".equals(unary.operator())) {
            refine(unary.operand(), whenFalse, whenTrue);
        }
    }

    // === Bindings ===

    /**
     * Handles a value flowing into a named variable through a declaration or assignment.
     *
     * @param declaredType The declared type, or {@code null} for an assignment.
     */
    private void bind(String name, TypeRef declaredType, Expression value, SourcePosition position, FlowState state) {
        boolean nullableTarget = isNullableName(name);
        boolean fromNullableCall = isNullableCall(value);

        if (declaredType != null && nullableTarget && !fromNullableCall && !isNullableType(declaredType)) {
            report(DiagnosticCode.INVALID_NULLABLE_PREFIX,
                    "Variable '" + name + "' uses the c_ prefix but is not bound to a value that can be NULL",
                    position, "Remove the c_ prefix");
        }

        if (value == null) {
            if (nullableTarget) {
                state.setNullState(name, NullState.UNCHECKED);
            }
            return;
        }
        if (fromNullableCall) {
            Expression.Call call = (Expression.Call) value;
            checkArguments(call, state);
            if (nullableTarget) {
                state.setNullState(name, NullState.UNCHECKED);
            } else {
                report(DiagnosticCode.MISSING_NULLABLE_PREFIX,
                        "The result of '" + call.calleeName() + "' can be NULL and must be stored in a c_ variable",
                        value.position(), "Rename '" + name + "' to 'c_" + name + "'");
            }
            return;
        }
        if (value instanceof Expression.Identifier source && isNullableName(source.name())) {
            if (nullableTarget) {
                state.setNullState(name, state.nullState(source.name()));
            } else {
                report(DiagnosticCode.INVALID_NULLABLE_STORAGE,
                        "Nullable '" + source.name() + "' cannot be stored in non-nullable '" + name + "'",
                        value.position(), "Store it in a c_ variable");
            }
            return;
        }
        check(value, state);
        if (nullableTarget) {
            state.setNullState(name, NullState.UNCHECKED);
        }
    }

    private boolean isNullableType(TypeRef type) {
        return symbolTable.resolveType(type.name())
                .map(TypeInfo::kind)
                .map(kind -> kind == TypeKind.OPAQUE || kind == TypeKind.POINTER)
                .orElse(false);
    }

    private static boolean isNullableCall(Expression expression) {
        return expression instanceof Expression.Call call && call.calleeName() != null
                && NULLABLE_FUNCTIONS.contains(call.calleeName());
    }

    // === Uses ===

    private void check(Expression expression, FlowState state) {
        if (expression == null) {
            return;
        }
        if (expression instanceof Expression.NullLiteral nullLiteral) {
            report(DiagnosticCode.NULL_OUTSIDE_COMPARISON, "NULL may only be compared with '=' or '!='",
                    nullLiteral.position(), null);
        } else if (expression instanceof Expression.Identifier identifier) {
            if (isNullableName(identifier.name()) && state.nullState(identifier.name()) != NullState.NOT_NULL) {
                report(DiagnosticCode.UNCHECKED_NULLABLE_USE,
                        "'" + identifier.name() + "' may be NULL here",
                        identifier.position(), "Guard the use with 'if (" + identifier.name() + " != NULL)'");
            }
        } else if (expression instanceof Expression.Binary binary) {
            checkBinary(binary, state);
        } else if (expression instanceof Expression.Call call) {
            String callee = call.calleeName() == null ? "" : call.calleeName();
            if (FORBIDDEN_FUNCTIONS.contains(callee)) {
                report(DiagnosticCode.FORBIDDEN_ALLOCATION, "Dynamic allocation with '" + callee + "' is not allowed",
                        call.position(), "Use statically sized storage");
            } else if (NULLABLE_FUNCTIONS.contains(callee)) {
                report(DiagnosticCode.MISSING_NULL_CHECK,
                        "The result of '" + callee + "' can be NULL and must be checked",
                        call.position(), "Store the result in a c_ variable and compare it with NULL");
            }
            checkArguments(call, state);
        } else if (expression instanceof Expression.Ternary ternary) {
            check(ternary.condition(), state);
            FlowState whenTrue = state.copy();
            FlowState whenFalse = state.copy();
            refine(ternary.condition(), whenTrue, whenFalse);
            check(ternary.thenValue(), whenTrue);
            check(ternary.elseValue(), whenFalse);
        } else {
            expression.getChildren().forEach(child -> {
                if (child instanceof Expression e) {
                    check(e, state);
                }
            });
        }
    }

    private void checkArguments(Expression.Call call, FlowState state) {
        for (Expression argument : call.arguments()) {
            check(argument, state);
        }
    }

    private void checkBinary(Expression.Binary binary, FlowState state) {
        String operator = binary.operator();
        if ("&&".equals(operator) || "||".equals(operator)) {
            check(binary.left(), state);
            FlowState whenTrue = state.copy();
            FlowState whenFalse = state.copy();
            refine(binary.left(), whenTrue, whenFalse);
            check(binary.right(), "&&".equals(operator) ? whenTrue : whenFalse);
            return;
        }
        if (!"=".equals(operator) && !"!=".equals(operator)) {
            check(binary.left(), state);
            check(binary.right(), state);
            return;
        }
        boolean leftNull = binary.left() instanceof Expression.NullLiteral;
        boolean rightNull = binary.right() instanceof Expression.NullLiteral;
        if (leftNull || rightNull) {
            Expression other = leftNull ? binary.right() : binary.left();
            if (other instanceof Expression.Identifier identifier && isNullableName(identifier.name())) {
                return;
            }
            if (other instanceof Expression.NullLiteral) {
                report(DiagnosticCode.NULL_COMPARISON_ON_NON_NULLABLE, "Comparing NULL with NULL is meaningless",
                        binary.position(), null);
                return;
            }
            if (isNullableCall(other)) {
                checkArguments((Expression.Call) other, state);
                return;
            }
            report(DiagnosticCode.NULL_COMPARISON_ON_NON_NULLABLE,
                    "Only c_ variables and nullable C calls can be compared with NULL",
                    binary.position(), null);
            check(other, state);
            return;
        }
        Expression nullableSide = nullableIdentifier(binary.left()) ? binary.left()
                : nullableIdentifier(binary.right()) ? binary.right() : null;
        if (nullableSide != null) {
            report(DiagnosticCode.NULLABLE_COMPARED_TO_VALUE,
                    "'" + ((Expression.Identifier) nullableSide).name() + "' may only be compared with NULL",
                    binary.position(), null);
            check(nullableSide == binary.left() ? binary.right() : binary.left(), state);
            return;
        }
        check(binary.left(), state);
        check(binary.right(), state);
    }

    private static boolean nullableIdentifier(Expression expression) {
        return expression instanceof Expression.Identifier identifier && isNullableName(identifier.name());
    }

    private static Optional<String> nullCheckedName(Expression.Binary binary) {
        if (binary.right() instanceof Expression.NullLiteral && nullableIdentifier(binary.left())) {
            return Optional.of(((Expression.Identifier) binary.left()).name());
        }
        if (binary.left() instanceof Expression.NullLiteral && nullableIdentifier(binary.right())) {
            return Optional.of(((Expression.Identifier) binary.right()).name());
        }
        return Optional.empty();
    }

    private void report(DiagnosticCode code, String message, SourcePosition position, String suggestion) {
        if (!reporting) {
            return;
        }
        diagnostics.reportError(code, message, position.fileName(), position.line(), position.column(), suggestion);
    }
}
