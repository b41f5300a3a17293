package org.cnext.compiler.backend.codegen;

import org.cnext.compiler.backend.register.RegisterBinding;
import org.cnext.compiler.backend.register.RegisterField;
import org.cnext.compiler.backend.register.RegisterRegistry;
import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.parser.Parser;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;
import org.cnext.compiler.frontend.semantics.BuiltinTypes;
import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.SymbolTable;
import org.cnext.compiler.frontend.semantics.TypeInfo;
import org.cnext.compiler.frontend.semantics.TypeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Emits C for C-Next expressions.
 *
 * <p>Operators keep their C precedence; nested binary and ternary operands are parenthesized.
 * Member access is resolved here: type bounds, register fields, enum variants, the
 * {@code length} and {@code capacity} properties and struct fields. Calls pass struct and
 * by-reference arguments by address.</p>
 */
public class ExpressionGenerator {

    private final SymbolTable symbolTable;
    private final RegisterRegistry registers;
    private final TypeResolver types;
    private final LiteralGenerator literals;
    private final BitAccessGenerator bits;
    private final ArithmeticChecker arithmetic;
    private final DiagnosticsEngine diagnostics;

    private final Set<String> laterDeclarations = new HashSet<>();
    private final Set<String> requiredHeaders = new LinkedHashSet<>();

    public ExpressionGenerator(SymbolTable symbolTable, RegisterRegistry registers, TypeResolver types,
                               LiteralGenerator literals, BitAccessGenerator bits, ArithmeticChecker arithmetic,
                               DiagnosticsEngine diagnostics) {
        this.symbolTable = symbolTable;
        this.registers = registers;
        this.types = types;
        this.literals = literals;
        this.bits = bits;
        this.arithmetic = arithmetic;
        this.diagnostics = diagnostics;
    }

    // === Unit state ===

    /**
     * Resets the per-unit state. {@code declaredNames} are the top-level names of the unit
     * that have not been generated yet; referring to one of them is a use before definition.
     */
    public void beginUnit(Set<String> declaredNames) {
        laterDeclarations.clear();
        laterDeclarations.addAll(declaredNames);
        requiredHeaders.clear();
    }

    /**
     * Marks a top-level name as defined.
     */
    public void defined(String name) {
        laterDeclarations.remove(name);
    }

    public boolean isDeclaredLater(String name) {
        return laterDeclarations.contains(name);
    }

    public void requireHeader(String header) {
        requiredHeaders.add(header);
    }

    /**
     * The system headers the generated code of the current unit needs beyond stdint and stdbool.
     */
    public Set<String> requiredHeaders() {
        return Collections.unmodifiableSet(requiredHeaders);
    }

    // === Entry points ===

    /**
     * Emits an expression.
     *
     * @param expected The type the value flows into, or {@code null}. Untyped literals take it on.
     */
    public String generate(Expression expression, TypeInfo expected) {
        return emit(expression, expected, false);
    }

    /**
     * Emits the whole value of a declaration, assignment, return or call argument. A literal in
     * this position is checked against the range of its target type.
     */
    public String generateValue(Expression expression, TypeInfo expected) {
        if (expression instanceof Expression.Literal literal && literal.kind() == Expression.LiteralKind.INTEGER) {
            return literals.integer(literal, false, expected, true);
        }
        if (expression instanceof Expression.Unary unary && "-".equals(unary.operator())
                && unary.operand() instanceof Expression.Literal literal
                && literal.kind() == Expression.LiteralKind.INTEGER) {
            return literals.integer(literal, true, expected, true);
        }
        return generate(expression, expected);
    }

    /**
     * Emits an assignment target. Register fields are not checked for readability here.
     */
    public String lvalue(Expression expression) {
        return emit(expression, null, true);
    }

    /**
     * Emits a pointer to a value: the address of an lvalue, the pointer itself for
     * by-reference locals, or a compound literal for any other value.
     *
     * @param cType The C type of the pointed-to value, used for compound literals.
     */
    public String addressOf(Expression expression, TypeInfo type, String cType) {
        if (expression instanceof Expression.Identifier identifier) {
            Optional<TypeResolver.LocalVariable> local = types.local(identifier.name());
            if (local.isPresent() && local.get().storage() != TypeResolver.Storage.VALUE) {
                return identifier.name();
            }
            if (local.isPresent() || symbolTable.resolve(identifier.name())
                    .filter(Symbol.VariableSymbol.class::isInstance).isPresent()) {
                return "&" + identifier.name();
            }
        }
        if (isAddressable(expression)) {
            return "&" + generate(expression, type);
        }
        return "&(" + cType + "){" + generateValue(expression, type) + "}";
    }

    private boolean isAddressable(Expression expression) {
        if (expression instanceof Expression.Identifier identifier) {
            return types.isLocal(identifier.name())
                    || symbolTable.resolve(identifier.name()).filter(Symbol.VariableSymbol.class::isInstance).isPresent();
        }
        if (expression instanceof Expression.MemberAccess access) {
            TypeInfo targetType = types.typeOf(access.target());
            return targetType != null && targetType.isStruct() && isAddressable(access.target());
        }
        if (expression instanceof Expression.Index index) {
            TypeInfo targetType = types.typeOf(index.target());
            return !index.isRange() && targetType != null && (targetType.isArray() || targetType.isString())
                    && isAddressable(index.target());
        }
        return false;
    }

    // === Dispatch ===

    private String emit(Expression expression, TypeInfo expected, boolean write) {
        if (expression instanceof Expression.Literal literal) {
            return literal(literal, expected);
        }
        if (expression instanceof Expression.NullLiteral) {
            return "NULL";
        }
        if (expression instanceof Expression.Identifier identifier) {
            return identifier(identifier);
        }
        if (expression instanceof Expression.MemberAccess access) {
            return memberAccess(access, write);
        }
        if (expression instanceof Expression.Index index) {
            return index(index, write);
        }
        if (expression instanceof Expression.Unary unary) {
            return unary(unary, expected);
        }
        if (expression instanceof Expression.Binary binary) {
            return binary(binary, expected);
        }
        if (expression instanceof Expression.Ternary ternary) {
            return "(" + generate(ternary.condition(), null) + ") ? "
                    + operand(ternary.thenValue(), expected) + " : " + operand(ternary.elseValue(), expected);
        }
        if (expression instanceof Expression.Call call) {
            return call(call);
        }
        if (expression instanceof Expression.Cast cast) {
            Optional<TypeInfo> target = types.resolve(cast.type());
            if (target.isEmpty()) {
                reportUndefined(cast.type().name(), cast.type().position(), "type");
            }
            return "(" + types.cTypeName(cast.type()) + ")" + operand(cast.operand(), target.orElse(null));
        }
        throw new IllegalStateException("Unhandled expression " + expression.getClass().getSimpleName());
    }

    private String literal(Expression.Literal literal, TypeInfo expected) {
        switch (literal.kind()) {
            case INTEGER:
                return literals.integer(literal, false, expected, false);
            case FLOAT:
                return literals.floating(literal, expected);
            default:
                return literal.text();
        }
    }

    private String identifier(Expression.Identifier identifier) {
        String name = identifier.name();
        Optional<TypeResolver.LocalVariable> local = types.local(name);
        if (local.isPresent()) {
            TypeResolver.Storage storage = local.get().storage();
            return storage == TypeResolver.Storage.POINTER || storage == TypeResolver.Storage.STRUCT_POINTER
                    ? "(*" + name + ")"
                    : name;
        }
        if (!symbolTable.contains(name) && symbolTable.resolveEnumMemberOwner(name).isEmpty()) {
            reportUndefined(name, identifier.position(), "identifier");
        }
        return name;
    }

    private void reportUndefined(String name, SourcePosition position, String what) {
        if (laterDeclarations.contains(name)) {
            report(DiagnosticCode.USE_BEFORE_DEFINITION, "'" + name + "' is used before its definition",
                    position, "Move the definition of '" + name + "' above its first use");
        } else {
            report(DiagnosticCode.UNDEFINED_IDENTIFIER, "Undefined " + what + " '" + name + "'", position, null);
        }
    }

    // === Member access ===

    private String memberAccess(Expression.MemberAccess access, boolean write) {
        String member = access.member();
        if (access.target() instanceof Expression.Identifier target && !types.isLocal(target.name())) {
            String name = target.name();
            Optional<TypeInfo> primitive = BuiltinTypes.dslPrimitive(name);
            if (primitive.isPresent()) {
                return typeBound(primitive.get(), access);
            }
            Optional<RegisterBinding> register = registers.resolve(name);
            if (register.isPresent()) {
                return registerField(register.get(), access, write);
            }
            Optional<Symbol.EnumSymbol> enumSymbol = symbolTable.resolveEnum(name);
            if (enumSymbol.isPresent() && symbolTable.resolve(name)
                    .filter(Symbol.VariableSymbol.class::isInstance).isEmpty()) {
                return enumVariant(enumSymbol.get(), access);
            }
        }

        TypeInfo targetType = types.typeOf(access.target());
        if (targetType != null && targetType.kind() == TypeKind.STRUCT && !targetType.isArray()) {
            TypeInfo field = types.fieldOf(targetType, member);
            if (field != null) {
                return structField(access);
            }
            if (!"length".equals(member) && !targetType.structFields().isEmpty()) {
                report(DiagnosticCode.UNKNOWN_MEMBER, "'" + targetType.baseType() + "' has no field '" + member + "'",
                        access.position(), null);
                return structField(access);
            }
        }
        if ("length".equals(member) && targetType != null) {
            return length(access, targetType);
        }
        if ("capacity".equals(member) && targetType != null && targetType.isString()) {
            return Integer.toString(targetType.stringCapacity());
        }
        return structField(access);
    }

    private String structField(Expression.MemberAccess access) {
        if (access.target() instanceof Expression.Identifier target) {
            Optional<TypeResolver.LocalVariable> local = types.local(target.name());
            if (local.isPresent() && local.get().storage() == TypeResolver.Storage.STRUCT_POINTER) {
                return target.name() + "->" + access.member();
            }
        }
        return operand(access.target(), null) + "." + access.member();
    }

    private String typeBound(TypeInfo type, Expression.MemberAccess access) {
        String member = access.member();
        if (type.kind().isInteger() && ("MIN".equals(member) || "MAX".equals(member))) {
            return literals.boundary(type, member);
        }
        report(DiagnosticCode.UNKNOWN_MEMBER, "Type '" + type.baseType() + "' has no property '" + member + "'",
                access.position(), null);
        return member;
    }

    private String registerField(RegisterBinding register, Expression.MemberAccess access, boolean write) {
        Optional<RegisterField> field = register.field(access.member());
        if (field.isEmpty()) {
            report(DiagnosticCode.UNKNOWN_MEMBER,
                    "Register '" + register.name() + "' has no field '" + access.member() + "'",
                    access.position(), null);
            return register.name() + "_" + access.member();
        }
        if (!write && !field.get().access().isReadable()) {
            report(DiagnosticCode.READ_OF_WRITE_ONLY_REGISTER,
                    "Register field '" + register.name() + "." + access.member() + "' is "
                            + field.get().access().keyword() + " and cannot be read",
                    access.position(), null);
        }
        return register.macroName(field.get());
    }

    private String enumVariant(Symbol.EnumSymbol enumSymbol, Expression.MemberAccess access) {
        if (!enumSymbol.members().containsKey(access.member())) {
            report(DiagnosticCode.UNKNOWN_MEMBER,
                    "Enum '" + enumSymbol.name() + "' has no variant '" + access.member() + "'",
                    access.position(), null);
        }
        return enumSymbol.language() == SourceLanguage.CNEXT
                ? enumSymbol.name() + "_" + access.member()
                : access.member();
    }

    private String length(Expression.MemberAccess access, TypeInfo type) {
        if (type.isArray()) {
            return Integer.toString(type.arrayLength());
        }
        if (type.isString()) {
            requireHeader("string.h");
            return "strlen(" + generate(access.target(), null) + ")";
        }
        return Integer.toString(type.bitWidth());
    }

    // === Indexing ===

    private String index(Expression.Index index, boolean write) {
        TypeInfo targetType = types.typeOf(index.target());
        String target = emit(index.target(), null, write);
        if (targetType != null && targetType.kind().isInteger() && !targetType.isArray()) {
            String start = generate(index.index(), null);
            String width = index.isRange() ? generate(index.width(), null) : null;
            return bits.read(target, targetType, index, start, width);
        }
        if (index.isRange()) {
            report(DiagnosticCode.SYNTAX_ERROR, "A range of an array can only be assigned to", index.position(),
                    "Copy the bytes with 'arr[offset, length] <- value'");
        }
        return target + "[" + generate(index.index(), null) + "]";
    }

    // === Operators ===

    private String unary(Expression.Unary unary, TypeInfo expected) {
        if ("-".equals(unary.operator()) && unary.operand() instanceof Expression.Literal literal
                && literal.kind() == Expression.LiteralKind.INTEGER) {
            return literals.integer(literal, true, expected, false);
        }
        return unary.operator() + operand(unary.operand(), expected);
    }

    private String binary(Expression.Binary binary, TypeInfo expected) {
        String operator = "=".equals(binary.operator()) ? "==" : binary.operator();
        arithmetic.checkOperation(binary.operator(), binary.left(), binary.right(), binary.position());
        TypeInfo operandType = expected;
        if (isComparison(binary.operator()) || "&&".equals(operator) || "||".equals(operator)) {
            TypeInfo left = types.typeOf(binary.left());
            operandType = left != null ? left : types.typeOf(binary.right());
        }
        return operand(binary.left(), operandType) + " " + operator + " " + operand(binary.right(), operandType);
    }

    private static boolean isComparison(String operator) {
        switch (operator) {
            case "=": case "!=": case "<": case "<=": case ">": case ">=":
                return true;
            default:
                return false;
        }
    }

    private String operand(Expression expression, TypeInfo expected) {
        String text = generate(expression, expected);
        return expression instanceof Expression.Binary || expression instanceof Expression.Ternary
                ? "(" + text + ")"
                : text;
    }

    // === Calls ===

    private String call(Expression.Call call) {
        String callee = call.calleeName();
        if (Parser.ARRAY_INITIALIZER.equals(callee)) {
            List<String> elements = new ArrayList<>();
            for (Expression element : call.arguments()) {
                elements.add(generateValue(element, null));
            }
            return "{" + String.join(", ", elements) + "}";
        }
        if (callee == null) {
            report(DiagnosticCode.SYNTAX_ERROR, "Only named functions can be called", call.position(), null);
            return generate(call.callee(), null) + "()";
        }
        Optional<Symbol.FunctionSymbol> function = symbolTable.resolveFunction(callee);
        if (function.isEmpty()) {
            reportUndefined(callee, call.position(), "function");
            List<String> arguments = new ArrayList<>();
            for (Expression argument : call.arguments()) {
                arguments.add(generate(argument, null));
            }
            return callee + "(" + String.join(", ", arguments) + ")";
        }
        Symbol.FunctionSymbol symbol = function.get();
        List<Symbol.Parameter> parameters = symbol.parameters();
        boolean isCNext = symbol.language() == SourceLanguage.CNEXT;
        if (isCNext && call.arguments().size() != parameters.size()) {
            report(DiagnosticCode.ARGUMENT_COUNT_MISMATCH,
                    "'" + callee + "' expects " + parameters.size() + " argument(s) but got " + call.arguments().size(),
                    call.position(), null);
        }
        List<String> arguments = new ArrayList<>();
        for (int i = 0; i < call.arguments().size(); i++) {
            Expression argument = call.arguments().get(i);
            Symbol.Parameter parameter = i < parameters.size() ? parameters.get(i) : null;
            arguments.add(isCNext ? cnextArgument(argument, parameter) : foreignArgument(argument, parameter));
        }
        return callee + "(" + String.join(", ", arguments) + ")";
    }

    private String cnextArgument(Expression argument, Symbol.Parameter parameter) {
        if (parameter == null) {
            return generate(argument, null);
        }
        TypeInfo type = parameter.type();
        if (type.isArray() || type.isString()) {
            return generate(argument, type);
        }
        if (parameter.byReference() || type.isStruct()) {
            return addressOf(argument, type, types.cTypeName(type));
        }
        return generateValue(argument, type);
    }

    private String foreignArgument(Expression argument, Symbol.Parameter parameter) {
        if (parameter == null) {
            return generate(argument, null);
        }
        TypeInfo argumentType = types.typeOf(argument);
        if (parameter.type().kind() == TypeKind.POINTER && argumentType != null && argumentType.isStruct()) {
            return addressOf(argument, argumentType, types.cTypeName(argumentType));
        }
        return generate(argument, parameter.type().kind().isScalar() ? parameter.type() : null);
    }

    private void report(DiagnosticCode code, String message, SourcePosition position, String suggestion) {
        diagnostics.reportError(code, message, position.fileName(), position.line(), position.column(), suggestion);
    }
}
