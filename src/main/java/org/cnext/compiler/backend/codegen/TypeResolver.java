package org.cnext.compiler.backend.codegen;

import org.cnext.compiler.backend.register.RegisterField;
import org.cnext.compiler.backend.register.RegisterRegistry;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.TypeRef;
import org.cnext.compiler.frontend.semantics.BuiltinTypes;
import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.SymbolTable;
import org.cnext.compiler.frontend.semantics.TypeInfo;
import org.cnext.compiler.frontend.semantics.TypeKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Resolves C-Next types and computes the type of expressions during generation. Keeps the
 * stack of local scopes of the function being generated, including how each local is
 * stored in the emitted C.
 */
public class TypeResolver {

    /**
     * How a local or parameter is represented in the generated C.
     */
    public enum Storage {
        /** A plain C variable. */
        VALUE,
        /** A scalar passed by reference: reads and writes go through {@code (*name)}. */
        POINTER,
        /** A struct passed by pointer: members are reached with {@code ->}. */
        STRUCT_POINTER,
        /** An array or string; decays to a pointer when passed on. */
        ARRAY
    }

    /**
     * A local variable or parameter in scope.
     *
     * @param name    The variable name.
     * @param type    The resolved type.
     * @param cType   The C spelling of the element type.
     * @param storage The C representation.
     */
    public record LocalVariable(String name, TypeInfo type, String cType, Storage storage) {}

    private final SymbolTable symbolTable;
    private final RegisterRegistry registers;
    private final ConstantFolder folder;
    private final Deque<Map<String, LocalVariable>> scopes = new ArrayDeque<>();

    public TypeResolver(SymbolTable symbolTable, RegisterRegistry registers, ConstantFolder folder) {
        this.symbolTable = symbolTable;
        this.registers = registers;
        this.folder = folder;
    }

    // === Local scopes ===

    public void pushScope() {
        scopes.push(new HashMap<>());
    }

    public void popScope() {
        scopes.pop();
    }

    public void declareLocal(LocalVariable variable) {
        if (scopes.isEmpty()) {
            pushScope();
        }
        scopes.peek().put(variable.name(), variable);
    }

    public Optional<LocalVariable> local(String name) {
        for (Map<String, LocalVariable> scope : scopes) {
            LocalVariable variable = scope.get(name);
            if (variable != null) {
                return Optional.of(variable);
            }
        }
        return Optional.empty();
    }

    public boolean isLocal(String name) {
        return local(name).isPresent();
    }

    // === Types ===

    /**
     * Resolves a written type, folding constant array dimensions.
     *
     * @return the type, or empty if the type name is unknown or a dimension is not constant.
     */
    public Optional<TypeInfo> resolve(TypeRef ref) {
        TypeInfo base;
        if (ref.isString()) {
            base = TypeInfo.string(ref.stringCapacity());
        } else {
            Optional<TypeInfo> named = symbolTable.resolveType(ref.name());
            if (named.isEmpty()) {
                return Optional.empty();
            }
            base = named.get();
        }
        if (!ref.isArray()) {
            return Optional.of(base);
        }
        List<Integer> dimensions = new ArrayList<>();
        for (Expression dimension : ref.arrayDimensions()) {
            OptionalLong value = folder.fold(dimension);
            if (value.isEmpty() || value.getAsLong() <= 0) {
                return Optional.empty();
            }
            dimensions.add((int) value.getAsLong());
        }
        return Optional.of(base.withArrayDimensions(dimensions));
    }

    /**
     * The C spelling of a written type's element type: {@code uint32_t} for {@code u32},
     * {@code char} for strings, {@code struct tag} for untypedef'd C structs.
     */
    public String cTypeName(TypeRef ref) {
        return ref.isString() ? "char" : cTypeName(ref.name());
    }

    /**
     * The C spelling of a resolved type's element type.
     */
    public String cTypeName(TypeInfo type) {
        return type.isString() ? "char" : cTypeName(type.baseType());
    }

    private String cTypeName(String name) {
        if (BuiltinTypes.isDslPrimitive(name)) {
            return BuiltinTypes.toCName(name);
        }
        List<Symbol> symbols = symbolTable.resolveAll(name);
        boolean hasTypedef = symbols.stream().anyMatch(Symbol.TypedefSymbol.class::isInstance);
        boolean isCTag = symbols.stream().anyMatch(s -> s.language() == SourceLanguage.C
                && (s instanceof Symbol.StructSymbol || s instanceof Symbol.EnumSymbol));
        if (isCTag && !hasTypedef) {
            boolean isEnum = symbols.stream().anyMatch(Symbol.EnumSymbol.class::isInstance);
            return (isEnum ? "enum " : "struct ") + name;
        }
        return name;
    }

    /**
     * The C declarator suffix for array dimensions and string storage, e.g. {@code [4][33]}.
     */
    public static String dimensionSuffix(TypeInfo type) {
        StringBuilder suffix = new StringBuilder();
        for (int dimension : type.arrayDimensions()) {
            suffix.append('[').append(dimension).append(']');
        }
        if (type.isString()) {
            suffix.append('[').append(type.stringCapacity() + 1).append(']');
        }
        return suffix.toString();
    }

    // === Expressions ===

    /**
     * Computes the static type of an expression.
     *
     * @return the type, or {@code null} if it cannot be determined (e.g. an untyped literal).
     */
    public TypeInfo typeOf(Expression expression) {
        if (expression instanceof Expression.Literal literal) {
            switch (literal.kind()) {
                case BOOLEAN:
                    return BuiltinTypes.dslPrimitive("bool").orElseThrow();
                case FLOAT:
                    return BuiltinTypes.dslPrimitive(literal.text().endsWith("f32") ? "f32" : "f64").orElseThrow();
                case STRING:
                    return TypeInfo.string(Math.max(0, literal.text().length() - 2));
                case INTEGER:
                    return IntegerLiteral.parse(literal.text())
                            .map(IntegerLiteral::typeSuffix)
                            .flatMap(BuiltinTypes::dslPrimitive)
                            .orElse(null);
                default:
                    return null;
            }
        }
        if (expression instanceof Expression.Identifier identifier) {
            return typeOfName(identifier.name());
        }
        if (expression instanceof Expression.MemberAccess access) {
            return typeOfMember(access);
        }
        if (expression instanceof Expression.Index index) {
            TypeInfo target = typeOf(index.target());
            if (target == null) {
                return null;
            }
            if (target.isArray()) {
                return index.isRange() ? target : target.elementType();
            }
            if (target.isString()) {
                return BuiltinTypes.dslPrimitive("u8").orElseThrow();
            }
            return index.isRange() ? target : BuiltinTypes.dslPrimitive("bool").orElseThrow();
        }
        if (expression instanceof Expression.Binary binary) {
            switch (binary.operator()) {
                case "=": case "!=": case "<": case "<=": case ">": case ">=": case "&&": case "||":
                    return BuiltinTypes.dslPrimitive("bool").orElseThrow();
                default:
                    TypeInfo left = typeOf(binary.left());
                    return left != null ? left : typeOf(binary.right());
            }
        }
        if (expression instanceof Expression.Unary unary) {
            return "!".equals(unary.operator())
                    ? BuiltinTypes.dslPrimitive("bool").orElseThrow()
                    : typeOf(unary.operand());
        }
        if (expression instanceof Expression.Ternary ternary) {
            TypeInfo then = typeOf(ternary.thenValue());
            return then != null ? then : typeOf(ternary.elseValue());
        }
        if (expression instanceof Expression.Call call) {
            String callee = call.calleeName();
            return callee == null ? null
                    : symbolTable.resolveFunction(callee).map(Symbol::type).orElse(null);
        }
        if (expression instanceof Expression.Cast cast) {
            return resolve(cast.type()).orElse(null);
        }
        return null;
    }

    private TypeInfo typeOfName(String name) {
        Optional<LocalVariable> local = local(name);
        if (local.isPresent()) {
            return local.get().type();
        }
        Optional<Symbol> symbol = symbolTable.resolve(name);
        if (symbol.isPresent()) {
            Symbol s = symbol.get();
            if (s instanceof Symbol.VariableSymbol || s instanceof Symbol.MacroConstantSymbol) {
                return s.type();
            }
        }
        return symbolTable.resolveEnumMemberOwner(name).map(Symbol::type).orElse(null);
    }

    private TypeInfo typeOfMember(Expression.MemberAccess access) {
        String member = access.member();
        if (access.target() instanceof Expression.Identifier target && !isLocal(target.name())) {
            String name = target.name();
            Optional<TypeInfo> primitive = BuiltinTypes.dslPrimitive(name);
            if (primitive.isPresent()) {
                return primitive.get();
            }
            Optional<RegisterField> field = registerField(name, member);
            if (field.isPresent()) {
                return field.get().type();
            }
            Optional<Symbol.EnumSymbol> enumSymbol = symbolTable.resolveEnum(name);
            if (enumSymbol.isPresent() && symbolTable.resolve(name).filter(Symbol.VariableSymbol.class::isInstance).isEmpty()) {
                return enumSymbol.get().type();
            }
        }
        TypeInfo target = typeOf(access.target());
        if (target == null) {
            return null;
        }
        if (target.isStruct() || target.kind() == TypeKind.STRUCT && !target.isArray()) {
            TypeInfo field = fieldOf(target, member);
            if (field != null) {
                return field;
            }
        }
        if ("length".equals(member) || "capacity".equals(member)) {
            return BuiltinTypes.dslPrimitive("u32").orElseThrow();
        }
        return null;
    }

    /**
     * Looks up a struct field, resolving layouts that were recorded by name only.
     */
    public TypeInfo fieldOf(TypeInfo struct, String member) {
        TypeInfo field = struct.field(member);
        if (field == null && struct.structFields().isEmpty()) {
            field = symbolTable.resolveType(struct.baseType()).map(t -> t.field(member)).orElse(null);
        }
        if (field != null && field.kind() == TypeKind.STRUCT && field.structFields().isEmpty()) {
            TypeInfo layout = symbolTable.resolveType(field.baseType()).orElse(null);
            if (layout != null && !layout.structFields().isEmpty()) {
                return field.isArray() ? layout.withArrayDimensions(field.arrayDimensions()) : layout;
            }
        }
        return field;
    }

    /**
     * Resolves {@code Register.FIELD} when {@code Register} names a register block.
     */
    public Optional<RegisterField> registerField(String register, String field) {
        if (isLocal(register)) {
            return Optional.empty();
        }
        return registers.resolve(register).flatMap(binding -> binding.field(field));
    }
}
