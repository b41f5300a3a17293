package org.cnext.compiler.backend.codegen;

import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.semantics.BuiltinTypes;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.SymbolTable;
import org.cnext.compiler.frontend.semantics.TypeInfo;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Evaluates integer constant expressions at generation time: literals, C-Next constants
 * with a constant initializer, foreign macro constants, enum variants and the type bounds
 * {@code T.MIN} and {@code T.MAX}.
 *
 * <p>Locals of the function being generated hide constants of the same name. A local
 * {@code const} with a constant initializer folds like a global one.</p>
 */
public class ConstantFolder {

    private final SymbolTable symbolTable;
    private final Map<String, Long> constants = new HashMap<>();
    // A null value marks a local that does not fold.
    private final Map<String, Long> locals = new HashMap<>();

    public ConstantFolder(SymbolTable symbolTable) {
        this.symbolTable = symbolTable;
    }

    /**
     * Records the value of a C-Next constant.
     */
    public void define(String name, long value) {
        constants.put(name, value);
    }

    /**
     * Forgets the locals of the previous function.
     */
    public void beginFunction() {
        locals.clear();
    }

    /**
     * Records a parameter or local of the current function. A name declared again in the same
     * function with a different value no longer folds.
     *
     * @param value The value of a constant local, or empty for anything else.
     */
    public void defineLocal(String name, OptionalLong value) {
        Long folded = value.isPresent() ? value.getAsLong() : null;
        if (locals.containsKey(name) && !Objects.equals(locals.get(name), folded)) {
            locals.put(name, null);
        } else {
            locals.put(name, folded);
        }
    }

    public OptionalLong fold(Expression expression) {
        if (expression instanceof Expression.Literal literal) {
            if (literal.kind() == Expression.LiteralKind.INTEGER) {
                return IntegerLiteral.parse(literal.text())
                        .filter(l -> l.magnitude().bitLength() < 64)
                        .map(l -> OptionalLong.of(l.magnitude().longValue()))
                        .orElse(OptionalLong.empty());
            }
            if (literal.kind() == Expression.LiteralKind.BOOLEAN) {
                return OptionalLong.of("true".equals(literal.text()) ? 1 : 0);
            }
            if (literal.kind() == Expression.LiteralKind.CHAR && literal.text().length() == 3) {
                return OptionalLong.of(literal.text().charAt(1));
            }
            return OptionalLong.empty();
        }
        if (expression instanceof Expression.Identifier identifier) {
            return identifier(identifier.name());
        }
        if (expression instanceof Expression.MemberAccess access
                && access.target() instanceof Expression.Identifier type) {
            return member(type.name(), access.member());
        }
        if (expression instanceof Expression.Cast cast) {
            return fold(cast.operand());
        }
        if (expression instanceof Expression.Unary unary) {
            OptionalLong operand = fold(unary.operand());
            if (operand.isEmpty()) {
                return operand;
            }
            switch (unary.operator()) {
                case "-":
                    return OptionalLong.of(-operand.getAsLong());
                case "~":
                    return OptionalLong.of(~operand.getAsLong());
                case "!":
                    return OptionalLong.of(operand.getAsLong() == 0 ? 1 : 0);
                default:
                    return OptionalLong.empty();
            }
        }
        if (expression instanceof Expression.Binary binary) {
            OptionalLong left = fold(binary.left());
            OptionalLong right = fold(binary.right());
            if (left.isEmpty() || right.isEmpty()) {
                return OptionalLong.empty();
            }
            return binary(binary.operator(), left.getAsLong(), right.getAsLong());
        }
        return OptionalLong.empty();
    }

    private OptionalLong identifier(String name) {
        if (locals.containsKey(name)) {
            Long local = locals.get(name);
            return local == null ? OptionalLong.empty() : OptionalLong.of(local);
        }
        Long value = constants.get(name);
        if (value != null) {
            return OptionalLong.of(value);
        }
        Optional<Symbol> symbol = symbolTable.resolve(name);
        if (symbol.isPresent() && symbol.get() instanceof Symbol.MacroConstantSymbol macro) {
            String text = macro.value().replaceAll("^\\(+|\\)+$", "").trim();
            boolean negative = text.startsWith("-");
            return IntegerLiteral.parse(negative ? text.substring(1).trim() : text)
                    .filter(l -> l.magnitude().bitLength() < 64)
                    .map(l -> OptionalLong.of(negative ? -l.magnitude().longValue() : l.magnitude().longValue()))
                    .orElse(OptionalLong.empty());
        }
        return symbolTable.resolveEnumMemberOwner(name)
                .map(owner -> OptionalLong.of(owner.members().get(name)))
                .orElse(OptionalLong.empty());
    }

    private OptionalLong member(String typeName, String member) {
        Optional<TypeInfo> primitive = BuiltinTypes.dslPrimitive(typeName);
        if (primitive.isPresent() && primitive.get().kind().isInteger()) {
            if ("MIN".equals(member)) {
                return OptionalLong.of(primitive.get().minValue());
            }
            if ("MAX".equals(member)) {
                return OptionalLong.of(primitive.get().maxValue());
            }
        }
        return symbolTable.resolveEnum(typeName)
                .filter(e -> e.members().containsKey(member))
                .map(e -> OptionalLong.of(e.members().get(member)))
                .orElse(OptionalLong.empty());
    }

    private static OptionalLong binary(String operator, long a, long b) {
        switch (operator) {
            case "+":
                return OptionalLong.of(a + b);
            case "-":
                return OptionalLong.of(a - b);
            case "*":
                return OptionalLong.of(a * b);
            case "/":
                return b == 0 ? OptionalLong.empty() : OptionalLong.of(a / b);
            case "%":
                return b == 0 ? OptionalLong.empty() : OptionalLong.of(a % b);
            case "<<":
                return OptionalLong.of(a << b);
            case ">>":
                return OptionalLong.of(a >> b);
            case "&":
                return OptionalLong.of(a & b);
            case "|":
                return OptionalLong.of(a | b);
            case "^":
                return OptionalLong.of(a ^ b);
            default:
                return OptionalLong.empty();
        }
    }
}
