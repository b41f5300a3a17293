package org.cnext.compiler.backend.codegen;

import org.cnext.compiler.backend.register.RegisterAccess;
import org.cnext.compiler.backend.register.RegisterField;
import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.parser.Parser;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;
import org.cnext.compiler.frontend.parser.ast.Statement;
import org.cnext.compiler.frontend.parser.ast.TypeRef;
import org.cnext.compiler.frontend.semantics.BuiltinTypes;
import org.cnext.compiler.frontend.semantics.TypeInfo;
import org.cnext.compiler.frontend.semantics.TypeKind;
import org.cnext.compiler.frontend.semantics.flow.NullSafetyRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Emits C for function bodies: local declarations, assignments and control flow.
 *
 * <p>Assignments are lowered according to their target. Register fields honor their access
 * mode, bit indexes on scalars become read-modify-write or plain writes, byte ranges of
 * arrays are copied with {@code memcpy}, and bounded strings are copied with
 * {@code strncpy} and always terminated.</p>
 */
public class StatementGenerator {

    private final TypeResolver types;
    private final ExpressionGenerator expressions;
    private final BitAccessGenerator bits;
    private final SwitchGenerator switches;
    private final ArithmeticChecker arithmetic;
    private final ConstantFolder folder;
    private final DiagnosticsEngine diagnostics;

    private TypeInfo returnType;
    private boolean inMain;

    public StatementGenerator(TypeResolver types, ExpressionGenerator expressions, BitAccessGenerator bits,
                              SwitchGenerator switches, ArithmeticChecker arithmetic, ConstantFolder folder,
                              DiagnosticsEngine diagnostics) {
        this.types = types;
        this.expressions = expressions;
        this.bits = bits;
        this.switches = switches;
        this.arithmetic = arithmetic;
        this.folder = folder;
        this.diagnostics = diagnostics;
    }

    /**
     * Emits the statements of a function body. The caller has already opened the function
     * and declared its parameters.
     */
    public void functionBody(Statement.Block body, TypeInfo returnType, boolean isMain, CodeWriter out) {
        this.returnType = returnType;
        this.inMain = isMain;
        blockStatements(body, out);
    }

    /**
     * Resolves a written type, reporting unknown names and non-constant dimensions.
     *
     * @return the type, or an opaque placeholder after an error.
     */
    public TypeInfo resolveType(TypeRef ref) {
        Optional<TypeInfo> resolved = types.resolve(ref);
        if (resolved.isPresent()) {
            return resolved.get();
        }
        SourcePosition position = ref.position();
        if (ref.isString() || types.resolve(ref.withArrayDimensions(List.of())).isPresent()) {
            report(DiagnosticCode.SYNTAX_ERROR, "Array dimensions of '" + ref.name() + "' must be positive constants",
                    position, null);
        } else if (expressions.isDeclaredLater(ref.name())) {
            report(DiagnosticCode.USE_BEFORE_DEFINITION, "Type '" + ref.name() + "' is used before its definition",
                    position, "Move the definition of '" + ref.name() + "' above its first use");
        } else {
            report(DiagnosticCode.UNDEFINED_IDENTIFIER, "Unknown type '" + ref.name() + "'", position, null);
        }
        return TypeInfo.scalar(ref.name(), TypeKind.OPAQUE, 0);
    }

    // === Blocks and control flow ===

    private void blockStatements(Statement.Block block, CodeWriter out) {
        types.pushScope();
        for (Statement statement : block.statements()) {
            statement(statement, out);
        }
        types.popScope();
    }

    private void statement(Statement statement, CodeWriter out) {
        if (statement instanceof Statement.Block block) {
            out.open("{");
            blockStatements(block, out);
            out.close("}");
        } else if (statement instanceof Statement.VariableDeclaration declaration) {
            declaration(declaration).forEach(line -> out.line(line + ";"));
        } else if (statement instanceof Statement.Assignment assignment) {
            assignment(assignment).forEach(line -> out.line(line + ";"));
        } else if (statement instanceof Statement.ExpressionStatement expression) {
            out.line(expressions.generate(expression.expression(), null) + ";");
        } else if (statement instanceof Statement.If ifStatement) {
            out.open("if (" + condition(ifStatement.condition()) + ") {");
            ifChain(ifStatement, out);
            out.close("}");
        } else if (statement instanceof Statement.While loop) {
            out.open("while (" + condition(loop.condition()) + ") {");
            blockStatements(loop.body(), out);
            out.close("}");
        } else if (statement instanceof Statement.DoWhile loop) {
            out.open("do {");
            blockStatements(loop.body(), out);
            out.close("} while (" + condition(loop.condition()) + ");");
        } else if (statement instanceof Statement.For loop) {
            forLoop(loop, out);
        } else if (statement instanceof Statement.Switch switchStatement) {
            switches.generate(switchStatement, out, body -> blockStatements(body, out));
        } else if (statement instanceof Statement.Return returnStatement) {
            out.line(returnStatement(returnStatement));
        }
    }

    private void ifChain(Statement.If ifStatement, CodeWriter out) {
        blockStatements(ifStatement.thenBranch(), out);
        Statement elseBranch = ifStatement.elseBranch();
        if (elseBranch instanceof Statement.If elseIf) {
            out.reopen("} else if (" + condition(elseIf.condition()) + ") {");
            ifChain(elseIf, out);
        } else if (elseBranch instanceof Statement.Block elseBlock) {
            out.reopen("} else {");
            blockStatements(elseBlock, out);
        } else if (elseBranch != null) {
            out.reopen("} else {");
            statement(elseBranch, out);
        }
    }

    private void forLoop(Statement.For loop, CodeWriter out) {
        types.pushScope();
        String init = loop.init() == null ? "" : String.join(", ", simpleStatement(loop.init()));
        String condition = loop.condition() == null ? "" : condition(loop.condition());
        String update = loop.update() == null ? "" : String.join(", ", simpleStatement(loop.update()));
        out.open("for (" + init + "; " + condition + "; " + update + ") {");
        blockStatements(loop.body(), out);
        out.close("}");
        types.popScope();
    }

    private List<String> simpleStatement(Statement statement) {
        if (statement instanceof Statement.VariableDeclaration declaration) {
            return declaration(declaration);
        }
        if (statement instanceof Statement.Assignment assignment) {
            return assignment(assignment);
        }
        if (statement instanceof Statement.ExpressionStatement expression) {
            return List.of(expressions.generate(expression.expression(), null));
        }
        report(DiagnosticCode.SYNTAX_ERROR, "Only declarations, assignments and calls are allowed in a for header",
                statement.position(), null);
        return List.of();
    }

    private String condition(Expression condition) {
        return expressions.generate(condition, null);
    }

    private String returnStatement(Statement.Return statement) {
        if (statement.value() == null) {
            return inMain ? "return 0;" : "return;";
        }
        return "return " + expressions.generateValue(statement.value(), returnType) + ";";
    }

    // === Declarations ===

    /**
     * Emits a local declaration, possibly followed by the statements that complete it.
     */
    List<String> declaration(Statement.VariableDeclaration declaration) {
        TypeInfo type = resolveType(declaration.type());
        String cType = types.cTypeName(declaration.type());
        String name = declaration.name();
        String qualifier = declaration.isConst() ? "const " : "";
        Expression initializer = declaration.initializer();
        List<String> lines = new ArrayList<>();
        folder.defineLocal(name, declaration.isConst() && initializer != null
                ? folder.fold(initializer) : OptionalLong.empty());

        if (NullSafetyRule.isNullableName(name)) {
            String pointer = type.kind() == TypeKind.POINTER ? cType : cType + "*";
            String value = initializer == null ? "NULL" : expressions.generate(initializer, null);
            types.declareLocal(new TypeResolver.LocalVariable(name, type, cType, TypeResolver.Storage.VALUE));
            lines.add(pointer + " " + name + " = " + value);
            return lines;
        }

        if (type.isString() && !type.isArray()) {
            String declarator = qualifier + "char " + name + TypeResolver.dimensionSuffix(type);
            if (initializer instanceof Expression.Literal literal && literal.kind() == Expression.LiteralKind.STRING) {
                checkStringLiteral(literal, type);
                lines.add(declarator + " = " + literal.text());
            } else if (initializer == null) {
                lines.add(declarator + " = \"\"");
            } else {
                String value = expressions.generate(initializer, null);
                lines.add(declarator + " = \"\"");
                lines.addAll(stringCopy(name, type, value));
            }
            types.declareLocal(new TypeResolver.LocalVariable(name, type, cType, TypeResolver.Storage.ARRAY));
            return lines;
        }

        String declarator = qualifier + cType + " " + name + TypeResolver.dimensionSuffix(type);
        if (type.isArray()) {
            if (initializer == null) {
                lines.add(declarator + " = {0}");
            } else if (initializer instanceof Expression.Call call && call.calleeName() != null
                    && call.calleeName().equals(Parser.ARRAY_INITIALIZER)) {
                lines.add(declarator + " = " + expressions.generate(initializer, type.elementType()));
            } else {
                String value = expressions.generate(initializer, null);
                lines.add(declarator + " = {0}");
                expressions.requireHeader("string.h");
                lines.add("memcpy(" + name + ", " + value + ", sizeof(" + name + "))");
            }
            types.declareLocal(new TypeResolver.LocalVariable(name, type, cType, TypeResolver.Storage.ARRAY));
            return lines;
        }

        if (type.isStruct()) {
            lines.add(declarator + " = " + (initializer == null ? "{0}" : expressions.generate(initializer, type)));
        } else if (initializer == null) {
            lines.add(declarator);
        } else {
            arithmetic.checkConversion(initializer, type, initializer.position());
            lines.add(declarator + " = " + expressions.generateValue(initializer, type));
        }
        types.declareLocal(new TypeResolver.LocalVariable(name, type, cType, TypeResolver.Storage.VALUE));
        return lines;
    }

    /**
     * Reports a string literal that does not fit the declared capacity.
     */
    void checkStringLiteral(Expression.Literal literal, TypeInfo type) {
        int length = unescapedLength(literal.text());
        if (length > type.stringCapacity()) {
            report(DiagnosticCode.LITERAL_OUT_OF_RANGE,
                    "String literal of length " + length + " exceeds the capacity " + type.stringCapacity(),
                    literal.position(), "Declare the string with a capacity of at least " + length);
        }
    }

    private static int unescapedLength(String quoted) {
        String body = quoted.length() >= 2 ? quoted.substring(1, quoted.length() - 1) : quoted;
        int length = 0;
        for (int i = 0; i < body.length(); i++) {
            if (body.charAt(i) == '\\') {
                i++;
            }
            length++;
        }
        return length;
    }

    // === Assignments ===

    /**
     * Lowers an assignment into one or more C statements, without trailing semicolons.
     */
    List<String> assignment(Statement.Assignment assignment) {
        Expression target = assignment.target();
        if (assignment.isCompound()) {
            arithmetic.checkOperation(assignment.binaryOperator(), target, assignment.value(), assignment.position());
        }
        if (target instanceof Expression.Index index) {
            TypeInfo baseType = types.typeOf(index.target());
            if (baseType != null && baseType.kind().isInteger() && !baseType.isArray()) {
                return List.of(bitWrite(assignment, index, baseType));
            }
            if (index.isRange()) {
                return List.of(sliceWrite(assignment, index, baseType));
            }
        }
        Optional<RegisterField> register = registerField(target);
        if (register.isPresent()) {
            return List.of(registerWrite(assignment, register.get()));
        }
        TypeInfo type = types.typeOf(target);
        if (type != null && type.isString() && !type.isArray()) {
            return stringAssignment(assignment, type);
        }

        String lhs = expressions.lvalue(target);
        if (type != null && type.isArray() && !assignment.isCompound()) {
            expressions.requireHeader("string.h");
            return List.of("memcpy(" + lhs + ", " + expressions.generate(assignment.value(), null)
                    + ", sizeof(" + lhs + "))");
        }
        if (!assignment.isCompound()) {
            arithmetic.checkConversion(assignment.value(), type, assignment.value().position());
        }
        String value = assignment.isCompound()
                ? expressions.generate(assignment.value(), type)
                : expressions.generateValue(assignment.value(), type);
        return List.of(lhs + " " + assignment.cOperator() + " " + value);
    }

    private Optional<RegisterField> registerField(Expression target) {
        if (target instanceof Expression.MemberAccess access && access.target() instanceof Expression.Identifier name) {
            return types.registerField(name.name(), access.member());
        }
        return Optional.empty();
    }

    private String registerWrite(Statement.Assignment assignment, RegisterField field) {
        String lhs = expressions.lvalue(assignment.target());
        RegisterAccess access = field.access();
        if (!access.isWritable()) {
            report(DiagnosticCode.WRITE_TO_READ_ONLY_REGISTER,
                    "Register field '" + lhs + "' is read-only", assignment.position(), null);
        } else if (assignment.isCompound() && !access.isReadable()) {
            report(DiagnosticCode.READ_OF_WRITE_ONLY_REGISTER,
                    "Compound assignment reads register field '" + lhs + "', which is " + access.keyword(),
                    assignment.position(), "Write the full value with '<-'");
        }
        String value = assignment.isCompound()
                ? expressions.generate(assignment.value(), field.type())
                : expressions.generateValue(assignment.value(), field.type());
        return lhs + " " + assignment.cOperator() + " " + value;
    }

    private String bitWrite(Statement.Assignment assignment, Expression.Index index, TypeInfo type) {
        String cType = types.cTypeName(type);
        String target = expressions.lvalue(index.target());
        String start = expressions.generate(index.index(), null);
        String width = index.isRange() ? expressions.generate(index.width(), null) : null;
        String value = expressions.generate(assignment.value(), null);
        if (assignment.isCompound()) {
            String current = bits.read(expressions.generate(index.target(), null), type, index, start, width);
            value = current + " " + assignment.binaryOperator() + " (" + value + ")";
        }

        Optional<RegisterField> register = registerField(index.target());
        if (register.isPresent()) {
            RegisterAccess access = register.get().access();
            if (!access.isWritable()) {
                report(DiagnosticCode.WRITE_TO_READ_ONLY_REGISTER,
                        "Register field '" + target + "' is read-only", assignment.position(), null);
                return target + " = " + target;
            }
            if (access.isWriteOneToAct() && index.isRange()) {
                report(DiagnosticCode.BIT_RANGE_WRITE_ON_W1,
                        "Bit range writes are not allowed on " + access.keyword() + " field '" + target + "'",
                        assignment.position(), "Write single bits or the full field");
            }
            if (!access.isReadable()) {
                if (isZero(assignment.value())) {
                    report(DiagnosticCode.CLEARING_WRITE_ON_WRITE_ONLY,
                            "Writing 0 to bits of " + access.keyword() + " field '" + target + "' has no effect",
                            assignment.position(), "Write 1 to the bits that should act");
                }
                return bits.plainWrite(target, type, cType, index, start, width, value);
            }
        }
        return bits.readModifyWrite(target, type, cType, index, start, width, value);
    }

    private boolean isZero(Expression value) {
        OptionalLong folded = folder.fold(value);
        return folded.isPresent() && folded.getAsLong() == 0;
    }

    private String sliceWrite(Statement.Assignment assignment, Expression.Index index, TypeInfo baseType) {
        String target = expressions.lvalue(index.target());
        OptionalLong offset = folder.fold(index.index());
        OptionalLong length = folder.fold(index.width());
        if (offset.isEmpty() || length.isEmpty()) {
            report(DiagnosticCode.SLICE_NOT_CONSTANT, "The offset and length of a range write must be constants",
                    index.position(), null);
        } else if (baseType != null && offset.getAsLong() + length.getAsLong() > baseType.capacityBytes()) {
            report(DiagnosticCode.SLICE_OUT_OF_BOUNDS,
                    "Range [" + offset.getAsLong() + ", " + length.getAsLong() + "] exceeds the "
                            + baseType.capacityBytes() + " byte(s) of '" + target + "'",
                    index.position(), null);
        }
        expressions.requireHeader("string.h");
        TypeInfo valueType = types.typeOf(assignment.value());
        String cType = valueType != null && valueType.kind().isScalar() && !valueType.isArray()
                ? types.cTypeName(valueType)
                : unsignedOfBytes(length);
        String source = expressions.addressOf(assignment.value(), valueType, cType);
        String count = length.isPresent() ? Long.toString(length.getAsLong()) : expressions.generate(index.width(), null);
        return "memcpy((uint8_t*)" + target + " + " + expressions.generate(index.index(), null) + ", "
                + source + ", " + count + ")";
    }

    private static String unsignedOfBytes(OptionalLong length) {
        long bytes = length.orElse(1);
        return BuiltinTypes.dslNameFor(TypeKind.UNSIGNED, (int) bytes * 8)
                .map(BuiltinTypes::toCName)
                .orElse("uint8_t");
    }

    private List<String> stringAssignment(Statement.Assignment assignment, TypeInfo type) {
        String target = expressions.lvalue(assignment.target());
        int capacity = type.stringCapacity();
        Expression value = assignment.value();
        if (value instanceof Expression.Literal literal && literal.kind() == Expression.LiteralKind.STRING
                && !assignment.isCompound()) {
            checkStringLiteral(literal, type);
        }
        String source = expressions.generate(value, null);
        expressions.requireHeader("string.h");
        if (!assignment.isCompound()) {
            return stringCopy(target, type, source);
        }
        if (!"+".equals(assignment.binaryOperator())) {
            report(DiagnosticCode.SYNTAX_ERROR, "Strings only support '<-' and '+<-'", assignment.position(), null);
        }
        return List.of("strncat(" + target + ", " + source + ", " + capacity + " - strlen(" + target + "))");
    }

    private List<String> stringCopy(String target, TypeInfo type, String source) {
        expressions.requireHeader("string.h");
        int capacity = type.stringCapacity();
        return List.of("strncpy(" + target + ", " + source + ", " + capacity + ")",
                target + "[" + capacity + "] = '\\0'");
    }

    private void report(DiagnosticCode code, String message, SourcePosition position, String suggestion) {
        diagnostics.reportError(code, message, position.fileName(), position.line(), position.column(), suggestion);
    }
}
