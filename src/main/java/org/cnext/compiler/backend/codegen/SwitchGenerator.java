package org.cnext.compiler.backend.codegen;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;
import org.cnext.compiler.frontend.parser.ast.Statement;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.SymbolTable;
import org.cnext.compiler.frontend.semantics.TypeInfo;
import org.cnext.compiler.frontend.semantics.TypeKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Checks and emits switch statements.
 *
 * <p>A switch over an enum must account for every variant: either one case per variant and
 * no default, or explicit cases plus {@code default(n)} where {@code n} is the number of
 * variants left over. Cases never fall through: every case gets its own block ending in
 * {@code break}, and a default branch is always emitted.</p>
 */
public class SwitchGenerator {

    private final SymbolTable symbolTable;
    private final TypeResolver types;
    private final ExpressionGenerator expressions;
    private final ConstantFolder folder;
    private final DiagnosticsEngine diagnostics;

    public SwitchGenerator(SymbolTable symbolTable, TypeResolver types, ExpressionGenerator expressions,
                           ConstantFolder folder, DiagnosticsEngine diagnostics) {
        this.symbolTable = symbolTable;
        this.types = types;
        this.expressions = expressions;
        this.folder = folder;
        this.diagnostics = diagnostics;
    }

    /**
     * Emits a switch.
     *
     * @param body Emits the statements of one case block into {@code out}.
     */
    public void generate(Statement.Switch statement, CodeWriter out, Consumer<Statement.Block> body) {
        TypeInfo subjectType = types.typeOf(statement.subject());
        Optional<Symbol.EnumSymbol> enumSymbol = subjectType != null && subjectType.kind() == TypeKind.ENUM
                && !subjectType.isArray()
                ? symbolTable.resolveEnum(subjectType.baseType())
                : Optional.empty();

        check(statement, enumSymbol);

        out.open("switch (" + expressions.generate(statement.subject(), null) + ") {");
        for (Statement.SwitchCase switchCase : statement.cases()) {
            List<Expression> labels = switchCase.labels();
            for (int i = 0; i < labels.size() - 1; i++) {
                out.line("case " + expressions.generate(labels.get(i), subjectType) + ":");
            }
            out.open("case " + expressions.generate(labels.get(labels.size() - 1), subjectType) + ": {");
            body.accept(switchCase.body());
            out.line("break;");
            out.close("}");
        }
        out.open("default: {");
        if (statement.defaultCase() != null) {
            body.accept(statement.defaultCase().body());
        }
        out.line("break;");
        out.close("}");
        out.close("}");
    }

    private void check(Statement.Switch statement, Optional<Symbol.EnumSymbol> enumSymbol) {
        Set<String> seen = new HashSet<>();
        Set<String> covered = new LinkedHashSet<>();
        for (Statement.SwitchCase switchCase : statement.cases()) {
            for (Expression label : switchCase.labels()) {
                String key = enumSymbol.map(e -> variantOf(label, e)).orElseGet(() -> constantKey(label));
                if (!seen.add(key)) {
                    report(DiagnosticCode.DUPLICATE_CASE, "Duplicate case '" + key + "'", label.position(), null);
                }
                covered.add(key);
            }
        }

        Statement.DefaultCase defaultCase = statement.defaultCase();
        if (enumSymbol.isEmpty()) {
            if (defaultCase != null && defaultCase.count() != null) {
                report(DiagnosticCode.DEFAULT_COUNT_ON_NON_ENUM,
                        "default(" + defaultCase.count() + ") is only valid when switching on an enum",
                        defaultCase.position(), "Use a plain 'default'");
            }
            return;
        }

        Symbol.EnumSymbol enumType = enumSymbol.get();
        List<String> missing = new ArrayList<>();
        for (String variant : enumType.members().keySet()) {
            if (!covered.contains(variant)) {
                missing.add(variant);
            }
        }
        if (defaultCase == null) {
            if (!missing.isEmpty()) {
                report(DiagnosticCode.NON_EXHAUSTIVE_SWITCH,
                        "Switch on '" + enumType.name() + "' does not handle " + String.join(", ", missing),
                        statement.position(), "Add the missing cases or a 'default(" + missing.size() + ")'");
            }
        } else if (defaultCase.count() == null) {
            report(DiagnosticCode.DEFAULT_COUNT_REQUIRED,
                    "A default on an enum switch must state how many variants it covers",
                    defaultCase.position(), "Use 'default(" + missing.size() + ")'");
        } else if (defaultCase.count() != missing.size()) {
            report(DiagnosticCode.DEFAULT_COUNT_MISMATCH,
                    "default(" + defaultCase.count() + ") does not match the " + missing.size()
                            + " variant(s) of '" + enumType.name() + "' without a case",
                    defaultCase.position(), "Use 'default(" + missing.size() + ")'");
        }
    }

    private String variantOf(Expression label, Symbol.EnumSymbol enumType) {
        if (label instanceof Expression.MemberAccess access
                && access.target() instanceof Expression.Identifier type
                && type.name().equals(enumType.name())) {
            return access.member();
        }
        if (label instanceof Expression.Identifier identifier && enumType.members().containsKey(identifier.name())) {
            return identifier.name();
        }
        report(DiagnosticCode.UNKNOWN_MEMBER, "Case label is not a variant of '" + enumType.name() + "'",
                label.position(), null);
        return expressions.generate(label, null);
    }

    private String constantKey(Expression label) {
        OptionalLong value = folder.fold(label);
        if (value.isPresent()) {
            return Long.toString(value.getAsLong());
        }
        return label instanceof Expression.Literal literal ? literal.text() : expressions.generate(label, null);
    }

    private void report(DiagnosticCode code, String message, SourcePosition position, String suggestion) {
        diagnostics.reportError(code, message, position.fileName(), position.line(), position.column(), suggestion);
    }
}
