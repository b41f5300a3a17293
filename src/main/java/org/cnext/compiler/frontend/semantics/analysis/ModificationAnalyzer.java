package org.cnext.compiler.frontend.semantics.analysis;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.parser.ast.AstNode;
import org.cnext.compiler.frontend.parser.ast.Declaration;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.Program;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;
import org.cnext.compiler.frontend.parser.ast.Statement;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides the const qualifier of every parameter and enforces explicit {@code const}.
 *
 * <p>A parameter is mutated if it is the root of an assignment target (directly, or through
 * an element, member or bit access), or if it is passed to a parameter of a callee that is
 * itself recorded as mutated. Functions are analyzed in file order and their decisions are
 * recorded in the {@link FunctionSignatureRegistry} before the next function is looked at,
 * so propagation only sees callees defined earlier. A self-recursive call does not see the
 * function's own decisions.</p>
 */
public class ModificationAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ModificationAnalyzer.class);

    private final FunctionSignatureRegistry signatures;
    private final SymbolTable symbolTable;
    private final DiagnosticsEngine diagnostics;
    private final Set<String> constGlobals = new HashSet<>();

    public ModificationAnalyzer(FunctionSignatureRegistry signatures, SymbolTable symbolTable,
                                DiagnosticsEngine diagnostics) {
        this.signatures = signatures;
        this.symbolTable = symbolTable;
        this.diagnostics = diagnostics;
    }

    /**
     * Analyzes every function of a flattened program in file order.
     */
    public void analyze(Program program) {
        for (Declaration declaration : program.declarations()) {
            if (declaration instanceof Declaration.VariableDecl variable && variable.variable().isConst()) {
                constGlobals.add(variable.name());
            }
        }
        for (Declaration declaration : program.declarations()) {
            if (declaration instanceof Declaration.FunctionDecl function) {
                analyzeFunction(function);
            }
        }
    }

    /**
     * Analyzes one function and records its parameter modes. Const globals are looked up in
     * the symbol table, so every global the function refers to must already be defined there.
     */
    public void analyzeFunction(Declaration.FunctionDecl function) {
        FunctionScope scope = new FunctionScope(function);
        visit(function.body(), scope);

        List<FunctionSignatureRegistry.ParameterMode> modes = new ArrayList<>();
        for (Declaration.Parameter parameter : function.parameters()) {
            boolean mutated = !parameter.isConst() && scope.mutated.contains(parameter.name());
            modes.add(new FunctionSignatureRegistry.ParameterMode(parameter.name(), parameter.isConst(), mutated));
        }
        signatures.record(function.name(), modes);
        log.debug("Parameter modes of {}: {}", function.name(), modes);
    }

    private void visit(AstNode node, FunctionScope scope) {
        // A for header declares into the loop's own scope.
        boolean opensScope = node instanceof Statement.Block || node instanceof Statement.For;
        if (opensScope) {
            scope.locals.push(new HashMap<>());
        }
        try {
            check(node, scope);
            for (AstNode child : node.getChildren()) {
                if (child != null) {
                    visit(child, scope);
                }
            }
        } finally {
            if (opensScope) {
                scope.locals.pop();
            }
        }
    }

    private void check(AstNode node, FunctionScope scope) {
        if (node instanceof Statement.VariableDeclaration declaration) {
            scope.locals.peek().put(declaration.name(), declaration.isConst());
        } else if (node instanceof Statement.Assignment assignment) {
            String root = Expression.rootName(assignment.target());
            if (root != null) {
                if (scope.isConst(root)) {
                    report(DiagnosticCode.ASSIGNMENT_TO_CONST, "Cannot assign to const '" + root + "'",
                            assignment.position(), "Remove 'const' from the declaration of '" + root + "'");
                } else if (scope.isParameter(root)) {
                    scope.mutated.add(root);
                }
            }
        } else if (node instanceof Expression.Call call && call.calleeName() != null) {
            for (int i = 0; i < call.arguments().size(); i++) {
                Expression argument = call.arguments().get(i);
                if (!signatures.isParameterMutated(call.calleeName(), i) || !isLvalue(argument)) {
                    continue;
                }
                String root = Expression.rootName(argument);
                if (scope.isConst(root)) {
                    report(DiagnosticCode.CONST_PASSED_AS_MUTABLE,
                            "Const '" + root + "' is passed to '" + call.calleeName()
                                    + "', which modifies parameter " + (i + 1),
                            argument.position(), "Pass a mutable copy of '" + root + "'");
                } else if (scope.isParameter(root)) {
                    scope.mutated.add(root);
                }
            }
        }
    }

    private static boolean isLvalue(Expression expression) {
        return expression instanceof Expression.Identifier
                || expression instanceof Expression.MemberAccess
                || expression instanceof Expression.Index;
    }

    private void report(DiagnosticCode code, String message, SourcePosition position, String suggestion) {
        diagnostics.reportError(code, message, position.fileName(), position.line(), position.column(), suggestion);
    }

    private final class FunctionScope {
        final Set<String> parameters = new HashSet<>();
        final Set<String> constParameters = new HashSet<>();
        // Innermost block first; each map holds the const-ness of the locals declared so far.
        final Deque<Map<String, Boolean>> locals = new ArrayDeque<>();
        final Set<String> mutated = new HashSet<>();

        FunctionScope(Declaration.FunctionDecl function) {
            for (Declaration.Parameter parameter : function.parameters()) {
                parameters.add(parameter.name());
                if (parameter.isConst()) {
                    constParameters.add(parameter.name());
                }
            }
        }

        boolean isParameter(String name) {
            return parameters.contains(name) && locals.stream().noneMatch(block -> block.containsKey(name));
        }

        boolean isConst(String name) {
            if (name == null) {
                return false;
            }
            for (Map<String, Boolean> block : locals) {
                Boolean local = block.get(name);
                if (local != null) {
                    return local;
                }
            }
            if (parameters.contains(name)) {
                return constParameters.contains(name);
            }
            if (constGlobals.contains(name)) {
                return true;
            }
            return symbolTable.resolve(name)
                    .filter(Symbol.VariableSymbol.class::isInstance)
                    .map(s -> s.type().isConst())
                    .orElse(false);
        }
    }
}
