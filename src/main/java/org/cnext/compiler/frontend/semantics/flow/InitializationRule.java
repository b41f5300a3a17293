package org.cnext.compiler.frontend.semantics.flow;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.parser.ast.Declaration;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.Statement;
import org.cnext.compiler.frontend.semantics.analysis.FunctionSignatureRegistry;

import java.util.HashSet;
import java.util.Set;

/**
 * Definite initialization: a local may only be read once every path from its declaration
 * has written it. Writing an element, member or bit of a local initializes the whole local,
 * and so does passing it to a parameter the callee writes through.
 */
public class InitializationRule implements IFlowRule {

    private final FunctionSignatureRegistry signatures;
    private final DiagnosticsEngine diagnostics;
    private final Set<String> reported = new HashSet<>();
    private boolean reporting = true;

    public InitializationRule(FunctionSignatureRegistry signatures, DiagnosticsEngine diagnostics) {
        this.signatures = signatures;
        this.diagnostics = diagnostics;
    }

    @Override
    public void enterFunction(Declaration.FunctionDecl function, FlowState state) {
        reported.clear();
    }

    @Override
    public void setReporting(boolean enabled) {
        this.reporting = enabled;
    }

    @Override
    public void declare(Statement.VariableDeclaration declaration, FlowState state) {
        if (declaration.initializer() != null) {
            read(declaration.initializer(), state);
            state.setInitState(declaration.name(), InitState.INITIALIZED);
        } else {
            state.setInitState(declaration.name(), InitState.UNINITIALIZED);
        }
    }

    @Override
    public void assign(Statement.Assignment assignment, FlowState state) {
        read(assignment.value(), state);
        Expression target = assignment.target();
        if (assignment.isCompound()) {
            read(target, state);
        } else {
            readSubscripts(target, state);
        }
        String root = Expression.rootName(target);
        if (root != null) {
            state.markInitialized(root);
        }
    }

    @Override
    public void evaluate(Expression expression, FlowState state) {
        read(expression, state);
    }

    private void read(Expression expression, FlowState state) {
        if (expression == null) {
            return;
        }
        if (expression instanceof Expression.Identifier identifier) {
            check(identifier, state);
        } else if (expression instanceof Expression.Call call) {
            for (int i = 0; i < call.arguments().size(); i++) {
                Expression argument = call.arguments().get(i);
                String root = Expression.rootName(argument);
                if (call.calleeName() != null && root != null
                        && signatures.isParameterMutated(call.calleeName(), i)) {
                    // Out-parameter: the callee writes it.
                    readSubscripts(argument, state);
                    state.markInitialized(root);
                } else {
                    read(argument, state);
                }
            }
        } else if (expression instanceof Expression.MemberAccess access) {
            if (!isSizeProperty(access.member())) {
                read(access.target(), state);
            }
        } else {
            expression.getChildren().forEach(child -> {
                if (child instanceof Expression e) {
                    read(e, state);
                }
            });
        }
    }

    // Reads the index expressions of an lvalue without reading the lvalue itself.
    private void readSubscripts(Expression target, FlowState state) {
        if (target instanceof Expression.Index index) {
            readSubscripts(index.target(), state);
            read(index.index(), state);
            read(index.width(), state);
        } else if (target instanceof Expression.MemberAccess access) {
            readSubscripts(access.target(), state);
        }
    }

    private void check(Expression.Identifier identifier, FlowState state) {
        String name = identifier.name();
        InitState init = state.initState(name);
        if (init == InitState.INITIALIZED || !reporting || !reported.add(name)) {
            return;
        }
        String message = init == InitState.UNINITIALIZED
                ? "Variable '" + name + "' is used before it is initialized"
                : "Variable '" + name + "' may be used before it is initialized on every path";
        diagnostics.reportError(DiagnosticCode.USE_BEFORE_INIT, message, identifier.position().fileName(),
                identifier.position().line(), identifier.position().column(),
                "Assign '" + name + "' on every path before reading it, or give it an initializer");
    }

    private static boolean isSizeProperty(String member) {
        return "length".equals(member) || "capacity".equals(member);
    }
}
