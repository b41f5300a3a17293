package org.cnext.compiler;

import org.cnext.compiler.backend.codegen.ConstantFolder;
import org.cnext.compiler.backend.register.RegisterRegistry;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.semantics.SymbolTable;
import org.cnext.compiler.frontend.semantics.analysis.FunctionSignatureRegistry;
import org.cnext.compiler.frontend.semantics.scope.ScopeRegistry;

/**
 * The state shared by every phase and unit of one compilation run.
 */
public class CompilationContext {

    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable;
    private final ScopeRegistry scopes = new ScopeRegistry();
    private final FunctionSignatureRegistry signatures = new FunctionSignatureRegistry();
    private final RegisterRegistry registers = new RegisterRegistry();
    private final ConstantFolder constants;

    public CompilationContext(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.symbolTable = new SymbolTable(diagnostics);
        this.constants = new ConstantFolder(symbolTable);
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    public ScopeRegistry getScopes() {
        return scopes;
    }

    public FunctionSignatureRegistry getSignatures() {
        return signatures;
    }

    public RegisterRegistry getRegisters() {
        return registers;
    }

    public ConstantFolder getConstants() {
        return constants;
    }
}
