package org.cnext.compiler.frontend.semantics.scope;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.parser.ast.Declaration;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.Program;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;
import org.cnext.compiler.frontend.parser.ast.Statement;
import org.cnext.compiler.frontend.parser.ast.TypeRef;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites scopes into flat, prefixed top-level declarations before any lookup happens.
 * Inside scope {@code S}, {@code this.m} becomes {@code S_m}; anywhere, {@code S.m} becomes
 * {@code S_m} and {@code global.x} becomes {@code x}. Scope members keep their scope name and
 * visibility so that private members can be emitted {@code static}.
 *
 * <p>Qualification is mandatory: a bare reference to a member of the enclosing scope is
 * rejected, as is access to a private member from outside its scope.</p>
 */
public class ScopeFlattener {

    private static final String THIS = "this";
    private static final String GLOBAL = "global";

    private final ScopeRegistry registry;
    private final DiagnosticsEngine diagnostics;

    private String currentScope;
    private Set<String> locals = new HashSet<>();

    public ScopeFlattener(ScopeRegistry registry, DiagnosticsEngine diagnostics) {
        this.registry = registry;
        this.diagnostics = diagnostics;
    }

    /**
     * Registers the scopes of a program and returns the flattened program.
     * @param program The parsed program.
     * @return A program without {@link Declaration.ScopeDecl} nodes.
     */
    public Program flatten(Program program) {
        for (Declaration declaration : program.declarations()) {
            if (declaration instanceof Declaration.ScopeDecl scope) {
                registry.register(scope);
            }
        }
        List<Declaration> flat = new ArrayList<>();
        for (Declaration declaration : program.declarations()) {
            if (declaration instanceof Declaration.ScopeDecl scope) {
                currentScope = scope.name();
                for (Declaration member : scope.members()) {
                    flat.add(rewriteMember(member, scope.name()));
                }
                currentScope = null;
            } else {
                flat.add(rewriteMember(declaration, null));
            }
        }
        return new Program(program.fileName(), flat);
    }

    private Declaration rewriteMember(Declaration declaration, String scope) {
        if (declaration instanceof Declaration.FunctionDecl function) {
            locals = new HashSet<>();
            for (Declaration.Parameter parameter : function.parameters()) {
                locals.add(parameter.name());
            }
            collectLocals(function.body(), locals);
            List<Declaration.Parameter> parameters = new ArrayList<>();
            for (Declaration.Parameter p : function.parameters()) {
                parameters.add(new Declaration.Parameter(type(p.type()), p.name(), p.isConst(), p.position()));
            }
            String name = scope == null ? function.name() : ScopeRegistry.flatName(scope, function.name());
            Declaration.FunctionDecl rewritten = new Declaration.FunctionDecl(type(function.returnType()), name,
                    parameters, block(function.body()), function.isPublic(), function.scopeName(),
                    function.position());
            locals = new HashSet<>();
            return rewritten;
        }
        if (declaration instanceof Declaration.VariableDecl variable) {
            Statement.VariableDeclaration v = variable.variable();
            String name = scope == null ? v.name() : ScopeRegistry.flatName(scope, v.name());
            Statement.VariableDeclaration rewritten = new Statement.VariableDeclaration(type(v.type()), name,
                    expression(v.initializer()), v.isConst(), v.position());
            return new Declaration.VariableDecl(rewritten, variable.isPublic(), variable.scopeName());
        }
        if (declaration instanceof Declaration.StructDecl struct) {
            List<Declaration.Field> fields = new ArrayList<>();
            for (Declaration.Field field : struct.fields()) {
                fields.add(new Declaration.Field(type(field.type()), field.name(), field.position()));
            }
            return new Declaration.StructDecl(struct.name(), fields, struct.position());
        }
        if (declaration instanceof Declaration.EnumDecl enumDecl) {
            List<Declaration.EnumMember> members = new ArrayList<>();
            for (Declaration.EnumMember member : enumDecl.members()) {
                members.add(new Declaration.EnumMember(member.name(), expression(member.value()), member.position()));
            }
            return new Declaration.EnumDecl(enumDecl.name(), members, enumDecl.position());
        }
        if (declaration instanceof Declaration.RegisterDecl register) {
            List<Declaration.RegisterMember> members = new ArrayList<>();
            for (Declaration.RegisterMember member : register.members()) {
                members.add(new Declaration.RegisterMember(member.name(), member.type(), member.access(),
                        expression(member.offset()), member.position()));
            }
            return new Declaration.RegisterDecl(register.name(), expression(register.baseAddress()), members,
                    register.position());
        }
        return declaration;
    }

    private static void collectLocals(Statement statement, Set<String> names) {
        if (statement == null) {
            return;
        }
        if (statement instanceof Statement.VariableDeclaration declaration) {
            names.add(declaration.name());
            return;
        }
        statement.getChildren().forEach(child -> {
            if (child instanceof Statement s) {
                collectLocals(s, names);
            } else if (child instanceof Statement.SwitchCase c) {
                collectLocals(c.body(), names);
            } else if (child instanceof Statement.DefaultCase d) {
                collectLocals(d.body(), names);
            }
        });
    }

    // === Statements ===

    private Statement.Block block(Statement.Block block) {
        List<Statement> statements = new ArrayList<>();
        for (Statement statement : block.statements()) {
            statements.add(statement(statement));
        }
        return new Statement.Block(statements, block.position());
    }

    private Statement statement(Statement statement) {
        if (statement == null) {
            return null;
        }
        if (statement instanceof Statement.Block b) {
            return block(b);
        }
        if (statement instanceof Statement.VariableDeclaration v) {
            return new Statement.VariableDeclaration(type(v.type()), v.name(), expression(v.initializer()),
                    v.isConst(), v.position());
        }
        if (statement instanceof Statement.Assignment a) {
            return new Statement.Assignment(expression(a.target()), a.operator(), expression(a.value()), a.position());
        }
        if (statement instanceof Statement.ExpressionStatement e) {
            return new Statement.ExpressionStatement(expression(e.expression()), e.position());
        }
        if (statement instanceof Statement.If i) {
            return new Statement.If(expression(i.condition()), block(i.thenBranch()), statement(i.elseBranch()),
                    i.position());
        }
        if (statement instanceof Statement.While w) {
            return new Statement.While(expression(w.condition()), block(w.body()), w.position());
        }
        if (statement instanceof Statement.DoWhile d) {
            return new Statement.DoWhile(block(d.body()), expression(d.condition()), d.position());
        }
        if (statement instanceof Statement.For f) {
            return new Statement.For(statement(f.init()), expression(f.condition()), statement(f.update()),
                    block(f.body()), f.position());
        }
        if (statement instanceof Statement.Switch s) {
            List<Statement.SwitchCase> cases = new ArrayList<>();
            for (Statement.SwitchCase c : s.cases()) {
                List<Expression> labels = new ArrayList<>();
                for (Expression label : c.labels()) {
                    labels.add(expression(label));
                }
                cases.add(new Statement.SwitchCase(labels, block(c.body()), c.position()));
            }
            Statement.DefaultCase defaultCase = s.defaultCase() == null ? null
                    : new Statement.DefaultCase(s.defaultCase().count(), block(s.defaultCase().body()),
                    s.defaultCase().position());
            return new Statement.Switch(expression(s.subject()), cases, defaultCase, s.position());
        }
        if (statement instanceof Statement.Return r) {
            return new Statement.Return(expression(r.value()), r.position());
        }
        return statement;
    }

    private TypeRef type(TypeRef type) {
        if (type == null || !type.isArray()) {
            return type;
        }
        List<Expression> dimensions = new ArrayList<>();
        for (Expression dimension : type.arrayDimensions()) {
            dimensions.add(expression(dimension));
        }
        return type.withArrayDimensions(dimensions);
    }

    // === Expressions ===

    private Expression expression(Expression expression) {
        if (expression == null) {
            return null;
        }
        if (expression instanceof Expression.Identifier identifier) {
            return identifier(identifier);
        }
        if (expression instanceof Expression.MemberAccess access) {
            return memberAccess(access);
        }
        if (expression instanceof Expression.Unary u) {
            return new Expression.Unary(u.operator(), expression(u.operand()), u.position());
        }
        if (expression instanceof Expression.Binary b) {
            return new Expression.Binary(b.operator(), expression(b.left()), expression(b.right()), b.position());
        }
        if (expression instanceof Expression.Ternary t) {
            return new Expression.Ternary(expression(t.condition()), expression(t.thenValue()),
                    expression(t.elseValue()), t.position());
        }
        if (expression instanceof Expression.Call c) {
            List<Expression> arguments = new ArrayList<>();
            for (Expression argument : c.arguments()) {
                arguments.add(expression(argument));
            }
            return new Expression.Call(expression(c.callee()), arguments, c.position());
        }
        if (expression instanceof Expression.Index i) {
            return new Expression.Index(expression(i.target()), expression(i.index()), expression(i.width()),
                    i.position());
        }
        if (expression instanceof Expression.Cast c) {
            return new Expression.Cast(c.type(), expression(c.operand()), c.position());
        }
        return expression;
    }

    private Expression identifier(Expression.Identifier identifier) {
        String name = identifier.name();
        if (THIS.equals(name) || GLOBAL.equals(name)) {
            report(DiagnosticCode.UNDEFINED_IDENTIFIER, "'" + name + "' must be followed by a member name",
                    identifier.position(), null);
            return identifier;
        }
        if (currentScope != null && !locals.contains(name) && registry.member(currentScope, name).isPresent()) {
            report(DiagnosticCode.UNQUALIFIED_SCOPE_MEMBER,
                    "Scope member '" + name + "' must be qualified inside scope '" + currentScope + "'",
                    identifier.position(), "Use 'this." + name + "'");
            return new Expression.Identifier(ScopeRegistry.flatName(currentScope, name), identifier.position());
        }
        return identifier;
    }

    private Expression memberAccess(Expression.MemberAccess access) {
        if (access.target() instanceof Expression.Identifier target) {
            String qualifier = target.name();
            if (GLOBAL.equals(qualifier)) {
                return new Expression.Identifier(access.member(), access.position());
            }
            if (THIS.equals(qualifier)) {
                if (currentScope == null) {
                    report(DiagnosticCode.UNDEFINED_IDENTIFIER, "'this' is only valid inside a scope",
                            target.position(), "Use 'global." + access.member() + "' or the plain name");
                    return new Expression.Identifier(access.member(), access.position());
                }
                return scopeMember(currentScope, access);
            }
            if (!locals.contains(qualifier) && registry.isScope(qualifier)) {
                return scopeMember(qualifier, access);
            }
        }
        return new Expression.MemberAccess(expression(access.target()), access.member(), access.position());
    }

    private Expression scopeMember(String scope, Expression.MemberAccess access) {
        Optional<ScopeRegistry.ScopeMember> member = registry.member(scope, access.member());
        if (member.isEmpty()) {
            report(DiagnosticCode.UNKNOWN_MEMBER, "Scope '" + scope + "' has no member '" + access.member() + "'",
                    access.position(), null);
        } else if (!member.get().isPublic() && !scope.equals(currentScope)) {
            report(DiagnosticCode.PRIVATE_MEMBER_ACCESS,
                    "'" + scope + "." + access.member() + "' is private to scope '" + scope + "'",
                    access.position(), "Mark the member 'public' to use it outside its scope");
        }
        return new Expression.Identifier(ScopeRegistry.flatName(scope, access.member()), access.position());
    }

    private void report(DiagnosticCode code, String message, SourcePosition position, String suggestion) {
        diagnostics.reportError(code, message, position.fileName(), position.line(), position.column(), suggestion);
    }
}
