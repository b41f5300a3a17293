package org.cnext.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A top-level or scope-level declaration.
 */
public sealed interface Declaration extends AstNode, SourceLocatable
        permits Declaration.IncludeDecl, Declaration.VariableDecl, Declaration.FunctionDecl,
        Declaration.StructDecl, Declaration.EnumDecl, Declaration.RegisterDecl, Declaration.ScopeDecl {

    /**
     * Returns the declared name, flat-prefixed once scopes have been flattened.
     */
    String name();

    /**
     * {@code #include "target"} or {@code #include <target>}.
     */
    record IncludeDecl(String target, boolean angled, SourcePosition position) implements Declaration {

        @Override
        public String name() {
            return target;
        }

        public boolean isCNextInclude() {
            return target.endsWith(".cnx");
        }
    }

    /**
     * A global or scope variable.
     *
     * @param isPublic  True if visible outside its scope; top-level variables are always public.
     * @param scopeName The enclosing scope, or {@code null} at top level.
     */
    record VariableDecl(Statement.VariableDeclaration variable, boolean isPublic, String scopeName)
            implements Declaration {

        @Override
        public String name() {
            return variable.name();
        }

        @Override
        public SourcePosition position() {
            return variable.position();
        }

        @Override
        public List<AstNode> getChildren() {
            return List.of(variable);
        }
    }

    /**
     * A function parameter.
     *
     * @param isConst True if declared {@code const}.
     */
    record Parameter(TypeRef type, String name, boolean isConst, SourcePosition position)
            implements AstNode, SourceLocatable {}

    /**
     * A function definition.
     *
     * @param isPublic  True if exported through the generated header.
     * @param scopeName The enclosing scope, or {@code null} at top level.
     */
    record FunctionDecl(TypeRef returnType, String name, List<Parameter> parameters, Statement.Block body,
                        boolean isPublic, String scopeName, SourcePosition position) implements Declaration {

        public FunctionDecl {
            parameters = List.copyOf(parameters);
        }

        public boolean isMain() {
            return "main".equals(name) && scopeName == null;
        }

        public FunctionDecl withName(String newName) {
            return new FunctionDecl(returnType, newName, parameters, body, isPublic, scopeName, position);
        }

        public FunctionDecl withBody(Statement.Block newBody) {
            return new FunctionDecl(returnType, name, parameters, newBody, isPublic, scopeName, position);
        }

        @Override
        public List<AstNode> getChildren() {
            List<AstNode> children = new ArrayList<>(parameters);
            children.add(body);
            return children;
        }
    }

    record Field(TypeRef type, String name, SourcePosition position) implements AstNode, SourceLocatable {}

    record StructDecl(String name, List<Field> fields, SourcePosition position) implements Declaration {

        public StructDecl {
            fields = List.copyOf(fields);
        }

        @Override
        public List<AstNode> getChildren() {
            return new ArrayList<>(fields);
        }
    }

    /**
     * @param value The explicit value, or {@code null} to continue from the previous member.
     */
    record EnumMember(String name, Expression value, SourcePosition position) implements AstNode, SourceLocatable {}

    record EnumDecl(String name, List<EnumMember> members, SourcePosition position) implements Declaration {

        public EnumDecl {
            members = List.copyOf(members);
        }

        @Override
        public List<AstNode> getChildren() {
            return new ArrayList<>(members);
        }
    }

    /**
     * One field of a memory-mapped register block.
     *
     * @param access One of {@code rw}, {@code ro}, {@code wo}, {@code w1c}, {@code w1s}.
     */
    record RegisterMember(String name, TypeRef type, String access, Expression offset, SourcePosition position)
            implements AstNode, SourceLocatable {}

    record RegisterDecl(String name, Expression baseAddress, List<RegisterMember> members, SourcePosition position)
            implements Declaration {

        public RegisterDecl {
            members = List.copyOf(members);
        }

        @Override
        public List<AstNode> getChildren() {
            return new ArrayList<>(members);
        }
    }

    /**
     * A named scope grouping variables and functions. Members are referenced as
     * {@code Scope.member} from outside and {@code this.member} from inside.
     */
    record ScopeDecl(String name, List<Declaration> members, SourcePosition position) implements Declaration {

        public ScopeDecl {
            members = List.copyOf(members);
        }

        @Override
        public List<AstNode> getChildren() {
            return new ArrayList<>(members);
        }
    }
}
