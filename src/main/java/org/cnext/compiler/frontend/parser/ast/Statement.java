package org.cnext.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A statement node inside a function body.
 */
public sealed interface Statement extends AstNode, SourceLocatable
        permits Statement.Block, Statement.VariableDeclaration, Statement.Assignment,
        Statement.ExpressionStatement, Statement.If, Statement.While, Statement.DoWhile, Statement.For,
        Statement.Switch, Statement.Return {

    record Block(List<Statement> statements, SourcePosition position) implements Statement {

        public Block {
            statements = List.copyOf(statements);
        }

        @Override
        public List<AstNode> getChildren() {
            return new ArrayList<>(statements);
        }
    }

    /**
     * A variable declaration; used for locals and, wrapped in a {@link Declaration.VariableDecl}, for globals.
     *
     * @param initializer The initial value, or {@code null}.
     */
    record VariableDeclaration(TypeRef type, String name, Expression initializer, boolean isConst,
                               SourcePosition position) implements Statement {

        public VariableDeclaration withName(String newName) {
            return new VariableDeclaration(type, newName, initializer, isConst, position);
        }

        @Override
        public List<AstNode> getChildren() {
            return initializer == null ? List.of(type) : List.of(type, initializer);
        }
    }

    /**
     * An assignment. The operator is {@code <-} or a compound form such as {@code +<-}.
     */
    record Assignment(Expression target, String operator, Expression value, SourcePosition position)
            implements Statement {

        public boolean isCompound() {
            return !"<-".equals(operator);
        }

        /**
         * Returns the C assignment operator, e.g. {@code +=} for {@code +<-}.
         */
        public String cOperator() {
            return isCompound() ? operator.substring(0, operator.length() - 2) + "=" : "=";
        }

        /**
         * Returns the binary operator of a compound assignment, e.g. {@code +} for {@code +<-}.
         */
        public String binaryOperator() {
            return operator.substring(0, operator.length() - 2);
        }

        @Override
        public List<AstNode> getChildren() {
            return List.of(target, value);
        }
    }

    record ExpressionStatement(Expression expression, SourcePosition position) implements Statement {
        @Override
        public List<AstNode> getChildren() {
            return List.of(expression);
        }
    }

    /**
     * @param elseBranch A block, another {@code if}, or {@code null}.
     */
    record If(Expression condition, Block thenBranch, Statement elseBranch, SourcePosition position)
            implements Statement {
        @Override
        public List<AstNode> getChildren() {
            return elseBranch == null ? List.of(condition, thenBranch) : List.of(condition, thenBranch, elseBranch);
        }
    }

    record While(Expression condition, Block body, SourcePosition position) implements Statement {
        @Override
        public List<AstNode> getChildren() {
            return List.of(condition, body);
        }
    }

    record DoWhile(Block body, Expression condition, SourcePosition position) implements Statement {
        @Override
        public List<AstNode> getChildren() {
            return List.of(body, condition);
        }
    }

    /**
     * @param init      A declaration or assignment, or {@code null}.
     * @param condition The loop condition, or {@code null}.
     * @param update    An assignment or expression statement, or {@code null}.
     */
    record For(Statement init, Expression condition, Statement update, Block body, SourcePosition position)
            implements Statement {
        @Override
        public List<AstNode> getChildren() {
            List<AstNode> children = new ArrayList<>();
            if (init != null) children.add(init);
            if (condition != null) children.add(condition);
            if (update != null) children.add(update);
            children.add(body);
            return children;
        }
    }

    /**
     * A switch. There is no fallthrough; every case owns a block.
     *
     * @param defaultCase The default branch, or {@code null}.
     */
    record Switch(Expression subject, List<SwitchCase> cases, DefaultCase defaultCase, SourcePosition position)
            implements Statement {

        public Switch {
            cases = List.copyOf(cases);
        }

        @Override
        public List<AstNode> getChildren() {
            List<AstNode> children = new ArrayList<>();
            children.add(subject);
            children.addAll(cases);
            if (defaultCase != null) children.add(defaultCase);
            return children;
        }
    }

    /**
     * One {@code case} with its OR-grouped labels.
     */
    record SwitchCase(List<Expression> labels, Block body, SourcePosition position) implements AstNode, SourceLocatable {

        public SwitchCase {
            labels = List.copyOf(labels);
        }

        @Override
        public List<AstNode> getChildren() {
            List<AstNode> children = new ArrayList<>(labels);
            children.add(body);
            return children;
        }
    }

    /**
     * The default branch.
     *
     * @param count The declared number of covered enum variants for {@code default(n)}, or {@code null}.
     */
    record DefaultCase(Integer count, Block body, SourcePosition position) implements AstNode, SourceLocatable {
        @Override
        public List<AstNode> getChildren() {
            return List.of(body);
        }
    }

    /**
     * @param value The returned value, or {@code null}.
     */
    record Return(Expression value, SourcePosition position) implements Statement {
        @Override
        public List<AstNode> getChildren() {
            return value == null ? List.of() : List.of(value);
        }
    }
}
