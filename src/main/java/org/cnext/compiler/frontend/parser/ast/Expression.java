package org.cnext.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An expression node. The variant is closed; consumers switch over the record types.
 */
public sealed interface Expression extends AstNode, SourceLocatable
        permits Expression.Literal, Expression.Identifier, Expression.NullLiteral, Expression.Unary,
        Expression.Binary, Expression.Ternary, Expression.Call, Expression.MemberAccess, Expression.Index,
        Expression.Cast {

    enum LiteralKind { INTEGER, FLOAT, STRING, CHAR, BOOLEAN }

    /**
     * Returns the variable an lvalue is rooted at: {@code p} for {@code p}, {@code p.x},
     * {@code p[2]} or {@code p.a[1][0, 4]}.
     *
     * @return the root name, or {@code null} if the expression is not rooted at a name.
     */
    static String rootName(Expression expression) {
        Expression current = expression;
        while (true) {
            if (current instanceof Identifier identifier) {
                return identifier.name();
            }
            if (current instanceof MemberAccess access) {
                current = access.target();
            } else if (current instanceof Index index) {
                current = index.target();
            } else {
                return null;
            }
        }
    }

    /**
     * A literal as written, e.g. {@code 0xFF}, {@code 1.5}, {@code "text"} or {@code true}.
     */
    record Literal(LiteralKind kind, String text, SourcePosition position) implements Expression {}

    /**
     * A name. {@code this} and {@code global} appear as identifiers with those names until
     * scope flattening replaces them.
     */
    record Identifier(String name, SourcePosition position) implements Expression {}

    record NullLiteral(SourcePosition position) implements Expression {}

    /**
     * A prefix operation: {@code -}, {@code !} or {@code ~}.
     */
    record Unary(String operator, Expression operand, SourcePosition position) implements Expression {
        @Override
        public List<AstNode> getChildren() {
            return List.of(operand);
        }
    }

    /**
     * A binary operation with the operator in C-Next spelling ({@code =} is equality).
     */
    record Binary(String operator, Expression left, Expression right, SourcePosition position)
            implements Expression {
        @Override
        public List<AstNode> getChildren() {
            return List.of(left, right);
        }
    }

    record Ternary(Expression condition, Expression thenValue, Expression elseValue, SourcePosition position)
            implements Expression {
        @Override
        public List<AstNode> getChildren() {
            return List.of(condition, thenValue, elseValue);
        }
    }

    record Call(Expression callee, List<Expression> arguments, SourcePosition position) implements Expression {

        public Call {
            arguments = List.copyOf(arguments);
        }

        /**
         * Returns the callee name if the callee is a plain identifier, otherwise {@code null}.
         */
        public String calleeName() {
            return callee instanceof Identifier identifier ? identifier.name() : null;
        }

        @Override
        public List<AstNode> getChildren() {
            List<AstNode> children = new ArrayList<>();
            children.add(callee);
            children.addAll(arguments);
            return children;
        }
    }

    /**
     * {@code target.member}: struct fields, scope and register members, enum variants and the
     * {@code length}, {@code capacity}, {@code MIN} and {@code MAX} properties.
     */
    record MemberAccess(Expression target, String member, SourcePosition position) implements Expression {
        @Override
        public List<AstNode> getChildren() {
            return List.of(target);
        }
    }

    /**
     * {@code target[index]} or the bit range {@code target[index, width]}.
     *
     * @param width The range width, or {@code null} for single-element or single-bit access.
     */
    record Index(Expression target, Expression index, Expression width, SourcePosition position)
            implements Expression {

        public boolean isRange() {
            return width != null;
        }

        @Override
        public List<AstNode> getChildren() {
            return width == null ? List.of(target, index) : List.of(target, index, width);
        }
    }

    record Cast(TypeRef type, Expression operand, SourcePosition position) implements Expression {
        @Override
        public List<AstNode> getChildren() {
            return List.of(operand);
        }
    }
}
