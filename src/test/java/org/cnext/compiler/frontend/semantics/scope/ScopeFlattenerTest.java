package org.cnext.compiler.frontend.semantics.scope;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.lexer.Lexer;
import org.cnext.compiler.frontend.parser.Parser;
import org.cnext.compiler.frontend.parser.ast.Declaration;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.Program;
import org.cnext.compiler.frontend.parser.ast.Statement;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the rewriting of scopes into prefixed top-level declarations.
 */
public class ScopeFlattenerTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private Program flatten(String source) {
        Program program = new Parser(new Lexer(source, "test.cnx", diagnostics).scanTokens(), diagnostics).parse();
        return new ScopeFlattener(new ScopeRegistry(), diagnostics).flatten(program);
    }

    @Test
    @Tag("unit")
    void membersArePrefixedWithTheirScope() {
        Program flat = flatten("""
                scope Motor {
                    u8 speed <- 0;
                    public void set(u8 value) { this.speed <- value; }
                }
                void main() { Motor.set(3); }
                """);

        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        assertThat(flat.declarations()).noneMatch(Declaration.ScopeDecl.class::isInstance);
        Declaration.VariableDecl speed = (Declaration.VariableDecl) flat.declarations().get(0);
        assertThat(speed.variable().name()).isEqualTo("Motor_speed");
        assertThat(speed.scopeName()).isEqualTo("Motor");
        Declaration.FunctionDecl set = (Declaration.FunctionDecl) flat.declarations().get(1);
        assertThat(set.name()).isEqualTo("Motor_set");
        Statement.Assignment write = (Statement.Assignment) set.body().statements().get(0);
        assertThat(((Expression.Identifier) write.target()).name()).isEqualTo("Motor_speed");

        Declaration.FunctionDecl main = (Declaration.FunctionDecl) flat.declarations().get(2);
        Statement.ExpressionStatement call = (Statement.ExpressionStatement) main.body().statements().get(0);
        Expression.Call invocation = (Expression.Call) call.expression();
        assertThat(((Expression.Identifier) invocation.callee()).name()).isEqualTo("Motor_set");
    }

    @Test
    @Tag("unit")
    void globalQualifierReachesTopLevelNames() {
        Program flat = flatten("""
                u8 count <- 0;
                scope Counter {
                    public void bump() { global.count +<- 1; }
                }
                """);

        Declaration.FunctionDecl bump = (Declaration.FunctionDecl) flat.declarations().get(1);
        Statement.Assignment write = (Statement.Assignment) bump.body().statements().get(0);
        assertThat(((Expression.Identifier) write.target()).name()).isEqualTo("count");
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    @Tag("unit")
    void bareScopeMemberMustBeQualified() {
        flatten("""
                scope Led {
                    u8 level <- 0;
                    public void on() { level <- 1; }
                }
                """);

        assertThat(diagnostics.hasCode(DiagnosticCode.UNQUALIFIED_SCOPE_MEMBER)).isTrue();
        assertThat(diagnostics.summary()).contains("Use 'this.level'");
    }

    @Test
    @Tag("unit")
    void localShadowingAMemberNeedsNoQualifier() {
        flatten("""
                scope Led {
                    u8 level <- 0;
                    public void on() { u8 level <- 2; level +<- 1; }
                }
                """);

        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
    }

    @Test
    @Tag("unit")
    void privateMembersAreHiddenFromOtherScopes() {
        flatten("""
                scope Led {
                    u8 level <- 0;
                    public void on() { this.level <- 1; }
                }
                void main() { Led.level <- 3; Led.off(); }
                """);

        assertThat(diagnostics.hasCode(DiagnosticCode.PRIVATE_MEMBER_ACCESS)).isTrue();
        assertThat(diagnostics.hasCode(DiagnosticCode.UNKNOWN_MEMBER)).isTrue();
    }

    @Test
    @Tag("unit")
    void thisOutsideScopeIsRejected() {
        flatten("void main() { this.x <- 1; }");

        assertThat(diagnostics.hasCode(DiagnosticCode.UNDEFINED_IDENTIFIER)).isTrue();
    }
}
