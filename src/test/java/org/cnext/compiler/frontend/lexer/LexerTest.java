package org.cnext.compiler.frontend.lexer;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests tokenization of C-Next source.
 */
public class LexerTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private List<Token> scan(String source) {
        return new Lexer(source, "test.cnx", diagnostics).scanTokens();
    }

    @Test
    @Tag("unit")
    void assignmentArrowAndEqualityAreDistinct() {
        List<Token> tokens = scan("x <- 5; if (x = 5) { x +<- 1; x <<<- 2; }");

        assertThat(tokens).extracting(Token::type).startsWith(
                TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.INTEGER, TokenType.SEMICOLON,
                TokenType.IF, TokenType.LEFT_PAREN, TokenType.IDENTIFIER, TokenType.EQUAL);
        assertThat(tokens).extracting(Token::type).contains(TokenType.PLUS_ASSIGN, TokenType.SHL_ASSIGN);
        assertThat(tokens.get(tokens.size() - 1).type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    @Tag("unit")
    void numbersKeepPrefixesAndSuffixes() {
        List<Token> tokens = scan("0xFF_FFu32 0b1010 1_000 3.25f32 1e3");

        assertThat(tokens).extracting(Token::text)
                .startsWith("0xFF_FFu32", "0b1010", "1_000", "3.25f32", "1e3");
        assertThat(tokens).extracting(Token::type).startsWith(
                TokenType.INTEGER, TokenType.INTEGER, TokenType.INTEGER, TokenType.FLOAT, TokenType.FLOAT);
    }

    @Test
    @Tag("unit")
    void includesBecomeSingleTokensAndCommentsVanish() {
        List<Token> tokens = scan("""
                #include <stdio.h>
                // comment
                /* block
                   comment */ u8 value;
                """);

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.INCLUDE);
        assertThat(tokens.get(0).text()).isEqualTo("<stdio.h>");
        Token type = tokens.get(1);
        assertThat(type.text()).isEqualTo("u8");
        assertThat(type.line()).isEqualTo(4);
        assertThat(type.column()).isEqualTo(15);
    }

    @Test
    @Tag("unit")
    void keywordsAreRecognized() {
        assertThat(scan("register scope enum struct const global this NULL string"))
                .extracting(Token::type)
                .startsWith(TokenType.REGISTER, TokenType.SCOPE, TokenType.ENUM, TokenType.STRUCT, TokenType.CONST,
                        TokenType.GLOBAL, TokenType.THIS, TokenType.NULL, TokenType.STRING_TYPE);
    }

    @Test
    @Tag("unit")
    void unterminatedLiteralsAreReported() {
        scan("string<8> s <- \"open\nu8 c <- 'x");

        assertThat(diagnostics.hasCode(DiagnosticCode.UNTERMINATED_LITERAL)).isTrue();
        assertThat(diagnostics.errorCount()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void strayCharacterIsReportedWithPosition() {
        scan("u8 x <- 1;\n  $");

        assertThat(diagnostics.hasCode(DiagnosticCode.UNEXPECTED_TOKEN)).isTrue();
        assertThat(diagnostics.getDiagnostics().get(0).line()).isEqualTo(2);
        assertThat(diagnostics.getDiagnostics().get(0).column()).isEqualTo(3);
    }
}
