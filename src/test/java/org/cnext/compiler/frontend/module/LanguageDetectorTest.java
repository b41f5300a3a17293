package org.cnext.compiler.frontend.module;

import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests language classification by extension and C++ content signatures.
 */
public class LanguageDetectorTest {

    @Test
    @Tag("unit")
    void extensionDecidesFirst() {
        assertThat(LanguageDetector.detect("src/main.cnx", null)).isEqualTo(SourceLanguage.CNEXT);
        assertThat(LanguageDetector.detect("lib/vec.hpp", "int x;")).isEqualTo(SourceLanguage.CPP);
        assertThat(LanguageDetector.detect("lib/vec.hh", null)).isEqualTo(SourceLanguage.CPP);
        assertThat(LanguageDetector.detect("lib/board.h", "int x;")).isEqualTo(SourceLanguage.C);
    }

    @Test
    @Tag("unit")
    void cppSignaturesTurnDotHIntoCpp() {
        assertThat(LanguageDetector.detect("a.h", "namespace hw { int x; }")).isEqualTo(SourceLanguage.CPP);
        assertThat(LanguageDetector.detect("a.h", "template<typename T> T id(T v);")).isEqualTo(SourceLanguage.CPP);
        assertThat(LanguageDetector.detect("a.h", "enum class Mode : int { A };")).isEqualTo(SourceLanguage.CPP);
        assertThat(LanguageDetector.detect("a.h", "class Timer {\npublic:\n  void start();\n};"))
                .isEqualTo(SourceLanguage.CPP);
    }

    @Test
    @Tag("unit")
    void signaturesInsideCommentsAreIgnored() {
        assertThat(LanguageDetector.detect("a.h", "/* namespace demo */\n// class X {\nint x;"))
                .isEqualTo(SourceLanguage.C);
    }

    @Test
    @Tag("unit")
    void implementationFilesAreRecognized() {
        assertThat(LanguageDetector.isImplementationFile("util.c")).isTrue();
        assertThat(LanguageDetector.isImplementationFile("util.cpp")).isTrue();
        assertThat(LanguageDetector.isImplementationFile("util.h")).isFalse();
    }
}
