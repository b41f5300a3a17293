package org.cnext.compiler.frontend.module;

import org.cnext.compiler.frontend.semantics.SourceLanguage;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies a file by extension, falling back to content heuristics for {@code .h} files
 * which may hold either C or C++ declarations.
 */
public final class LanguageDetector {

    private static final Set<String> CPP_HEADER_EXTENSIONS = Set.of(".hpp", ".hh", ".hxx", ".h++");
    private static final Set<String> IMPLEMENTATION_EXTENSIONS = Set.of(".c", ".cpp", ".cc", ".cxx", ".c++");

    private static final Pattern CPP_SIGNATURE = Pattern.compile(
            "template\\s*<"
                    + "|\\bnamespace\\s+\\w+"
                    + "|\\bclass\\s+\\w+[^;]*\\{"
                    + "|\\benum\\s+class\\b"
                    + "|\\w::\\w"
                    + "|^\\s*(public|private|protected)\\s*:",
            Pattern.MULTILINE);

    private LanguageDetector() {}

    /**
     * Detects the language of a file.
     *
     * @param fileName The file name or path.
     * @param content  The file content, used only for {@code .h} files; may be {@code null}.
     * @return The detected language. Unknown extensions are treated as C.
     */
    public static SourceLanguage detect(String fileName, String content) {
        String extension = extensionOf(fileName);
        if (".cnx".equals(extension)) {
            return SourceLanguage.CNEXT;
        }
        if (CPP_HEADER_EXTENSIONS.contains(extension)) {
            return SourceLanguage.CPP;
        }
        if (".h".equals(extension) && content != null && hasCppSignature(content)) {
            return SourceLanguage.CPP;
        }
        return SourceLanguage.C;
    }

    /**
     * Checks whether a file name denotes a C or C++ implementation file.
     */
    public static boolean isImplementationFile(String fileName) {
        return IMPLEMENTATION_EXTENSIONS.contains(extensionOf(fileName));
    }

    static boolean hasCppSignature(String content) {
        return CPP_SIGNATURE.matcher(stripComments(content)).find();
    }

    static String extensionOf(String fileName) {
        String name = fileName.replace('\\', '/');
        int slash = name.lastIndexOf('/');
        int dot = name.lastIndexOf('.');
        if (dot <= slash) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * Removes line and block comments, keeping line breaks so line numbers stay stable.
     */
    static String stripComments(String content) {
        StringBuilder out = new StringBuilder(content.length());
        int i = 0;
        int n = content.length();
        while (i < n) {
            char c = content.charAt(i);
            if (c == '"' || c == '\'') {
                int end = i + 1;
                while (end < n && content.charAt(end) != c && content.charAt(end) != '\n') {
                    if (content.charAt(end) == '\\') end++;
                    end++;
                }
                end = Math.min(end + 1, n);
                out.append(content, i, end);
                i = end;
            } else if (c == '/' && i + 1 < n && content.charAt(i + 1) == '/') {
                while (i < n && content.charAt(i) != '\n') i++;
            } else if (c == '/' && i + 1 < n && content.charAt(i + 1) == '*') {
                i += 2;
                while (i < n && !(content.charAt(i) == '*' && i + 1 < n && content.charAt(i + 1) == '/')) {
                    if (content.charAt(i) == '\n') out.append('\n');
                    i++;
                }
                i = Math.min(i + 2, n);
                out.append(' ');
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }
}
