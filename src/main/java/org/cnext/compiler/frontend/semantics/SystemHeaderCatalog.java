package org.cnext.compiler.frontend.semantics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Describes the recognized system headers. Angle-bracket includes of these headers are never
 * read from disk; the symbols they would contribute come from this catalog instead.
 */
public final class SystemHeaderCatalog {

    private static final Set<String> HEADERS = Set.of(
            "assert.h", "ctype.h", "errno.h", "float.h", "inttypes.h", "iso646.h", "limits.h",
            "locale.h", "math.h", "setjmp.h", "signal.h", "stdarg.h", "stdbool.h", "stddef.h",
            "stdint.h", "stdio.h", "stdlib.h", "string.h", "time.h", "wchar.h",
            "cstdint", "cstdio", "cstdlib", "cstring", "cmath");

    private static final TypeInfo CHAR_PTR = pointer("char");
    private static final TypeInfo FILE_PTR = pointer("FILE");
    private static final TypeInfo VOID_PTR = pointer("void");
    private static final TypeInfo INT = BuiltinTypes.cScalar("int").orElseThrow();
    private static final TypeInfo SIZE = BuiltinTypes.cScalar("size_t").orElseThrow();
    private static final TypeInfo DOUBLE = BuiltinTypes.cScalar("double").orElseThrow();
    private static final TypeInfo VOID = TypeInfo.voidType();

    private static final Map<String, List<Symbol>> SYMBOLS = new LinkedHashMap<>();

    static {
        header("stdio.h",
                typedef("stdio.h", "FILE", TypeInfo.scalar("FILE", TypeKind.OPAQUE, 0)),
                fn("stdio.h", "fopen", FILE_PTR, false, CHAR_PTR, CHAR_PTR),
                fn("stdio.h", "freopen", FILE_PTR, false, CHAR_PTR, CHAR_PTR, FILE_PTR),
                fn("stdio.h", "tmpfile", FILE_PTR, false),
                fn("stdio.h", "fclose", INT, false, FILE_PTR),
                fn("stdio.h", "fflush", INT, false, FILE_PTR),
                fn("stdio.h", "fgets", CHAR_PTR, false, CHAR_PTR, INT, FILE_PTR),
                fn("stdio.h", "gets", CHAR_PTR, false, CHAR_PTR),
                fn("stdio.h", "fputs", INT, false, CHAR_PTR, FILE_PTR),
                fn("stdio.h", "fgetc", INT, false, FILE_PTR),
                fn("stdio.h", "fputc", INT, false, INT, FILE_PTR),
                fn("stdio.h", "fread", SIZE, false, VOID_PTR, SIZE, SIZE, FILE_PTR),
                fn("stdio.h", "fwrite", SIZE, false, VOID_PTR, SIZE, SIZE, FILE_PTR),
                fn("stdio.h", "printf", INT, true, CHAR_PTR),
                fn("stdio.h", "fprintf", INT, true, FILE_PTR, CHAR_PTR),
                fn("stdio.h", "snprintf", INT, true, CHAR_PTR, SIZE, CHAR_PTR),
                fn("stdio.h", "puts", INT, false, CHAR_PTR),
                fn("stdio.h", "putchar", INT, false, INT),
                fn("stdio.h", "getchar", INT, false));
        header("string.h",
                fn("string.h", "strstr", CHAR_PTR, false, CHAR_PTR, CHAR_PTR),
                fn("string.h", "strchr", CHAR_PTR, false, CHAR_PTR, INT),
                fn("string.h", "strrchr", CHAR_PTR, false, CHAR_PTR, INT),
                fn("string.h", "memchr", VOID_PTR, false, VOID_PTR, INT, SIZE),
                fn("string.h", "strlen", SIZE, false, CHAR_PTR),
                fn("string.h", "strcmp", INT, false, CHAR_PTR, CHAR_PTR),
                fn("string.h", "strncmp", INT, false, CHAR_PTR, CHAR_PTR, SIZE),
                fn("string.h", "strncpy", CHAR_PTR, false, CHAR_PTR, CHAR_PTR, SIZE),
                fn("string.h", "memcpy", VOID_PTR, false, VOID_PTR, VOID_PTR, SIZE),
                fn("string.h", "memset", VOID_PTR, false, VOID_PTR, INT, SIZE),
                fn("string.h", "memcmp", INT, false, VOID_PTR, VOID_PTR, SIZE));
        header("stdlib.h",
                fn("stdlib.h", "getenv", CHAR_PTR, false, CHAR_PTR),
                fn("stdlib.h", "malloc", VOID_PTR, false, SIZE),
                fn("stdlib.h", "calloc", VOID_PTR, false, SIZE, SIZE),
                fn("stdlib.h", "realloc", VOID_PTR, false, VOID_PTR, SIZE),
                fn("stdlib.h", "free", VOID, false, VOID_PTR),
                fn("stdlib.h", "abs", INT, false, INT),
                fn("stdlib.h", "atoi", INT, false, CHAR_PTR),
                fn("stdlib.h", "exit", VOID, false, INT),
                fn("stdlib.h", "abort", VOID, false));
        header("math.h",
                fn("math.h", "sqrt", DOUBLE, false, DOUBLE),
                fn("math.h", "fabs", DOUBLE, false, DOUBLE),
                fn("math.h", "sin", DOUBLE, false, DOUBLE),
                fn("math.h", "cos", DOUBLE, false, DOUBLE),
                fn("math.h", "pow", DOUBLE, false, DOUBLE, DOUBLE),
                fn("math.h", "floor", DOUBLE, false, DOUBLE),
                fn("math.h", "ceil", DOUBLE, false, DOUBLE));
        SYMBOLS.put("cstdio", SYMBOLS.get("stdio.h"));
        SYMBOLS.put("cstring", SYMBOLS.get("string.h"));
        SYMBOLS.put("cstdlib", SYMBOLS.get("stdlib.h"));
        SYMBOLS.put("cmath", SYMBOLS.get("math.h"));
    }

    private SystemHeaderCatalog() {}

    /**
     * Checks whether an include target names a recognized system header.
     *
     * @param includeTarget The include target as written, e.g. {@code stdio.h} or {@code sys/types.h}.
     */
    public static boolean isSystemHeader(String includeTarget) {
        return HEADERS.contains(includeTarget);
    }

    /**
     * Returns the symbols contributed by a system header; empty for headers that only
     * provide types already covered by {@link BuiltinTypes}.
     */
    public static List<Symbol> symbolsFor(String header) {
        return SYMBOLS.getOrDefault(header, List.of());
    }

    /**
     * The logical path used for a system header node in the dependency tree.
     */
    public static String logicalPath(String header) {
        return "<" + header + ">";
    }

    private static TypeInfo pointer(String pointee) {
        return TypeInfo.scalar(pointee + "*", TypeKind.POINTER, 32);
    }

    private static void header(String name, Symbol... symbols) {
        SYMBOLS.put(name, new ArrayList<>(Arrays.asList(symbols)));
    }

    private static Symbol typedef(String header, String name, TypeInfo type) {
        return new Symbol.TypedefSymbol(name, origin(header), type);
    }

    private static Symbol fn(String header, String name, TypeInfo returnType, boolean variadic,
                             TypeInfo... parameterTypes) {
        List<Symbol.Parameter> params = new ArrayList<>();
        for (int i = 0; i < parameterTypes.length; i++) {
            params.add(new Symbol.Parameter("p" + i, parameterTypes[i], false));
        }
        return new Symbol.FunctionSymbol(name, origin(header), returnType, params, true, variadic);
    }

    private static SymbolOrigin origin(String header) {
        return new SymbolOrigin(logicalPath(header), 0, SourceLanguage.SYSTEM);
    }
}
