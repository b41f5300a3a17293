package org.cnext.compiler.frontend.semantics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in width and type knowledge: the C-Next primitive types, their C spellings, and the
 * scalar type spellings of the foreign grammars. Used instead of parsing system headers.
 */
public final class BuiltinTypes {

    private static final Map<String, TypeInfo> DSL_PRIMITIVES = new LinkedHashMap<>();
    private static final Map<String, String> DSL_TO_C = new LinkedHashMap<>();
    private static final Map<String, TypeInfo> C_SCALARS = new LinkedHashMap<>();

    static {
        dsl("u8", "uint8_t", TypeKind.UNSIGNED, 8);
        dsl("u16", "uint16_t", TypeKind.UNSIGNED, 16);
        dsl("u32", "uint32_t", TypeKind.UNSIGNED, 32);
        dsl("u64", "uint64_t", TypeKind.UNSIGNED, 64);
        dsl("i8", "int8_t", TypeKind.SIGNED, 8);
        dsl("i16", "int16_t", TypeKind.SIGNED, 16);
        dsl("i32", "int32_t", TypeKind.SIGNED, 32);
        dsl("i64", "int64_t", TypeKind.SIGNED, 64);
        dsl("f32", "float", TypeKind.FLOAT, 32);
        dsl("f64", "double", TypeKind.FLOAT, 64);
        dsl("bool", "bool", TypeKind.BOOL, 8);
        dsl("void", "void", TypeKind.VOID, 0);

        c("uint8_t", TypeKind.UNSIGNED, 8);
        c("uint16_t", TypeKind.UNSIGNED, 16);
        c("uint32_t", TypeKind.UNSIGNED, 32);
        c("uint64_t", TypeKind.UNSIGNED, 64);
        c("int8_t", TypeKind.SIGNED, 8);
        c("int16_t", TypeKind.SIGNED, 16);
        c("int32_t", TypeKind.SIGNED, 32);
        c("int64_t", TypeKind.SIGNED, 64);
        c("uint_least8_t", TypeKind.UNSIGNED, 8);
        c("uint_fast8_t", TypeKind.UNSIGNED, 8);
        c("int_least8_t", TypeKind.SIGNED, 8);
        c("uintptr_t", TypeKind.UNSIGNED, 32);
        c("intptr_t", TypeKind.SIGNED, 32);
        c("size_t", TypeKind.UNSIGNED, 32);
        c("ptrdiff_t", TypeKind.SIGNED, 32);
        c("char", TypeKind.SIGNED, 8);
        c("signed char", TypeKind.SIGNED, 8);
        c("unsigned char", TypeKind.UNSIGNED, 8);
        c("short", TypeKind.SIGNED, 16);
        c("short int", TypeKind.SIGNED, 16);
        c("signed short", TypeKind.SIGNED, 16);
        c("unsigned short", TypeKind.UNSIGNED, 16);
        c("unsigned short int", TypeKind.UNSIGNED, 16);
        c("int", TypeKind.SIGNED, 32);
        c("signed", TypeKind.SIGNED, 32);
        c("signed int", TypeKind.SIGNED, 32);
        c("unsigned", TypeKind.UNSIGNED, 32);
        c("unsigned int", TypeKind.UNSIGNED, 32);
        c("long", TypeKind.SIGNED, 32);
        c("long int", TypeKind.SIGNED, 32);
        c("unsigned long", TypeKind.UNSIGNED, 32);
        c("unsigned long int", TypeKind.UNSIGNED, 32);
        c("long long", TypeKind.SIGNED, 64);
        c("long long int", TypeKind.SIGNED, 64);
        c("unsigned long long", TypeKind.UNSIGNED, 64);
        c("unsigned long long int", TypeKind.UNSIGNED, 64);
        c("float", TypeKind.FLOAT, 32);
        c("double", TypeKind.FLOAT, 64);
        c("long double", TypeKind.FLOAT, 64);
        c("bool", TypeKind.BOOL, 8);
        c("_Bool", TypeKind.BOOL, 8);
        c("void", TypeKind.VOID, 0);
    }

    private BuiltinTypes() {}

    private static void dsl(String name, String cName, TypeKind kind, int width) {
        DSL_PRIMITIVES.put(name, TypeInfo.scalar(name, kind, width));
        DSL_TO_C.put(name, cName);
    }

    private static void c(String spelling, TypeKind kind, int width) {
        C_SCALARS.put(spelling, TypeInfo.scalar(spelling, kind, width));
    }

    /**
     * Looks up a C-Next primitive type such as {@code u32}.
     */
    public static Optional<TypeInfo> dslPrimitive(String name) {
        return Optional.ofNullable(DSL_PRIMITIVES.get(name));
    }

    public static boolean isDslPrimitive(String name) {
        return DSL_PRIMITIVES.containsKey(name);
    }

    /**
     * Looks up a scalar type spelling of the foreign grammars, such as {@code unsigned int}.
     */
    public static Optional<TypeInfo> cScalar(String spelling) {
        return Optional.ofNullable(C_SCALARS.get(normalizeSpelling(spelling)));
    }

    /**
     * Returns the C spelling for a type name: C-Next primitives map to their
     * {@code <stdint.h>} names, every other name is already a C name.
     */
    public static String toCName(String baseType) {
        return DSL_TO_C.getOrDefault(baseType, baseType);
    }

    /**
     * Finds the C-Next primitive of the given kind and width, e.g. {@code (UNSIGNED, 32) -> u32}.
     */
    public static Optional<String> dslNameFor(TypeKind kind, int width) {
        return DSL_PRIMITIVES.values().stream()
                .filter(t -> t.kind() == kind && t.bitWidth() == width)
                .map(TypeInfo::baseType)
                .findFirst();
    }

    /**
     * Returns the {@code <stdint.h>} boundary macro for a primitive, e.g. {@code (i32, MIN) -> INT32_MIN}.
     *
     * @param type  An integer type.
     * @param bound {@code "MIN"} or {@code "MAX"}.
     * @return the macro name, or {@code "0"} for the minimum of an unsigned type.
     */
    public static String boundaryMacro(TypeInfo type, String bound) {
        String prefix = type.kind() == TypeKind.UNSIGNED ? "UINT" : "INT";
        if (type.kind() == TypeKind.UNSIGNED && "MIN".equals(bound)) {
            return "0U";
        }
        return prefix + type.bitWidth() + "_" + bound;
    }

    private static String normalizeSpelling(String spelling) {
        return spelling.trim().replaceAll("\\s+", " ");
    }
}
