package org.cnext.compiler.frontend.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Type metadata shared by DSL and foreign symbols. Scalar integer widths are always 8, 16,
 * 32 or 64 bits; for arrays the total storage is {@code bitWidth} times the product of
 * {@code arrayDimensions}.
 *
 * @param baseType        The type name as spelled in its origin language (e.g. {@code u32},
 *                        {@code uint32_t}, {@code Point}).
 * @param kind            The type classification.
 * @param bitWidth        The width of one element in bits, or 0 if not applicable.
 * @param arrayDimensions Array dimensions, outermost first; empty for non-arrays.
 * @param isConst         True if explicitly immutable.
 * @param isAutoConst     True if inferred immutable by the code generator.
 * @param stringCapacity  Declared capacity of a {@code string<N>}, or 0.
 * @param structFields    Ordered field types for struct types; empty otherwise.
 */
public record TypeInfo(
        String baseType,
        TypeKind kind,
        int bitWidth,
        List<Integer> arrayDimensions,
        boolean isConst,
        boolean isAutoConst,
        int stringCapacity,
        Map<String, TypeInfo> structFields
) {

    public TypeInfo {
        arrayDimensions = arrayDimensions == null ? List.of() : List.copyOf(arrayDimensions);
        structFields = structFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(structFields));
    }

    /**
     * Creates a scalar type.
     */
    public static TypeInfo scalar(String baseType, TypeKind kind, int bitWidth) {
        return new TypeInfo(baseType, kind, bitWidth, List.of(), false, false, 0, Map.of());
    }

    /**
     * Creates a struct type with the given ordered fields.
     */
    public static TypeInfo struct(String name, Map<String, TypeInfo> fields) {
        int width = 0;
        for (TypeInfo field : fields.values()) {
            width += field.totalBits();
        }
        return new TypeInfo(name, TypeKind.STRUCT, width, List.of(), false, false, 0, fields);
    }

    /**
     * Creates a bounded string type of the given capacity.
     */
    public static TypeInfo string(int capacity) {
        return new TypeInfo("string", TypeKind.STRING, 8, List.of(), false, false, capacity, Map.of());
    }

    public static TypeInfo voidType() {
        return scalar("void", TypeKind.VOID, 0);
    }

    public boolean isArray() {
        return !arrayDimensions.isEmpty();
    }

    public boolean isString() {
        return kind == TypeKind.STRING;
    }

    public boolean isStruct() {
        return kind == TypeKind.STRUCT && !isArray();
    }

    /**
     * Returns the outermost array dimension, or -1 if this is not an array.
     */
    public int arrayLength() {
        return isArray() ? arrayDimensions.get(0) : -1;
    }

    /**
     * Total storage in bits, multiplying through every array dimension.
     */
    public long totalBits() {
        long bits = isString() ? 8L * (stringCapacity + 1) : bitWidth;
        for (int dimension : arrayDimensions) {
            bits *= dimension;
        }
        return bits;
    }

    /**
     * Storage capacity in bytes.
     */
    public long capacityBytes() {
        return totalBits() / 8;
    }

    /**
     * Returns the type of one element of this array (dropping the outermost dimension).
     */
    public TypeInfo elementType() {
        if (!isArray()) {
            return this;
        }
        return new TypeInfo(baseType, kind, bitWidth, arrayDimensions.subList(1, arrayDimensions.size()),
                isConst, isAutoConst, stringCapacity, structFields);
    }

    public TypeInfo withArrayDimensions(List<Integer> dimensions) {
        List<Integer> merged = new ArrayList<>(dimensions);
        merged.addAll(arrayDimensions);
        return new TypeInfo(baseType, kind, bitWidth, merged, isConst, isAutoConst, stringCapacity, structFields);
    }

    public TypeInfo withConst(boolean value) {
        return new TypeInfo(baseType, kind, bitWidth, arrayDimensions, value, isAutoConst, stringCapacity, structFields);
    }

    public TypeInfo withAutoConst(boolean value) {
        return new TypeInfo(baseType, kind, bitWidth, arrayDimensions, isConst, value, stringCapacity, structFields);
    }

    /**
     * Looks up a struct field type by name.
     *
     * @return the field type, or {@code null} if this type has no such field.
     */
    public TypeInfo field(String name) {
        return structFields.get(name);
    }

    /**
     * Smallest value representable by this integer type.
     */
    public long minValue() {
        if (kind != TypeKind.SIGNED) {
            return 0L;
        }
        return bitWidth >= 64 ? Long.MIN_VALUE : -(1L << (bitWidth - 1));
    }

    /**
     * Largest value representable by this integer type. For unsigned 64-bit types the
     * result is {@link Long#MAX_VALUE}; use {@link #isUnsigned64()} to special-case it.
     */
    public long maxValue() {
        if (kind == TypeKind.SIGNED) {
            return bitWidth >= 64 ? Long.MAX_VALUE : (1L << (bitWidth - 1)) - 1;
        }
        return bitWidth >= 64 ? Long.MAX_VALUE : (1L << bitWidth) - 1;
    }

    public boolean isUnsigned64() {
        return kind == TypeKind.UNSIGNED && bitWidth == 64;
    }
}
