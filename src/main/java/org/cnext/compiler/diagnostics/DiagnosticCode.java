package org.cnext.compiler.diagnostics;

/**
 * Stable, machine-readable diagnostic codes. The code strings are part of the tool's
 * external interface and must not be renumbered.
 */
public enum DiagnosticCode {

    SYNTAX_ERROR("E0100", Subsystem.PARSER),
    UNEXPECTED_TOKEN("E0101", Subsystem.PARSER),
    UNTERMINATED_LITERAL("E0102", Subsystem.PARSER),

    CROSS_LANGUAGE_CONFLICT("E0201", Subsystem.SYMBOLS),
    DUPLICATE_DEFINITION("E0202", Subsystem.SYMBOLS),
    UNDEFINED_IDENTIFIER("E0203", Subsystem.SYMBOLS),
    USE_BEFORE_DEFINITION("E0204", Subsystem.SYMBOLS),
    UNQUALIFIED_SCOPE_MEMBER("E0205", Subsystem.SYMBOLS),
    PRIVATE_MEMBER_ACCESS("E0206", Subsystem.SYMBOLS),
    UNKNOWN_MEMBER("E0207", Subsystem.SYMBOLS),
    ARGUMENT_COUNT_MISMATCH("E0208", Subsystem.SYMBOLS),

    ASSIGNMENT_TO_CONST("E0301", Subsystem.CONST),
    CONST_PASSED_AS_MUTABLE("E0302", Subsystem.CONST),
    USE_BEFORE_INIT("E0381", Subsystem.INITIALIZATION),

    NON_EXHAUSTIVE_SWITCH("E0401", Subsystem.SWITCH),
    DEFAULT_COUNT_MISMATCH("E0402", Subsystem.SWITCH),
    DUPLICATE_CASE("E0403", Subsystem.SWITCH),
    DEFAULT_COUNT_REQUIRED("E0404", Subsystem.SWITCH),
    DEFAULT_COUNT_ON_NON_ENUM("E0405", Subsystem.SWITCH),

    FUNCTION_LIKE_MACRO("E0501", Subsystem.PREPROCESSOR),
    VALUE_MACRO("E0502", Subsystem.PREPROCESSOR),
    IMPLEMENTATION_FILE_INCLUDE("E0503", Subsystem.PREPROCESSOR),
    CNEXT_ALTERNATIVE_EXISTS("E0504", Subsystem.PREPROCESSOR),
    UNRESOLVED_INCLUDE("E0505", Subsystem.PREPROCESSOR),

    BIT_INDEX_OUT_OF_RANGE("E0601", Subsystem.NUMERIC),
    SLICE_NOT_CONSTANT("E0602", Subsystem.NUMERIC),
    SLICE_OUT_OF_BOUNDS("E0603", Subsystem.NUMERIC),
    BOUNDARY_LITERAL("E0604", Subsystem.NUMERIC),
    LITERAL_OUT_OF_RANGE("E0605", Subsystem.NUMERIC),
    DIVISION_BY_ZERO("E0606", Subsystem.NUMERIC),
    FLOAT_MODULO("E0607", Subsystem.NUMERIC),
    NARROWING_CONVERSION("E0608", Subsystem.NUMERIC),
    SIGN_CONVERSION("E0609", Subsystem.NUMERIC),

    READ_OF_WRITE_ONLY_REGISTER("E0701", Subsystem.REGISTER),
    WRITE_TO_READ_ONLY_REGISTER("E0702", Subsystem.REGISTER),
    BIT_RANGE_WRITE_ON_W1("E0703", Subsystem.REGISTER),
    CLEARING_WRITE_ON_WRITE_ONLY("E0704", Subsystem.REGISTER),

    HEADER_PARSE_ERROR("E0801", Subsystem.HEADER),

    MISSING_NULL_CHECK("E0901", Subsystem.NULL_SAFETY),
    FORBIDDEN_ALLOCATION("E0902", Subsystem.NULL_SAFETY),
    NULL_OUTSIDE_COMPARISON("E0903", Subsystem.NULL_SAFETY),
    INVALID_NULLABLE_STORAGE("E0904", Subsystem.NULL_SAFETY),
    MISSING_NULLABLE_PREFIX("E0905", Subsystem.NULL_SAFETY),
    INVALID_NULLABLE_PREFIX("E0906", Subsystem.NULL_SAFETY),
    NULL_COMPARISON_ON_NON_NULLABLE("E0907", Subsystem.NULL_SAFETY),
    UNCHECKED_NULLABLE_USE("E0908", Subsystem.NULL_SAFETY),
    NULLABLE_COMPARED_TO_VALUE("E0909", Subsystem.NULL_SAFETY),

    IO_ERROR("E1001", Subsystem.IO);

    private final String code;
    private final Subsystem subsystem;

    DiagnosticCode(String code, Subsystem subsystem) {
        this.code = code;
        this.subsystem = subsystem;
    }

    public String code() {
        return code;
    }

    public Subsystem subsystem() {
        return subsystem;
    }
}
