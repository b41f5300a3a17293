package org.cnext.compiler.frontend.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A symbol in the unified cross-language {@link SymbolTable}. The variant is closed: one
 * record per {@link SymbolKind}, all answering the same name/type lookup contract
 * regardless of the language they came from.
 */
public sealed interface Symbol
        permits Symbol.FunctionSymbol, Symbol.StructSymbol, Symbol.EnumSymbol,
        Symbol.TypedefSymbol, Symbol.MacroConstantSymbol, Symbol.VariableSymbol {

    /**
     * The qualified, flat name the symbol is registered under.
     */
    String name();

    SymbolOrigin origin();

    /**
     * The type payload: the return type for functions, the aliased type for typedefs,
     * the layout for structs.
     */
    TypeInfo type();

    SymbolKind kind();

    default SourceLanguage language() {
        return origin().language();
    }

    /**
     * A function parameter.
     *
     * @param name        The parameter name (may be empty for unnamed foreign parameters).
     * @param type        The parameter type, carrying the const/auto-const decision.
     * @param byReference True if the generated C passes the argument by pointer.
     */
    record Parameter(String name, TypeInfo type, boolean byReference) {

        /**
         * True if the callee may write through this parameter.
         */
        public boolean isMutable() {
            return !type.isConst() && !type.isAutoConst();
        }
    }

    /**
     * A function or method.
     *
     * @param isDeclaration True for a prototype without a body ({@code extern} declaration).
     * @param variadic      True if the parameter list ends in {@code ...}.
     */
    record FunctionSymbol(String name, SymbolOrigin origin, TypeInfo type, List<Parameter> parameters,
                          boolean isDeclaration, boolean variadic) implements Symbol {

        public FunctionSymbol {
            parameters = List.copyOf(parameters);
        }

        @Override
        public SymbolKind kind() {
            return SymbolKind.FUNCTION;
        }

        /**
         * The call signature used to tell overloads apart.
         */
        public String signature() {
            String params = parameters.stream()
                    .map(p -> p.type().baseType() + "[]".repeat(p.type().arrayDimensions().size()))
                    .collect(Collectors.joining(","));
            return "(" + params + (variadic ? ",..." : "") + ")";
        }
    }

    /**
     * A struct, union or class layout. The fields live in {@code type().structFields()}.
     */
    record StructSymbol(String name, SymbolOrigin origin, TypeInfo type) implements Symbol {

        @Override
        public SymbolKind kind() {
            return SymbolKind.STRUCT;
        }
    }

    /**
     * An enumeration with its ordered members and their values.
     */
    record EnumSymbol(String name, SymbolOrigin origin, TypeInfo type, Map<String, Long> members)
            implements Symbol {

        public EnumSymbol {
            members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
        }

        @Override
        public SymbolKind kind() {
            return SymbolKind.ENUM;
        }

        public int variantCount() {
            return members.size();
        }
    }

    /**
     * A type alias.
     */
    record TypedefSymbol(String name, SymbolOrigin origin, TypeInfo type) implements Symbol {

        @Override
        public SymbolKind kind() {
            return SymbolKind.TYPEDEF;
        }
    }

    /**
     * An object-like macro with a scalar value.
     *
     * @param value The macro replacement text.
     */
    record MacroConstantSymbol(String name, SymbolOrigin origin, TypeInfo type, String value)
            implements Symbol {

        @Override
        public SymbolKind kind() {
            return SymbolKind.MACRO_CONSTANT;
        }
    }

    /**
     * A global variable or constant.
     *
     * @param isExtern True for an {@code extern} declaration that does not allocate storage.
     */
    record VariableSymbol(String name, SymbolOrigin origin, TypeInfo type, boolean isExtern)
            implements Symbol {

        @Override
        public SymbolKind kind() {
            return SymbolKind.VARIABLE;
        }
    }
}
