package org.cnext.compiler.cache;

import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.SymbolKind;
import org.cnext.compiler.frontend.semantics.SymbolOrigin;
import org.cnext.compiler.frontend.semantics.TypeInfo;

import java.util.List;
import java.util.Map;

/**
 * Flat JSON form of a {@link Symbol}. The sealed variant is stored as one object with a
 * {@code kind} discriminator; fields that do not apply to a kind stay {@code null}.
 */
final class CachedSymbol {

    SymbolKind kind;
    String name;
    String file;
    int line;
    SourceLanguage language;
    TypeInfo type;
    List<Symbol.Parameter> parameters;
    boolean declaration;
    boolean variadic;
    Map<String, Long> members;
    String value;
    boolean external;

    static CachedSymbol from(Symbol symbol) {
        CachedSymbol cached = new CachedSymbol();
        cached.kind = symbol.kind();
        cached.name = symbol.name();
        cached.file = symbol.origin().file();
        cached.line = symbol.origin().line();
        cached.language = symbol.origin().language();
        cached.type = symbol.type();
        if (symbol instanceof Symbol.FunctionSymbol function) {
            cached.parameters = function.parameters();
            cached.declaration = function.isDeclaration();
            cached.variadic = function.variadic();
        } else if (symbol instanceof Symbol.EnumSymbol enumSymbol) {
            cached.members = enumSymbol.members();
        } else if (symbol instanceof Symbol.MacroConstantSymbol macro) {
            cached.value = macro.value();
        } else if (symbol instanceof Symbol.VariableSymbol variable) {
            cached.external = variable.isExtern();
        }
        return cached;
    }

    Symbol toSymbol() {
        if (kind == null || name == null || type == null) {
            throw new IllegalStateException("Incomplete cached symbol: " + name);
        }
        SymbolOrigin origin = new SymbolOrigin(file, line, language);
        return switch (kind) {
            case FUNCTION -> new Symbol.FunctionSymbol(name, origin, type,
                    parameters == null ? List.of() : parameters, declaration, variadic);
            case STRUCT -> new Symbol.StructSymbol(name, origin, type);
            case ENUM -> new Symbol.EnumSymbol(name, origin, type, members == null ? Map.of() : members);
            case TYPEDEF -> new Symbol.TypedefSymbol(name, origin, type);
            case MACRO_CONSTANT -> new Symbol.MacroConstantSymbol(name, origin, type, value);
            case VARIABLE -> new Symbol.VariableSymbol(name, origin, type, external);
        };
    }
}
