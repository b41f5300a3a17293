package org.cnext.compiler.frontend.semantics;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The unified cross-language symbol table of one compilation run. Symbols from C-Next,
 * C, C++ and the system header catalog share one flat namespace keyed by qualified name.
 *
 * <p>The table is write-once per symbol: a definition is never replaced. A second symbol
 * under an existing name is accepted only if it is compatible with every symbol already
 * present:</p>
 * <ul>
 *   <li>repeated function declarations with an identical signature (extern prototypes),</li>
 *   <li>C++ overloads whose signatures are disjoint,</li>
 *   <li>identical redefinitions of a typedef or macro within one language,</li>
 *   <li>an {@code extern} variable declaration next to its definition,</li>
 *   <li>a typedef that names a struct or enum of the same name.</li>
 * </ul>
 * <p>Any other collision is reported: across languages as {@link DiagnosticCode#CROSS_LANGUAGE_CONFLICT},
 * within one language as {@link DiagnosticCode#DUPLICATE_DEFINITION}.</p>
 */
public class SymbolTable {

    private final Map<String, List<Symbol>> symbols = new LinkedHashMap<>();
    private final Map<String, String> enumMemberOwners = new HashMap<>();
    private final DiagnosticsEngine diagnostics;

    /**
     * Constructs an empty symbol table.
     * @param diagnostics The diagnostics engine for reporting conflicts.
     */
    public SymbolTable(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    // === Definition ===

    /**
     * Defines a symbol, applying the conflict policy.
     * @param symbol The symbol to define.
     * @return true if the symbol was added or was already present, false if it was rejected.
     */
    public boolean define(Symbol symbol) {
        List<Symbol> existing = symbols.computeIfAbsent(symbol.name(), k -> new ArrayList<>());
        for (Symbol other : existing) {
            if (other.equals(symbol)) {
                return true;
            }
        }
        for (Symbol other : existing) {
            if (!isCompatible(other, symbol)) {
                reportConflict(other, symbol);
                return false;
            }
        }
        existing.add(symbol);
        if (symbol instanceof Symbol.EnumSymbol enumSymbol && symbol.language() != SourceLanguage.CNEXT) {
            // Foreign enumerators are referenced without their enum's name.
            for (String member : enumSymbol.members().keySet()) {
                enumMemberOwners.putIfAbsent(member, enumSymbol.name());
            }
        }
        return true;
    }

    /**
     * Defines every symbol of the given collection.
     * @return true if all symbols were accepted.
     */
    public boolean defineAll(Collection<? extends Symbol> newSymbols) {
        boolean ok = true;
        for (Symbol symbol : newSymbols) {
            ok &= define(symbol);
        }
        return ok;
    }

    private boolean isCompatible(Symbol a, Symbol b) {
        if (a instanceof Symbol.FunctionSymbol fa && b instanceof Symbol.FunctionSymbol fb) {
            boolean sameSignature = fa.signature().equals(fb.signature());
            if (a.language() == SourceLanguage.SYSTEM || b.language() == SourceLanguage.SYSTEM) {
                return (fa.isDeclaration() || a.language() == SourceLanguage.SYSTEM)
                        && (fb.isDeclaration() || b.language() == SourceLanguage.SYSTEM)
                        && a.language() != SourceLanguage.CNEXT && b.language() != SourceLanguage.CNEXT;
            }
            if (sameSignature) {
                // Repeated extern prototypes, possibly from headers of different languages.
                return fa.isDeclaration() || fb.isDeclaration();
            }
            return a.language() == SourceLanguage.CPP && b.language() == SourceLanguage.CPP;
        }
        if (a.language() != b.language()) {
            return false;
        }
        if (a instanceof Symbol.TypedefSymbol && b instanceof Symbol.TypedefSymbol) {
            return a.type().equals(b.type());
        }
        if (a instanceof Symbol.MacroConstantSymbol ma && b instanceof Symbol.MacroConstantSymbol mb) {
            return ma.value().equals(mb.value());
        }
        if (a instanceof Symbol.VariableSymbol va && b instanceof Symbol.VariableSymbol vb) {
            return (va.isExtern() || vb.isExtern()) && va.type().baseType().equals(vb.type().baseType());
        }
        if (isTag(a) && b instanceof Symbol.TypedefSymbol) {
            return b.type().baseType().equals(a.name());
        }
        if (a instanceof Symbol.TypedefSymbol && isTag(b)) {
            return a.type().baseType().equals(b.name());
        }
        return false;
    }

    private static boolean isTag(Symbol symbol) {
        return symbol instanceof Symbol.StructSymbol || symbol instanceof Symbol.EnumSymbol;
    }

    private void reportConflict(Symbol existing, Symbol rejected) {
        boolean crossLanguage = existing.language() != rejected.language();
        DiagnosticCode code = crossLanguage
                ? DiagnosticCode.CROSS_LANGUAGE_CONFLICT
                : DiagnosticCode.DUPLICATE_DEFINITION;
        String message = crossLanguage
                ? "Symbol conflict: '" + rejected.name() + "' is defined in multiple languages: "
                        + existing.origin() + " and " + rejected.origin()
                : "Symbol '" + rejected.name() + "' is already defined at "
                        + existing.origin().file() + ":" + existing.origin().line();
        String suggestion = rejected.language() == SourceLanguage.CNEXT
                ? "Rename the C-Next symbol '" + rejected.name() + "'"
                : null;
        diagnostics.reportError(code, message, rejected.origin().file(), rejected.origin().line(), 0, suggestion);
    }

    // === Resolution ===

    /**
     * Resolves a symbol by qualified name. For overloaded names the first definition is returned.
     * @param name The qualified name.
     * @return The symbol, or empty if the name is unknown.
     */
    public Optional<Symbol> resolve(String name) {
        List<Symbol> found = symbols.get(name);
        if (found == null || found.isEmpty()) {
            return Optional.empty();
        }
        // Prefer definitions over declarations.
        return found.stream()
                .filter(s -> !(s instanceof Symbol.FunctionSymbol f) || !f.isDeclaration())
                .findFirst()
                .or(() -> Optional.of(found.get(0)));
    }

    /**
     * Returns every symbol registered under a name (overloads and compatible redeclarations).
     */
    public List<Symbol> resolveAll(String name) {
        return Collections.unmodifiableList(symbols.getOrDefault(name, List.of()));
    }

    public boolean contains(String name) {
        List<Symbol> found = symbols.get(name);
        return found != null && !found.isEmpty();
    }

    /**
     * Resolves a function by name.
     */
    public Optional<Symbol.FunctionSymbol> resolveFunction(String name) {
        return resolveAll(name).stream()
                .filter(Symbol.FunctionSymbol.class::isInstance)
                .map(Symbol.FunctionSymbol.class::cast)
                .findFirst();
    }

    /**
     * Resolves a type name (struct, enum or typedef, following typedef chains) to its TypeInfo.
     * @param typeName The type name as written.
     * @return The resolved type, or empty if the name is not a known type.
     */
    public Optional<TypeInfo> resolveType(String typeName) {
        Optional<TypeInfo> builtin = BuiltinTypes.dslPrimitive(typeName).or(() -> BuiltinTypes.cScalar(typeName));
        if (builtin.isPresent()) {
            return builtin;
        }
        String current = stripTag(typeName);
        for (int depth = 0; depth < 16; depth++) {
            List<Symbol> candidates = resolveAll(current);
            Optional<Symbol> symbol = candidates.stream()
                    .filter(s -> s instanceof Symbol.StructSymbol || s instanceof Symbol.EnumSymbol)
                    .findFirst()
                    .or(() -> candidates.stream()
                            .filter(Symbol.TypedefSymbol.class::isInstance)
                            .findFirst());
            if (symbol.isEmpty()) {
                return Optional.empty();
            }
            Symbol s = symbol.get();
            if (!(s instanceof Symbol.TypedefSymbol typedef)) {
                return Optional.of(s.type());
            }
            TypeInfo aliased = typedef.type();
            if (aliased.kind() != TypeKind.STRUCT && aliased.kind() != TypeKind.ENUM
                    || !aliased.structFields().isEmpty()
                    || aliased.baseType().equals(current)) {
                return Optional.of(aliased);
            }
            current = stripTag(aliased.baseType());
        }
        return Optional.empty();
    }

    /**
     * Resolves an enum by name.
     */
    public Optional<Symbol.EnumSymbol> resolveEnum(String name) {
        return resolveAll(name).stream()
                .filter(Symbol.EnumSymbol.class::isInstance)
                .map(Symbol.EnumSymbol.class::cast)
                .findFirst();
    }

    /**
     * Returns the enum owning an unscoped foreign enumerator, if any.
     */
    public Optional<Symbol.EnumSymbol> resolveEnumMemberOwner(String member) {
        String owner = enumMemberOwners.get(member);
        return owner == null ? Optional.empty() : resolveEnum(owner);
    }

    /**
     * Returns all symbols in definition order.
     */
    public List<Symbol> getAllSymbols() {
        return symbols.values().stream().flatMap(List::stream).collect(Collectors.toList());
    }

    public int size() {
        return symbols.values().stream().mapToInt(List::size).sum();
    }

    private static String stripTag(String typeName) {
        String name = typeName.trim();
        for (String tag : new String[]{"struct ", "union ", "enum class ", "enum ", "class "}) {
            if (name.startsWith(tag)) {
                return name.substring(tag.length()).trim();
            }
        }
        return name;
    }
}
