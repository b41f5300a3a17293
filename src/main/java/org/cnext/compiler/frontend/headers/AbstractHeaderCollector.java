package org.cnext.compiler.frontend.headers;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.module.DependencyNode;
import org.cnext.compiler.frontend.semantics.BuiltinTypes;
import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.SymbolOrigin;
import org.cnext.compiler.frontend.semantics.SymbolTable;
import org.cnext.compiler.frontend.semantics.TypeInfo;
import org.cnext.compiler.frontend.semantics.TypeKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The C declaration grammar shared by the C and C++ collectors. It understands the
 * declarations that contribute interop symbols and skips everything else:
 * <ul>
 *   <li>object-like {@code #define} constants with a scalar value,</li>
 *   <li>{@code typedef} of structs, unions, enums, scalars and function pointers,</li>
 *   <li>named struct, union and enum definitions,</li>
 *   <li>function prototypes and definitions (bodies are skipped),</li>
 *   <li>{@code extern} and global variables, bit-fields and arrays.</li>
 * </ul>
 * Conditional-compilation lines are ignored. Subclasses add language-specific declarations
 * through {@link #parseLanguageExtension()}.
 */
public abstract class AbstractHeaderCollector implements IHeaderCollector {

    private static final Pattern DEFINE = Pattern.compile("^define\\s+(\\w+)(\\()?\\s*(.*)$");
    private static final Pattern INTEGER_LITERAL = Pattern.compile(
            "^([-+]?)(0[xX][0-9a-fA-F]+|0[bB][01]+|\\d+)([uU]?[lL]{0,2}|[lL]{1,2}[uU])$");
    private static final Pattern FLOAT_LITERAL = Pattern.compile(
            "^[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?([fF]|[lL])?$");
    private static final Pattern CHAR_LITERAL = Pattern.compile("^'(\\\\.|[^'\\\\])'$");
    private static final Pattern CAST_PREFIX = Pattern.compile("^\\(\\s*[A-Za-z_][\\w\\s]*\\)\\s*");

    private static final Set<String> SCALAR_KEYWORDS = Set.of(
            "signed", "unsigned", "short", "long", "int", "char", "float", "double", "void", "bool", "_Bool");
    private static final Set<String> IGNORED_QUALIFIERS = Set.of(
            "volatile", "inline", "__inline", "__inline__", "register", "restrict", "__restrict",
            "constexpr", "mutable", "virtual", "explicit", "friend", "typename", "thread_local",
            "_Noreturn", "__extension__", "noexcept");

    protected List<HeaderToken> tokens;
    protected int current;
    protected String fileName;
    protected SymbolTable symbolTable;
    protected DiagnosticsEngine diagnostics;
    protected final Deque<String> blocks = new ArrayDeque<>();
    private List<Symbol> collected;
    // Members of the most recently parsed enum body, for anonymous typedef'd enums.
    private Map<String, Long> pendingEnumMembers = new LinkedHashMap<>();

    /**
     * Parsed declaration specifiers.
     *
     * @param spelling The base type as written, e.g. {@code unsigned int} or {@code struct Point}.
     * @param type     The resolved base type.
     * @param isConst  True if a {@code const} qualifier was present.
     * @param isExtern True if the storage class was {@code extern}.
     * @param isStatic True if the storage class was {@code static}.
     */
    protected record TypeSpec(String spelling, TypeInfo type, boolean isConst, boolean isExtern, boolean isStatic) {}

    /**
     * A parsed declarator.
     *
     * @param name       The declared name, or empty for abstract declarators.
     * @param pointers   The number of {@code *} and {@code &} levels.
     * @param dimensions The array dimensions.
     * @param parameters The parameter list for function declarators, otherwise {@code null}.
     * @param variadic   True if the parameter list ends in {@code ...}.
     * @param bitField   The bit-field width, or -1.
     * @param line       The line of the name.
     */
    protected record Declarator(String name, int pointers, List<Integer> dimensions,
                                List<Symbol.Parameter> parameters, boolean variadic, int bitField, int line) {

        boolean isFunction() {
            return parameters != null;
        }
    }

    /**
     * The language tag applied to every collected symbol.
     */
    protected abstract SourceLanguage language();

    /**
     * Hook for declarations only the subclass grammar understands. Called at every
     * declaration boundary before the C rules are tried.
     *
     * @return true if the hook consumed a declaration.
     */
    protected boolean parseLanguageExtension() {
        return false;
    }

    /**
     * Hook for member-level constructs inside a struct or class body that are not fields.
     *
     * @return true if the hook consumed something.
     */
    protected boolean skipMemberExtension(String aggregateName) {
        return false;
    }

    /**
     * Returns the fully qualified form of a name declared at the current position.
     */
    protected String qualify(String name) {
        return name;
    }

    @Override
    public List<Symbol> collect(DependencyNode header, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        this.tokens = new HeaderLexer(header.rawContent()).scanTokens();
        this.current = 0;
        this.fileName = header.absolutePath();
        this.symbolTable = symbolTable;
        this.diagnostics = diagnostics;
        this.collected = new ArrayList<>();
        this.blocks.clear();

        while (!isAtEnd()) {
            int start = current;
            try {
                parseTopLevel();
            } catch (HeaderParseException e) {
                diagnostics.reportError(DiagnosticCode.HEADER_PARSE_ERROR, e.getMessage(), fileName, e.getLine(), 0);
                synchronize();
            }
            if (current == start) {
                advance();
            }
        }
        if (!blocks.isEmpty()) {
            diagnostics.reportError(DiagnosticCode.HEADER_PARSE_ERROR,
                    "Unexpected end of file: " + blocks.size() + " unclosed block(s)", fileName, peek().line(), 0);
        }
        return List.copyOf(collected);
    }

    // === Top level ===

    private void parseTopLevel() {
        HeaderToken token = peek();
        if (token.type() == HeaderToken.Type.DIRECTIVE) {
            advance();
            parseDirective(token);
            return;
        }
        if (match(";")) {
            return;
        }
        if (check("}")) {
            HeaderToken close = advance();
            if (blocks.isEmpty()) {
                throw new HeaderParseException("Unbalanced '}'", close.line());
            }
            blocks.pop();
            match(";");
            return;
        }
        if (check("extern") && peekAt(1).type() == HeaderToken.Type.STRING) {
            advance();
            advance();
            if (match("{")) {
                blocks.push("");
            }
            return;
        }
        if (parseLanguageExtension()) {
            return;
        }
        if (match("typedef")) {
            parseTypedef();
            return;
        }
        if (match("static_assert") || match("_Static_assert")) {
            skipBalanced("(", ")");
            match(";");
            return;
        }
        parseDeclaration();
    }

    private void parseDirective(HeaderToken token) {
        Matcher matcher = DEFINE.matcher(token.text());
        if (!matcher.matches() || matcher.group(2) != null) {
            // Conditional compilation, includes and function-like macros contribute nothing.
            return;
        }
        String name = matcher.group(1);
        String value = matcher.group(3).trim();
        scalarMacroType(value).ifPresent(type -> define(
                new Symbol.MacroConstantSymbol(name, origin(token.line()), type, value)));
    }

    /**
     * Determines the type of a scalar macro value, or empty if the value is not a scalar literal.
     */
    static Optional<TypeInfo> scalarMacroType(String rawValue) {
        String value = rawValue.trim();
        while (value.startsWith("(") && value.endsWith(")") && value.length() > 2) {
            String inner = value.substring(1, value.length() - 1).trim();
            if (inner.contains("(") || inner.contains(")")) {
                break;
            }
            value = inner;
        }
        Matcher cast = CAST_PREFIX.matcher(value);
        if (cast.find()) {
            String castType = value.substring(1, value.indexOf(')')).trim();
            Optional<TypeInfo> castTarget = BuiltinTypes.cScalar(castType);
            String rest = value.substring(cast.end()).trim();
            if (castTarget.isPresent() && scalarMacroType(rest).isPresent()) {
                return castTarget;
            }
            return Optional.empty();
        }
        Matcher integer = INTEGER_LITERAL.matcher(value);
        if (integer.matches()) {
            String suffix = integer.group(3).toLowerCase();
            boolean unsigned = suffix.contains("u");
            boolean wide = suffix.contains("ll") || parseMagnitude(integer.group(2)) > 0xFFFFFFFFL;
            String spelling = wide ? (unsigned ? "unsigned long long" : "long long")
                    : (unsigned ? "unsigned int" : "int");
            return BuiltinTypes.cScalar(spelling);
        }
        if (FLOAT_LITERAL.matcher(value).matches()) {
            return BuiltinTypes.cScalar(value.toLowerCase().endsWith("f") ? "float" : "double");
        }
        if (CHAR_LITERAL.matcher(value).matches()) {
            return BuiltinTypes.cScalar("char");
        }
        return Optional.empty();
    }

    private static long parseMagnitude(String digits) {
        try {
            if (digits.startsWith("0x") || digits.startsWith("0X")) {
                return Long.parseUnsignedLong(digits.substring(2), 16);
            }
            if (digits.startsWith("0b") || digits.startsWith("0B")) {
                return Long.parseUnsignedLong(digits.substring(2), 2);
            }
            return Long.parseUnsignedLong(digits);
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    // === typedef ===

    private void parseTypedef() {
        int line = previous().line();
        if (check("struct") || check("union") || check("enum")) {
            boolean isAggregateDefinition = peekAt(1).is("{")
                    || (peekAt(1).type() == HeaderToken.Type.IDENTIFIER && (peekAt(2).is("{") || peekAt(2).is(":")))
                    || (peekAt(1).is("class") && peekAt(2).type() == HeaderToken.Type.IDENTIFIER);
            if (isAggregateDefinition) {
                String keyword = advance().text();
                TypeInfo type = "enum".equals(keyword) ? parseEnumBody(line) : parseAggregateBody(keyword, line);
                parseTypedefNames(type, type.baseType().isEmpty() ? null : type.baseType());
                return;
            }
        }
        TypeSpec spec = parseTypeSpec();
        if (spec == null) {
            throw new HeaderParseException("Expected a type after 'typedef'", line);
        }
        parseTypedefNames(spec.type(), null);
    }

    private void parseTypedefNames(TypeInfo type, String tag) {
        do {
            Declarator declarator = parseDeclarator(false);
            if (declarator.name().isEmpty()) {
                throw new HeaderParseException("Expected a typedef name", peek().line());
            }
            String name = qualify(declarator.name());
            TypeInfo aliased = applyDeclarator(type, declarator);
            if (aliased.kind() == TypeKind.ENUM && declarator.pointers() == 0 && !declarator.isFunction()) {
                TypeInfo named = TypeInfo.scalar(name, TypeKind.ENUM, aliased.bitWidth());
                Optional<Symbol.EnumSymbol> owner = tag == null ? Optional.empty() : symbolTable.resolveEnum(tag);
                Map<String, Long> members = owner.map(Symbol.EnumSymbol::members).orElse(pendingEnumMembers);
                if (!name.equals(tag)) {
                    define(new Symbol.EnumSymbol(name, origin(declarator.line()), named, members));
                }
                // The name is a typedef, never an enum tag of its own.
                define(new Symbol.TypedefSymbol(name, origin(declarator.line()), named));
            } else if (aliased.kind() == TypeKind.STRUCT && declarator.pointers() == 0 && !aliased.isArray()
                    && !declarator.isFunction()) {
                TypeInfo named = new TypeInfo(name, TypeKind.STRUCT, aliased.bitWidth(), List.of(), false, false, 0,
                        aliased.structFields());
                if (tag == null) {
                    define(new Symbol.StructSymbol(name, origin(declarator.line()), named));
                }
                define(new Symbol.TypedefSymbol(name, origin(declarator.line()), named));
            } else {
                define(new Symbol.TypedefSymbol(name, origin(declarator.line()), aliased));
            }
        } while (match(","));
        consume(";", "Expected ';' after typedef");
    }

    // === Aggregates ===

    /**
     * Parses {@code [Tag] [: base] { fields }} after {@code struct}, {@code union} or
     * {@code class}. Defines a struct symbol when the aggregate is named.
     *
     * @return The aggregate type; its base type is the qualified tag, or empty if anonymous.
     */
    protected TypeInfo parseAggregateBody(String keyword, int line) {
        String tag = "";
        if (peek().type() == HeaderToken.Type.IDENTIFIER && !peek().is("{")) {
            tag = advance().text();
        }
        match("final");
        if (match(":")) {
            // Base classes.
            while (!check("{") && !isAtEnd()) {
                advance();
            }
        }
        consume("{", "Expected '{' in " + keyword + " definition");
        String qualifiedTag = tag.isEmpty() ? "" : qualify(tag);
        Map<String, TypeInfo> fields = new LinkedHashMap<>();
        boolean defaultPrivate = "class".equals(keyword);
        boolean visible = !defaultPrivate;
        while (!check("}")) {
            if (isAtEnd()) {
                throw new HeaderParseException("Unterminated " + keyword + " '" + tag + "'", line);
            }
            if (peek().type() == HeaderToken.Type.DIRECTIVE || match(";")) {
                if (peek().type() == HeaderToken.Type.DIRECTIVE) advance();
                continue;
            }
            if ((check("public") || check("private") || check("protected")) && peekAt(1).is(":")) {
                visible = advance().text().equals("public");
                advance();
                continue;
            }
            if (skipMemberExtension(tag)) {
                continue;
            }
            parseMember(fields, visible);
        }
        consume("}", "Expected '}'");
        TypeInfo type = "union".equals(keyword) ? union(qualifiedTag, fields) : TypeInfo.struct(qualifiedTag, fields);
        if (!qualifiedTag.isEmpty()) {
            define(new Symbol.StructSymbol(qualifiedTag, origin(line), type));
        }
        return type;
    }

    private void parseMember(Map<String, TypeInfo> fields, boolean visible) {
        if (match("typedef") || match("using") || match("friend") || match("static_assert")) {
            skipDeclaration();
            return;
        }
        if ((check("struct") || check("union")) && (peekAt(1).is("{")
                || (peekAt(1).type() == HeaderToken.Type.IDENTIFIER && peekAt(2).is("{")))) {
            String keyword = advance().text();
            TypeInfo nested = parseAggregateBody(keyword, previous().line());
            if (match(";")) {
                // Anonymous members are flattened into the enclosing aggregate.
                if (nested.baseType().isEmpty() && visible) {
                    fields.putAll(nested.structFields());
                }
                return;
            }
            parseFieldDeclarators(nested, fields, visible);
            return;
        }
        if (check("enum") && (peekAt(1).is("{") || peekAt(2).is("{") || peekAt(1).is("class"))) {
            advance();
            TypeInfo nested = parseEnumBody(previous().line());
            if (!match(";")) {
                parseFieldDeclarators(nested, fields, visible);
            }
            return;
        }
        TypeSpec spec = parseTypeSpec();
        if (spec == null) {
            throw new HeaderParseException("Unexpected '" + peek().text() + "' in aggregate body", peek().line());
        }
        if ((check("(") && !peekAt(1).is("*")) || check("~") || check("operator")) {
            // Constructor, destructor or operator.
            skipDeclaration();
            return;
        }
        if (spec.isStatic()) {
            skipDeclaration();
            return;
        }
        parseFieldDeclarators(spec.type(), fields, visible);
    }

    private void parseFieldDeclarators(TypeInfo base, Map<String, TypeInfo> fields, boolean visible) {
        do {
            Declarator declarator = parseDeclarator(true);
            if (declarator.isFunction()) {
                // Method: skip an inline body or trailing qualifiers.
                skipDeclaration();
                return;
            }
            if (match("=") || check("{")) {
                skipInitializer();
            }
            if (visible && !declarator.name().isEmpty()) {
                TypeInfo fieldType = applyDeclarator(base, declarator);
                if (declarator.bitField() > 0) {
                    fieldType = TypeInfo.scalar(fieldType.baseType(), fieldType.kind(), declarator.bitField());
                }
                fields.put(declarator.name(), fieldType);
            }
        } while (match(","));
        consume(";", "Expected ';' after field declaration");
    }

    private static TypeInfo union(String name, Map<String, TypeInfo> fields) {
        long width = 0;
        for (TypeInfo field : fields.values()) {
            width = Math.max(width, field.totalBits());
        }
        return new TypeInfo(name, TypeKind.STRUCT, (int) width, List.of(), false, false, 0, fields);
    }

    /**
     * Parses {@code [class] [Tag] [: type] { A [= v], ... }} after {@code enum}.
     */
    protected TypeInfo parseEnumBody(int line) {
        match("class");
        match("struct");
        String tag = "";
        if (peek().type() == HeaderToken.Type.IDENTIFIER) {
            tag = advance().text();
        }
        int width = 32;
        if (match(":")) {
            TypeSpec underlying = parseTypeSpec();
            if (underlying != null && underlying.type().bitWidth() > 0) {
                width = underlying.type().bitWidth();
            }
        }
        String qualifiedTag = tag.isEmpty() ? "" : qualify(tag);
        TypeInfo type = TypeInfo.scalar(qualifiedTag, TypeKind.ENUM, width);
        if (!check("{")) {
            // Opaque enum declaration or enum used as a type.
            return type;
        }
        advance();
        Map<String, Long> members = new LinkedHashMap<>();
        long next = 0;
        while (!check("}")) {
            if (isAtEnd()) {
                throw new HeaderParseException("Unterminated enum '" + tag + "'", line);
            }
            if (peek().type() == HeaderToken.Type.DIRECTIVE) {
                advance();
                continue;
            }
            HeaderToken name = consumeIdentifier("Expected enumerator name");
            long value = next;
            if (match("=")) {
                value = evaluateUntil(members, ",", "}");
            }
            members.put(name.text(), value);
            next = value + 1;
            if (!match(",")) {
                break;
            }
        }
        consume("}", "Expected '}' after enumerators");
        pendingEnumMembers = members;
        if (!qualifiedTag.isEmpty()) {
            define(new Symbol.EnumSymbol(qualifiedTag, origin(line), type, members));
        }
        return type;
    }

    // === Declarations ===

    private void parseDeclaration() {
        if ((check("struct") || check("union") || check("class"))
                && (peekAt(1).is("{") || (peekAt(1).type() == HeaderToken.Type.IDENTIFIER
                && (peekAt(2).is("{") || peekAt(2).is(":") && !peekAt(3).is(":"))))) {
            String keyword = advance().text();
            TypeInfo type = parseAggregateBody(keyword, previous().line());
            if (!match(";")) {
                parseDeclaratorList(new TypeSpec(type.baseType(), type, false, false, false));
            }
            return;
        }
        if (check("enum") && (peekAt(1).is("{") || peekAt(2).is("{") || peekAt(1).is("class")
                || peekAt(2).is(":"))) {
            advance();
            TypeInfo type = parseEnumBody(previous().line());
            if (!match(";")) {
                parseDeclaratorList(new TypeSpec(type.baseType(), type, false, false, false));
            }
            return;
        }
        TypeSpec spec = parseTypeSpec();
        if (spec == null) {
            throw new HeaderParseException("Unexpected '" + peek().text() + "'", peek().line());
        }
        if (match(";")) {
            // Forward declaration.
            return;
        }
        parseDeclaratorList(spec);
    }

    private void parseDeclaratorList(TypeSpec spec) {
        do {
            Declarator declarator = parseDeclarator(false);
            if (declarator.name().isEmpty()) {
                throw new HeaderParseException("Expected a declarator name", peek().line());
            }
            if (declarator.isFunction()) {
                skipFunctionTrailer();
                boolean hasBody = check("{");
                if (hasBody) {
                    skipBalanced("{", "}");
                }
                TypeInfo returnType = declarator.pointers() > 0 ? pointerTo(spec.type(), declarator.pointers())
                        : spec.type();
                define(new Symbol.FunctionSymbol(qualify(declarator.name()), origin(declarator.line()), returnType,
                        declarator.parameters(), !hasBody, declarator.variadic()));
                if (hasBody) {
                    return;
                }
                continue;
            }
            if (match("=") || check("{")) {
                skipInitializer();
            }
            if (!spec.isStatic()) {
                TypeInfo type = applyDeclarator(spec.type(), declarator).withConst(spec.isConst());
                define(new Symbol.VariableSymbol(qualify(declarator.name()), origin(declarator.line()), type,
                        spec.isExtern()));
            }
        } while (match(","));
        consume(";", "Expected ';' after declaration");
    }

    private void skipFunctionTrailer() {
        while (check("const") || check("noexcept") || check("override") || check("final")
                || check("__attribute__") || check("throw") || check("->")) {
            HeaderToken token = advance();
            if ((token.is("__attribute__") || token.is("throw") || token.is("noexcept")) && check("(")) {
                skipBalanced("(", ")");
            }
            if (token.is("->")) {
                parseTypeSpec();
                while (match("*") || match("&")) {
                    // Pointer levels of the trailing return type.
                }
            }
        }
        if (match("=")) {
            // = 0, = default, = delete
            advance();
        }
    }

    // === Types ===

    /**
     * Parses declaration specifiers: storage class, qualifiers and the base type.
     *
     * @return The parsed specifiers, or {@code null} if no type is present.
     */
    protected TypeSpec parseTypeSpec() {
        boolean isConst = false;
        boolean isExtern = false;
        boolean isStatic = false;
        List<String> scalarWords = new ArrayList<>();
        String named = null;
        TypeInfo namedType = null;
        while (!isAtEnd()) {
            HeaderToken token = peek();
            if (token.type() != HeaderToken.Type.IDENTIFIER && !token.is("::")) {
                break;
            }
            String text = token.text();
            if ("const".equals(text)) {
                isConst = true;
                advance();
            } else if ("extern".equals(text)) {
                isExtern = true;
                advance();
            } else if ("static".equals(text)) {
                isStatic = true;
                advance();
            } else if (IGNORED_QUALIFIERS.contains(text)) {
                advance();
            } else if ("__attribute__".equals(text) || "__declspec".equals(text) || "alignas".equals(text)) {
                advance();
                if (check("(")) {
                    skipBalanced("(", ")");
                }
            } else if (SCALAR_KEYWORDS.contains(text) && named == null) {
                scalarWords.add(text);
                advance();
            } else if (named == null && scalarWords.isEmpty()
                    && ("struct".equals(text) || "union".equals(text) || "enum".equals(text) || "class".equals(text))) {
                advance();
                match("class");
                String tag = parseQualifiedName();
                named = text + " " + tag;
                namedType = resolveNamedType(tag, text);
            } else if (named == null && scalarWords.isEmpty()) {
                String name = parseQualifiedName();
                named = name;
                namedType = resolveNamedType(name, null);
            } else {
                break;
            }
        }
        if (named != null) {
            return new TypeSpec(named, namedType, isConst, isExtern, isStatic);
        }
        if (scalarWords.isEmpty()) {
            return null;
        }
        if (scalarWords.stream().allMatch(w -> w.equals("signed") || w.equals("unsigned")
                || w.equals("short") || w.equals("long"))) {
            scalarWords.add("int");
        }
        String spelling = String.join(" ", scalarWords);
        TypeInfo type = BuiltinTypes.cScalar(spelling)
                .or(() -> BuiltinTypes.cScalar(String.join(" ", reorderScalar(scalarWords))))
                .orElse(TypeInfo.scalar(spelling, TypeKind.SIGNED, 32));
        return new TypeSpec(spelling, type, isConst, isExtern, isStatic);
    }

    private static List<String> reorderScalar(List<String> words) {
        List<String> ordered = new ArrayList<>();
        for (String keyword : List.of("signed", "unsigned", "short", "long", "int", "char", "double")) {
            for (String word : words) {
                if (word.equals(keyword)) {
                    ordered.add(word);
                }
            }
        }
        return ordered;
    }

    /**
     * Parses a possibly qualified, possibly templated name such as {@code ns::Vec<int>}.
     */
    protected String parseQualifiedName() {
        StringBuilder name = new StringBuilder();
        if (match("::")) {
            name.append("::");
        }
        name.append(consumeIdentifier("Expected a type name").text());
        while (true) {
            if (check("<") && language() == SourceLanguage.CPP) {
                skipBalanced("<", ">");
            }
            if (check("::") && peekAt(1).type() == HeaderToken.Type.IDENTIFIER) {
                advance();
                name.append("::").append(advance().text());
            } else {
                break;
            }
        }
        String result = name.toString();
        return result.startsWith("::") ? result.substring(2) : result;
    }

    /**
     * Resolves a type name through the symbols collected so far.
     */
    protected TypeInfo resolveNamedType(String name, String tagKeyword) {
        Optional<TypeInfo> resolved = symbolTable.resolveType(name);
        if (resolved.isEmpty() && !qualify(name).equals(name)) {
            resolved = symbolTable.resolveType(qualify(name));
        }
        if (resolved.isPresent()) {
            return resolved.get();
        }
        if ("enum".equals(tagKeyword)) {
            return TypeInfo.scalar(name, TypeKind.ENUM, 32);
        }
        if (tagKeyword != null && !"enum".equals(tagKeyword)) {
            return TypeInfo.struct(name, Map.of());
        }
        return TypeInfo.scalar(name, TypeKind.OPAQUE, 0);
    }

    protected static TypeInfo pointerTo(TypeInfo base, int levels) {
        return TypeInfo.scalar(base.baseType() + "*".repeat(levels), TypeKind.POINTER, 32);
    }

    private static TypeInfo applyDeclarator(TypeInfo base, Declarator declarator) {
        if (declarator.isFunction()) {
            return TypeInfo.scalar(base.baseType() + "(*)()", TypeKind.POINTER, 32);
        }
        TypeInfo type = declarator.pointers() > 0 ? pointerTo(base, declarator.pointers()) : base;
        return declarator.dimensions().isEmpty() ? type : type.withArrayDimensions(declarator.dimensions());
    }

    // === Declarators ===

    /**
     * Parses a declarator: pointer levels, the name (or a parenthesized function-pointer
     * name), array dimensions, a parameter list and, for fields, a bit-field width.
     */
    protected Declarator parseDeclarator(boolean allowBitField) {
        int pointers = 0;
        while (check("*") || check("&") || check("&&") || check("const") || check("volatile")
                || check("restrict") || check("__restrict")) {
            HeaderToken token = advance();
            if (token.is("*") || token.is("&") || token.is("&&")) {
                pointers++;
            }
        }
        String name = "";
        int line = peek().line();
        boolean functionPointer = false;
        if (check("(") && (peekAt(1).is("*") || peekAt(1).is("^") || peekAt(1).is("&"))) {
            // Function pointer: ( * name ) ( params )
            advance();
            while (match("*") || match("^") || match("&") || match("const")) {
                // Pointer levels inside the parentheses.
            }
            if (peek().type() == HeaderToken.Type.IDENTIFIER) {
                line = peek().line();
                name = advance().text();
            }
            while (check("[")) {
                skipBalanced("[", "]");
            }
            consume(")", "Expected ')' in function pointer declarator");
            if (check("(")) {
                skipBalanced("(", ")");
            }
            functionPointer = true;
        } else if (peek().type() == HeaderToken.Type.IDENTIFIER && !peek().is("operator")) {
            line = peek().line();
            name = parseQualifiedName();
        }
        List<Integer> dimensions = new ArrayList<>();
        List<Symbol.Parameter> parameters = null;
        boolean variadic = false;
        if (!functionPointer && check("(")) {
            advance();
            parameters = new ArrayList<>();
            variadic = parseParameters(parameters);
        }
        while (match("[")) {
            dimensions.add(check("]") ? 0 : (int) evaluateUntil(Map.of(), "]"));
            consume("]", "Expected ']'");
        }
        int bitField = -1;
        if (allowBitField && match(":")) {
            bitField = (int) evaluateUntil(Map.of(), ";", ",");
        }
        if (functionPointer) {
            pointers = Math.max(pointers, 1);
        }
        return new Declarator(name, pointers, dimensions, parameters, variadic, bitField, line);
    }

    private boolean parseParameters(List<Symbol.Parameter> parameters) {
        boolean variadic = false;
        if (check("void") && peekAt(1).is(")")) {
            advance();
        }
        while (!check(")")) {
            if (isAtEnd()) {
                throw new HeaderParseException("Unterminated parameter list", previous().line());
            }
            if (match("...")) {
                variadic = true;
                continue;
            }
            TypeSpec spec = parseTypeSpec();
            if (spec == null) {
                throw new HeaderParseException("Expected a parameter type", peek().line());
            }
            Declarator declarator = parseDeclarator(false);
            if (match("=")) {
                skipInitializer();
            }
            TypeInfo type = applyDeclarator(spec.type(), declarator).withConst(spec.isConst());
            parameters.add(new Symbol.Parameter(declarator.name(), type, declarator.pointers() > 0));
            if (!match(",")) {
                break;
            }
        }
        consume(")", "Expected ')' after parameters");
        return variadic;
    }

    // === Constant expressions ===

    /**
     * Evaluates a small integer constant expression ({@code + - * / << |}, parentheses,
     * literals, macro constants and enumerators) up to, but not including, a terminator.
     * Unknown operands evaluate to 0.
     */
    private long evaluateUntil(Map<String, Long> localEnumerators, String... terminators) {
        List<HeaderToken> expression = new ArrayList<>();
        int depth = 0;
        while (!isAtEnd()) {
            HeaderToken token = peek();
            if (depth == 0 && isTerminator(token, terminators)) {
                break;
            }
            if (token.is("(")) depth++;
            if (token.is(")")) {
                if (depth == 0) break;
                depth--;
            }
            expression.add(advance());
        }
        return new ConstantEvaluator(expression, name -> lookupConstant(name, localEnumerators)).evaluate();
    }

    private static boolean isTerminator(HeaderToken token, String[] terminators) {
        for (String terminator : terminators) {
            if (token.is(terminator)) {
                return true;
            }
        }
        return false;
    }

    private Optional<Long> lookupConstant(String name, Map<String, Long> localEnumerators) {
        if (localEnumerators.containsKey(name)) {
            return Optional.of(localEnumerators.get(name));
        }
        Optional<Symbol> symbol = symbolTable.resolve(name);
        if (symbol.isPresent() && symbol.get() instanceof Symbol.MacroConstantSymbol macro) {
            return ConstantEvaluator.parseLiteral(macro.value());
        }
        return symbolTable.resolveEnumMemberOwner(name).map(e -> e.members().get(name));
    }

    // === Token helpers ===

    protected void define(Symbol symbol) {
        if (symbolTable.define(symbol)) {
            collected.add(symbol);
        }
    }

    protected SymbolOrigin origin(int line) {
        return new SymbolOrigin(fileName, line, language());
    }

    /**
     * Skips to the end of the current declaration: the next {@code ;} at nesting depth 0, or
     * a balanced brace block with an optional trailing {@code ;}.
     */
    protected void skipDeclaration() {
        while (!isAtEnd()) {
            if (check("{")) {
                skipBalanced("{", "}");
                match(";");
                return;
            }
            if (check("(")) {
                skipBalanced("(", ")");
                continue;
            }
            if (check("}")) {
                return;
            }
            if (advance().is(";")) {
                return;
            }
        }
    }

    private void skipInitializer() {
        while (!isAtEnd() && !check(",") && !check(";")) {
            if (check("{")) {
                skipBalanced("{", "}");
            } else if (check("(")) {
                skipBalanced("(", ")");
            } else {
                advance();
            }
        }
    }

    private void synchronize() {
        skipDeclaration();
    }

    protected void skipBalanced(String open, String close) {
        HeaderToken start = consume(open, "Expected '" + open + "'");
        int depth = 1;
        while (depth > 0) {
            if (isAtEnd()) {
                throw new HeaderParseException("Unbalanced '" + open + "'", start.line());
            }
            HeaderToken token = advance();
            if (token.is(open)) {
                depth++;
            } else if (token.is(close)) {
                depth--;
            } else if (">".equals(close) && token.is(">>")) {
                depth -= 2;
            }
        }
    }

    protected boolean match(String text) {
        if (check(text)) {
            advance();
            return true;
        }
        return false;
    }

    protected boolean check(String text) {
        return !isAtEnd() && peek().is(text);
    }

    protected HeaderToken consume(String text, String message) {
        if (check(text)) {
            return advance();
        }
        throw new HeaderParseException(message + ", found '" + peek().text() + "'", peek().line());
    }

    protected HeaderToken consumeIdentifier(String message) {
        if (peek().type() == HeaderToken.Type.IDENTIFIER) {
            return advance();
        }
        throw new HeaderParseException(message + ", found '" + peek().text() + "'", peek().line());
    }

    protected HeaderToken advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    protected HeaderToken peek() {
        return tokens.get(current);
    }

    protected HeaderToken peekAt(int offset) {
        int index = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    protected HeaderToken previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    protected boolean isAtEnd() {
        return peek().type() == HeaderToken.Type.END_OF_FILE;
    }
}
