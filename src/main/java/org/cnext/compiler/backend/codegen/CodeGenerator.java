package org.cnext.compiler.backend.codegen;

import org.cnext.compiler.CompilationContext;
import org.cnext.compiler.backend.header.HeaderGenerator;
import org.cnext.compiler.backend.header.HeaderModel;
import org.cnext.compiler.backend.register.RegisterAccess;
import org.cnext.compiler.backend.register.RegisterBinding;
import org.cnext.compiler.backend.register.RegisterField;
import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.io.SourceDiscovery;
import org.cnext.compiler.frontend.parser.ast.Declaration;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.Program;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;
import org.cnext.compiler.frontend.parser.ast.Statement;
import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.SymbolOrigin;
import org.cnext.compiler.frontend.semantics.SymbolTable;
import org.cnext.compiler.frontend.semantics.TypeInfo;
import org.cnext.compiler.frontend.semantics.TypeKind;
import org.cnext.compiler.frontend.semantics.analysis.FunctionSignatureRegistry;
import org.cnext.compiler.frontend.semantics.analysis.ModificationAnalyzer;
import org.cnext.compiler.frontend.semantics.flow.FlowAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Generates the {@code .c} and {@code .h} text of one flattened C-Next program.
 *
 * <p>Declarations are processed in file order. Each one enters the symbol table as generation
 * reaches it, so a name is only visible below its definition. Before a function body is
 * emitted its parameters are analyzed for mutation and the decisions are recorded; the
 * function's signature is then registered, the body is checked by the flow analyses, and
 * finally emitted. Definition and prototype are printed from the same parameter decisions.</p>
 */
public class CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerator.class);

    private final SymbolTable symbolTable;
    private final DiagnosticsEngine diagnostics;
    private final FunctionSignatureRegistry signatures;
    private final ConstantFolder folder;
    private final CompilationContext context;
    private final TypeResolver types;
    private final ExpressionGenerator expressions;
    private final StatementGenerator statements;
    private final ModificationAnalyzer modifications;
    private final FlowAnalyzer flow;
    private final HeaderGenerator headerGenerator = new HeaderGenerator();
    private final String headerExtension;

    public CodeGenerator(CompilationContext context) {
        this(context, ".h");
    }

    /**
     * @param headerExtension The extension of generated headers, including the dot.
     */
    public CodeGenerator(CompilationContext context, String headerExtension) {
        this.context = context;
        this.headerExtension = headerExtension;
        this.symbolTable = context.getSymbolTable();
        this.diagnostics = context.getDiagnostics();
        this.signatures = context.getSignatures();
        this.folder = context.getConstants();
        this.types = new TypeResolver(symbolTable, context.getRegisters(), folder);
        LiteralGenerator literals = new LiteralGenerator(diagnostics);
        BitAccessGenerator bits = new BitAccessGenerator(folder, diagnostics);
        ArithmeticChecker arithmetic = new ArithmeticChecker(types, folder, diagnostics);
        this.expressions = new ExpressionGenerator(symbolTable, context.getRegisters(), types, literals, bits,
                arithmetic, diagnostics);
        SwitchGenerator switches = new SwitchGenerator(symbolTable, types, expressions, folder, diagnostics);
        this.statements = new StatementGenerator(types, expressions, bits, switches, arithmetic, folder,
                diagnostics);
        this.modifications = new ModificationAnalyzer(signatures, symbolTable, diagnostics);
        this.flow = FlowAnalyzer.withDefaultRules(symbolTable, signatures, diagnostics);
    }

    /**
     * Generates one unit.
     *
     * @param program  The flattened program.
     * @param baseName The output file name without extension.
     * @return the generated source and header text.
     */
    public GeneratedUnit generate(Program program, String baseName) {
        Set<String> declared = new LinkedHashSet<>();
        for (Declaration declaration : program.declarations()) {
            if (!(declaration instanceof Declaration.IncludeDecl)) {
                declared.add(declaration.name());
            }
        }
        expressions.beginUnit(declared);

        HeaderModel header = new HeaderModel();
        CodeWriter body = new CodeWriter();
        for (Declaration declaration : program.declarations()) {
            expressions.defined(declaration.name());
            if (declaration instanceof Declaration.IncludeDecl include) {
                header.addInclude(includeLine(include));
            } else if (declaration instanceof Declaration.StructDecl struct) {
                struct(struct, program.fileName(), header);
            } else if (declaration instanceof Declaration.EnumDecl enumDecl) {
                enumeration(enumDecl, program.fileName(), header);
            } else if (declaration instanceof Declaration.RegisterDecl register) {
                register(register, header);
            } else if (declaration instanceof Declaration.VariableDecl variable) {
                global(variable, program.fileName(), header, body);
            } else if (declaration instanceof Declaration.FunctionDecl function) {
                function(function, program.fileName(), header, body);
            }
        }

        StringBuilder source = new StringBuilder();
        source.append("#include \"").append(baseName).append(headerExtension).append("\"\n");
        for (String required : expressions.requiredHeaders()) {
            source.append("#include <").append(required).append(">\n");
        }
        if (!body.isEmpty()) {
            source.append('\n').append(body);
        }
        log.debug("Generated {} ({} declarations)", baseName, program.declarations().size());
        String headerText = headerGenerator.render(baseName + headerExtension, header);
        return new GeneratedUnit(baseName, source.toString(), headerText);
    }

    // === Includes and types ===

    private String includeLine(Declaration.IncludeDecl include) {
        if (include.isCNextInclude()) {
            String target = include.target();
            return "#include \"" + target.substring(0, target.length() - SourceDiscovery.CNEXT_EXTENSION.length())
                    + headerExtension + "\"";
        }
        return include.angled()
                ? "#include <" + include.target() + ">"
                : "#include \"" + include.target() + "\"";
    }

    private void struct(Declaration.StructDecl struct, String file, HeaderModel header) {
        Map<String, TypeInfo> fields = new LinkedHashMap<>();
        CodeWriter out = new CodeWriter();
        out.open("typedef struct " + struct.name() + " {");
        for (Declaration.Field field : struct.fields()) {
            TypeInfo type = statements.resolveType(field.type());
            if (fields.put(field.name(), type) != null) {
                report(DiagnosticCode.DUPLICATE_DEFINITION,
                        "Field '" + field.name() + "' is already defined in '" + struct.name() + "'",
                        field.position(), null);
            }
            out.line(types.cTypeName(field.type()) + " " + field.name() + TypeResolver.dimensionSuffix(type) + ";");
        }
        out.close("} " + struct.name() + ";");
        symbolTable.define(new Symbol.StructSymbol(struct.name(), origin(file, struct.position()),
                TypeInfo.struct(struct.name(), fields)));
        header.addType(out.toString());
    }

    private void enumeration(Declaration.EnumDecl enumDecl, String file, HeaderModel header) {
        Map<String, Long> members = new LinkedHashMap<>();
        long next = 0;
        CodeWriter out = new CodeWriter();
        out.open("typedef enum {");
        List<Declaration.EnumMember> declared = enumDecl.members();
        for (int i = 0; i < declared.size(); i++) {
            Declaration.EnumMember member = declared.get(i);
            if (member.value() != null) {
                OptionalLong value = folder.fold(member.value());
                if (value.isPresent()) {
                    next = value.getAsLong();
                } else {
                    report(DiagnosticCode.SYNTAX_ERROR, "Value of '" + member.name() + "' must be a constant",
                            member.position(), null);
                }
            }
            if (members.containsKey(member.name())) {
                report(DiagnosticCode.DUPLICATE_DEFINITION,
                        "Variant '" + member.name() + "' is already defined in '" + enumDecl.name() + "'",
                        member.position(), null);
            }
            members.put(member.name(), next);
            out.line(enumDecl.name() + "_" + member.name() + " = " + next + (i < declared.size() - 1 ? "," : ""));
            next++;
        }
        out.close("} " + enumDecl.name() + ";");
        symbolTable.define(new Symbol.EnumSymbol(enumDecl.name(), origin(file, enumDecl.position()),
                TypeInfo.scalar(enumDecl.name(), TypeKind.ENUM, 32), members));
        header.addType(out.toString());
    }

    private void register(Declaration.RegisterDecl register, HeaderModel header) {
        String base = expressions.generate(register.baseAddress(), null);
        Map<String, RegisterField> fields = new LinkedHashMap<>();
        List<String> macros = new ArrayList<>();
        for (Declaration.RegisterMember member : register.members()) {
            TypeInfo type = statements.resolveType(member.type());
            if (!type.kind().isInteger() || type.isArray()) {
                report(DiagnosticCode.SYNTAX_ERROR, "Register field '" + member.name() + "' must have an integer type",
                        member.position(), null);
            }
            String cType = types.cTypeName(member.type());
            String offset = expressions.generate(member.offset(), null);
            RegisterField field = new RegisterField(member.name(), type, cType,
                    RegisterAccess.fromKeyword(member.access()), offset);
            fields.put(member.name(), field);
            macros.add("#define " + register.name() + "_" + member.name() + " (*(volatile " + cType + "*)(" + base
                    + " + " + offset + "))");
        }
        if (!context.getRegisters().register(new RegisterBinding(register.name(), base, fields))) {
            report(DiagnosticCode.DUPLICATE_DEFINITION, "Register '" + register.name() + "' is already defined",
                    register.position(), null);
            return;
        }
        macros.forEach(header::addRegisterMacro);
    }

    // === Globals ===

    private void global(Declaration.VariableDecl declaration, String file, HeaderModel header, CodeWriter body) {
        Statement.VariableDeclaration variable = declaration.variable();
        TypeInfo type = statements.resolveType(variable.type()).withConst(variable.isConst());
        String cType = types.cTypeName(variable.type());
        String name = variable.name();
        boolean isPrivate = declaration.scopeName() != null && !declaration.isPublic();
        String declarator = (variable.isConst() ? "const " : "") + cType + " " + name
                + TypeResolver.dimensionSuffix(type);

        String value = globalInitializer(variable.initializer(), type);
        symbolTable.define(new Symbol.VariableSymbol(name, origin(file, variable.position()), type, false));
        if (variable.isConst() && variable.initializer() != null && type.kind().isInteger() && !type.isArray()) {
            folder.fold(variable.initializer()).ifPresent(v -> folder.define(name, v));
        }

        body.line((isPrivate ? "static " : "") + declarator + " = " + value + ";");
        if (!isPrivate) {
            header.addExtern("extern " + declarator + ";");
        }
    }

    private String globalInitializer(Expression initializer, TypeInfo type) {
        if (initializer == null) {
            if (type.isString() && !type.isArray()) {
                return "\"\"";
            }
            return type.isArray() || type.kind() == TypeKind.STRUCT ? "{0}" : "0";
        }
        if (type.isString() && !type.isArray() && initializer instanceof Expression.Literal literal
                && literal.kind() == Expression.LiteralKind.STRING) {
            statements.checkStringLiteral(literal, type);
            return literal.text();
        }
        if (type.isArray()) {
            return expressions.generate(initializer, type.elementType());
        }
        return expressions.generateValue(initializer, type);
    }

    // === Functions ===

    private void function(Declaration.FunctionDecl function, String file, HeaderModel header, CodeWriter body) {
        modifications.analyzeFunction(function);
        List<FunctionSignatureRegistry.ParameterMode> modes = signatures.modes(function.name()).orElse(List.of());

        TypeInfo returnType = statements.resolveType(function.returnType());
        List<Symbol.Parameter> parameters = new ArrayList<>();
        for (int i = 0; i < function.parameters().size(); i++) {
            Declaration.Parameter parameter = function.parameters().get(i);
            FunctionSignatureRegistry.ParameterMode mode = i < modes.size() ? modes.get(i) : null;
            boolean mutated = mode != null && mode.mutated();
            TypeInfo type = statements.resolveType(parameter.type())
                    .withConst(!mutated)
                    .withAutoConst(mode != null && mode.isAutoConst());
            boolean scalar = !type.isArray() && !type.isString() && !type.isStruct() && type.kind() != TypeKind.OPAQUE;
            parameters.add(new Symbol.Parameter(parameter.name(), type, (mutated && scalar) || type.isStruct()));
        }
        symbolTable.define(new Symbol.FunctionSymbol(function.name(), origin(file, function.position()),
                returnType, parameters, false, false));

        flow.analyzeFunction(function);

        String signature = signature(function, returnType, parameters);
        boolean isPrivate = function.scopeName() != null && !function.isPublic();
        if (!isPrivate && !function.isMain()) {
            header.addPrototype(signature + ";");
        }

        types.pushScope();
        folder.beginFunction();
        for (int i = 0; i < parameters.size(); i++) {
            Symbol.Parameter parameter = parameters.get(i);
            folder.defineLocal(parameter.name(), OptionalLong.empty());
            types.declareLocal(new TypeResolver.LocalVariable(parameter.name(), parameter.type(),
                    types.cTypeName(function.parameters().get(i).type()), storageOf(parameter)));
        }
        if (!body.isEmpty()) {
            body.blankLine();
        }
        body.open((isPrivate ? "static " : "") + signature + " {");
        statements.functionBody(function.body(), returnType, function.isMain(), body);
        if (function.isMain() && returnType.kind() == TypeKind.VOID && !endsWithReturn(function)) {
            body.line("return 0;");
        }
        body.close("}");
        types.popScope();
    }

    private static boolean endsWithReturn(Declaration.FunctionDecl function) {
        List<Statement> body = function.body().statements();
        return !body.isEmpty() && body.get(body.size() - 1) instanceof Statement.Return;
    }

    private static TypeResolver.Storage storageOf(Symbol.Parameter parameter) {
        TypeInfo type = parameter.type();
        if (type.isArray() || type.isString()) {
            return TypeResolver.Storage.ARRAY;
        }
        if (type.isStruct()) {
            return TypeResolver.Storage.STRUCT_POINTER;
        }
        return parameter.byReference() ? TypeResolver.Storage.POINTER : TypeResolver.Storage.VALUE;
    }

    /**
     * Prints a function signature from the recorded parameter decisions. Used for both the
     * definition and the prototype.
     */
    private String signature(Declaration.FunctionDecl function, TypeInfo returnType,
                             List<Symbol.Parameter> parameters) {
        if (function.isMain()) {
            return "int main(void)";
        }
        List<String> declarators = new ArrayList<>();
        for (int i = 0; i < parameters.size(); i++) {
            declarators.add(parameterDeclarator(parameters.get(i), types.cTypeName(function.parameters().get(i).type())));
        }
        String returnC = returnType.isString() ? "const char*" : types.cTypeName(function.returnType());
        return returnC + " " + function.name() + "(" + (declarators.isEmpty() ? "void" : String.join(", ", declarators))
                + ")";
    }

    private static String parameterDeclarator(Symbol.Parameter parameter, String cType) {
        TypeInfo type = parameter.type();
        String name = parameter.name();
        String qualifier = type.isConst() ? "const " : "";
        if (type.isString() && !type.isArray()) {
            return qualifier + "char* " + name;
        }
        if (type.isArray()) {
            return qualifier + cType + " " + name + TypeResolver.dimensionSuffix(type);
        }
        if (type.isStruct()) {
            return qualifier + cType + "* " + name;
        }
        if (type.kind() == TypeKind.OPAQUE) {
            return cType + "* " + name;
        }
        return parameter.byReference() ? cType + "* " + name : qualifier + cType + " " + name;
    }

    private static SymbolOrigin origin(String file, SourcePosition position) {
        return new SymbolOrigin(file, position.line(), SourceLanguage.CNEXT);
    }

    private void report(DiagnosticCode code, String message, SourcePosition position, String suggestion) {
        diagnostics.reportError(code, message, position.fileName(), position.line(), position.column(), suggestion);
    }
}
