package org.cnext.compiler.frontend.parser;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.lexer.Token;
import org.cnext.compiler.frontend.lexer.TokenType;
import org.cnext.compiler.frontend.parser.ast.Declaration;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.Program;
import org.cnext.compiler.frontend.parser.ast.SourcePosition;
import org.cnext.compiler.frontend.parser.ast.Statement;
import org.cnext.compiler.frontend.parser.ast.TypeRef;
import org.cnext.compiler.frontend.semantics.BuiltinTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recursive-descent parser for C-Next. Keyword-introduced declarations are delegated to the
 * handlers of a {@link DeclarationHandlerRegistry}; functions, globals, statements and
 * expressions are parsed here.
 *
 * <p>Syntax errors are reported to the {@link DiagnosticsEngine} and the parser resynchronizes
 * at the next statement or declaration boundary, so one run reports as many errors as possible.</p>
 */
public class Parser implements ParsingContext {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    /**
     * Callee name of the pseudo-call that represents a brace initializer {@code {a, b, c}}.
     */
    public static final String ARRAY_INITIALIZER = "{}";

    private static final Map<TokenType, String> BINARY_SPELLING = Map.ofEntries(
            Map.entry(TokenType.OR_OR, "||"), Map.entry(TokenType.AND_AND, "&&"),
            Map.entry(TokenType.PIPE, "|"), Map.entry(TokenType.CARET, "^"), Map.entry(TokenType.AMP, "&"),
            Map.entry(TokenType.EQUAL, "="), Map.entry(TokenType.NOT_EQUAL, "!="),
            Map.entry(TokenType.LESS, "<"), Map.entry(TokenType.LESS_EQUAL, "<="),
            Map.entry(TokenType.GREATER, ">"), Map.entry(TokenType.GREATER_EQUAL, ">="),
            Map.entry(TokenType.SHL, "<<"), Map.entry(TokenType.SHR, ">>"),
            Map.entry(TokenType.PLUS, "+"), Map.entry(TokenType.MINUS, "-"),
            Map.entry(TokenType.STAR, "*"), Map.entry(TokenType.SLASH, "/"), Map.entry(TokenType.PERCENT, "%"));

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final DeclarationHandlerRegistry declarationRegistry;
    private int current = 0;

    /**
     * Constructs a parser with the built-in declaration handlers.
     * @param tokens      The tokens of one source file, terminated by END_OF_FILE.
     * @param diagnostics The engine for reporting syntax errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this(tokens, diagnostics, DeclarationHandlerRegistry.initialize());
    }

    /**
     * Constructs a parser with a custom declaration handler registry.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, DeclarationHandlerRegistry declarationRegistry) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.declarationRegistry = declarationRegistry;
    }

    /**
     * Parses the whole token stream.
     * @return The program. Declarations that failed to parse are omitted.
     */
    public Program parse() {
        String fileName = tokens.isEmpty() ? "" : tokens.get(0).fileName();
        List<Declaration> declarations = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.DIRECTIVE)) {
                continue;
            }
            try {
                declarations.add(declaration());
            } catch (ParseException e) {
                synchronizeDeclaration();
            }
        }
        log.debug("Parsed {} top-level declarations from {}", declarations.size(), fileName);
        return new Program(fileName, declarations);
    }

    // === Declarations ===

    private Declaration declaration() {
        Optional<IDeclarationHandler> handler = declarationRegistry.get(peek().type());
        if (handler.isPresent()) {
            return handler.get().parse(this);
        }
        return functionOrVariable(true, null);
    }

    @Override
    public Declaration functionOrVariable(boolean isPublic, String scopeName) {
        boolean isConst = match(TokenType.CONST);
        TypeRef type = typeRef();
        Token name = consume(TokenType.IDENTIFIER, "Expected a name after type '" + type + "'.");
        if (!isConst && match(TokenType.LEFT_PAREN)) {
            List<Declaration.Parameter> parameters = parameters();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters.");
            Statement.Block body = block();
            return new Declaration.FunctionDecl(type, name.text(), parameters, body, isPublic, scopeName,
                    SourcePosition.of(name));
        }
        Statement.VariableDeclaration variable = variableRest(type, name, isConst);
        consume(TokenType.SEMICOLON, "Expected ';' after variable declaration.");
        return new Declaration.VariableDecl(variable, isPublic, scopeName);
    }

    private List<Declaration.Parameter> parameters() {
        List<Declaration.Parameter> parameters = new ArrayList<>();
        if (check(TokenType.RIGHT_PAREN)) {
            return parameters;
        }
        do {
            boolean isConst = match(TokenType.CONST);
            TypeRef type = typeRef();
            Token name = consume(TokenType.IDENTIFIER, "Expected a parameter name.");
            type = type.withArrayDimensions(arrayDimensions());
            parameters.add(new Declaration.Parameter(type, name.text(), isConst, SourcePosition.of(name)));
        } while (match(TokenType.COMMA));
        return parameters;
    }

    private Statement.VariableDeclaration variableRest(TypeRef type, Token name, boolean isConst) {
        TypeRef declared = type.withArrayDimensions(arrayDimensions());
        Expression initializer = null;
        if (match(TokenType.ASSIGN)) {
            initializer = check(TokenType.LEFT_BRACE) ? arrayInitializer() : expression();
        }
        return new Statement.VariableDeclaration(declared, name.text(), initializer, isConst,
                SourcePosition.of(name));
    }

    // Array initializers are kept as a call to a pseudo-function so they survive as expressions.
    private Expression arrayInitializer() {
        Token brace = consume(TokenType.LEFT_BRACE, "Expected '{'.");
        List<Expression> elements = new ArrayList<>();
        if (!check(TokenType.RIGHT_BRACE)) {
            do {
                if (check(TokenType.RIGHT_BRACE)) {
                    break;
                }
                elements.add(check(TokenType.LEFT_BRACE) ? arrayInitializer() : expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' after array initializer.");
        SourcePosition position = SourcePosition.of(brace);
        return new Expression.Call(new Expression.Identifier(ARRAY_INITIALIZER, position), elements, position);
    }

    @Override
    public TypeRef typeRef() {
        if (match(TokenType.STRING_TYPE)) {
            Token keyword = previous();
            consume(TokenType.LESS, "Expected '<' after 'string'.");
            Token capacity = consume(TokenType.INTEGER, "Expected a string capacity.");
            consume(TokenType.GREATER, "Expected '>' after string capacity.");
            return new TypeRef("string", Integer.parseInt(capacity.text()), List.of(), SourcePosition.of(keyword));
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected a type name.");
        return TypeRef.simple(name.text(), SourcePosition.of(name));
    }

    @Override
    public List<Expression> arrayDimensions() {
        List<Expression> dimensions = new ArrayList<>();
        while (match(TokenType.LEFT_BRACKET)) {
            dimensions.add(expression());
            consume(TokenType.RIGHT_BRACKET, "Expected ']' after array dimension.");
        }
        return dimensions;
    }

    // === Statements ===

    @Override
    public Statement.Block block() {
        Token brace = consume(TokenType.LEFT_BRACE, "Expected '{'.");
        List<Statement> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            try {
                statements.add(statement());
            } catch (ParseException e) {
                synchronizeStatement();
            }
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' after block.");
        return new Statement.Block(statements, SourcePosition.of(brace));
    }

    private Statement statement() {
        Token start = peek();
        switch (start.type()) {
            case LEFT_BRACE:
                return block();
            case IF:
                return ifStatement();
            case WHILE: {
                advance();
                consume(TokenType.LEFT_PAREN, "Expected '(' after 'while'.");
                Expression condition = expression();
                consume(TokenType.RIGHT_PAREN, "Expected ')' after condition.");
                return new Statement.While(condition, block(), SourcePosition.of(start));
            }
            case DO: {
                advance();
                Statement.Block body = block();
                consume(TokenType.WHILE, "Expected 'while' after do block.");
                consume(TokenType.LEFT_PAREN, "Expected '(' after 'while'.");
                Expression condition = expression();
                consume(TokenType.RIGHT_PAREN, "Expected ')' after condition.");
                consume(TokenType.SEMICOLON, "Expected ';' after do-while.");
                return new Statement.DoWhile(body, condition, SourcePosition.of(start));
            }
            case FOR:
                return forStatement();
            case SWITCH:
                return switchStatement();
            case RETURN: {
                advance();
                Expression value = check(TokenType.SEMICOLON) ? null : expression();
                consume(TokenType.SEMICOLON, "Expected ';' after return.");
                return new Statement.Return(value, SourcePosition.of(start));
            }
            default:
                Statement simple = simpleStatement();
                consume(TokenType.SEMICOLON, "Expected ';' after statement.");
                return simple;
        }
    }

    private Statement ifStatement() {
        Token keyword = advance();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'.");
        Expression condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after condition.");
        Statement.Block thenBranch = block();
        Statement elseBranch = null;
        if (match(TokenType.ELSE)) {
            elseBranch = check(TokenType.IF) ? ifStatement() : block();
        }
        return new Statement.If(condition, thenBranch, elseBranch, SourcePosition.of(keyword));
    }

    private Statement forStatement() {
        Token keyword = advance();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'for'.");
        Statement init = check(TokenType.SEMICOLON) ? null : simpleStatement();
        consume(TokenType.SEMICOLON, "Expected ';' after for initializer.");
        Expression condition = check(TokenType.SEMICOLON) ? null : expression();
        consume(TokenType.SEMICOLON, "Expected ';' after for condition.");
        Statement update = check(TokenType.RIGHT_PAREN) ? null : simpleStatement();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after for clauses.");
        return new Statement.For(init, condition, update, block(), SourcePosition.of(keyword));
    }

    private Statement switchStatement() {
        Token keyword = advance();
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'switch'.");
        Expression subject = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after switch subject.");
        consume(TokenType.LEFT_BRACE, "Expected '{' after switch subject.");
        List<Statement.SwitchCase> cases = new ArrayList<>();
        Statement.DefaultCase defaultCase = null;
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            if (match(TokenType.CASE)) {
                Token caseToken = previous();
                List<Expression> labels = new ArrayList<>();
                do {
                    labels.add(bitwiseOr());
                } while (match(TokenType.OR_OR));
                cases.add(new Statement.SwitchCase(labels, block(), SourcePosition.of(caseToken)));
            } else if (match(TokenType.DEFAULT)) {
                Token defaultToken = previous();
                Integer count = null;
                if (match(TokenType.LEFT_PAREN)) {
                    Token n = consume(TokenType.INTEGER, "Expected the number of remaining variants.");
                    count = Integer.parseInt(n.text());
                    consume(TokenType.RIGHT_PAREN, "Expected ')' after default count.");
                }
                if (defaultCase != null) {
                    error(defaultToken, DiagnosticCode.SYNTAX_ERROR, "A switch can have only one default branch.");
                }
                defaultCase = new Statement.DefaultCase(count, block(), SourcePosition.of(defaultToken));
            } else {
                error(peek(), DiagnosticCode.UNEXPECTED_TOKEN, "Expected 'case' or 'default' in switch.");
            }
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' after switch.");
        return new Statement.Switch(subject, cases, defaultCase, SourcePosition.of(keyword));
    }

    /**
     * A declaration, assignment or expression statement without its terminating semicolon.
     */
    private Statement simpleStatement() {
        if (isLocalDeclarationStart()) {
            boolean isConst = match(TokenType.CONST);
            TypeRef type = typeRef();
            Token name = consume(TokenType.IDENTIFIER, "Expected a variable name.");
            return variableRest(type, name, isConst);
        }
        Token start = peek();
        Expression expression = expression();
        if (peek().type().isAssignment()) {
            Token operator = advance();
            Expression value = expression();
            return new Statement.Assignment(expression, operator.text(), value, SourcePosition.of(start));
        }
        return new Statement.ExpressionStatement(expression, SourcePosition.of(start));
    }

    private boolean isLocalDeclarationStart() {
        if (check(TokenType.CONST) || check(TokenType.STRING_TYPE)) {
            return true;
        }
        return check(TokenType.IDENTIFIER) && peekAt(1).type() == TokenType.IDENTIFIER;
    }

    // === Expressions ===

    @Override
    public Expression expression() {
        return ternary();
    }

    private Expression ternary() {
        Expression condition = binaryLevel(0);
        if (match(TokenType.QUESTION)) {
            Expression thenValue = expression();
            consume(TokenType.COLON, "Expected ':' in conditional expression.");
            Expression elseValue = expression();
            return new Expression.Ternary(condition, thenValue, elseValue, condition.position());
        }
        return condition;
    }

    // Lowest precedence first.
    private static final TokenType[][] PRECEDENCE = {
            {TokenType.OR_OR},
            {TokenType.AND_AND},
            {TokenType.PIPE},
            {TokenType.CARET},
            {TokenType.AMP},
            {TokenType.EQUAL, TokenType.NOT_EQUAL},
            {TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL},
            {TokenType.SHL, TokenType.SHR},
            {TokenType.PLUS, TokenType.MINUS},
            {TokenType.STAR, TokenType.SLASH, TokenType.PERCENT}
    };

    private static final int BITWISE_OR_LEVEL = 2;

    private Expression bitwiseOr() {
        return binaryLevel(BITWISE_OR_LEVEL);
    }

    private Expression binaryLevel(int level) {
        if (level == PRECEDENCE.length) {
            return unary();
        }
        Expression left = binaryLevel(level + 1);
        while (match(PRECEDENCE[level])) {
            Token operator = previous();
            Expression right = binaryLevel(level + 1);
            left = new Expression.Binary(BINARY_SPELLING.get(operator.type()), left, right, SourcePosition.of(operator));
        }
        return left;
    }

    private Expression unary() {
        if (match(TokenType.MINUS, TokenType.BANG, TokenType.TILDE)) {
            Token operator = previous();
            return new Expression.Unary(operator.text(), unary(), SourcePosition.of(operator));
        }
        if (isCastStart()) {
            Token paren = advance();
            TypeRef type = typeRef();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after cast type.");
            return new Expression.Cast(type, unary(), SourcePosition.of(paren));
        }
        return postfix();
    }

    private boolean isCastStart() {
        if (!check(TokenType.LEFT_PAREN)) {
            return false;
        }
        Token next = peekAt(1);
        if (next.type() == TokenType.STRING_TYPE) {
            return true;
        }
        return next.type() == TokenType.IDENTIFIER
                && BuiltinTypes.dslPrimitive(next.text()).isPresent()
                && peekAt(2).type() == TokenType.RIGHT_PAREN;
    }

    private Expression postfix() {
        Expression expression = primary();
        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                List<Expression> arguments = new ArrayList<>();
                if (!check(TokenType.RIGHT_PAREN)) {
                    do {
                        arguments.add(expression());
                    } while (match(TokenType.COMMA));
                }
                consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments.");
                expression = new Expression.Call(expression, arguments, expression.position());
            } else if (match(TokenType.DOT)) {
                Token member = consume(TokenType.IDENTIFIER, "Expected a member name after '.'.");
                expression = new Expression.MemberAccess(expression, member.text(), SourcePosition.of(member));
            } else if (match(TokenType.LEFT_BRACKET)) {
                Token bracket = previous();
                Expression index = expression();
                Expression width = match(TokenType.COMMA) ? expression() : null;
                consume(TokenType.RIGHT_BRACKET, "Expected ']' after index.");
                expression = new Expression.Index(expression, index, width, SourcePosition.of(bracket));
            } else {
                return expression;
            }
        }
    }

    private Expression primary() {
        Token token = peek();
        if (token.type() == TokenType.END_OF_FILE) {
            error(token, DiagnosticCode.SYNTAX_ERROR, "Expected an expression but found end of file.");
        }
        advance();
        SourcePosition position = SourcePosition.of(token);
        switch (token.type()) {
            case INTEGER:
                return new Expression.Literal(Expression.LiteralKind.INTEGER, token.text(), position);
            case FLOAT:
                return new Expression.Literal(Expression.LiteralKind.FLOAT, token.text(), position);
            case STRING:
                return new Expression.Literal(Expression.LiteralKind.STRING, token.text(), position);
            case CHAR:
                return new Expression.Literal(Expression.LiteralKind.CHAR, token.text(), position);
            case TRUE:
            case FALSE:
                return new Expression.Literal(Expression.LiteralKind.BOOLEAN, token.text(), position);
            case NULL:
                return new Expression.NullLiteral(position);
            case THIS:
            case GLOBAL:
            case IDENTIFIER:
                return new Expression.Identifier(token.text(), position);
            case LEFT_PAREN: {
                Expression inner = expression();
                consume(TokenType.RIGHT_PAREN, "Expected ')' after expression.");
                return inner;
            }
            default:
                current--;
                error(token, DiagnosticCode.UNEXPECTED_TOKEN, "Expected an expression but found '" + token.text() + "'.");
                return null;
        }
    }

    // === Token stream ===

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) {
            return type == TokenType.END_OF_FILE;
        }
        return peek().type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) {
            current++;
        }
        return previous();
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    private Token peekAt(int offset) {
        int index = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    @Override
    public Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    @Override
    public Token consume(TokenType type, String errorMessage) {
        if (check(type)) {
            return advance();
        }
        Token found = peek();
        DiagnosticCode code = found.type() == TokenType.END_OF_FILE
                ? DiagnosticCode.SYNTAX_ERROR
                : DiagnosticCode.UNEXPECTED_TOKEN;
        String where = found.type() == TokenType.END_OF_FILE ? "end of file" : "'" + found.text() + "'";
        error(found, code, errorMessage + " Found " + where + ".");
        return found;
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private void error(Token token, DiagnosticCode code, String message) {
        diagnostics.reportError(code, message, token.fileName(), token.line(), token.column());
        throw new ParseException(message, token);
    }

    // === Recovery ===

    private void synchronizeStatement() {
        int depth = 0;
        while (!isAtEnd()) {
            Token token = advance();
            if (token.type() == TokenType.LEFT_BRACE) {
                depth++;
            } else if (token.type() == TokenType.RIGHT_BRACE) {
                if (depth == 0) {
                    current--;
                    return;
                }
                depth--;
                if (depth == 0) {
                    return;
                }
            } else if (token.type() == TokenType.SEMICOLON && depth == 0) {
                return;
            }
        }
    }

    private void synchronizeDeclaration() {
        int depth = 0;
        while (!isAtEnd()) {
            Token token = advance();
            if (token.type() == TokenType.LEFT_BRACE) {
                depth++;
            } else if (token.type() == TokenType.RIGHT_BRACE) {
                depth = Math.max(0, depth - 1);
                if (depth == 0) {
                    match(TokenType.SEMICOLON);
                    return;
                }
            } else if (token.type() == TokenType.SEMICOLON && depth == 0) {
                return;
            }
        }
    }
}
