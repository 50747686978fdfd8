package org.lunaform.compiler.frontend.parser;

import org.lunaform.compiler.diagnostics.DiagnosticsEngine;
import org.lunaform.compiler.frontend.lexer.Lexeme;
import org.lunaform.compiler.frontend.lexer.TokenType;
import org.lunaform.compiler.frontend.syntax.Args;
import org.lunaform.compiler.frontend.syntax.Call;
import org.lunaform.compiler.frontend.syntax.ContainedSpan;
import org.lunaform.compiler.frontend.syntax.Expr;
import org.lunaform.compiler.frontend.syntax.FunctionBodySyntax;
import org.lunaform.compiler.frontend.syntax.FunctionCallSyntax;
import org.lunaform.compiler.frontend.syntax.FunctionNameSyntax;
import org.lunaform.compiler.frontend.syntax.GenericDeclaration;
import org.lunaform.compiler.frontend.syntax.Index;
import org.lunaform.compiler.frontend.syntax.LastStmt;
import org.lunaform.compiler.frontend.syntax.Parameter;
import org.lunaform.compiler.frontend.syntax.PrefixSyntax;
import org.lunaform.compiler.frontend.syntax.Punctuated;
import org.lunaform.compiler.frontend.syntax.Span;
import org.lunaform.compiler.frontend.syntax.Stmt;
import org.lunaform.compiler.frontend.syntax.Suffix;
import org.lunaform.compiler.frontend.syntax.SyntaxBlock;
import org.lunaform.compiler.frontend.syntax.SyntaxTree;
import org.lunaform.compiler.frontend.syntax.TableConstructor;
import org.lunaform.compiler.frontend.syntax.TableField;
import org.lunaform.compiler.frontend.syntax.TokenReference;
import org.lunaform.compiler.frontend.syntax.TypeInfo;
import org.lunaform.compiler.frontend.syntax.TypeSpecifier;
import org.lunaform.compiler.frontend.syntax.Var;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The recursive-descent parser for Lua and its Luau extensions. It consumes the tokens
 * produced by the {@link org.lunaform.compiler.frontend.lexer.Lexer} (with trivia attached by
 * the {@link TriviaAttacher}) and produces a {@link SyntaxTree}.
 * <p>
 * Parsing stops at the first syntax error; the error is reported to the diagnostics engine.
 */
public class Parser implements ParsingContext {

    private static final int UNARY_PRECEDENCE = 11;

    private static final Set<TokenType> COMPOUND_OPERATORS = EnumSet.of(
            TokenType.PLUS_EQUAL, TokenType.MINUS_EQUAL, TokenType.STAR_EQUAL, TokenType.SLASH_EQUAL,
            TokenType.DOUBLE_SLASH_EQUAL, TokenType.PERCENT_EQUAL, TokenType.CARET_EQUAL,
            TokenType.TWO_DOTS_EQUAL);

    private static final Set<TokenType> UNARY_OPERATORS = EnumSet.of(
            TokenType.NOT, TokenType.MINUS, TokenType.HASH, TokenType.TILDE);

    // Tokens after `continue` that make it an ordinary identifier.
    private static final Set<TokenType> CONTINUE_AS_NAME = EnumSet.of(
            TokenType.LEFT_PAREN, TokenType.EQUAL, TokenType.DOT, TokenType.LEFT_BRACKET,
            TokenType.COLON, TokenType.COMMA, TokenType.STRING, TokenType.LEFT_BRACE,
            TokenType.INTERPOLATED_SIMPLE, TokenType.INTERPOLATED_BEGIN);

    private final List<TokenReference> tokens;
    private final DiagnosticsEngine diagnostics;
    private final String source;
    private final TypeParser typeParser;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param source The source code the tokens were produced from.
     * @param tokens The significant tokens with their trivia, terminated by the end-of-file token.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(String source, List<TokenReference> tokens, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.tokens = new ArrayList<>(tokens);
        this.diagnostics = diagnostics;
        this.typeParser = new TypeParser(this);
    }

    /**
     * Parses the entire token stream.
     * @return The syntax tree, or empty when a syntax error was reported.
     */
    public Optional<SyntaxTree> parse() {
        try {
            SyntaxBlock block = block();
            if (!isAtEnd()) {
                throw error("Expected end of file but got '" + peek().text() + "'.");
            }
            return Optional.of(new SyntaxTree(source, block, peek()));
        } catch (SyntaxError e) {
            return Optional.empty();
        }
    }

    // region Blocks and statements

    private SyntaxBlock block() {
        int start = peek().token().start();
        List<Stmt> statements = new ArrayList<>();
        List<Optional<TokenReference>> semicolons = new ArrayList<>();
        Optional<LastStmt> lastStatement = Optional.empty();
        Optional<TokenReference> lastSemicolon = Optional.empty();

        while (!isBlockEnd()) {
            if (check(TokenType.RETURN) || check(TokenType.BREAK) || isContinueStatement()) {
                lastStatement = Optional.of(lastStatement());
                lastSemicolon = optionalToken(TokenType.SEMICOLON);
                if (!isBlockEnd()) {
                    throw error("Expected end of block after '" + previous().text() + "'.");
                }
                break;
            }
            statements.add(statement());
            semicolons.add(optionalToken(TokenType.SEMICOLON));
        }

        int end = statements.isEmpty() && lastStatement.isEmpty() ? start : previous().token().end();
        return new SyntaxBlock(new Span(start, end), statements, semicolons, lastStatement, lastSemicolon);
    }

    private boolean isBlockEnd() {
        return isAtEnd() || check(TokenType.END) || check(TokenType.ELSE) || check(TokenType.ELSEIF)
                || check(TokenType.UNTIL);
    }

    private boolean isContinueStatement() {
        if (!checkIdentifier("continue")) {
            return false;
        }
        TokenType next = tokens.get(current + 1).type();
        return !CONTINUE_AS_NAME.contains(next) && !COMPOUND_OPERATORS.contains(next);
    }

    private LastStmt lastStatement() {
        int start = peek().token().start();
        if (match(TokenType.BREAK)) {
            return new LastStmt.Break(spanFrom(start), previous());
        }
        if (match(TokenType.RETURN)) {
            TokenReference returnToken = previous();
            Punctuated<Expr> values = Punctuated.empty();
            if (!isBlockEnd() && !check(TokenType.SEMICOLON)) {
                values = expressionList();
            }
            return new LastStmt.Return(spanFrom(start), returnToken, values);
        }
        TokenReference continueToken = advance();
        return new LastStmt.Continue(spanFrom(start), continueToken);
    }

    private Stmt statement() {
        int start = peek().token().start();
        TokenType type = peek().type();
        switch (type) {
            case LOCAL:
                return checkNext(TokenType.FUNCTION) ? localFunction(start) : localAssignment(start);
            case FUNCTION:
                return functionDeclaration(start);
            case IF:
                return ifStatement(start);
            case WHILE:
                return whileStatement(start);
            case DO: {
                TokenReference doToken = advance();
                SyntaxBlock block = block();
                TokenReference end = consume(TokenType.END, "Expected 'end' to close 'do' block.");
                return new Stmt.Do(spanFrom(start), doToken, block, end);
            }
            case FOR:
                return forStatement(start);
            case REPEAT: {
                TokenReference repeat = advance();
                SyntaxBlock block = block();
                TokenReference until = consume(TokenType.UNTIL, "Expected 'until' to close 'repeat' block.");
                Expr condition = expression();
                return new Stmt.Repeat(spanFrom(start), repeat, block, until, condition);
            }
            case DOUBLE_COLON: {
                TokenReference left = advance();
                TokenReference name = consume(TokenType.IDENTIFIER, "Expected label name after '::'.");
                TokenReference right = consume(TokenType.DOUBLE_COLON, "Expected '::' after label name.");
                return new Stmt.Label(spanFrom(start), left, name, right);
            }
            default:
                break;
        }
        if (checkIdentifier("goto") && checkNext(TokenType.IDENTIFIER)) {
            TokenReference gotoToken = advance();
            TokenReference label = advance();
            return new Stmt.Goto(spanFrom(start), gotoToken, label);
        }
        if (checkIdentifier("type") && checkNext(TokenType.IDENTIFIER)) {
            return typeDeclaration(start, Optional.empty());
        }
        if (checkIdentifier("export") && checkNext(TokenType.IDENTIFIER)
                && "type".equals(tokens.get(current + 1).text())) {
            TokenReference export = advance();
            return typeDeclaration(start, Optional.of(export));
        }
        return expressionStatement(start);
    }

    private Stmt localFunction(int start) {
        TokenReference local = advance();
        TokenReference function = advance();
        TokenReference name = consume(TokenType.IDENTIFIER, "Expected function name after 'local function'.");
        FunctionBodySyntax body = functionBody();
        return new Stmt.LocalFunction(spanFrom(start), local, function, name, body);
    }

    private Stmt localAssignment(int start) {
        TokenReference local = advance();
        List<TokenReference> names = new ArrayList<>();
        List<TokenReference> commas = new ArrayList<>();
        List<Optional<TypeSpecifier>> types = new ArrayList<>();
        do {
            names.add(consume(TokenType.IDENTIFIER, "Expected variable name."));
            types.add(optionalTypeSpecifier());
        } while (matchInto(TokenType.COMMA, commas));

        Optional<TokenReference> equal = optionalToken(TokenType.EQUAL);
        Punctuated<Expr> values = equal.isPresent() ? expressionList() : Punctuated.empty();
        return new Stmt.LocalAssignment(spanFrom(start), local, new Punctuated<>(names, commas), types,
                equal, values);
    }

    private Stmt functionDeclaration(int start) {
        TokenReference function = advance();
        int nameStart = peek().token().start();
        List<TokenReference> names = new ArrayList<>();
        List<TokenReference> dots = new ArrayList<>();
        do {
            names.add(consume(TokenType.IDENTIFIER, "Expected function name."));
        } while (matchInto(TokenType.DOT, dots));
        Optional<TokenReference> colon = optionalToken(TokenType.COLON);
        Optional<TokenReference> method = Optional.empty();
        if (colon.isPresent()) {
            method = Optional.of(consume(TokenType.IDENTIFIER, "Expected method name after ':'."));
        }
        FunctionNameSyntax name = new FunctionNameSyntax(spanFrom(nameStart), new Punctuated<>(names, dots),
                colon, method);
        FunctionBodySyntax body = functionBody();
        return new Stmt.FunctionDeclaration(spanFrom(start), function, name, body);
    }

    private Stmt ifStatement(int start) {
        TokenReference ifToken = advance();
        Expr condition = expression();
        TokenReference then = consume(TokenType.THEN, "Expected 'then' after condition.");
        SyntaxBlock block = block();
        List<Stmt.ElseIf> elseIfs = new ArrayList<>();
        while (check(TokenType.ELSEIF)) {
            TokenReference elseIf = advance();
            Expr elseIfCondition = expression();
            TokenReference elseIfThen = consume(TokenType.THEN, "Expected 'then' after condition.");
            elseIfs.add(new Stmt.ElseIf(elseIf, elseIfCondition, elseIfThen, block()));
        }
        Optional<TokenReference> elseToken = optionalToken(TokenType.ELSE);
        Optional<SyntaxBlock> elseBlock = elseToken.isPresent() ? Optional.of(block()) : Optional.empty();
        TokenReference end = consume(TokenType.END, "Expected 'end' to close 'if' statement.");
        return new Stmt.If(spanFrom(start), ifToken, condition, then, block, elseIfs, elseToken, elseBlock, end);
    }

    private Stmt whileStatement(int start) {
        TokenReference whileToken = advance();
        Expr condition = expression();
        TokenReference doToken = consume(TokenType.DO, "Expected 'do' after condition.");
        SyntaxBlock block = block();
        TokenReference end = consume(TokenType.END, "Expected 'end' to close 'while' loop.");
        return new Stmt.While(spanFrom(start), whileToken, condition, doToken, block, end);
    }

    private Stmt forStatement(int start) {
        TokenReference forToken = advance();
        TokenReference firstName = consume(TokenType.IDENTIFIER, "Expected variable name after 'for'.");
        Optional<TypeSpecifier> firstType = optionalTypeSpecifier();

        if (check(TokenType.EQUAL)) {
            TokenReference equal = advance();
            Expr startExpression = expression();
            TokenReference endComma = consume(TokenType.COMMA, "Expected ',' after numeric for start.");
            Expr endExpression = expression();
            Optional<TokenReference> stepComma = optionalToken(TokenType.COMMA);
            Optional<Expr> step = stepComma.isPresent() ? Optional.of(expression()) : Optional.empty();
            TokenReference doToken = consume(TokenType.DO, "Expected 'do' in numeric for.");
            SyntaxBlock block = block();
            TokenReference end = consume(TokenType.END, "Expected 'end' to close 'for' loop.");
            return new Stmt.NumericFor(spanFrom(start), forToken, firstName, firstType, equal, startExpression,
                    endComma, endExpression, stepComma, step, doToken, block, end);
        }

        List<TokenReference> names = new ArrayList<>();
        List<TokenReference> commas = new ArrayList<>();
        List<Optional<TypeSpecifier>> types = new ArrayList<>();
        names.add(firstName);
        types.add(firstType);
        while (matchInto(TokenType.COMMA, commas)) {
            names.add(consume(TokenType.IDENTIFIER, "Expected variable name."));
            types.add(optionalTypeSpecifier());
        }
        TokenReference in = consume(TokenType.IN, "Expected '=' or 'in' in for loop.");
        Punctuated<Expr> expressions = expressionList();
        TokenReference doToken = consume(TokenType.DO, "Expected 'do' in generic for.");
        SyntaxBlock block = block();
        TokenReference end = consume(TokenType.END, "Expected 'end' to close 'for' loop.");
        return new Stmt.GenericFor(spanFrom(start), forToken, new Punctuated<>(names, commas), types, in,
                expressions, doToken, block, end);
    }

    private Stmt typeDeclaration(int start, Optional<TokenReference> export) {
        TokenReference type = advance();
        TokenReference name = consume(TokenType.IDENTIFIER, "Expected type name.");
        Optional<GenericDeclaration> generics = check(TokenType.LESS_THAN)
                ? Optional.of(typeParser.genericDeclaration(true))
                : Optional.empty();
        TokenReference equal = consume(TokenType.EQUAL, "Expected '=' in type declaration.");
        TypeInfo declared = typeParser.type();
        return new Stmt.TypeDeclaration(spanFrom(start), export, type, name, generics, equal, declared);
    }

    private Stmt expressionStatement(int start) {
        Expr expression = suffixedExpression();

        if (check(TokenType.EQUAL) || check(TokenType.COMMA)) {
            List<Var> variables = new ArrayList<>();
            List<TokenReference> commas = new ArrayList<>();
            variables.add(asVariable(expression));
            while (matchInto(TokenType.COMMA, commas)) {
                variables.add(asVariable(suffixedExpression()));
            }
            TokenReference equal = consume(TokenType.EQUAL, "Expected '=' in assignment.");
            Punctuated<Expr> values = expressionList();
            return new Stmt.Assignment(spanFrom(start), new Punctuated<>(variables, commas), equal, values);
        }
        if (COMPOUND_OPERATORS.contains(peek().type())) {
            Var variable = asVariable(expression);
            TokenReference operator = advance();
            Expr value = expression();
            return new Stmt.CompoundAssignment(spanFrom(start), variable, operator, value);
        }
        if (expression instanceof FunctionCallSyntax call) {
            return call;
        }
        throw error("Expected statement but got an expression.");
    }

    private Var asVariable(Expr expression) {
        if (expression instanceof Var variable) {
            return variable;
        }
        throw error("Cannot assign to this expression.");
    }

    // endregion

    // region Functions

    private FunctionBodySyntax functionBody() {
        int start = peek().token().start();
        Optional<GenericDeclaration> generics = check(TokenType.LESS_THAN)
                ? Optional.of(typeParser.genericDeclaration(false))
                : Optional.empty();
        TokenReference open = consume(TokenType.LEFT_PAREN, "Expected '(' to open parameter list.");
        List<Parameter> parameters = new ArrayList<>();
        List<TokenReference> commas = new ArrayList<>();
        List<Optional<TypeSpecifier>> types = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                int parameterStart = peek().token().start();
                if (match(TokenType.ELLIPSIS)) {
                    parameters.add(new Parameter.Ellipsis(spanFrom(parameterStart), previous()));
                    types.add(optionalVariadicTypeSpecifier());
                } else {
                    TokenReference name = consume(TokenType.IDENTIFIER, "Expected parameter name.");
                    parameters.add(new Parameter.Name(spanFrom(parameterStart), name));
                    types.add(optionalTypeSpecifier());
                }
            } while (matchInto(TokenType.COMMA, commas));
        }
        TokenReference close = consume(TokenType.RIGHT_PAREN, "Expected ')' to close parameter list.");
        Optional<TypeSpecifier> returnType = Optional.empty();
        if (check(TokenType.COLON)) {
            TokenReference colon = advance();
            returnType = Optional.of(new TypeSpecifier(colon, typeParser.returnType()));
        }
        SyntaxBlock block = block();
        TokenReference end = consume(TokenType.END, "Expected 'end' to close function body.");
        return new FunctionBodySyntax(spanFrom(start), generics, new ContainedSpan(open, close),
                new Punctuated<>(parameters, commas), types, returnType, block, end);
    }

    private Optional<TypeSpecifier> optionalTypeSpecifier() {
        if (!check(TokenType.COLON)) {
            return Optional.empty();
        }
        TokenReference colon = advance();
        return Optional.of(new TypeSpecifier(colon, typeParser.type()));
    }

    private Optional<TypeSpecifier> optionalVariadicTypeSpecifier() {
        if (!check(TokenType.COLON)) {
            return Optional.empty();
        }
        TokenReference colon = advance();
        return Optional.of(new TypeSpecifier(colon, typeParser.variadicType()));
    }

    // endregion

    // region Expressions

    /**
     * Parses a comma separated, non-empty list of expressions.
     * @return The expressions with their commas.
     */
    private Punctuated<Expr> expressionList() {
        List<Expr> values = new ArrayList<>();
        List<TokenReference> commas = new ArrayList<>();
        do {
            values.add(expression());
        } while (matchInto(TokenType.COMMA, commas));
        return new Punctuated<>(values, commas);
    }

    @Override
    public Expr expression() {
        return binary(1);
    }

    /**
     * Precedence climbing. Left associative operators of the same level are folded in the loop,
     * so long chains such as {@code a + b + c + ...} do not deepen the call stack.
     */
    private Expr binary(int minPrecedence) {
        int start = peek().token().start();
        Expr left = unary();
        while (true) {
            TokenType operatorType = peek().type();
            int precedence = binaryPrecedence(operatorType);
            if (precedence < minPrecedence) {
                break;
            }
            TokenReference operator = advance();
            int nextMinimum = isRightAssociative(operatorType) ? precedence : precedence + 1;
            Expr right = binary(nextMinimum);
            left = new Expr.Binary(spanFrom(start), left, operator, right);
        }
        return left;
    }

    private Expr unary() {
        if (UNARY_OPERATORS.contains(peek().type())) {
            int start = peek().token().start();
            TokenReference operator = advance();
            Expr operand = binary(UNARY_PRECEDENCE);
            return new Expr.Unary(spanFrom(start), operator, operand);
        }
        return simpleExpression();
    }

    private static int binaryPrecedence(TokenType type) {
        switch (type) {
            case OR: return 1;
            case AND: return 2;
            case LESS_THAN: case GREATER_THAN: case LESS_EQUAL: case GREATER_EQUAL:
            case TILDE_EQUAL: case TWO_EQUAL: return 3;
            case PIPE: return 4;
            case TILDE: return 5;
            case AMPERSAND: return 6;
            case DOUBLE_LESS_THAN: case DOUBLE_GREATER_THAN: return 7;
            case TWO_DOTS: return 8;
            case PLUS: case MINUS: return 9;
            case STAR: case SLASH: case DOUBLE_SLASH: case PERCENT: return 10;
            case CARET: return 12;
            default: return -1;
        }
    }

    private static boolean isRightAssociative(TokenType type) {
        return type == TokenType.TWO_DOTS || type == TokenType.CARET;
    }

    private Expr simpleExpression() {
        int start = peek().token().start();
        Expr expression = switch (peek().type()) {
            case NUMBER -> new Expr.Number(spanFrom(start, advance()), previous());
            case STRING -> new Expr.StringLiteral(spanFrom(start, advance()), previous());
            case NIL, TRUE, FALSE, ELLIPSIS -> new Expr.Symbol(spanFrom(start, advance()), previous());
            case LEFT_BRACE -> tableConstructor();
            case FUNCTION -> {
                TokenReference function = advance();
                FunctionBodySyntax body = functionBody();
                yield new Expr.Function(spanFrom(start), function, body);
            }
            case IF -> ifExpression(start);
            case INTERPOLATED_SIMPLE, INTERPOLATED_BEGIN -> interpolatedString(start);
            default -> suffixedExpression();
        };
        while (check(TokenType.DOUBLE_COLON)) {
            TokenReference doubleColon = advance();
            TypeInfo castTo = typeParser.type();
            expression = new Expr.TypeAssertion(spanFrom(start), expression, doubleColon, castTo);
        }
        return expression;
    }

    private Expr ifExpression(int start) {
        TokenReference ifToken = advance();
        Expr condition = expression();
        TokenReference then = consume(TokenType.THEN, "Expected 'then' in if-expression.");
        Expr result = expression();
        List<Expr.ElseIfExpression> elseIfs = new ArrayList<>();
        while (check(TokenType.ELSEIF)) {
            TokenReference elseIf = advance();
            Expr elseIfCondition = expression();
            TokenReference elseIfThen = consume(TokenType.THEN, "Expected 'then' in if-expression.");
            elseIfs.add(new Expr.ElseIfExpression(elseIf, elseIfCondition, elseIfThen, expression()));
        }
        TokenReference elseToken = consume(TokenType.ELSE, "Expected 'else' in if-expression.");
        Expr elseResult = expression();
        return new Expr.IfExpression(spanFrom(start), ifToken, condition, then, result, elseIfs, elseToken,
                elseResult);
    }

    private Expr interpolatedString(int start) {
        if (match(TokenType.INTERPOLATED_SIMPLE)) {
            return new Expr.InterpolatedString(spanFrom(start), List.of(), previous());
        }
        List<Expr.InterpolatedSegment> segments = new ArrayList<>();
        TokenReference literal = advance();
        while (true) {
            Expr value = expression();
            segments.add(new Expr.InterpolatedSegment(literal, value));
            if (match(TokenType.INTERPOLATED_END)) {
                return new Expr.InterpolatedString(spanFrom(start), segments, previous());
            }
            literal = consume(TokenType.INTERPOLATED_MIDDLE, "Expected '}' to close interpolated expression.");
        }
    }

    /**
     * Parses a prefix followed by any number of index and call suffixes.
     * @return a name, a suffixed variable, a call or a parenthesized expression.
     */
    private Expr suffixedExpression() {
        int start = peek().token().start();
        PrefixSyntax prefix;
        if (check(TokenType.IDENTIFIER)) {
            TokenReference name = advance();
            prefix = new PrefixSyntax.Name(spanFrom(start), name);
        } else if (check(TokenType.LEFT_PAREN)) {
            TokenReference open = advance();
            Expr inner = expression();
            TokenReference close = consume(TokenType.RIGHT_PAREN, "Expected ')' after expression.");
            prefix = new PrefixSyntax.Expression(spanFrom(start),
                    new Expr.Parentheses(spanFrom(start), new ContainedSpan(open, close), inner));
        } else {
            throw error("Unexpected token '" + peek().text() + "' while parsing expression.");
        }

        List<Suffix> suffixes = new ArrayList<>();
        while (true) {
            int suffixStart = peek().token().start();
            if (check(TokenType.DOT)) {
                TokenReference dot = advance();
                TokenReference name = consume(TokenType.IDENTIFIER, "Expected field name after '.'.");
                suffixes.add(new Suffix.IndexSuffix(spanFrom(suffixStart), new Index.Dot(spanFrom(suffixStart), dot, name)));
            } else if (check(TokenType.LEFT_BRACKET)) {
                TokenReference open = advance();
                Expr key = expression();
                TokenReference close = consume(TokenType.RIGHT_BRACKET, "Expected ']' after index.");
                suffixes.add(new Suffix.IndexSuffix(spanFrom(suffixStart),
                        new Index.Brackets(spanFrom(suffixStart), new ContainedSpan(open, close), key)));
            } else if (check(TokenType.COLON)) {
                TokenReference colon = advance();
                TokenReference name = consume(TokenType.IDENTIFIER, "Expected method name after ':'.");
                Args arguments = functionArguments();
                suffixes.add(new Suffix.CallSuffix(spanFrom(suffixStart),
                        new Call.Method(spanFrom(suffixStart), colon, name, arguments)));
            } else if (isArgumentsStart()) {
                Args arguments = functionArguments();
                suffixes.add(new Suffix.CallSuffix(spanFrom(suffixStart),
                        new Call.Anonymous(spanFrom(suffixStart), arguments)));
            } else {
                break;
            }
        }

        if (suffixes.isEmpty()) {
            if (prefix instanceof PrefixSyntax.Name name) {
                return new Var.Name(name.span(), name.token());
            }
            return ((PrefixSyntax.Expression) prefix).expression();
        }
        if (suffixes.get(suffixes.size() - 1) instanceof Suffix.CallSuffix) {
            return new FunctionCallSyntax(spanFrom(start), prefix, suffixes);
        }
        return new Var.Suffixed(spanFrom(start), prefix, suffixes);
    }

    private boolean isArgumentsStart() {
        return check(TokenType.LEFT_PAREN) || check(TokenType.STRING) || check(TokenType.LEFT_BRACE);
    }

    private Args functionArguments() {
        int start = peek().token().start();
        if (check(TokenType.STRING)) {
            TokenReference string = advance();
            return new Expr.StringLiteral(spanFrom(start), string);
        }
        if (check(TokenType.LEFT_BRACE)) {
            return tableConstructor();
        }
        TokenReference open = consume(TokenType.LEFT_PAREN, "Expected function arguments.");
        Punctuated<Expr> arguments = check(TokenType.RIGHT_PAREN) ? Punctuated.empty() : expressionList();
        TokenReference close = consume(TokenType.RIGHT_PAREN, "Expected ')' to close arguments.");
        return new Args.Parenthesized(spanFrom(start), new ContainedSpan(open, close), arguments);
    }

    private TableConstructor tableConstructor() {
        int start = peek().token().start();
        TokenReference open = consume(TokenType.LEFT_BRACE, "Expected '{'.");
        List<TableField> fields = new ArrayList<>();
        List<TokenReference> separators = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            int fieldStart = peek().token().start();
            if (check(TokenType.LEFT_BRACKET)) {
                TokenReference openBracket = advance();
                Expr key = expression();
                TokenReference closeBracket = consume(TokenType.RIGHT_BRACKET, "Expected ']' after table key.");
                TokenReference equal = consume(TokenType.EQUAL, "Expected '=' after table key.");
                Expr value = expression();
                fields.add(new TableField.ExpressionKey(spanFrom(fieldStart),
                        new ContainedSpan(openBracket, closeBracket), key, equal, value));
            } else if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUAL)) {
                TokenReference name = advance();
                TokenReference equal = advance();
                Expr value = expression();
                fields.add(new TableField.NameKey(spanFrom(fieldStart), name, equal, value));
            } else {
                Expr value = expression();
                fields.add(new TableField.NoKey(spanFrom(fieldStart), value));
            }
            if (!matchInto(TokenType.COMMA, separators) && !matchInto(TokenType.SEMICOLON, separators)) {
                break;
            }
        }
        TokenReference close = consume(TokenType.RIGHT_BRACE, "Expected '}' to close table.");
        return new TableConstructor(spanFrom(start), new ContainedSpan(open, close), new Punctuated<>(fields, separators));
    }

    // endregion

    // region Token stream

    private Optional<TokenReference> optionalToken(TokenType type) {
        return match(type) ? Optional.of(previous()) : Optional.empty();
    }

    private boolean matchInto(TokenType type, List<TokenReference> into) {
        if (match(type)) {
            into.add(previous());
            return true;
        }
        return false;
    }

    private Span spanFrom(int start, TokenReference consumed) {
        return new Span(start, consumed.token().end());
    }

    @Override
    public Span spanFrom(int start) {
        return new Span(start, previous().token().end());
    }

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
        return peek().type() == type;
    }

    @Override
    public boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    @Override
    public boolean checkIdentifier(String text) {
        return check(TokenType.IDENTIFIER) && peek().text().equals(text);
    }

    @Override
    public TokenReference advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    @Override
    public TokenReference peek() {
        return tokens.get(current);
    }

    @Override
    public TokenReference previous() {
        return tokens.get(current - 1);
    }

    @Override
    public TokenReference consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(errorMessage);
    }

    @Override
    public TokenReference consumeClosingAngle() {
        if (check(TokenType.DOUBLE_GREATER_THAN)) {
            TokenReference both = peek();
            Lexeme lexeme = both.token();
            Lexeme first = new Lexeme(TokenType.GREATER_THAN, ">", lexeme.start(), lexeme.start() + 1, lexeme.line());
            Lexeme second = new Lexeme(TokenType.GREATER_THAN, ">", lexeme.start() + 1, lexeme.end(), lexeme.line());
            tokens.set(current, new TokenReference(first, both.leadingTrivia(), List.of()));
            tokens.add(current + 1, new TokenReference(second, List.of(), both.trailingTrivia()));
        }
        return consume(TokenType.GREATER_THAN, "Expected '>' to close generic list.");
    }

    @Override
    public RuntimeException error(String message) {
        TokenReference at = peek();
        diagnostics.reportError(message, at.line());
        return new SyntaxError(message);
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    // endregion
}
