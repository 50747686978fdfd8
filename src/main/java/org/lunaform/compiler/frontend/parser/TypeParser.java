package org.lunaform.compiler.frontend.parser;

import org.lunaform.compiler.frontend.lexer.TokenType;
import org.lunaform.compiler.frontend.syntax.ContainedSpan;
import org.lunaform.compiler.frontend.syntax.Expr;
import org.lunaform.compiler.frontend.syntax.GenericDeclaration;
import org.lunaform.compiler.frontend.syntax.Punctuated;
import org.lunaform.compiler.frontend.syntax.TokenReference;
import org.lunaform.compiler.frontend.syntax.TypeField;
import org.lunaform.compiler.frontend.syntax.TypeInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses Luau type annotations on behalf of the {@link Parser}.
 */
public class TypeParser {

    private final ParsingContext context;

    /**
     * @param context The token stream shared with the statement parser.
     */
    public TypeParser(ParsingContext context) {
        this.context = context;
    }

    /**
     * Parses a type, including unions, intersections and optionals.
     * @return The parsed type.
     */
    public TypeInfo type() {
        int start = context.peek().token().start();
        TypeInfo left = optionalSuffixes(start, simpleType());
        while (context.check(TokenType.PIPE) || context.check(TokenType.AMPERSAND)) {
            TokenReference operator = context.advance();
            int rightStart = context.peek().token().start();
            TypeInfo right = optionalSuffixes(rightStart, simpleType());
            left = operator.type() == TokenType.PIPE
                    ? new TypeInfo.Union(context.spanFrom(start), left, operator, right)
                    : new TypeInfo.Intersection(context.spanFrom(start), left, operator, right);
        }
        return left;
    }

    /**
     * Parses a return type: a type, a parenthesized type pack, a variadic type or a generic pack.
     * @return The parsed type.
     */
    public TypeInfo returnType() {
        if (context.check(TokenType.ELLIPSIS) || isGenericPack()) {
            return variadicType();
        }
        return type();
    }

    /**
     * Parses the type of a variadic parameter or a variadic tail: {@code T...}, {@code ...T} or a type.
     * @return The parsed type.
     */
    public TypeInfo variadicType() {
        int start = context.peek().token().start();
        if (isGenericPack()) {
            TokenReference name = context.advance();
            TokenReference ellipsis = context.advance();
            return new TypeInfo.GenericPack(context.spanFrom(start), name, ellipsis);
        }
        if (context.check(TokenType.ELLIPSIS)) {
            TokenReference ellipsis = context.advance();
            TypeInfo inner = type();
            return new TypeInfo.Variadic(context.spanFrom(start), ellipsis, inner);
        }
        return type();
    }

    /**
     * Parses angle bracketed generic parameters.
     * @param allowDefaults Whether {@code = default} is accepted, as on type declarations.
     * @return The parsed declaration.
     */
    public GenericDeclaration genericDeclaration(boolean allowDefaults) {
        TokenReference open = context.consume(TokenType.LESS_THAN, "Expected '<' to open generic list.");
        List<GenericDeclaration.GenericParameter> parameters = new ArrayList<>();
        List<TokenReference> commas = new ArrayList<>();
        do {
            int start = context.peek().token().start();
            TokenReference name = context.consume(TokenType.IDENTIFIER, "Expected generic name.");
            GenericDeclaration.GenericParameterInfo info;
            boolean pack = context.check(TokenType.ELLIPSIS);
            if (pack) {
                info = new GenericDeclaration.Pack(name, context.advance());
            } else {
                info = new GenericDeclaration.Name(name);
            }
            Optional<TokenReference> equal = Optional.empty();
            Optional<TypeInfo> defaultType = Optional.empty();
            if (allowDefaults && context.check(TokenType.EQUAL)) {
                equal = Optional.of(context.advance());
                defaultType = Optional.of(pack ? returnType() : type());
            }
            parameters.add(new GenericDeclaration.GenericParameter(context.spanFrom(start), info, equal, defaultType));
            if (!context.check(TokenType.COMMA)) {
                break;
            }
            commas.add(context.advance());
        } while (true);
        TokenReference close = context.consumeClosingAngle();
        return new GenericDeclaration(new ContainedSpan(open, close), new Punctuated<>(parameters, commas));
    }

    private TypeInfo optionalSuffixes(int start, TypeInfo type) {
        TypeInfo result = type;
        while (context.check(TokenType.QUESTION)) {
            TokenReference question = context.advance();
            result = new TypeInfo.OptionalType(context.spanFrom(start), result, question);
        }
        return result;
    }

    private boolean isGenericPack() {
        return context.check(TokenType.IDENTIFIER) && context.checkNext(TokenType.ELLIPSIS);
    }

    private TypeInfo simpleType() {
        int start = context.peek().token().start();
        TokenReference token = context.peek();
        switch (token.type()) {
            case NIL:
                context.advance();
                return new TypeInfo.Basic(context.spanFrom(start), token);
            case TRUE:
            case FALSE:
                context.advance();
                return new TypeInfo.Boolean(context.spanFrom(start), token);
            case STRING:
                context.advance();
                return new TypeInfo.StringLiteral(context.spanFrom(start), token);
            case LEFT_BRACE:
                return tableOrArray(start);
            case LEFT_PAREN:
            case LESS_THAN:
                return parenthesizedOrCallback(start);
            case ELLIPSIS:
                return variadicType();
            case IDENTIFIER:
                break;
            default:
                throw context.error("Unexpected token '" + token.text() + "' while parsing type.");
        }

        if (context.checkIdentifier("typeof") && context.checkNext(TokenType.LEFT_PAREN)) {
            TokenReference typeofToken = context.advance();
            TokenReference open = context.advance();
            Expr inner = context.expression();
            TokenReference close = context.consume(TokenType.RIGHT_PAREN, "Expected ')' after typeof expression.");
            return new TypeInfo.Typeof(context.spanFrom(start), typeofToken, new ContainedSpan(open, close), inner);
        }
        if (isGenericPack()) {
            return variadicType();
        }
        TokenReference name = context.advance();
        if (context.check(TokenType.DOT) && context.checkNext(TokenType.IDENTIFIER)) {
            TokenReference dot = context.advance();
            int innerStart = context.peek().token().start();
            TokenReference typeName = context.advance();
            TypeInfo inner = basicOrGeneric(innerStart, typeName);
            return new TypeInfo.Module(context.spanFrom(start), name, dot, inner);
        }
        return basicOrGeneric(start, name);
    }

    private TypeInfo basicOrGeneric(int start, TokenReference name) {
        if (!context.check(TokenType.LESS_THAN)) {
            return new TypeInfo.Basic(context.spanFrom(start), name);
        }
        TokenReference open = context.advance();
        List<TypeInfo> generics = new ArrayList<>();
        List<TokenReference> commas = new ArrayList<>();
        if (!context.check(TokenType.GREATER_THAN) && !context.check(TokenType.DOUBLE_GREATER_THAN)) {
            do {
                generics.add(typeParameter());
                if (!context.check(TokenType.COMMA)) {
                    break;
                }
                commas.add(context.advance());
            } while (true);
        }
        TokenReference close = context.consumeClosingAngle();
        return new TypeInfo.Generic(context.spanFrom(start), name, new ContainedSpan(open, close),
                new Punctuated<>(generics, commas));
    }

    private TypeInfo typeParameter() {
        if (context.check(TokenType.ELLIPSIS) || isGenericPack()) {
            return variadicType();
        }
        return type();
    }

    private TypeInfo tableOrArray(int start) {
        TokenReference open = context.advance();
        boolean isTable = context.check(TokenType.RIGHT_BRACE)
                || context.check(TokenType.LEFT_BRACKET)
                || (context.check(TokenType.IDENTIFIER) && context.checkNext(TokenType.COLON));
        if (!isTable) {
            TypeInfo element = type();
            TokenReference close = context.consume(TokenType.RIGHT_BRACE, "Expected '}' to close array type.");
            return new TypeInfo.Array(context.spanFrom(start), new ContainedSpan(open, close), element);
        }

        List<TypeField> fields = new ArrayList<>();
        List<TokenReference> separators = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACE)) {
            int fieldStart = context.peek().token().start();
            TypeField.Key key;
            if (context.check(TokenType.LEFT_BRACKET)) {
                TokenReference openBracket = context.advance();
                TypeInfo inner = type();
                TokenReference closeBracket = context.consume(TokenType.RIGHT_BRACKET, "Expected ']' in table type indexer.");
                key = new TypeField.IndexSignature(new ContainedSpan(openBracket, closeBracket), inner);
            } else {
                key = new TypeField.NameKey(context.consume(TokenType.IDENTIFIER, "Expected property name in table type."));
            }
            TokenReference colon = context.consume(TokenType.COLON, "Expected ':' in table type.");
            TypeInfo value = type();
            fields.add(new TypeField(context.spanFrom(fieldStart), key, colon, value));
            if (context.check(TokenType.COMMA) || context.check(TokenType.SEMICOLON)) {
                separators.add(context.advance());
            } else {
                break;
            }
        }
        TokenReference close = context.consume(TokenType.RIGHT_BRACE, "Expected '}' to close table type.");
        return new TypeInfo.Table(context.spanFrom(start), new ContainedSpan(open, close), new Punctuated<>(fields, separators));
    }

    /**
     * Parses {@code (A, B)} followed by an optional {@code -> R}, or {@code <T>(A) -> R}.
     */
    private TypeInfo parenthesizedOrCallback(int start) {
        Optional<GenericDeclaration> generics = context.check(TokenType.LESS_THAN)
                ? Optional.of(genericDeclaration(false))
                : Optional.empty();
        TokenReference open = context.consume(TokenType.LEFT_PAREN, "Expected '(' in function type.");
        List<TypeInfo.TypeArgument> arguments = new ArrayList<>();
        List<TokenReference> commas = new ArrayList<>();
        boolean named = false;
        if (!context.check(TokenType.RIGHT_PAREN)) {
            do {
                int argumentStart = context.peek().token().start();
                Optional<TokenReference> name = Optional.empty();
                Optional<TokenReference> colon = Optional.empty();
                if (context.check(TokenType.IDENTIFIER) && context.checkNext(TokenType.COLON)) {
                    name = Optional.of(context.advance());
                    colon = Optional.of(context.advance());
                    named = true;
                }
                TypeInfo argumentType = typeParameter();
                arguments.add(new TypeInfo.TypeArgument(context.spanFrom(argumentStart), name, colon, argumentType));
                if (!context.check(TokenType.COMMA)) {
                    break;
                }
                commas.add(context.advance());
            } while (true);
        }
        TokenReference close = context.consume(TokenType.RIGHT_PAREN, "Expected ')' to close type list.");
        ContainedSpan parentheses = new ContainedSpan(open, close);

        if (context.check(TokenType.ARROW) || generics.isPresent()) {
            TokenReference arrow = context.consume(TokenType.ARROW, "Expected '->' in function type.");
            TypeInfo returnType = returnType();
            return new TypeInfo.Callback(context.spanFrom(start), generics, parentheses,
                    new Punctuated<>(arguments, commas), arrow, returnType);
        }
        if (named) {
            throw context.error("Named types are only allowed in function type arguments.");
        }
        List<TypeInfo> types = new ArrayList<>();
        for (TypeInfo.TypeArgument argument : arguments) {
            types.add(argument.type());
        }
        return new TypeInfo.Tuple(context.spanFrom(start), parentheses, new Punctuated<>(types, commas));
    }
}
