package org.lunaform.compiler.frontend.syntax;

import java.util.List;

/**
 * An expression of the parse tree. Calls, variables and table constructors implement this
 * interface from their own files since they also appear in other positions.
 */
public interface Expr extends SyntaxNode {

    record Binary(Span span, Expr left, TokenReference operator, Expr right) implements Expr {
    }

    record Unary(Span span, TokenReference operator, Expr operand) implements Expr {
    }

    record Parentheses(Span span, ContainedSpan parentheses, Expr inner) implements Expr {
    }

    record Function(Span span, TokenReference function, FunctionBodySyntax body) implements Expr {
    }

    record Number(Span span, TokenReference token) implements Expr {
    }

    /** A quoted or long bracket string. Also usable as call arguments. */
    record StringLiteral(Span span, TokenReference token) implements Expr, Args {
    }

    /** {@code nil}, {@code true}, {@code false} or {@code ...}. */
    record Symbol(Span span, TokenReference token) implements Expr {
    }

    record IfExpression(Span span, TokenReference ifToken, Expr condition, TokenReference then,
                        Expr result, List<ElseIfExpression> elseIfs, TokenReference elseToken,
                        Expr elseResult) implements Expr {
    }

    record ElseIfExpression(TokenReference elseIf, Expr condition, TokenReference then, Expr result) {
    }

    /**
     * An interpolated string. Each segment is the literal lexeme that precedes an embedded
     * expression; {@code last} is the lexeme that closes the string.
     */
    record InterpolatedString(Span span, List<InterpolatedSegment> segments,
                              TokenReference last) implements Expr {
    }

    record InterpolatedSegment(TokenReference literal, Expr expression) {
    }

    /** {@code expression :: Type}. */
    record TypeAssertion(Span span, Expr expression, TokenReference doubleColon,
                         TypeInfo castTo) implements Expr {
    }
}
