package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Token;

import java.util.Optional;

/**
 * A numeric literal in decimal, hexadecimal or binary notation.
 */
public interface NumberExpression extends Expression {

    double computeValue();

    Optional<Token> getToken();

    void setToken(Token token);
}
