package org.lunaform.compiler.nodes.expressions;

/**
 * An expression that can be called, indexed or have a field read: identifiers, calls, field and
 * index expressions and parenthesized expressions.
 */
public interface Prefix extends Expression {
}
