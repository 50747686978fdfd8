package org.lunaform.compiler.nodes.expressions;

/**
 * An assignable prefix: an identifier, a field expression or an index expression.
 */
public interface Variable extends Prefix {
}
