package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;

/**
 * The arguments of a {@link FunctionCall}: a parenthesized tuple, a bare string or a bare table.
 */
public interface Arguments extends Node {
}
