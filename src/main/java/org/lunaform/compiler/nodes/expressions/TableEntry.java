package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;

/**
 * One entry of a {@link TableExpression}.
 */
public interface TableEntry extends Node {
}
