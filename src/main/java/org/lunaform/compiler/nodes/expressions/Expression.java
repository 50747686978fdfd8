package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;

/**
 * A node producing a value.
 */
public interface Expression extends Node {
}
