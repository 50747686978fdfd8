package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;

/**
 * The type of the {@code ...} parameter of a function: a {@link Type} or a {@link GenericTypePack}.
 */
public interface FunctionVariadicType extends Node {
}
