package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;

/**
 * The return type of a function: a {@link Type}, a {@link TypePack}, a {@link VariadicTypePack}
 * or a {@link GenericTypePack}.
 */
public interface FunctionReturnType extends Node {
}
