package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;

/**
 * The variadic tail of a type pack or a function type: a {@link VariadicTypePack} or a
 * {@link GenericTypePack}.
 */
public interface VariadicArgumentType extends Node {
}
