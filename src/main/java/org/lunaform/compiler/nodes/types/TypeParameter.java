package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;

/**
 * A parameter given to a generic type name: a {@link Type}, a {@link TypePack}, a
 * {@link VariadicTypePack} or a {@link GenericTypePack}.
 */
public interface TypeParameter extends Node {
}
