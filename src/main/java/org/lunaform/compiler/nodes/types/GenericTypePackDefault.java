package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;

/**
 * The default of a generic type pack: a {@link TypePack}, a {@link VariadicTypePack} or a
 * {@link GenericTypePack}.
 */
public interface GenericTypePackDefault extends Node {
}
