package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;

/**
 * A part of an {@link InterpolatedStringExpression}: literal text or an embedded value.
 */
public interface InterpolationSegment extends Node {
}
