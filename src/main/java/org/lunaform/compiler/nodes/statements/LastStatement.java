package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.Node;

/**
 * A statement that can only end a block: {@code return}, {@code break} or {@code continue}.
 */
public interface LastStatement extends Node {
}
