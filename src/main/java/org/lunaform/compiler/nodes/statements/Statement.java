package org.lunaform.compiler.nodes.statements;

import org.lunaform.compiler.nodes.Node;

public interface Statement extends Node {
}
