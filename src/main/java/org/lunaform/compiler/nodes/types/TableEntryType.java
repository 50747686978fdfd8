package org.lunaform.compiler.nodes.types;

import org.lunaform.compiler.nodes.Node;

public interface TableEntryType extends Node {
}
