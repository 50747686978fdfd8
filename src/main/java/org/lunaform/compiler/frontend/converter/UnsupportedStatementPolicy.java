package org.lunaform.compiler.frontend.converter;

/**
 * What the converter does with statements the node model has no counterpart for, such as
 * {@code goto} and labels.
 */
public enum UnsupportedStatementPolicy {
    /** Replace the statement with an empty {@code do end} block and log it. */
    PLACEHOLDER,
    /** Fail the conversion with a statement error. */
    ERROR
}
