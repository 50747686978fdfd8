package org.lunaform.compiler.api;

/**
 * Identifies what kind of node the converter was building when it met a shape it does not model.
 * Tests match on these codes instead of on message text.
 */
public enum ConversionErrorKind {
    STATEMENT("statement"),
    LAST_STATEMENT("last statement"),
    VARIABLE("variable"),
    FUNCTION_ARGUMENTS("function arguments"),
    CALL("call"),
    INDEX("index"),
    SUFFIX("suffix"),
    PREFIX("prefix"),
    /** A numeric literal that none of the per-base parsers accepted. */
    NUMBER("number"),
    EXPRESSION("expression"),
    FUNCTION_PARAMETER("function parameter"),
    FUNCTION_PARAMETERS("function parameters"),
    TABLE_ENTRY("table entry"),
    BINARY_OPERATOR("binary operator"),
    COMPOUND_OPERATOR("compound operator"),
    UNARY_OPERATOR("unary operator"),
    STRING("string"),
    INTERPOLATED_STRING("interpolated string"),
    TYPE("type"),
    TABLE_TYPE_PROPERTY("table type property"),
    GENERICS("generic declaration"),
    /** A token kind showed up as trivia although it is neither a comment nor whitespace. */
    UNEXPECTED_TRIVIA("trivia"),
    /** A function declaration without any name part. */
    EXPECTED_FUNCTION_NAME("function name"),
    /** A value stack did not hold what an assembly step expected. Always a converter bug. */
    INTERNAL_STACK("internal stack");

    private final String description;

    ConversionErrorKind(String description) {
        this.description = description;
    }

    /**
     * @return the human readable name used in error messages.
     */
    public String description() {
        return description;
    }
}
