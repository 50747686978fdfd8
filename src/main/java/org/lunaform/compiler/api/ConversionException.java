package org.lunaform.compiler.api;

/**
 * Thrown when a parse tree cannot be converted into the node model.
 * <p>
 * Conversion is fail-fast: when this exception escapes, no partial tree is produced.
 */
public class ConversionException extends Exception {

    private final ConversionErrorKind kind;
    private final String snippet;

    /**
     * Constructs an exception for a construct the converter does not model.
     * @param kind What kind of node was being built.
     * @param snippet The source text of the offending construct.
     */
    public ConversionException(ConversionErrorKind kind, String snippet) {
        this(kind, snippet, String.format("unable to convert %s from `%s`", kind.description(), snippet));
    }

    /**
     * Constructs an exception with a custom message.
     * @param kind What kind of node was being built.
     * @param snippet The source text of the offending construct, may be empty.
     * @param message The detail message.
     */
    protected ConversionException(ConversionErrorKind kind, String snippet, String message) {
        super(message);
        this.kind = kind;
        this.snippet = snippet;
    }

    /**
     * Builds the error reported when a numeric literal cannot be parsed.
     * @param number The literal text.
     * @param reason The message of the underlying number parser.
     * @return The exception to throw.
     */
    public static ConversionException number(String number, String reason) {
        return new ConversionException(ConversionErrorKind.NUMBER, number,
                String.format("unable to convert number from `%s` (%s)", number, reason));
    }

    /**
     * Builds the error reported when a trivia lexeme is neither a comment nor whitespace.
     * @param tokenKind The name of the unexpected token kind.
     * @return The exception to throw.
     */
    public static ConversionException unexpectedTrivia(String tokenKind) {
        return new ConversionException(ConversionErrorKind.UNEXPECTED_TRIVIA, tokenKind,
                String.format("unable to convert trivia from token kind `%s`", tokenKind));
    }

    /**
     * Builds the error reported for a function declaration without a name.
     * @return The exception to throw.
     */
    public static ConversionException expectedFunctionName() {
        return new ConversionException(ConversionErrorKind.EXPECTED_FUNCTION_NAME, "",
                "unable to convert empty function name");
    }

    public ConversionErrorKind getKind() {
        return kind;
    }

    public String getSnippet() {
        return snippet;
    }
}
