package org.lunaform.compiler.process.path;

/**
 * Thrown when a string is not a valid serialized {@link NodePath}.
 */
public class NodePathParseException extends Exception {

    private final String input;
    private final String reason;

    /**
     * @param input The text that was parsed.
     * @param reason What is wrong with it.
     */
    public NodePathParseException(String input, String reason) {
        super(String.format("unable to parse path `%s`: %s", input, reason));
        this.input = input;
        this.reason = reason;
    }

    public String getInput() {
        return input;
    }

    public String getReason() {
        return reason;
    }
}
