package org.lunaform.compiler.api;

/**
 * Signals that an assembly step of the converter did not find the value it expected on one of
 * its per-category stacks, or that stacks were left unbalanced after a conversion.
 * This never describes malformed input; it is an invariant violation inside the converter.
 */
public class InternalStackException extends ConversionException {

    private final String category;

    /**
     * @param category The name of the value stack that was empty or unbalanced.
     */
    public InternalStackException(String category) {
        super(ConversionErrorKind.INTERNAL_STACK, category,
                String.format("internal conversion stack expected to find an item of `%s`", category));
        this.category = category;
    }

    /**
     * @param category The name of the value stack that was left unbalanced.
     * @param remaining How many items were still on it.
     */
    public InternalStackException(String category, int remaining) {
        super(ConversionErrorKind.INTERNAL_STACK, category,
                String.format("internal conversion stack `%s` still holds %d item(s) after conversion", category, remaining));
        this.category = category;
    }

    public String getCategory() {
        return category;
    }
}
