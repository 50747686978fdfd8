package org.lunaform.compiler.process;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.Trivia;

import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Operations applied to every token held anywhere under a node.
 * Each token is reached exactly once, through the node that owns it.
 */
public final class TokenOperations {

    private TokenOperations() {
    }

    public static void clearComments(Node root) {
        forEachToken(root, Token::clearComments);
    }

    public static void clearWhitespaces(Node root) {
        forEachToken(root, Token::clearWhitespaces);
    }

    /**
     * Removes every comment rejected by the predicate.
     * @param root The subtree to process.
     * @param keep Returns true for the comments to keep.
     */
    public static void filterComments(Node root, Predicate<Trivia> keep) {
        forEachToken(root, token -> token.filterComments(keep));
    }

    /**
     * Adds {@code amount} to the line number of every token and trivia under the node.
     * @param root The subtree to process.
     * @param amount The number of lines to shift by, may be negative.
     */
    public static void shiftTokenLine(Node root, int amount) {
        forEachToken(root, token -> token.shiftTokenLine(amount));
    }

    /**
     * Detaches the subtree from the source text: every referenced token and trivia gets its
     * content copied in.
     * @param root The subtree to process.
     * @param source The source the tokens were created from.
     */
    public static void replaceReferencedTokens(Node root, String source) {
        forEachToken(root, token -> token.replaceReferencedTokens(source));
    }

    public static int countTokens(Node root) {
        int[] count = new int[1];
        forEachToken(root, token -> count[0]++);
        return count[0];
    }

    /**
     * Applies an action to every token under a node.
     * @param root The subtree to process.
     * @param action Called once per token.
     */
    public static void forEachToken(Node root, Consumer<Token> action) {
        TreeWalker.walk(root, node -> node.forEachOwnToken(action));
    }
}
