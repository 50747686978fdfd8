package org.lunaform.compiler.nodes;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Tokens of a {@link Block}.
 *
 * @param semicolons One optional semicolon per statement, in statement order.
 * @param lastSemicolon The semicolon after the last statement.
 * @param finalToken The end of file token of the root block, carrying the trailing trivia of the file.
 */
public record BlockTokens(List<Optional<Token>> semicolons, Optional<Token> lastSemicolon, Optional<Token> finalToken) {

    public BlockTokens withLastSemicolon(Optional<Token> semicolon) {
        return new BlockTokens(semicolons, semicolon, finalToken);
    }

    public void forEach(Consumer<Token> action) {
        semicolons.forEach(semicolon -> semicolon.ifPresent(action));
        lastSemicolon.ifPresent(action);
        finalToken.ifPresent(action);
    }
}
