package org.lunaform.compiler.frontend.syntax;

import java.util.List;
import java.util.Optional;

/**
 * A sequence of statements, optionally terminated by a last statement.
 *
 * @param span The covered source range.
 * @param statements The statements in source order.
 * @param semicolons The optional semicolon following each statement, aligned with {@code statements}.
 * @param lastStatement The return, break or continue statement ending the block.
 * @param lastSemicolon The optional semicolon following the last statement.
 */
public record SyntaxBlock(
        Span span,
        List<Stmt> statements,
        List<Optional<TokenReference>> semicolons,
        Optional<LastStmt> lastStatement,
        Optional<TokenReference> lastSemicolon
) implements SyntaxNode {

    public SyntaxBlock {
        statements = List.copyOf(statements);
        semicolons = List.copyOf(semicolons);
    }
}
