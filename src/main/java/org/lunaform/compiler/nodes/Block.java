package org.lunaform.compiler.nodes;

import org.lunaform.compiler.nodes.statements.LastStatement;
import org.lunaform.compiler.nodes.statements.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * An ordered list of statements with an optional final {@link LastStatement}.
 * <p>
 * When tokens are attached, the semicolon list never holds more entries than there are
 * statements. All mutations go through this class so the two lists stay aligned.
 */
public class Block implements Node {

    private final List<Statement> statements = new ArrayList<>();
    private LastStatement lastStatement;
    private BlockTokens tokens;

    public Block() {
    }

    public Block(List<? extends Statement> statements, LastStatement lastStatement) {
        this.statements.addAll(statements);
        this.lastStatement = lastStatement;
    }

    public Block withStatement(Statement statement) {
        pushStatement(statement);
        return this;
    }

    public Block withLastStatement(LastStatement statement) {
        setLastStatement(statement);
        return this;
    }

    public Block withTokens(BlockTokens tokens) {
        this.tokens = tokens;
        return this;
    }

    public Optional<BlockTokens> getTokens() {
        return Optional.ofNullable(tokens);
    }

    public void setTokens(BlockTokens tokens) {
        this.tokens = tokens;
    }

    public boolean isEmpty() {
        return statements.isEmpty() && lastStatement == null;
    }

    /**
     * @return the number of statements, not counting the last statement.
     */
    public int statementsCount() {
        return statements.size();
    }

    /**
     * @return the number of statements, counting the last statement.
     */
    public int totalLength() {
        return statements.size() + (lastStatement == null ? 0 : 1);
    }

    public List<Statement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public Statement getStatement(int index) {
        return statements.get(index);
    }

    public Optional<LastStatement> getLastStatement() {
        return Optional.ofNullable(lastStatement);
    }

    public void pushStatement(Statement statement) {
        insertStatement(statements.size(), statement);
    }

    /**
     * Inserts a statement. A statement index past the end is clamped to an append.
     */
    public void insertStatement(int index, Statement statement) {
        int position = Math.min(index, statements.size());
        statements.add(position, statement);
        if (tokens != null && position <= tokens.semicolons().size()) {
            tokens.semicolons().add(position, Optional.empty());
        }
    }

    public Statement replaceStatement(int index, Statement statement) {
        return statements.set(index, statement);
    }

    public Statement removeStatement(int index) {
        Statement removed = statements.remove(index);
        if (tokens != null && index < tokens.semicolons().size()) {
            tokens.semicolons().remove(index);
        }
        return removed;
    }

    /**
     * Keeps only the statements accepted by the filter, together with their semicolons.
     */
    public void filterStatements(Predicate<Statement> keep) {
        for (int i = statements.size() - 1; i >= 0; i--) {
            if (!keep.test(statements.get(i))) {
                removeStatement(i);
            }
        }
    }

    public void setLastStatement(LastStatement statement) {
        this.lastStatement = statement;
    }

    /**
     * Removes the last statement and its semicolon.
     * @return the removed statement, if there was one.
     */
    public Optional<LastStatement> takeLastStatement() {
        LastStatement taken = lastStatement;
        lastStatement = null;
        if (tokens != null) {
            tokens = tokens.withLastSemicolon(Optional.empty());
        }
        return Optional.ofNullable(taken);
    }

    public void clear() {
        statements.clear();
        lastStatement = null;
        if (tokens != null) {
            tokens.semicolons().clear();
            tokens = tokens.withLastSemicolon(Optional.empty());
        }
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(statements);
        if (lastStatement != null) {
            children.add(lastStatement);
        }
        return children;
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (tokens != null) {
            tokens.forEach(action);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
