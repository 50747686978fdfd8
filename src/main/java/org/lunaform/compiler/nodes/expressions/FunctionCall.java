package org.lunaform.compiler.nodes.expressions;

import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.statements.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A call such as {@code print("hi")} or {@code object:method(1)}. A call is usable both as a
 * statement and as a prefix.
 */
public class FunctionCall implements Prefix, Statement {

    private Prefix prefix;
    private Arguments arguments;
    private Identifier method;
    private Token colon;

    public FunctionCall(Prefix prefix, Arguments arguments) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.arguments = Objects.requireNonNull(arguments, "arguments");
    }

    /**
     * Creates a call with no argument.
     */
    public static FunctionCall fromName(String name) {
        return new FunctionCall(new Identifier(name), new TupleArguments());
    }

    public FunctionCall withMethod(Identifier method) {
        this.method = method;
        return this;
    }

    public FunctionCall withColon(Token colon) {
        this.colon = colon;
        return this;
    }

    /**
     * Appends an argument. A string or table argument is first turned into a tuple.
     */
    public FunctionCall withArgument(Expression argument) {
        if (arguments instanceof TupleArguments) {
            ((TupleArguments) arguments).pushValue(argument);
        } else {
            TupleArguments tuple = new TupleArguments();
            tuple.pushValue((Expression) arguments);
            tuple.pushValue(argument);
            arguments = tuple;
        }
        return this;
    }

    public Prefix getPrefix() {
        return prefix;
    }

    public void setPrefix(Prefix prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    public Arguments getArguments() {
        return arguments;
    }

    public void setArguments(Arguments arguments) {
        this.arguments = Objects.requireNonNull(arguments, "arguments");
    }

    public Optional<Identifier> getMethod() {
        return Optional.ofNullable(method);
    }

    public void setMethod(Identifier method) {
        this.method = method;
    }

    public Optional<Token> getColon() {
        return Optional.ofNullable(colon);
    }

    public void setColon(Token colon) {
        this.colon = colon;
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(3);
        children.add(prefix);
        if (method != null) {
            children.add(method);
        }
        children.add(arguments);
        return children;
    }

    @Override
    public void forEachOwnToken(Consumer<Token> action) {
        if (colon != null) {
            action.accept(colon);
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
