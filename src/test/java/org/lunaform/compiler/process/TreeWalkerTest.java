package org.lunaform.compiler.process;

import org.lunaform.compiler.LuaParser;
import org.lunaform.compiler.nodes.Block;
import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.expressions.Expression;
import org.lunaform.compiler.nodes.expressions.FunctionCall;
import org.lunaform.compiler.nodes.expressions.Identifier;
import org.lunaform.compiler.nodes.expressions.UnaryExpression;
import org.lunaform.compiler.nodes.expressions.UnaryOperator;
import org.lunaform.compiler.nodes.statements.ReturnStatement;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class TreeWalkerTest {

    @Mock
    private Consumer<Node> callHandler;

    @Mock
    private Consumer<Node> returnHandler;

    @Test
    void visitsParentsBeforeChildrenInSourceOrder() throws Exception {
        // Arrange
        Block block = LuaParser.discardingTokens().parse("local a = b");
        List<String> visited = new ArrayList<>();

        // Act
        TreeWalker.walk(block, node -> visited.add(node instanceof Identifier identifier
                ? identifier.getName()
                : node.getClass().getSimpleName()));

        // Assert
        assertThat(visited).containsExactly("Block", "LocalAssignStatement", "TypedIdentifier", "a", "b");
    }

    @Test
    void runsOnlyRegisteredHandlers() throws Exception {
        // Arrange
        Block block = LuaParser.discardingTokens().parse("print(a, b.c) f()");
        List<String> names = new ArrayList<>();
        int[] calls = new int[1];
        Map<Class<? extends Node>, Consumer<Node>> handlers = Map.of(
                Identifier.class, node -> names.add(((Identifier) node).getName()),
                FunctionCall.class, node -> calls[0]++);

        // Act
        new TreeWalker(handlers).walk(block);

        // Assert
        assertThat(names).containsExactly("print", "a", "b", "c", "f");
        assertThat(calls[0]).isEqualTo(2);
    }

    @Test
    void dispatchesOnTheExactNodeClass() throws Exception {
        // Arrange
        Block block = LuaParser.discardingTokens().parse("f(g())");
        FunctionCall outer = (FunctionCall) block.getStatement(0);

        // Act
        new TreeWalker(Map.of(FunctionCall.class, callHandler, ReturnStatement.class, returnHandler)).walk(block);

        // Assert
        InOrder order = inOrder(callHandler);
        order.verify(callHandler).accept(outer);
        order.verify(callHandler).accept(any(FunctionCall.class));
        verify(callHandler, times(2)).accept(any());
        verify(returnHandler, never()).accept(any());
    }

    @Test
    void walksDeeplyNestedTrees() {
        // Arrange
        Expression expression = new Identifier("x");
        for (int i = 0; i < 100_000; i++) {
            expression = new UnaryExpression(UnaryOperator.NOT, expression);
        }
        Block block = new Block().withLastStatement(new ReturnStatement(List.of(expression)));
        int[] count = new int[1];

        // Act
        TreeWalker.walk(block, node -> count[0]++);

        // Assert
        assertThat(count[0]).isEqualTo(100_003);
    }
}
