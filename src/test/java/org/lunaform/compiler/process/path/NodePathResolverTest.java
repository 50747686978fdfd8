package org.lunaform.compiler.process.path;

import org.lunaform.compiler.LuaParser;
import org.lunaform.compiler.backend.generator.TokenBasedGenerator;
import org.lunaform.compiler.nodes.Block;
import org.lunaform.compiler.nodes.expressions.BinaryExpression;
import org.lunaform.compiler.nodes.expressions.BinaryOperator;
import org.lunaform.compiler.nodes.expressions.DecimalNumber;
import org.lunaform.compiler.nodes.expressions.FunctionCall;
import org.lunaform.compiler.nodes.expressions.Identifier;
import org.lunaform.compiler.nodes.expressions.ParentheseExpression;
import org.lunaform.compiler.nodes.statements.AssignStatement;
import org.lunaform.compiler.nodes.statements.IfStatement;
import org.lunaform.compiler.nodes.statements.LocalAssignStatement;
import org.lunaform.compiler.nodes.statements.ReturnStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class NodePathResolverTest {

    private static final String SOURCE = String.join("\n",
            "local a = 1 + f(2, 3)",
            "if a then",
            "  print(a)",
            "elseif b then",
            "  return",
            "else",
            "  x = t.y",
            "end",
            "return a");

    private Block block;

    @BeforeEach
    void setUp() throws Exception {
        block = LuaParser.discardingTokens().parse(SOURCE);
    }

    @Test
    void resolvesStatements() throws Exception {
        assertThat(NodePathResolver.resolve(block, NodePath.root())).containsSame(block);
        assertThat(NodePathResolver.resolveStatement(block, NodePath.parse("0/"))).get().isInstanceOf(LocalAssignStatement.class);
        assertThat(NodePathResolver.resolveStatement(block, NodePath.parse("1/"))).get().isInstanceOf(IfStatement.class);
        assertThat(NodePathResolver.resolveLastStatement(block, NodePath.parse("2/"))).get().isInstanceOf(ReturnStatement.class);
        assertThat(NodePathResolver.resolveStatement(block, NodePath.parse("2/"))).isEmpty();
        assertThat(NodePathResolver.resolve(block, NodePath.parse("3/"))).isEmpty();
    }

    /**
     * Block components of an if statement count its branches first and the else block last.
     */
    @Test
    void resolvesBlocksOfIfStatements() throws Exception {
        assertThat(NodePathResolver.resolveStatement(block, NodePath.parse("1/0#0/"))).get().isInstanceOf(FunctionCall.class);
        assertThat(NodePathResolver.resolveLastStatement(block, NodePath.parse("1/1#0/"))).get().isInstanceOf(ReturnStatement.class);
        assertThat(NodePathResolver.resolveStatement(block, NodePath.parse("1/2#0/"))).get().isInstanceOf(AssignStatement.class);
        assertThat(NodePathResolver.resolveBlock(block, NodePath.parse("1/2#"))).isPresent();
        assertThat(NodePathResolver.resolve(block, NodePath.parse("1/3#"))).isEmpty();
    }

    @Test
    void resolvesExpressionsDependingOnTheParent() throws Exception {
        assertThat(NodePathResolver.resolveExpression(block, NodePath.parse("0/0:"))).get().isInstanceOf(BinaryExpression.class);
        assertThat(NodePathResolver.resolveExpression(block, NodePath.parse("0/0:1:"))).get().isInstanceOf(FunctionCall.class);
        assertThat(NodePathResolver.resolveExpression(block, NodePath.parse("0/0:1:1:")))
                .get().isInstanceOfSatisfying(DecimalNumber.class, number -> assertThat(number.getValue()).isEqualTo(3.0));
        assertThat(NodePathResolver.resolveExpression(block, NodePath.parse("1/0:")))
                .get().isInstanceOfSatisfying(Identifier.class, identifier -> assertThat(identifier.getName()).isEqualTo("a"));
        assertThat(NodePathResolver.resolve(block, NodePath.parse("0/1:"))).isEmpty();
        assertThat(NodePathResolver.resolve(block, NodePath.parse("0/0#"))).isEmpty();
    }

    @Test
    void resolvesValuesOfLocalAssignments() throws Exception {
        // Arrange
        Block local = LuaParser.discardingTokens().parse("local a, b = 1, 2");
        NodePath path = NodePath.root().withStatement(0).withExpression(1);

        // Act & Assert
        assertThat(NodePathResolver.resolveExpression(local, path))
                .get().isInstanceOfSatisfying(DecimalNumber.class, number -> assertThat(number.getValue()).isEqualTo(2.0));
    }

    @Test
    void wrapsExpressionsPlacedInPrefixSlots() throws Exception {
        // Arrange
        NodePath prefix = NodePath.parse("1/2#0/0:0:");
        BinaryExpression sum = new BinaryExpression(BinaryOperator.PLUS, new Identifier("a"), new Identifier("b"));

        // Act
        boolean replaced = NodePathResolver.replaceExpression(block, prefix, sum);

        // Assert
        assertThat(replaced).isTrue();
        assertThat(NodePathResolver.resolveExpression(block, prefix))
                .get().isInstanceOfSatisfying(ParentheseExpression.class,
                        parenthese -> assertThat(parenthese.getInnerExpression()).isSameAs(sum));
    }

    @Test
    void replacesArguments() throws Exception {
        // Act
        boolean replaced = NodePathResolver.replaceExpression(block, NodePath.parse("1/0#0/0:"), new Identifier("z"));

        // Assert
        assertThat(replaced).isTrue();
        assertThat(generate()).contains("print(z)");
        assertThat(NodePathResolver.replaceExpression(block, NodePath.parse("1/0#0/1:"), new Identifier("z"))).isFalse();
    }

    @Test
    void insertsAndRemovesStatements() throws Exception {
        // Act
        boolean inserted = NodePathResolver.insertStatement(block, NodePath.parse("1/0#1/"), FunctionCall.fromName("after"));
        boolean removed = NodePathResolver.removeStatement(block, NodePath.parse("1/2#0/"));

        // Assert
        assertThat(inserted).isTrue();
        assertThat(removed).isTrue();
        assertThat(generate()).isEqualTo("local a=1+f(2,3)if a then print(a)after()elseif b then return else end return a");
        assertThat(NodePathResolver.insertStatement(block, NodePath.parse("1/0#5/"), FunctionCall.fromName("late"))).isFalse();
    }

    @Test
    void removesLastStatementAtTheStatementCount() throws Exception {
        // Act
        boolean removed = NodePathResolver.removeStatement(block, NodePath.parse("2/"));

        // Assert
        assertThat(removed).isTrue();
        assertThat(block.getLastStatement()).isEmpty();
        assertThat(block.statementsCount()).isEqualTo(2);
        assertThat(NodePathResolver.removeStatement(block, NodePath.parse("2/"))).isFalse();
    }

    @Test
    void replacesOnlyRegularStatements() throws Exception {
        assertThat(NodePathResolver.replaceStatement(block, NodePath.parse("2/"), FunctionCall.fromName("g"))).isFalse();
        assertThat(NodePathResolver.replaceStatement(block, NodePath.parse("0/"), FunctionCall.fromName("g"))).isTrue();
        assertThat(generate()).startsWith("g()if a then");
    }

    private String generate() {
        return new TokenBasedGenerator().generate(block);
    }
}
