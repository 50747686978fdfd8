package org.lunaform.compiler.backend.generator;

import org.lunaform.compiler.LuaParser;
import org.lunaform.compiler.nodes.Block;
import org.lunaform.compiler.nodes.TypedIdentifier;
import org.lunaform.compiler.nodes.expressions.BinaryExpression;
import org.lunaform.compiler.nodes.expressions.BinaryNumber;
import org.lunaform.compiler.nodes.expressions.BinaryOperator;
import org.lunaform.compiler.nodes.expressions.DecimalNumber;
import org.lunaform.compiler.nodes.expressions.FunctionCall;
import org.lunaform.compiler.nodes.expressions.HexNumber;
import org.lunaform.compiler.nodes.expressions.Identifier;
import org.lunaform.compiler.nodes.expressions.ParentheseExpression;
import org.lunaform.compiler.nodes.expressions.TupleArguments;
import org.lunaform.compiler.nodes.expressions.TypeCastExpression;
import org.lunaform.compiler.nodes.expressions.UnaryExpression;
import org.lunaform.compiler.nodes.expressions.UnaryOperator;
import org.lunaform.compiler.nodes.statements.LocalAssignStatement;
import org.lunaform.compiler.nodes.statements.ReturnStatement;
import org.lunaform.compiler.nodes.types.OptionalType;
import org.lunaform.compiler.nodes.types.TypeName;
import org.lunaform.compiler.nodes.types.UnionType;
import org.lunaform.compiler.process.TokenOperations;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TokenBasedGeneratorTest {

    private static final String[] SOURCES = {
            "",
            "-- only a comment",
            "\n\n  local a = 1  \n\n",
            "print('hello') ; print \"x\" f{1, 2; 3,}",
            "-- header\nlocal function add(a: number, b: number): number\n    return a + b -- sum\nend\n",
            "for i = 1, 10, 2 do\n  t[i] = i ^ 2\nend",
            "for k, v in pairs(t) do print(k, v) end",
            "if a then b() elseif c then d() else e() end",
            "while not done do done = step() end",
            "while true do continue end",
            "while x do break end",
            "repeat local x = f() until x",
            "local t = { a = 1, [\"b\"] = 2, 3 }",
            "local s = `hello {name}!`",
            "x += 1\ny ..= 'z'",
            "a, b = b, a",
            "type Point = { x: number, y: number }\nexport type Map<K, V = string> = { [K]: V }",
            "local f = function(...) return ... end",
            "local v = if a then 1 elseif b then 2 else 3",
            "local n = a :: number",
            "return --[[ block ]] 0x1F, 1e10, 0b101, .5",
            "local a = #t + -b * (c - d) // 2 % 3",
            "do local _ = a.b.c:d(e)[f] end",
            "function a.b.c:d<T>(x: T): T return x end",
            "local x: {number}? = nil",
            "local z: \"on\" | \"off\" = 'on'",
            "local s = [==[\nlong\n]==]",
    };

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 17, 18, 19, 20, 21, 22, 23, 24, 25, 26})
    void reproducesSourceFromTokens(int index) throws Exception {
        // Arrange
        String source = SOURCES[index];
        Block block = LuaParser.preservingTokens().parse(source);

        // Act
        String generated = new TokenBasedGenerator(source).generate(block);

        // Assert
        assertThat(generated).isEqualTo(source);
    }

    /**
     * Without tokens every construct is written from its fallback text. Parsing that output again
     * must give a tree that generates the same text.
     */
    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 17, 18, 19, 20, 21, 22, 23, 24, 25, 26})
    void generatesStableCodeWithoutTokens(int index) throws Exception {
        // Arrange
        Block block = LuaParser.discardingTokens().parse(SOURCES[index]);

        // Act
        String generated = new TokenBasedGenerator().generate(block);
        String regenerated = new TokenBasedGenerator().generate(LuaParser.discardingTokens().parse(generated));

        // Assert
        assertThat(regenerated).isEqualTo(generated);
    }

    @Test
    void writesCompactFallbackText() throws Exception {
        // Arrange
        Block block = LuaParser.discardingTokens().parse("local function add(a, b)\n  return a + b\nend\nprint(add(1, 2))");

        // Act
        String generated = new TokenBasedGenerator().generate(block);

        // Assert
        assertThat(generated).isEqualTo("local function add(a,b)return a+b end print(add(1,2))");
    }

    @Test
    void parenthesizesSyntheticBinaryOperands() {
        // Arrange
        Block block = new Block()
                .withStatement(new LocalAssignStatement(List.of(new TypedIdentifier("a")), List.of(
                        new BinaryExpression(BinaryOperator.ASTERISK,
                                new BinaryExpression(BinaryOperator.PLUS, new DecimalNumber(1), new DecimalNumber(2)),
                                new DecimalNumber(3)))))
                .withLastStatement(new ReturnStatement(List.of(
                        new BinaryExpression(BinaryOperator.MINUS, new Identifier("a"),
                                new BinaryExpression(BinaryOperator.MINUS, new Identifier("b"), new Identifier("c"))),
                        new BinaryExpression(BinaryOperator.CARET,
                                new UnaryExpression(UnaryOperator.MINUS, new DecimalNumber(2)), new DecimalNumber(2)))));

        // Act
        String generated = new TokenBasedGenerator().generate(block);

        // Assert
        assertThat(generated).isEqualTo("local a=(1+2)*3 return a-(b-c),(-2)^2");
    }

    @Test
    void separatesSyntheticTextThatWouldMerge() {
        // Arrange
        Block block = new Block().withLastStatement(new ReturnStatement(List.of(
                new UnaryExpression(UnaryOperator.MINUS, new UnaryExpression(UnaryOperator.MINUS, new Identifier("x"))),
                new BinaryExpression(BinaryOperator.CONCAT, new DecimalNumber(1), new Identifier("b")),
                new BinaryExpression(BinaryOperator.CONCAT, new Identifier("a1"), new Identifier("b")))));

        // Act
        String generated = new TokenBasedGenerator().generate(block);

        // Assert
        assertThat(generated).isEqualTo("return- -x,1 ..b,a1..b");
    }

    @Test
    void insertsSemicolonBeforeStatementStartingWithParenthese() {
        // Arrange
        Block block = new Block()
                .withStatement(FunctionCall.fromName("f"))
                .withStatement(new FunctionCall(new ParentheseExpression(new Identifier("g")), new TupleArguments()));

        // Act
        String generated = new TokenBasedGenerator().generate(block);

        // Assert
        assertThat(generated).isEqualTo("f();(g)()");
    }

    @Test
    void parenthesizesSyntheticTypes() {
        // Arrange
        Block block = new Block()
                .withStatement(new LocalAssignStatement(List.of(new TypedIdentifier("x").withType(
                        new OptionalType(new UnionType(new TypeName("string"), new TypeName("number"))))), List.of()))
                .withLastStatement(new ReturnStatement(List.of(new TypeCastExpression(
                        new BinaryExpression(BinaryOperator.PLUS, new Identifier("a"), new Identifier("b")),
                        new TypeName("number")))));

        // Act
        String generated = new TokenBasedGenerator().generate(block);

        // Assert
        assertThat(generated).isEqualTo("local x:(string|number)?return(a+b)::number");
    }

    @Test
    void mixesSourceTokensWithInjectedNodes() throws Exception {
        // Arrange
        String source = "local a = 1";
        Block block = LuaParser.preservingTokens().parse(source);
        block.pushStatement(FunctionCall.fromName("print").withArgument(new Identifier("a")));

        // Act
        String generated = new TokenBasedGenerator(source).generate(block);

        // Assert
        assertThat(generated).isEqualTo("local a = 1 print(a)");
    }

    @Test
    void keepsTokensApartAndOnTheirLinesWithoutWhitespace() throws Exception {
        // Arrange
        String source = "local a = 1 -- one\n\nreturn a";
        Block block = LuaParser.preservingTokens().parse(source);
        TokenOperations.clearWhitespaces(block);

        // Act
        String generated = new TokenBasedGenerator(source).generate(block);

        // Assert
        assertThat(generated).isEqualTo("local a=1-- one\n\nreturn a");
    }

    @Test
    void closesSingleLineCommentsBeforeTheNextToken() throws Exception {
        // Arrange
        String source = "local a = 1 -- one\nreturn a";
        Block block = LuaParser.preservingTokens().parse(source);
        TokenOperations.clearWhitespaces(block);
        TokenOperations.shiftTokenLine(block, -5);

        // Act
        String generated = new TokenBasedGenerator(source).generate(block);

        // Assert
        assertThat(generated).isEqualTo("local a=1-- one\nreturn a");
    }

    @Test
    void requiresTheSourceForReferencedTokens() throws Exception {
        // Arrange
        String source = "return 1";
        Block block = LuaParser.preservingTokens().parse(source);

        // Act & Assert
        assertThatThrownBy(() -> new TokenBasedGenerator().generate(block))
                .isInstanceOf(IllegalStateException.class);

        TokenOperations.replaceReferencedTokens(block, source);
        assertThat(new TokenBasedGenerator().generate(block)).isEqualTo(source);
    }

    @Test
    void formatsNumbers() {
        assertThat(TokenBasedGenerator.formatDecimal(new DecimalNumber(1.5))).isEqualTo("1.5");
        assertThat(TokenBasedGenerator.formatDecimal(new DecimalNumber(100))).isEqualTo("100");
        assertThat(TokenBasedGenerator.formatDecimal(new DecimalNumber(2500).withExponent(3, false))).isEqualTo("2.5e3");
        assertThat(TokenBasedGenerator.formatDecimal(new DecimalNumber(Double.NaN))).isEqualTo("(0/0)");
        assertThat(TokenBasedGenerator.formatDecimal(new DecimalNumber(Double.POSITIVE_INFINITY))).isEqualTo("1e999");
        assertThat(TokenBasedGenerator.formatDecimal(new DecimalNumber(1e20))).isEqualTo("1.0E20");

        Block block = new Block().withLastStatement(new ReturnStatement(List.of(
                new HexNumber(255, false), new HexNumber(16, true).withExponent(2), new BinaryNumber(5, true))));
        assertThat(new TokenBasedGenerator().generate(block)).isEqualTo("return 0xff,0X10P2,0B101");
    }

    @Test
    void quotesStrings() {
        assertThat(TokenBasedGenerator.quote("say \"hi\"\n")).isEqualTo("\"say \\\"hi\\\"\\n\"");
        assertThat(TokenBasedGenerator.quote("tab\there\u0001")).isEqualTo("\"tab\\there\\001\"");
        assertThat(TokenBasedGenerator.quote("a\\b`{c}")).isEqualTo("\"a\\\\b`{c}\"");
    }
}
