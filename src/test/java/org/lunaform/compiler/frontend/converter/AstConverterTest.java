package org.lunaform.compiler.frontend.converter;

import org.lunaform.compiler.api.ConversionErrorKind;
import org.lunaform.compiler.api.ConversionException;
import org.lunaform.compiler.api.InternalStackException;
import org.lunaform.compiler.diagnostics.DiagnosticsEngine;
import org.lunaform.compiler.frontend.lexer.Lexer;
import org.lunaform.compiler.frontend.parser.Parser;
import org.lunaform.compiler.frontend.parser.TriviaAttacher;
import org.lunaform.compiler.frontend.syntax.SyntaxTree;
import org.lunaform.compiler.nodes.Block;
import org.lunaform.compiler.nodes.FunctionBody;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TypedIdentifier;
import org.lunaform.compiler.nodes.expressions.BinaryExpression;
import org.lunaform.compiler.nodes.expressions.BinaryNumber;
import org.lunaform.compiler.nodes.expressions.BinaryOperator;
import org.lunaform.compiler.nodes.expressions.DecimalNumber;
import org.lunaform.compiler.nodes.expressions.Expression;
import org.lunaform.compiler.nodes.expressions.FieldExpression;
import org.lunaform.compiler.nodes.expressions.FunctionCall;
import org.lunaform.compiler.nodes.expressions.HexNumber;
import org.lunaform.compiler.nodes.expressions.Identifier;
import org.lunaform.compiler.nodes.expressions.IfExpression;
import org.lunaform.compiler.nodes.expressions.IndexExpression;
import org.lunaform.compiler.nodes.expressions.InterpolatedStringExpression;
import org.lunaform.compiler.nodes.expressions.ParentheseExpression;
import org.lunaform.compiler.nodes.expressions.StringExpression;
import org.lunaform.compiler.nodes.expressions.StringSegment;
import org.lunaform.compiler.nodes.expressions.TableExpression;
import org.lunaform.compiler.nodes.expressions.TableFieldEntry;
import org.lunaform.compiler.nodes.expressions.TableIndexEntry;
import org.lunaform.compiler.nodes.expressions.TableValueEntry;
import org.lunaform.compiler.nodes.expressions.TupleArguments;
import org.lunaform.compiler.nodes.expressions.TypeCastExpression;
import org.lunaform.compiler.nodes.expressions.UnaryExpression;
import org.lunaform.compiler.nodes.expressions.UnaryOperator;
import org.lunaform.compiler.nodes.expressions.ValueSegment;
import org.lunaform.compiler.nodes.statements.AssignStatement;
import org.lunaform.compiler.nodes.statements.CompoundAssignStatement;
import org.lunaform.compiler.nodes.statements.CompoundOperator;
import org.lunaform.compiler.nodes.statements.ContinueStatement;
import org.lunaform.compiler.nodes.statements.DoStatement;
import org.lunaform.compiler.nodes.statements.FunctionStatement;
import org.lunaform.compiler.nodes.statements.GenericForStatement;
import org.lunaform.compiler.nodes.statements.IfStatement;
import org.lunaform.compiler.nodes.statements.LocalAssignStatement;
import org.lunaform.compiler.nodes.statements.LocalFunctionStatement;
import org.lunaform.compiler.nodes.statements.NumericForStatement;
import org.lunaform.compiler.nodes.statements.RepeatStatement;
import org.lunaform.compiler.nodes.statements.ReturnStatement;
import org.lunaform.compiler.nodes.statements.TypeDeclarationStatement;
import org.lunaform.compiler.nodes.statements.WhileStatement;
import org.lunaform.compiler.nodes.types.GenericParameters;
import org.lunaform.compiler.nodes.types.OptionalType;
import org.lunaform.compiler.nodes.types.TableType;
import org.lunaform.compiler.nodes.types.TypeName;
import org.lunaform.compiler.nodes.types.UnionType;
import org.lunaform.compiler.process.TokenOperations;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AstConverterTest {

    private static SyntaxTree syntax(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        SyntaxTree tree = new Parser(source,
                TriviaAttacher.attach(new Lexer(source, diagnostics).scanTokens()), diagnostics)
                .parse()
                .orElseThrow(() -> new AssertionError(diagnostics.summary()));
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return tree;
    }

    private static Block convert(String source) throws ConversionException {
        return new AstConverter(false).convert(syntax(source));
    }

    private static Block convertWithTokens(String source) throws ConversionException {
        return new AstConverter(true).convert(syntax(source));
    }

    private static List<Expression> returned(String source) throws ConversionException {
        return ((ReturnStatement) convert(source).getLastStatement().orElseThrow()).getExpressions();
    }

    private static String name(Expression expression) {
        return ((Identifier) expression).getName();
    }

    // ---------------------------------------------------------------- statements

    @Test
    void convertsLocalAssignmentKeepingOrder() throws Exception {
        // Act
        Block block = convert("local a, b: number = 1, 'x'");

        // Assert
        LocalAssignStatement statement = (LocalAssignStatement) block.getStatement(0);
        assertThat(statement.getVariables()).extracting(TypedIdentifier::getName).containsExactly("a", "b");
        assertThat(statement.getVariables().get(0).getType()).isEmpty();
        assertThat(statement.getVariables().get(1).getType()).containsInstanceOf(TypeName.class);
        assertThat(((DecimalNumber) statement.getValues().get(0)).getValue()).isEqualTo(1.0);
        assertThat(((StringExpression) statement.getValues().get(1)).getValue()).isEqualTo("x");
    }

    @Test
    void convertsAssignmentVariablesAndValuesInOrder() throws Exception {
        // Act
        Block block = convert("a, b.c, d[1] = x, y, z");

        // Assert
        AssignStatement statement = (AssignStatement) block.getStatement(0);
        assertThat(statement.getVariables())
                .hasExactlyElementsOfTypes(Identifier.class, FieldExpression.class, IndexExpression.class);
        assertThat(statement.getValues()).extracting(AstConverterTest::name).containsExactly("x", "y", "z");
    }

    /**
     * Siblings of every list keep the order they have in the source.
     */
    @Test
    void keepsSiblingsInSourceOrder() throws Exception {
        // Act
        Block block = convert("a() b() c(x, y, z) return {1, 2, 3}");

        // Assert
        assertThat(block.getStatements())
                .extracting(statement -> name((Expression) ((FunctionCall) statement).getPrefix()))
                .containsExactly("a", "b", "c");
        TupleArguments arguments = (TupleArguments) ((FunctionCall) block.getStatement(2)).getArguments();
        assertThat(arguments.getValues()).extracting(AstConverterTest::name).containsExactly("x", "y", "z");
        TableExpression table = (TableExpression) ((ReturnStatement) block.getLastStatement().orElseThrow())
                .getExpressions().get(0);
        assertThat(table.getEntries())
                .extracting(entry -> ((DecimalNumber) ((TableValueEntry) entry).getValue()).getValue())
                .containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void convertsCompoundAssignment() throws Exception {
        // Act
        CompoundAssignStatement statement = (CompoundAssignStatement) convert("t.n ..= 'x'").getStatement(0);

        // Assert
        assertThat(statement.getOperator()).isEqualTo(CompoundOperator.CONCAT);
        assertThat(statement.getVariable()).isInstanceOf(FieldExpression.class);
        assertThat(statement.getValue()).isInstanceOf(StringExpression.class);
    }

    @Test
    void convertsNumericForWithStartEndAndStep() throws Exception {
        // Act
        NumericForStatement statement = (NumericForStatement) convert("for i = 1, 10, 2 do f(i) end").getStatement(0);

        // Assert
        assertThat(statement.getIdentifier().getName()).isEqualTo("i");
        assertThat(((DecimalNumber) statement.getStart()).getValue()).isEqualTo(1.0);
        assertThat(((DecimalNumber) statement.getEnd()).getValue()).isEqualTo(10.0);
        assertThat(statement.getStep()).isPresent();
        assertThat(((DecimalNumber) statement.getStep().get()).getValue()).isEqualTo(2.0);
        assertThat(statement.getBlock().statementsCount()).isEqualTo(1);
    }

    @Test
    void convertsGenericFor() throws Exception {
        // Act
        GenericForStatement statement = (GenericForStatement) convert("for k, v in next, t do end").getStatement(0);

        // Assert
        assertThat(statement.getIdentifiers()).extracting(TypedIdentifier::getName).containsExactly("k", "v");
        assertThat(statement.getExpressions()).extracting(AstConverterTest::name).containsExactly("next", "t");
        assertThat(statement.getBlock().isEmpty()).isTrue();
    }

    /**
     * Conditions and blocks of every branch end up on the branch they were written in.
     */
    @Test
    void convertsIfStatementBranchesInOrder() throws Exception {
        // Act
        IfStatement statement = (IfStatement) convert("""
                if a then f()
                elseif b then g() h()
                else return end
                """).getStatement(0);

        // Assert
        assertThat(statement.getBranches()).hasSize(2);
        assertThat(name(statement.getBranches().get(0).getCondition())).isEqualTo("a");
        assertThat(statement.getBranches().get(0).getBlock().statementsCount()).isEqualTo(1);
        assertThat(name(statement.getBranches().get(1).getCondition())).isEqualTo("b");
        assertThat(statement.getBranches().get(1).getBlock().statementsCount()).isEqualTo(2);
        assertThat(statement.getElseBlock()).isPresent();
        assertThat(statement.getElseBlock().get().getLastStatement()).containsInstanceOf(ReturnStatement.class);
    }

    @Test
    void convertsWhileAndRepeat() throws Exception {
        // Act
        Block block = convert("while a do continue end repeat local x = 1 until x");

        // Assert
        WhileStatement whileStatement = (WhileStatement) block.getStatement(0);
        assertThat(name(whileStatement.getCondition())).isEqualTo("a");
        assertThat(whileStatement.getBlock().getLastStatement()).containsInstanceOf(ContinueStatement.class);
        RepeatStatement repeat = (RepeatStatement) block.getStatement(1);
        assertThat(repeat.getBlock().statementsCount()).isEqualTo(1);
        assertThat(name(repeat.getCondition())).isEqualTo("x");
    }

    @Test
    void convertsFunctionStatementWithNameAndParameters() throws Exception {
        // Act
        FunctionStatement statement = (FunctionStatement) convert(
                "function a.b:c(x: number, ...: string): boolean return x end").getStatement(0);

        // Assert
        assertThat(statement.getName().getName().getName()).isEqualTo("a");
        assertThat(statement.getName().getFieldNames()).extracting(Identifier::getName).containsExactly("b");
        assertThat(statement.getName().getMethod()).map(Identifier::getName).contains("c");
        FunctionBody body = statement.getBody();
        assertThat(body.getParameters()).extracting(TypedIdentifier::getName).containsExactly("x");
        assertThat(body.isVariadic()).isTrue();
        assertThat(body.getVariadicType()).isPresent();
        assertThat(body.getReturnType()).isPresent();
        assertThat(body.getBlock().getLastStatement()).containsInstanceOf(ReturnStatement.class);
    }

    @Test
    void convertsLocalFunctionWithGenerics() throws Exception {
        // Act
        LocalFunctionStatement statement = (LocalFunctionStatement) convert(
                "local function id<T>(value: T): T return value end").getStatement(0);

        // Assert
        assertThat(statement.getName()).isEqualTo("id");
        assertThat(statement.getBody().getGenericParameters()).isPresent();
        assertThat(statement.getBody().getGenericParameters().get().getTypeVariables())
                .extracting(Identifier::getName).containsExactly("T");
    }

    @Test
    void convertsTypeDeclarationWithDefaults() throws Exception {
        // Act
        TypeDeclarationStatement statement = (TypeDeclarationStatement) convert(
                "export type Map<K, V = string> = { [K]: V, size: number }").getStatement(0);

        // Assert
        assertThat(statement.isExported()).isTrue();
        assertThat(statement.getName().getName()).isEqualTo("Map");
        GenericParameters generics = statement.getGenericParameters().orElseThrow();
        assertThat(generics.getTypeVariables()).extracting(Identifier::getName).containsExactly("K");
        assertThat(generics.getTypeVariablesWithDefault()).hasSize(1);
        TableType table = (TableType) statement.getType();
        assertThat(table.getEntries()).hasSize(2);
        assertThat(table.getIndexer()).isPresent();
    }

    // ---------------------------------------------------------------- expressions

    /**
     * The left operand is converted before the right one and both land on the right side.
     */
    @Test
    void convertsBinaryOperandsInOrder() throws Exception {
        // Act
        BinaryExpression expression = (BinaryExpression) returned("return a - b").get(0);

        // Assert
        assertThat(expression.getOperator()).isEqualTo(BinaryOperator.MINUS);
        assertThat(name(expression.getLeft())).isEqualTo("a");
        assertThat(name(expression.getRight())).isEqualTo("b");
    }

    @Test
    void nestsOperatorsByPrecedence() throws Exception {
        // Act
        BinaryExpression sum = (BinaryExpression) returned("return 1 + 2 * 3").get(0);

        // Assert
        assertThat(sum.getOperator()).isEqualTo(BinaryOperator.PLUS);
        assertThat(((DecimalNumber) sum.getLeft()).getValue()).isEqualTo(1.0);
        BinaryExpression product = (BinaryExpression) sum.getRight();
        assertThat(product.getOperator()).isEqualTo(BinaryOperator.ASTERISK);
        assertThat(((DecimalNumber) product.getLeft()).getValue()).isEqualTo(2.0);
        assertThat(((DecimalNumber) product.getRight()).getValue()).isEqualTo(3.0);
    }

    @Test
    void convertsEmptyDoAndBareReturn() throws Exception {
        // Act
        Block block = convert("do end return");

        // Assert
        assertThat(block.getStatements()).hasSize(1);
        assertThat(((DoStatement) block.getStatement(0)).getBlock().isEmpty()).isTrue();
        assertThat(block.getLastStatement()).get().isInstanceOf(ReturnStatement.class);
        assertThat(((ReturnStatement) block.getLastStatement().orElseThrow()).getExpressions()).isEmpty();
    }

    @Test
    void convertsUnaryOperators() throws Exception {
        // Act
        List<Expression> values = returned("return not a, -b, #c");

        // Assert
        assertThat(values).extracting(value -> ((UnaryExpression) value).getOperator())
                .containsExactly(UnaryOperator.NOT, UnaryOperator.MINUS, UnaryOperator.LENGTH);
        assertThat(name(((UnaryExpression) values.get(2)).getExpression())).isEqualTo("c");
    }

    @Test
    void convertsSuffixChainsFromTheInsideOut() throws Exception {
        // Act
        FunctionCall call = (FunctionCall) convert("a.b[c]:d(1)'s'").getStatement(0);

        // Assert
        assertThat(call.getArguments()).isInstanceOf(StringExpression.class);
        FunctionCall method = (FunctionCall) call.getPrefix();
        assertThat(method.getMethod()).map(Identifier::getName).contains("d");
        assertThat(((TupleArguments) method.getArguments()).getValues()).hasSize(1);
        IndexExpression index = (IndexExpression) method.getPrefix();
        assertThat(name(index.getIndex())).isEqualTo("c");
        FieldExpression field = (FieldExpression) index.getPrefix();
        assertThat(field.getField().getName()).isEqualTo("b");
        assertThat(name(field.getPrefix())).isEqualTo("a");
    }

    @Test
    void convertsParenthesesAndTables() throws Exception {
        // Act
        List<Expression> values = returned("return (a), {1, x = 2, [3] = 4}");

        // Assert
        assertThat(values.get(0)).isInstanceOf(ParentheseExpression.class);
        TableExpression table = (TableExpression) values.get(1);
        assertThat(table.getEntries())
                .hasExactlyElementsOfTypes(TableValueEntry.class, TableFieldEntry.class, TableIndexEntry.class);
        assertThat(((TableFieldEntry) table.getEntries().get(1)).getField().getName()).isEqualTo("x");
    }

    @Test
    void convertsIfExpressionWithElseIfBranches() throws Exception {
        // Act
        IfExpression expression = (IfExpression) returned("return if a then 1 elseif b then 2 else 3").get(0);

        // Assert
        assertThat(name(expression.getCondition())).isEqualTo("a");
        assertThat(((DecimalNumber) expression.getResult()).getValue()).isEqualTo(1.0);
        assertThat(expression.getBranches()).hasSize(1);
        assertThat(name(expression.getBranches().get(0).getCondition())).isEqualTo("b");
        assertThat(((DecimalNumber) expression.getElseResult()).getValue()).isEqualTo(3.0);
    }

    @Test
    void convertsIfExpressionWithoutBranches() throws Exception {
        // Act
        IfExpression expression = (IfExpression) returned("return if condition then result else other").get(0);

        // Assert
        assertThat(name(expression.getCondition())).isEqualTo("condition");
        assertThat(name(expression.getResult())).isEqualTo("result");
        assertThat(name(expression.getElseResult())).isEqualTo("other");
        assertThat(expression.getBranches()).isEmpty();
    }

    @Test
    void convertsInterpolatedStringSegments() throws Exception {
        // Act
        InterpolatedStringExpression expression =
                (InterpolatedStringExpression) returned("return `a\\n{b}c{d}`").get(0);

        // Assert
        assertThat(expression.getSegments())
                .hasExactlyElementsOfTypes(StringSegment.class, ValueSegment.class, StringSegment.class,
                        ValueSegment.class);
        assertThat(((StringSegment) expression.getSegments().get(0)).getValue()).isEqualTo("a\n");
        assertThat(name(((ValueSegment) expression.getSegments().get(3)).getValue())).isEqualTo("d");
    }

    @Test
    void convertsTypeCast() throws Exception {
        // Act
        TypeCastExpression cast = (TypeCastExpression) returned("return x :: string?").get(0);

        // Assert
        assertThat(name(cast.getExpression())).isEqualTo("x");
        assertThat(cast.getType()).isInstanceOf(OptionalType.class);
    }

    @Test
    void convertsUnionTypes() throws Exception {
        // Act
        LocalAssignStatement statement = (LocalAssignStatement) convert("local v: number | string").getStatement(0);

        // Assert
        assertThat(statement.getVariables().get(0).getType()).containsInstanceOf(UnionType.class);
    }

    @Test
    void decodesStringLiterals() throws Exception {
        // Act
        List<Expression> values = returned("return 'a\\tb', \"\\65\\x42\\u{43}\", [[\nlong]], 'x\\z   y'");

        // Assert
        assertThat(values).extracting(value -> ((StringExpression) value).getValue())
                .containsExactly("a\tb", "ABC", "long", "xy");
    }

    @Test
    void parsesNumbersOfEveryBase() throws Exception {
        // Act
        List<Expression> values = returned("return 0xFF, 0B101, 1.5E3, 1_000");

        // Assert
        assertThat(((HexNumber) values.get(0)).getValue()).isEqualTo(255L);
        assertThat(((BinaryNumber) values.get(1)).getValue()).isEqualTo(5L);
        assertThat(((BinaryNumber) values.get(1)).isUppercase()).isTrue();
        DecimalNumber decimal = (DecimalNumber) values.get(2);
        assertThat(decimal.getValue()).isEqualTo(1500.0);
        assertThat(decimal.getExponent()).hasValue(3);
        assertThat(decimal.isUppercaseExponent()).isTrue();
        assertThat(((DecimalNumber) values.get(3)).getValue()).isEqualTo(1000.0);
    }

    // ---------------------------------------------------------------- tokens

    @Test
    void attachesReferencedTokensWhenHoldingTokenData() throws Exception {
        // Arrange
        String source = "local value = 1 -- note\n";

        // Act
        Block block = convertWithTokens(source);

        // Assert
        LocalAssignStatement statement = (LocalAssignStatement) block.getStatement(0);
        assertThat(statement.getTokens()).isPresent();
        Token local = statement.getTokens().get().local();
        assertThat(local.isReferenced()).isTrue();
        assertThat(local.read(source)).isEqualTo("local");
        assertThat(local.getLineNumber()).hasValue(1);
        Token one = ((DecimalNumber) statement.getValues().get(0)).getToken().orElseThrow();
        assertThat(one.getTrailingTrivia()).extracting(trivia -> trivia.read(source))
                .containsExactly(" ", "-- note", "\n");
        assertThat(block.getTokens()).isPresent();
    }

    @Test
    void leavesNodesBareWithoutTokenData() throws Exception {
        // Act
        Block block = convert("local value = 1;");

        // Assert
        assertThat(block.getTokens()).isEmpty();
        assertThat(((LocalAssignStatement) block.getStatement(0)).getTokens()).isEmpty();
        assertThat(TokenOperations.countTokens(block)).isZero();
    }

    // ---------------------------------------------------------------- failures and policies

    @Test
    void replacesGotoAndLabelsWithEmptyDoBlocks() throws Exception {
        // Act
        Block block = convert("goto done ::done::");

        // Assert
        assertThat(block.getStatements()).hasSize(2).allSatisfy(statement -> {
            assertThat(statement).isInstanceOf(DoStatement.class);
            assertThat(((DoStatement) statement).getBlock().isEmpty()).isTrue();
        });
    }

    @Test
    void rejectsGotoWhenConfiguredToFail() {
        // Arrange
        AstConverter converter = new AstConverter(false, UnsupportedStatementPolicy.ERROR);

        // Act & Assert
        assertThatThrownBy(() -> converter.convert(syntax("goto done")))
                .isInstanceOf(ConversionException.class)
                .hasMessage("unable to convert statement from `goto done`")
                .extracting(e -> ((ConversionException) e).getKind())
                .isEqualTo(ConversionErrorKind.STATEMENT);
    }

    @Test
    void rejectsBitwiseBinaryOperators() {
        assertThatThrownBy(() -> convert("return a & b"))
                .isInstanceOf(ConversionException.class)
                .hasMessage("unable to convert binary operator from `&`");
    }

    @Test
    void rejectsBitwiseUnaryOperator() {
        assertThatThrownBy(() -> convert("return ~a"))
                .isInstanceOf(ConversionException.class)
                .extracting(e -> ((ConversionException) e).getKind())
                .isEqualTo(ConversionErrorKind.UNARY_OPERATOR);
    }

    @Test
    void rejectsMalformedNumbers() {
        assertThatThrownBy(() -> convert("return 12abc"))
                .isInstanceOf(ConversionException.class)
                .hasMessageStartingWith("unable to convert number from `12abc`")
                .extracting(e -> ((ConversionException) e).getKind())
                .isEqualTo(ConversionErrorKind.NUMBER);
    }

    @Test
    void rejectsMalformedStringEscapes() {
        assertThatThrownBy(() -> convert("return '\\q'"))
                .isInstanceOf(ConversionException.class)
                .extracting(e -> ((ConversionException) e).getKind())
                .isEqualTo(ConversionErrorKind.STRING);
    }

    @Test
    void rejectsVariadicParameterBeforeNamedOne() {
        assertThatThrownBy(() -> convert("local function f(..., a) end"))
                .isInstanceOf(ConversionException.class)
                .hasMessage("unable to convert function parameters from `(..., a)`")
                .extracting(e -> ((ConversionException) e).getKind())
                .isEqualTo(ConversionErrorKind.FUNCTION_PARAMETERS);
    }

    @Test
    void reportsValuesLeftOnTheStacks() {
        // Arrange
        AstConverter converter = new AstConverter(false);
        converter.expressions.push(new Identifier("stray"));

        // Act & Assert
        assertThatThrownBy(converter::assertBalanced)
                .isInstanceOf(InternalStackException.class)
                .hasMessage("internal conversion stack `Expression` still holds 1 item(s) after conversion");
    }

    /**
     * Generic packs have to follow plain type variables.
     */
    @Test
    void rejectsMisorderedGenericParameters() {
        assertThatThrownBy(() -> convert("type T<A..., B> = B"))
                .isInstanceOf(ConversionException.class)
                .hasMessage("unable to convert generic declaration from `<A..., B>`");
    }

    @Test
    void rejectsShebangTriviaWhenHoldingTokens() throws Exception {
        // Arrange
        String source = "#!/usr/bin/env lua\nreturn 1";

        // Act & Assert
        assertThat(convert(source).getLastStatement()).isPresent();
        assertThatThrownBy(() -> convertWithTokens(source))
                .isInstanceOf(ConversionException.class)
                .hasMessage("unable to convert trivia from token kind `SHEBANG`");
    }

    // ---------------------------------------------------------------- scale

    /**
     * A chain of 100 000 additions converts without exhausting the call stack, and the value
     * stacks are balanced afterwards (otherwise convert would throw).
     */
    @Test
    void convertsVeryLongOperatorChains() throws Exception {
        // Arrange
        int terms = 100_000;
        StringBuilder source = new StringBuilder("return 1");
        for (int i = 1; i < terms; i++) {
            source.append(" + 1");
        }

        // Act
        Block block = convertWithTokens(source.toString());

        // Assert
        Expression current = ((ReturnStatement) block.getLastStatement().orElseThrow()).getExpressions().get(0);
        int depth = 0;
        while (current instanceof BinaryExpression binary) {
            current = binary.getLeft();
            depth++;
        }
        assertThat(depth).isEqualTo(terms - 1);
        // return, every number, every operator, and end of file
        assertThat(TokenOperations.countTokens(block)).isEqualTo(1 + terms + (terms - 1) + 1);
    }
}
