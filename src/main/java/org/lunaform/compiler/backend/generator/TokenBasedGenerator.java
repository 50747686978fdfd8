package org.lunaform.compiler.backend.generator;

import org.lunaform.compiler.nodes.Block;
import org.lunaform.compiler.nodes.BlockTokens;
import org.lunaform.compiler.nodes.FunctionBody;
import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.NodeVisitor;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.Trivia;
import org.lunaform.compiler.nodes.TypedIdentifier;
import org.lunaform.compiler.nodes.expressions.BinaryExpression;
import org.lunaform.compiler.nodes.expressions.BinaryNumber;
import org.lunaform.compiler.nodes.expressions.BinaryOperator;
import org.lunaform.compiler.nodes.expressions.DecimalNumber;
import org.lunaform.compiler.nodes.expressions.ElseIfExpressionBranch;
import org.lunaform.compiler.nodes.expressions.Expression;
import org.lunaform.compiler.nodes.expressions.FalseExpression;
import org.lunaform.compiler.nodes.expressions.FieldExpression;
import org.lunaform.compiler.nodes.expressions.FunctionCall;
import org.lunaform.compiler.nodes.expressions.FunctionExpression;
import org.lunaform.compiler.nodes.expressions.HexNumber;
import org.lunaform.compiler.nodes.expressions.Identifier;
import org.lunaform.compiler.nodes.expressions.IfExpression;
import org.lunaform.compiler.nodes.expressions.IndexExpression;
import org.lunaform.compiler.nodes.expressions.InterpolatedStringExpression;
import org.lunaform.compiler.nodes.expressions.InterpolationSegment;
import org.lunaform.compiler.nodes.expressions.NilExpression;
import org.lunaform.compiler.nodes.expressions.ParentheseExpression;
import org.lunaform.compiler.nodes.expressions.Prefix;
import org.lunaform.compiler.nodes.expressions.StringExpression;
import org.lunaform.compiler.nodes.expressions.StringSegment;
import org.lunaform.compiler.nodes.expressions.TableExpression;
import org.lunaform.compiler.nodes.expressions.TableFieldEntry;
import org.lunaform.compiler.nodes.expressions.TableIndexEntry;
import org.lunaform.compiler.nodes.expressions.TableValueEntry;
import org.lunaform.compiler.nodes.expressions.TrueExpression;
import org.lunaform.compiler.nodes.expressions.TupleArguments;
import org.lunaform.compiler.nodes.expressions.TypeCastExpression;
import org.lunaform.compiler.nodes.expressions.UnaryExpression;
import org.lunaform.compiler.nodes.expressions.ValueSegment;
import org.lunaform.compiler.nodes.expressions.VariableArgumentsExpression;
import org.lunaform.compiler.nodes.statements.AssignStatement;
import org.lunaform.compiler.nodes.statements.BreakStatement;
import org.lunaform.compiler.nodes.statements.CompoundAssignStatement;
import org.lunaform.compiler.nodes.statements.ContinueStatement;
import org.lunaform.compiler.nodes.statements.DoStatement;
import org.lunaform.compiler.nodes.statements.FunctionName;
import org.lunaform.compiler.nodes.statements.FunctionStatement;
import org.lunaform.compiler.nodes.statements.GenericForStatement;
import org.lunaform.compiler.nodes.statements.IfBranch;
import org.lunaform.compiler.nodes.statements.IfStatement;
import org.lunaform.compiler.nodes.statements.LocalAssignStatement;
import org.lunaform.compiler.nodes.statements.LocalFunctionStatement;
import org.lunaform.compiler.nodes.statements.NumericForStatement;
import org.lunaform.compiler.nodes.statements.RepeatStatement;
import org.lunaform.compiler.nodes.statements.ReturnStatement;
import org.lunaform.compiler.nodes.statements.Statement;
import org.lunaform.compiler.nodes.statements.TypeDeclarationStatement;
import org.lunaform.compiler.nodes.statements.WhileStatement;
import org.lunaform.compiler.nodes.types.ArrayType;
import org.lunaform.compiler.nodes.types.ExpressionType;
import org.lunaform.compiler.nodes.types.FalseType;
import org.lunaform.compiler.nodes.types.FunctionArgumentType;
import org.lunaform.compiler.nodes.types.FunctionType;
import org.lunaform.compiler.nodes.types.GenericParameters;
import org.lunaform.compiler.nodes.types.GenericTypePack;
import org.lunaform.compiler.nodes.types.GenericTypePackWithDefault;
import org.lunaform.compiler.nodes.types.IntersectionType;
import org.lunaform.compiler.nodes.types.NilType;
import org.lunaform.compiler.nodes.types.OptionalType;
import org.lunaform.compiler.nodes.types.ParentheseType;
import org.lunaform.compiler.nodes.types.StringType;
import org.lunaform.compiler.nodes.types.TableIndexerType;
import org.lunaform.compiler.nodes.types.TablePropertyType;
import org.lunaform.compiler.nodes.types.TableType;
import org.lunaform.compiler.nodes.types.TrueType;
import org.lunaform.compiler.nodes.types.Type;
import org.lunaform.compiler.nodes.types.TypeField;
import org.lunaform.compiler.nodes.types.TypeName;
import org.lunaform.compiler.nodes.types.TypePack;
import org.lunaform.compiler.nodes.types.TypeParameters;
import org.lunaform.compiler.nodes.types.TypeVariableWithDefault;
import org.lunaform.compiler.nodes.types.UnionType;
import org.lunaform.compiler.nodes.types.VariadicTypePack;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * Writes a tree back to source text using the tokens attached to its nodes.
 * <p>
 * A node that carries tokens is written exactly as its tokens read, trivia included, so
 * a tree parsed with token data and generated again reproduces the input. Where a token is
 * missing the generator falls back to the canonical text of the construct. A space is inserted
 * wherever two neighbours would otherwise lex as one token, which keeps the output valid after
 * whitespace trivia has been cleared.
 * <p>
 * Tokens that know their line are written on that line: missing line breaks are added before
 * them, and a single line comment is always closed before the next token.
 * <p>
 * Referenced tokens can only be read against the source they were parsed from. Generating a
 * tree that still holds referenced tokens without that source fails with an
 * {@link IllegalStateException}.
 */
public class TokenBasedGenerator implements NodeVisitor<Void> {

    private final String source;
    private final StringBuilder output = new StringBuilder();
    private boolean lastSynthetic;
    private boolean commenting;
    private int currentLine;

    /**
     * Creates a generator for trees whose tokens own their content.
     */
    public TokenBasedGenerator() {
        this(null);
    }

    /**
     * @param source The text the tree was parsed from, used to read referenced tokens.
     */
    public TokenBasedGenerator(String source) {
        this.source = source;
    }

    /**
     * Generates the code of a whole block.
     *
     * @param block The block to write.
     * @return The generated code.
     */
    public String generate(Block block) {
        output.setLength(0);
        lastSynthetic = false;
        commenting = false;
        currentLine = 1;
        block.accept(this);
        return output.toString();
    }

    // ---------------------------------------------------------------- output

    private void write(Token token, String fallback) {
        if (token == null) {
            writeSymbol(fallback);
            return;
        }
        for (Trivia trivia : token.getLeadingTrivia()) {
            writeTrivia(trivia);
        }
        String content = token.read(source);
        if (!content.isEmpty()) {
            if (commenting) {
                uncomment();
            }
            OptionalInt line = token.getLineNumber();
            if (line.isPresent()) {
                while (line.getAsInt() > currentLine) {
                    output.append('\n');
                    currentLine++;
                }
            }
            append(content, isSynthetic(token));
        }
        for (Trivia trivia : token.getTrailingTrivia()) {
            writeTrivia(trivia);
        }
    }

    private void write(Optional<Token> token, String fallback) {
        write(token.orElse(null), fallback);
    }

    private void writeSymbol(String symbol) {
        if (symbol.isEmpty()) {
            return;
        }
        if (commenting) {
            uncomment();
        }
        append(symbol, true);
    }

    private void writeTrivia(Trivia trivia) {
        String content = trivia.read(source);
        push(content);
        lastSynthetic = false;
        if (trivia.isComment()) {
            if (isSingleLineComment(content)) {
                commenting = true;
            }
        } else if (commenting && content.indexOf('\n') >= 0) {
            commenting = false;
        }
    }

    private void uncomment() {
        push("\n");
        commenting = false;
    }

    private static boolean isSingleLineComment(String comment) {
        if (!comment.startsWith("--[")) {
            return true;
        }
        int index = 3;
        while (index < comment.length() && comment.charAt(index) == '=') {
            index++;
        }
        return index >= comment.length() || comment.charAt(index) != '[';
    }

    private static <T> Token pick(Optional<T> tokens, Function<T, Token> getter) {
        return tokens.map(getter).orElse(null);
    }

    private static <T> List<Token> pickList(Optional<T> tokens, Function<T, List<Token>> getter) {
        return tokens.map(getter).orElse(List.of());
    }

    private static boolean isSynthetic(Token token) {
        return !token.isReferenced() && token.getLineNumber().isEmpty();
    }

    private void append(String text, boolean synthetic) {
        if (text.isEmpty()) {
            return;
        }
        if (needsSpace(text.charAt(0), synthetic || lastSynthetic)) {
            output.append(' ');
        }
        push(text);
        lastSynthetic = synthetic;
    }

    private void push(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                currentLine++;
            }
        }
        output.append(text);
    }

    /**
     * Checks whether the next text would merge with the end of the output into another token.
     * Braces only matter around synthetic text, since nested tables in the source have none
     * between them.
     */
    private boolean needsSpace(char next, boolean synthetic) {
        if (output.length() == 0) {
            return false;
        }
        char last = output.charAt(output.length() - 1);
        if (isWordChar(last) && isWordChar(next)) {
            return true;
        }
        switch (last) {
            case '.':
                return next == '.' || isDigit(next);
            case '-':
                return next == '-';
            case '[':
                return next == '[' || next == '=';
            case '{':
                return synthetic && next == '{';
            case '=':
            case '<':
            case '>':
            case '~':
                return next == '=';
            case '/':
                return next == '/';
            case ':':
                return next == ':';
            default:
                return next == '.' && endsWithNumber();
        }
    }

    private boolean endsWithNumber() {
        int index = output.length() - 1;
        while (index >= 0) {
            char current = output.charAt(index);
            boolean singlePeriod = current == '.' && (index == 0 || output.charAt(index - 1) != '.');
            if (!isWordChar(current) && !singlePeriod) {
                break;
            }
            index--;
        }
        return index + 1 < output.length() && isDigit(output.charAt(index + 1));
    }

    private static boolean isWordChar(char character) {
        return character == '_' || isDigit(character)
                || (character >= 'a' && character <= 'z')
                || (character >= 'A' && character <= 'Z');
    }

    private static boolean isDigit(char character) {
        return character >= '0' && character <= '9';
    }

    private void writeSeparated(List<? extends Node> nodes, List<Token> separators) {
        for (int i = 0; i < nodes.size(); i++) {
            nodes.get(i).accept(this);
            if (i < separators.size()) {
                write(separators.get(i), ",");
            } else if (i < nodes.size() - 1) {
                write((Token) null, ",");
            }
        }
    }

    private void writeWrapped(Node node, boolean wrap) {
        if (wrap) {
            write((Token) null, "(");
            node.accept(this);
            write((Token) null, ")");
        } else {
            node.accept(this);
        }
    }

    // ---------------------------------------------------------------- general

    @Override
    public Void visitBlock(Block node) {
        Optional<BlockTokens> tokens = node.getTokens();
        List<Statement> statements = node.getStatements();
        List<Optional<Token>> semicolons = tokens.map(BlockTokens::semicolons).orElse(List.of());
        for (int i = 0; i < statements.size(); i++) {
            statements.get(i).accept(this);
            Optional<Token> semicolon = i < semicolons.size() ? semicolons.get(i) : Optional.empty();
            if (semicolon.isPresent()) {
                write(semicolon.get(), ";");
            } else if (i + 1 < statements.size() && startsWithParenthese(statements.get(i + 1))
                    && endsWithPrefix(statements.get(i))) {
                write((Token) null, ";");
            }
        }
        node.getLastStatement().ifPresent(last -> {
            last.accept(this);
            tokens.flatMap(BlockTokens::lastSemicolon).ifPresent(semicolon -> write(semicolon, ";"));
        });
        tokens.flatMap(BlockTokens::finalToken).ifPresent(token -> write(token, ""));
        return null;
    }

    private static boolean startsWithParenthese(Statement statement) {
        Expression leftmost;
        if (statement instanceof FunctionCall call) {
            leftmost = call;
        } else if (statement instanceof AssignStatement assign && !assign.getVariables().isEmpty()) {
            leftmost = assign.getVariables().get(0);
        } else if (statement instanceof CompoundAssignStatement compound) {
            leftmost = compound.getVariable();
        } else {
            return false;
        }
        while (true) {
            if (leftmost instanceof FunctionCall call) {
                leftmost = call.getPrefix();
            } else if (leftmost instanceof FieldExpression field) {
                leftmost = field.getPrefix();
            } else if (leftmost instanceof IndexExpression index) {
                leftmost = index.getPrefix();
            } else {
                return leftmost instanceof ParentheseExpression;
            }
        }
    }

    private static boolean endsWithPrefix(Statement statement) {
        if (statement instanceof FunctionCall) {
            return true;
        }
        List<Expression> values;
        if (statement instanceof AssignStatement assign) {
            values = assign.getValues();
        } else if (statement instanceof LocalAssignStatement local) {
            values = local.getValues();
        } else if (statement instanceof CompoundAssignStatement compound) {
            values = List.of(compound.getValue());
        } else if (statement instanceof RepeatStatement repeat) {
            values = List.of(repeat.getCondition());
        } else {
            return false;
        }
        if (values.isEmpty()) {
            return false;
        }
        Expression last = values.get(values.size() - 1);
        while (true) {
            if (last instanceof BinaryExpression binary) {
                last = binary.getRight();
            } else if (last instanceof UnaryExpression unary) {
                last = unary.getExpression();
            } else if (last instanceof IfExpression ifExpression) {
                last = ifExpression.getElseResult();
            } else if (last instanceof TypeCastExpression) {
                return false;
            } else {
                return last instanceof Prefix;
            }
        }
    }

    @Override
    public Void visitFunctionBody(FunctionBody node) {
        Optional<FunctionBody.Tokens> tokens = node.getTokens();
        node.getGenericParameters().ifPresent(generics -> generics.accept(this));
        write(pick(tokens, FunctionBody.Tokens::openingParenthese), "(");
        List<Token> commas = pickList(tokens, FunctionBody.Tokens::parameterCommas);
        List<TypedIdentifier> parameters = node.getParameters();
        int count = parameters.size() + (node.isVariadic() ? 1 : 0);
        for (int i = 0; i < parameters.size(); i++) {
            parameters.get(i).accept(this);
            writeSeparator(commas, i, count);
        }
        if (node.isVariadic()) {
            write(tokens.flatMap(FunctionBody.Tokens::variableArguments), "...");
            node.getVariadicType().ifPresent(type -> {
                write(tokens.flatMap(FunctionBody.Tokens::variableArgumentsColon), ":");
                type.accept(this);
            });
            writeSeparator(commas, parameters.size(), count);
        }
        write(pick(tokens, FunctionBody.Tokens::closingParenthese), ")");
        node.getReturnType().ifPresent(type -> {
            write(tokens.flatMap(FunctionBody.Tokens::returnTypeColon), ":");
            type.accept(this);
        });
        node.getBlock().accept(this);
        write(pick(tokens, FunctionBody.Tokens::end), "end");
        return null;
    }

    private void writeSeparator(List<Token> separators, int index, int count) {
        if (index < separators.size()) {
            write(separators.get(index), ",");
        } else if (index < count - 1) {
            write((Token) null, ",");
        }
    }

    private void writeFunctionKeyword(FunctionBody body) {
        write(pick(body.getTokens(), FunctionBody.Tokens::function), "function");
    }

    @Override
    public Void visitTypedIdentifier(TypedIdentifier node) {
        node.getIdentifier().accept(this);
        node.getType().ifPresent(type -> {
            write(node.getColonToken(), ":");
            type.accept(this);
        });
        return null;
    }

    // ---------------------------------------------------------------- statements

    @Override
    public Void visitAssignStatement(AssignStatement node) {
        Optional<AssignStatement.Tokens> tokens = node.getTokens();
        writeSeparated(node.getVariables(), pickList(tokens, AssignStatement.Tokens::variableCommas));
        write(pick(tokens, AssignStatement.Tokens::equal), "=");
        writeSeparated(node.getValues(), pickList(tokens, AssignStatement.Tokens::valueCommas));
        return null;
    }

    @Override
    public Void visitBreakStatement(BreakStatement node) {
        write(node.getToken(), "break");
        return null;
    }

    @Override
    public Void visitCompoundAssignStatement(CompoundAssignStatement node) {
        node.getVariable().accept(this);
        write(node.getToken(), node.getOperator().symbol());
        node.getValue().accept(this);
        return null;
    }

    @Override
    public Void visitContinueStatement(ContinueStatement node) {
        write(node.getToken(), "continue");
        return null;
    }

    @Override
    public Void visitDoStatement(DoStatement node) {
        write(pick(node.getTokens(), DoStatement.Tokens::doToken), "do");
        node.getBlock().accept(this);
        write(pick(node.getTokens(), DoStatement.Tokens::end), "end");
        return null;
    }

    @Override
    public Void visitFunctionName(FunctionName node) {
        List<Token> periods = pickList(node.getTokens(), FunctionName.Tokens::periods);
        node.getName().accept(this);
        List<Identifier> fields = node.getFieldNames();
        for (int i = 0; i < fields.size(); i++) {
            write(i < periods.size() ? periods.get(i) : null, ".");
            fields.get(i).accept(this);
        }
        node.getMethod().ifPresent(method -> {
            write(node.getTokens().flatMap(FunctionName.Tokens::colon), ":");
            method.accept(this);
        });
        return null;
    }

    @Override
    public Void visitFunctionStatement(FunctionStatement node) {
        writeFunctionKeyword(node.getBody());
        node.getName().accept(this);
        node.getBody().accept(this);
        return null;
    }

    @Override
    public Void visitGenericForStatement(GenericForStatement node) {
        Optional<GenericForStatement.Tokens> tokens = node.getTokens();
        write(pick(tokens, GenericForStatement.Tokens::forToken), "for");
        writeSeparated(node.getIdentifiers(), pickList(tokens, GenericForStatement.Tokens::identifierCommas));
        write(pick(tokens, GenericForStatement.Tokens::in), "in");
        writeSeparated(node.getExpressions(), pickList(tokens, GenericForStatement.Tokens::valueCommas));
        write(pick(tokens, GenericForStatement.Tokens::doToken), "do");
        node.getBlock().accept(this);
        write(pick(tokens, GenericForStatement.Tokens::end), "end");
        return null;
    }

    @Override
    public Void visitIfBranch(IfBranch node) {
        write(pick(node.getTokens(), IfBranch.Tokens::elseIf), "elseif");
        node.getCondition().accept(this);
        write(pick(node.getTokens(), IfBranch.Tokens::then), "then");
        node.getBlock().accept(this);
        return null;
    }

    @Override
    public Void visitIfStatement(IfStatement node) {
        Optional<IfStatement.Tokens> tokens = node.getTokens();
        List<IfBranch> branches = node.getBranches();
        IfBranch first = branches.get(0);
        write(pick(tokens, IfStatement.Tokens::ifToken), "if");
        first.getCondition().accept(this);
        write(pick(tokens, IfStatement.Tokens::then), "then");
        first.getBlock().accept(this);
        for (int i = 1; i < branches.size(); i++) {
            branches.get(i).accept(this);
        }
        node.getElseBlock().ifPresent(block -> {
            write(tokens.flatMap(IfStatement.Tokens::elseToken), "else");
            block.accept(this);
        });
        write(pick(tokens, IfStatement.Tokens::end), "end");
        return null;
    }

    @Override
    public Void visitLocalAssignStatement(LocalAssignStatement node) {
        Optional<LocalAssignStatement.Tokens> tokens = node.getTokens();
        write(pick(tokens, LocalAssignStatement.Tokens::local), "local");
        writeSeparated(node.getVariables(), pickList(tokens, LocalAssignStatement.Tokens::variableCommas));
        if (!node.getValues().isEmpty()) {
            write(tokens.flatMap(LocalAssignStatement.Tokens::equal), "=");
            writeSeparated(node.getValues(), pickList(tokens, LocalAssignStatement.Tokens::valueCommas));
        }
        return null;
    }

    @Override
    public Void visitLocalFunctionStatement(LocalFunctionStatement node) {
        write(node.getLocalToken(), "local");
        writeFunctionKeyword(node.getBody());
        node.getIdentifier().accept(this);
        node.getBody().accept(this);
        return null;
    }

    @Override
    public Void visitNumericForStatement(NumericForStatement node) {
        Optional<NumericForStatement.Tokens> tokens = node.getTokens();
        write(pick(tokens, NumericForStatement.Tokens::forToken), "for");
        node.getIdentifier().accept(this);
        write(pick(tokens, NumericForStatement.Tokens::equal), "=");
        node.getStart().accept(this);
        write(pick(tokens, NumericForStatement.Tokens::endComma), ",");
        node.getEnd().accept(this);
        node.getStep().ifPresent(step -> {
            write(tokens.flatMap(NumericForStatement.Tokens::stepComma), ",");
            step.accept(this);
        });
        write(pick(tokens, NumericForStatement.Tokens::doToken), "do");
        node.getBlock().accept(this);
        write(pick(tokens, NumericForStatement.Tokens::end), "end");
        return null;
    }

    @Override
    public Void visitRepeatStatement(RepeatStatement node) {
        write(pick(node.getTokens(), RepeatStatement.Tokens::repeat), "repeat");
        node.getBlock().accept(this);
        write(pick(node.getTokens(), RepeatStatement.Tokens::until), "until");
        node.getCondition().accept(this);
        return null;
    }

    @Override
    public Void visitReturnStatement(ReturnStatement node) {
        write(pick(node.getTokens(), ReturnStatement.Tokens::returnToken), "return");
        writeSeparated(node.getExpressions(), pickList(node.getTokens(), ReturnStatement.Tokens::commas));
        return null;
    }

    @Override
    public Void visitTypeDeclarationStatement(TypeDeclarationStatement node) {
        Optional<TypeDeclarationStatement.Tokens> tokens = node.getTokens();
        if (node.isExported()) {
            write(tokens.flatMap(TypeDeclarationStatement.Tokens::export), "export");
        }
        write(pick(tokens, TypeDeclarationStatement.Tokens::type), "type");
        node.getName().accept(this);
        node.getGenericParameters().ifPresent(generics -> generics.accept(this));
        write(pick(tokens, TypeDeclarationStatement.Tokens::equal), "=");
        node.getType().accept(this);
        return null;
    }

    @Override
    public Void visitWhileStatement(WhileStatement node) {
        Optional<WhileStatement.Tokens> tokens = node.getTokens();
        write(pick(tokens, WhileStatement.Tokens::whileToken), "while");
        node.getCondition().accept(this);
        write(pick(tokens, WhileStatement.Tokens::doToken), "do");
        node.getBlock().accept(this);
        write(pick(tokens, WhileStatement.Tokens::end), "end");
        return null;
    }

    // ---------------------------------------------------------------- expressions

    @Override
    public Void visitBinaryExpression(BinaryExpression node) {
        boolean synthetic = node.getToken().isEmpty();
        BinaryOperator operator = node.getOperator();
        writeWrapped(node.getLeft(), synthetic && needsParentheses(operator, node.getLeft(), true));
        write(node.getToken(), operator.symbol());
        writeWrapped(node.getRight(), synthetic && needsParentheses(operator, node.getRight(), false));
        return null;
    }

    private static boolean needsParentheses(BinaryOperator operator, Expression operand, boolean left) {
        if (operand instanceof BinaryExpression binary) {
            return operator.needsParentheses(binary.getOperator(), left);
        }
        if (operand instanceof UnaryExpression) {
            return left && operator.precedence() > BinaryOperator.UNARY_PRECEDENCE;
        }
        return operand instanceof IfExpression;
    }

    @Override
    public Void visitBinaryNumber(BinaryNumber node) {
        write(node.getToken(), "0" + (node.isUppercase() ? "B" : "b") + Long.toBinaryString(node.getValue()));
        return null;
    }

    @Override
    public Void visitDecimalNumber(DecimalNumber node) {
        write(node.getToken(), formatDecimal(node));
        return null;
    }

    static String formatDecimal(DecimalNumber number) {
        double value = number.getValue();
        OptionalInt exponent = number.getExponent();
        if (exponent.isPresent() && !Double.isNaN(value) && !Double.isInfinite(value)) {
            double mantissa = value / Math.pow(10, exponent.getAsInt());
            return formatPlain(mantissa) + (number.isUppercaseExponent() ? "E" : "e") + exponent.getAsInt();
        }
        return formatPlain(value);
    }

    private static String formatPlain(double value) {
        if (Double.isNaN(value)) {
            return "(0/0)";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "1e999" : "-1e999";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    @Override
    public Void visitElseIfExpressionBranch(ElseIfExpressionBranch node) {
        write(pick(node.getTokens(), ElseIfExpressionBranch.Tokens::elseIf), "elseif");
        node.getCondition().accept(this);
        write(pick(node.getTokens(), ElseIfExpressionBranch.Tokens::then), "then");
        node.getResult().accept(this);
        return null;
    }

    @Override
    public Void visitFalseExpression(FalseExpression node) {
        write(node.getToken(), "false");
        return null;
    }

    @Override
    public Void visitFieldExpression(FieldExpression node) {
        node.getPrefix().accept(this);
        write(node.getToken(), ".");
        node.getField().accept(this);
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCall node) {
        node.getPrefix().accept(this);
        node.getMethod().ifPresent(method -> {
            write(node.getColon(), ":");
            method.accept(this);
        });
        node.getArguments().accept(this);
        return null;
    }

    @Override
    public Void visitFunctionExpression(FunctionExpression node) {
        writeFunctionKeyword(node.getBody());
        node.getBody().accept(this);
        return null;
    }

    @Override
    public Void visitHexNumber(HexNumber node) {
        String fallback = "0" + (node.isUppercase() ? "X" : "x") + Long.toHexString(node.getValue());
        OptionalInt exponent = node.getExponent();
        if (exponent.isPresent()) {
            fallback += (node.isUppercase() ? "P" : "p") + exponent.getAsInt();
        }
        write(node.getToken(), fallback);
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node) {
        write(node.getToken(), node.getName());
        return null;
    }

    @Override
    public Void visitIfExpression(IfExpression node) {
        Optional<IfExpression.Tokens> tokens = node.getTokens();
        write(pick(tokens, IfExpression.Tokens::ifToken), "if");
        node.getCondition().accept(this);
        write(pick(tokens, IfExpression.Tokens::then), "then");
        node.getResult().accept(this);
        for (ElseIfExpressionBranch branch : node.getBranches()) {
            branch.accept(this);
        }
        write(pick(tokens, IfExpression.Tokens::elseToken), "else");
        node.getElseResult().accept(this);
        return null;
    }

    @Override
    public Void visitIndexExpression(IndexExpression node) {
        node.getPrefix().accept(this);
        write(pick(node.getTokens(), IndexExpression.Tokens::openingBracket), "[");
        node.getIndex().accept(this);
        write(pick(node.getTokens(), IndexExpression.Tokens::closingBracket), "]");
        return null;
    }

    @Override
    public Void visitInterpolatedStringExpression(InterpolatedStringExpression node) {
        write(pick(node.getTokens(), InterpolatedStringExpression.Tokens::openingTick), "`");
        for (InterpolationSegment segment : node.getSegments()) {
            segment.accept(this);
        }
        write(pick(node.getTokens(), InterpolatedStringExpression.Tokens::closingTick), "`");
        return null;
    }

    @Override
    public Void visitNilExpression(NilExpression node) {
        write(node.getToken(), "nil");
        return null;
    }

    @Override
    public Void visitParentheseExpression(ParentheseExpression node) {
        write(pick(node.getTokens(), ParentheseExpression.Tokens::openingParenthese), "(");
        node.getInnerExpression().accept(this);
        write(pick(node.getTokens(), ParentheseExpression.Tokens::closingParenthese), ")");
        return null;
    }

    @Override
    public Void visitStringExpression(StringExpression node) {
        write(node.getToken(), quote(node.getValue()));
        return null;
    }

    /**
     * Writes a string value as a double quoted literal.
     */
    static String quote(String value) {
        StringBuilder builder = new StringBuilder(value.length() + 2).append('"');
        escape(value, builder, false);
        return builder.append('"').toString();
    }

    private static void escape(String value, StringBuilder builder, boolean interpolated) {
        for (int i = 0; i < value.length(); i++) {
            char character = value.charAt(i);
            switch (character) {
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                case '"' -> builder.append(interpolated ? "\"" : "\\\"");
                case '`' -> builder.append(interpolated ? "\\`" : "`");
                case '{' -> builder.append(interpolated ? "\\{" : "{");
                default -> {
                    if (character < 0x20 || character == 0x7F) {
                        builder.append(String.format("\\%03d", (int) character));
                    } else {
                        builder.append(character);
                    }
                }
            }
        }
    }

    @Override
    public Void visitStringSegment(StringSegment node) {
        StringBuilder builder = new StringBuilder();
        escape(node.getValue(), builder, true);
        write(node.getToken(), builder.toString());
        return null;
    }

    @Override
    public Void visitTableExpression(TableExpression node) {
        Optional<TableExpression.Tokens> tokens = node.getTokens();
        write(pick(tokens, TableExpression.Tokens::openingBrace), "{");
        writeSeparated(node.getEntries(), pickList(tokens, TableExpression.Tokens::separators));
        write(pick(tokens, TableExpression.Tokens::closingBrace), "}");
        return null;
    }

    @Override
    public Void visitTableFieldEntry(TableFieldEntry node) {
        node.getField().accept(this);
        write(node.getToken(), "=");
        node.getValue().accept(this);
        return null;
    }

    @Override
    public Void visitTableIndexEntry(TableIndexEntry node) {
        Optional<TableIndexEntry.Tokens> tokens = node.getTokens();
        write(pick(tokens, TableIndexEntry.Tokens::openingBracket), "[");
        node.getKey().accept(this);
        write(pick(tokens, TableIndexEntry.Tokens::closingBracket), "]");
        write(pick(tokens, TableIndexEntry.Tokens::equal), "=");
        node.getValue().accept(this);
        return null;
    }

    @Override
    public Void visitTableValueEntry(TableValueEntry node) {
        node.getValue().accept(this);
        return null;
    }

    @Override
    public Void visitTrueExpression(TrueExpression node) {
        write(node.getToken(), "true");
        return null;
    }

    @Override
    public Void visitTupleArguments(TupleArguments node) {
        Optional<TupleArguments.Tokens> tokens = node.getTokens();
        write(pick(tokens, TupleArguments.Tokens::openingParenthese), "(");
        writeSeparated(node.getValues(), pickList(tokens, TupleArguments.Tokens::commas));
        write(pick(tokens, TupleArguments.Tokens::closingParenthese), ")");
        return null;
    }

    @Override
    public Void visitTypeCastExpression(TypeCastExpression node) {
        Expression expression = node.getExpression();
        boolean wrap = node.getToken().isEmpty() && (expression instanceof BinaryExpression
                || expression instanceof UnaryExpression
                || expression instanceof IfExpression
                || expression instanceof TypeCastExpression);
        writeWrapped(expression, wrap);
        write(node.getToken(), "::");
        node.getType().accept(this);
        return null;
    }

    @Override
    public Void visitUnaryExpression(UnaryExpression node) {
        write(node.getToken(), node.getOperator().symbol());
        Expression operand = node.getExpression();
        boolean wrap = node.getToken().isEmpty() && (operand instanceof IfExpression
                || (operand instanceof BinaryExpression binary
                    && binary.getOperator().precedence() < BinaryOperator.UNARY_PRECEDENCE));
        writeWrapped(operand, wrap);
        return null;
    }

    @Override
    public Void visitValueSegment(ValueSegment node) {
        write(pick(node.getTokens(), ValueSegment.Tokens::openingBrace), "{");
        node.getValue().accept(this);
        write(pick(node.getTokens(), ValueSegment.Tokens::closingBrace), "}");
        return null;
    }

    @Override
    public Void visitVariableArgumentsExpression(VariableArgumentsExpression node) {
        write(node.getToken(), "...");
        return null;
    }

    // ---------------------------------------------------------------- types

    @Override
    public Void visitArrayType(ArrayType node) {
        write(pick(node.getTokens(), ArrayType.Tokens::openingBrace), "{");
        node.getElementType().accept(this);
        write(pick(node.getTokens(), ArrayType.Tokens::closingBrace), "}");
        return null;
    }

    @Override
    public Void visitExpressionType(ExpressionType node) {
        Optional<ExpressionType.Tokens> tokens = node.getTokens();
        write(pick(tokens, ExpressionType.Tokens::typeofToken), "typeof");
        write(pick(tokens, ExpressionType.Tokens::openingParenthese), "(");
        node.getExpression().accept(this);
        write(pick(tokens, ExpressionType.Tokens::closingParenthese), ")");
        return null;
    }

    @Override
    public Void visitFalseType(FalseType node) {
        write(node.getToken(), "false");
        return null;
    }

    @Override
    public Void visitFunctionArgumentType(FunctionArgumentType node) {
        node.getName().ifPresent(name -> {
            name.accept(this);
            write(node.getColonToken(), ":");
        });
        node.getType().accept(this);
        return null;
    }

    @Override
    public Void visitFunctionType(FunctionType node) {
        Optional<FunctionType.Tokens> tokens = node.getTokens();
        node.getGenericParameters().ifPresent(generics -> generics.accept(this));
        write(pick(tokens, FunctionType.Tokens::openingParenthese), "(");
        List<Node> arguments = new ArrayList<>(node.getArguments());
        node.getVariadicArgumentType().ifPresent(arguments::add);
        writeSeparated(arguments, pickList(tokens, FunctionType.Tokens::commas));
        write(pick(tokens, FunctionType.Tokens::closingParenthese), ")");
        write(pick(tokens, FunctionType.Tokens::arrow), "->");
        node.getReturnType().accept(this);
        return null;
    }

    @Override
    public Void visitGenericParameters(GenericParameters node) {
        Optional<GenericParameters.Tokens> tokens = node.getTokens();
        write(pick(tokens, GenericParameters.Tokens::opening), "<");
        List<Node> parameters = new ArrayList<>(node.getTypeVariables());
        parameters.addAll(node.getTypeVariablesWithDefault());
        parameters.addAll(node.getGenericTypePacks());
        parameters.addAll(node.getGenericTypePacksWithDefault());
        writeSeparated(parameters, pickList(tokens, GenericParameters.Tokens::commas));
        write(pick(tokens, GenericParameters.Tokens::closing), ">");
        return null;
    }

    @Override
    public Void visitGenericTypePack(GenericTypePack node) {
        node.getName().accept(this);
        write(node.getToken(), "...");
        return null;
    }

    @Override
    public Void visitGenericTypePackWithDefault(GenericTypePackWithDefault node) {
        node.getGenericTypePack().accept(this);
        write(node.getToken(), "=");
        node.getDefaultType().accept(this);
        return null;
    }

    @Override
    public Void visitIntersectionType(IntersectionType node) {
        boolean synthetic = node.getToken().isEmpty();
        writeWrapped(node.getLeft(), synthetic && (node.getLeft() instanceof UnionType
                || node.getLeft() instanceof FunctionType));
        write(node.getToken(), "&");
        writeWrapped(node.getRight(), synthetic && node.getRight() instanceof UnionType);
        return null;
    }

    @Override
    public Void visitNilType(NilType node) {
        write(node.getToken(), "nil");
        return null;
    }

    @Override
    public Void visitOptionalType(OptionalType node) {
        Type inner = node.getInnerType();
        boolean wrap = node.getToken().isEmpty() && (inner instanceof UnionType
                || inner instanceof IntersectionType
                || inner instanceof FunctionType);
        writeWrapped(inner, wrap);
        write(node.getToken(), "?");
        return null;
    }

    @Override
    public Void visitParentheseType(ParentheseType node) {
        write(pick(node.getTokens(), ParentheseType.Tokens::openingParenthese), "(");
        node.getInnerType().accept(this);
        write(pick(node.getTokens(), ParentheseType.Tokens::closingParenthese), ")");
        return null;
    }

    @Override
    public Void visitStringType(StringType node) {
        write(node.getToken(), quote(node.getValue()));
        return null;
    }

    @Override
    public Void visitTableIndexerType(TableIndexerType node) {
        Optional<TableIndexerType.Tokens> tokens = node.getTokens();
        write(pick(tokens, TableIndexerType.Tokens::openingBracket), "[");
        node.getKeyType().accept(this);
        write(pick(tokens, TableIndexerType.Tokens::closingBracket), "]");
        write(pick(tokens, TableIndexerType.Tokens::colon), ":");
        node.getValueType().accept(this);
        return null;
    }

    @Override
    public Void visitTablePropertyType(TablePropertyType node) {
        node.getProperty().accept(this);
        write(node.getToken(), ":");
        node.getType().accept(this);
        return null;
    }

    @Override
    public Void visitTableType(TableType node) {
        Optional<TableType.Tokens> tokens = node.getTokens();
        write(pick(tokens, TableType.Tokens::openingBrace), "{");
        writeSeparated(node.getEntries(), pickList(tokens, TableType.Tokens::separators));
        write(pick(tokens, TableType.Tokens::closingBrace), "}");
        return null;
    }

    @Override
    public Void visitTrueType(TrueType node) {
        write(node.getToken(), "true");
        return null;
    }

    @Override
    public Void visitTypeField(TypeField node) {
        node.getNamespace().accept(this);
        write(node.getToken(), ".");
        node.getTypeName().accept(this);
        return null;
    }

    @Override
    public Void visitTypeName(TypeName node) {
        node.getTypeName().accept(this);
        node.getParameters().ifPresent(parameters -> parameters.accept(this));
        return null;
    }

    @Override
    public Void visitTypePack(TypePack node) {
        Optional<TypePack.Tokens> tokens = node.getTokens();
        write(pick(tokens, TypePack.Tokens::openingParenthese), "(");
        List<Node> types = new ArrayList<>(node.getTypes());
        node.getVariadicType().ifPresent(types::add);
        writeSeparated(types, pickList(tokens, TypePack.Tokens::commas));
        write(pick(tokens, TypePack.Tokens::closingParenthese), ")");
        return null;
    }

    @Override
    public Void visitTypeParameters(TypeParameters node) {
        Optional<TypeParameters.Tokens> tokens = node.getTokens();
        write(pick(tokens, TypeParameters.Tokens::opening), "<");
        writeSeparated(node.getParameters(), pickList(tokens, TypeParameters.Tokens::commas));
        write(pick(tokens, TypeParameters.Tokens::closing), ">");
        return null;
    }

    @Override
    public Void visitTypeVariableWithDefault(TypeVariableWithDefault node) {
        node.getTypeVariable().accept(this);
        write(node.getToken(), "=");
        node.getDefaultType().accept(this);
        return null;
    }

    @Override
    public Void visitUnionType(UnionType node) {
        boolean synthetic = node.getToken().isEmpty();
        writeWrapped(node.getLeft(), synthetic && node.getLeft() instanceof FunctionType);
        write(node.getToken(), "|");
        node.getRight().accept(this);
        return null;
    }

    @Override
    public Void visitVariadicTypePack(VariadicTypePack node) {
        write(node.getToken(), "...");
        node.getType().accept(this);
        return null;
    }
}
