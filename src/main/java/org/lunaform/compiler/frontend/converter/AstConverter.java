package org.lunaform.compiler.frontend.converter;

import org.lunaform.compiler.api.ConversionErrorKind;
import org.lunaform.compiler.api.ConversionException;
import org.lunaform.compiler.api.InternalStackException;
import org.lunaform.compiler.frontend.converter.ConvertWork.SuffixTarget;
import org.lunaform.compiler.frontend.lexer.Lexeme;
import org.lunaform.compiler.frontend.lexer.TokenType;
import org.lunaform.compiler.frontend.syntax.Args;
import org.lunaform.compiler.frontend.syntax.Call;
import org.lunaform.compiler.frontend.syntax.ContainedSpan;
import org.lunaform.compiler.frontend.syntax.Expr;
import org.lunaform.compiler.frontend.syntax.FunctionBodySyntax;
import org.lunaform.compiler.frontend.syntax.FunctionCallSyntax;
import org.lunaform.compiler.frontend.syntax.GenericDeclaration;
import org.lunaform.compiler.frontend.syntax.Index;
import org.lunaform.compiler.frontend.syntax.LastStmt;
import org.lunaform.compiler.frontend.syntax.Parameter;
import org.lunaform.compiler.frontend.syntax.PrefixSyntax;
import org.lunaform.compiler.frontend.syntax.Punctuated;
import org.lunaform.compiler.frontend.syntax.Stmt;
import org.lunaform.compiler.frontend.syntax.Suffix;
import org.lunaform.compiler.frontend.syntax.SyntaxBlock;
import org.lunaform.compiler.frontend.syntax.SyntaxNode;
import org.lunaform.compiler.frontend.syntax.SyntaxTree;
import org.lunaform.compiler.frontend.syntax.TableConstructor;
import org.lunaform.compiler.frontend.syntax.TableField;
import org.lunaform.compiler.frontend.syntax.TokenReference;
import org.lunaform.compiler.frontend.syntax.TypeInfo;
import org.lunaform.compiler.frontend.syntax.TypeSpecifier;
import org.lunaform.compiler.frontend.syntax.Var;
import org.lunaform.compiler.nodes.Block;
import org.lunaform.compiler.nodes.BlockTokens;
import org.lunaform.compiler.nodes.FunctionBody;
import org.lunaform.compiler.nodes.Token;
import org.lunaform.compiler.nodes.TokenPosition;
import org.lunaform.compiler.nodes.Trivia;
import org.lunaform.compiler.nodes.TriviaKind;
import org.lunaform.compiler.nodes.TypedIdentifier;
import org.lunaform.compiler.nodes.expressions.Arguments;
import org.lunaform.compiler.nodes.expressions.BinaryExpression;
import org.lunaform.compiler.nodes.expressions.BinaryOperator;
import org.lunaform.compiler.nodes.expressions.ElseIfExpressionBranch;
import org.lunaform.compiler.nodes.expressions.Expression;
import org.lunaform.compiler.nodes.expressions.FalseExpression;
import org.lunaform.compiler.nodes.expressions.FieldExpression;
import org.lunaform.compiler.nodes.expressions.FunctionCall;
import org.lunaform.compiler.nodes.expressions.FunctionExpression;
import org.lunaform.compiler.nodes.expressions.Identifier;
import org.lunaform.compiler.nodes.expressions.IfExpression;
import org.lunaform.compiler.nodes.expressions.IndexExpression;
import org.lunaform.compiler.nodes.expressions.InterpolatedStringExpression;
import org.lunaform.compiler.nodes.expressions.NilExpression;
import org.lunaform.compiler.nodes.expressions.NumberExpression;
import org.lunaform.compiler.nodes.expressions.ParentheseExpression;
import org.lunaform.compiler.nodes.expressions.Prefix;
import org.lunaform.compiler.nodes.expressions.StringExpression;
import org.lunaform.compiler.nodes.expressions.StringSegment;
import org.lunaform.compiler.nodes.expressions.TableEntry;
import org.lunaform.compiler.nodes.expressions.TableExpression;
import org.lunaform.compiler.nodes.expressions.TableFieldEntry;
import org.lunaform.compiler.nodes.expressions.TableIndexEntry;
import org.lunaform.compiler.nodes.expressions.TableValueEntry;
import org.lunaform.compiler.nodes.expressions.TrueExpression;
import org.lunaform.compiler.nodes.expressions.TupleArguments;
import org.lunaform.compiler.nodes.expressions.TypeCastExpression;
import org.lunaform.compiler.nodes.expressions.UnaryExpression;
import org.lunaform.compiler.nodes.expressions.UnaryOperator;
import org.lunaform.compiler.nodes.expressions.ValueSegment;
import org.lunaform.compiler.nodes.expressions.VariableArgumentsExpression;
import org.lunaform.compiler.nodes.expressions.Variable;
import org.lunaform.compiler.nodes.statements.AssignStatement;
import org.lunaform.compiler.nodes.statements.BreakStatement;
import org.lunaform.compiler.nodes.statements.CompoundAssignStatement;
import org.lunaform.compiler.nodes.statements.CompoundOperator;
import org.lunaform.compiler.nodes.statements.ContinueStatement;
import org.lunaform.compiler.nodes.statements.DoStatement;
import org.lunaform.compiler.nodes.statements.FunctionName;
import org.lunaform.compiler.nodes.statements.FunctionStatement;
import org.lunaform.compiler.nodes.statements.GenericForStatement;
import org.lunaform.compiler.nodes.statements.IfBranch;
import org.lunaform.compiler.nodes.statements.IfStatement;
import org.lunaform.compiler.nodes.statements.LastStatement;
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
import org.lunaform.compiler.nodes.types.FunctionReturnType;
import org.lunaform.compiler.nodes.types.FunctionType;
import org.lunaform.compiler.nodes.types.FunctionVariadicType;
import org.lunaform.compiler.nodes.types.GenericParameters;
import org.lunaform.compiler.nodes.types.GenericTypePack;
import org.lunaform.compiler.nodes.types.GenericTypePackDefault;
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
import org.lunaform.compiler.nodes.types.TypeParameter;
import org.lunaform.compiler.nodes.types.TypeParameters;
import org.lunaform.compiler.nodes.types.TypeVariableWithDefault;
import org.lunaform.compiler.nodes.types.UnionType;
import org.lunaform.compiler.nodes.types.VariadicArgumentType;
import org.lunaform.compiler.nodes.types.VariadicTypePack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Converts a parse tree into the mutable node model.
 * <p>
 * The conversion never recurses on the Java call stack: parse tree nodes are scheduled on an
 * explicit work stack and converted children wait on per-category value stacks until the
 * assembly step of their parent pops them. Arbitrarily deep input is therefore converted in
 * bounded stack space.
 * <p>
 * When token data is held, every node receives tokens that reference the source text by offset,
 * so the tree can later be written back exactly.
 * <p>
 * An instance is not thread-safe but can be reused for several conversions.
 */
public class AstConverter {

    private static final Logger log = LoggerFactory.getLogger(AstConverter.class);

    private final boolean holdTokenData;
    private final UnsupportedStatementPolicy unsupportedStatements;

    private final Deque<ConvertWork> work = new ArrayDeque<>();

    final ValueStack<Block> blocks = new ValueStack<>("Block");
    final ValueStack<Statement> statements = new ValueStack<>("Statement");
    final ValueStack<LastStatement> lastStatements = new ValueStack<>("LastStatement");
    final ValueStack<Expression> expressions = new ValueStack<>("Expression");
    final ValueStack<Prefix> prefixes = new ValueStack<>("Prefix");
    final ValueStack<Arguments> arguments = new ValueStack<>("Arguments");
    final ValueStack<Variable> variables = new ValueStack<>("Variable");
    final ValueStack<FunctionBody> functionBodies = new ValueStack<>("FunctionBody");
    final ValueStack<GenericParameters> genericParameters = new ValueStack<>("GenericParameters");
    final ValueStack<Type> types = new ValueStack<>("Type");
    final ValueStack<TypePack> typePacks = new ValueStack<>("TypePack");
    final ValueStack<VariadicTypePack> variadicTypePacks = new ValueStack<>("VariadicTypePack");
    final ValueStack<FunctionReturnType> returnTypes = new ValueStack<>("FunctionReturnType");
    final ValueStack<TypeParameter> typeParameters = new ValueStack<>("TypeParameter");
    final ValueStack<VariadicArgumentType> variadicArgumentTypes = new ValueStack<>("VariadicArgumentType");
    final ValueStack<FunctionVariadicType> functionVariadicTypes = new ValueStack<>("FunctionVariadicType");
    final ValueStack<GenericTypePackDefault> packDefaults = new ValueStack<>("GenericTypePackDefault");

    private final List<ValueStack<?>> allStacks = List.of(blocks, statements, lastStatements, expressions,
            prefixes, arguments, variables, functionBodies, genericParameters, types, typePacks,
            variadicTypePacks, returnTypes, typeParameters, variadicArgumentTypes, functionVariadicTypes,
            packDefaults);

    private String source = "";

    /**
     * Creates a converter that replaces unsupported statements with an empty {@code do end} block.
     * @param holdTokenData Whether nodes receive their source tokens.
     */
    public AstConverter(boolean holdTokenData) {
        this(holdTokenData, UnsupportedStatementPolicy.PLACEHOLDER);
    }

    /**
     * @param holdTokenData Whether nodes receive their source tokens.
     * @param unsupportedStatements What to do with {@code goto} and labels.
     */
    public AstConverter(boolean holdTokenData, UnsupportedStatementPolicy unsupportedStatements) {
        this.holdTokenData = holdTokenData;
        this.unsupportedStatements = unsupportedStatements;
    }

    /**
     * Converts a whole parse tree. The end-of-file token becomes the final token of the root block.
     * @param tree The parse tree.
     * @return The root block of the node model.
     * @throws ConversionException If the tree contains a construct the node model does not represent.
     */
    public Block convert(SyntaxTree tree) throws ConversionException {
        source = tree.source();
        work.clear();
        allStacks.forEach(ValueStack::clear);

        work.push(new ConvertWork.ConvertBlock(tree.block(), Optional.of(tree.endOfFile())));
        long processed = 0;
        while (!work.isEmpty()) {
            work.pop().run(this);
            processed++;
        }
        log.trace("conversion processed {} work items", processed);

        Block block = blocks.pop();
        assertBalanced();
        return block;
    }

    void assertBalanced() throws InternalStackException {
        for (ValueStack<?> stack : allStacks) {
            if (stack.size() != 0) {
                throw new InternalStackException(stack.category(), stack.size());
            }
        }
    }

    /**
     * Pushes an assembly step followed by the conversions it depends on. The last child runs first,
     * so the first child's value ends on top of its stack and the assembly step pops the values in
     * source order.
     */
    private void schedule(ConvertWork make, List<ConvertWork> children) {
        work.push(make);
        for (ConvertWork child : children) {
            work.push(child);
        }
    }

    // ---- blocks and statements ----

    void convertBlock(SyntaxBlock block, Optional<TokenReference> finalToken) {
        List<ConvertWork> children = new ArrayList<>();
        for (Stmt statement : block.statements()) {
            children.add(new ConvertWork.ConvertStatement(statement));
        }
        block.lastStatement().ifPresent(last -> children.add(new ConvertWork.ConvertLastStatement(last)));
        schedule(new ConvertWork.MakeBlock(block, finalToken), children);
    }

    void makeBlock(SyntaxBlock block, Optional<TokenReference> finalToken) throws ConversionException {
        List<Statement> converted = statements.pop(block.statements().size());
        LastStatement last = block.lastStatement().isPresent() ? lastStatements.pop() : null;
        Block result = new Block(converted, last);
        if (holdTokenData) {
            List<Optional<Token>> semicolons = new ArrayList<>();
            for (Optional<TokenReference> semicolon : block.semicolons()) {
                semicolons.add(optionalToken(semicolon));
            }
            result.withTokens(new BlockTokens(semicolons, optionalToken(block.lastSemicolon()),
                    optionalToken(finalToken)));
        }
        blocks.push(result);
    }

    void convertStatement(Stmt statement) throws ConversionException {
        List<ConvertWork> children = new ArrayList<>();
        if (statement instanceof Stmt.Assignment assignment) {
            for (Var variable : assignment.variables().values()) {
                children.add(new ConvertWork.ConvertVariable(variable));
            }
            addExpressions(children, assignment.values());
            schedule(new ConvertWork.MakeAssign(assignment), children);
        } else if (statement instanceof Stmt.CompoundAssignment assignment) {
            CompoundOperator operator = compoundOperator(assignment.operator());
            children.add(new ConvertWork.ConvertVariable(assignment.variable()));
            children.add(new ConvertWork.ConvertExpression(assignment.value()));
            schedule(new ConvertWork.MakeCompoundAssign(assignment, operator), children);
        } else if (statement instanceof Stmt.Do doStatement) {
            children.add(new ConvertWork.ConvertBlock(doStatement.block(), Optional.empty()));
            schedule(new ConvertWork.MakeDo(doStatement), children);
        } else if (statement instanceof Stmt.NumericFor numericFor) {
            numericFor.type().ifPresent(type -> children.add(new ConvertWork.ConvertType(type.type())));
            children.add(new ConvertWork.ConvertExpression(numericFor.start()));
            children.add(new ConvertWork.ConvertExpression(numericFor.end()));
            numericFor.step().ifPresent(step -> children.add(new ConvertWork.ConvertExpression(step)));
            children.add(new ConvertWork.ConvertBlock(numericFor.block(), Optional.empty()));
            schedule(new ConvertWork.MakeNumericFor(numericFor), children);
        } else if (statement instanceof Stmt.GenericFor genericFor) {
            addTypeSpecifiers(children, genericFor.types());
            addExpressions(children, genericFor.expressions());
            children.add(new ConvertWork.ConvertBlock(genericFor.block(), Optional.empty()));
            schedule(new ConvertWork.MakeGenericFor(genericFor), children);
        } else if (statement instanceof Stmt.FunctionDeclaration declaration) {
            if (declaration.name().names().isEmpty()) {
                throw ConversionException.expectedFunctionName();
            }
            children.add(new ConvertWork.ConvertFunctionBody(declaration.body(), declaration.function()));
            schedule(new ConvertWork.MakeFunctionStatement(declaration), children);
        } else if (statement instanceof Stmt.LocalFunction localFunction) {
            children.add(new ConvertWork.ConvertFunctionBody(localFunction.body(), localFunction.function()));
            schedule(new ConvertWork.MakeLocalFunction(localFunction), children);
        } else if (statement instanceof Stmt.LocalAssignment localAssignment) {
            addTypeSpecifiers(children, localAssignment.types());
            addExpressions(children, localAssignment.values());
            schedule(new ConvertWork.MakeLocalAssign(localAssignment), children);
        } else if (statement instanceof Stmt.If ifStatement) {
            children.add(new ConvertWork.ConvertExpression(ifStatement.condition()));
            children.add(new ConvertWork.ConvertBlock(ifStatement.block(), Optional.empty()));
            for (Stmt.ElseIf branch : ifStatement.elseIfs()) {
                children.add(new ConvertWork.ConvertExpression(branch.condition()));
                children.add(new ConvertWork.ConvertBlock(branch.block(), Optional.empty()));
            }
            ifStatement.elseBlock().ifPresent(
                    elseBlock -> children.add(new ConvertWork.ConvertBlock(elseBlock, Optional.empty())));
            schedule(new ConvertWork.MakeIf(ifStatement), children);
        } else if (statement instanceof Stmt.Repeat repeat) {
            children.add(new ConvertWork.ConvertBlock(repeat.block(), Optional.empty()));
            children.add(new ConvertWork.ConvertExpression(repeat.condition()));
            schedule(new ConvertWork.MakeRepeat(repeat), children);
        } else if (statement instanceof Stmt.While whileStatement) {
            children.add(new ConvertWork.ConvertExpression(whileStatement.condition()));
            children.add(new ConvertWork.ConvertBlock(whileStatement.block(), Optional.empty()));
            schedule(new ConvertWork.MakeWhile(whileStatement), children);
        } else if (statement instanceof Stmt.TypeDeclaration declaration) {
            declaration.generics().ifPresent(
                    generics -> children.add(new ConvertWork.ConvertGenericParameters(generics, true)));
            children.add(new ConvertWork.ConvertType(declaration.declaredType()));
            schedule(new ConvertWork.MakeTypeDeclaration(declaration), children);
        } else if (statement instanceof FunctionCallSyntax call) {
            schedulePrefixWithSuffixes(call, call.prefix(), call.suffixes(), SuffixTarget.STATEMENT);
        } else if (statement instanceof Stmt.Goto || statement instanceof Stmt.Label) {
            convertUnsupportedStatement(statement);
        } else {
            throw error(ConversionErrorKind.STATEMENT, statement);
        }
    }

    private void convertUnsupportedStatement(Stmt statement) throws ConversionException {
        String snippet = snippet(statement);
        if (unsupportedStatements == UnsupportedStatementPolicy.ERROR) {
            throw new ConversionException(ConversionErrorKind.STATEMENT, snippet);
        }
        log.debug("replacing unsupported statement `{}` with an empty do block", snippet);
        statements.push(new DoStatement(new Block()));
    }

    void makeAssign(Stmt.Assignment statement) throws ConversionException {
        List<Variable> converted = variables.pop(statement.variables().size());
        List<Expression> values = expressions.pop(statement.values().size());
        AssignStatement result = new AssignStatement(converted, values);
        if (holdTokenData) {
            result.withTokens(new AssignStatement.Tokens(token(statement.equal()),
                    tokens(statement.variables().separators()), tokens(statement.values().separators())));
        }
        statements.push(result);
    }

    void makeCompoundAssign(Stmt.CompoundAssignment statement, CompoundOperator operator) throws ConversionException {
        Variable variable = variables.pop();
        Expression value = expressions.pop();
        CompoundAssignStatement result = new CompoundAssignStatement(operator, variable, value);
        if (holdTokenData) {
            result.withToken(token(statement.operator()));
        }
        statements.push(result);
    }

    void makeDo(Stmt.Do statement) throws ConversionException {
        DoStatement result = new DoStatement(blocks.pop());
        if (holdTokenData) {
            result.withTokens(new DoStatement.Tokens(token(statement.doToken()), token(statement.end())));
        }
        statements.push(result);
    }

    void makeNumericFor(Stmt.NumericFor statement) throws ConversionException {
        TypedIdentifier identifier = new TypedIdentifier(identifier(statement.name()));
        if (statement.type().isPresent()) {
            identifier.withType(types.pop());
            if (holdTokenData) {
                identifier.withColonToken(token(statement.type().get().punctuation()));
            }
        }
        Expression start = expressions.pop();
        Expression end = expressions.pop();
        Expression step = statement.step().isPresent() ? expressions.pop() : null;
        NumericForStatement result = new NumericForStatement(identifier, start, end, step, blocks.pop());
        if (holdTokenData) {
            result.withTokens(new NumericForStatement.Tokens(token(statement.forToken()), token(statement.equal()),
                    token(statement.endComma()), optionalToken(statement.stepComma()), token(statement.doToken()),
                    token(statement.endToken())));
        }
        statements.push(result);
    }

    void makeGenericFor(Stmt.GenericFor statement) throws ConversionException {
        List<TypedIdentifier> identifiers = typedIdentifiers(statement.names(), statement.types());
        List<Expression> values = expressions.pop(statement.expressions().size());
        GenericForStatement result = new GenericForStatement(identifiers, values, blocks.pop());
        if (holdTokenData) {
            result.withTokens(new GenericForStatement.Tokens(token(statement.forToken()), token(statement.in()),
                    token(statement.doToken()), token(statement.end()),
                    tokens(statement.names().separators()), tokens(statement.expressions().separators())));
        }
        statements.push(result);
    }

    void makeFunctionStatement(Stmt.FunctionDeclaration statement) throws ConversionException {
        List<TokenReference> names = statement.name().names().values();
        FunctionName name = new FunctionName(identifier(names.get(0)));
        for (int i = 1; i < names.size(); i++) {
            name.withField(identifier(names.get(i)));
        }
        if (statement.name().method().isPresent()) {
            name.withMethod(identifier(statement.name().method().get()));
        }
        if (holdTokenData) {
            name.withTokens(new FunctionName.Tokens(tokens(statement.name().names().separators()),
                    optionalToken(statement.name().colon())));
        }
        statements.push(new FunctionStatement(name, functionBodies.pop()));
    }

    void makeLocalFunction(Stmt.LocalFunction statement) throws ConversionException {
        LocalFunctionStatement result = new LocalFunctionStatement(identifier(statement.name()), functionBodies.pop());
        if (holdTokenData) {
            result.withLocalToken(token(statement.local()));
        }
        statements.push(result);
    }

    void makeLocalAssign(Stmt.LocalAssignment statement) throws ConversionException {
        List<TypedIdentifier> identifiers = typedIdentifiers(statement.names(), statement.types());
        List<Expression> values = expressions.pop(statement.values().size());
        LocalAssignStatement result = new LocalAssignStatement(identifiers, values);
        if (holdTokenData) {
            result.withTokens(new LocalAssignStatement.Tokens(token(statement.local()),
                    optionalToken(statement.equal()), tokens(statement.names().separators()),
                    tokens(statement.values().separators())));
        }
        statements.push(result);
    }

    void makeIf(Stmt.If statement) throws ConversionException {
        List<IfBranch> branches = new ArrayList<>();
        branches.add(new IfBranch(expressions.pop(), blocks.pop()));
        for (Stmt.ElseIf elseIf : statement.elseIfs()) {
            IfBranch branch = new IfBranch(expressions.pop(), blocks.pop());
            if (holdTokenData) {
                branch.withTokens(new IfBranch.Tokens(token(elseIf.elseIf()), token(elseIf.then())));
            }
            branches.add(branch);
        }
        Block elseBlock = statement.elseBlock().isPresent() ? blocks.pop() : null;
        IfStatement result = new IfStatement(branches, elseBlock);
        if (holdTokenData) {
            result.withTokens(new IfStatement.Tokens(token(statement.ifToken()), token(statement.then()),
                    token(statement.end()), optionalToken(statement.elseToken())));
        }
        statements.push(result);
    }

    void makeRepeat(Stmt.Repeat statement) throws ConversionException {
        Block block = blocks.pop();
        RepeatStatement result = new RepeatStatement(block, expressions.pop());
        if (holdTokenData) {
            result.withTokens(new RepeatStatement.Tokens(token(statement.repeat()), token(statement.until())));
        }
        statements.push(result);
    }

    void makeWhile(Stmt.While statement) throws ConversionException {
        Expression condition = expressions.pop();
        WhileStatement result = new WhileStatement(condition, blocks.pop());
        if (holdTokenData) {
            result.withTokens(new WhileStatement.Tokens(token(statement.whileToken()), token(statement.doToken()),
                    token(statement.end())));
        }
        statements.push(result);
    }

    void makeTypeDeclaration(Stmt.TypeDeclaration statement) throws ConversionException {
        GenericParameters generics = statement.generics().isPresent() ? genericParameters.pop() : null;
        TypeDeclarationStatement result = new TypeDeclarationStatement(identifier(statement.name()), types.pop());
        if (generics != null) {
            result.withGenericParameters(generics);
        }
        if (statement.export().isPresent()) {
            result.export();
        }
        if (holdTokenData) {
            result.withTokens(new TypeDeclarationStatement.Tokens(token(statement.type()), token(statement.equal()),
                    optionalToken(statement.export())));
        }
        statements.push(result);
    }

    void convertLastStatement(LastStmt statement) throws ConversionException {
        if (statement instanceof LastStmt.Return returnStatement) {
            List<ConvertWork> children = new ArrayList<>();
            addExpressions(children, returnStatement.values());
            schedule(new ConvertWork.MakeReturn(returnStatement), children);
        } else if (statement instanceof LastStmt.Break breakStatement) {
            lastStatements.push(holdTokenData ? new BreakStatement(token(breakStatement.token())) : new BreakStatement());
        } else if (statement instanceof LastStmt.Continue continueStatement) {
            lastStatements.push(holdTokenData
                    ? new ContinueStatement(token(continueStatement.token()))
                    : new ContinueStatement());
        } else {
            throw error(ConversionErrorKind.LAST_STATEMENT, statement);
        }
    }

    void makeReturn(LastStmt.Return statement) throws ConversionException {
        ReturnStatement result = new ReturnStatement(expressions.pop(statement.values().size()));
        if (holdTokenData) {
            result.withTokens(new ReturnStatement.Tokens(token(statement.returnToken()),
                    tokens(statement.values().separators())));
        }
        lastStatements.push(result);
    }

    // ---- expressions ----

    void convertExpression(Expr expression) throws ConversionException {
        List<ConvertWork> children = new ArrayList<>();
        if (expression instanceof Expr.Binary binary) {
            BinaryOperator operator = binaryOperator(binary.operator());
            children.add(new ConvertWork.ConvertExpression(binary.left()));
            children.add(new ConvertWork.ConvertExpression(binary.right()));
            schedule(new ConvertWork.MakeBinary(binary, operator), children);
        } else if (expression instanceof Expr.Unary unary) {
            UnaryOperator operator = unaryOperator(unary.operator());
            children.add(new ConvertWork.ConvertExpression(unary.operand()));
            schedule(new ConvertWork.MakeUnary(unary, operator), children);
        } else if (expression instanceof Expr.Parentheses parentheses) {
            children.add(new ConvertWork.ConvertExpression(parentheses.inner()));
            schedule(new ConvertWork.MakeParenthese(parentheses, false), children);
        } else if (expression instanceof Expr.Function function) {
            children.add(new ConvertWork.ConvertFunctionBody(function.body(), function.function()));
            schedule(new ConvertWork.MakeFunctionExpression(function), children);
        } else if (expression instanceof Expr.Number number) {
            expressions.push(number(number.token()));
        } else if (expression instanceof Expr.StringLiteral string) {
            expressions.push(string(string.token()));
        } else if (expression instanceof Expr.Symbol symbol) {
            expressions.push(symbol(symbol));
        } else if (expression instanceof Expr.IfExpression ifExpression) {
            children.add(new ConvertWork.ConvertExpression(ifExpression.condition()));
            children.add(new ConvertWork.ConvertExpression(ifExpression.result()));
            for (Expr.ElseIfExpression branch : ifExpression.elseIfs()) {
                children.add(new ConvertWork.ConvertExpression(branch.condition()));
                children.add(new ConvertWork.ConvertExpression(branch.result()));
            }
            children.add(new ConvertWork.ConvertExpression(ifExpression.elseResult()));
            schedule(new ConvertWork.MakeIfExpression(ifExpression), children);
        } else if (expression instanceof Expr.InterpolatedString interpolated) {
            for (Expr.InterpolatedSegment segment : interpolated.segments()) {
                children.add(new ConvertWork.ConvertExpression(segment.expression()));
            }
            schedule(new ConvertWork.MakeInterpolatedString(interpolated), children);
        } else if (expression instanceof Expr.TypeAssertion assertion) {
            children.add(new ConvertWork.ConvertExpression(assertion.expression()));
            children.add(new ConvertWork.ConvertType(assertion.castTo()));
            schedule(new ConvertWork.MakeTypeCast(assertion), children);
        } else if (expression instanceof TableConstructor table) {
            scheduleTable(table, false);
        } else if (expression instanceof Var.Name name) {
            expressions.push(identifier(name.token()));
        } else if (expression instanceof Var.Suffixed suffixed) {
            schedulePrefixWithSuffixes(suffixed, suffixed.prefix(), suffixed.suffixes(), SuffixTarget.EXPRESSION);
        } else if (expression instanceof FunctionCallSyntax call) {
            schedulePrefixWithSuffixes(call, call.prefix(), call.suffixes(), SuffixTarget.EXPRESSION);
        } else {
            throw error(ConversionErrorKind.EXPRESSION, expression);
        }
    }

    private Expression symbol(Expr.Symbol symbol) throws ConversionException {
        Token token = holdTokenData ? token(symbol.token()) : null;
        switch (symbol.token().type()) {
            case NIL:
                return token == null ? new NilExpression() : new NilExpression(token);
            case TRUE:
                return token == null ? new TrueExpression() : new TrueExpression(token);
            case FALSE:
                return token == null ? new FalseExpression() : new FalseExpression(token);
            case ELLIPSIS:
                return token == null ? new VariableArgumentsExpression() : new VariableArgumentsExpression(token);
            default:
                throw error(ConversionErrorKind.EXPRESSION, symbol);
        }
    }

    void makeBinary(Expr.Binary expression, BinaryOperator operator) throws ConversionException {
        Expression left = expressions.pop();
        Expression right = expressions.pop();
        BinaryExpression result = new BinaryExpression(operator, left, right);
        if (holdTokenData) {
            result.withToken(token(expression.operator()));
        }
        expressions.push(result);
    }

    void makeUnary(Expr.Unary expression, UnaryOperator operator) throws ConversionException {
        UnaryExpression result = new UnaryExpression(operator, expressions.pop());
        if (holdTokenData) {
            result.withToken(token(expression.operator()));
        }
        expressions.push(result);
    }

    void makeParenthese(Expr.Parentheses expression, boolean asPrefix) throws ConversionException {
        ParentheseExpression result = new ParentheseExpression(expressions.pop());
        if (holdTokenData) {
            ContainedSpan parentheses = expression.parentheses();
            result.withTokens(new ParentheseExpression.Tokens(token(parentheses.open()), token(parentheses.close())));
        }
        if (asPrefix) {
            prefixes.push(result);
        } else {
            expressions.push(result);
        }
    }

    void makeFunctionExpression(Expr.Function expression) throws ConversionException {
        expressions.push(new FunctionExpression(functionBodies.pop()));
    }

    void makeIfExpression(Expr.IfExpression expression) throws ConversionException {
        Expression condition = expressions.pop();
        Expression result = expressions.pop();
        List<ElseIfExpressionBranch> branches = new ArrayList<>();
        for (Expr.ElseIfExpression elseIf : expression.elseIfs()) {
            Expression branchCondition = expressions.pop();
            ElseIfExpressionBranch branch = new ElseIfExpressionBranch(branchCondition, expressions.pop());
            if (holdTokenData) {
                branch.withTokens(new ElseIfExpressionBranch.Tokens(token(elseIf.elseIf()), token(elseIf.then())));
            }
            branches.add(branch);
        }
        IfExpression ifExpression = new IfExpression(condition, result, expressions.pop());
        branches.forEach(ifExpression::withBranch);
        if (holdTokenData) {
            ifExpression.withTokens(new IfExpression.Tokens(token(expression.ifToken()), token(expression.then()),
                    token(expression.elseToken())));
        }
        expressions.push(ifExpression);
    }

    void makeInterpolatedString(Expr.InterpolatedString expression) throws ConversionException {
        List<Expr.InterpolatedSegment> segments = expression.segments();
        List<Expression> values = expressions.pop(segments.size());
        InterpolatedStringExpression result = new InterpolatedStringExpression();
        for (int i = 0; i < segments.size(); i++) {
            TokenReference literal = segments.get(i).literal();
            addStringSegment(result, literal);
            ValueSegment value = new ValueSegment(values.get(i));
            if (holdTokenData) {
                TokenReference next = i + 1 < segments.size() ? segments.get(i + 1).literal() : expression.last();
                value.withTokens(new ValueSegment.Tokens(openingBrace(literal), closingBrace(next)));
            }
            result.withSegment(value);
        }
        addStringSegment(result, expression.last());
        if (holdTokenData) {
            TokenReference first = segments.isEmpty() ? expression.last() : segments.get(0).literal();
            result.withTokens(new InterpolatedStringExpression.Tokens(openingTick(first), closingTick(expression.last())));
        }
        expressions.push(result);
    }

    /**
     * Adds the literal text between the delimiters of an interpolated string lexeme, if any.
     * A lexeme always starts and ends with one delimiter character: a backtick or a brace.
     */
    private void addStringSegment(InterpolatedStringExpression result, TokenReference literal) throws ConversionException {
        String text = literal.text();
        if (text.length() < 2) {
            throw new ConversionException(ConversionErrorKind.INTERPOLATED_STRING, text);
        }
        String content = text.substring(1, text.length() - 1);
        if (content.isEmpty()) {
            return;
        }
        String value;
        try {
            value = StringDecoder.decodeEscapes(content);
        } catch (IllegalArgumentException e) {
            throw new ConversionException(ConversionErrorKind.INTERPOLATED_STRING, text);
        }
        Lexeme lexeme = literal.token();
        if (holdTokenData) {
            result.withSegment(new StringSegment(value,
                    Token.fromPosition(lexeme.start() + 1, lexeme.end() - 1, lexeme.line())));
        } else {
            result.withSegment(new StringSegment(value));
        }
    }

    private Token openingTick(TokenReference first) throws ConversionException {
        Lexeme lexeme = first.token();
        Token token = Token.fromPosition(lexeme.start(), lexeme.start() + 1, lexeme.line());
        pushTrivia(first.leadingTrivia(), token, true);
        return token;
    }

    private Token closingTick(TokenReference last) throws ConversionException {
        Lexeme lexeme = last.token();
        Token token = Token.fromPosition(lexeme.end() - 1, lexeme.end(), lexeme.line() + lexeme.lineBreaks());
        pushTrivia(last.trailingTrivia(), token, false);
        return token;
    }

    private Token openingBrace(TokenReference literal) throws ConversionException {
        Lexeme lexeme = literal.token();
        Token token = Token.fromPosition(lexeme.end() - 1, lexeme.end(), lexeme.line() + lexeme.lineBreaks());
        pushTrivia(literal.trailingTrivia(), token, false);
        return token;
    }

    private Token closingBrace(TokenReference next) throws ConversionException {
        Lexeme lexeme = next.token();
        Token token = Token.fromPosition(lexeme.start(), lexeme.start() + 1, lexeme.line());
        pushTrivia(next.leadingTrivia(), token, true);
        return token;
    }

    void makeTypeCast(Expr.TypeAssertion expression) throws ConversionException {
        Expression value = expressions.pop();
        TypeCastExpression result = new TypeCastExpression(value, types.pop());
        if (holdTokenData) {
            result.withToken(token(expression.doubleColon()));
        }
        expressions.push(result);
    }

    private void scheduleTable(TableConstructor table, boolean asArguments) throws ConversionException {
        List<ConvertWork> children = new ArrayList<>();
        for (TableField field : table.fields().values()) {
            if (field instanceof TableField.NoKey noKey) {
                children.add(new ConvertWork.ConvertExpression(noKey.value()));
            } else if (field instanceof TableField.NameKey nameKey) {
                children.add(new ConvertWork.ConvertExpression(nameKey.value()));
            } else if (field instanceof TableField.ExpressionKey expressionKey) {
                children.add(new ConvertWork.ConvertExpression(expressionKey.key()));
                children.add(new ConvertWork.ConvertExpression(expressionKey.value()));
            } else {
                throw error(ConversionErrorKind.TABLE_ENTRY, field);
            }
        }
        schedule(new ConvertWork.MakeTable(table, asArguments), children);
    }

    void makeTable(TableConstructor table, boolean asArguments) throws ConversionException {
        List<TableEntry> entries = new ArrayList<>();
        for (TableField field : table.fields().values()) {
            if (field instanceof TableField.NoKey) {
                entries.add(new TableValueEntry(expressions.pop()));
            } else if (field instanceof TableField.NameKey nameKey) {
                TableFieldEntry entry = new TableFieldEntry(identifier(nameKey.name()), expressions.pop());
                if (holdTokenData) {
                    entry.withToken(token(nameKey.equal()));
                }
                entries.add(entry);
            } else {
                TableField.ExpressionKey expressionKey = (TableField.ExpressionKey) field;
                Expression key = expressions.pop();
                TableIndexEntry entry = new TableIndexEntry(key, expressions.pop());
                if (holdTokenData) {
                    entry.withTokens(new TableIndexEntry.Tokens(token(expressionKey.brackets().open()),
                            token(expressionKey.brackets().close()), token(expressionKey.equal())));
                }
                entries.add(entry);
            }
        }
        TableExpression result = new TableExpression(entries);
        if (holdTokenData) {
            result.withTokens(new TableExpression.Tokens(token(table.braces().open()), token(table.braces().close()),
                    tokens(table.fields().separators())));
        }
        if (asArguments) {
            arguments.push(result);
        } else {
            expressions.push(result);
        }
    }

    void convertPrefix(PrefixSyntax prefix) throws ConversionException {
        if (prefix instanceof PrefixSyntax.Name name) {
            prefixes.push(identifier(name.token()));
        } else if (prefix instanceof PrefixSyntax.Expression wrapped
                && wrapped.expression() instanceof Expr.Parentheses parentheses) {
            schedule(new ConvertWork.MakeParenthese(parentheses, true),
                    List.of(new ConvertWork.ConvertExpression(parentheses.inner())));
        } else {
            throw error(ConversionErrorKind.PREFIX, prefix);
        }
    }

    void convertVariable(Var variable) throws ConversionException {
        if (variable instanceof Var.Name name) {
            variables.push(identifier(name.token()));
        } else if (variable instanceof Var.Suffixed suffixed) {
            schedulePrefixWithSuffixes(suffixed, suffixed.prefix(), suffixed.suffixes(), SuffixTarget.VARIABLE);
        } else {
            throw error(ConversionErrorKind.VARIABLE, variable);
        }
    }

    /**
     * Schedules the conversion of a prefix followed by call and index suffixes. The suffix shapes
     * are validated here so the assembly step only has to replay them.
     */
    private void schedulePrefixWithSuffixes(SyntaxNode node, PrefixSyntax prefix, List<Suffix> suffixes,
                                            SuffixTarget target) throws ConversionException {
        List<ConvertWork> children = new ArrayList<>();
        children.add(new ConvertWork.ConvertPrefix(prefix));
        for (Suffix suffix : suffixes) {
            if (suffix instanceof Suffix.CallSuffix callSuffix) {
                Call call = callSuffix.call();
                if (call instanceof Call.Anonymous anonymous) {
                    children.add(new ConvertWork.ConvertArguments(anonymous.arguments()));
                } else if (call instanceof Call.Method method) {
                    children.add(new ConvertWork.ConvertArguments(method.arguments()));
                } else {
                    throw error(ConversionErrorKind.CALL, call);
                }
            } else if (suffix instanceof Suffix.IndexSuffix indexSuffix) {
                Index index = indexSuffix.index();
                if (index instanceof Index.Brackets brackets) {
                    children.add(new ConvertWork.ConvertExpression(brackets.expression()));
                } else if (!(index instanceof Index.Dot)) {
                    throw error(ConversionErrorKind.INDEX, index);
                }
            } else {
                throw error(ConversionErrorKind.SUFFIX, suffix);
            }
        }
        schedule(new ConvertWork.MakePrefixWithSuffixes(node, suffixes, target), children);
    }

    void makePrefixWithSuffixes(SyntaxNode node, List<Suffix> suffixes, SuffixTarget target) throws ConversionException {
        Prefix current = prefixes.pop();
        for (Suffix suffix : suffixes) {
            if (suffix instanceof Suffix.CallSuffix callSuffix) {
                Call call = callSuffix.call();
                if (call instanceof Call.Method method) {
                    FunctionCall functionCall = new FunctionCall(current, arguments.pop())
                            .withMethod(identifier(method.name()));
                    if (holdTokenData) {
                        functionCall.withColon(token(method.colon()));
                    }
                    current = functionCall;
                } else {
                    current = new FunctionCall(current, arguments.pop());
                }
            } else {
                Index index = ((Suffix.IndexSuffix) suffix).index();
                if (index instanceof Index.Brackets brackets) {
                    IndexExpression indexExpression = new IndexExpression(current, expressions.pop());
                    if (holdTokenData) {
                        indexExpression.withTokens(new IndexExpression.Tokens(token(brackets.brackets().open()),
                                token(brackets.brackets().close())));
                    }
                    current = indexExpression;
                } else {
                    Index.Dot dot = (Index.Dot) index;
                    FieldExpression field = new FieldExpression(current, identifier(dot.name()));
                    if (holdTokenData) {
                        field.withToken(token(dot.dot()));
                    }
                    current = field;
                }
            }
        }
        switch (target) {
            case EXPRESSION:
                expressions.push(current);
                break;
            case PREFIX:
                prefixes.push(current);
                break;
            case VARIABLE:
                if (!(current instanceof Variable)) {
                    throw error(ConversionErrorKind.VARIABLE, node);
                }
                variables.push((Variable) current);
                break;
            case STATEMENT:
                if (!(current instanceof FunctionCall)) {
                    throw error(ConversionErrorKind.STATEMENT, node);
                }
                statements.push((FunctionCall) current);
                break;
            default:
                throw new IllegalStateException("unknown suffix target " + target);
        }
    }

    void convertArguments(Args args) throws ConversionException {
        if (args instanceof Args.Parenthesized parenthesized) {
            List<ConvertWork> children = new ArrayList<>();
            addExpressions(children, parenthesized.arguments());
            schedule(new ConvertWork.MakeTupleArguments(parenthesized), children);
        } else if (args instanceof Expr.StringLiteral string) {
            arguments.push(string(string.token()));
        } else if (args instanceof TableConstructor table) {
            scheduleTable(table, true);
        } else {
            throw error(ConversionErrorKind.FUNCTION_ARGUMENTS, args);
        }
    }

    void makeTupleArguments(Args.Parenthesized args) throws ConversionException {
        TupleArguments result = new TupleArguments(expressions.pop(args.arguments().size()));
        if (holdTokenData) {
            result.withTokens(new TupleArguments.Tokens(token(args.parentheses().open()),
                    token(args.parentheses().close()), tokens(args.arguments().separators())));
        }
        arguments.push(result);
    }

    // ---- functions ----

    void convertFunctionBody(FunctionBodySyntax body, TokenReference function) throws ConversionException {
        List<Parameter> parameters = body.parameters().values();
        boolean variadic = false;
        for (Parameter parameter : parameters) {
            if (variadic) {
                throw new ConversionException(ConversionErrorKind.FUNCTION_PARAMETERS, parameterListSnippet(body));
            }
            if (parameter instanceof Parameter.Ellipsis) {
                variadic = true;
            } else if (!(parameter instanceof Parameter.Name)) {
                throw error(ConversionErrorKind.FUNCTION_PARAMETER, parameter);
            }
        }

        List<ConvertWork> children = new ArrayList<>();
        body.generics().ifPresent(generics -> children.add(new ConvertWork.ConvertGenericParameters(generics, false)));
        for (int i = 0; i < parameters.size(); i++) {
            Optional<TypeSpecifier> specifier = typeSpecifier(body.typeSpecifiers(), i);
            if (specifier.isPresent()) {
                TypeInfo type = specifier.get().type();
                children.add(parameters.get(i) instanceof Parameter.Ellipsis
                        ? new ConvertWork.ConvertFunctionVariadicType(type)
                        : new ConvertWork.ConvertType(type));
            }
        }
        body.returnType().ifPresent(returnType -> children.add(new ConvertWork.ConvertReturnType(returnType.type())));
        children.add(new ConvertWork.ConvertBlock(body.block(), Optional.empty()));
        schedule(new ConvertWork.MakeFunctionBody(body, function), children);
    }

    void makeFunctionBody(FunctionBodySyntax body, TokenReference function) throws ConversionException {
        GenericParameters generics = body.generics().isPresent() ? genericParameters.pop() : null;
        List<Parameter> parameters = body.parameters().values();
        List<TypedIdentifier> named = new ArrayList<>();
        boolean variadic = false;
        FunctionVariadicType variadicType = null;
        Optional<Token> ellipsis = Optional.empty();
        Optional<Token> ellipsisColon = Optional.empty();
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            Optional<TypeSpecifier> specifier = typeSpecifier(body.typeSpecifiers(), i);
            if (parameter instanceof Parameter.Ellipsis ellipsisParameter) {
                variadic = true;
                if (holdTokenData) {
                    ellipsis = Optional.of(token(ellipsisParameter.token()));
                }
                if (specifier.isPresent()) {
                    variadicType = functionVariadicTypes.pop();
                    if (holdTokenData) {
                        ellipsisColon = Optional.of(token(specifier.get().punctuation()));
                    }
                }
            } else {
                TypedIdentifier identifier = new TypedIdentifier(identifier(((Parameter.Name) parameter).token()));
                if (specifier.isPresent()) {
                    identifier.withType(types.pop());
                    if (holdTokenData) {
                        identifier.withColonToken(token(specifier.get().punctuation()));
                    }
                }
                named.add(identifier);
            }
        }
        FunctionReturnType returnType = body.returnType().isPresent() ? returnTypes.pop() : null;

        FunctionBody result = new FunctionBody(blocks.pop(), named, variadic);
        if (variadicType != null) {
            result.withVariadicType(variadicType);
        }
        if (returnType != null) {
            result.withReturnType(returnType);
        }
        if (generics != null) {
            result.withGenericParameters(generics);
        }
        if (holdTokenData) {
            Optional<Token> returnTypeColon = body.returnType().isPresent()
                    ? Optional.of(token(body.returnType().get().punctuation()))
                    : Optional.empty();
            result.withTokens(new FunctionBody.Tokens(token(function), token(body.parentheses().open()),
                    token(body.parentheses().close()), token(body.end()), tokens(body.parameters().separators()),
                    ellipsis, ellipsisColon, returnTypeColon));
        }
        functionBodies.push(result);
    }

    private String parameterListSnippet(FunctionBodySyntax body) {
        ContainedSpan parentheses = body.parentheses();
        return source.substring(parentheses.open().token().start(), parentheses.close().token().end());
    }

    // ---- types ----

    void convertType(TypeInfo type) throws ConversionException {
        List<ConvertWork> children = new ArrayList<>();
        if (type instanceof TypeInfo.Basic basic) {
            if (basic.token().type() == TokenType.NIL) {
                types.push(holdTokenData ? new NilType(token(basic.token())) : new NilType());
            } else {
                types.push(new TypeName(identifier(basic.token())));
            }
        } else if (type instanceof TypeInfo.Boolean bool) {
            boolean isTrue = bool.token().type() == TokenType.TRUE;
            Token token = holdTokenData ? token(bool.token()) : null;
            if (isTrue) {
                types.push(token == null ? new TrueType() : new TrueType(token));
            } else {
                types.push(token == null ? new FalseType() : new FalseType(token));
            }
        } else if (type instanceof TypeInfo.StringLiteral string) {
            String value = decodeString(string.token(), ConversionErrorKind.STRING);
            types.push(holdTokenData ? new StringType(value, token(string.token())) : new StringType(value));
        } else if (type instanceof TypeInfo.Array array) {
            children.add(new ConvertWork.ConvertType(array.element()));
            schedule(new ConvertWork.MakeArrayType(array), children);
        } else if (type instanceof TypeInfo.Table table) {
            scheduleTableType(table);
        } else if (type instanceof TypeInfo.Callback callback) {
            scheduleFunctionType(callback);
        } else if (type instanceof TypeInfo.Generic generic) {
            for (TypeInfo parameter : generic.generics().values()) {
                children.add(new ConvertWork.ConvertTypeParameter(parameter));
            }
            schedule(new ConvertWork.MakeTypeName(generic), children);
        } else if (type instanceof TypeInfo.Intersection intersection) {
            children.add(new ConvertWork.ConvertType(intersection.left()));
            children.add(new ConvertWork.ConvertType(intersection.right()));
            schedule(new ConvertWork.MakeIntersectionType(intersection), children);
        } else if (type instanceof TypeInfo.Union union) {
            children.add(new ConvertWork.ConvertType(union.left()));
            children.add(new ConvertWork.ConvertType(union.right()));
            schedule(new ConvertWork.MakeUnionType(union), children);
        } else if (type instanceof TypeInfo.Module module) {
            children.add(new ConvertWork.ConvertType(module.type()));
            schedule(new ConvertWork.MakeTypeField(module), children);
        } else if (type instanceof TypeInfo.OptionalType optional) {
            children.add(new ConvertWork.ConvertType(optional.base()));
            schedule(new ConvertWork.MakeOptionalType(optional), children);
        } else if (type instanceof TypeInfo.Typeof typeof) {
            children.add(new ConvertWork.ConvertExpression(typeof.inner()));
            schedule(new ConvertWork.MakeExpressionType(typeof), children);
        } else if (type instanceof TypeInfo.Tuple tuple && tuple.types().size() == 1
                && tuple.types().separators().isEmpty()) {
            children.add(new ConvertWork.ConvertType(tuple.types().values().get(0)));
            schedule(new ConvertWork.MakeParentheseType(tuple), children);
        } else {
            throw error(ConversionErrorKind.TYPE, type);
        }
    }

    /** A function return position accepts packs as well as plain types. */
    void convertReturnType(TypeInfo type) throws ConversionException {
        if (type instanceof TypeInfo.Tuple tuple) {
            work.push(new ConvertWork.Move<>(typePacks, returnTypes));
            scheduleTypePack(tuple);
        } else if (type instanceof TypeInfo.Variadic variadic) {
            work.push(new ConvertWork.Move<>(variadicTypePacks, returnTypes));
            scheduleVariadicTypePack(variadic);
        } else if (type instanceof TypeInfo.GenericPack pack) {
            returnTypes.push(genericTypePack(pack.name(), pack.ellipsis()));
        } else {
            work.push(new ConvertWork.Move<>(types, returnTypes));
            work.push(new ConvertWork.ConvertType(type));
        }
    }

    void convertTypeParameter(TypeInfo type) throws ConversionException {
        if (type instanceof TypeInfo.Tuple tuple) {
            work.push(new ConvertWork.Move<>(typePacks, typeParameters));
            scheduleTypePack(tuple);
        } else if (type instanceof TypeInfo.Variadic variadic) {
            work.push(new ConvertWork.Move<>(variadicTypePacks, typeParameters));
            scheduleVariadicTypePack(variadic);
        } else if (type instanceof TypeInfo.GenericPack pack) {
            typeParameters.push(genericTypePack(pack.name(), pack.ellipsis()));
        } else {
            work.push(new ConvertWork.Move<>(types, typeParameters));
            work.push(new ConvertWork.ConvertType(type));
        }
    }

    void convertVariadicArgumentType(TypeInfo type) throws ConversionException {
        if (type instanceof TypeInfo.Variadic variadic) {
            work.push(new ConvertWork.Move<>(variadicTypePacks, variadicArgumentTypes));
            scheduleVariadicTypePack(variadic);
        } else if (type instanceof TypeInfo.GenericPack pack) {
            variadicArgumentTypes.push(genericTypePack(pack.name(), pack.ellipsis()));
        } else {
            throw error(ConversionErrorKind.TYPE, type);
        }
    }

    void convertFunctionVariadicType(TypeInfo type) throws ConversionException {
        if (type instanceof TypeInfo.GenericPack pack) {
            functionVariadicTypes.push(genericTypePack(pack.name(), pack.ellipsis()));
        } else {
            work.push(new ConvertWork.Move<>(types, functionVariadicTypes));
            work.push(new ConvertWork.ConvertType(type));
        }
    }

    void convertPackDefault(TypeInfo type) throws ConversionException {
        if (type instanceof TypeInfo.Tuple tuple) {
            work.push(new ConvertWork.Move<>(typePacks, packDefaults));
            scheduleTypePack(tuple);
        } else if (type instanceof TypeInfo.Variadic variadic) {
            work.push(new ConvertWork.Move<>(variadicTypePacks, packDefaults));
            scheduleVariadicTypePack(variadic);
        } else if (type instanceof TypeInfo.GenericPack pack) {
            packDefaults.push(genericTypePack(pack.name(), pack.ellipsis()));
        } else {
            throw error(ConversionErrorKind.TYPE, type);
        }
    }

    private static boolean isVariadicTail(TypeInfo type) {
        return type instanceof TypeInfo.Variadic || type instanceof TypeInfo.GenericPack;
    }

    private void scheduleTypePack(TypeInfo.Tuple tuple) {
        List<TypeInfo> elements = tuple.types().values();
        boolean variadicTail = !elements.isEmpty() && isVariadicTail(elements.get(elements.size() - 1));
        List<ConvertWork> children = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            boolean tail = variadicTail && i == elements.size() - 1;
            children.add(tail
                    ? new ConvertWork.ConvertVariadicArgumentType(elements.get(i))
                    : new ConvertWork.ConvertType(elements.get(i)));
        }
        schedule(new ConvertWork.MakeTypePack(tuple, variadicTail), children);
    }

    void makeTypePack(TypeInfo.Tuple tuple, boolean variadicTail) throws ConversionException {
        int plainCount = tuple.types().size() - (variadicTail ? 1 : 0);
        TypePack result = new TypePack();
        for (Type type : types.pop(plainCount)) {
            result.withType(type);
        }
        if (variadicTail) {
            result.withVariadicType(variadicArgumentTypes.pop());
        }
        if (holdTokenData) {
            result.withTokens(new TypePack.Tokens(token(tuple.parentheses().open()), token(tuple.parentheses().close()),
                    tokens(tuple.types().separators())));
        }
        typePacks.push(result);
    }

    private void scheduleVariadicTypePack(TypeInfo.Variadic variadic) {
        schedule(new ConvertWork.MakeVariadicTypePack(variadic), List.of(new ConvertWork.ConvertType(variadic.type())));
    }

    void makeVariadicTypePack(TypeInfo.Variadic variadic) throws ConversionException {
        VariadicTypePack result = new VariadicTypePack(types.pop());
        if (holdTokenData) {
            result.withToken(token(variadic.ellipsis()));
        }
        variadicTypePacks.push(result);
    }

    void makeArrayType(TypeInfo.Array array) throws ConversionException {
        ArrayType result = new ArrayType(types.pop());
        if (holdTokenData) {
            result.withTokens(new ArrayType.Tokens(token(array.braces().open()), token(array.braces().close())));
        }
        types.push(result);
    }

    private void scheduleTableType(TypeInfo.Table table) throws ConversionException {
        List<ConvertWork> children = new ArrayList<>();
        boolean hasIndexer = false;
        for (org.lunaform.compiler.frontend.syntax.TypeField field : table.fields().values()) {
            if (field.key() instanceof org.lunaform.compiler.frontend.syntax.TypeField.IndexSignature signature) {
                if (hasIndexer) {
                    throw error(ConversionErrorKind.TABLE_TYPE_PROPERTY, field);
                }
                hasIndexer = true;
                children.add(new ConvertWork.ConvertType(signature.inner()));
            } else if (!(field.key() instanceof org.lunaform.compiler.frontend.syntax.TypeField.NameKey)) {
                throw error(ConversionErrorKind.TABLE_TYPE_PROPERTY, field);
            }
            children.add(new ConvertWork.ConvertType(field.value()));
        }
        schedule(new ConvertWork.MakeTableType(table), children);
    }

    void makeTableType(TypeInfo.Table table) throws ConversionException {
        TableType result = new TableType();
        for (org.lunaform.compiler.frontend.syntax.TypeField field : table.fields().values()) {
            if (field.key() instanceof org.lunaform.compiler.frontend.syntax.TypeField.IndexSignature signature) {
                Type key = types.pop();
                TableIndexerType indexer = new TableIndexerType(key, types.pop());
                if (holdTokenData) {
                    indexer.withTokens(new TableIndexerType.Tokens(token(signature.brackets().open()),
                            token(signature.brackets().close()), token(field.colon())));
                }
                result.withEntry(indexer);
            } else {
                org.lunaform.compiler.frontend.syntax.TypeField.NameKey name =
                        (org.lunaform.compiler.frontend.syntax.TypeField.NameKey) field.key();
                TablePropertyType property = new TablePropertyType(identifier(name.name()), types.pop());
                if (holdTokenData) {
                    property.withToken(token(field.colon()));
                }
                result.withEntry(property);
            }
        }
        if (holdTokenData) {
            result.withTokens(new TableType.Tokens(token(table.braces().open()), token(table.braces().close()),
                    tokens(table.fields().separators())));
        }
        types.push(result);
    }

    private void scheduleFunctionType(TypeInfo.Callback callback) throws ConversionException {
        List<TypeInfo.TypeArgument> args = callback.arguments().values();
        boolean variadicTail = !args.isEmpty() && isVariadicTail(args.get(args.size() - 1).type());
        if (variadicTail && args.get(args.size() - 1).name().isPresent()) {
            throw error(ConversionErrorKind.TYPE, args.get(args.size() - 1));
        }
        List<ConvertWork> children = new ArrayList<>();
        callback.generics().ifPresent(generics -> children.add(new ConvertWork.ConvertGenericParameters(generics, false)));
        for (int i = 0; i < args.size(); i++) {
            boolean tail = variadicTail && i == args.size() - 1;
            children.add(tail
                    ? new ConvertWork.ConvertVariadicArgumentType(args.get(i).type())
                    : new ConvertWork.ConvertType(args.get(i).type()));
        }
        children.add(new ConvertWork.ConvertReturnType(callback.returnType()));
        schedule(new ConvertWork.MakeFunctionType(callback, variadicTail), children);
    }

    void makeFunctionType(TypeInfo.Callback callback, boolean variadicTail) throws ConversionException {
        GenericParameters generics = callback.generics().isPresent() ? genericParameters.pop() : null;
        List<TypeInfo.TypeArgument> args = callback.arguments().values();
        int plainCount = args.size() - (variadicTail ? 1 : 0);
        List<FunctionArgumentType> converted = new ArrayList<>();
        for (int i = 0; i < plainCount; i++) {
            TypeInfo.TypeArgument argument = args.get(i);
            FunctionArgumentType argumentType = new FunctionArgumentType(types.pop());
            if (argument.name().isPresent()) {
                Token colon = holdTokenData && argument.colon().isPresent() ? token(argument.colon().get()) : null;
                argumentType.withName(identifier(argument.name().get()), colon);
            }
            converted.add(argumentType);
        }
        VariadicArgumentType variadicType = variadicTail ? variadicArgumentTypes.pop() : null;

        FunctionType result = new FunctionType(returnTypes.pop());
        converted.forEach(result::withArgument);
        if (variadicType != null) {
            result.withVariadicArgumentType(variadicType);
        }
        if (generics != null) {
            result.withGenericParameters(generics);
        }
        if (holdTokenData) {
            result.withTokens(new FunctionType.Tokens(token(callback.parentheses().open()),
                    token(callback.parentheses().close()), token(callback.arrow()),
                    tokens(callback.arguments().separators())));
        }
        types.push(result);
    }

    void makeTypeName(TypeInfo.Generic generic) throws ConversionException {
        TypeParameters parameters = new TypeParameters(typeParameters.pop(generic.generics().size()));
        if (holdTokenData) {
            parameters.withTokens(new TypeParameters.Tokens(token(generic.arrows().open()),
                    token(generic.arrows().close()), tokens(generic.generics().separators())));
        }
        types.push(new TypeName(identifier(generic.base())).withParameters(parameters));
    }

    void makeTypeField(TypeInfo.Module module) throws ConversionException {
        Type inner = types.pop();
        if (!(inner instanceof TypeName)) {
            throw error(ConversionErrorKind.TYPE, module);
        }
        TypeField result = new TypeField(identifier(module.module()), (TypeName) inner);
        if (holdTokenData) {
            result.withToken(token(module.dot()));
        }
        types.push(result);
    }

    void makeOptionalType(TypeInfo.OptionalType optional) throws ConversionException {
        OptionalType result = new OptionalType(types.pop());
        if (holdTokenData) {
            result.withToken(token(optional.questionMark()));
        }
        types.push(result);
    }

    void makeUnionType(TypeInfo.Union union) throws ConversionException {
        Type left = types.pop();
        UnionType result = new UnionType(left, types.pop());
        if (holdTokenData) {
            result.withToken(token(union.pipe()));
        }
        types.push(result);
    }

    void makeIntersectionType(TypeInfo.Intersection intersection) throws ConversionException {
        Type left = types.pop();
        IntersectionType result = new IntersectionType(left, types.pop());
        if (holdTokenData) {
            result.withToken(token(intersection.ampersand()));
        }
        types.push(result);
    }

    void makeParentheseType(TypeInfo.Tuple tuple) throws ConversionException {
        ParentheseType result = new ParentheseType(types.pop());
        if (holdTokenData) {
            result.withTokens(new ParentheseType.Tokens(token(tuple.parentheses().open()),
                    token(tuple.parentheses().close())));
        }
        types.push(result);
    }

    void makeExpressionType(TypeInfo.Typeof typeof) throws ConversionException {
        ExpressionType result = new ExpressionType(expressions.pop());
        if (holdTokenData) {
            result.withTokens(new ExpressionType.Tokens(token(typeof.typeofToken()),
                    token(typeof.parentheses().open()), token(typeof.parentheses().close())));
        }
        types.push(result);
    }

    // ---- generics ----

    /**
     * Validates the parameter order: plain variables, variables with a default, packs, then packs
     * with a default. Defaults are rejected where they are not allowed.
     */
    void convertGenericParameters(GenericDeclaration declaration, boolean allowDefaults) throws ConversionException {
        List<ConvertWork> children = new ArrayList<>();
        int previousPhase = 0;
        boolean sawVariableDefault = false;
        for (GenericDeclaration.GenericParameter parameter : declaration.parameters().values()) {
            boolean pack = parameter.info() instanceof GenericDeclaration.Pack;
            boolean hasDefault = parameter.defaultType().isPresent();
            if (hasDefault && !allowDefaults) {
                throw genericsError(declaration);
            }
            int phase = (pack ? 2 : 0) + (hasDefault ? 1 : 0);
            if (phase < previousPhase || (phase == 2 && sawVariableDefault)) {
                throw genericsError(declaration);
            }
            previousPhase = phase;
            sawVariableDefault |= phase == 1;
            if (hasDefault) {
                TypeInfo defaultType = parameter.defaultType().get();
                children.add(pack ? new ConvertWork.ConvertPackDefault(defaultType) : new ConvertWork.ConvertType(defaultType));
            }
        }
        schedule(new ConvertWork.MakeGenericParameters(declaration), children);
    }

    void makeGenericParameters(GenericDeclaration declaration) throws ConversionException {
        GenericParameters result = new GenericParameters();
        for (GenericDeclaration.GenericParameter parameter : declaration.parameters().values()) {
            Optional<Token> equal = holdTokenData ? optionalToken(parameter.equal()) : Optional.empty();
            if (parameter.info() instanceof GenericDeclaration.Pack pack) {
                GenericTypePack typePack = genericTypePack(pack.name(), pack.ellipsis());
                if (parameter.defaultType().isPresent()) {
                    GenericTypePackWithDefault withDefault = new GenericTypePackWithDefault(typePack, packDefaults.pop());
                    equal.ifPresent(withDefault::withToken);
                    result.withGenericTypePackWithDefault(withDefault);
                } else {
                    result.withGenericTypePack(typePack);
                }
            } else {
                Identifier name = identifier(((GenericDeclaration.Name) parameter.info()).name());
                if (parameter.defaultType().isPresent()) {
                    TypeVariableWithDefault withDefault = new TypeVariableWithDefault(name, types.pop());
                    equal.ifPresent(withDefault::withToken);
                    result.withTypeVariableWithDefault(withDefault);
                } else {
                    result.withTypeVariable(name);
                }
            }
        }
        if (holdTokenData) {
            result.withTokens(new GenericParameters.Tokens(token(declaration.arrows().open()),
                    token(declaration.arrows().close()), tokens(declaration.parameters().separators())));
        }
        genericParameters.push(result);
    }

    private ConversionException genericsError(GenericDeclaration declaration) {
        ContainedSpan arrows = declaration.arrows();
        return new ConversionException(ConversionErrorKind.GENERICS,
                source.substring(arrows.open().token().start(), arrows.close().token().end()));
    }

    private GenericTypePack genericTypePack(TokenReference name, TokenReference ellipsis) throws ConversionException {
        GenericTypePack pack = new GenericTypePack(identifier(name));
        if (holdTokenData) {
            pack.withToken(token(ellipsis));
        }
        return pack;
    }

    // ---- shared helpers ----

    private static void addExpressions(List<ConvertWork> children, Punctuated<Expr> values) {
        for (Expr value : values.values()) {
            children.add(new ConvertWork.ConvertExpression(value));
        }
    }

    private static void addTypeSpecifiers(List<ConvertWork> children, List<Optional<TypeSpecifier>> specifiers) {
        for (Optional<TypeSpecifier> specifier : specifiers) {
            specifier.ifPresent(present -> children.add(new ConvertWork.ConvertType(present.type())));
        }
    }

    private static Optional<TypeSpecifier> typeSpecifier(List<Optional<TypeSpecifier>> specifiers, int index) {
        return index < specifiers.size() ? specifiers.get(index) : Optional.empty();
    }

    private List<TypedIdentifier> typedIdentifiers(Punctuated<TokenReference> names,
                                                   List<Optional<TypeSpecifier>> specifiers) throws ConversionException {
        List<TypedIdentifier> identifiers = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            TypedIdentifier identifier = new TypedIdentifier(identifier(names.values().get(i)));
            Optional<TypeSpecifier> specifier = typeSpecifier(specifiers, i);
            if (specifier.isPresent()) {
                identifier.withType(types.pop());
                if (holdTokenData) {
                    identifier.withColonToken(token(specifier.get().punctuation()));
                }
            }
            identifiers.add(identifier);
        }
        return identifiers;
    }

    private Identifier identifier(TokenReference reference) throws ConversionException {
        Identifier identifier = new Identifier(reference.text());
        if (holdTokenData) {
            identifier.setToken(token(reference));
        }
        return identifier;
    }

    private NumberExpression number(TokenReference reference) throws ConversionException {
        NumberExpression number = NumberParser.parse(reference.text());
        if (holdTokenData) {
            number.setToken(token(reference));
        }
        return number;
    }

    private StringExpression string(TokenReference reference) throws ConversionException {
        String value = decodeString(reference, ConversionErrorKind.STRING);
        return holdTokenData ? new StringExpression(value, token(reference)) : new StringExpression(value);
    }

    private static String decodeString(TokenReference reference, ConversionErrorKind kind) throws ConversionException {
        try {
            return StringDecoder.decodeLiteral(reference.text());
        } catch (IllegalArgumentException e) {
            throw new ConversionException(kind, reference.text());
        }
    }

    private Token token(TokenReference reference) throws ConversionException {
        Lexeme lexeme = reference.token();
        Token token = Token.fromPosition(lexeme.start(), lexeme.end(), lexeme.line());
        pushTrivia(reference.leadingTrivia(), token, true);
        pushTrivia(reference.trailingTrivia(), token, false);
        return token;
    }

    private Optional<Token> optionalToken(Optional<TokenReference> reference) throws ConversionException {
        return reference.isPresent() ? Optional.of(token(reference.get())) : Optional.empty();
    }

    private List<Token> tokens(List<TokenReference> references) throws ConversionException {
        List<Token> result = new ArrayList<>(references.size());
        for (TokenReference reference : references) {
            result.add(token(reference));
        }
        return result;
    }

    private static void pushTrivia(List<Lexeme> lexemes, Token token, boolean leading) throws ConversionException {
        for (Lexeme lexeme : lexemes) {
            Trivia trivia = trivia(lexeme);
            if (leading) {
                token.pushLeadingTrivia(trivia);
            } else {
                token.pushTrailingTrivia(trivia);
            }
        }
    }

    private static Trivia trivia(Lexeme lexeme) throws ConversionException {
        TriviaKind kind;
        switch (lexeme.type()) {
            case WHITESPACE:
                kind = TriviaKind.WHITESPACE;
                break;
            case SINGLE_LINE_COMMENT:
            case MULTI_LINE_COMMENT:
                kind = TriviaKind.COMMENT;
                break;
            default:
                throw ConversionException.unexpectedTrivia(lexeme.type().name());
        }
        return new Trivia(kind, new TokenPosition.Referenced(lexeme.start(), lexeme.end(), lexeme.line()));
    }

    private BinaryOperator binaryOperator(TokenReference operator) throws ConversionException {
        switch (operator.type()) {
            case AND: return BinaryOperator.AND;
            case OR: return BinaryOperator.OR;
            case TWO_EQUAL: return BinaryOperator.EQUAL;
            case TILDE_EQUAL: return BinaryOperator.NOT_EQUAL;
            case LESS_THAN: return BinaryOperator.LOWER_THAN;
            case LESS_EQUAL: return BinaryOperator.LOWER_OR_EQUAL_THAN;
            case GREATER_THAN: return BinaryOperator.GREATER_THAN;
            case GREATER_EQUAL: return BinaryOperator.GREATER_OR_EQUAL_THAN;
            case PLUS: return BinaryOperator.PLUS;
            case MINUS: return BinaryOperator.MINUS;
            case STAR: return BinaryOperator.ASTERISK;
            case SLASH: return BinaryOperator.SLASH;
            case DOUBLE_SLASH: return BinaryOperator.DOUBLE_SLASH;
            case PERCENT: return BinaryOperator.PERCENT;
            case CARET: return BinaryOperator.CARET;
            case TWO_DOTS: return BinaryOperator.CONCAT;
            default:
                throw new ConversionException(ConversionErrorKind.BINARY_OPERATOR, operator.text());
        }
    }

    private UnaryOperator unaryOperator(TokenReference operator) throws ConversionException {
        switch (operator.type()) {
            case MINUS: return UnaryOperator.MINUS;
            case NOT: return UnaryOperator.NOT;
            case HASH: return UnaryOperator.LENGTH;
            default:
                throw new ConversionException(ConversionErrorKind.UNARY_OPERATOR, operator.text());
        }
    }

    private CompoundOperator compoundOperator(TokenReference operator) throws ConversionException {
        switch (operator.type()) {
            case PLUS_EQUAL: return CompoundOperator.PLUS;
            case MINUS_EQUAL: return CompoundOperator.MINUS;
            case STAR_EQUAL: return CompoundOperator.ASTERISK;
            case SLASH_EQUAL: return CompoundOperator.SLASH;
            case DOUBLE_SLASH_EQUAL: return CompoundOperator.DOUBLE_SLASH;
            case PERCENT_EQUAL: return CompoundOperator.PERCENT;
            case CARET_EQUAL: return CompoundOperator.CARET;
            case TWO_DOTS_EQUAL: return CompoundOperator.CONCAT;
            default:
                throw new ConversionException(ConversionErrorKind.COMPOUND_OPERATOR, operator.text());
        }
    }

    private ConversionException error(ConversionErrorKind kind, SyntaxNode node) {
        return new ConversionException(kind, snippet(node));
    }

    private String snippet(SyntaxNode node) {
        return node.span().read(source);
    }
}
