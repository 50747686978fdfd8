package org.lunaform.compiler.process.path;

import org.lunaform.compiler.nodes.Block;
import org.lunaform.compiler.nodes.Node;
import org.lunaform.compiler.nodes.expressions.Arguments;
import org.lunaform.compiler.nodes.expressions.BinaryExpression;
import org.lunaform.compiler.nodes.expressions.ElseIfExpressionBranch;
import org.lunaform.compiler.nodes.expressions.Expression;
import org.lunaform.compiler.nodes.expressions.FieldExpression;
import org.lunaform.compiler.nodes.expressions.FunctionCall;
import org.lunaform.compiler.nodes.expressions.FunctionExpression;
import org.lunaform.compiler.nodes.expressions.IfExpression;
import org.lunaform.compiler.nodes.expressions.IndexExpression;
import org.lunaform.compiler.nodes.expressions.InterpolatedStringExpression;
import org.lunaform.compiler.nodes.expressions.InterpolationSegment;
import org.lunaform.compiler.nodes.expressions.ParentheseExpression;
import org.lunaform.compiler.nodes.expressions.Prefix;
import org.lunaform.compiler.nodes.expressions.StringExpression;
import org.lunaform.compiler.nodes.expressions.TableEntry;
import org.lunaform.compiler.nodes.expressions.TableExpression;
import org.lunaform.compiler.nodes.expressions.TableFieldEntry;
import org.lunaform.compiler.nodes.expressions.TableIndexEntry;
import org.lunaform.compiler.nodes.expressions.TableValueEntry;
import org.lunaform.compiler.nodes.expressions.TupleArguments;
import org.lunaform.compiler.nodes.expressions.TypeCastExpression;
import org.lunaform.compiler.nodes.expressions.UnaryExpression;
import org.lunaform.compiler.nodes.expressions.ValueSegment;
import org.lunaform.compiler.nodes.statements.AssignStatement;
import org.lunaform.compiler.nodes.statements.CompoundAssignStatement;
import org.lunaform.compiler.nodes.statements.DoStatement;
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
import org.lunaform.compiler.nodes.statements.WhileStatement;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Resolves {@link NodePath}s against a tree and applies edits through them.
 * <p>
 * What a component designates depends on the node reached before it: {@code Expression(1)} is the
 * right operand of a binary expression but the second argument of a call. A component that does
 * not apply to the node actually present makes the whole resolution return empty.
 */
public final class NodePathResolver {

    private NodePathResolver() {
    }

    /**
     * @param root The root block.
     * @param path The path to follow.
     * @return the node at the end of the path, the root itself for the root path.
     */
    public static Optional<Node> resolve(Block root, NodePath path) {
        Node current = root;
        for (NodePath.Component component : path.components()) {
            Optional<Node> next = step(current, component);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    public static Optional<Statement> resolveStatement(Block root, NodePath path) {
        return resolve(root, path).filter(Statement.class::isInstance).map(Statement.class::cast);
    }

    /**
     * Resolves a statement component equal to the statement count of its block, which designates
     * the block's last statement ({@code return}, {@code break} or {@code continue}).
     */
    public static Optional<LastStatement> resolveLastStatement(Block root, NodePath path) {
        return resolve(root, path).filter(LastStatement.class::isInstance).map(LastStatement.class::cast);
    }

    public static Optional<Expression> resolveExpression(Block root, NodePath path) {
        return resolve(root, path).filter(Expression.class::isInstance).map(Expression.class::cast);
    }

    public static Optional<Block> resolveBlock(Block root, NodePath path) {
        return resolve(root, path).filter(Block.class::isInstance).map(Block.class::cast);
    }

    /**
     * Replaces the statement a path ends on. The path must end with a statement component
     * designating one of the regular statements of a block.
     * @return whether the path resolved.
     */
    public static boolean replaceStatement(Block root, NodePath path, Statement statement) {
        Optional<IndexedBlock> target = statementTarget(root, path);
        if (target.isEmpty() || target.get().index() >= target.get().block().statementsCount()) {
            return false;
        }
        target.get().block().replaceStatement(target.get().index(), statement);
        return true;
    }

    /**
     * Removes the statement a path ends on. An index equal to the statement count removes the
     * last statement. Semicolon tokens are kept in sync by the block.
     * @return whether the path resolved.
     */
    public static boolean removeStatement(Block root, NodePath path) {
        Optional<IndexedBlock> target = statementTarget(root, path);
        if (target.isEmpty()) {
            return false;
        }
        Block block = target.get().block();
        int index = target.get().index();
        if (index < block.statementsCount()) {
            block.removeStatement(index);
            return true;
        }
        return index == block.statementsCount() && block.takeLastStatement().isPresent();
    }

    /**
     * Inserts a statement at the position a path ends on, shifting the following statements.
     * @return whether the path resolved to a position inside a block.
     */
    public static boolean insertStatement(Block root, NodePath path, Statement statement) {
        Optional<IndexedBlock> target = statementTarget(root, path);
        if (target.isEmpty() || target.get().index() > target.get().block().statementsCount()) {
            return false;
        }
        target.get().block().insertStatement(target.get().index(), statement);
        return true;
    }

    /**
     * Replaces the expression a path ends on. A slot that only accepts a prefix receives the
     * expression wrapped in parentheses when it is not a prefix itself.
     * @return whether the path resolved.
     */
    public static boolean replaceExpression(Block root, NodePath path, Expression expression) {
        Optional<NodePath.Component> last = path.last();
        if (last.isEmpty() || last.get().kind() != NodePath.ComponentKind.EXPRESSION) {
            return false;
        }
        Optional<Node> parent = resolve(root, path.parent().orElseThrow());
        if (parent.isEmpty()) {
            return false;
        }
        Optional<ExpressionSlot> slot = expressionSlot(parent.get(), last.get().index());
        if (slot.isEmpty()) {
            return false;
        }
        slot.get().replace(expression);
        return true;
    }

    private static Optional<IndexedBlock> statementTarget(Block root, NodePath path) {
        Optional<NodePath.Component> last = path.last();
        if (last.isEmpty() || last.get().kind() != NodePath.ComponentKind.STATEMENT) {
            return Optional.empty();
        }
        return resolve(root, path.parent().orElseThrow())
                .flatMap(NodePathResolver::statementsBlock)
                .map(block -> new IndexedBlock(block, last.get().index()));
    }

    private static Optional<Node> step(Node current, NodePath.Component component) {
        int index = component.index();
        switch (component.kind()) {
            case STATEMENT:
                return statementsBlock(current).flatMap(block -> statementAt(block, index));
            case BLOCK:
                return blockAt(current, index);
            case EXPRESSION:
                return expressionSlot(current, index).map(ExpressionSlot::get);
            default:
                return Optional.empty();
        }
    }

    private static Optional<Node> statementAt(Block block, int index) {
        if (index < block.statementsCount()) {
            return Optional.of(block.getStatement(index));
        }
        if (index == block.statementsCount()) {
            return block.getLastStatement().map(Node.class::cast);
        }
        return Optional.empty();
    }

    /** The block whose statements a statement component indexes, when the node has exactly one. */
    private static Optional<Block> statementsBlock(Node node) {
        if (node instanceof Block) {
            return Optional.of((Block) node);
        }
        return singleBlock(node);
    }

    private static Optional<Block> singleBlock(Node node) {
        if (node instanceof DoStatement) {
            return Optional.of(((DoStatement) node).getBlock());
        } else if (node instanceof WhileStatement) {
            return Optional.of(((WhileStatement) node).getBlock());
        } else if (node instanceof RepeatStatement) {
            return Optional.of(((RepeatStatement) node).getBlock());
        } else if (node instanceof NumericForStatement) {
            return Optional.of(((NumericForStatement) node).getBlock());
        } else if (node instanceof GenericForStatement) {
            return Optional.of(((GenericForStatement) node).getBlock());
        } else if (node instanceof FunctionStatement) {
            return Optional.of(((FunctionStatement) node).getBody().getBlock());
        } else if (node instanceof LocalFunctionStatement) {
            return Optional.of(((LocalFunctionStatement) node).getBody().getBlock());
        } else if (node instanceof FunctionExpression) {
            return Optional.of(((FunctionExpression) node).getBody().getBlock());
        }
        return Optional.empty();
    }

    private static Optional<Node> blockAt(Node node, int index) {
        if (node instanceof IfStatement) {
            IfStatement ifStatement = (IfStatement) node;
            int branches = ifStatement.getBranches().size();
            if (index < branches) {
                return Optional.of(ifStatement.getBranches().get(index).getBlock());
            }
            return index == branches ? ifStatement.getElseBlock().map(Node.class::cast) : Optional.empty();
        }
        return index == 0 ? singleBlock(node).map(Node.class::cast) : Optional.empty();
    }

    private static Optional<ExpressionSlot> expressionSlot(Node node, int index) {
        if (node instanceof AssignStatement) {
            return listSlot(((AssignStatement) node).getValues(), index, ((AssignStatement) node)::replaceValue);
        } else if (node instanceof LocalAssignStatement) {
            LocalAssignStatement local = (LocalAssignStatement) node;
            return listSlot(local.getValues(), index, local::replaceValue);
        } else if (node instanceof GenericForStatement) {
            GenericForStatement genericFor = (GenericForStatement) node;
            return listSlot(genericFor.getExpressions(), index, genericFor::replaceExpression);
        } else if (node instanceof ReturnStatement) {
            ReturnStatement returnStatement = (ReturnStatement) node;
            return listSlot(returnStatement.getExpressions(), index, returnStatement::replaceExpression);
        } else if (node instanceof CompoundAssignStatement) {
            CompoundAssignStatement compound = (CompoundAssignStatement) node;
            return single(index, compound::getValue, compound::setValue);
        } else if (node instanceof NumericForStatement) {
            return numericForSlot((NumericForStatement) node, index);
        } else if (node instanceof WhileStatement) {
            WhileStatement whileStatement = (WhileStatement) node;
            return single(index, whileStatement::getCondition, whileStatement::setCondition);
        } else if (node instanceof RepeatStatement) {
            RepeatStatement repeat = (RepeatStatement) node;
            return single(index, repeat::getCondition, repeat::setCondition);
        } else if (node instanceof IfStatement) {
            List<IfBranch> branches = ((IfStatement) node).getBranches();
            if (index >= branches.size()) {
                return Optional.empty();
            }
            IfBranch branch = branches.get(index);
            return Optional.of(new ExpressionSlot(branch::getCondition, branch::setCondition, false));
        } else if (node instanceof FunctionCall) {
            return argumentSlot((FunctionCall) node, index);
        } else if (node instanceof BinaryExpression) {
            BinaryExpression binary = (BinaryExpression) node;
            if (index == 0) {
                return Optional.of(new ExpressionSlot(binary::getLeft, binary::setLeft, false));
            }
            return index == 1 ? Optional.of(new ExpressionSlot(binary::getRight, binary::setRight, false)) : Optional.empty();
        } else if (node instanceof UnaryExpression) {
            UnaryExpression unary = (UnaryExpression) node;
            return single(index, unary::getExpression, unary::setExpression);
        } else if (node instanceof ParentheseExpression) {
            ParentheseExpression parenthese = (ParentheseExpression) node;
            return single(index, parenthese::getInnerExpression, parenthese::setInnerExpression);
        } else if (node instanceof TypeCastExpression) {
            TypeCastExpression cast = (TypeCastExpression) node;
            return single(index, cast::getExpression, cast::setExpression);
        } else if (node instanceof FieldExpression) {
            FieldExpression field = (FieldExpression) node;
            return index == 0 ? Optional.of(prefixSlot(field::getPrefix, field::setPrefix)) : Optional.empty();
        } else if (node instanceof IndexExpression) {
            IndexExpression indexExpression = (IndexExpression) node;
            if (index == 0) {
                return Optional.of(prefixSlot(indexExpression::getPrefix, indexExpression::setPrefix));
            }
            return index == 1
                    ? Optional.of(new ExpressionSlot(indexExpression::getIndex, indexExpression::setIndex, false))
                    : Optional.empty();
        } else if (node instanceof IfExpression) {
            return ifExpressionSlot((IfExpression) node, index);
        } else if (node instanceof TableExpression) {
            List<TableEntry> entries = ((TableExpression) node).getEntries();
            return index < entries.size() ? tableEntrySlot(entries.get(index)) : Optional.empty();
        } else if (node instanceof InterpolatedStringExpression) {
            return interpolationSlot((InterpolatedStringExpression) node, index);
        }
        return Optional.empty();
    }

    private static Optional<ExpressionSlot> listSlot(List<Expression> values, int index,
                                                     ReplaceAt replace) {
        if (index >= values.size()) {
            return Optional.empty();
        }
        return Optional.of(new ExpressionSlot(() -> values.get(index), value -> replace.apply(index, value), false));
    }

    private static Optional<ExpressionSlot> single(int index, Supplier<Expression> getter, Consumer<Expression> setter) {
        return index == 0 ? Optional.of(new ExpressionSlot(getter, setter, false)) : Optional.empty();
    }

    private static ExpressionSlot prefixSlot(Supplier<Prefix> getter, Consumer<Prefix> setter) {
        return new ExpressionSlot(getter::get, value -> setter.accept((Prefix) value), true);
    }

    private static Optional<ExpressionSlot> numericForSlot(NumericForStatement numericFor, int index) {
        switch (index) {
            case 0:
                return Optional.of(new ExpressionSlot(numericFor::getStart, numericFor::setStart, false));
            case 1:
                return Optional.of(new ExpressionSlot(numericFor::getEnd, numericFor::setEnd, false));
            case 2:
                return numericFor.getStep()
                        .map(step -> new ExpressionSlot(() -> numericFor.getStep().orElseThrow(), numericFor::setStep, false));
            default:
                return Optional.empty();
        }
    }

    private static Optional<ExpressionSlot> argumentSlot(FunctionCall call, int index) {
        Arguments arguments = call.getArguments();
        if (arguments instanceof TupleArguments) {
            TupleArguments tuple = (TupleArguments) arguments;
            return listSlot(tuple.getValues(), index, tuple::replaceValue);
        }
        if (index != 0) {
            return Optional.empty();
        }
        // string and table arguments count as one argument
        return Optional.of(new ExpressionSlot(() -> (Expression) call.getArguments(), value -> {
            if (value instanceof StringExpression || value instanceof TableExpression) {
                call.setArguments((Arguments) value);
            } else {
                call.setArguments(new TupleArguments(List.of(value)));
            }
        }, false));
    }

    private static Optional<ExpressionSlot> ifExpressionSlot(IfExpression ifExpression, int index) {
        switch (index) {
            case 0:
                return Optional.of(new ExpressionSlot(ifExpression::getCondition, ifExpression::setCondition, false));
            case 1:
                return Optional.of(new ExpressionSlot(ifExpression::getResult, ifExpression::setResult, false));
            case 2:
                return Optional.of(new ExpressionSlot(ifExpression::getElseResult, ifExpression::setElseResult, false));
            default:
                int branchIndex = (index - 3) / 2;
                List<ElseIfExpressionBranch> branches = ifExpression.getBranches();
                if (branchIndex >= branches.size()) {
                    return Optional.empty();
                }
                ElseIfExpressionBranch branch = branches.get(branchIndex);
                return (index - 3) % 2 == 0
                        ? Optional.of(new ExpressionSlot(branch::getCondition, branch::setCondition, false))
                        : Optional.of(new ExpressionSlot(branch::getResult, branch::setResult, false));
        }
    }

    private static Optional<ExpressionSlot> tableEntrySlot(TableEntry entry) {
        if (entry instanceof TableValueEntry) {
            TableValueEntry value = (TableValueEntry) entry;
            return Optional.of(new ExpressionSlot(value::getValue, value::setValue, false));
        } else if (entry instanceof TableFieldEntry) {
            TableFieldEntry field = (TableFieldEntry) entry;
            return Optional.of(new ExpressionSlot(field::getValue, field::setValue, false));
        } else if (entry instanceof TableIndexEntry) {
            TableIndexEntry index = (TableIndexEntry) entry;
            return Optional.of(new ExpressionSlot(index::getValue, index::setValue, false));
        }
        return Optional.empty();
    }

    private static Optional<ExpressionSlot> interpolationSlot(InterpolatedStringExpression string, int index) {
        int valueIndex = 0;
        for (InterpolationSegment segment : string.getSegments()) {
            if (segment instanceof ValueSegment) {
                if (valueIndex == index) {
                    ValueSegment value = (ValueSegment) segment;
                    return Optional.of(new ExpressionSlot(value::getValue, value::setValue, false));
                }
                valueIndex++;
            }
        }
        return Optional.empty();
    }

    @FunctionalInterface
    private interface ReplaceAt {
        Expression apply(int index, Expression value);
    }

    private record IndexedBlock(Block block, int index) {
    }

    /**
     * A place holding one expression.
     * @param prefixOnly Whether only a {@link Prefix} may be stored there.
     */
    private record ExpressionSlot(Supplier<? extends Expression> getter, Consumer<Expression> setter, boolean prefixOnly) {

        Node get() {
            return getter.get();
        }

        void replace(Expression expression) {
            if (prefixOnly && !(expression instanceof Prefix)) {
                setter.accept(new ParentheseExpression(expression));
            } else {
                setter.accept(expression);
            }
        }
    }
}
