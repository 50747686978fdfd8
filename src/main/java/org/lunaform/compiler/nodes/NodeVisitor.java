package org.lunaform.compiler.nodes;

import org.lunaform.compiler.nodes.expressions.BinaryExpression;
import org.lunaform.compiler.nodes.expressions.BinaryNumber;
import org.lunaform.compiler.nodes.expressions.DecimalNumber;
import org.lunaform.compiler.nodes.expressions.ElseIfExpressionBranch;
import org.lunaform.compiler.nodes.expressions.FalseExpression;
import org.lunaform.compiler.nodes.expressions.FieldExpression;
import org.lunaform.compiler.nodes.expressions.FunctionCall;
import org.lunaform.compiler.nodes.expressions.FunctionExpression;
import org.lunaform.compiler.nodes.expressions.HexNumber;
import org.lunaform.compiler.nodes.expressions.Identifier;
import org.lunaform.compiler.nodes.expressions.IfExpression;
import org.lunaform.compiler.nodes.expressions.IndexExpression;
import org.lunaform.compiler.nodes.expressions.InterpolatedStringExpression;
import org.lunaform.compiler.nodes.expressions.NilExpression;
import org.lunaform.compiler.nodes.expressions.ParentheseExpression;
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
import org.lunaform.compiler.nodes.types.TypeField;
import org.lunaform.compiler.nodes.types.TypeName;
import org.lunaform.compiler.nodes.types.TypePack;
import org.lunaform.compiler.nodes.types.TypeParameters;
import org.lunaform.compiler.nodes.types.TypeVariableWithDefault;
import org.lunaform.compiler.nodes.types.UnionType;
import org.lunaform.compiler.nodes.types.VariadicTypePack;

/**
 * Visits every concrete node type. Adding a node type adds a method here, so every visitor
 * has to decide what to do with it.
 *
 * @param <R> The result type, {@link Void} for visitors run for their side effects.
 */
public interface NodeVisitor<R> {

    // Shared nodes
    R visitBlock(Block node);
    R visitFunctionBody(FunctionBody node);
    R visitTypedIdentifier(TypedIdentifier node);

    // Statements
    R visitAssignStatement(AssignStatement node);
    R visitBreakStatement(BreakStatement node);
    R visitCompoundAssignStatement(CompoundAssignStatement node);
    R visitContinueStatement(ContinueStatement node);
    R visitDoStatement(DoStatement node);
    R visitFunctionName(FunctionName node);
    R visitFunctionStatement(FunctionStatement node);
    R visitGenericForStatement(GenericForStatement node);
    R visitIfBranch(IfBranch node);
    R visitIfStatement(IfStatement node);
    R visitLocalAssignStatement(LocalAssignStatement node);
    R visitLocalFunctionStatement(LocalFunctionStatement node);
    R visitNumericForStatement(NumericForStatement node);
    R visitRepeatStatement(RepeatStatement node);
    R visitReturnStatement(ReturnStatement node);
    R visitTypeDeclarationStatement(TypeDeclarationStatement node);
    R visitWhileStatement(WhileStatement node);

    // Expressions
    R visitBinaryExpression(BinaryExpression node);
    R visitBinaryNumber(BinaryNumber node);
    R visitDecimalNumber(DecimalNumber node);
    R visitElseIfExpressionBranch(ElseIfExpressionBranch node);
    R visitFalseExpression(FalseExpression node);
    R visitFieldExpression(FieldExpression node);
    R visitFunctionCall(FunctionCall node);
    R visitFunctionExpression(FunctionExpression node);
    R visitHexNumber(HexNumber node);
    R visitIdentifier(Identifier node);
    R visitIfExpression(IfExpression node);
    R visitIndexExpression(IndexExpression node);
    R visitInterpolatedStringExpression(InterpolatedStringExpression node);
    R visitNilExpression(NilExpression node);
    R visitParentheseExpression(ParentheseExpression node);
    R visitStringExpression(StringExpression node);
    R visitStringSegment(StringSegment node);
    R visitTableExpression(TableExpression node);
    R visitTableFieldEntry(TableFieldEntry node);
    R visitTableIndexEntry(TableIndexEntry node);
    R visitTableValueEntry(TableValueEntry node);
    R visitTrueExpression(TrueExpression node);
    R visitTupleArguments(TupleArguments node);
    R visitTypeCastExpression(TypeCastExpression node);
    R visitUnaryExpression(UnaryExpression node);
    R visitValueSegment(ValueSegment node);
    R visitVariableArgumentsExpression(VariableArgumentsExpression node);

    // Types
    R visitArrayType(ArrayType node);
    R visitExpressionType(ExpressionType node);
    R visitFalseType(FalseType node);
    R visitFunctionArgumentType(FunctionArgumentType node);
    R visitFunctionType(FunctionType node);
    R visitGenericParameters(GenericParameters node);
    R visitGenericTypePack(GenericTypePack node);
    R visitGenericTypePackWithDefault(GenericTypePackWithDefault node);
    R visitIntersectionType(IntersectionType node);
    R visitNilType(NilType node);
    R visitOptionalType(OptionalType node);
    R visitParentheseType(ParentheseType node);
    R visitStringType(StringType node);
    R visitTableIndexerType(TableIndexerType node);
    R visitTablePropertyType(TablePropertyType node);
    R visitTableType(TableType node);
    R visitTrueType(TrueType node);
    R visitTypeField(TypeField node);
    R visitTypeName(TypeName node);
    R visitTypePack(TypePack node);
    R visitTypeParameters(TypeParameters node);
    R visitTypeVariableWithDefault(TypeVariableWithDefault node);
    R visitUnionType(UnionType node);
    R visitVariadicTypePack(VariadicTypePack node);
}
