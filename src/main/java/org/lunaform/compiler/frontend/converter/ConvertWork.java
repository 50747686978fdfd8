package org.lunaform.compiler.frontend.converter;

import org.lunaform.compiler.api.ConversionException;
import org.lunaform.compiler.frontend.syntax.Args;
import org.lunaform.compiler.frontend.syntax.Expr;
import org.lunaform.compiler.frontend.syntax.FunctionBodySyntax;
import org.lunaform.compiler.frontend.syntax.GenericDeclaration;
import org.lunaform.compiler.frontend.syntax.LastStmt;
import org.lunaform.compiler.frontend.syntax.PrefixSyntax;
import org.lunaform.compiler.frontend.syntax.Stmt;
import org.lunaform.compiler.frontend.syntax.Suffix;
import org.lunaform.compiler.frontend.syntax.SyntaxBlock;
import org.lunaform.compiler.frontend.syntax.SyntaxNode;
import org.lunaform.compiler.frontend.syntax.TableConstructor;
import org.lunaform.compiler.frontend.syntax.TokenReference;
import org.lunaform.compiler.frontend.syntax.TypeInfo;
import org.lunaform.compiler.frontend.syntax.Var;
import org.lunaform.compiler.nodes.expressions.BinaryOperator;
import org.lunaform.compiler.nodes.expressions.UnaryOperator;
import org.lunaform.compiler.nodes.statements.CompoundOperator;

import java.util.List;
import java.util.Optional;

/**
 * One unit of work on the converter's explicit work stack.
 * <p>
 * Convert items look at a parse tree node and schedule more work. Make items pop the converted
 * children from the value stacks and push the assembled node. A Make item is always pushed before
 * the Convert items of its children, so it runs after all of them.
 */
sealed interface ConvertWork {

    void run(AstConverter converter) throws ConversionException;

    /** Where a folded prefix with suffixes is delivered. */
    enum SuffixTarget {
        EXPRESSION, PREFIX, VARIABLE, STATEMENT
    }

    // Convert items

    record ConvertBlock(SyntaxBlock block, Optional<TokenReference> finalToken) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.convertBlock(block, finalToken);
        }
    }

    record ConvertStatement(Stmt statement) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.convertStatement(statement);
        }
    }

    record ConvertLastStatement(LastStmt statement) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.convertLastStatement(statement);
        }
    }

    record ConvertExpression(Expr expression) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.convertExpression(expression);
        }
    }

    record ConvertPrefix(PrefixSyntax prefix) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.convertPrefix(prefix);
        }
    }

    record ConvertVariable(Var variable) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.convertVariable(variable);
        }
    }

    record ConvertArguments(Args arguments) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.convertArguments(arguments);
        }
    }

    record ConvertFunctionBody(FunctionBodySyntax body, TokenReference function) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.convertFunctionBody(body, function);
        }
    }

    record ConvertType(TypeInfo type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.convertType(type);
        }
    }

    record ConvertReturnType(TypeInfo type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.convertReturnType(type);
        }
    }

    record ConvertTypeParameter(TypeInfo type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.convertTypeParameter(type);
        }
    }

    record ConvertVariadicArgumentType(TypeInfo type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.convertVariadicArgumentType(type);
        }
    }

    record ConvertFunctionVariadicType(TypeInfo type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.convertFunctionVariadicType(type);
        }
    }

    record ConvertPackDefault(TypeInfo type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.convertPackDefault(type);
        }
    }

    record ConvertGenericParameters(GenericDeclaration declaration, boolean allowDefaults) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.convertGenericParameters(declaration, allowDefaults);
        }
    }

    /** Moves the top value of one stack to a stack of a wider category. */
    record Move<T>(ValueStack<? extends T> from, ValueStack<T> to) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            to.push(from.pop());
        }
    }

    // Make items: statements

    record MakeBlock(SyntaxBlock block, Optional<TokenReference> finalToken) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeBlock(block, finalToken);
        }
    }

    record MakeAssign(Stmt.Assignment statement) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeAssign(statement);
        }
    }

    record MakeCompoundAssign(Stmt.CompoundAssignment statement, CompoundOperator operator) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeCompoundAssign(statement, operator);
        }
    }

    record MakeDo(Stmt.Do statement) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeDo(statement);
        }
    }

    record MakeNumericFor(Stmt.NumericFor statement) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeNumericFor(statement);
        }
    }

    record MakeGenericFor(Stmt.GenericFor statement) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeGenericFor(statement);
        }
    }

    record MakeFunctionStatement(Stmt.FunctionDeclaration statement) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeFunctionStatement(statement);
        }
    }

    record MakeLocalFunction(Stmt.LocalFunction statement) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeLocalFunction(statement);
        }
    }

    record MakeLocalAssign(Stmt.LocalAssignment statement) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeLocalAssign(statement);
        }
    }

    record MakeIf(Stmt.If statement) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeIf(statement);
        }
    }

    record MakeRepeat(Stmt.Repeat statement) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeRepeat(statement);
        }
    }

    record MakeWhile(Stmt.While statement) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeWhile(statement);
        }
    }

    record MakeTypeDeclaration(Stmt.TypeDeclaration statement) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeTypeDeclaration(statement);
        }
    }

    record MakeReturn(LastStmt.Return statement) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeReturn(statement);
        }
    }

    // Make items: expressions

    record MakeBinary(Expr.Binary expression, BinaryOperator operator) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeBinary(expression, operator);
        }
    }

    record MakeUnary(Expr.Unary expression, UnaryOperator operator) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeUnary(expression, operator);
        }
    }

    record MakeParenthese(Expr.Parentheses expression, boolean asPrefix) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeParenthese(expression, asPrefix);
        }
    }

    record MakeFunctionExpression(Expr.Function expression) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeFunctionExpression(expression);
        }
    }

    record MakeIfExpression(Expr.IfExpression expression) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeIfExpression(expression);
        }
    }

    record MakeInterpolatedString(Expr.InterpolatedString expression) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeInterpolatedString(expression);
        }
    }

    record MakeTypeCast(Expr.TypeAssertion expression) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeTypeCast(expression);
        }
    }

    record MakeTable(TableConstructor table, boolean asArguments) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeTable(table, asArguments);
        }
    }

    record MakePrefixWithSuffixes(SyntaxNode node, List<Suffix> suffixes, SuffixTarget target) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makePrefixWithSuffixes(node, suffixes, target);
        }
    }

    record MakeTupleArguments(Args.Parenthesized arguments) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeTupleArguments(arguments);
        }
    }

    record MakeFunctionBody(FunctionBodySyntax body, TokenReference function) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeFunctionBody(body, function);
        }
    }

    // Make items: types

    record MakeArrayType(TypeInfo.Array type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeArrayType(type);
        }
    }

    record MakeTableType(TypeInfo.Table type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeTableType(type);
        }
    }

    record MakeFunctionType(TypeInfo.Callback type, boolean variadicTail) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeFunctionType(type, variadicTail);
        }
    }

    record MakeTypeName(TypeInfo.Generic type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeTypeName(type);
        }
    }

    record MakeTypeField(TypeInfo.Module type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeTypeField(type);
        }
    }

    record MakeOptionalType(TypeInfo.OptionalType type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeOptionalType(type);
        }
    }

    record MakeUnionType(TypeInfo.Union type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeUnionType(type);
        }
    }

    record MakeIntersectionType(TypeInfo.Intersection type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeIntersectionType(type);
        }
    }

    record MakeParentheseType(TypeInfo.Tuple type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeParentheseType(type);
        }
    }

    record MakeExpressionType(TypeInfo.Typeof type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeExpressionType(type);
        }
    }

    record MakeTypePack(TypeInfo.Tuple type, boolean variadicTail) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeTypePack(type, variadicTail);
        }
    }

    record MakeVariadicTypePack(TypeInfo.Variadic type) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeVariadicTypePack(type);
        }
    }

    record MakeGenericParameters(GenericDeclaration declaration) implements ConvertWork {
        @Override
        public void run(AstConverter converter) throws ConversionException {
            converter.makeGenericParameters(declaration);
        }
    }
}
