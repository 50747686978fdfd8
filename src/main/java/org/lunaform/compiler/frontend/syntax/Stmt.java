package org.lunaform.compiler.frontend.syntax;

import java.util.List;
import java.util.Optional;

/**
 * A statement of the parse tree. Function calls used as statements are represented by
 * {@link FunctionCallSyntax}, which implements this interface directly.
 */
public interface Stmt extends SyntaxNode {

    record Assignment(Span span, Punctuated<Var> variables, TokenReference equal,
                      Punctuated<Expr> values) implements Stmt {
    }

    record CompoundAssignment(Span span, Var variable, TokenReference operator,
                              Expr value) implements Stmt {
    }

    record Do(Span span, TokenReference doToken, SyntaxBlock block, TokenReference end) implements Stmt {
    }

    record NumericFor(Span span, TokenReference forToken, TokenReference name,
                      Optional<TypeSpecifier> type, TokenReference equal, Expr start,
                      TokenReference endComma, Expr end, Optional<TokenReference> stepComma,
                      Optional<Expr> step, TokenReference doToken, SyntaxBlock block,
                      TokenReference endToken) implements Stmt {
    }

    /**
     * @param types The optional type annotation of each name, aligned with {@code names}.
     */
    record GenericFor(Span span, TokenReference forToken, Punctuated<TokenReference> names,
                      List<Optional<TypeSpecifier>> types, TokenReference in,
                      Punctuated<Expr> expressions, TokenReference doToken, SyntaxBlock block,
                      TokenReference end) implements Stmt {
    }

    record FunctionDeclaration(Span span, TokenReference function, FunctionNameSyntax name,
                               FunctionBodySyntax body) implements Stmt {
    }

    record LocalFunction(Span span, TokenReference local, TokenReference function,
                         TokenReference name, FunctionBodySyntax body) implements Stmt {
    }

    /**
     * @param types The optional type annotation of each name, aligned with {@code names}.
     */
    record LocalAssignment(Span span, TokenReference local, Punctuated<TokenReference> names,
                           List<Optional<TypeSpecifier>> types, Optional<TokenReference> equal,
                           Punctuated<Expr> values) implements Stmt {
    }

    record If(Span span, TokenReference ifToken, Expr condition, TokenReference then,
              SyntaxBlock block, List<ElseIf> elseIfs, Optional<TokenReference> elseToken,
              Optional<SyntaxBlock> elseBlock, TokenReference end) implements Stmt {
    }

    record ElseIf(TokenReference elseIf, Expr condition, TokenReference then, SyntaxBlock block) {
    }

    record Repeat(Span span, TokenReference repeat, SyntaxBlock block, TokenReference until,
                  Expr condition) implements Stmt {
    }

    record While(Span span, TokenReference whileToken, Expr condition, TokenReference doToken,
                 SyntaxBlock block, TokenReference end) implements Stmt {
    }

    record TypeDeclaration(Span span, Optional<TokenReference> export, TokenReference type,
                           TokenReference name, Optional<GenericDeclaration> generics,
                           TokenReference equal, TypeInfo declaredType) implements Stmt {
    }

    /** {@code goto name}. Parsed, but the node model has no counterpart for it. */
    record Goto(Span span, TokenReference gotoToken, TokenReference label) implements Stmt {
    }

    /** {@code ::name::}. Parsed, but the node model has no counterpart for it. */
    record Label(Span span, TokenReference leftColons, TokenReference name,
                 TokenReference rightColons) implements Stmt {
    }
}
