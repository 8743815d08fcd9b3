package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.Optional;

public record ReturnExpr(SyntaxNode syntax) implements Expr {

    public ReturnExpr {
        AstNodes.requireKind(syntax, SyntaxKind.RETURN_EXPR);
    }

    public Optional<Expr> expr() {
        return AstNodes.child(this, Expr.class);
    }
}
