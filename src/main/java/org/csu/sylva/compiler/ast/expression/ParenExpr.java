package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.Optional;

public record ParenExpr(SyntaxNode syntax) implements Expr {

    public ParenExpr {
        AstNodes.requireKind(syntax, SyntaxKind.PAREN_EXPR);
    }

    public Optional<Expr> expr() {
        return AstNodes.child(this, Expr.class);
    }
}
