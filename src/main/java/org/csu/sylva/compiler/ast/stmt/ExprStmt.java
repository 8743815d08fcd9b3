package org.csu.sylva.compiler.ast.stmt;

import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.compiler.ast.expression.Expr;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.Optional;

public record ExprStmt(SyntaxNode syntax) implements Stmt {

    public ExprStmt {
        AstNodes.requireKind(syntax, SyntaxKind.EXPR_STMT);
    }

    public Optional<Expr> expr() {
        return AstNodes.child(this, Expr.class);
    }
}
