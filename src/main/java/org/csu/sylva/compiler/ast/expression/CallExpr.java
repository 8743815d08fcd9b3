package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.Optional;

/**
 * AST 节点: 函数调用 (e.g., foo(1, 2))
 */
public record CallExpr(SyntaxNode syntax) implements Expr {

    public CallExpr {
        AstNodes.requireKind(syntax, SyntaxKind.CALL_EXPR);
    }

    /**
     * 被调用的表达式。
     */
    public Optional<Expr> expr() {
        return AstNodes.child(this, Expr.class);
    }

    public Optional<ArgList> argList() {
        return AstNodes.child(this, ArgList.class);
    }
}
