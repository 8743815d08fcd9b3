package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.compiler.ast.stmt.Stmt;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * AST 节点: 代码块 { stmt* tail? }
 */
public record BlockExpr(SyntaxNode syntax) implements Expr {

    public BlockExpr {
        AstNodes.requireKind(syntax, SyntaxKind.BLOCK_EXPR);
    }

    public List<Stmt> statements() {
        return AstNodes.children(this, Stmt.class);
    }

    /**
     * 块末尾没有分号的表达式，即代码块的值。
     */
    public Optional<Expr> tailExpr() {
        return AstNodes.child(this, Expr.class);
    }
}
