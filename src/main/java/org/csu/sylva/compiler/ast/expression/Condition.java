package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.compiler.ast.AstNode;
import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.Optional;

/**
 * AST 节点: if 后面的条件，单独成节点，避免与分支代码块混淆。
 */
public record Condition(SyntaxNode syntax) implements AstNode {

    public Condition {
        AstNodes.requireKind(syntax, SyntaxKind.CONDITION);
    }

    public Optional<Expr> expr() {
        return AstNodes.child(this, Expr.class);
    }
}
