package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.compiler.ast.AstNode;
import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.Optional;

/**
 * 所有表达式产生式的公共类型。
 */
public interface Expr extends AstNode {

    static Optional<Expr> cast(SyntaxNode node) {
        return AstNodes.cast(node, Expr.class);
    }
}
