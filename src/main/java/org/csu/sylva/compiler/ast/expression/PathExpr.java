package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.compiler.ast.item.Path;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.Optional;

/**
 * AST 节点: 对变量或函数的引用 (e.g., x)
 */
public record PathExpr(SyntaxNode syntax) implements Expr {

    public PathExpr {
        AstNodes.requireKind(syntax, SyntaxKind.PATH_EXPR);
    }

    public Optional<Path> path() {
        return AstNodes.child(this, Path.class);
    }
}
