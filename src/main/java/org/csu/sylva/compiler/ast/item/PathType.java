package org.csu.sylva.compiler.ast.item;

import org.csu.sylva.compiler.ast.AstNode;
import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.Optional;

/**
 * AST 节点: 以路径表示的类型引用 (e.g., int, Point)
 */
public record PathType(SyntaxNode syntax) implements AstNode {

    public PathType {
        AstNodes.requireKind(syntax, SyntaxKind.PATH_TYPE);
    }

    public Optional<Path> path() {
        return AstNodes.child(this, Path.class);
    }
}
