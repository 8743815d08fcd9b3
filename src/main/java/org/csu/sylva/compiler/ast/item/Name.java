package org.csu.sylva.compiler.ast.item;

import org.csu.sylva.compiler.ast.AstNode;
import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

/**
 * AST 节点: 声明处的名称（定义一个新名字）。
 */
public record Name(SyntaxNode syntax) implements AstNode {

    public Name {
        AstNodes.requireKind(syntax, SyntaxKind.NAME);
    }

    public String text() {
        return syntax.text();
    }
}
