package org.csu.sylva.compiler.ast.item;

import org.csu.sylva.compiler.ast.AstNode;
import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;
import org.csu.sylva.syntax.SyntaxToken;

import java.util.Optional;

/**
 * AST 节点: 使用处的名称（引用一个已有的名字），字段访问中的字段名也是 NameRef。
 */
public record NameRef(SyntaxNode syntax) implements AstNode {

    public NameRef {
        AstNodes.requireKind(syntax, SyntaxKind.NAME_REF);
    }

    public Optional<SyntaxToken> identToken() {
        return AstNodes.token(this, SyntaxKind.IDENT);
    }

    public String text() {
        return syntax.text();
    }
}
