package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.compiler.ast.AstNode;
import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.List;

public record ArgList(SyntaxNode syntax) implements AstNode {

    public ArgList {
        AstNodes.requireKind(syntax, SyntaxKind.ARG_LIST);
    }

    public List<Expr> args() {
        return AstNodes.children(this, Expr.class);
    }
}
