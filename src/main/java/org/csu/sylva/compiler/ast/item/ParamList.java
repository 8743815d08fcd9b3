package org.csu.sylva.compiler.ast.item;

import org.csu.sylva.compiler.ast.AstNode;
import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.List;

public record ParamList(SyntaxNode syntax) implements AstNode {

    public ParamList {
        AstNodes.requireKind(syntax, SyntaxKind.PARAM_LIST);
    }

    public List<Param> params() {
        return AstNodes.children(this, Param.class);
    }
}
