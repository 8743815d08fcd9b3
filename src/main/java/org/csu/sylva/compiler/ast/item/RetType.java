package org.csu.sylva.compiler.ast.item;

import org.csu.sylva.compiler.ast.AstNode;
import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.Optional;

public record RetType(SyntaxNode syntax) implements AstNode {

    public RetType {
        AstNodes.requireKind(syntax, SyntaxKind.RET_TYPE);
    }

    public Optional<PathType> typeRef() {
        return AstNodes.child(this, PathType.class);
    }
}
