package org.csu.sylva.compiler.ast.item;

import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.compiler.ast.NameOwner;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.Optional;

public record Param(SyntaxNode syntax) implements NameOwner {

    public Param {
        AstNodes.requireKind(syntax, SyntaxKind.PARAM);
    }

    public Optional<PathType> typeRef() {
        return AstNodes.child(this, PathType.class);
    }
}
