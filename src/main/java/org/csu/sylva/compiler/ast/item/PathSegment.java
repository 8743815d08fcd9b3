package org.csu.sylva.compiler.ast.item;

import org.csu.sylva.compiler.ast.AstNode;
import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.Optional;

public record PathSegment(SyntaxNode syntax) implements AstNode {

    public PathSegment {
        AstNodes.requireKind(syntax, SyntaxKind.PATH_SEGMENT);
    }

    public Optional<NameRef> nameRef() {
        return AstNodes.child(this, NameRef.class);
    }
}
