package org.csu.sylva.compiler.ast.item;

import org.csu.sylva.compiler.ast.AstNode;
import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.Optional;

public record Path(SyntaxNode syntax) implements AstNode {

    public Path {
        AstNodes.requireKind(syntax, SyntaxKind.PATH);
    }

    public Optional<PathSegment> segment() {
        return AstNodes.child(this, PathSegment.class);
    }
}
