package org.csu.sylva.compiler.parser;

import org.csu.sylva.syntax.SyntaxKind;

/**
 * 一个尚未完成的节点，必须调用 {@link #complete}。
 */
final class Marker {

    private final int pos;

    Marker(int pos) {
        this.pos = pos;
    }

    CompletedMarker complete(Parser p, SyntaxKind kind) {
        ((Event.Start) p.events().get(pos)).kind = kind;
        p.events().add(new Event.Finish());
        return new CompletedMarker(pos, kind);
    }

    /**
     * 一个已经完成的节点，之后仍然可以用 {@link #precede} 给它套上父节点（例如二元表达式的左操作数）。
     */
    record CompletedMarker(int startPos, SyntaxKind kind) {

        Marker precede(Parser p) {
            Marker parent = p.start();
            ((Event.Start) p.events().get(startPos)).forwardParent = parent.pos - startPos;
            return parent;
        }
    }
}
