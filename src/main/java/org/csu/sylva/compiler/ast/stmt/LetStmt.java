package org.csu.sylva.compiler.ast.stmt;

import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.compiler.ast.NameOwner;
import org.csu.sylva.compiler.ast.expression.Expr;
import org.csu.sylva.compiler.ast.item.PathType;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.Optional;

/**
 * @author hidyouth
 * @description: AST 节点: let name: Type = initializer;
 */
public record LetStmt(SyntaxNode syntax) implements Stmt, NameOwner {

    public LetStmt {
        AstNodes.requireKind(syntax, SyntaxKind.LET_STMT);
    }

    public Optional<PathType> typeRef() {
        return AstNodes.child(this, PathType.class);
    }

    public Optional<Expr> initializer() {
        return AstNodes.child(this, Expr.class);
    }
}
