package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxElement;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;
import org.csu.sylva.syntax.SyntaxToken;

import java.util.Optional;

/**
 * AST 节点: 前缀表达式 (e.g., !done, -x)
 */
public record PrefixExpr(SyntaxNode syntax) implements Expr {

    public PrefixExpr {
        AstNodes.requireKind(syntax, SyntaxKind.PREFIX_EXPR);
    }

    /**
     * 运算符总是前缀表达式的第一个子元素；第一个子元素不是 Token 时返回空。
     */
    public Optional<SyntaxToken> opToken() {
        return syntax.firstChildOrToken().flatMap(SyntaxElement::asToken);
    }

    public Optional<PrefixOp> opKind() {
        return opToken().flatMap(token -> PrefixOp.fromToken(token.kind()));
    }

    public Optional<Expr> expr() {
        return AstNodes.child(this, Expr.class);
    }
}
