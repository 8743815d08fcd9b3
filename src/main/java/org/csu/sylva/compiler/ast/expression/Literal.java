package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.common.exception.SyntaxInvariantError;
import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxElement;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;
import org.csu.sylva.syntax.SyntaxToken;

/**
 * AST 节点: 字面量 (e.g., "hello", 42, 4.2, true)
 *
 * 字面量节点恰好包含一个非 trivia 的 Token。解析器只会用四种字面量 Token 构造该节点，
 * 所以遇到其他情况说明解析器有缺陷，直接抛出 {@link SyntaxInvariantError}，而不是返回一个错误的分类。
 */
public record Literal(SyntaxNode syntax) implements Expr {

    public Literal {
        AstNodes.requireKind(syntax, SyntaxKind.LITERAL);
    }

    public SyntaxToken token() {
        for (SyntaxElement element : syntax.childrenWithTokens()) {
            if (element.kind().isTrivia()) {
                continue;
            }
            if (element instanceof SyntaxToken token) {
                return token;
            }
            throw new SyntaxInvariantError(syntax, "expected a token but found node " + element.kind());
        }
        throw new SyntaxInvariantError(syntax, "literal without a token");
    }

    public LiteralKind kind() {
        SyntaxToken token = token();
        return LiteralKind.fromToken(token.kind())
                .orElseThrow(() -> new SyntaxInvariantError(syntax, "unexpected literal token " + token.kind()));
    }

    public String text() {
        return token().text();
    }
}
