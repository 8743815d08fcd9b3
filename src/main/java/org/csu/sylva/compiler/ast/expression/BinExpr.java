package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxElement;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;
import org.csu.sylva.syntax.SyntaxToken;

import java.util.Iterator;
import java.util.Optional;

/**
 * AST 节点: 二元运算表达式 (e.g., a + b, x += 1, age > 20)
 *
 * 运算符 Token 在子元素中的位置随操作数的形状变化，所以按源码顺序扫描全部子元素，
 * 取第一个出现在运算符表中的 Token。操作数则是前两个表达式子节点。
 */
public record BinExpr(SyntaxNode syntax) implements Expr {

    /**
     * @param token 运算符 Token
     * @param op    对应的语义运算符
     */
    public record OpDetails(SyntaxToken token, BinOp op) {
    }

    /**
     * 左右操作数，文法保证恰好有两个表达式子节点；错误恢复产生的节点可能缺少其中一个。
     */
    public record SubExprs(Optional<Expr> lhs, Optional<Expr> rhs) {
    }

    public BinExpr {
        AstNodes.requireKind(syntax, SyntaxKind.BIN_EXPR);
    }

    public Optional<OpDetails> opDetails() {
        for (SyntaxElement element : syntax.childrenWithTokens()) {
            if (element instanceof SyntaxToken token) {
                Optional<BinOp> op = BinOp.fromToken(token.kind());
                if (op.isPresent()) {
                    return Optional.of(new OpDetails(token, op.get()));
                }
            }
        }
        return Optional.empty();
    }

    public Optional<BinOp> opKind() {
        return opDetails().map(OpDetails::op);
    }

    public Optional<SyntaxToken> opToken() {
        return opDetails().map(OpDetails::token);
    }

    public Optional<Expr> lhs() {
        return AstNodes.children(this, Expr.class).stream().findFirst();
    }

    public Optional<Expr> rhs() {
        return AstNodes.children(this, Expr.class).stream().skip(1).findFirst();
    }

    public SubExprs subExprs() {
        Iterator<Expr> operands = AstNodes.children(this, Expr.class).iterator();
        Optional<Expr> first = operands.hasNext() ? Optional.of(operands.next()) : Optional.empty();
        Optional<Expr> second = operands.hasNext() ? Optional.of(operands.next()) : Optional.empty();
        return new SubExprs(first, second);
    }
}
