package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * AST 节点: 条件表达式 (e.g., if c { 1 } else if d { 2 } else { 3 })
 */
public record IfExpr(SyntaxNode syntax) implements Expr {

    public IfExpr {
        AstNodes.requireKind(syntax, SyntaxKind.IF_EXPR);
    }

    public Optional<Condition> condition() {
        return AstNodes.child(this, Condition.class);
    }

    public Optional<BlockExpr> thenBranch() {
        return blocks().stream().findFirst();
    }

    /**
     * 第二个代码块子节点表示 else 块；否则嵌套的条件表达式子节点表示 else-if；都没有时没有 else 分支。
     */
    public Optional<ElseBranch> elseBranch() {
        List<BlockExpr> blocks = blocks();
        if (blocks.size() > 1) {
            return Optional.of(new ElseBranch.Block(blocks.get(1)));
        }
        return AstNodes.child(this, IfExpr.class).map(ElseBranch.ElseIf::new);
    }

    private List<BlockExpr> blocks() {
        return AstNodes.children(this, BlockExpr.class);
    }
}
