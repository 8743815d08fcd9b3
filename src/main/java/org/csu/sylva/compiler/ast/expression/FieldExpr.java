package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.compiler.ast.AstNodes;
import org.csu.sylva.compiler.ast.item.NameRef;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;
import org.csu.sylva.syntax.SyntaxToken;
import org.csu.sylva.syntax.TextRange;

import java.util.Optional;

/**
 * AST 节点: 字段访问表达式 (e.g., point.x, pair.0)
 */
public record FieldExpr(SyntaxNode syntax) implements Expr {

    public FieldExpr {
        AstNodes.requireKind(syntax, SyntaxKind.FIELD_EXPR);
    }

    /**
     * 被访问的接收者表达式。
     */
    public Optional<Expr> expr() {
        return AstNodes.child(this, Expr.class);
    }

    public Optional<NameRef> nameRef() {
        return AstNodes.child(this, NameRef.class);
    }

    public Optional<SyntaxToken> indexToken() {
        return AstNodes.token(this, SyntaxKind.INDEX);
    }

    /**
     * 名称优先，其次是下标；两者都没有时（不完整的输入）返回空。
     */
    public Optional<FieldKind> fieldAccess() {
        Optional<NameRef> nameRef = nameRef();
        if (nameRef.isPresent()) {
            return Optional.of(new FieldKind.Name(nameRef.get()));
        }
        return indexToken().map(FieldKind.Index::new);
    }

    /**
     * 只覆盖字段部分的源码区间，供诊断信息标注使用。
     * <ul>
     *     <li>有名称时取名称节点的区间；</li>
     *     <li>有下标时从下标 Token 起点后一个字符开始（跳过 '.'），到 Token 末尾；</li>
     *     <li>都没有时返回节点起点处的零宽区间。</li>
     * </ul>
     */
    public TextRange fieldRange() {
        Optional<NameRef> nameRef = nameRef();
        if (nameRef.isPresent()) {
            return nameRef.get().syntax().textRange();
        }
        Optional<SyntaxToken> index = indexToken();
        if (index.isPresent()) {
            TextRange range = index.get().textRange();
            return TextRange.fromTo(range.start() + 1, range.end());
        }
        int start = syntax.textRange().start();
        return TextRange.fromTo(start, start);
    }
}
