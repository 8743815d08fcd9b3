package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.compiler.ast.item.NameRef;
import org.csu.sylva.syntax.SyntaxToken;

/**
 * 字段访问的两种合法形状：按名称 ({@code p.x}) 或按位置下标 ({@code t.0})。
 */
public interface FieldKind {

    record Name(NameRef nameRef) implements FieldKind {
    }

    /**
     * @param token INDEX Token，文本包含前导的 '.'
     */
    record Index(SyntaxToken token) implements FieldKind {
    }
}
