package org.csu.sylva.compiler.lexer;

import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.TextRange;

/**
 * @param kind   词法单元的类型 (种别码)
 * @param text   词法单元的原始文本，包括字符串的引号
 * @param offset 在源码中的起始偏移量
 */
public record Token(SyntaxKind kind, String text, int offset) {

    public int len() {
        return text.length();
    }

    public TextRange range() {
        return TextRange.fromTo(offset, offset + text.length());
    }

    @Override
    public String toString() {
        return String.format("Token[Kind=%-12s, Text='%s', Offset=%d]", kind, text, offset);
    }
}
