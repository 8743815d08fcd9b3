package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.syntax.SyntaxKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 字面量的语义类别。
 */
public enum LiteralKind {
    STRING(SyntaxKind.STRING),
    INT_NUMBER(SyntaxKind.INT_NUMBER),
    FLOAT_NUMBER(SyntaxKind.FLOAT_NUMBER),
    BOOL(SyntaxKind.TRUE_KW, SyntaxKind.FALSE_KW);

    private static final Map<SyntaxKind, LiteralKind> BY_TOKEN = new EnumMap<>(SyntaxKind.class);

    static {
        for (LiteralKind kind : values()) {
            for (SyntaxKind token : kind.tokens) {
                BY_TOKEN.put(token, kind);
            }
        }
    }

    private final SyntaxKind[] tokens;

    LiteralKind(SyntaxKind... tokens) {
        this.tokens = tokens;
    }

    public static Optional<LiteralKind> fromToken(SyntaxKind kind) {
        return Optional.ofNullable(BY_TOKEN.get(kind));
    }
}
