package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.syntax.SyntaxKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 一元（前缀）运算符。
 */
public enum PrefixOp {
    /** 逻辑取反 {@code !} */
    NOT(SyntaxKind.EXCLAMATION),
    /** 取负 {@code -} */
    NEG(SyntaxKind.MINUS);

    private static final Map<SyntaxKind, PrefixOp> BY_TOKEN = new EnumMap<>(SyntaxKind.class);

    static {
        for (PrefixOp op : values()) {
            BY_TOKEN.put(op.token, op);
        }
    }

    private final SyntaxKind token;

    PrefixOp(SyntaxKind token) {
        this.token = token;
    }

    public SyntaxKind token() {
        return token;
    }

    public static Optional<PrefixOp> fromToken(SyntaxKind kind) {
        return Optional.ofNullable(BY_TOKEN.get(kind));
    }
}
