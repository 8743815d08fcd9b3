package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.syntax.SyntaxKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * @description: 二元运算符（含赋值和复合赋值）。
 *
 * Token 种别到运算符的映射由枚举常量上的数据生成，而不是散落在各处的分支里。
 * 取余 {@code %}、乘方 {@code ^} 及其复合赋值形式已经能被词法和语法分析识别，
 * 但还没有对应的语义运算符，它们登记在 {@link #RESERVED_TOKENS} 中，分类时得到空结果。
 */
public enum BinOp {
    ADD(SyntaxKind.PLUS, Category.ARITHMETIC),
    SUBTRACT(SyntaxKind.MINUS, Category.ARITHMETIC),
    DIVIDE(SyntaxKind.SLASH, Category.ARITHMETIC),
    MULTIPLY(SyntaxKind.STAR, Category.ARITHMETIC),
    ASSIGN(SyntaxKind.EQ, Category.ASSIGNMENT),
    ADD_ASSIGN(SyntaxKind.PLUSEQ, Category.ASSIGNMENT),
    SUBTRACT_ASSIGN(SyntaxKind.MINUSEQ, Category.ASSIGNMENT),
    DIVIDE_ASSIGN(SyntaxKind.SLASHEQ, Category.ASSIGNMENT),
    MULTIPLY_ASSIGN(SyntaxKind.STAREQ, Category.ASSIGNMENT),
    EQUALS(SyntaxKind.EQEQ, Category.COMPARISON),
    NOT_EQUALS(SyntaxKind.NEQ, Category.COMPARISON),
    LESS(SyntaxKind.LT, Category.COMPARISON),
    LESS_EQUAL(SyntaxKind.LTEQ, Category.COMPARISON),
    GREATER(SyntaxKind.GT, Category.COMPARISON),
    GREAT_EQUAL(SyntaxKind.GTEQ, Category.COMPARISON);

    private enum Category { ARITHMETIC, ASSIGNMENT, COMPARISON }

    /**
     * 已保留但尚未支持的运算符 Token：取余、乘方以及它们的复合赋值。
     */
    public static final Set<SyntaxKind> RESERVED_TOKENS = Collections.unmodifiableSet(EnumSet.of(
            SyntaxKind.PERCENT,
            SyntaxKind.CARET,
            SyntaxKind.PERCENTEQ,
            SyntaxKind.CARETEQ
    ));

    private static final Map<SyntaxKind, BinOp> BY_TOKEN = new EnumMap<>(SyntaxKind.class);

    static {
        for (BinOp op : values()) {
            BY_TOKEN.put(op.token, op);
        }
    }

    private final SyntaxKind token;
    private final Category category;

    BinOp(SyntaxKind token, Category category) {
        this.token = token;
        this.category = category;
    }

    public SyntaxKind token() {
        return token;
    }

    public String symbol() {
        return token.fixedText();
    }

    public boolean isAssignment() {
        return category == Category.ASSIGNMENT;
    }

    public boolean isComparison() {
        return category == Category.COMPARISON;
    }

    public static Optional<BinOp> fromToken(SyntaxKind kind) {
        return Optional.ofNullable(BY_TOKEN.get(kind));
    }

    public static boolean isReserved(SyntaxKind kind) {
        return RESERVED_TOKENS.contains(kind);
    }
}
