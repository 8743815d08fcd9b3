package org.csu.sylva.syntax;

/**
 * @author hidyouth
 * @description: 语法树中所有元素的种别码。
 *
 * 前半部分是词法单元（Token）的种别，后半部分是语法节点（Node）对应的产生式。
 * 新增一个产生式只需要在这里加一个节点种别，并在 {@code AstNodes} 中登记对应的包装类型。
 */
public enum SyntaxKind {
    // ---- 琐碎内容 (Trivia) ----
    WHITESPACE(Category.TRIVIA),
    COMMENT(Category.TRIVIA),

    // ---- 关键字 (Keywords) ----
    FN_KW(Category.KEYWORD, "fn"),
    LET_KW(Category.KEYWORD, "let"),
    IF_KW(Category.KEYWORD, "if"),
    ELSE_KW(Category.KEYWORD, "else"),
    RETURN_KW(Category.KEYWORD, "return"),
    TRUE_KW(Category.KEYWORD, "true"),
    FALSE_KW(Category.KEYWORD, "false"),

    // ---- 标识符与常量 ----
    IDENT(Category.TOKEN),
    INT_NUMBER(Category.TOKEN),
    FLOAT_NUMBER(Category.TOKEN),
    STRING(Category.TOKEN),
    INDEX(Category.TOKEN),      // ".0" 形式的位置下标，包含前导的 '.'

    // ---- 运算符 (Operators) ----
    PLUS(Category.TOKEN, "+"),
    MINUS(Category.TOKEN, "-"),
    STAR(Category.TOKEN, "*"),
    SLASH(Category.TOKEN, "/"),
    PERCENT(Category.TOKEN, "%"),
    CARET(Category.TOKEN, "^"),
    EQ(Category.TOKEN, "="),
    PLUSEQ(Category.TOKEN, "+="),
    MINUSEQ(Category.TOKEN, "-="),
    STAREQ(Category.TOKEN, "*="),
    SLASHEQ(Category.TOKEN, "/="),
    PERCENTEQ(Category.TOKEN, "%="),
    CARETEQ(Category.TOKEN, "^="),
    EQEQ(Category.TOKEN, "=="),
    NEQ(Category.TOKEN, "!="),
    LT(Category.TOKEN, "<"),
    LTEQ(Category.TOKEN, "<="),
    GT(Category.TOKEN, ">"),
    GTEQ(Category.TOKEN, ">="),
    EXCLAMATION(Category.TOKEN, "!"),

    // ---- 分隔符 (Delimiters) ----
    DOT(Category.TOKEN, "."),
    COMMA(Category.TOKEN, ","),
    COLON(Category.TOKEN, ":"),
    SEMI(Category.TOKEN, ";"),
    L_PAREN(Category.TOKEN, "("),
    R_PAREN(Category.TOKEN, ")"),
    L_CURLY(Category.TOKEN, "{"),
    R_CURLY(Category.TOKEN, "}"),

    // ---- 特殊 Token ----
    ERROR_TOKEN(Category.TOKEN),  // 非法字符或未闭合的字符串
    EOF(Category.TOKEN),          // 只在解析器内部使用，不会进入语法树

    // ---- 语法节点 (Nodes) ----
    SOURCE_FILE(Category.NODE),
    FUNCTION_DEF(Category.NODE),
    PARAM_LIST(Category.NODE),
    PARAM(Category.NODE),
    RET_TYPE(Category.NODE),
    PATH_TYPE(Category.NODE),
    NAME(Category.NODE),
    NAME_REF(Category.NODE),
    PATH(Category.NODE),
    PATH_SEGMENT(Category.NODE),
    BLOCK_EXPR(Category.NODE),
    LET_STMT(Category.NODE),
    EXPR_STMT(Category.NODE),
    LITERAL(Category.NODE),
    PATH_EXPR(Category.NODE),
    PAREN_EXPR(Category.NODE),
    PREFIX_EXPR(Category.NODE),
    BIN_EXPR(Category.NODE),
    FIELD_EXPR(Category.NODE),
    CALL_EXPR(Category.NODE),
    ARG_LIST(Category.NODE),
    IF_EXPR(Category.NODE),
    CONDITION(Category.NODE),
    RETURN_EXPR(Category.NODE),
    ERROR(Category.NODE);         // 错误恢复时包裹意外 Token 的节点

    private enum Category { TRIVIA, KEYWORD, TOKEN, NODE }

    private final Category category;
    private final String fixedText;

    SyntaxKind(Category category) {
        this(category, null);
    }

    SyntaxKind(Category category, String fixedText) {
        this.category = category;
        this.fixedText = fixedText;
    }

    public boolean isTrivia() {
        return category == Category.TRIVIA;
    }

    public boolean isKeyword() {
        return category == Category.KEYWORD;
    }

    public boolean isNode() {
        return category == Category.NODE;
    }

    public boolean isToken() {
        return category != Category.NODE;
    }

    /**
     * 关键字和标点的固定文本，其余种别返回 null。
     */
    public String fixedText() {
        return fixedText;
    }
}
