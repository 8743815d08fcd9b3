package org.csu.sylva.compiler.lexer;

import lombok.Getter;
import org.csu.sylva.syntax.SyntaxKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * @author hidyouth
 * @description: 无损词法分析器 (Lexer/Scanner)
 *
 * 把源码切分成 Token 序列。空白、注释和无法识别的字符也会各自成为 Token，
 * 所以把所有 Token 的文本按顺序拼起来一定等于原始输入。
 */
public class Lexer {

    @Getter
    private final String input;
    private int position = 0; // 当前读取的位置

    // 关键字映射表
    private static final Map<String, SyntaxKind> keywords = Map.of(
            "fn", SyntaxKind.FN_KW,
            "let", SyntaxKind.LET_KW,
            "if", SyntaxKind.IF_KW,
            "else", SyntaxKind.ELSE_KW,
            "return", SyntaxKind.RETURN_KW,
            "true", SyntaxKind.TRUE_KW,
            "false", SyntaxKind.FALSE_KW
    );

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token（不包含 EOF）
     * @return Token列表
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (position < input.length()) {
            tokens.add(nextToken());
        }
        return tokens;
    }

    /**
     * 获取下一个Token，调用前保证还有未读字符
     * @return 解析出的下一个Token
     */
    private Token nextToken() {
        int start = position;
        char currentChar = peek();

        if (Character.isWhitespace(currentChar)) {
            while (position < input.length() && Character.isWhitespace(peek())) {
                advance();
            }
            return make(SyntaxKind.WHITESPACE, start);
        }

        if (currentChar == '/' && (peekNext() == '/' || peekNext() == '*')) {
            return readComment();
        }

        // 识别标识符或关键字
        if (isIdentStart(currentChar)) {
            return readIdentifierOrKeyword();
        }

        // 识别数字
        if (isDigit(currentChar)) {
            return readNumber();
        }

        // 识别字符串
        if (currentChar == '"') {
            return readString();
        }

        // 识别运算符和分隔符
        advance();
        switch (currentChar) {
            case '+':
                return withAssign(SyntaxKind.PLUS, SyntaxKind.PLUSEQ, start);
            case '-':
                return withAssign(SyntaxKind.MINUS, SyntaxKind.MINUSEQ, start);
            case '*':
                return withAssign(SyntaxKind.STAR, SyntaxKind.STAREQ, start);
            case '/':
                return withAssign(SyntaxKind.SLASH, SyntaxKind.SLASHEQ, start);
            case '%':
                return withAssign(SyntaxKind.PERCENT, SyntaxKind.PERCENTEQ, start);
            case '^':
                return withAssign(SyntaxKind.CARET, SyntaxKind.CARETEQ, start);
            case '=':
                return withAssign(SyntaxKind.EQ, SyntaxKind.EQEQ, start);
            case '!':
                return withAssign(SyntaxKind.EXCLAMATION, SyntaxKind.NEQ, start);
            case '<':
                return withAssign(SyntaxKind.LT, SyntaxKind.LTEQ, start);
            case '>':
                return withAssign(SyntaxKind.GT, SyntaxKind.GTEQ, start);
            case '.':
                // ".0" 这样的位置下标合成一个 INDEX Token，前导的 '.' 也算在里面
                if (isDigit(peek())) {
                    while (position < input.length() && isDigit(peek())) {
                        advance();
                    }
                    return make(SyntaxKind.INDEX, start);
                }
                return make(SyntaxKind.DOT, start);
            case ',':
                return make(SyntaxKind.COMMA, start);
            case ':':
                return make(SyntaxKind.COLON, start);
            case ';':
                return make(SyntaxKind.SEMI, start);
            case '(':
                return make(SyntaxKind.L_PAREN, start);
            case ')':
                return make(SyntaxKind.R_PAREN, start);
            case '{':
                return make(SyntaxKind.L_CURLY, start);
            case '}':
                return make(SyntaxKind.R_CURLY, start);
            default:
                return make(SyntaxKind.ERROR_TOKEN, start);
        }
    }

    private Token readComment() {
        int start = position;
        advance(); // 跳过 '/'
        if (peek() == '/') {
            while (position < input.length() && peek() != '\n') {
                advance();
            }
            return make(SyntaxKind.COMMENT, start);
        }
        advance(); // 跳过 '*'
        while (position < input.length() && !(peek() == '*' && peekNext() == '/')) {
            advance();
        }
        if (position >= input.length()) {
            // 未闭合的块注释，剩余内容全部当作错误
            return make(SyntaxKind.ERROR_TOKEN, start);
        }
        advance();
        advance();
        return make(SyntaxKind.COMMENT, start);
    }

    private Token readIdentifierOrKeyword() {
        int start = position;
        while (position < input.length() && isIdentContinue(peek())) {
            advance();
        }
        String text = input.substring(start, position);
        // 关键字区分大小写
        SyntaxKind kind = keywords.getOrDefault(text, SyntaxKind.IDENT);
        return new Token(kind, text, start);
    }

    private Token readNumber() {
        int start = position;
        while (position < input.length() && isDigit(peek())) {
            advance();
        }

        // 小数点后面必须还有数字，否则 '.' 属于后面的字段访问
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消耗掉 '.'
            while (position < input.length() && isDigit(peek())) {
                advance();
            }
            return make(SyntaxKind.FLOAT_NUMBER, start);
        }
        return make(SyntaxKind.INT_NUMBER, start);
    }

    private Token readString() {
        int start = position;
        advance(); // 跳过起始的双引号
        while (position < input.length() && peek() != '"') {
            if (peek() == '\\' && position + 1 < input.length()) {
                advance(); // 跳过转义字符
            }
            advance();
        }
        if (position >= input.length()) {
            return make(SyntaxKind.ERROR_TOKEN, start); // 未闭合的字符串
        }
        advance(); // 跳过结束的双引号
        return make(SyntaxKind.STRING, start);
    }

    // --- 辅助方法 ---

    private Token withAssign(SyntaxKind plain, SyntaxKind compound, int start) {
        if (peek() == '=') {
            advance();
            return make(compound, start);
        }
        return make(plain, start);
    }

    private Token make(SyntaxKind kind, int start) {
        return new Token(kind, input.substring(start, position), start);
    }

    private char peek() {
        if (position >= input.length()) return '\0'; // 文件结束符
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        position++;
    }

    private boolean isIdentStart(char ch) {
        return Character.isLetter(ch) || ch == '_';
    }

    private boolean isIdentContinue(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }

    private boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }
}
