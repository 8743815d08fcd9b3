package org.csu.sylva.compiler.lexer;

import org.csu.sylva.syntax.SyntaxKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.csu.sylva.syntax.SyntaxKind.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @description: Lexer 类的单元测试
 */
class LexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize();
    }

    private static List<SyntaxKind> kindsNoTrivia(String src) {
        return lex(src).stream().map(Token::kind).filter(k -> !k.isTrivia()).toList();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "fn main() { let x = 1; }",
            "a /* block */ + // line\n b",
            "\"unterminated",
            "@#$ fn ?",
            "x.0.1 + 4.2 - 4. /* open"
    })
    void tokensConcatenateBackToInput(String src) {
        String joined = lex(src).stream().map(Token::text).collect(Collectors.joining());
        assertEquals(src, joined);
    }

    @Test
    void offsetsAreContiguous() {
        List<Token> tokens = lex("let  x=1;");
        int expected = 0;
        for (Token token : tokens) {
            assertEquals(expected, token.offset(), "Token offset mismatch: " + token);
            expected = token.range().end();
        }
        assertEquals(9, expected);
    }

    @Test
    void keywordsAndIdentifiers() {
        assertEquals(List.of(FN_KW, LET_KW, IF_KW, ELSE_KW, RETURN_KW, TRUE_KW, FALSE_KW, IDENT, IDENT, IDENT),
                kindsNoTrivia("fn let if else return true false foo _bar If"));
    }

    @Test
    void emptyInputHasNoTokens() {
        Lexer lexer = new Lexer("");
        assertTrue(lexer.tokenize().isEmpty());
        assertEquals("", lexer.getInput());
    }

    @Test
    void keywordTokensCarryTheirFixedText() {
        for (Token token : new Lexer("fn let if else return true false").tokenize()) {
            if (token.kind().isTrivia()) {
                continue;
            }
            assertTrue(token.kind().isKeyword(), token.toString());
            assertEquals(token.kind().fixedText(), token.text());
        }
        assertFalse(IDENT.isKeyword());
    }

    @Test
    void operatorsIncludingCompoundAssignments() {
        assertEquals(List.of(
                PLUS, MINUS, STAR, SLASH, PERCENT, CARET,
                EQ, PLUSEQ, MINUSEQ, STAREQ, SLASHEQ, PERCENTEQ, CARETEQ,
                EQEQ, NEQ, LT, LTEQ, GT, GTEQ, EXCLAMATION
        ), kindsNoTrivia("+ - * / % ^ = += -= *= /= %= ^= == != < <= > >= !"));
    }

    @Test
    void delimiters() {
        assertEquals(List.of(L_PAREN, R_PAREN, L_CURLY, R_CURLY, COMMA, COLON, SEMI, DOT),
                kindsNoTrivia("(){},:;."));
    }

    @Test
    void numbersVersusIndexAndDot() {
        assertEquals(List.of(INT_NUMBER, FLOAT_NUMBER), kindsNoTrivia("42 4.2"));
        assertEquals(List.of(INT_NUMBER, DOT), kindsNoTrivia("4."));
        assertEquals(List.of(IDENT, DOT, IDENT), kindsNoTrivia("x.y"));
        assertEquals(List.of(INT_NUMBER, DOT, IDENT), kindsNoTrivia("1.foo"));

        List<Token> tokens = lex("x.0.12");
        assertEquals(List.of(IDENT, INDEX, INDEX), tokens.stream().map(Token::kind).toList());
        assertEquals(".0", tokens.get(1).text());
        assertEquals(".12", tokens.get(2).text());
        assertEquals(3, tokens.get(2).offset());
    }

    @Test
    void stringsKeepQuotesAndEscapes() {
        List<Token> tokens = lex("\"a\\\"b\" \"\"");
        assertEquals(STRING, tokens.get(0).kind());
        assertEquals("\"a\\\"b\"", tokens.get(0).text());
        assertEquals(STRING, tokens.get(2).kind());
        assertEquals("\"\"", tokens.get(2).text());
    }

    @Test
    void commentsAreTrivia() {
        List<Token> tokens = lex("a // line\nb /* block */ c");
        assertEquals(List.of(IDENT, IDENT, IDENT), kindsNoTrivia("a // line\nb /* block */ c"));
        assertEquals("// line", tokens.get(2).text());
        assertEquals(COMMENT, tokens.get(2).kind());
        assertEquals("/* block */", tokens.get(6).text());
        assertTrue(COMMENT.isTrivia());
        assertTrue(WHITESPACE.isTrivia());
    }

    @Test
    void unknownCharactersAndUnterminatedLiteralsBecomeErrorTokens() {
        assertEquals(List.of(ERROR_TOKEN, IDENT), kindsNoTrivia("@ x"));

        List<Token> unterminated = lex("x \"abc");
        assertEquals(ERROR_TOKEN, unterminated.get(2).kind());
        assertEquals("\"abc", unterminated.get(2).text());

        List<Token> openComment = lex("x /* abc");
        assertEquals(ERROR_TOKEN, openComment.get(2).kind());
        assertEquals("/* abc", openComment.get(2).text());
    }
}
