package org.csu.sylva.compiler.parser;

import org.csu.sylva.common.exception.ParseException;
import org.csu.sylva.compiler.ast.SourceFile;
import org.csu.sylva.syntax.SyntaxElement;
import org.csu.sylva.syntax.SyntaxError;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxNode;
import org.csu.sylva.syntax.TextRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @description: Parser 的单元测试，覆盖正常输入的树形状和错误输入的容错行为。
 */
class ParserTest {

    private SourceFile parse(String source) {
        System.out.println("Input: " + source);
        SourceFile file = SourceFile.parse(source);
        System.out.println("Generated Tree:\n" + file.tree().debugDump());
        return file;
    }

    @Test
    void parseSimpleFunction() {
        String expected = String.join("\n",
                "SOURCE_FILE@0..12",
                "  FUNCTION_DEF@0..12",
                "    FN_KW@0..2 \"fn\"",
                "    WHITESPACE@2..3 \" \"",
                "    NAME@3..4",
                "      IDENT@3..4 \"f\"",
                "    PARAM_LIST@4..6",
                "      L_PAREN@4..5 \"(\"",
                "      R_PAREN@5..6 \")\"",
                "    WHITESPACE@6..7 \" \"",
                "    BLOCK_EXPR@7..12",
                "      L_CURLY@7..8 \"{\"",
                "      WHITESPACE@8..9 \" \"",
                "      LITERAL@9..10",
                "        INT_NUMBER@9..10 \"1\"",
                "      WHITESPACE@10..11 \" \"",
                "      R_CURLY@11..12 \"}\"",
                "");
        assertEquals(expected, parse("fn f() { 1 }").tree().debugDump());
    }

    @Test
    void leadingAndTrailingTriviaBelongToTheRoot() {
        SyntaxNode root = parse("  // header\nfn f() {}\n\n").syntax();
        List<SyntaxKind> kinds = root.childrenWithTokens().stream().map(SyntaxElement::kind).toList();
        assertEquals(List.of(SyntaxKind.WHITESPACE, SyntaxKind.COMMENT, SyntaxKind.WHITESPACE,
                SyntaxKind.FUNCTION_DEF, SyntaxKind.WHITESPACE), kinds);
    }

    @Test
    void binaryOperatorsFollowPrecedence() {
        SyntaxNode tail = parse("fn f() { 1 + 2 * 3 }").syntax().descendants()
                .filter(n -> n.kind() == SyntaxKind.BIN_EXPR).findFirst().orElseThrow();
        assertEquals("1 + 2 * 3", tail.text());
        List<SyntaxNode> operands = tail.children();
        assertEquals(SyntaxKind.LITERAL, operands.get(0).kind());
        assertEquals(SyntaxKind.BIN_EXPR, operands.get(1).kind());
        assertEquals("2 * 3", operands.get(1).text());
    }

    @Test
    void assignmentIsRightAssociative() {
        SyntaxNode outer = parse("fn f() { a = b = c; }").syntax().descendants()
                .filter(n -> n.kind() == SyntaxKind.BIN_EXPR).findFirst().orElseThrow();
        assertEquals("a = b = c", outer.text());
        assertEquals("b = c", outer.children().get(1).text());
        assertEquals(SyntaxKind.EXPR_STMT, outer.parent().orElseThrow().kind());
    }

    @Test
    void postfixBindsTighterThanPrefix() {
        SyntaxNode prefix = parse("fn f() { -a.b(1) }").syntax().descendants()
                .filter(n -> n.kind() == SyntaxKind.PREFIX_EXPR).findFirst().orElseThrow();
        assertEquals(SyntaxKind.CALL_EXPR, prefix.children().get(0).kind());
        assertEquals(SyntaxKind.FIELD_EXPR, prefix.children().get(0).children().get(0).kind());
    }

    @Test
    void blockLikeExpressionStatementsNeedNoSemicolon() {
        SourceFile file = parse("fn f() { if a { 1 } { 2 } x }");
        assertFalse(file.tree().hasErrors());
        List<SyntaxKind> kinds = file.functions().get(0).body().orElseThrow().syntax().children().stream()
                .map(SyntaxNode::kind).toList();
        assertEquals(List.of(SyntaxKind.EXPR_STMT, SyntaxKind.EXPR_STMT, SyntaxKind.PATH_EXPR), kinds);
    }

    @Test
    void missingExpressionIsReportedAtTheNextToken() {
        SourceFile file = parse("fn main() { let x = ; }");
        List<SyntaxError> errors = file.errors();
        assertEquals(1, errors.size());
        assertEquals("expected expression", errors.get(0).message());
        assertEquals(TextRange.empty(20), errors.get(0).range());

        ParseException e = assertThrows(ParseException.class, file::ok);
        assertTrue(e.getMessage().contains("line 1, column 21"), e.getMessage());
        assertEquals(errors, e.getErrors());
    }

    @Test
    void unexpectedTokensAreWrappedInErrorNodes() {
        SourceFile file = parse("fn f() { let x = 1; ) }\n@");
        List<SyntaxNode> errorNodes = file.syntax().descendants()
                .filter(n -> n.kind() == SyntaxKind.ERROR).toList();
        assertEquals(2, errorNodes.size());
        assertEquals(")", errorNodes.get(0).text());
        assertEquals("@", errorNodes.get(1).text());
        assertEquals(2, file.errors().size());
    }

    @Test
    void validSourceHasNoErrors() {
        SourceFile file = parse("""
                fn add(a: int, b: int): int {
                    let sum: int = a + b;
                    sum += 1;
                    if sum > 10 { return sum; } else if sum < 0 { 0 } else { sum.0 }
                }
                """);
        assertSame(file, file.ok());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "fn",
            "fn main() {",
            "}}}",
            "fn f(a: int, b) { let x = ; x.; if {} else }",
            "fn f(: int,, ) : { foo(1 2, ; }",
            "@#$ \"unterminated",
            "fn f() { -; !; 1 + ; a.0. ; (1 }",
            "fn f() { if a { } else if }",
            "fn f() { let = 1; let x: = 2; return }"
    })
    void neverThrowsAndStaysLossless(String source) {
        SourceFile file = assertDoesNotThrow(() -> SourceFile.parse(source));
        assertEquals(source, file.syntax().text());
        assertEquals(TextRange.fromTo(0, source.length()), file.syntax().textRange());
        file.syntax().descendants().forEach(node -> {
            for (SyntaxElement child : node.childrenWithTokens()) {
                assertTrue(node.textRange().containsRange(child.textRange()), child + " escapes " + node);
            }
        });
    }
}
