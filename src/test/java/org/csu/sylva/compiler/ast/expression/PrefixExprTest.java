package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.compiler.ast.SourceFile;
import org.csu.sylva.syntax.SyntaxKind;
import org.csu.sylva.syntax.SyntaxTree;
import org.csu.sylva.syntax.TreeFixtures;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.csu.sylva.compiler.ast.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class PrefixExprTest {

    @Test
    void notAndNegation() {
        PrefixExpr not = first(parseBody("!done"), PrefixExpr.class);
        assertEquals(PrefixOp.NOT, not.opKind().orElseThrow());
        assertEquals("!", not.opToken().orElseThrow().text());
        assertEquals("done", text(not.expr().orElseThrow()));

        PrefixExpr neg = first(parseBody("-x"), PrefixExpr.class);
        assertEquals(PrefixOp.NEG, neg.opKind().orElseThrow());
        assertEquals(SyntaxKind.MINUS, neg.opToken().orElseThrow().kind());
    }

    @Test
    void repeatedQueriesGiveTheSameAnswer() {
        PrefixExpr neg = first(parseBody("-x"), PrefixExpr.class);
        for (int i = 0; i < 3; i++) {
            assertEquals(Optional.of(PrefixOp.NEG), neg.opKind());
            assertEquals(neg.opToken(), neg.opToken());
        }
    }

    @Test
    void operandKeepsPostfixExpressionsTogether() {
        PrefixExpr neg = first(parseBody("-a.b"), PrefixExpr.class);
        assertInstanceOf(FieldExpr.class, neg.expr().orElseThrow());
        assertEquals("a.b", text(neg.expr().orElseThrow()));
    }

    @Test
    void nestedPrefixes() {
        PrefixExpr outer = first(parseBody("!-x"), PrefixExpr.class);
        assertEquals(PrefixOp.NOT, outer.opKind().orElseThrow());
        PrefixExpr inner = assertInstanceOf(PrefixExpr.class, outer.expr().orElseThrow());
        assertEquals(PrefixOp.NEG, inner.opKind().orElseThrow());
    }

    @Test
    void missingOperandStillClassifiesTheOperator() {
        SourceFile file = parseBody("-");
        PrefixExpr neg = first(file, PrefixExpr.class);
        assertEquals(PrefixOp.NEG, neg.opKind().orElseThrow());
        assertTrue(neg.expr().isEmpty());
        assertTrue(file.tree().hasErrors());
    }

    @Test
    void unknownOperatorTokenHasNoKind() {
        SyntaxTree tree = TreeFixtures.of("+1")
                .start(SyntaxKind.PREFIX_EXPR)
                .token(SyntaxKind.PLUS, "+")
                .start(SyntaxKind.LITERAL).token(SyntaxKind.INT_NUMBER, "1").finish()
                .finish()
                .build();
        PrefixExpr expr = new PrefixExpr(tree.root());
        assertEquals("+", expr.opToken().orElseThrow().text());
        assertTrue(expr.opKind().isEmpty());
        assertEquals("1", text(expr.expr().orElseThrow()));
    }

    @Test
    void firstChildThatIsNotATokenMeansNoOperator() {
        SyntaxTree tree = TreeFixtures.of("1")
                .start(SyntaxKind.PREFIX_EXPR)
                .start(SyntaxKind.LITERAL).token(SyntaxKind.INT_NUMBER, "1").finish()
                .finish()
                .build();
        PrefixExpr expr = new PrefixExpr(tree.root());
        assertTrue(expr.opToken().isEmpty());
        assertTrue(expr.opKind().isEmpty());
    }
}
