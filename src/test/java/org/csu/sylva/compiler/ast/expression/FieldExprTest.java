package org.csu.sylva.compiler.ast.expression;

import org.csu.sylva.compiler.ast.SourceFile;
import org.csu.sylva.syntax.TextRange;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.csu.sylva.compiler.ast.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FieldExprTest {

    private static String fieldText(SourceFile file, FieldExpr expr) {
        return expr.fieldRange().substring(file.tree().getText());
    }

    @Test
    void namedField() {
        SourceFile file = parseBody("point.x");
        FieldExpr expr = first(file, FieldExpr.class);
        assertEquals("point", text(expr.expr().orElseThrow()));

        FieldKind.Name name = assertInstanceOf(FieldKind.Name.class, expr.fieldAccess().orElseThrow());
        assertEquals("x", name.nameRef().text());
        assertEquals("x", name.nameRef().identToken().orElseThrow().text());
        assertTrue(expr.indexToken().isEmpty());
        assertEquals("x", fieldText(file, expr));
        assertEquals(TextRange.fromTo(PREFIX.length() + 6, PREFIX.length() + 7), expr.fieldRange());
    }

    @Test
    void positionalIndex() {
        SourceFile file = parseBody("pair.0");
        FieldExpr expr = first(file, FieldExpr.class);
        FieldKind.Index index = assertInstanceOf(FieldKind.Index.class, expr.fieldAccess().orElseThrow());
        assertEquals(".0", index.token().text());
        assertTrue(expr.nameRef().isEmpty());
        assertEquals("0", fieldText(file, expr));
    }

    @Test
    void multiDigitIndexSkipsOnlyTheDot() {
        SourceFile file = parseBody("t.12");
        FieldExpr expr = first(file, FieldExpr.class);
        assertEquals(".12", expr.indexToken().orElseThrow().text());
        assertEquals("12", fieldText(file, expr));
    }

    @Test
    void chainedIndexes() {
        SourceFile file = parseBody("t.0.1");
        FieldExpr outer = first(file, FieldExpr.class);
        assertEquals("t.0.1", text(outer));
        assertEquals("1", fieldText(file, outer));

        FieldExpr inner = assertInstanceOf(FieldExpr.class, outer.expr().orElseThrow());
        assertEquals("t.0", text(inner));
        assertEquals("0", fieldText(file, inner));
        assertFalse(file.tree().hasErrors());
    }

    @Test
    void repeatedQueriesGiveTheSameAnswer() {
        SourceFile file = parseBody("p.x + t.0");
        for (FieldExpr expr : all(file, FieldExpr.class)) {
            Optional<FieldKind> access = expr.fieldAccess();
            assertTrue(access.isPresent());
            for (int i = 0; i < 3; i++) {
                assertEquals(access, expr.fieldAccess());
                assertEquals(expr.fieldRange(), expr.fieldRange());
            }
        }
    }

    @Test
    void missingFieldGivesEmptyRangeAtNodeStart() {
        SourceFile file = parseBody("x.;");
        FieldExpr expr = first(file, FieldExpr.class);
        assertEquals("x.", text(expr));
        assertTrue(expr.fieldAccess().isEmpty());

        TextRange range = expr.fieldRange();
        assertTrue(range.isEmpty());
        assertEquals(expr.syntax().textRange().start(), range.start());
        assertEquals("expected field name or number", file.errors().get(0).message());
    }
}
