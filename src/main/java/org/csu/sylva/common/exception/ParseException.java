package org.csu.sylva.common.exception;

import org.csu.sylva.syntax.LineIndex;
import org.csu.sylva.syntax.SyntaxError;

import java.util.List;

/**
 * @author hidyouth
 * @description: 源码中存在语法错误时抛出。
 *
 * 解析器本身从不抛出该异常，只有调用方要求一棵没有错误的树时（例如 {@code SourceFile.ok()}）才会用到。
 */
public class ParseException extends RuntimeException {

    private final List<SyntaxError> errors;

    public ParseException(List<SyntaxError> errors, LineIndex lineIndex) {
        super(format(errors, lineIndex));
        this.errors = List.copyOf(errors);
    }

    public List<SyntaxError> getErrors() {
        return errors;
    }

    private static String format(List<SyntaxError> errors, LineIndex lineIndex) {
        if (errors.isEmpty()) {
            return "Syntax Error";
        }
        SyntaxError first = errors.get(0);
        LineIndex.LineCol position = lineIndex.lineCol(first.range().start());
        String message = String.format("Syntax Error at line %d, column %d: %s",
                position.line(), position.column(), first.message());
        if (errors.size() > 1) {
            message += String.format(" (and %d more)", errors.size() - 1);
        }
        return message;
    }
}
