package co.fanki.recipegen.analysis.domain;

import co.fanki.recipegen.analysis.domain.python.PythonNodeTypes;
import co.fanki.recipegen.analysis.domain.python.SyntaxNode;
import co.fanki.recipegen.analysis.domain.python.SyntaxTree;

import java.util.List;
import java.util.Locale;

/**
 * Detects a module-level {@code if __name__ == "__main__":} guard.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ExecutabilityDetector {

    /**
     * Checks whether the module runs code when executed as a script.
     *
     * @param tree the parsed source, never null
     * @return true if a main guard is present at module level
     */
    public boolean isExecutable(final SyntaxTree tree) {
        for (final SyntaxNode statement : tree.topLevelStatements()) {
            if (statement.is(PythonNodeTypes.IF_STATEMENT)
                    && isMainGuard(statement.namedChildren().get(0))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isMainGuard(final SyntaxNode condition) {
        final List<SyntaxNode> parts = condition.children();
        if (!condition.is(PythonNodeTypes.COMPARISON_OPERATOR)
                || parts.size() != 3 || !parts.get(1).is("==")) {
            return false;
        }
        final SyntaxNode left = parts.get(0);
        final SyntaxNode right = parts.get(2);
        return (isNameVariable(left) && isMainLiteral(right))
                || (isMainLiteral(left) && isNameVariable(right));
    }

    private static boolean isNameVariable(final SyntaxNode node) {
        return node.is(PythonNodeTypes.IDENTIFIER)
                && "__name__".equals(node.text());
    }

    /** A plain, non-formatted string whose content is {@code __main__}. */
    private static boolean isMainLiteral(final SyntaxNode node) {
        if (!node.is(PythonNodeTypes.STRING)) {
            return false;
        }
        final StringBuilder content = new StringBuilder();
        for (final SyntaxNode part : node.children()) {
            if (part.is(PythonNodeTypes.STRING_START)) {
                if (part.text().toLowerCase(Locale.ROOT).contains("f")) {
                    return false;
                }
            } else if (part.is(PythonNodeTypes.STRING_CONTENT)) {
                content.append(part.text());
            } else if (!part.is(PythonNodeTypes.STRING_END)) {
                return false;
            }
        }
        return "__main__".equals(content.toString());
    }

}
