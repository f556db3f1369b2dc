package co.fanki.recipegen.analysis.domain.python;

import co.fanki.recipegen.shared.Preconditions;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Parses Python 3 source with the tree-sitter Python grammar.
 *
 * <p>The grammar covers Python 3 through 3.12: soft keywords
 * ({@code match}, {@code case}, {@code type}), {@code except*}, and
 * PEP 701 f-strings whose replacement fields are parsed as expressions.
 * Parsing is all or nothing: if tree-sitter had to recover from any
 * error, the tree holds a Python 2 statement, or a module or block breaks
 * the indentation rules the grammar tolerates, the parse fails with a
 * {@link SourceParseException} located at the first offending node.</p>
 *
 * <p>The tree-sitter tree is copied into {@link SyntaxNode}s with an
 * explicit stack, so nesting depth is bounded only by the heap.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PythonParser {

    private static final TSLanguage PYTHON = new TreeSitterPython();

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /** Extras that carry nothing the analysis reads. */
    private static final Set<String> SKIPPED = Set.of(
            PythonNodeTypes.COMMENT, PythonNodeTypes.LINE_CONTINUATION);

    private static final Set<String> PYTHON2_STATEMENTS = Set.of(
            PythonNodeTypes.PRINT_STATEMENT, PythonNodeTypes.EXEC_STATEMENT);

    private PythonParser() {
    }

    /**
     * Parses Python source text into a syntax tree.
     *
     * @param source the source text, never null
     * @return the syntax tree
     * @throws SourceParseException if the text is not valid Python 3
     */
    public static SyntaxTree parse(final String source) {
        Preconditions.requireNonNull(source, "Source is required");
        final String text = !source.isEmpty()
                && source.charAt(0) == BYTE_ORDER_MARK
                ? source.substring(1) : source;

        // TSParser is not thread safe, one per call.
        final TSParser parser = new TSParser();
        parser.setLanguage(PYTHON);
        final TSTree tree = parser.parseString(null, text);
        final SourceBytes bytes = new SourceBytes(text);
        final TSNode root = tree.getRootNode();
        if (root.hasError()) {
            throw syntaxError(root, bytes);
        }
        return new SyntaxTree(convert(root, bytes));
    }

    /** Copies the tree-sitter tree, post-order, without recursion. */
    private static SyntaxNode convert(final TSNode root,
            final SourceBytes bytes) {
        final Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root));
        SyntaxNode result = null;
        while (!stack.isEmpty()) {
            final Frame frame = stack.peek();
            if (frame.next < frame.node.getChildCount()) {
                final TSNode child = frame.node.getChild(frame.next++);
                if (!SKIPPED.contains(child.getType())) {
                    stack.push(new Frame(child));
                }
                continue;
            }
            stack.pop();
            final SyntaxNode node = toSyntaxNode(frame, bytes);
            if (stack.isEmpty()) {
                result = node;
            } else {
                stack.peek().children.add(node);
            }
        }
        return result;
    }

    private static SyntaxNode toSyntaxNode(final Frame frame,
            final SourceBytes bytes) {
        final TSNode node = frame.node;
        final TSPoint start = node.getStartPoint();
        final int line = start.getRow() + 1;
        final int column = bytes.column(start, node.getStartByte());
        if (PYTHON2_STATEMENTS.contains(node.getType())) {
            throw new SourceParseException(
                    "Python 2 statement '" + node.getType() + "'",
                    line, column);
        }
        if (PythonNodeTypes.MODULE.equals(node.getType())
                || PythonNodeTypes.BLOCK.equals(node.getType())) {
            checkLayout(node, bytes);
        }
        final String text = frame.children.isEmpty()
                || PythonNodeTypes.STRING_CONTENT.equals(node.getType())
                ? bytes.slice(node.getStartByte(), node.getEndByte())
                : null;
        return new SyntaxNode(node.getType(), node.isNamed(), text, line,
                column, frame.children);
    }

    /**
     * Checks that every statement starting a line is aligned with the
     * first one, at column zero for the module, and that a block is not
     * empty.
     */
    private static void checkLayout(final TSNode node,
            final SourceBytes bytes) {
        final boolean module = PythonNodeTypes.MODULE.equals(node.getType());
        int indent = module ? 0 : -1;
        int previousEndRow = -1;
        boolean empty = true;
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            final TSNode statement = node.getNamedChild(i);
            if (SKIPPED.contains(statement.getType())) {
                continue;
            }
            empty = false;
            final TSPoint start = statement.getStartPoint();
            if (start.getRow() > previousEndRow) {
                if (indent < 0) {
                    indent = start.getColumn();
                } else if (start.getColumn() != indent) {
                    throw new SourceParseException(
                            start.getColumn() > indent
                                    ? "unexpected indent"
                                    : "unindent does not match any outer"
                                            + " indentation level",
                            start.getRow() + 1,
                            bytes.column(start, statement.getStartByte()));
                }
            }
            previousEndRow = statement.getEndPoint().getRow();
        }
        if (!module && empty) {
            final TSPoint start = node.getStartPoint();
            throw new SourceParseException("expected an indented block",
                    start.getRow() + 1,
                    bytes.column(start, node.getStartByte()));
        }
    }

    /**
     * Locates the first error or missing node, following only the
     * subtrees that report an error.
     */
    private static SourceParseException syntaxError(final TSNode root,
            final SourceBytes bytes) {
        TSNode node = root;
        boolean descended = true;
        while (descended && !isErrorNode(node)) {
            descended = false;
            for (int i = 0; i < node.getChildCount(); i++) {
                final TSNode child = node.getChild(i);
                if (isErrorNode(child) || child.hasError()) {
                    node = child;
                    descended = true;
                    break;
                }
            }
        }
        final TSPoint start = node.getStartPoint();
        final String message = node.isMissing()
                ? "expected '" + node.getType() + "'"
                : "invalid syntax" + near(node, bytes);
        return new SourceParseException(message, start.getRow() + 1,
                bytes.column(start, node.getStartByte()));
    }

    private static boolean isErrorNode(final TSNode node) {
        return node.isMissing()
                || PythonNodeTypes.ERROR.equals(node.getType());
    }

    private static String near(final TSNode node, final SourceBytes bytes) {
        final String text = bytes.slice(node.getStartByte(),
                node.getEndByte()).strip();
        if (text.isEmpty()) {
            return "";
        }
        final int end = text.indexOf('\n');
        return " near '" + (end < 0 ? text : text.substring(0, end)) + "'";
    }

    private static final class Frame {

        private final TSNode node;

        private final List<SyntaxNode> children = new ArrayList<>();

        private int next;

        private Frame(final TSNode theNode) {
            this.node = theNode;
        }
    }

    /**
     * The UTF-8 form of the source, which is what tree-sitter offsets
     * and columns count in.
     */
    private static final class SourceBytes {

        private final byte[] utf8;

        private final boolean ascii;

        private SourceBytes(final String text) {
            this.utf8 = text.getBytes(StandardCharsets.UTF_8);
            this.ascii = utf8.length == text.length();
        }

        private String slice(final int startByte, final int endByte) {
            return new String(utf8, startByte, endByte - startByte,
                    StandardCharsets.UTF_8);
        }

        /** Converts a byte column into a character column. */
        private int column(final TSPoint point, final int startByte) {
            final int byteColumn = point.getColumn();
            if (ascii) {
                return byteColumn;
            }
            return slice(startByte - byteColumn, startByte).length();
        }
    }

}
