package co.fanki.recipegen.analysis.domain.python;

import co.fanki.recipegen.shared.Preconditions;

import java.util.List;
import java.util.Optional;

/**
 * A node of the Python syntax tree.
 *
 * <p>The {@code type} is the grammar's node type, e.g.
 * {@code import_statement} or {@code identifier}. Anonymous nodes are the
 * grammar's literal tokens such as {@code "=="} or {@code "="}; their type
 * is the token itself. Leaves and string contents carry {@code text}, the
 * exact source slice they cover; other inner nodes have a null text.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SyntaxNode {

    private final String type;

    private final boolean named;

    private final String text;

    private final int line;

    private final int column;

    private final List<SyntaxNode> children;

    /**
     * Creates a new node.
     *
     * @param theType the grammar node type, never null
     * @param isNamed whether the grammar names this node
     * @param theText the source slice, null for most inner nodes
     * @param theLine the 1-based line where the node starts
     * @param theColumn the 0-based column where the node starts
     * @param theChildren the child nodes, never null
     */
    public SyntaxNode(final String theType, final boolean isNamed,
            final String theText, final int theLine, final int theColumn,
            final List<SyntaxNode> theChildren) {
        this.type = Preconditions.requireNonNull(theType, "Type is required");
        this.named = isNamed;
        this.text = theText;
        this.line = theLine;
        this.column = theColumn;
        this.children = List.copyOf(Preconditions.requireNonNull(theChildren,
                "Children are required"));
    }

    public String type() {
        return type;
    }

    public boolean isNamed() {
        return named;
    }

    public String text() {
        return text;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public List<SyntaxNode> children() {
        return children;
    }

    /**
     * Returns the named children, skipping punctuation and keywords.
     *
     * @return the named children in source order
     */
    public List<SyntaxNode> namedChildren() {
        return children.stream().filter(SyntaxNode::isNamed).toList();
    }

    /**
     * Returns the first named child of the given type.
     *
     * @param theType the node type to look for
     * @return the child, empty if there is none
     */
    public Optional<SyntaxNode> firstChild(final String theType) {
        return children.stream().filter(child -> child.is(theType))
                .findFirst();
    }

    /**
     * Checks whether some direct child, named or anonymous, has the type.
     *
     * @param theType the node type to look for
     * @return true if such a child exists
     */
    public boolean hasChild(final String theType) {
        return firstChild(theType).isPresent();
    }

    /**
     * Checks the type of this node.
     *
     * @param theType the type to compare
     * @return true if this node has that type
     */
    public boolean is(final String theType) {
        return type.equals(theType);
    }

    /**
     * Returns the concatenated text of every leaf under this node.
     *
     * @return the source text the node covers, without the whitespace
     *      between tokens
     */
    public String leafText() {
        if (text != null) {
            return text;
        }
        final StringBuilder builder = new StringBuilder();
        children.forEach(child -> builder.append(child.leafText()));
        return builder.toString();
    }

    @Override
    public String toString() {
        return text == null
                ? type + "@" + line + ":" + column
                : type + "(" + text + ")@" + line + ":" + column;
    }

}
