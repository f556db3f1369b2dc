package co.fanki.recipegen.analysis.domain.python;

import co.fanki.recipegen.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * The parsed form of one Python source file.
 *
 * <p>Traversal uses an explicit worklist, so deeply nested trees never
 * exhaust the call stack.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SyntaxTree {

    private final SyntaxNode root;

    /**
     * Creates a tree over the given module node.
     *
     * @param theRoot the module node, never null
     */
    public SyntaxTree(final SyntaxNode theRoot) {
        Preconditions.requireNonNull(theRoot, "Root node is required");
        Preconditions.require(theRoot.is(PythonNodeTypes.MODULE),
                "Root node must be a module");
        this.root = theRoot;
    }

    public SyntaxNode root() {
        return root;
    }

    /**
     * Returns the statements at module level, in source order.
     *
     * @return the top-level statements
     */
    public List<SyntaxNode> topLevelStatements() {
        return root.namedChildren();
    }

    /**
     * Returns every node of the tree in pre-order (source order).
     *
     * @return all nodes, the root first
     */
    public List<SyntaxNode> walk() {
        final List<SyntaxNode> visited = new ArrayList<>();
        final Deque<SyntaxNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final SyntaxNode node = pending.pop();
            visited.add(node);
            final List<SyntaxNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return visited;
    }

    /**
     * Checks whether any node of the tree matches the predicate.
     *
     * @param predicate the condition to test, never null
     * @return true on the first matching node
     */
    public boolean anyMatch(final Predicate<SyntaxNode> predicate) {
        final Deque<SyntaxNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final SyntaxNode node = pending.pop();
            if (predicate.test(node)) {
                return true;
            }
            node.children().forEach(pending::push);
        }
        return false;
    }

}
