package co.fanki.recipegen.analysis.domain.version;

import co.fanki.recipegen.analysis.domain.python.PythonNodeTypes;
import co.fanki.recipegen.analysis.domain.python.SyntaxNode;

import java.util.function.Predicate;

/**
 * Syntax features that imply a minimum Python version.
 *
 * <p>Declared newest first. The heuristic takes the highest minimum among
 * the rules that match any node of the tree.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum VersionFeatureRule {

    /** {@code match subject: case ...}. */
    MATCH_STATEMENT("match-statement", PythonVersion.of(3, 10),
            node -> node.is(PythonNodeTypes.MATCH_STATEMENT)),

    /**
     * The walrus operator, {@code (n := len(x))}, also inside f-string
     * replacement fields.
     */
    ASSIGNMENT_EXPRESSION("assignment-expression", PythonVersion.of(3, 8),
            node -> node.is(PythonNodeTypes.NAMED_EXPRESSION)),

    /** {@code f"{value=}"}: a replacement field with a trailing '='. */
    SELF_DOCUMENTING_FSTRING("fstring-self-doc", PythonVersion.of(3, 8),
            node -> node.is(PythonNodeTypes.INTERPOLATION)
                    && node.children().stream().anyMatch(
                            part -> !part.isNamed() && part.is("="))),

    /** The {@code /} marker in {@code def f(a, /, b)}. */
    POSITIONAL_ONLY_PARAMETERS("positional-only-parameters",
            PythonVersion.of(3, 8),
            node -> node.is(PythonNodeTypes.POSITIONAL_SEPARATOR));

    private final String featureId;

    private final PythonVersion minimumVersion;

    private final Predicate<SyntaxNode> detector;

    VersionFeatureRule(final String theFeatureId,
            final PythonVersion theMinimumVersion,
            final Predicate<SyntaxNode> theDetector) {
        this.featureId = theFeatureId;
        this.minimumVersion = theMinimumVersion;
        this.detector = theDetector;
    }

    public String featureId() {
        return featureId;
    }

    public PythonVersion minimumVersion() {
        return minimumVersion;
    }

    /**
     * Checks whether the node uses this feature.
     *
     * @param node the node to inspect, never null
     * @return true if the node is an instance of the feature
     */
    public boolean matches(final SyntaxNode node) {
        return detector.test(node);
    }

}
