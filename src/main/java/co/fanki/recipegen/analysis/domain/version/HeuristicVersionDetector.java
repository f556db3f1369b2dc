package co.fanki.recipegen.analysis.domain.version;

import co.fanki.recipegen.analysis.domain.python.SourceUnit;
import co.fanki.recipegen.analysis.domain.python.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Detects the Python version from syntax features of the parsed tree.
 *
 * <p>Every {@link VersionFeatureRule} is evaluated against every node; the
 * highest minimum version among the matching rules wins, and
 * {@link PythonVersion#MINIMUM_SUPPORTED} applies when none match. Only the
 * given file is inspected: the local import scan flag has no effect
 * here.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class HeuristicVersionDetector implements VersionDetector {

    private static final Logger LOG = LoggerFactory.getLogger(
            HeuristicVersionDetector.class);

    private final List<VersionFeatureRule> rules;

    /** Creates a detector over all known feature rules. */
    public HeuristicVersionDetector() {
        this(List.of(VersionFeatureRule.values()));
    }

    /**
     * Creates a detector over the given rules.
     *
     * @param theRules the rules to evaluate, never null
     */
    public HeuristicVersionDetector(final List<VersionFeatureRule> theRules) {
        this.rules = List.copyOf(theRules);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public VersionDetection detect(final SourceUnit source,
            final boolean scanLocalImports) {
        final Set<VersionFeatureRule> matched = EnumSet.noneOf(
                VersionFeatureRule.class);
        for (final SyntaxNode node : source.tree().walk()) {
            for (final VersionFeatureRule rule : rules) {
                if (!matched.contains(rule) && rule.matches(node)) {
                    matched.add(rule);
                }
            }
        }

        PythonVersion version = PythonVersion.MINIMUM_SUPPORTED;
        for (final VersionFeatureRule rule : matched) {
            version = version.max(rule.minimumVersion());
        }

        LOG.debug("Features in {}: {}; minimum version {}",
                source.fileName(), matched, version);

        return new VersionDetection(version, VersionDetectionMethod.HEURISTIC);
    }

}
