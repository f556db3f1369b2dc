package co.fanki.recipegen.analysis.domain.version;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the version detection strategy.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class VersionDetectors {

    private static final Logger LOG = LoggerFactory.getLogger(
            VersionDetectors.class);

    private VersionDetectors() {
        // Utility class, not instantiable
    }

    /**
     * Returns the analyzer when it is enabled and available, otherwise the
     * heuristic. Meant to be called once, when the pipeline is built.
     *
     * @param analyzerEnabled whether the analyzer may be used
     * @param analyzer the external analyzer detector, never null
     * @param heuristic the heuristic detector, never null
     * @return the selected detector
     */
    public static VersionDetector select(final boolean analyzerEnabled,
            final VersionDetector analyzer,
            final VersionDetector heuristic) {
        if (analyzerEnabled && analyzer.isAvailable()) {
            LOG.info("Python version detection: external analyzer");
            return analyzer;
        }
        LOG.info("Python version detection: syntax heuristic{}",
                analyzerEnabled ? " (analyzer not available)" : "");
        return heuristic;
    }

}
