package co.fanki.recipegen.analysis.domain.version;

import co.fanki.recipegen.analysis.domain.python.SourceUnit;

/**
 * Strategy that determines the minimum Python version a source requires.
 *
 * <p>Implementations never fail: when they cannot decide they answer with
 * {@link PythonVersion#MINIMUM_SUPPORTED}, or delegate to a fallback.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface VersionDetector {

    /**
     * Checks whether this detector can run in the current environment.
     *
     * @return true if the detector is usable
     */
    boolean isAvailable();

    /**
     * Detects the minimum Python version of the source.
     *
     * @param source the parsed source, never null
     * @param scanLocalImports whether modules imported from the source's
     *     directory should be analyzed too
     * @return the detected version and method, never null
     */
    VersionDetection detect(SourceUnit source, boolean scanLocalImports);

}
