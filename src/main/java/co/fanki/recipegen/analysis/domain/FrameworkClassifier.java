package co.fanki.recipegen.analysis.domain;

import co.fanki.recipegen.shared.Preconditions;

import java.util.List;

/**
 * Classifies a source by the web framework it imports.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FrameworkClassifier {

    private final List<FrameworkSignature> signatures;

    /** Creates a classifier over all known signatures in priority order. */
    public FrameworkClassifier() {
        this(List.of(FrameworkSignature.values()));
    }

    /**
     * Creates a classifier over the given signatures.
     *
     * @param theSignatures the signatures in priority order, never null
     */
    public FrameworkClassifier(final List<FrameworkSignature> theSignatures) {
        this.signatures = List.copyOf(Preconditions.requireNonNull(
                theSignatures, "Signatures are required"));
    }

    /**
     * Returns the application type of the first signature whose marker is a
     * third-party import, or {@link AppType#SCRIPT} when none is.
     *
     * @param imports the source imports, never null
     * @return the application type
     */
    public AppType classify(final ImportSet imports) {
        for (final FrameworkSignature signature : signatures) {
            if (imports.importsThirdParty(signature.markerImport())) {
                return signature.appType();
            }
        }
        return AppType.SCRIPT;
    }

}
