package co.fanki.recipegen.analysis.domain.version;

/**
 * How a Python version was determined.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum VersionDetectionMethod {

    /** Reported by the external semantic analyzer. */
    ANALYZER("analyzer"),

    /** Derived from syntax feature rules. */
    HEURISTIC("heuristic");

    private final String label;

    VersionDetectionMethod(final String theLabel) {
        this.label = theLabel;
    }

    /**
     * Returns the lowercase name used in recipe comments and output.
     *
     * @return the label
     */
    public String label() {
        return label;
    }

}
