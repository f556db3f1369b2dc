package co.fanki.recipegen.analysis.domain;

import java.util.Locale;

/**
 * The kind of application a source is.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum AppType {

    SCRIPT,
    FLASK,
    DJANGO,
    FASTAPI,
    STREAMLIT;

    /**
     * Returns the lowercase name, e.g. {@code fastapi}.
     *
     * @return the label
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

}
