package co.fanki.recipegen.analysis.domain;

import co.fanki.recipegen.shared.DomainException;

import java.nio.file.Path;

/**
 * Thrown when the file to analyze or archive does not exist.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MissingSourceException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception for the given path.
     *
     * @param path the missing file
     */
    public MissingSourceException(final Path path) {
        super("File not found: " + path, "MISSING_SOURCE");
    }

}
