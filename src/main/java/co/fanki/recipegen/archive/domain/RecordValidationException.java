package co.fanki.recipegen.archive.domain;

import co.fanki.recipegen.shared.DomainException;

/**
 * Thrown when a recipe record is rejected before being stored.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class RecordValidationException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new validation exception.
     *
     * @param message what is wrong with the record
     */
    public RecordValidationException(final String message) {
        super(message, "VALIDATION_ERROR");
    }

}
