package co.fanki.recipegen.archive.domain;

import co.fanki.recipegen.shared.DomainException;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Thrown when a record with the same name, date and time already exists.
 * The existing record is never overwritten.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DuplicateRecordException extends DomainException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new duplicate exception.
     *
     * @param name the record name
     * @param date the creation date
     * @param time the creation time
     * @param cause the constraint violation
     */
    public DuplicateRecordException(final String name, final LocalDate date,
            final LocalTime time, final Throwable cause) {
        super("Recipe '" + name + "' already exists for " + date + " "
                + time, "DUPLICATE_ENTRY", cause);
    }

}
