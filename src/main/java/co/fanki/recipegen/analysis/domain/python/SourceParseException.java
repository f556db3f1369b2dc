package co.fanki.recipegen.analysis.domain.python;

import co.fanki.recipegen.shared.DomainException;

/**
 * Thrown when Python source is not syntactically valid.
 *
 * <p>Parsing is all or nothing: when this exception is raised no syntax
 * tree exists, so nothing downstream (imports, version, recipe) is ever
 * computed from a partial parse.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceParseException extends DomainException {

    private static final long serialVersionUID = 1L;

    private final int line;

    private final int column;

    /**
     * Creates a new parse exception.
     *
     * @param message the syntax error description
     * @param theLine the 1-based line of the error
     * @param theColumn the 0-based column of the error
     */
    public SourceParseException(final String message, final int theLine,
            final int theColumn) {
        super(message + " (line " + theLine + ", column " + theColumn + ")",
                "PARSE_ERROR");
        this.line = theLine;
        this.column = theColumn;
    }

    /**
     * Returns the 1-based line where the error was detected.
     *
     * @return the line number
     */
    public int line() {
        return line;
    }

    /**
     * Returns the 0-based column where the error was detected.
     *
     * @return the column number
     */
    public int column() {
        return column;
    }

}
