package co.fanki.recipegen.analysis.domain.python;

import co.fanki.recipegen.shared.Preconditions;

import java.nio.file.Path;

/**
 * A Python source file together with its text and syntax tree.
 *
 * <p>Lives only for the duration of one analysis.</p>
 *
 * @param path the file the source was read from
 * @param text the source text
 * @param tree the parsed syntax tree
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SourceUnit(Path path, String text, SyntaxTree tree) {

    public SourceUnit {
        Preconditions.requireNonNull(path, "Source path is required");
        Preconditions.requireNonNull(text, "Source text is required");
        Preconditions.requireNonNull(tree, "Syntax tree is required");
    }

    /**
     * Parses the given text into a source unit.
     *
     * @param path the file the text was read from, never null
     * @param text the source text, never null
     * @return the parsed unit
     * @throws SourceParseException if the text is not valid Python
     */
    public static SourceUnit parse(final Path path, final String text) {
        return new SourceUnit(path, text, PythonParser.parse(text));
    }

    /**
     * Returns the file name of the source, e.g. {@code app.py}.
     *
     * @return the file name
     */
    public String fileName() {
        return path.getFileName().toString();
    }

}
