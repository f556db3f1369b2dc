package co.fanki.recipegen.analysis.domain;

import co.fanki.recipegen.analysis.domain.python.ImportStatement;
import co.fanki.recipegen.analysis.domain.python.SyntaxTree;
import co.fanki.recipegen.shared.Preconditions;

import java.util.HashSet;
import java.util.Set;

/**
 * Collects the top-level packages a source imports.
 *
 * <p>Every {@code import a.b.c} and {@code from a.b import c} anywhere in
 * the tree counts, including imports nested in functions, conditionals
 * and {@code try} blocks, and contributes {@code a}. Relative imports
 * ({@code from . import x}, {@code from .pkg import y}) refer to the
 * project itself and are skipped.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ImportExtractor {

    private final Set<String> standardLibrary;

    /** Creates an extractor over {@link StandardLibraryModules#NAMES}. */
    public ImportExtractor() {
        this(StandardLibraryModules.NAMES);
    }

    /**
     * Creates an extractor over the given standard library table.
     *
     * @param theStandardLibrary the standard library names, never null
     */
    public ImportExtractor(final Set<String> theStandardLibrary) {
        this.standardLibrary = Preconditions.requireNonNull(
                theStandardLibrary, "Standard library table is required");
    }

    /**
     * Extracts and classifies the imports of the tree.
     *
     * @param tree the parsed source, never null
     * @return the import set
     */
    public ImportSet extract(final SyntaxTree tree) {
        final Set<String> standard = new HashSet<>();
        final Set<String> thirdParty = new HashSet<>();

        for (final ImportStatement statement : ImportStatement.collect(tree)) {
            if (!statement.relative()) {
                classify(statement.module(), standard, thirdParty);
            }
        }
        return new ImportSet(standard, thirdParty);
    }

    private void classify(final String dottedName, final Set<String> standard,
            final Set<String> thirdParty) {
        final int dot = dottedName.indexOf('.');
        final String topLevel = dot < 0
                ? dottedName : dottedName.substring(0, dot);
        if (standardLibrary.contains(topLevel)) {
            standard.add(topLevel);
        } else {
            thirdParty.add(topLevel);
        }
    }

}
