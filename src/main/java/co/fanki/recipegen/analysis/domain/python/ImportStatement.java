package co.fanki.recipegen.analysis.domain.python;

import co.fanki.recipegen.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One imported module, as written in an import statement.
 *
 * <p>{@code import a.b, c} yields two statements, {@code a.b} and
 * {@code c}, without names. {@code from a.b import c, d as e} yields one
 * statement for {@code a.b} with the names {@code c} and {@code d}; a star
 * import has the single name {@code *}. A relative import
 * ({@code from . import x}, {@code from ..pkg import y}) keeps the module
 * path after its dots, possibly empty.</p>
 *
 * @param module the dotted module name
 * @param relative whether the import is relative to the importing package
 * @param names the imported names of a from-import, empty otherwise
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportStatement(String module, boolean relative,
        List<String> names) {

    /** The name of a star import. */
    public static final String WILDCARD = "*";

    private static final String FUTURE = "__future__";

    public ImportStatement {
        Preconditions.requireNonNull(module, "Module is required");
        names = List.copyOf(Preconditions.requireNonNull(names,
                "Names are required"));
    }

    /**
     * Collects the import statements anywhere in the tree, nested ones
     * included, in source order.
     *
     * @param tree the parsed source, never null
     * @return the imports
     */
    public static List<ImportStatement> collect(final SyntaxTree tree) {
        final List<ImportStatement> imports = new ArrayList<>();
        for (final SyntaxNode node : tree.walk()) {
            if (node.is(PythonNodeTypes.IMPORT_STATEMENT)) {
                for (final SyntaxNode name : node.namedChildren()) {
                    imports.add(new ImportStatement(importedName(name), false,
                            List.of()));
                }
            } else if (node.is(PythonNodeTypes.IMPORT_FROM_STATEMENT)) {
                imports.add(fromImport(node));
            } else if (node.is(PythonNodeTypes.FUTURE_IMPORT_STATEMENT)) {
                imports.add(new ImportStatement(FUTURE, false,
                        names(node.namedChildren())));
            }
        }
        return imports;
    }

    private static ImportStatement fromImport(final SyntaxNode node) {
        final List<SyntaxNode> parts = node.namedChildren();
        final SyntaxNode source = parts.get(0);
        final List<String> names = names(parts.subList(1, parts.size()));
        if (source.is(PythonNodeTypes.RELATIVE_IMPORT)) {
            final String module = source.firstChild(PythonNodeTypes.DOTTED_NAME)
                    .map(ImportStatement::dottedName).orElse("");
            return new ImportStatement(module, true, names);
        }
        return new ImportStatement(dottedName(source), false, names);
    }

    private static List<String> names(final List<SyntaxNode> nodes) {
        final List<String> names = new ArrayList<>();
        for (final SyntaxNode node : nodes) {
            names.add(node.is(PythonNodeTypes.WILDCARD_IMPORT)
                    ? WILDCARD : importedName(node));
        }
        return names;
    }

    /** Reads a dotted_name, or the name of an aliased_import. */
    private static String importedName(final SyntaxNode node) {
        if (node.is(PythonNodeTypes.ALIASED_IMPORT)) {
            return dottedName(node.namedChildren().get(0));
        }
        return dottedName(node);
    }

    private static String dottedName(final SyntaxNode node) {
        if (node.is(PythonNodeTypes.IDENTIFIER)) {
            return node.text();
        }
        return node.namedChildren().stream()
                .map(SyntaxNode::text)
                .collect(Collectors.joining("."));
    }

}
