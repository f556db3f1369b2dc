package co.fanki.recipegen.analysis.domain.python;

/**
 * Node type names of the tree-sitter Python grammar read by the analysis.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PythonNodeTypes {

    public static final String MODULE = "module";
    public static final String BLOCK = "block";
    public static final String COMMENT = "comment";
    public static final String LINE_CONTINUATION = "line_continuation";
    public static final String ERROR = "ERROR";

    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    public static final String FUTURE_IMPORT_STATEMENT =
            "future_import_statement";
    public static final String DOTTED_NAME = "dotted_name";
    public static final String ALIASED_IMPORT = "aliased_import";
    public static final String RELATIVE_IMPORT = "relative_import";
    public static final String WILDCARD_IMPORT = "wildcard_import";

    public static final String IF_STATEMENT = "if_statement";
    public static final String COMPARISON_OPERATOR = "comparison_operator";
    public static final String IDENTIFIER = "identifier";
    public static final String STRING = "string";
    public static final String STRING_START = "string_start";
    public static final String STRING_CONTENT = "string_content";
    public static final String STRING_END = "string_end";
    public static final String ESCAPE_SEQUENCE = "escape_sequence";
    public static final String INTERPOLATION = "interpolation";

    public static final String MATCH_STATEMENT = "match_statement";
    public static final String NAMED_EXPRESSION = "named_expression";
    public static final String POSITIONAL_SEPARATOR = "positional_separator";
    public static final String TYPE_ALIAS_STATEMENT = "type_alias_statement";
    public static final String FUNCTION_DEFINITION = "function_definition";

    /** Python 2 statements the grammar still recognizes. */
    public static final String PRINT_STATEMENT = "print_statement";
    public static final String EXEC_STATEMENT = "exec_statement";

    private PythonNodeTypes() {
    }

}
