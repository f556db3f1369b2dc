package co.fanki.recipegen.recipe.domain;

import co.fanki.recipegen.shared.Preconditions;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps Python packages to the OS packages needed to build them.
 *
 * <p>Package names are compared after stripping version specifiers,
 * extras and environment markers, ignoring case and treating {@code -},
 * {@code _} and {@code .} alike. The result is the sorted union over all
 * requirements, so adding a requirement never removes a system
 * package.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SystemDependencyResolver {

    /** Build packages per normalized Python package name. */
    public static final Map<String, Set<String>> DEFAULT_TABLE = Map.of(
            "numpy", Set.of("gcc"),
            "pandas", Set.of("gcc"),
            "scipy", Set.of("gcc"),
            "pillow", Set.of("gcc", "libjpeg-dev", "zlib1g-dev"),
            "psycopg2", Set.of("gcc", "libpq-dev"),
            "mysqlclient", Set.of("gcc", "default-libmysqlclient-dev",
                    "pkg-config"),
            "lxml", Set.of("gcc", "libxml2-dev", "libxslt1-dev"));

    private static final Pattern PACKAGE_NAME = Pattern.compile(
            "^\\s*([A-Za-z0-9](?:[A-Za-z0-9._-]*[A-Za-z0-9])?)");

    private final Map<String, Set<String>> table;

    /** Creates a resolver over {@link #DEFAULT_TABLE}. */
    public SystemDependencyResolver() {
        this(DEFAULT_TABLE);
    }

    /**
     * Creates a resolver over the given table.
     *
     * @param theTable OS packages keyed by normalized package name
     */
    public SystemDependencyResolver(final Map<String, Set<String>> theTable) {
        this.table = Preconditions.requireNonNull(theTable,
                "System dependency table is required");
    }

    /**
     * Resolves the OS packages the requirements need.
     *
     * @param requirements the requirement specifiers, never null
     * @return the sorted OS package names, empty when none is needed
     */
    public List<String> resolve(final List<String> requirements) {
        final Set<String> packages = new TreeSet<>();
        for (final String requirement : requirements) {
            packageName(requirement)
                    .map(table::get)
                    .ifPresent(packages::addAll);
        }
        return List.copyOf(packages);
    }

    /**
     * Extracts the normalized package name of a requirement specifier,
     * e.g. {@code psycopg2} from {@code Psycopg2[binary]>=2.9; python_version>"3"}.
     *
     * @param specifier the requirement line
     * @return the name, or empty for option lines such as {@code -e .}
     */
    static Optional<String> packageName(final String specifier) {
        final Matcher matcher = PACKAGE_NAME.matcher(specifier);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1).toLowerCase(Locale.ROOT)
                .replaceAll("[-_.]+", "-"));
    }

}
