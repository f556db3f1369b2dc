package co.fanki.recipegen.analysis.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Determines the packages to install for a source.
 *
 * <p>A {@value #MANIFEST_FILE_NAME} beside the source is authoritative:
 * its lines, with comments and blanks removed, are used in declared order
 * and the imports are not consulted. Without one, the third-party imports
 * become the requirements, as bare names in lexical order.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class RequirementsResolver {

    private static final Logger LOG = LoggerFactory.getLogger(
            RequirementsResolver.class);

    /** The manifest looked up beside the source. */
    public static final String MANIFEST_FILE_NAME = "requirements.txt";

    /**
     * Resolves the requirements of a source.
     *
     * @param sourceFile the analyzed file, never null
     * @param imports the imports of the source, never null
     * @return the requirements
     * @throws UncheckedIOException if the manifest exists but cannot be read
     */
    public ResolvedRequirements resolve(final Path sourceFile,
            final ImportSet imports) {
        final Path directory = sourceFile.toAbsolutePath().getParent();
        final Path manifest = directory.resolve(MANIFEST_FILE_NAME);

        if (Files.isRegularFile(manifest)) {
            final List<String> specifiers = readManifest(manifest);
            LOG.debug("Using {} requirement(s) from {}", specifiers.size(),
                    manifest);
            return new ResolvedRequirements(specifiers, true);
        }

        LOG.debug("No {} beside {}; using third-party imports",
                MANIFEST_FILE_NAME, sourceFile.getFileName());
        return new ResolvedRequirements(new ArrayList<>(imports.thirdParty()),
                false);
    }

    private List<String> readManifest(final Path manifest) {
        final String content;
        try {
            content = new String(Files.readAllBytes(manifest),
                    StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read " + manifest, e);
        }

        final List<String> specifiers = new ArrayList<>();
        content.lines()
                .map(RequirementsResolver::stripComment)
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .forEach(specifiers::add);
        return specifiers;
    }

    /**
     * Removes a trailing comment. A {@code #} starts a comment at the start
     * of a line or after whitespace; elsewhere it belongs to the specifier,
     * as in URL fragments.
     */
    static String stripComment(final String line) {
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == '#'
                    && (i == 0 || Character.isWhitespace(line.charAt(i - 1)))) {
                return line.substring(0, i);
            }
        }
        return line;
    }

}
