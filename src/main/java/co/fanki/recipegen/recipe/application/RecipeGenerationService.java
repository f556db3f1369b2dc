package co.fanki.recipegen.recipe.application;

import co.fanki.recipegen.analysis.domain.AnalysisResult;
import co.fanki.recipegen.analysis.domain.MissingSourceException;
import co.fanki.recipegen.analysis.domain.SourceAnalyzer;
import co.fanki.recipegen.analysis.domain.python.SourceParseException;
import co.fanki.recipegen.archive.application.RecipeArchiveService;
import co.fanki.recipegen.archive.domain.RecipeRecord;
import co.fanki.recipegen.recipe.domain.Recipe;
import co.fanki.recipegen.recipe.domain.RecipeSynthesizer;
import co.fanki.recipegen.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Generates the container recipe for a Python source file.
 *
 * <p>Analyzes the source, synthesizes the recipe, writes it to disk and
 * optionally archives it. Nothing is written when the analysis fails.
 * The archive is only looked up when archiving is requested, so a plain
 * generation never opens the archive database.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class RecipeGenerationService {

    private static final Logger LOG = LoggerFactory.getLogger(
            RecipeGenerationService.class);

    private final SourceAnalyzer sourceAnalyzer;

    private final RecipeSynthesizer recipeSynthesizer;

    private final ObjectProvider<RecipeArchiveService> archiveService;

    private final String defaultOutputFilename;

    /**
     * Creates a new RecipeGenerationService.
     *
     * @param theSourceAnalyzer the source analyzer
     * @param theRecipeSynthesizer the recipe synthesizer
     * @param theArchiveService provides the archive, only asked for when
     *     archiving is requested
     * @param theDefaultOutputFilename the recipe file name used when no
     *     output path is given
     */
    public RecipeGenerationService(final SourceAnalyzer theSourceAnalyzer,
            final RecipeSynthesizer theRecipeSynthesizer,
            final ObjectProvider<RecipeArchiveService> theArchiveService,
            @Value("${recipegen.recipe.output-filename:Dockerfile}")
            final String theDefaultOutputFilename) {
        this.sourceAnalyzer = Preconditions.requireNonNull(theSourceAnalyzer,
                "Source analyzer is required");
        this.recipeSynthesizer = Preconditions.requireNonNull(
                theRecipeSynthesizer, "Recipe synthesizer is required");
        this.archiveService = Preconditions.requireNonNull(theArchiveService,
                "Archive service is required");
        this.defaultOutputFilename = Preconditions.requireNonBlank(
                theDefaultOutputFilename, "Output filename is required");
    }

    /**
     * Generates and writes the recipe of a source file.
     *
     * @param sourceFile the Python file, never null
     * @param output where to write the recipe; null writes the default file
     *     name next to the source. Relative paths resolve against the
     *     source directory
     * @param scanLocalImports whether local modules take part in version
     *     detection
     * @param archive whether the written recipe is also archived
     * @return the generated recipe
     * @throws MissingSourceException if the source does not exist
     * @throws SourceParseException if the source is not valid Python
     * @throws UncheckedIOException if the recipe cannot be written
     */
    public GeneratedRecipe generate(final Path sourceFile, final Path output,
            final boolean scanLocalImports, final boolean archive) {
        Preconditions.requireNonNull(sourceFile, "Source file is required");

        final AnalysisResult analysis = sourceAnalyzer.analyze(sourceFile,
                scanLocalImports);
        final Recipe recipe = recipeSynthesizer.synthesize(analysis);
        final String content = recipe.render();

        final Path target = resolveOutput(sourceFile, output);
        write(target, content);
        LOG.info("Wrote recipe for {} to {}", analysis.sourceFilename(),
                target);

        Optional<RecipeRecord> archived = Optional.empty();
        if (archive) {
            archived = Optional.of(archiveService.getObject().create(
                    target.getFileName().toString(), content));
        }
        return new GeneratedRecipe(analysis, content, target, archived);
    }

    /** Resolves where the recipe of a source goes. */
    Path resolveOutput(final Path sourceFile, final Path output) {
        final Path directory = sourceFile.toAbsolutePath().getParent();
        if (output == null) {
            return directory.resolve(defaultOutputFilename);
        }
        return directory.resolve(output).normalize();
    }

    private static void write(final Path target, final String content) {
        try {
            final Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot write " + target, e);
        }
    }

}
