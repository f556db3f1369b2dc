package co.fanki.recipegen.cli;

import co.fanki.recipegen.analysis.domain.AnalysisResult;
import co.fanki.recipegen.analysis.domain.AppType;
import co.fanki.recipegen.recipe.application.GeneratedRecipe;
import co.fanki.recipegen.recipe.application.RecipeGenerationService;
import co.fanki.recipegen.shared.DomainException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: recipegen generate &lt;source&gt;.
 *
 * <p>Analyzes a Python file and writes its container recipe. Exits with 1
 * when the source is missing or invalid, or the recipe cannot be
 * written.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Command(name = "generate", mixinStandardHelpOptions = true,
        description = "Generate the container recipe of a Python file")
@Component
public class GenerateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "The Python source file")
    private Path source;

    @Option(names = {"-o", "--output"},
            description = "Recipe path, relative to the source directory"
                    + " (default: Dockerfile)")
    private Path output;

    @Option(names = {"-s", "--scan-imports"},
            description = "Include local modules in version detection")
    private boolean scanImports;

    @Option(names = "--archive",
            description = "Also store the recipe in the archive")
    private boolean archive;

    private final RecipeGenerationService generationService;

    /**
     * Creates a new GenerateCommand.
     *
     * @param theGenerationService the recipe generation service
     */
    public GenerateCommand(final RecipeGenerationService theGenerationService) {
        this.generationService = theGenerationService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Analyzing " + source + "...");

        final GeneratedRecipe generated;
        try {
            generated = generationService.generate(source, output,
                    scanImports, archive);
        } catch (DomainException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (UncheckedIOException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        final AnalysisResult analysis = generated.analysis();
        ConsoleOutput.info("Python " + analysis.version() + " (detected via "
                + analysis.versionDetectionMethod().label() + ")");
        ConsoleOutput.info("Application type: " + analysis.appType().label());
        ConsoleOutput.info("Requirements: " + (analysis.requirements().isEmpty()
                ? "none" : String.join(", ", analysis.requirements()))
                + (analysis.manifestPresent() ? " (requirements.txt)" : ""));
        if (analysis.appType() == AppType.SCRIPT && !analysis.executable()) {
            ConsoleOutput.warning("No __main__ guard found:"
                    + " the container may exit immediately");
        }
        ConsoleOutput.success("Recipe written to " + generated.outputPath());
        generated.archived().ifPresent(record -> ConsoleOutput.success(
                "Archived as #" + record.id()));
        return 0;
    }

}
