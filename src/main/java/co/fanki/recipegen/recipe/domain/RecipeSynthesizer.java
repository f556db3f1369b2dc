package co.fanki.recipegen.recipe.domain;

import co.fanki.recipegen.analysis.domain.AnalysisResult;
import co.fanki.recipegen.analysis.domain.AppType;
import co.fanki.recipegen.analysis.domain.FrameworkSignature;
import co.fanki.recipegen.analysis.domain.RequirementsResolver;
import co.fanki.recipegen.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the container recipe for an analyzed source.
 *
 * <p>The recipe is a pure function of the {@link AnalysisResult} and the
 * static tables: the same analysis always renders to the same bytes.</p>
 *
 * <p>Block order: base image, working directory, Python environment,
 * system packages (only when a requirement needs them), requirements
 * manifest and installation (omitted when there is neither a manifest nor
 * anything to install), application code, exposed port (frameworks
 * only), run command.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class RecipeSynthesizer {

    private static final String APP_DIRECTORY = "/app";

    private final SystemDependencyResolver systemDependencies;

    /**
     * Creates a new synthesizer.
     *
     * @param theSystemDependencies resolves OS build packages, never null
     */
    public RecipeSynthesizer(
            final SystemDependencyResolver theSystemDependencies) {
        this.systemDependencies = Preconditions.requireNonNull(
                theSystemDependencies, "System dependency resolver is required");
    }

    /**
     * Synthesizes the recipe.
     *
     * @param analysis the analysis of the source, never null
     * @return the recipe
     */
    public Recipe synthesize(final AnalysisResult analysis) {
        Preconditions.requireNonNull(analysis, "Analysis is required");

        final List<RecipeBlock> blocks = new ArrayList<>();

        blocks.add(new RecipeBlock(List.of(
                "Use official Python runtime as base image",
                "Python " + analysis.version() + " detected via "
                        + analysis.versionDetectionMethod().label()),
                List.of(Instruction.of(InstructionType.FROM,
                        "python:" + analysis.version() + "-slim"))));

        blocks.add(RecipeBlock.of("Set working directory",
                Instruction.of(InstructionType.WORKDIR, APP_DIRECTORY)));

        blocks.add(RecipeBlock.of("Set environment variables",
                Instruction.of(InstructionType.ENV,
                        "PYTHONDONTWRITEBYTECODE=1"),
                Instruction.of(InstructionType.ENV, "PYTHONUNBUFFERED=1")));

        final List<String> osPackages = systemDependencies.resolve(
                analysis.requirements());
        if (!osPackages.isEmpty()) {
            blocks.add(RecipeBlock.of("Install system dependencies",
                    Instruction.of(InstructionType.RUN,
                            aptInstall(osPackages))));
        }

        blocks.addAll(dependencyBlocks(analysis));

        blocks.add(RecipeBlock.of("Copy application code",
                Instruction.of(InstructionType.COPY,
                        Recipe.APPLICATION_COPY)));

        final Optional<FrameworkSignature> framework = FrameworkSignature.of(
                analysis.appType());
        framework.ifPresent(signature -> blocks.add(RecipeBlock.of(
                "Expose port", Instruction.of(InstructionType.EXPOSE,
                        String.valueOf(signature.defaultPort())))));

        blocks.add(runBlock(analysis, framework));

        return new Recipe(blocks);
    }

    private static List<RecipeBlock> dependencyBlocks(
            final AnalysisResult analysis) {
        final String manifest = RequirementsResolver.MANIFEST_FILE_NAME;
        final RecipeBlock install = RecipeBlock.of(
                "Install Python dependencies",
                Instruction.of(InstructionType.RUN,
                        "pip install --no-cache-dir -r " + manifest));

        if (analysis.manifestPresent()) {
            return List.of(RecipeBlock.of("Copy requirements file",
                    Instruction.of(InstructionType.COPY, manifest + " .")),
                    install);
        }
        if (analysis.requirements().isEmpty()) {
            return List.of();
        }
        return List.of(RecipeBlock.of(
                "Create requirements file from detected imports",
                Instruction.of(InstructionType.RUN, "printf '%s\\n' "
                        + String.join(" ", analysis.requirements())
                        + " > " + manifest)),
                install);
    }

    private static RecipeBlock runBlock(final AnalysisResult analysis,
            final Optional<FrameworkSignature> framework) {
        final List<String> command;
        final List<String> comments = new ArrayList<>();
        comments.add("Run the application");

        if (framework.isPresent()) {
            command = framework.get().entryCommand(analysis.sourceFilename());
        } else {
            command = List.of("python", analysis.sourceFilename());
            if (analysis.appType() == AppType.SCRIPT && !analysis.executable()) {
                comments.add("No __main__ guard found: the container may exit"
                        + " immediately");
            }
        }
        return new RecipeBlock(comments, List.of(
                Instruction.execForm(InstructionType.CMD, command)));
    }

    private static String aptInstall(final List<String> packages) {
        final StringBuilder command = new StringBuilder(
                "apt-get update && apt-get install -y"
                        + " --no-install-recommends \\\n");
        for (final String name : packages) {
            command.append("    ").append(name).append(" \\\n");
        }
        return command.append("    && rm -rf /var/lib/apt/lists/*").toString();
    }

}
