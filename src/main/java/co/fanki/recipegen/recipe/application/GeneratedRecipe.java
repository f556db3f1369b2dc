package co.fanki.recipegen.recipe.application;

import co.fanki.recipegen.analysis.domain.AnalysisResult;
import co.fanki.recipegen.archive.domain.RecipeRecord;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of a recipe generation.
 *
 * @param analysis the analysis the recipe was built from
 * @param content the rendered recipe text
 * @param outputPath where the recipe was written
 * @param archived the archive record, when archiving was requested
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GeneratedRecipe(
        AnalysisResult analysis,
        String content,
        Path outputPath,
        Optional<RecipeRecord> archived
) {}
