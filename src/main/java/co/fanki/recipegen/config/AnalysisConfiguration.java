package co.fanki.recipegen.config;

import co.fanki.recipegen.analysis.domain.ExecutabilityDetector;
import co.fanki.recipegen.analysis.domain.FrameworkClassifier;
import co.fanki.recipegen.analysis.domain.ImportExtractor;
import co.fanki.recipegen.analysis.domain.RequirementsResolver;
import co.fanki.recipegen.analysis.domain.SourceAnalyzer;
import co.fanki.recipegen.analysis.domain.version.HeuristicVersionDetector;
import co.fanki.recipegen.analysis.domain.version.LocalImportResolver;
import co.fanki.recipegen.analysis.domain.version.VerminVersionDetector;
import co.fanki.recipegen.analysis.domain.version.VersionDetector;
import co.fanki.recipegen.analysis.domain.version.VersionDetectors;
import co.fanki.recipegen.recipe.domain.RecipeSynthesizer;
import co.fanki.recipegen.recipe.domain.SystemDependencyResolver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the analysis pipeline and the recipe synthesizer.
 *
 * <p>The version detection strategy is chosen once, here, based on the
 * {@code recipegen.analyzer.*} properties and on whether the analyzer can
 * be run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class AnalysisConfiguration {

    @Value("${recipegen.analyzer.enabled:true}")
    private boolean analyzerEnabled;

    @Value("${recipegen.analyzer.command:vermin}")
    private String analyzerCommand;

    @Value("${recipegen.analyzer.timeout-seconds:30}")
    private long analyzerTimeoutSeconds;

    @Bean
    public ImportExtractor importExtractor() {
        return new ImportExtractor();
    }

    @Bean
    public RequirementsResolver requirementsResolver() {
        return new RequirementsResolver();
    }

    @Bean
    public FrameworkClassifier frameworkClassifier() {
        return new FrameworkClassifier();
    }

    @Bean
    public ExecutabilityDetector executabilityDetector() {
        return new ExecutabilityDetector();
    }

    @Bean
    public LocalImportResolver localImportResolver() {
        return new LocalImportResolver();
    }

    /**
     * Selects the version detector.
     *
     * @param localImportResolver resolves local modules for the analyzer
     * @return the analyzer when enabled and installed, else the heuristic
     */
    @Bean
    public VersionDetector versionDetector(
            final LocalImportResolver localImportResolver) {
        final VersionDetector heuristic = new HeuristicVersionDetector();
        final VersionDetector analyzer = new VerminVersionDetector(
                analyzerCommand, Duration.ofSeconds(analyzerTimeoutSeconds),
                heuristic, localImportResolver);
        return VersionDetectors.select(analyzerEnabled, analyzer, heuristic);
    }

    @Bean
    public SourceAnalyzer sourceAnalyzer(
            final ImportExtractor importExtractor,
            final VersionDetector versionDetector,
            final RequirementsResolver requirementsResolver,
            final FrameworkClassifier frameworkClassifier,
            final ExecutabilityDetector executabilityDetector) {
        return new SourceAnalyzer(importExtractor, versionDetector,
                requirementsResolver, frameworkClassifier,
                executabilityDetector);
    }

    @Bean
    public RecipeSynthesizer recipeSynthesizer() {
        return new RecipeSynthesizer(new SystemDependencyResolver());
    }

}
