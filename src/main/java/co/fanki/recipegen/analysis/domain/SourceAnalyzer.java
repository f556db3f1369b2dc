package co.fanki.recipegen.analysis.domain;

import co.fanki.recipegen.analysis.domain.python.SourceParseException;
import co.fanki.recipegen.analysis.domain.python.SourceUnit;
import co.fanki.recipegen.analysis.domain.version.VersionDetection;
import co.fanki.recipegen.analysis.domain.version.VersionDetector;
import co.fanki.recipegen.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs the static analysis of a Python source file.
 *
 * <p>Reads and parses the file once, then derives imports, version,
 * requirements, application type and executability from it. A syntax
 * error stops the analysis before any fact is derived.</p>
 *
 * <p>The analyzer holds no per-call state; concurrent analyses of
 * different files are safe.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceAnalyzer.class);

    private final ImportExtractor importExtractor;

    private final VersionDetector versionDetector;

    private final RequirementsResolver requirementsResolver;

    private final FrameworkClassifier frameworkClassifier;

    private final ExecutabilityDetector executabilityDetector;

    /**
     * Creates a new analyzer.
     *
     * @param theImportExtractor extracts imports, never null
     * @param theVersionDetector the selected version strategy, never null
     * @param theRequirementsResolver resolves requirements, never null
     * @param theFrameworkClassifier classifies the application, never null
     * @param theExecutabilityDetector detects the main guard, never null
     */
    public SourceAnalyzer(final ImportExtractor theImportExtractor,
            final VersionDetector theVersionDetector,
            final RequirementsResolver theRequirementsResolver,
            final FrameworkClassifier theFrameworkClassifier,
            final ExecutabilityDetector theExecutabilityDetector) {
        this.importExtractor = Preconditions.requireNonNull(
                theImportExtractor, "Import extractor is required");
        this.versionDetector = Preconditions.requireNonNull(
                theVersionDetector, "Version detector is required");
        this.requirementsResolver = Preconditions.requireNonNull(
                theRequirementsResolver, "Requirements resolver is required");
        this.frameworkClassifier = Preconditions.requireNonNull(
                theFrameworkClassifier, "Framework classifier is required");
        this.executabilityDetector = Preconditions.requireNonNull(
                theExecutabilityDetector, "Executability detector is required");
    }

    /**
     * Analyzes a Python source file.
     *
     * @param sourceFile the file to analyze, never null
     * @param scanLocalImports whether local modules it imports take part in
     *     version detection
     * @return the analysis result
     * @throws MissingSourceException if the file does not exist
     * @throws SourceParseException if the file is not valid Python
     * @throws UncheckedIOException if the file cannot be read
     */
    public AnalysisResult analyze(final Path sourceFile,
            final boolean scanLocalImports) {
        Preconditions.requireNonNull(sourceFile, "Source file is required");
        if (!Files.isRegularFile(sourceFile)) {
            throw new MissingSourceException(sourceFile);
        }

        LOG.info("Analyzing {}", sourceFile);

        final SourceUnit source = SourceUnit.parse(sourceFile,
                read(sourceFile));

        final ImportSet imports = importExtractor.extract(source.tree());
        final VersionDetection version = versionDetector.detect(source,
                scanLocalImports);
        final ResolvedRequirements requirements = requirementsResolver
                .resolve(sourceFile, imports);
        final AppType appType = frameworkClassifier.classify(imports);
        final boolean executable = executabilityDetector.isExecutable(
                source.tree());

        LOG.info("{}: Python {} ({}), {} application, {} requirement(s)",
                source.fileName(), version.version(), version.method().label(),
                appType.label(), requirements.specifiers().size());

        return new AnalysisResult(source.fileName(), imports,
                requirements.specifiers(), requirements.manifestPresent(),
                version.version(), version.method(), appType, executable);
    }

    private static String read(final Path sourceFile) {
        try {
            return Files.readString(sourceFile);
        } catch (final CharacterCodingException e) {
            throw new SourceParseException("source is not valid UTF-8", 1, 0);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read " + sourceFile, e);
        }
    }

}
