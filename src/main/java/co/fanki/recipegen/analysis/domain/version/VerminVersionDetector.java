package co.fanki.recipegen.analysis.domain.version;

import co.fanki.recipegen.analysis.domain.python.SourceUnit;
import co.fanki.recipegen.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Detects the Python version with the external {@code vermin} analyzer.
 *
 * <p>Runs {@code vermin --format parsable} over the source (and, when
 * requested, its local imports) and takes the minimum Python 3 version
 * from the summary line, the last line of output, which looks like
 * {@code :::<py2>:<py3>:}. Versions below
 * {@link PythonVersion#MINIMUM_SUPPORTED} are raised to it.</p>
 *
 * <p>On timeout, a non-zero exit, an inconclusive summary (a Python 3
 * version of {@code !3} or none at all) or any I/O failure, detection is
 * delegated to the fallback detector.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class VerminVersionDetector implements VersionDetector {

    private static final Logger LOG = LoggerFactory.getLogger(
            VerminVersionDetector.class);

    /** Timeout for the {@code --version} availability check. */
    private static final long VERSION_CHECK_TIMEOUT_SECONDS = 10;

    private static final List<String> ARGUMENTS = List.of(
            "--no-tips", "--format", "parsable",
            "--feature", "fstring-self-doc");

    private final String command;

    private final Duration timeout;

    private final VersionDetector fallback;

    private final LocalImportResolver localImports;

    /**
     * Creates a new vermin based detector.
     *
     * @param theCommand the vermin executable, never blank
     * @param theTimeout the maximum time a run may take, never null
     * @param theFallback the detector used when vermin cannot decide,
     *     never null
     * @param theLocalImports resolves local modules to scan, never null
     */
    public VerminVersionDetector(final String theCommand,
            final Duration theTimeout, final VersionDetector theFallback,
            final LocalImportResolver theLocalImports) {
        this.command = Preconditions.requireNonBlank(theCommand,
                "Analyzer command is required");
        this.timeout = Preconditions.requireNonNull(theTimeout,
                "Analyzer timeout is required");
        this.fallback = Preconditions.requireNonNull(theFallback,
                "Fallback detector is required");
        this.localImports = Preconditions.requireNonNull(theLocalImports,
                "Local import resolver is required");
    }

    @Override
    public boolean isAvailable() {
        try {
            final ProcessBuilder pb = new ProcessBuilder(command, "--version");
            pb.redirectErrorStream(true);
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            final Process process = pb.start();
            if (!process.waitFor(VERSION_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return false;
            }
            return process.exitValue() == 0;
        } catch (final IOException e) {
            LOG.debug("{} is not available: {}", command, e.getMessage());
            return false;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public VersionDetection detect(final SourceUnit source,
            final boolean scanLocalImports) {
        final List<Path> files = new ArrayList<>();
        files.add(source.path());
        if (scanLocalImports) {
            files.addAll(localImports.resolve(source));
        }

        try {
            final Optional<PythonVersion> reported = run(files);
            if (reported.isPresent()) {
                final PythonVersion version = reported.get()
                        .max(PythonVersion.MINIMUM_SUPPORTED);
                LOG.info("vermin reports Python {} for {}", reported.get(),
                        source.fileName());
                return new VersionDetection(version,
                        VersionDetectionMethod.ANALYZER);
            }
            LOG.warn("vermin was inconclusive for {}; using the heuristic",
                    source.fileName());
        } catch (final IOException e) {
            LOG.warn("vermin failed for {}: {}; using the heuristic",
                    source.fileName(), e.getMessage());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while running vermin for {}; using the"
                    + " heuristic", source.fileName());
        }
        return fallback.detect(source, scanLocalImports);
    }

    private Optional<PythonVersion> run(final List<Path> files)
            throws IOException, InterruptedException {

        final Path outputFile = Files.createTempFile("vermin-", ".out");
        final Path errorFile = Files.createTempFile("vermin-", ".err");
        try {
            final List<String> commandLine = new ArrayList<>();
            commandLine.add(command);
            commandLine.addAll(ARGUMENTS);
            for (final Path file : files) {
                commandLine.add(file.toAbsolutePath().toString());
            }

            final ProcessBuilder pb = new ProcessBuilder(commandLine);
            // Both streams go to files; vermin can outgrow a pipe buffer.
            pb.redirectOutput(outputFile.toFile());
            pb.redirectError(errorFile.toFile());

            LOG.debug("Running {}", commandLine);

            final Process process = pb.start();
            final boolean finished = process.waitFor(timeout.toMillis(),
                    TimeUnit.MILLISECONDS);

            if (!finished) {
                process.destroyForcibly();
                throw new IOException("vermin timed out after "
                        + timeout.toSeconds() + " seconds");
            }

            if (process.exitValue() != 0) {
                final String stderr = Files.readString(errorFile,
                        StandardCharsets.UTF_8);
                throw new IOException("vermin exited with code "
                        + process.exitValue() + ": " + stderr.trim());
            }

            return parseMinimumVersion(Files.readAllLines(outputFile,
                    StandardCharsets.UTF_8));
        } finally {
            Files.deleteIfExists(outputFile);
            Files.deleteIfExists(errorFile);
        }
    }

    /**
     * Reads the minimum Python 3 version from vermin's parsable output.
     *
     * @param lines the output lines
     * @return the version, or empty when the output is inconclusive
     */
    static Optional<PythonVersion> parseMinimumVersion(
            final List<String> lines) {
        String summary = null;
        for (int i = lines.size() - 1; i >= 0 && summary == null; i--) {
            if (!lines.get(i).isBlank()) {
                summary = lines.get(i).trim();
            }
        }
        if (summary == null) {
            return Optional.empty();
        }

        final String[] fields = summary.split(":", -1);
        if (fields.length < 5) {
            return Optional.empty();
        }
        final String py3 = fields[4].trim();
        if (py3.isEmpty() || py3.startsWith("!") || py3.startsWith("~")) {
            return Optional.empty();
        }
        try {
            return Optional.of(PythonVersion.parse(py3));
        } catch (final IllegalArgumentException e) {
            LOG.debug("Unexpected vermin summary '{}'", summary);
            return Optional.empty();
        }
    }

}
