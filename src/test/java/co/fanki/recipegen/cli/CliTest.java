package co.fanki.recipegen.cli;

import co.fanki.recipegen.analysis.domain.AnalysisResult;
import co.fanki.recipegen.analysis.domain.AppType;
import co.fanki.recipegen.analysis.domain.ImportSet;
import co.fanki.recipegen.analysis.domain.MissingSourceException;
import co.fanki.recipegen.analysis.domain.python.SourceParseException;
import co.fanki.recipegen.analysis.domain.version.PythonVersion;
import co.fanki.recipegen.analysis.domain.version.VersionDetectionMethod;
import co.fanki.recipegen.archive.application.RecipeArchiveService;
import co.fanki.recipegen.archive.domain.ArchiveStatistics;
import co.fanki.recipegen.archive.domain.RecipeRecord;
import co.fanki.recipegen.recipe.application.GeneratedRecipe;
import co.fanki.recipegen.recipe.application.RecipeGenerationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for the recipegen command structure.
 *
 * <p>Runs picocli directly, without a Spring context, over mocked
 * services.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CliTest {

    private static final RecipeRecord RECORD = RecipeRecord.create(
            "Dockerfile", "FROM python:3.8-slim\n",
            ZonedDateTime.of(2024, 3, 1, 10, 15, 30, 0, ZoneId.of("UTC")))
            .withId(1);

    private record CliResult(int exitCode, String output) {}

    private RecipeGenerationService generationService;

    private RecipeArchiveService archiveService;

    @BeforeEach
    void setUp() {
        generationService = mock(RecipeGenerationService.class);
        archiveService = mock(RecipeArchiveService.class);
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(final Class<K> cls) throws Exception {
                if (cls == GenerateCommand.class) {
                    return (K) new GenerateCommand(generationService);
                }
                if (cls == ArchiveCommand.class) {
                    return (K) new ArchiveCommand(archiveService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(final String... args) {
        final ByteArrayOutputStream capture = new ByteArrayOutputStream();
        final PrintStream capturePrintStream = new PrintStream(capture, true);
        final PrintStream originalOut = System.out;
        final PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            final CommandLine commandLine = new CommandLine(
                    new RecipeGenCommand(), createFactory());
            final int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("help")
    class Help {

        @Test
        void whenRequestingHelp_shouldListSubcommands() {
            final CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("generate"));
            assertTrue(result.output().contains("archive"));
            assertTrue(result.output().contains("serve"));
        }

        @Test
        void whenRunningWithoutArguments_shouldPrintUsage() {
            final CliResult result = execute();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Usage: recipegen"));
        }

        @Test
        void whenPassingUnknownSubcommand_shouldFail() {
            assertEquals(2, execute("frobnicate").exitCode());
        }

    }

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        void whenGenerating_givenValidSource_shouldReportAndExitZero() {
            final AnalysisResult analysis = new AnalysisResult("app.py",
                    new ImportSet(Set.of(), Set.of("flask")),
                    List.of("flask==3.0.0"), true, PythonVersion.of(3, 8),
                    VersionDetectionMethod.HEURISTIC, AppType.FLASK, false);
            when(generationService.generate(eq(Path.of("app.py")), isNull(),
                    eq(false), eq(false))).thenReturn(new GeneratedRecipe(
                            analysis, "FROM python:3.8-slim\n",
                            Path.of("/work/Dockerfile"), Optional.empty()));

            final CliResult result = execute("generate", "app.py");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Python 3.8"));
            assertTrue(result.output().contains("heuristic"));
            assertTrue(result.output().contains("flask==3.0.0"));
            assertTrue(result.output().contains("Recipe written to"));
            assertFalse(result.output().contains("__main__"));
        }

        @Test
        void whenGenerating_givenOptions_shouldPassThemOn() {
            final AnalysisResult analysis = new AnalysisResult("job.py",
                    ImportSet.empty(), List.of(), false,
                    PythonVersion.MINIMUM_SUPPORTED,
                    VersionDetectionMethod.HEURISTIC, AppType.SCRIPT, false);
            when(generationService.generate(any(), any(), anyBoolean(),
                    anyBoolean())).thenReturn(new GeneratedRecipe(analysis,
                            "FROM python:3.7-slim\n", Path.of("/work/out"),
                            Optional.of(RECORD)));

            final CliResult result = execute("generate", "job.py", "-o", "out",
                    "--scan-imports", "--archive");

            assertEquals(0, result.exitCode());
            verify(generationService).generate(Path.of("job.py"),
                    Path.of("out"), true, true);
            assertTrue(result.output().contains("No __main__ guard found"));
            assertTrue(result.output().contains("Archived as #1"));
        }

        @Test
        void whenGenerating_givenMissingSource_shouldExitOne() {
            when(generationService.generate(any(), any(), anyBoolean(),
                    anyBoolean())).thenThrow(
                            new MissingSourceException(Path.of("nope.py")));

            final CliResult result = execute("generate", "nope.py");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("nope.py"));
        }

        @Test
        void whenGenerating_givenInvalidSource_shouldExitOne() {
            when(generationService.generate(any(), any(), anyBoolean(),
                    anyBoolean())).thenThrow(
                            new SourceParseException("invalid syntax", 3, 4));

            final CliResult result = execute("generate", "broken.py");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("invalid syntax (line 3, column 4)"));
        }

        @Test
        void whenGenerating_givenNoSource_shouldFailParsing() {
            assertEquals(2, execute("generate").exitCode());
            verifyNoInteractions(generationService);
        }

    }

    @Nested
    @DisplayName("archive")
    class Archive {

        @Test
        void whenListing_givenRecords_shouldPrintTable() {
            when(archiveService.findAll()).thenReturn(List.of(RECORD));

            final CliResult result = execute("archive", "list");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Recipes (1):"));
            assertTrue(result.output().contains("2024-03-01"));
            assertTrue(result.output().contains("10:15:30"));
        }

        @Test
        void whenListing_givenInvalidDate_shouldExitOne() {
            final CliResult result = execute("archive", "list", "-d", "03/01");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Invalid date"));
            verifyNoInteractions(archiveService);
        }

        @Test
        void whenShowing_givenKnownId_shouldPrintContent() {
            when(archiveService.findById(1)).thenReturn(Optional.of(RECORD));

            final CliResult result = execute("archive", "show", "1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("FROM python:3.8-slim"));
        }

        @Test
        void whenShowing_givenUnknownId_shouldExitOne() {
            when(archiveService.findById(7)).thenReturn(Optional.empty());

            assertEquals(1, execute("archive", "show", "7").exitCode());
        }

        @Test
        void whenGettingLatest_shouldQueryByDateAndName() {
            when(archiveService.findLatest(LocalDate.of(2024, 3, 1),
                    "Dockerfile")).thenReturn(Optional.of(RECORD));

            final CliResult result = execute("archive", "latest",
                    "2024-03-01", "Dockerfile");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("FROM python:3.8-slim"));
        }

        @Test
        void whenShowingStats_shouldPrintCounts() {
            when(archiveService.statistics())
                    .thenReturn(new ArchiveStatistics(4, 2, 3));

            final CliResult result = execute("archive", "stats");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Total recipes: 4"));
        }

        @Test
        void whenDeleting_givenUnknownId_shouldExitOne() {
            when(archiveService.delete(5)).thenReturn(false);

            final CliResult result = execute("archive", "delete", "5");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Recipe #5 not found"));
        }

    }

    @Nested
    @DisplayName("runner")
    class Runner {

        @Test
        void whenCheckingServeMode_givenServeAsFirstArgument_shouldBeServeMode() {
            assertTrue(CliRunner.isServeMode("serve"));
            assertTrue(CliRunner.isServeMode("serve", "--help"));
        }

        @Test
        void whenCheckingServeMode_givenServeElsewhere_shouldNotBeServeMode() {
            assertFalse(CliRunner.isServeMode());
            assertFalse(CliRunner.isServeMode("generate", "serve"));
            assertFalse(CliRunner.isServeMode("generate", "app.py", "-o",
                    "serve"));
        }

        @Test
        void whenRunning_givenFileNamedServe_shouldExecuteGenerate() {
            when(generationService.generate(any(), any(), anyBoolean(),
                    anyBoolean())).thenThrow(
                            new MissingSourceException(Path.of("serve")));
            final CliRunner runner = new CliRunner(new RecipeGenCommand(),
                    createFactory());

            final PrintStream originalErr = System.err;
            System.setErr(new PrintStream(new ByteArrayOutputStream(), true));
            try {
                runner.run("generate", "serve");
            } finally {
                System.setErr(originalErr);
            }

            verify(generationService).generate(eq(Path.of("serve")), isNull(),
                    anyBoolean(), anyBoolean());
            assertEquals(1, runner.getExitCode());
        }
    }

}
