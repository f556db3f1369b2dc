package co.fanki.recipegen.recipe.application;

import co.fanki.recipegen.analysis.domain.AppType;
import co.fanki.recipegen.analysis.domain.ExecutabilityDetector;
import co.fanki.recipegen.analysis.domain.FrameworkClassifier;
import co.fanki.recipegen.analysis.domain.ImportExtractor;
import co.fanki.recipegen.analysis.domain.MissingSourceException;
import co.fanki.recipegen.analysis.domain.RequirementsResolver;
import co.fanki.recipegen.analysis.domain.SourceAnalyzer;
import co.fanki.recipegen.analysis.domain.python.SourceParseException;
import co.fanki.recipegen.analysis.domain.version.HeuristicVersionDetector;
import co.fanki.recipegen.analysis.domain.version.PythonVersion;
import co.fanki.recipegen.archive.application.RecipeArchiveService;
import co.fanki.recipegen.archive.domain.RecipeRecord;
import co.fanki.recipegen.recipe.domain.RecipeSynthesizer;
import co.fanki.recipegen.recipe.domain.SystemDependencyResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link RecipeGenerationService} with the real analysis and
 * synthesis pipeline and a mocked archive.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RecipeGenerationServiceTest {

    @TempDir
    Path dir;

    private RecipeArchiveService archiveService;

    private ObjectProvider<RecipeArchiveService> archiveProvider;

    private RecipeGenerationService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        archiveService = mock(RecipeArchiveService.class);
        archiveProvider = mock(ObjectProvider.class);
        when(archiveProvider.getObject()).thenReturn(archiveService);
        service = new RecipeGenerationService(
                new SourceAnalyzer(new ImportExtractor(),
                        new HeuristicVersionDetector(),
                        new RequirementsResolver(), new FrameworkClassifier(),
                        new ExecutabilityDetector()),
                new RecipeSynthesizer(new SystemDependencyResolver()),
                archiveProvider, "Dockerfile");
    }

    @Test
    void whenGenerating_givenFlaskAppWithManifest_shouldWriteRecipeNextToIt()
            throws IOException {
        final Path app = write("app.py", "from flask import Flask\n");
        write("requirements.txt", "flask==3.0.0\n");

        final GeneratedRecipe generated = service.generate(app, null, false,
                false);

        final Path target = dir.resolve("Dockerfile");
        assertEquals(target.toAbsolutePath(), generated.outputPath());
        assertEquals(generated.content(), Files.readString(target));
        assertEquals(AppType.FLASK, generated.analysis().appType());
        assertEquals(PythonVersion.MINIMUM_SUPPORTED,
                generated.analysis().version());
        assertTrue(generated.content().contains("COPY requirements.txt .\n"));
        assertTrue(generated.content().contains("EXPOSE 5000\n"));
        assertTrue(generated.content().endsWith(
                "CMD [\"python\", \"app.py\"]\n"));
        assertTrue(generated.archived().isEmpty());
        verify(archiveService, never()).create(anyString(), anyString());
        verify(archiveProvider, never()).getObject();
    }

    @Test
    void whenGenerating_givenRelativeOutput_shouldResolveAgainstSourceDirectory()
            throws IOException {
        final Path app = write("job.py", "print('hi')\n");

        final GeneratedRecipe generated = service.generate(app,
                Path.of("build", "job.Dockerfile"), false, false);

        final Path target = dir.resolve("build").resolve("job.Dockerfile");
        assertEquals(target.toAbsolutePath(), generated.outputPath());
        assertTrue(Files.isRegularFile(target));
        assertTrue(Files.readString(target).contains("No __main__ guard"));
    }

    @Test
    void whenGenerating_givenAbsoluteOutput_shouldWriteThere()
            throws IOException {
        final Path app = write("job.py", "print('hi')\n");
        final Path target = dir.resolve("out").resolve("Recipe")
                .toAbsolutePath();

        service.generate(app, target, false, false);

        assertTrue(Files.isRegularFile(target));
    }

    @Test
    void whenGenerating_givenInvalidPython_shouldWriteNothing()
            throws IOException {
        final Path app = write("broken.py", "def broken(:\n    pass\n");

        assertThrows(SourceParseException.class,
                () -> service.generate(app, null, false, true));

        assertFalse(Files.exists(dir.resolve("Dockerfile")));
        verify(archiveService, never()).create(anyString(), anyString());
    }

    @Test
    void whenGenerating_givenMissingSource_shouldThrow() {
        assertThrows(MissingSourceException.class,
                () -> service.generate(dir.resolve("nope.py"), null, false,
                        false));
    }

    @Test
    void whenGenerating_givenArchiveRequested_shouldArchiveUnderTargetName()
            throws IOException {
        final Path app = write("main.py", "import fastapi\n");
        final RecipeRecord stored = RecipeRecord.create("web.Dockerfile",
                "FROM x\n", ZonedDateTime.now(ZoneId.of("UTC"))).withId(3);
        when(archiveService.create(anyString(), anyString()))
                .thenReturn(stored);

        final GeneratedRecipe generated = service.generate(app,
                Path.of("web.Dockerfile"), false, true);

        verify(archiveService).create("web.Dockerfile", generated.content());
        assertEquals(3L, generated.archived().orElseThrow().id());
    }

    @Test
    void whenGenerating_givenSameSourceTwice_shouldWriteIdenticalRecipe()
            throws IOException {
        final Path app = write("main.py", """
                import numpy
                from fastapi import FastAPI
                app = FastAPI()
                """);

        final String first = service.generate(app, null, false, false)
                .content();
        final String second = service.generate(app, null, false, false)
                .content();

        assertEquals(first, second);
        assertTrue(first.contains("gcc"));
        assertTrue(first.contains(
                "RUN printf '%s\\n' fastapi numpy > requirements.txt\n"));
    }

    private Path write(final String name, final String content)
            throws IOException {
        final Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

}
