package co.fanki.recipegen.recipe.domain;

import co.fanki.recipegen.analysis.domain.AnalysisResult;
import co.fanki.recipegen.analysis.domain.AppType;
import co.fanki.recipegen.analysis.domain.ImportSet;
import co.fanki.recipegen.analysis.domain.version.PythonVersion;
import co.fanki.recipegen.analysis.domain.version.VersionDetectionMethod;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link RecipeSynthesizer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RecipeSynthesizerTest {

    private final RecipeSynthesizer synthesizer = new RecipeSynthesizer(
            new SystemDependencyResolver());

    @Test
    void whenSynthesizing_givenFlaskAppWithManifest_shouldRenderFullRecipe() {
        final AnalysisResult analysis = new AnalysisResult("app.py",
                new ImportSet(Set.of(), Set.of("flask")),
                List.of("flask==3.0.0"), true, PythonVersion.of(3, 8),
                VersionDetectionMethod.ANALYZER, AppType.FLASK, true);

        assertEquals("""
                # Use official Python runtime as base image
                # Python 3.8 detected via analyzer
                FROM python:3.8-slim

                # Set working directory
                WORKDIR /app

                # Set environment variables
                ENV PYTHONDONTWRITEBYTECODE=1
                ENV PYTHONUNBUFFERED=1

                # Copy requirements file
                COPY requirements.txt .

                # Install Python dependencies
                RUN pip install --no-cache-dir -r requirements.txt

                # Copy application code
                COPY . .

                # Expose port
                EXPOSE 5000

                # Run the application
                CMD ["python", "app.py"]
                """, synthesizer.synthesize(analysis).render());
    }

    @Test
    void whenSynthesizing_givenImportsWithoutManifest_shouldWriteManifest() {
        final AnalysisResult analysis = new AnalysisResult("main.py",
                new ImportSet(Set.of("os"), Set.of("fastapi", "numpy")),
                List.of("fastapi", "numpy"), false, PythonVersion.of(3, 10),
                VersionDetectionMethod.HEURISTIC, AppType.FASTAPI, false);

        final String recipe = synthesizer.synthesize(analysis).render();

        assertTrue(recipe.contains("""
                # Install system dependencies
                RUN apt-get update && apt-get install -y --no-install-recommends \\
                    gcc \\
                    && rm -rf /var/lib/apt/lists/*
                """));
        assertTrue(recipe.contains("""
                # Create requirements file from detected imports
                RUN printf '%s\\n' fastapi numpy > requirements.txt

                # Install Python dependencies
                RUN pip install --no-cache-dir -r requirements.txt
                """));
        assertTrue(recipe.contains("EXPOSE 8000\n"));
        assertTrue(recipe.endsWith(
                "CMD [\"uvicorn\", \"main:app\", \"--host\", \"0.0.0.0\","
                        + " \"--port\", \"8000\"]\n"));
        assertFalse(recipe.contains("COPY requirements.txt"));
    }

    @Test
    void whenSynthesizing_givenPlainScriptWithoutGuard_shouldWarnInComment() {
        final AnalysisResult analysis = new AnalysisResult("job.py",
                ImportSet.empty(), List.of(), false,
                PythonVersion.MINIMUM_SUPPORTED,
                VersionDetectionMethod.HEURISTIC, AppType.SCRIPT, false);

        final Recipe recipe = synthesizer.synthesize(analysis);

        assertEquals("""
                # Use official Python runtime as base image
                # Python 3.7 detected via heuristic
                FROM python:3.7-slim

                # Set working directory
                WORKDIR /app

                # Set environment variables
                ENV PYTHONDONTWRITEBYTECODE=1
                ENV PYTHONUNBUFFERED=1

                # Copy application code
                COPY . .

                # Run the application
                # No __main__ guard found: the container may exit immediately
                CMD ["python", "job.py"]
                """, recipe.render());
    }

    @Test
    void whenSynthesizing_givenExecutableScript_shouldNotExposePort() {
        final AnalysisResult analysis = new AnalysisResult("job.py",
                ImportSet.empty(), List.of(), false,
                PythonVersion.MINIMUM_SUPPORTED,
                VersionDetectionMethod.HEURISTIC, AppType.SCRIPT, true);

        final Recipe recipe = synthesizer.synthesize(analysis);

        assertTrue(recipe.instructions().stream()
                .noneMatch(i -> i.type() == InstructionType.EXPOSE));
        assertFalse(recipe.render().contains("__main__"));
    }

    @Test
    void whenSynthesizing_givenEmptyManifest_shouldStillCopyAndInstall() {
        final AnalysisResult analysis = new AnalysisResult("app.py",
                ImportSet.empty(), List.of(), true,
                PythonVersion.MINIMUM_SUPPORTED,
                VersionDetectionMethod.HEURISTIC, AppType.SCRIPT, true);

        final String recipe = synthesizer.synthesize(analysis).render();

        assertTrue(recipe.contains("COPY requirements.txt .\n"));
        assertTrue(recipe.contains(
                "RUN pip install --no-cache-dir -r requirements.txt\n"));
    }

    @Test
    void whenSynthesizing_givenSameAnalysisTwice_shouldRenderIdenticalText() {
        final AnalysisResult analysis = new AnalysisResult("app.py",
                new ImportSet(Set.of(), Set.of("streamlit", "pandas")),
                List.of("pandas", "streamlit"), false, PythonVersion.of(3, 9),
                VersionDetectionMethod.HEURISTIC, AppType.STREAMLIT, false);

        assertEquals(synthesizer.synthesize(analysis).render(),
                synthesizer.synthesize(analysis).render());
    }

    @Test
    void whenSynthesizing_givenDjangoApp_shouldRunManagePy() {
        final AnalysisResult analysis = new AnalysisResult("settings.py",
                new ImportSet(Set.of(), Set.of("django")), List.of("django"),
                false, PythonVersion.of(3, 11), VersionDetectionMethod.HEURISTIC,
                AppType.DJANGO, false);

        final String recipe = synthesizer.synthesize(analysis).render();

        assertTrue(recipe.endsWith("CMD [\"python\", \"manage.py\","
                + " \"runserver\", \"0.0.0.0:8000\"]\n"));
        assertFalse(recipe.contains("No __main__ guard"));
    }

}
