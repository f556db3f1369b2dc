package co.fanki.recipegen.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link FrameworkClassifier} and {@link FrameworkSignature}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FrameworkClassifierTest {

    private final FrameworkClassifier classifier = new FrameworkClassifier();

    @Test
    void whenClassifying_givenEachMarker_shouldReturnItsType() {
        assertEquals(AppType.FLASK, classify("flask"));
        assertEquals(AppType.DJANGO, classify("django"));
        assertEquals(AppType.FASTAPI, classify("fastapi"));
        assertEquals(AppType.STREAMLIT, classify("streamlit"));
    }

    @Test
    void whenClassifying_givenNoMarker_shouldReturnScript() {
        assertEquals(AppType.SCRIPT, classify("numpy"));
        assertEquals(AppType.SCRIPT, classifier.classify(ImportSet.empty()));
    }

    @Test
    void whenClassifying_givenTwoMarkers_shouldPreferEarlierSignature() {
        assertEquals(AppType.FLASK, classify("streamlit", "flask"));
        assertEquals(AppType.DJANGO, classify("fastapi", "django"));
        assertEquals(AppType.FASTAPI, classify("streamlit", "fastapi"));
    }

    @Test
    void whenClassifying_givenCustomOrder_shouldFollowIt() {
        final FrameworkClassifier custom = new FrameworkClassifier(List.of(
                FrameworkSignature.STREAMLIT, FrameworkSignature.FLASK));

        assertEquals(AppType.STREAMLIT, custom.classify(new ImportSet(
                Set.of(), Set.of("flask", "streamlit"))));
    }

    @Test
    void whenBuildingEntryCommand_givenTemplates_shouldFillFileAndModule() {
        assertEquals(List.of("python", "app.py"),
                FrameworkSignature.FLASK.entryCommand("app.py"));
        assertEquals(List.of("uvicorn", "main:app", "--host", "0.0.0.0",
                "--port", "8000"),
                FrameworkSignature.FASTAPI.entryCommand("main.py"));
        assertEquals(List.of("streamlit", "run", "dash.py",
                "--server.port=8501", "--server.address=0.0.0.0"),
                FrameworkSignature.STREAMLIT.entryCommand("dash.py"));
        assertEquals(List.of("python", "manage.py", "runserver", "0.0.0.0:8000"),
                FrameworkSignature.DJANGO.entryCommand("whatever.py"));
    }

    @Test
    void whenLookingUpSignature_givenAppType_shouldReturnItsPort() {
        assertEquals(5000, FrameworkSignature.of(AppType.FLASK)
                .orElseThrow().defaultPort());
        assertEquals(8501, FrameworkSignature.of(AppType.STREAMLIT)
                .orElseThrow().defaultPort());
        assertEquals(Optional.empty(), FrameworkSignature.of(AppType.SCRIPT));
    }

    private AppType classify(final String... thirdParty) {
        return classifier.classify(new ImportSet(Set.of(), Set.of(thirdParty)));
    }

}
