package co.fanki.recipegen.analysis.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * How each supported web framework is recognized and started.
 *
 * <p>Declaration order is the classification priority: when a source
 * imports more than one marker, the earlier signature wins.</p>
 *
 * <p>Entry command templates may use {@code {file}} (the source file name)
 * and {@code {module}} (the file name without {@code .py}).</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum FrameworkSignature {

    FLASK(AppType.FLASK, "flask", 5000,
            List.of("python", "{file}")),

    DJANGO(AppType.DJANGO, "django", 8000,
            List.of("python", "manage.py", "runserver", "0.0.0.0:8000")),

    FASTAPI(AppType.FASTAPI, "fastapi", 8000,
            List.of("uvicorn", "{module}:app", "--host", "0.0.0.0",
                    "--port", "8000")),

    STREAMLIT(AppType.STREAMLIT, "streamlit", 8501,
            List.of("streamlit", "run", "{file}", "--server.port=8501",
                    "--server.address=0.0.0.0"));

    private final AppType appType;

    private final String markerImport;

    private final int defaultPort;

    private final List<String> entryCommandTemplate;

    FrameworkSignature(final AppType theAppType, final String theMarkerImport,
            final int theDefaultPort, final List<String> theTemplate) {
        this.appType = theAppType;
        this.markerImport = theMarkerImport;
        this.defaultPort = theDefaultPort;
        this.entryCommandTemplate = theTemplate;
    }

    public AppType appType() {
        return appType;
    }

    public String markerImport() {
        return markerImport;
    }

    public int defaultPort() {
        return defaultPort;
    }

    /**
     * Builds the command that starts the application.
     *
     * @param fileName the source file name, e.g. {@code main.py}
     * @return the command arguments
     */
    public List<String> entryCommand(final String fileName) {
        final String module = fileName.endsWith(".py")
                ? fileName.substring(0, fileName.length() - 3) : fileName;
        final List<String> command = new ArrayList<>();
        for (final String argument : entryCommandTemplate) {
            command.add(argument.replace("{file}", fileName)
                    .replace("{module}", module));
        }
        return List.copyOf(command);
    }

    /**
     * Finds the signature of a framework application type.
     *
     * @param appType the application type
     * @return the signature, or empty for {@link AppType#SCRIPT}
     */
    public static Optional<FrameworkSignature> of(final AppType appType) {
        for (final FrameworkSignature signature : values()) {
            if (signature.appType == appType) {
                return Optional.of(signature);
            }
        }
        return Optional.empty();
    }

}
