package co.fanki.recipegen.analysis.domain;

import co.fanki.recipegen.analysis.domain.version.PythonVersion;
import co.fanki.recipegen.analysis.domain.version.VersionDetectionMethod;
import co.fanki.recipegen.shared.Preconditions;

import java.util.List;

/**
 * Everything the static analysis learned about one source file.
 *
 * <p>Built once per analysis and never changed; the recipe is a pure
 * function of it.</p>
 *
 * @param sourceFilename the file name of the source, e.g. {@code app.py}
 * @param imports the standard and third-party imports
 * @param requirements the requirement specifiers in install order
 * @param manifestPresent whether the requirements come from a manifest
 * @param version the minimum Python version
 * @param versionDetectionMethod how the version was found
 * @param appType the kind of application
 * @param executable whether the source has a main guard
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisResult(
        String sourceFilename,
        ImportSet imports,
        List<String> requirements,
        boolean manifestPresent,
        PythonVersion version,
        VersionDetectionMethod versionDetectionMethod,
        AppType appType,
        boolean executable
) {

    public AnalysisResult {
        Preconditions.requireNonBlank(sourceFilename,
                "Source filename is required");
        Preconditions.requireNonNull(imports, "Imports are required");
        Preconditions.requireNonNull(requirements, "Requirements are required");
        Preconditions.requireNonNull(version, "Version is required");
        Preconditions.requireNonNull(versionDetectionMethod,
                "Version detection method is required");
        Preconditions.requireNonNull(appType, "Application type is required");
        requirements = List.copyOf(requirements);
    }

}
