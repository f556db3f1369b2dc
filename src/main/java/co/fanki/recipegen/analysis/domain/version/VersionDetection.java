package co.fanki.recipegen.analysis.domain.version;

import co.fanki.recipegen.shared.Preconditions;

/**
 * The minimum Python version a source requires, with how it was found.
 *
 * @param version the minimum version, never below
 *     {@link PythonVersion#MINIMUM_SUPPORTED}
 * @param method the detection method
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record VersionDetection(PythonVersion version,
        VersionDetectionMethod method) {

    public VersionDetection {
        Preconditions.requireNonNull(version, "Version is required");
        Preconditions.requireNonNull(method, "Detection method is required");
        Preconditions.require(!PythonVersion.MINIMUM_SUPPORTED
                .isNewerThan(version), "Version cannot be below "
                + PythonVersion.MINIMUM_SUPPORTED);
    }

}
