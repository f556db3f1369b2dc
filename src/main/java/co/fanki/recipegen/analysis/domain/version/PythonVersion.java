package co.fanki.recipegen.analysis.domain.version;

import co.fanki.recipegen.shared.Preconditions;

/**
 * A Python {@code major.minor} version, ordered numerically so that
 * {@code 3.10} is newer than {@code 3.8}.
 *
 * @param major the major version
 * @param minor the minor version
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PythonVersion(int major, int minor)
        implements Comparable<PythonVersion> {

    /** The oldest version a recipe ever targets. */
    public static final PythonVersion MINIMUM_SUPPORTED = new PythonVersion(3, 7);

    public PythonVersion {
        Preconditions.require(major >= 0, "Major version cannot be negative");
        Preconditions.require(minor >= 0, "Minor version cannot be negative");
    }

    /**
     * Creates a version.
     *
     * @param major the major version
     * @param minor the minor version
     * @return the version
     */
    public static PythonVersion of(final int major, final int minor) {
        return new PythonVersion(major, minor);
    }

    /**
     * Parses {@code "3"}, {@code "3.8"} or {@code "3.8.1"}; anything past
     * the minor component is ignored.
     *
     * @param text the version text, never blank
     * @return the version
     * @throws IllegalArgumentException if the text is not a version
     */
    public static PythonVersion parse(final String text) {
        Preconditions.requireNonBlank(text, "Version text is required");
        final String[] parts = text.trim().split("\\.");
        try {
            final int major = Integer.parseInt(parts[0]);
            final int minor = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
            return new PythonVersion(major, minor);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Not a Python version: "
                    + text, e);
        }
    }

    /**
     * Returns the newer of this and the other version.
     *
     * @param other the version to compare with
     * @return the greater version
     */
    public PythonVersion max(final PythonVersion other) {
        return compareTo(other) >= 0 ? this : other;
    }

    public boolean isNewerThan(final PythonVersion other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(final PythonVersion other) {
        final int byMajor = Integer.compare(major, other.major);
        return byMajor != 0 ? byMajor : Integer.compare(minor, other.minor);
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }

}
