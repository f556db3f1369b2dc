package co.fanki.recipegen.analysis.domain;

import co.fanki.recipegen.shared.Preconditions;

import java.util.List;

/**
 * The Python packages a source needs installed.
 *
 * @param specifiers the requirement specifiers in install order
 * @param manifestPresent whether they come from a requirements manifest
 *     beside the source (true) or from the third-party imports (false)
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ResolvedRequirements(List<String> specifiers,
        boolean manifestPresent) {

    public ResolvedRequirements {
        Preconditions.requireNonNull(specifiers, "Specifiers are required");
        specifiers = List.copyOf(specifiers);
    }

}
