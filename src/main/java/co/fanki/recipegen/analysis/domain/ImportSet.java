package co.fanki.recipegen.analysis.domain;

import co.fanki.recipegen.shared.Preconditions;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * The top-level modules a source imports, split into standard library and
 * third-party names. Both sets are sorted and disjoint.
 *
 * @param standard the standard library modules
 * @param thirdParty every other absolute import
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportSet(Set<String> standard, Set<String> thirdParty) {

    public ImportSet {
        Preconditions.requireNonNull(standard, "Standard imports are required");
        Preconditions.requireNonNull(thirdParty,
                "Third-party imports are required");
        standard = Collections.unmodifiableSet(new TreeSet<>(standard));
        thirdParty = Collections.unmodifiableSet(new TreeSet<>(thirdParty));
        Preconditions.require(Collections.disjoint(standard, thirdParty),
                "An import cannot be both standard and third-party");
    }

    /**
     * Returns an import set without any import.
     *
     * @return the empty set
     */
    public static ImportSet empty() {
        return new ImportSet(Set.of(), Set.of());
    }

    /**
     * Checks whether the given top-level package is a third-party import.
     *
     * @param module the top-level module name
     * @return true if imported and not part of the standard library
     */
    public boolean importsThirdParty(final String module) {
        return thirdParty.contains(module);
    }

}
