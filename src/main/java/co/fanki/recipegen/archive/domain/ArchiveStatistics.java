package co.fanki.recipegen.archive.domain;

/**
 * Counts over the recipe archive.
 *
 * @param totalRecipes the number of stored records
 * @param uniqueDates the number of distinct creation dates
 * @param uniqueNames the number of distinct record names
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ArchiveStatistics(long totalRecipes, long uniqueDates,
        long uniqueNames) {
}
