package co.fanki.recipegen.archive.domain;

import co.fanki.recipegen.shared.Preconditions;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * An archived build recipe with its creation metadata.
 *
 * <p>A record is identified in the archive by its name together with its
 * creation date and time; the numeric id is assigned when it is
 * stored.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RecipeRecord {

    private final Long id;
    private final String name;
    private final String content;
    private final LocalDate createdDate;
    private final LocalTime createdTime;
    private final OffsetDateTime createdTimestamp;
    private final String timezone;

    private RecipeRecord(
            final Long theId,
            final String theName,
            final String theContent,
            final LocalDate theCreatedDate,
            final LocalTime theCreatedTime,
            final OffsetDateTime theCreatedTimestamp,
            final String theTimezone) {
        this.id = theId;
        this.name = theName;
        this.content = Preconditions.requireNonNull(theContent,
                "Recipe content is required");
        this.createdDate = Preconditions.requireNonNull(theCreatedDate,
                "Creation date is required");
        this.createdTime = Preconditions.requireNonNull(theCreatedTime,
                "Creation time is required");
        this.createdTimestamp = Preconditions.requireNonNull(
                theCreatedTimestamp, "Creation timestamp is required");
        this.timezone = Preconditions.requireNonBlank(theTimezone,
                "Timezone is required");
    }

    /**
     * Creates a new, not yet stored, record stamped with the given instant.
     *
     * @param name the record name, usually the recipe file name
     * @param content the recipe text
     * @param now the creation instant; truncated to microseconds
     * @return the new record
     * @throws RecordValidationException if the name is blank
     */
    public static RecipeRecord create(final String name, final String content,
            final ZonedDateTime now) {
        if (name == null || name.isBlank()) {
            throw new RecordValidationException("Recipe name cannot be empty");
        }
        final ZonedDateTime stamp = now.truncatedTo(ChronoUnit.MICROS);
        return new RecipeRecord(null, name.strip(), content,
                stamp.toLocalDate(), stamp.toLocalTime(),
                stamp.toOffsetDateTime(), stamp.getZone().getId());
    }

    /**
     * Reconstitutes a stored record.
     *
     * @param id the record id
     * @param name the record name
     * @param content the recipe text
     * @param createdDate the creation date
     * @param createdTime the creation time
     * @param createdTimestamp the full creation timestamp
     * @param timezone the zone id the record was stamped in
     * @return the record
     */
    public static RecipeRecord reconstitute(
            final long id,
            final String name,
            final String content,
            final LocalDate createdDate,
            final LocalTime createdTime,
            final OffsetDateTime createdTimestamp,
            final String timezone) {
        return new RecipeRecord(id, name, content, createdDate, createdTime,
                createdTimestamp, timezone);
    }

    /**
     * Returns a copy of this record carrying the id it was stored under.
     *
     * @param storedId the assigned id
     * @return the stored record
     */
    public RecipeRecord withId(final long storedId) {
        return new RecipeRecord(storedId, name, content, createdDate,
                createdTime, createdTimestamp, timezone);
    }

    /**
     * Returns the id, or null when the record was not stored yet.
     *
     * @return the id
     */
    public Long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String content() {
        return content;
    }

    public LocalDate createdDate() {
        return createdDate;
    }

    public LocalTime createdTime() {
        return createdTime;
    }

    public OffsetDateTime createdTimestamp() {
        return createdTimestamp;
    }

    public String timezone() {
        return timezone;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecipeRecord)) {
            return false;
        }
        final RecipeRecord other = (RecipeRecord) o;
        return Objects.equals(id, other.id) && name.equals(other.name)
                && createdDate.equals(other.createdDate)
                && createdTime.equals(other.createdTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, createdDate, createdTime);
    }

    @Override
    public String toString() {
        return "RecipeRecord{id=" + id + ", name='" + name + "', created="
                + createdTimestamp + "}";
    }

}
