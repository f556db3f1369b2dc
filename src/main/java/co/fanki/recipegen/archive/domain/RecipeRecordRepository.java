package co.fanki.recipegen.archive.domain;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Repository for persisting and retrieving archived recipes.
 *
 * <p>Dates, times and timestamps are stored as ISO-8601 text with a fixed
 * number of fractional digits, so their lexical order is their
 * chronological order. The schema is created on first access, so a
 * repository that is never used never opens, or creates, the database.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class RecipeRecordRepository {

    /** Table, uniqueness constraint and indexes. */
    static final List<String> SCHEMA = List.of("""
            CREATE TABLE IF NOT EXISTS recipes (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL,
                content TEXT NOT NULL,
                created_date TEXT NOT NULL,
                created_time TEXT NOT NULL,
                created_timestamp TEXT NOT NULL,
                timezone TEXT NOT NULL,
                UNIQUE (name, created_date, created_time)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_recipes_created_date"
                    + " ON recipes (created_date)",
            "CREATE INDEX IF NOT EXISTS idx_recipes_name ON recipes (name)",
            "CREATE INDEX IF NOT EXISTS idx_recipes_created_timestamp"
                    + " ON recipes (created_timestamp)");

    /** Find record by ID. Uses: PK index. */
    public static final String FIND_BY_ID =
            "SELECT * FROM recipes WHERE id = :id";

    /** Find all records, newest first. Uses: idx_recipes_created_timestamp. */
    public static final String FIND_ALL =
            "SELECT * FROM recipes ORDER BY created_timestamp DESC, id DESC";

    /** Find records of a date, oldest first. Uses: idx_recipes_created_date. */
    public static final String FIND_BY_DATE = """
            SELECT * FROM recipes WHERE created_date = :date
            ORDER BY created_time ASC, id ASC
            """;

    /** Find the newest record of a name on a date. Uses: UNIQUE constraint. */
    public static final String FIND_LATEST_BY_DATE_AND_NAME = """
            SELECT * FROM recipes WHERE created_date = :date AND name = :name
            ORDER BY created_time DESC, id DESC LIMIT 1
            """;

    /** Distinct names of a date. Uses: idx_recipes_created_date. */
    public static final String FIND_NAMES_BY_DATE = """
            SELECT DISTINCT name FROM recipes WHERE created_date = :date
            ORDER BY name ASC
            """;

    /** Distinct dates, newest first. Uses: idx_recipes_created_date. */
    public static final String FIND_DATES =
            "SELECT DISTINCT created_date FROM recipes"
                    + " ORDER BY created_date DESC";

    /** Archive counts. Uses: seq scan. */
    public static final String STATISTICS = """
            SELECT COUNT(*) AS total,
                   COUNT(DISTINCT created_date) AS dates,
                   COUNT(DISTINCT name) AS names
            FROM recipes
            """;

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("HH:mm:ss.SSSSSS");

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSxxx");

    private final Jdbi jdbi;

    private volatile boolean schemaCreated;

    /**
     * Creates a new RecipeRecordRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public RecipeRecordRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
        this.jdbi.registerRowMapper(new RecipeRecordRowMapper());
    }

    /**
     * Stores a new record.
     *
     * @param record the record to store, without id
     * @return the stored record, with its assigned id
     * @throws DuplicateRecordException if a record with the same name,
     *     date and time exists
     */
    public RecipeRecord save(final RecipeRecord record) {
        try {
            final long id = database().inTransaction(handle -> {
                handle.createUpdate("""
                        INSERT INTO recipes (
                            name, content, created_date, created_time,
                            created_timestamp, timezone
                        ) VALUES (
                            :name, :content, :createdDate, :createdTime,
                            :createdTimestamp, :timezone
                        )
                        """)
                        .bind("name", record.name())
                        .bind("content", record.content())
                        .bind("createdDate", record.createdDate().toString())
                        .bind("createdTime",
                                TIME_FORMAT.format(record.createdTime()))
                        .bind("createdTimestamp",
                                TIMESTAMP_FORMAT.format(record.createdTimestamp()))
                        .bind("timezone", record.timezone())
                        .execute();
                return handle.createQuery("SELECT last_insert_rowid()")
                        .mapTo(Long.class)
                        .one();
            });
            return record.withId(id);
        } catch (final UnableToExecuteStatementException e) {
            if (isUniqueViolation(e)) {
                throw new DuplicateRecordException(record.name(),
                        record.createdDate(), record.createdTime(), e);
            }
            throw e;
        }
    }

    /**
     * Finds a record by its ID.
     *
     * @param id the record ID
     * @return the record if found
     */
    public Optional<RecipeRecord> findById(final long id) {
        return database().withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .mapTo(RecipeRecord.class)
                .findOne());
    }

    /**
     * Finds all records, newest first.
     *
     * @return list of all records
     */
    public List<RecipeRecord> findAll() {
        return database().withHandle(handle -> handle
                .createQuery(FIND_ALL)
                .mapTo(RecipeRecord.class)
                .list());
    }

    /**
     * Finds the records created on a date, in creation order.
     *
     * @param date the creation date
     * @return the records of that date
     */
    public List<RecipeRecord> findByDate(final LocalDate date) {
        return database().withHandle(handle -> handle
                .createQuery(FIND_BY_DATE)
                .bind("date", date.toString())
                .mapTo(RecipeRecord.class)
                .list());
    }

    /**
     * Finds the newest record with the given name on a date.
     *
     * @param date the creation date
     * @param name the record name
     * @return the record if found
     */
    public Optional<RecipeRecord> findLatestByDateAndName(
            final LocalDate date, final String name) {
        return database().withHandle(handle -> handle
                .createQuery(FIND_LATEST_BY_DATE_AND_NAME)
                .bind("date", date.toString())
                .bind("name", name)
                .mapTo(RecipeRecord.class)
                .findOne());
    }

    /**
     * Lists the distinct record names of a date, sorted.
     *
     * @param date the creation date
     * @return the names
     */
    public List<String> findNamesByDate(final LocalDate date) {
        return database().withHandle(handle -> handle
                .createQuery(FIND_NAMES_BY_DATE)
                .bind("date", date.toString())
                .mapTo(String.class)
                .list());
    }

    /**
     * Lists the distinct creation dates, newest first.
     *
     * @return the dates
     */
    public List<LocalDate> findDates() {
        return database().withHandle(handle -> handle
                .createQuery(FIND_DATES)
                .map((rs, ctx) -> LocalDate.parse(rs.getString(1)))
                .list());
    }

    /**
     * Computes the archive counts.
     *
     * @return the statistics
     */
    public ArchiveStatistics statistics() {
        return database().withHandle(handle -> handle
                .createQuery(STATISTICS)
                .map((rs, ctx) -> new ArchiveStatistics(rs.getLong("total"),
                        rs.getLong("dates"), rs.getLong("names")))
                .one());
    }

    /**
     * Deletes a record.
     *
     * @param id the record ID
     * @return true if a record was deleted
     */
    public boolean deleteById(final long id) {
        return database().withHandle(handle -> handle
                .createUpdate("DELETE FROM recipes WHERE id = :id")
                .bind("id", id)
                .execute()) > 0;
    }

    /** Returns the JDBI instance, creating the schema on the first call. */
    private Jdbi database() {
        if (!schemaCreated) {
            synchronized (this) {
                if (!schemaCreated) {
                    jdbi.useHandle(handle -> SCHEMA.forEach(handle::execute));
                    schemaCreated = true;
                }
            }
        }
        return jdbi;
    }

    private static boolean isUniqueViolation(final Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException
                    && cause.getMessage() != null
                    && cause.getMessage().contains("UNIQUE constraint failed")) {
                return true;
            }
        }
        return false;
    }

    private static final class RecipeRecordRowMapper
            implements RowMapper<RecipeRecord> {

        @Override
        public RecipeRecord map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return RecipeRecord.reconstitute(
                    rs.getLong("id"),
                    rs.getString("name"),
                    rs.getString("content"),
                    LocalDate.parse(rs.getString("created_date")),
                    LocalTime.parse(rs.getString("created_time")),
                    OffsetDateTime.parse(rs.getString("created_timestamp")),
                    rs.getString("timezone"));
        }
    }

}
