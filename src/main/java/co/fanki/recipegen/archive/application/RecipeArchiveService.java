package co.fanki.recipegen.archive.application;

import co.fanki.recipegen.analysis.domain.MissingSourceException;
import co.fanki.recipegen.archive.domain.ArchiveStatistics;
import co.fanki.recipegen.archive.domain.DuplicateRecordException;
import co.fanki.recipegen.archive.domain.RecipeRecord;
import co.fanki.recipegen.archive.domain.RecipeRecordRepository;
import co.fanki.recipegen.archive.domain.RecordValidationException;
import co.fanki.recipegen.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Application service for the recipe archive.
 *
 * <p>Records are stamped with the current date and time of the injected
 * clock, in the clock's zone.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class RecipeArchiveService {

    private static final Logger LOG = LoggerFactory.getLogger(
            RecipeArchiveService.class);

    private final RecipeRecordRepository repository;

    private final Clock clock;

    /**
     * Creates a new RecipeArchiveService.
     *
     * @param theRepository the record repository
     * @param theClock the clock used to stamp new records
     */
    public RecipeArchiveService(final RecipeRecordRepository theRepository,
            final Clock theClock) {
        this.repository = Preconditions.requireNonNull(theRepository,
                "Repository is required");
        this.clock = Preconditions.requireNonNull(theClock,
                "Clock is required");
    }

    /**
     * Archives a recipe.
     *
     * @param name the record name, never blank
     * @param content the recipe text, never null
     * @return the stored record
     * @throws RecordValidationException if the name is blank or there is no
     *     content
     * @throws DuplicateRecordException if the name was already archived at
     *     the same date and time
     */
    public RecipeRecord create(final String name, final String content) {
        if (content == null) {
            throw new RecordValidationException("Recipe content is required");
        }
        final RecipeRecord record = RecipeRecord.create(name, content,
                ZonedDateTime.now(clock));
        final RecipeRecord stored = repository.save(record);
        LOG.info("Archived recipe '{}' as #{}", stored.name(), stored.id());
        return stored;
    }

    /**
     * Archives the content of a file under the file's name.
     *
     * @param file the recipe file, never null
     * @return the stored record
     * @throws MissingSourceException if the file does not exist
     * @throws UncheckedIOException if the file cannot be read
     */
    public RecipeRecord createFromFile(final Path file) {
        Preconditions.requireNonNull(file, "File is required");
        if (!Files.isRegularFile(file)) {
            throw new MissingSourceException(file);
        }
        final String content;
        try {
            content = Files.readString(file);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
        return create(file.getFileName().toString(), content);
    }

    public List<RecipeRecord> findAll() {
        return repository.findAll();
    }

    public Optional<RecipeRecord> findById(final long id) {
        return repository.findById(id);
    }

    public List<RecipeRecord> findByDate(final LocalDate date) {
        return repository.findByDate(date);
    }

    public Optional<RecipeRecord> findLatest(final LocalDate date,
            final String name) {
        return repository.findLatestByDateAndName(date, name);
    }

    public List<String> findNames(final LocalDate date) {
        return repository.findNamesByDate(date);
    }

    public List<LocalDate> findDates() {
        return repository.findDates();
    }

    public ArchiveStatistics statistics() {
        return repository.statistics();
    }

    /**
     * Deletes a record.
     *
     * @param id the record id
     * @return true if the record existed
     */
    public boolean delete(final long id) {
        final boolean deleted = repository.deleteById(id);
        if (deleted) {
            LOG.info("Deleted archived recipe #{}", id);
        }
        return deleted;
    }

}
