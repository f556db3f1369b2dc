package co.fanki.recipegen.cli;

import co.fanki.recipegen.archive.application.RecipeArchiveService;
import co.fanki.recipegen.archive.domain.ArchiveStatistics;
import co.fanki.recipegen.archive.domain.RecipeRecord;
import co.fanki.recipegen.shared.DomainException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * CLI command: recipegen archive.
 *
 * <p>Each subcommand is a method of this class; they return 0 on success
 * and 1 when the record is not found or the archive rejects the
 * request.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Command(name = "archive", mixinStandardHelpOptions = true,
        description = "Store and browse generated recipes")
@Component
public class ArchiveCommand implements Runnable {

    private final RecipeArchiveService archiveService;

    @Spec
    private CommandSpec spec;

    /**
     * Creates a new ArchiveCommand.
     *
     * @param theArchiveService the archive service
     */
    public ArchiveCommand(final RecipeArchiveService theArchiveService) {
        this.archiveService = theArchiveService;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "add", description = "Archive a recipe file under its file name")
    int add(@Parameters(paramLabel = "FILE", description = "The recipe file")
            final Path file) {
        try {
            final RecipeRecord record = archiveService.createFromFile(file);
            ConsoleOutput.success("Archived '" + record.name() + "' as #"
                    + record.id());
            return 0;
        } catch (DomainException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (UncheckedIOException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    @Command(name = "list", description = "List archived recipes, newest first")
    int list(@Option(names = {"-d", "--date"}, paramLabel = "DATE",
            description = "Only recipes of this date (yyyy-MM-dd)")
            final String date) {
        final List<RecipeRecord> records;
        if (date == null) {
            records = archiveService.findAll();
        } else {
            final Optional<LocalDate> day = parseDate(date);
            if (day.isEmpty()) {
                return 1;
            }
            records = archiveService.findByDate(day.get());
        }
        if (records.isEmpty()) {
            ConsoleOutput.info("No recipes found.");
            return 0;
        }
        ConsoleOutput.info("Recipes (" + records.size() + "):");
        ConsoleOutput.recordTable(records);
        return 0;
    }

    @Command(name = "show", description = "Print an archived recipe")
    int show(@Parameters(paramLabel = "ID", description = "The record id")
            final long id) {
        final Optional<RecipeRecord> record = archiveService.findById(id);
        if (record.isEmpty()) {
            ConsoleOutput.error("Recipe #" + id + " not found");
            return 1;
        }
        System.out.print(record.get().content());
        return 0;
    }

    @Command(name = "latest",
            description = "Print the newest recipe with a name on a date")
    int latest(
            @Parameters(index = "0", paramLabel = "DATE",
                    description = "The date (yyyy-MM-dd)") final String date,
            @Parameters(index = "1", paramLabel = "NAME",
                    description = "The recipe name") final String name) {
        final Optional<LocalDate> day = parseDate(date);
        if (day.isEmpty()) {
            return 1;
        }
        final Optional<RecipeRecord> record = archiveService.findLatest(
                day.get(), name);
        if (record.isEmpty()) {
            ConsoleOutput.error("No recipe '" + name + "' on " + date);
            return 1;
        }
        System.out.print(record.get().content());
        return 0;
    }

    @Command(name = "dates", description = "List the dates that have recipes")
    int dates() {
        archiveService.findDates().forEach(day -> System.out.println(
                "  " + day + "  " + String.join(", ",
                        archiveService.findNames(day))));
        return 0;
    }

    @Command(name = "stats", description = "Show archive statistics")
    int stats() {
        final ArchiveStatistics statistics = archiveService.statistics();
        ConsoleOutput.info("Total recipes: " + statistics.totalRecipes());
        ConsoleOutput.info("Unique dates:  " + statistics.uniqueDates());
        ConsoleOutput.info("Unique names:  " + statistics.uniqueNames());
        return 0;
    }

    @Command(name = "delete", description = "Delete an archived recipe")
    int delete(@Parameters(paramLabel = "ID", description = "The record id")
            final long id) {
        if (!archiveService.delete(id)) {
            ConsoleOutput.error("Recipe #" + id + " not found");
            return 1;
        }
        ConsoleOutput.success("Deleted recipe #" + id);
        return 0;
    }

    private static Optional<LocalDate> parseDate(final String date) {
        try {
            return Optional.of(LocalDate.parse(date));
        } catch (DateTimeParseException e) {
            ConsoleOutput.error("Invalid date '" + date
                    + "', expected yyyy-MM-dd");
            return Optional.empty();
        }
    }

}
