package co.fanki.recipegen.cli;

import co.fanki.recipegen.archive.domain.RecipeRecord;
import picocli.CommandLine;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * ANSI-colored terminal output utilities for the recipe generator CLI.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ConsoleOutput {

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("HH:mm:ss");

    private ConsoleOutput() {
        // Utility class, not instantiable
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) RECIPEGEN v0.0.1|@"));
        System.out.println("----------------------------------");
    }

    public static void info(final String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [RECIPEGEN]|@ " + message));
    }

    public static void success(final String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warning(final String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(final String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * Prints archive records as a table, one row per record.
     *
     * @param records the records to print
     */
    public static void recordTable(final List<RecipeRecord> records) {
        System.out.printf("  %-6s %-10s %-8s %s%n", "ID", "DATE", "TIME", "NAME");
        System.out.println("  " + "-".repeat(56));
        for (RecipeRecord record : records) {
            System.out.printf("  %-6d %-10s %-8s %s%n", record.id(),
                    record.createdDate(),
                    TIME_FORMAT.format(record.createdTime()),
                    record.name());
        }
    }

}
