package co.fanki.recipegen.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 *
 * <p>Parses the arguments and delegates to the matching command, keeping
 * its exit code for {@link org.springframework.boot.SpringApplication#exit}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final RecipeGenCommand recipeGenCommand;

    private final IFactory factory;

    private int exitCode;

    /**
     * Creates a new CliRunner.
     *
     * @param theRecipeGenCommand the top-level command
     * @param theFactory the Spring aware picocli factory
     */
    public CliRunner(final RecipeGenCommand theRecipeGenCommand,
            final IFactory theFactory) {
        this.recipeGenCommand = theRecipeGenCommand;
        this.factory = theFactory;
    }

    /**
     * Checks whether the arguments select the {@code serve} command.
     *
     * <p>Only the first argument names the command, so {@code serve} as an
     * option value or file name never starts the server.</p>
     *
     * @param args the command line arguments
     * @return true if the first argument is {@code serve}
     */
    public static boolean isServeMode(final String... args) {
        return args.length > 0 && ServeCommand.NAME.equals(args[0]);
    }

    @Override
    public void run(final String... args) {
        // In serve mode the embedded web server does the work; executing
        // picocli would return at once.
        if (isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(recipeGenCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

}
