package co.fanki.recipegen.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command of the recipe generator.
 *
 * <p>Routes to the subcommands: generate, archive, serve.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Command(
        name = "recipegen",
        mixinStandardHelpOptions = true,
        version = "recipegen 0.0.1",
        description = "Generates container recipes for single-file Python applications",
        subcommands = {
                GenerateCommand.class,
                ArchiveCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RecipeGenCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }

}
