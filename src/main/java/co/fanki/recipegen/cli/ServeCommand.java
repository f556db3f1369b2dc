package co.fanki.recipegen.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: recipegen serve.
 *
 * <p>Starts the REST API over the recipe archive. The web server is
 * enabled by {@link co.fanki.recipegen.RecipeGeneratorApplication#main}
 * when "serve" is the first argument, and {@link CliRunner} then skips
 * picocli so the embedded server keeps the JVM alive. The banner is
 * printed once the server is listening.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Command(name = ServeCommand.NAME, mixinStandardHelpOptions = true,
        description = "Start the recipe archive HTTP server")
@Component
public class ServeCommand implements Runnable {

    /** The command name, which also selects the web application type. */
    public static final String NAME = "serve";

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through picocli, e.g. for --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(final WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(final int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Recipe archive server running on port " + port);
        System.out.println();
        System.out.println("  API:      http://localhost:" + port + "/api/recipes");
        System.out.println("  Swagger:  http://localhost:" + port + "/swagger-ui.html");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

}
