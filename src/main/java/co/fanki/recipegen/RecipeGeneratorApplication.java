package co.fanki.recipegen;

import co.fanki.recipegen.cli.CliRunner;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

/**
 * Recipe Generator Application.
 *
 * <p>Main entry point of the recipe generator, which analyzes single-file
 * Python applications and writes a container recipe (a Dockerfile) for
 * them. Runs as a command line tool; the {@code serve} command starts the
 * REST API over the recipe archive instead.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class RecipeGeneratorApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        final boolean serveMode = CliRunner.isServeMode(args);

        final SpringApplicationBuilder builder = new SpringApplicationBuilder(
                RecipeGeneratorApplication.class)
                .properties("spring.main.banner-mode=off");

        if (serveMode) {
            builder.properties("spring.main.web-application-type=servlet");
        } else {
            builder.properties("spring.main.web-application-type=none");
        }

        final ApplicationContext context = builder.run(args);

        if (!serveMode) {
            final ExitCodeGenerator exitCode = context.getBean(
                    ExitCodeGenerator.class);
            System.exit(SpringApplication.exit(context, exitCode));
        }
    }

}
