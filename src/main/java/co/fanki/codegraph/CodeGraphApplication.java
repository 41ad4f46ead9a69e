package co.fanki.codegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Code Graph Server Application.
 *
 * <p>Analyzes JavaScript and TypeScript projects into a property graph of
 * modules, functions, classes, calls and the errors they throw or reject
 * with, and serves that graph over REST.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class CodeGraphApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(CodeGraphApplication.class, args);
    }

}
