package io.vulnwitness;

import io.vulnwitness.input.ResultLoader;
import io.vulnwitness.model.Result;
import io.vulnwitness.output.JsonReporter;
import io.vulnwitness.output.Reporter;
import io.vulnwitness.output.TextReporter;
import io.vulnwitness.witness.WitnessFinder;
import io.vulnwitness.witness.Witnesses;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the vuln-witness tool.
 */
@Command(
        name = "vuln-witness",
        mixinStandardHelpOptions = true,
        version = "vuln-witness 1.0.0",
        description = "Finds a representative call stack from the program's entry points to each vulnerable symbol.",
        footer = {
                "",
                "Exit codes: 0 no vulnerability reachable, 3 at least one reachable, 1 error.",
                "",
                "Examples:",
                "  vuln-witness analysis.yaml",
                "  vuln-witness analysis.yaml --output-format json --output-file witnesses.json"
        }
)
public class WitnessCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_REACHABLE = 3;

    @Parameters(
            index = "0",
            description = "YAML file with the call graph, entry functions and vulnerabilities"
    )
    private Path inputFile;

    @Option(
            names = {"-o", "--output-format"},
            description = "Output format: text (default), json",
            defaultValue = "text"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-f", "--output-file"},
            description = "Output file path (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"-t", "--threads"},
            description = "Number of concurrent searches (defaults to the number of processors)"
    )
    private Integer threads;

    @Option(
            names = {"--show-unreachable"},
            description = "Also list vulnerabilities whose sink is not reached from any entry function"
    )
    private boolean showUnreachable;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in text output"
    )
    private boolean noColor;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose logging"
    )
    private boolean verbose;

    public enum OutputFormat {
        text,
        json
    }

    @Override
    public Integer call() {
        if (verbose) {
            // must happen before the first logger is created
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }

        if (!Files.isRegularFile(inputFile)) {
            System.err.println("Error: Input file does not exist: " + inputFile);
            return EXIT_ERROR;
        }
        if (threads != null && threads < 1) {
            System.err.println("Error: --threads must be at least 1");
            return EXIT_ERROR;
        }

        Result result;
        try {
            result = ResultLoader.load(inputFile);
        } catch (IOException e) {
            System.err.println("Error loading " + inputFile + ": " + e.getMessage());
            return EXIT_ERROR;
        }

        WitnessFinder finder = threads != null ? new WitnessFinder(threads) : new WitnessFinder();
        Witnesses witnesses = finder.findWitnesses(result);

        Reporter reporter = switch (outputFormat) {
            case json -> new JsonReporter();
            case text -> new TextReporter(!noColor && outputFile == null, showUnreachable);
        };

        try {
            if (outputFile != null) {
                reporter.write(result, witnesses, outputFile);
            } else {
                Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
                reporter.write(result, witnesses, out);
                out.flush();
            }
        } catch (IOException e) {
            System.err.println("Error writing report: " + e.getMessage());
            return EXIT_ERROR;
        }

        return witnesses.reachable().isEmpty() ? EXIT_OK : EXIT_REACHABLE;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new WitnessCli()).execute(args);
        System.exit(exitCode);
    }
}
