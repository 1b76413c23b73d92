package com.hwapi.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hwapi.HwapiCLI;
import com.hwapi.core.config.ConfigLoader;
import com.hwapi.core.config.HwapiConfig;
import com.hwapi.core.lookup.LookupException;
import com.hwapi.core.parser.DatabaseParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Base class for commands that load hardware databases and print lookup results as JSON.
 *
 * <p>Handles the shared concerns of every subcommand:
 * <ul>
 *   <li>Applying the global logging options</li>
 *   <li>Loading {@code hwapi.yaml} (or the file given with {@code -c})</li>
 *   <li>Mapping database load failures to exit code {@value #EXIT_STARTUP_FAILURE}</li>
 *   <li>Printing single and batch lookup results</li>
 * </ul>
 */
public abstract class AbstractLookupCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_NOT_FOUND = 1;
    public static final int EXIT_STARTUP_FAILURE = 2;

    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @ParentCommand
    private HwapiCLI parent;

    @Spec
    protected CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: hwapi.yaml)"
    )
    private Path configPath = Paths.get("hwapi.yaml");

    /**
     * A single lookup. Empty means the input was well formed but nothing matched.
     *
     * @param <R> response type
     */
    @FunctionalInterface
    protected interface Lookup<R> {
        Optional<R> find(String input) throws LookupException;
    }

    @Override
    public Integer call() throws IOException {
        if (parent != null) {
            parent.configureLogging();
        }
        HwapiConfig config = ConfigLoader.load(configPath);
        try {
            return execute(config);
        } catch (IllegalStateException | DatabaseParseException e) {
            log.error("Failed to load hardware databases: {}", e.getMessage());
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return EXIT_STARTUP_FAILURE;
        }
    }

    /**
     * Loads what the command needs and runs it.
     *
     * @param config loaded configuration
     * @return exit code
     * @throws IOException if the result cannot be written
     */
    protected abstract int execute(HwapiConfig config) throws IOException;

    /**
     * Runs {@code lookup} for each input and prints the results.
     *
     * <p>A single input prints its result object, or reports it missing with exit code
     * {@value #EXIT_NOT_FOUND}. Several inputs print an array with {@code null} in place of
     * every failed lookup.
     *
     * @param inputs raw query strings
     * @param lookup lookup to run for each
     * @param <R> response type
     * @return exit code
     * @throws IOException if the result cannot be written
     */
    protected <R> int respond(List<String> inputs, Lookup<R> lookup) throws IOException {
        List<R> results = new ArrayList<>(inputs.size());
        for (String input : inputs) {
            results.add(findOrNull(input, lookup));
        }

        if (inputs.size() == 1) {
            R result = results.get(0);
            if (result == null) {
                spec.commandLine().getErr().println("Not found: " + inputs.get(0));
                return EXIT_NOT_FOUND;
            }
            printJson(result);
        } else {
            printJson(results);
        }
        return EXIT_OK;
    }

    /**
     * Writes {@code value} to standard output as JSON.
     *
     * @param value value to serialize
     * @throws JsonProcessingException if serialization fails
     */
    protected void printJson(Object value) throws JsonProcessingException {
        spec.commandLine().getOut().println(JSON.writeValueAsString(value));
        spec.commandLine().getOut().flush();
    }

    private <R> R findOrNull(String input, Lookup<R> lookup) {
        try {
            Optional<R> result = lookup.find(input);
            if (result.isEmpty()) {
                log.debug("No match for '{}'", input);
            }
            return result.orElse(null);
        } catch (LookupException e) {
            log.debug("Lookup of '{}' failed ({}): {}", input, e.failure(), e.getMessage());
            return null;
        }
    }
}
