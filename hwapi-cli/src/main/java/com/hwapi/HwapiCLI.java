package com.hwapi;

import ch.qos.logback.classic.Level;
import com.hwapi.cli.BugcheckCommand;
import com.hwapi.cli.CpuCommand;
import com.hwapi.cli.ListCommand;
import com.hwapi.cli.PcieCommand;
import com.hwapi.cli.UsbCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Main CLI entry point for hwapi.
 *
 * <p>hwapi resolves raw hardware identifiers, as reported by Windows inventory tools, to
 * vendor and product names from the bundled hardware databases.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code pcie} - Look up PCI device instance ids</li>
 *   <li>{@code usb} - Look up USB device instance ids</li>
 *   <li>{@code bugcheck} - Look up Windows bug check codes</li>
 *   <li>{@code cpu} - Resolve a reported CPU name to its catalog entry</li>
 *   <li>{@code list} - Summarize the loaded databases</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * hwapi pcie 'PCI\VEN_10EC&DEV_8168&SUBSYS_86771043&REV_06'
 * hwapi bugcheck 0x133 0x9F
 * hwapi cpu Intel(R) Core(TM) i7 CPU M 620 @ 2.67Ghz
 * }</pre>
 *
 * <p>Results are written to standard output as JSON; logs go to standard error.
 */
@Command(
    name = "hwapi",
    mixinStandardHelpOptions = true,
    version = "hwapi 1.2.2-SNAPSHOT",
    description = "Hardware identifier lookups against PCI, USB, bug check and CPU databases",
    subcommands = {
        PcieCommand.class,
        UsbCommand.class,
        BugcheckCommand.class,
        CpuCommand.class,
        ListCommand.class
    }
)
public class HwapiCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HwapiCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();
        spec.commandLine().usage(spec.commandLine().getOut());
        spec.commandLine().getOut().flush();
    }

    /**
     * Configures logging level based on global options.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured: verbose={}, quiet={}", verbose, quiet);
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new HwapiCLI()).execute(args);
        System.exit(exitCode);
    }
}
