package com.hwapi.cli;

import com.hwapi.cli.response.DatabaseSummary;
import com.hwapi.core.HardwareDatabases;
import com.hwapi.core.config.HwapiConfig;
import picocli.CommandLine.Command;

import java.io.IOException;

/**
 * Command to load every database and print how many records each holds.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * hwapi list
 * hwapi list -c /etc/hwapi/hwapi.yaml
 * }</pre>
 */
@Command(
    name = "list",
    description = "Load all databases and print their record counts",
    mixinStandardHelpOptions = true
)
public class ListCommand extends AbstractLookupCommand {

    @Override
    protected int execute(HwapiConfig config) throws IOException {
        HardwareDatabases databases = HardwareDatabases.load(config);
        printJson(DatabaseSummary.of(databases));
        return EXIT_OK;
    }
}
