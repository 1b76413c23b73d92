package com.hwapi.cli;

import com.hwapi.cli.response.PcieResponse;
import com.hwapi.core.HardwareDatabases;
import com.hwapi.core.cache.PcieCache;
import com.hwapi.core.config.HwapiConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Command to look up PCI device instance ids.
 *
 * <p>An id whose vendor is unknown counts as not found.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * hwapi pcie 'PCI\VEN_10EC&DEV_8168&SUBSYS_86771043&REV_06'
 * hwapi pcie 'PCI\VEN_8086&DEV_1533' 'PCI\VEN_10DE&DEV_2484'
 * }</pre>
 */
@Command(
    name = "pcie",
    description = "Look up PCI device instance ids",
    mixinStandardHelpOptions = true
)
public class PcieCommand extends AbstractLookupCommand {

    @Parameters(arity = "1..*", paramLabel = "IDENTIFIER", description = "PCI device instance id, e.g. PCI\\VEN_8086&DEV_1533")
    private List<String> identifiers;

    @Override
    protected int execute(HwapiConfig config) throws IOException {
        PcieCache cache = HardwareDatabases.loadPcie(config);
        return respond(identifiers, identifier -> Optional.of(cache.find(identifier))
            .filter(info -> info.vendor().isPresent())
            .map(PcieResponse::from));
    }
}
