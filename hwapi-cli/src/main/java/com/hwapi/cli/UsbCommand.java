package com.hwapi.cli;

import com.hwapi.cli.response.UsbResponse;
import com.hwapi.core.HardwareDatabases;
import com.hwapi.core.cache.UsbCache;
import com.hwapi.core.config.HwapiConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Command to look up USB device instance ids.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * hwapi usb 'USB\VID_046D&PID_C092\6&1D3A4F8&0&2'
 * }</pre>
 */
@Command(
    name = "usb",
    description = "Look up USB device instance ids",
    mixinStandardHelpOptions = true
)
public class UsbCommand extends AbstractLookupCommand {

    @Parameters(arity = "1..*", paramLabel = "IDENTIFIER", description = "USB device instance id, e.g. USB\\VID_046D&PID_C092")
    private List<String> identifiers;

    @Override
    protected int execute(HwapiConfig config) throws IOException {
        UsbCache cache = HardwareDatabases.loadUsb(config);
        return respond(identifiers, identifier -> Optional.of(cache.find(identifier))
            .filter(info -> info.vendor().isPresent())
            .map(UsbResponse::from));
    }
}
