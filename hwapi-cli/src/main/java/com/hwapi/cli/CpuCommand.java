package com.hwapi.cli;

import com.hwapi.core.HardwareDatabases;
import com.hwapi.core.cache.CpuCache;
import com.hwapi.core.config.HwapiConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Command to resolve a reported CPU name to its catalog entry.
 *
 * <p>All words are joined with single spaces into one query, so the name does not need quoting.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * hwapi cpu Intel(R) Core(TM) i7-14700K
 * hwapi cpu "AMD Ryzen 5 3400G with Radeon Vega Graphics"
 * }</pre>
 */
@Command(
    name = "cpu",
    description = "Resolve a CPU name to its catalog entry",
    mixinStandardHelpOptions = true
)
public class CpuCommand extends AbstractLookupCommand {

    @Parameters(arity = "1..*", paramLabel = "NAME", description = "CPU name as reported by the system")
    private List<String> words;

    @Override
    protected int execute(HwapiConfig config) throws IOException {
        CpuCache cache = HardwareDatabases.loadCpu(config);
        String query = String.join(" ", words);
        return respond(List.of(query), name -> Optional.of(cache.find(name)));
    }
}
