package com.hwapi.cli;

import com.hwapi.cli.response.BugcheckResponse;
import com.hwapi.core.HardwareDatabases;
import com.hwapi.core.cache.BugcheckCache;
import com.hwapi.core.config.HwapiConfig;
import com.hwapi.core.lookup.LookupException;
import com.hwapi.core.lookup.LookupFailure;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.List;

/**
 * Command to look up Windows bug check codes.
 *
 * <p>Codes are given in decimal or as {@code 0x}-prefixed hex.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * hwapi bugcheck 0x133
 * hwapi bugcheck 0xA 30 0xDEADDEAD
 * }</pre>
 */
@Command(
    name = "bugcheck",
    description = "Look up Windows bug check codes",
    mixinStandardHelpOptions = true
)
public class BugcheckCommand extends AbstractLookupCommand {

    @Parameters(arity = "1..*", paramLabel = "CODE", description = "Bug check code, decimal or 0x-hex")
    private List<String> codes;

    @Override
    protected int execute(HwapiConfig config) throws IOException {
        BugcheckCache cache = HardwareDatabases.loadBugcheck(config);
        return respond(codes, code -> cache.get(parseCode(code)).map(BugcheckResponse::from));
    }

    /**
     * Parses a code as unsigned decimal or {@code 0x} hex.
     *
     * @param code code as typed
     * @return numeric code
     * @throws LookupException if the text is not a number
     */
    static long parseCode(String code) throws LookupException {
        String trimmed = code.strip();
        try {
            if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
                return Long.parseUnsignedLong(trimmed.substring(2), 16);
            }
            return Long.parseUnsignedLong(trimmed);
        } catch (NumberFormatException e) {
            throw new LookupException(LookupFailure.MALFORMED_QUERY, code, "Not a bug check code: " + code, e);
        }
    }
}
