package com.hwapi.core.cache;

import com.hwapi.core.model.BugcheckCode;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory bug check code table.
 */
public class BugcheckCache {

    private final Map<Long, BugcheckCode> codes;

    /**
     * Creates a cache over parsed codes. A later duplicate code replaces an earlier one.
     *
     * @param codes parsed codes
     */
    public BugcheckCache(Collection<BugcheckCode> codes) {
        TreeMap<Long, BugcheckCode> byCode = new TreeMap<>(Long::compareUnsigned);
        for (BugcheckCode code : codes) {
            byCode.put(code.code(), code);
        }
        this.codes = byCode;
    }

    /**
     * Looks up a code.
     *
     * @param code bug check code, unsigned
     * @return name and documentation link, or empty if unknown
     */
    public Optional<BugcheckCode> get(long code) {
        return Optional.ofNullable(codes.get(code));
    }

    /**
     * Returns every code in ascending unsigned order.
     *
     * @return all codes
     */
    public List<BugcheckCode> codes() {
        return List.copyOf(codes.values());
    }

    public int size() {
        return codes.size();
    }
}
