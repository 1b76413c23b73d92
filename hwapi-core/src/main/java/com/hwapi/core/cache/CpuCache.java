package com.hwapi.core.cache;

import com.hwapi.core.cache.cpu.CpuCatalog;
import com.hwapi.core.cache.cpu.IndexEntry;
import com.hwapi.core.lookup.CpuLookupException;
import com.hwapi.core.model.Cpu;
import com.hwapi.core.model.CpuRecord;
import com.hwapi.core.model.CpuVendor;
import com.hwapi.core.parser.impl.cpu.SlicedCpu;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves free-form CPU names, as reported by hardware inventory tools, to catalog entries.
 *
 * <p>Names containing {@code "AMD"} are resolved against the AMD catalog, everything else
 * against the Intel catalog. See {@link CpuCatalog#bestMatch(IndexEntry)} for the matching rules.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Cpu cpu = cache.find("AMD Ryzen 5 3400G with Radeon Vega Graphics");
 * // cpu.name() is "AMD Ryzen™ 5 3400G with Radeon™ RX Vega 11 Graphics"
 * }</pre>
 *
 * <p>Safe to query concurrently. When memoization is on, successful resolutions are kept in
 * a concurrent map from query to catalog position, up to a fixed number of entries.
 */
public class CpuCache {

    private static final Logger log = LoggerFactory.getLogger(CpuCache.class);

    private final CpuCatalog<SlicedCpu> intel;
    private final CpuCatalog<Cpu> amd;
    private final Map<String, Integer> memo;
    private final int memoMaxEntries;

    /**
     * Creates a cache without memoization.
     *
     * @param intelCpus Intel catalog
     * @param amdCpus AMD catalog
     */
    public CpuCache(List<SlicedCpu> intelCpus, List<Cpu> amdCpus) {
        this(intelCpus, amdCpus, false, 0);
    }

    /**
     * Creates a cache and builds the search index of both catalogs.
     *
     * @param intelCpus Intel catalog
     * @param amdCpus AMD catalog
     * @param memoize whether to remember successful resolutions
     * @param memoMaxEntries upper bound on remembered resolutions
     */
    public CpuCache(List<SlicedCpu> intelCpus, List<Cpu> amdCpus, boolean memoize, int memoMaxEntries) {
        this.intel = new CpuCatalog<>("Intel", intelCpus);
        this.amd = new CpuCatalog<>("AMD", amdCpus);
        this.memo = memoize ? new ConcurrentHashMap<>() : null;
        this.memoMaxEntries = memoMaxEntries;
    }

    /**
     * Resolves a CPU name to the best matching catalog entry.
     *
     * @param query CPU name, e.g. {@code "Intel(R) Core(TM) i7 CPU M 620 @ 2.67Ghz"}
     * @return owned copy of the matched entry
     * @throws CpuLookupException if the query has no model number or nothing shares it
     */
    public Cpu find(String query) throws CpuLookupException {
        CpuCatalog<? extends CpuRecord> catalog = catalog(CpuVendor.forQuery(query));
        if (memo != null) {
            Integer remembered = memo.get(query);
            if (remembered != null) {
                return catalog.get(remembered).toCpu();
            }
        }

        IndexEntry key = IndexEntry.forQuery(query)
            .orElseThrow(() -> CpuLookupException.noModel(query));
        OptionalInt position = catalog.bestMatch(key);
        if (position.isEmpty()) {
            throw CpuLookupException.noMatch(query, key.model());
        }

        CpuRecord match = catalog.get(position.getAsInt());
        log.debug("Given the input '{}', the CPU '{}' was found", query, match.name());
        if (memo != null && memo.size() < memoMaxEntries) {
            memo.putIfAbsent(query, position.getAsInt());
        }
        return match.toCpu();
    }

    /**
     * Returns the catalog queries for {@code vendor} are resolved against.
     *
     * @param vendor CPU vendor
     * @return catalog
     */
    public CpuCatalog<? extends CpuRecord> catalog(CpuVendor vendor) {
        return vendor == CpuVendor.AMD ? amd : intel;
    }

    /**
     * Returns the number of remembered resolutions.
     *
     * @return memo size, 0 when memoization is off
     */
    public int memoSize() {
        return memo == null ? 0 : memo.size();
    }
}
