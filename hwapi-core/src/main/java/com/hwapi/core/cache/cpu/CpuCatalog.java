package com.hwapi.core.cache.cpu;

import com.hwapi.core.model.CpuRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One vendor's CPU list together with the search index built over it.
 *
 * <p>Index entries refer to CPUs by position. CPUs whose name yields no model number stay
 * in the list but are not indexed, so no query resolves to them directly.
 *
 * @param <C> entry representation
 */
public final class CpuCatalog<C extends CpuRecord> {

    private static final Logger log = LoggerFactory.getLogger(CpuCatalog.class);

    private final String label;
    private final List<C> entries;
    private final Map<String, List<IndexEntry>> entriesByModel;
    private final int indexSize;

    /**
     * Builds the index for {@code entries}.
     *
     * @param label catalog name used in logs
     * @param entries catalog in its canonical order
     */
    public CpuCatalog(String label, List<C> entries) {
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.entries = List.copyOf(entries);

        Map<String, List<IndexEntry>> byModel = new HashMap<>();
        int indexed = 0;
        for (int i = 0; i < this.entries.size(); i++) {
            String name = this.entries.get(i).name().toString();
            Optional<IndexEntry> entry = IndexEntry.generate(name, i);
            if (entry.isEmpty()) {
                log.debug("{} catalog: no model number in '{}', not indexed", label, name);
                continue;
            }
            byModel.computeIfAbsent(entry.get().model(), model -> new ArrayList<>()).add(entry.get());
            indexed++;
        }
        byModel.replaceAll((model, list) -> List.copyOf(list));
        this.entriesByModel = Map.copyOf(byModel);
        this.indexSize = indexed;
    }

    /**
     * Finds the best entry for a query.
     *
     * <p>Only entries with exactly the query's model number are candidates. The highest
     * {@link IndexEntry#score(IndexEntry)} wins; on ties the entry earliest in the catalog wins.
     *
     * @param query entry built from the query
     * @return position of the best entry, or empty if no entry shares the model number
     */
    public OptionalInt bestMatch(IndexEntry query) {
        List<IndexEntry> candidates = entriesByModel.getOrDefault(query.model(), List.of());
        IndexEntry best = null;
        int bestScore = Integer.MIN_VALUE;
        for (IndexEntry candidate : candidates) {
            int score = candidate.score(query);
            log.trace("{} candidate '{}' scored {}", label, entries.get(candidate.index()).name(), score);
            if (best == null || score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best == null ? OptionalInt.empty() : OptionalInt.of(best.index());
    }

    /**
     * Returns the entry at a catalog position.
     *
     * @param position position as returned by {@link #bestMatch(IndexEntry)}
     * @return catalog entry
     */
    public C get(int position) {
        return entries.get(position);
    }

    public String label() {
        return label;
    }

    /**
     * Returns the number of CPUs in the catalog.
     *
     * @return catalog size
     */
    public int size() {
        return entries.size();
    }

    /**
     * Returns the number of CPUs that could be indexed.
     *
     * @return index size, at most {@link #size()}
     */
    public int indexSize() {
        return indexSize;
    }
}
