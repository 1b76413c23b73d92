package com.hwapi.core.cache.cpu;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Search key derived from a CPU name.
 *
 * <p>The model token is split into an optional prefix, a run of digits and a suffix:
 * {@code "i5-9400F"} gives prefix {@code i5}, model {@code 9400} and suffix {@code F};
 * {@code "PRO 4650G"} gives prefix {@code PRO}, model {@code 4650} and suffix {@code G}.
 *
 * @param model leading digits of the model token, never empty
 * @param prefix text before the first {@code '-'} (or {@code ' '}), empty if none
 * @param suffix text after the digits
 * @param tags words of the full name other than vendor boilerplate
 * @param index position of the described CPU in its catalog, {@link #QUERY} for queries
 */
public record IndexEntry(
    String model,
    String prefix,
    String suffix,
    Set<String> tags,
    int index
) {
    /** Index value of an entry built from a query rather than a catalog entry. */
    public static final int QUERY = -1;

    static final int PREFIX_MISMATCH = -10;
    static final int SUFFIX_MISMATCH = -10;
    static final int SHARED_TAG = 5;

    private static final Set<String> IGNORED_TAGS = Set.of("Intel", "AMD", "Processor");

    public IndexEntry {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(prefix, "prefix must not be null");
        Objects.requireNonNull(suffix, "suffix must not be null");
        if (model.isEmpty()) {
            throw new IllegalArgumentException("model must not be empty");
        }
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    /**
     * Builds the entry for the catalog CPU at {@code index}.
     *
     * @param name catalog name
     * @param index position in the catalog
     * @return entry, or empty if the name has no model token starting with a digit
     */
    public static Optional<IndexEntry> generate(String name, int index) {
        String token = CpuModelExtractor.findModel(name);
        int split = token.indexOf('-');
        if (split < 0) {
            split = token.indexOf(' ');
        }
        String prefix = split < 0 ? "" : token.substring(0, split);
        String remainder = token.substring(split + 1);

        int digits = 0;
        while (digits < remainder.length() && isAsciiDigit(remainder.charAt(digits))) {
            digits++;
        }
        if (digits == 0) {
            return Optional.empty();
        }
        return Optional.of(new IndexEntry(
            remainder.substring(0, digits),
            prefix,
            remainder.substring(digits),
            tags(name),
            index));
    }

    /**
     * Builds the entry for a lookup query.
     *
     * @param query CPU name as reported by the system
     * @return entry, or empty if the query has no usable model token
     */
    public static Optional<IndexEntry> forQuery(String query) {
        return generate(query, QUERY);
    }

    /**
     * Scores this catalog entry against a query entry with the same model.
     *
     * <p>A differing prefix or suffix costs 10 each; every tag the two share earns 5.
     * Tags only this entry has cost nothing.
     *
     * @param query entry built from the query
     * @return score, higher is a better match
     */
    public int score(IndexEntry query) {
        int score = 0;
        if (!prefix.equals(query.prefix)) {
            score += PREFIX_MISMATCH;
        }
        if (!suffix.equals(query.suffix)) {
            score += SUFFIX_MISMATCH;
        }
        for (String tag : query.tags) {
            if (tags.contains(tag)) {
                score += SHARED_TAG;
            }
        }
        return score;
    }

    static Set<String> tags(String name) {
        return Arrays.stream(name.split("\\s+"))
            .filter(word -> !word.isEmpty())
            .filter(word -> !IGNORED_TAGS.contains(word))
            .filter(word -> !word.equals(name))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
