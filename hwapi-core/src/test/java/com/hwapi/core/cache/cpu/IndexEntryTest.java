package com.hwapi.core.cache.cpu;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link IndexEntry}.
 */
class IndexEntryTest {

    @Test
    void generate_splitsPrefixModelAndSuffix() {
        IndexEntry entry = IndexEntry.generate("Intel® Core™ i5-9400F Processor", 3).orElseThrow();

        assertThat(entry.prefix()).isEqualTo("i5");
        assertThat(entry.model()).isEqualTo("9400");
        assertThat(entry.suffix()).isEqualTo("F");
        assertThat(entry.index()).isEqualTo(3);
        assertThat(entry.tags()).containsExactly("Intel®", "Core™", "i5-9400F");
    }

    @Test
    void generate_proRewrite_usesProAsPrefix() {
        IndexEntry entry = IndexEntry.generate("AMD Ryzen™ 5 PRO 4650G", 0).orElseThrow();

        assertThat(entry.prefix()).isEqualTo("PRO");
        assertThat(entry.model()).isEqualTo("4650");
        assertThat(entry.suffix()).isEqualTo("G");
        assertThat(entry.tags()).doesNotContain("AMD");
    }

    @Test
    void generate_noLeadingDigit_isEmpty() {
        assertThat(IndexEntry.generate("AMD Athlon™ Silver", 0)).isEmpty();
        assertThat(IndexEntry.forQuery("Intel(R) Pentium(R) CPU")).isEmpty();
    }

    @Test
    void tags_dropBoilerplateAndWholeName() {
        assertThat(IndexEntry.tags("Intel Core Processor i3")).containsExactly("Core", "i3");
        assertThat(IndexEntry.tags("7702")).isEmpty();
    }

    @Test
    void score_penalizesPrefixAndSuffixAndRewardsSharedTags() {
        IndexEntry query = new IndexEntry("5600", "", "", Set.of("Ryzen", "5", "5600"), IndexEntry.QUERY);

        IndexEntry exact = new IndexEntry("5600", "", "", Set.of("Ryzen™", "5", "5600"), 0);
        IndexEntry variant = new IndexEntry("5600", "", "X", Set.of("Ryzen™", "5", "5600X"), 1);
        IndexEntry pro = new IndexEntry("5600", "PRO", "X", Set.of("PRO"), 2);

        assertThat(exact.score(query)).isEqualTo(10);
        assertThat(variant.score(query)).isEqualTo(-5);
        assertThat(pro.score(query)).isEqualTo(-20);
    }
}
