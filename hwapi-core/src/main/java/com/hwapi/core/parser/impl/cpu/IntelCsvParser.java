package com.hwapi.core.parser.impl.cpu;

import com.hwapi.core.parser.base.AbstractDatabaseParser;
import com.hwapi.core.parser.text.TextCursor;
import com.hwapi.core.parser.text.TextSlice;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parser for an Intel ARK "Product Specification Comparison" CSV export.
 *
 * <p>The export is transposed: CPUs are columns and attributes are rows.
 * <pre>
 * ARK | Intel® Product Specification Comparison
 * 01/14/2024 01:06:53 PM
 *  ,Intel® Core™ i5-9400F Processor ,Intel® Core™ i7-6700 Processor 
 * Essentials
 * Product Collection ,9th Generation Intel® Core™ i5 Processors ,6th Generation Intel® Core™ i7 Processors 
 * Code Name ,Products formerly Coffee Lake ,Products formerly Skylake 
 *
 * CPU Specifications
 * ...
 * </pre>
 * The header is every line before the CPU name row (the row starting with {@code " ,"}).
 * Each section is a heading line followed by attribute rows up to a blank line or the end
 * of input. Column {@code i + 1} of every attribute row belongs to CPU {@code i}; empty
 * cells are left out of that CPU's attributes.
 *
 * <p>Returned entries point into {@code source} and keep it reachable.
 */
public class IntelCsvParser extends AbstractDatabaseParser<List<SlicedCpu>> {

    private static final String BYTE_ORDER_MARK = "\uFEFF";
    private static final String NAME_ROW = " ,";

    @Override
    public String getId() {
        return "intel-csv";
    }

    @Override
    public String getDisplayName() {
        return "Intel ARK Comparison Export";
    }

    @Override
    public List<SlicedCpu> parse(String source) {
        TextCursor cursor = new TextCursor(source);
        if (cursor.startsWith(BYTE_ORDER_MARK)) {
            cursor.reset(1);
        }

        String timestamp = readHeader(cursor);
        List<TextSlice> names = readNames(cursor);
        List<List<TextSlice>> rows = readSections(cursor);
        log.debug("Intel export generated {}: {} CPUs, {} attribute rows", timestamp, names.size(), rows.size());

        List<SlicedCpu> cpus = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            toCpu(names.get(i), i + 1, rows).ifPresent(cpus::add);
        }
        return cpus;
    }

    /**
     * Consumes the header and returns its last non-blank line, the export timestamp.
     */
    private String readHeader(TextCursor cursor) {
        String timestamp = "";
        while (!cursor.startsWith(NAME_ROW)) {
            if (cursor.atEnd()) {
                throw parseFailure(cursor, "CPU name row not found");
            }
            String line = cursor.takeLine().strip();
            if (!line.isEmpty()) {
                timestamp = line;
            }
        }
        return timestamp;
    }

    private List<TextSlice> readNames(TextCursor cursor) {
        TextSlice row = cursor.sliceLine();
        TextSlice names = row.subSequence(NAME_ROW.length(), row.length()).strip();
        List<TextSlice> result = new ArrayList<>();
        for (TextSlice name : names.split(NAME_ROW)) {
            result.add(name.strip());
        }
        return result;
    }

    private List<List<TextSlice>> readSections(TextCursor cursor) {
        List<List<TextSlice>> rows = new ArrayList<>(256);
        while (true) {
            while (!cursor.atEnd() && isBlank(cursor)) {
                cursor.skipLine();
            }
            if (cursor.atEnd()) {
                return rows;
            }
            // section heading
            cursor.skipLine();
            while (!cursor.atEnd() && !isBlank(cursor)) {
                rows.add(readRow(cursor.sliceLine()));
            }
        }
    }

    private List<TextSlice> readRow(TextSlice line) {
        List<TextSlice> cells = new ArrayList<>();
        for (TextSlice cell : line.split(",")) {
            cells.add(cell.strip());
        }
        return cells;
    }

    private Optional<SlicedCpu> toCpu(TextSlice name, int column, List<List<TextSlice>> rows) {
        Map<TextSlice, TextSlice> attributes = new LinkedHashMap<>();
        for (List<TextSlice> row : rows) {
            if (row.size() <= column) {
                log.warn("Skipping Intel CPU '{}': attribute row '{}' has no column {}", name, row.get(0), column);
                return Optional.empty();
            }
            TextSlice value = row.get(column);
            if (value.length() > 0) {
                attributes.put(row.get(0), value);
            }
        }
        return Optional.of(new SlicedCpu(name, attributes));
    }

    private boolean isBlank(TextCursor cursor) {
        int mark = cursor.position();
        boolean blank = cursor.sliceLine().strip().length() == 0;
        cursor.reset(mark);
        return blank;
    }
}
