package com.hwapi.core.parser.impl.cpu;

import com.fasterxml.jackson.databind.JsonNode;
import com.hwapi.core.model.Cpu;
import com.hwapi.core.parser.base.AbstractJacksonDatabaseParser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parser for the JSON export of the AMD processor specifications table.
 *
 * <p>The export is {@code {"data": [{"Model": "...", "<column>": "...", ...}, ...]}}.
 * {@code Model} is usually a string but is a bare number for some parts; numbers are
 * rendered as their decimal text, both for the name and for attribute values. Empty and
 * null cells are dropped, as are the stray {@code "0"} and {@code ""} columns.
 */
public class AmdJsonParser extends AbstractJacksonDatabaseParser<List<Cpu>> {

    private static final String MODEL = "Model";
    private static final Set<String> IGNORED_KEYS = Set.of("0", "", MODEL);

    @Override
    public String getId() {
        return "amd-json";
    }

    @Override
    public String getDisplayName() {
        return "AMD Processor Specifications Export";
    }

    @Override
    public List<Cpu> parse(String source) {
        JsonNode root = readTree(source);
        JsonNode data = root == null ? null : root.get("data");
        if (!isArray(data)) {
            throw parseFailure("expected a top-level \"data\" array");
        }

        List<Cpu> cpus = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            cpus.add(toCpu(data.get(i), i));
        }
        log.debug("Parsed {} AMD CPUs", cpus.size());
        return cpus;
    }

    private Cpu toCpu(JsonNode entry, int position) {
        if (entry == null || !entry.isObject()) {
            throw parseFailure("data[" + position + "] is not an object");
        }
        JsonNode model = entry.get(MODEL);
        if (model == null || !(model.isTextual() || model.isNumber())) {
            throw parseFailure("data[" + position + "] has no string or numeric \"Model\"");
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = entry.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            if (IGNORED_KEYS.contains(key) || value.isNull()) {
                continue;
            }
            if (value.isContainerNode()) {
                throw parseFailure("data[" + position + "]." + key + " is not a scalar value");
            }
            String text = value.asText();
            if (!text.isEmpty()) {
                attributes.put(key, text);
            }
        }
        return new Cpu(model.asText(), attributes);
    }
}
