package com.bricks.sorter.input;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebrickable part list export (and the set inventories materialized by
 * {@link RebrickableSetResolver}):
 * <pre>{@code
 * {"count": 2, "results": [ {"part": {"part_num": "3001"}, "quantity": 4, …}, … ]}
 * }</pre>
 */
@Component
public class RebrickableJsonAdapter implements InventoryAdapter {

    static final String COL_PART = "part.part_num";
    static final String COL_QUANTITY = "quantity";

    private final ObjectMapper mapper;

    public RebrickableJsonAdapter(@Qualifier("sorterObjectMapper") final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String name() {
        return "Rebrickable JSON";
    }

    @Override
    public String signature() {
        return "{\"count\":";
    }

    @Override
    public String extension() {
        return ".json";
    }

    @Override
    public String identityColumn() {
        return COL_PART;
    }

    @Override
    public String quantityColumn() {
        return COL_QUANTITY;
    }

    @Override
    public List<Map<String, Object>> parse(final Path file) throws IOException {
        JsonNode root = mapper.readTree(file.toFile());
        JsonNode results = root.path("results");
        if (!results.isArray()) {
            throw new IOException("Rebrickable JSON without a \"results\" array: " + file);
        }

        List<Map<String, Object>> rows = new ArrayList<>(results.size());
        for (JsonNode n : results) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(COL_PART, n.at("/part/part_num").asText(null));
            JsonNode qty = n.path(COL_QUANTITY);
            row.put(COL_QUANTITY, qty.isNumber() ? qty.numberValue() : qty.asText(null));
            rows.add(row);
        }
        return rows;
    }
}
