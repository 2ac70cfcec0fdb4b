package com.bricks.sorter.input;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rebrickable CSV export with the header {@code Part,Color,Quantity[,Is Spare]}.
 */
@Component
public class RebrickableCsvAdapter implements InventoryAdapter {

    private final CsvMapper csvMapper = new CsvMapper();

    @Override
    public String name() {
        return "Rebrickable CSV";
    }

    @Override
    public String signature() {
        return "Part,Color,Quantity";
    }

    @Override
    public String extension() {
        return ".csv";
    }

    @Override
    public String identityColumn() {
        return "Part";
    }

    @Override
    public String quantityColumn() {
        return "Quantity";
    }

    @Override
    public List<Map<String, Object>> parse(final Path file) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, Object>> rows = new ArrayList<>();
        try (MappingIterator<Map<String, Object>> it = csvMapper
                .readerFor(Map.class)
                .with(schema)
                .readValues(file.toFile())) {
            while (it.hasNext()) {
                rows.add(it.next());
            }
        }
        return rows;
    }
}
