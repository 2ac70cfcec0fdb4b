package com.bricks.sorter.input;

import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LDCad part bin group ({@code .pbg}). Items follow the {@code <items>} line:
 * <pre>
 * [options]
 * …
 * &lt;items&gt;
 * 3001.dat: [color=4] [count=12]
 * </pre>
 */
@Component
public class LdcadPbgAdapter implements InventoryAdapter {

    static final String COL_PART = "DesignID";
    static final String COL_COLOR = "Color";
    static final String COL_COUNT = "Quantity";

    private static final String ITEMS_MARKER = "<items>";

    private static final Pattern ITEM_LINE =
            Pattern.compile("^([^.]*)\\.dat.*\\[color=(\\d+)] \\[count=(\\d+)]$");

    @Override
    public String name() {
        return "LDCad PBG";
    }

    @Override
    public String signature() {
        return "[options]";
    }

    @Override
    public String extension() {
        return ".pbg";
    }

    @Override
    public String identityColumn() {
        return COL_PART;
    }

    @Override
    public String quantityColumn() {
        return COL_COUNT;
    }

    @Override
    public List<Map<String, Object>> parse(final Path file) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        boolean inItems = false;

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!inItems) {
                    inItems = line.startsWith(ITEMS_MARKER);
                    continue;
                }
                Matcher m = ITEM_LINE.matcher(line.strip());
                if (m.matches()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put(COL_PART, m.group(1));
                    row.put(COL_COLOR, m.group(2));
                    row.put(COL_COUNT, m.group(3));
                    rows.add(row);
                }
            }
        }

        if (!inItems) {
            throw new IOException("LDCad file without an " + ITEMS_MARKER + " section: " + file);
        }
        return rows;
    }
}
