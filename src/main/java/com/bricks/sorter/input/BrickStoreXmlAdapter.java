package com.bricks.sorter.input;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * BrickStore document ({@code .bsx}):
 * <pre>{@code
 * <BrickStoreXML>
 *   <Inventory>
 *     <Item><ItemID>3001</ItemID><ColorID>5</ColorID><Qty>4</Qty></Item>
 *   </Inventory>
 * </BrickStoreXML>
 * }</pre>
 */
@Component
public class BrickStoreXmlAdapter implements InventoryAdapter {

    static final String COL_ITEM = "ItemID";
    static final String COL_QTY = "Qty";

    @Override
    public String name() {
        return "BrickStore XML";
    }

    @Override
    public String signature() {
        return "<BrickStoreXML>";
    }

    @Override
    public String extension() {
        return ".bsx";
    }

    @Override
    public String identityColumn() {
        return COL_ITEM;
    }

    @Override
    public String quantityColumn() {
        return COL_QTY;
    }

    @Override
    public List<Map<String, Object>> parse(final Path file) throws IOException {
        Document doc;
        try (InputStream in = Files.newInputStream(file)) {
            doc = Jsoup.parse(in, StandardCharsets.UTF_8.name(), "", Parser.xmlParser());
        }
        if (doc.selectFirst("Inventory") == null) {
            throw new IOException("BrickStore XML without an <Inventory> element: " + file);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Element item : doc.select("Inventory > Item")) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(COL_ITEM, childText(item, COL_ITEM));
            row.put(COL_QTY, childText(item, COL_QTY));
            rows.add(row);
        }
        return rows;
    }

    private static String childText(final Element item, final String tag) {
        Element child = item.getElementsByTag(tag).first();
        return child != null ? child.text() : null;
    }
}
