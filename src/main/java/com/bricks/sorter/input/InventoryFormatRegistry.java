package com.bricks.sorter.input;

import com.bricks.sorter.error.FormatUnrecognizedException;
import com.bricks.sorter.model.PartRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * <h2>InventoryFormatRegistry</h2>
 *
 * <p>Closed, ordered list of the supported inventory formats. A load tries,
 * in priority order:</p>
 * <ol>
 *   <li>the set number, through {@link RebrickableSetResolver};</li>
 *   <li>the uploaded file, matched against each adapter's signature.</li>
 * </ol>
 * <p>The first adapter whose signature matches <em>and</em> whose parse
 * succeeds wins.</p>
 */
@Slf4j
@Component
public class InventoryFormatRegistry {

    private final List<InventoryAdapter> adapters;

    private final RebrickableSetResolver setResolver;

    private final int headLength;

    public InventoryFormatRegistry(final RebrickableJsonAdapter json,
                                   final RebrickableCsvAdapter csv,
                                   final BrickStoreXmlAdapter xml,
                                   final LdcadPbgAdapter pbg,
                                   final RebrickableSetResolver setResolver) {
        this.adapters = List.of(json, csv, xml, pbg);
        this.setResolver = setResolver;
        this.headLength = adapters.stream()
                .mapToInt(a -> a.signature().getBytes(StandardCharsets.UTF_8).length)
                .max()
                .orElse(0);
    }

    /**
     * @return adapters in dispatch order
     */
    public List<InventoryAdapter> adapters() {
        return adapters;
    }

    /**
     * @return comma-separated extensions for an upload {@code accept} attribute
     */
    public String supportedExtensions() {
        return adapters.stream().map(InventoryAdapter::extension).collect(Collectors.joining(","));
    }

    /**
     * @return {@code true} when set numbers can be looked up
     */
    public boolean isSetLookupEnabled() {
        return setResolver.isEnabled();
    }

    /**
     * Loads the canonical inventory from a set number or a file.
     *
     * @param setNumber set number, may be {@code null} or blank
     * @param file      uploaded inventory, may be {@code null}
     * @return one record per design id, ascending
     * @throws FormatUnrecognizedException if neither input yields an inventory
     */
    public List<PartRecord> load(final String setNumber, final Path file) {
        if (StringUtils.isNotBlank(setNumber)) {
            SetResolution resolution = setResolver.resolve(setNumber);
            if (resolution.isFetched()) {
                try {
                    return decode(resolution.path());
                } finally {
                    deleteQuietly(resolution.path());
                }
            }
            log.info("Set number not used: {}", resolution.reason());
        }
        if (file == null) {
            throw new FormatUnrecognizedException("No inventory given: neither a usable set number nor a file");
        }
        return decode(file);
    }

    /**
     * Runs the signature dispatch on one file.
     *
     * @param file inventory file
     * @return one record per design id, ascending
     * @throws FormatUnrecognizedException if no adapter accepts the file
     */
    public List<PartRecord> decode(final Path file) {
        byte[] head = readHead(file);

        for (InventoryAdapter adapter : adapters) {
            if (!adapter.matchSignature(head)) {
                continue;
            }
            List<Map<String, Object>> rows;
            try {
                rows = adapter.parse(file);
            } catch (IOException | RuntimeException ex) {
                log.warn("{} signature matched but parse failed for {}: {}",
                        adapter.name(), file.getFileName(), ex.toString());
                continue;
            }
            List<PartRecord> records = adapter.normalize(rows);
            log.info("Loaded {} as {}: {} rows -> {} parts",
                    file.getFileName(), adapter.name(), rows.size(), records.size());
            return records;
        }
        throw new FormatUnrecognizedException("Unrecognized inventory format: " + file.getFileName());
    }

    private byte[] readHead(final Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return in.readNBytes(headLength);
        } catch (IOException ex) {
            throw new FormatUnrecognizedException("Cannot read inventory " + file.getFileName() + ": " + ex.getMessage());
        }
    }

    private static void deleteQuietly(final Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Could not delete {}: {}", path, ex.toString());
        }
    }
}
