package com.bricks.sorter.input;

import com.bricks.sorter.model.PartRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared reduction of raw inventory rows to canonical {@link PartRecord}s.
 * <p>
 * - the design id is the leading digit run of the part number ("3001pr0001" → 3001)
 * - quantities of the same design id are summed across colours
 * - output is ascending by design id
 * <p>
 * Rows without a leading digit run, with a non-positive id, or with a missing,
 * non-numeric or negative quantity are dropped. So is a row that would push
 * its part's total past {@link Long#MAX_VALUE}.
 */
@Slf4j
public final class PartNormalizer {

    private static final Pattern LEADING_DIGITS = Pattern.compile("^(\\d+)");

    private PartNormalizer() {
    }

    /**
     * @param rows           raw rows
     * @param identityColumn column holding the part number
     * @param quantityColumn column holding the count
     * @return one record per design id, ascending
     */
    public static List<PartRecord> normalize(final List<Map<String, Object>> rows,
                                             final String identityColumn,
                                             final String quantityColumn) {
        TreeMap<Integer, Long> totals = new TreeMap<>();
        int dropped = 0;

        for (Map<String, Object> row : rows) {
            Integer designId = designId(row.get(identityColumn));
            Long quantity = quantity(row.get(quantityColumn));
            if (designId == null || quantity == null) {
                dropped++;
                continue;
            }
            long sofar = totals.getOrDefault(designId, 0L);
            if (quantity > Long.MAX_VALUE - sofar) {
                log.warn("Quantity of part {} overflows; row dropped", designId);
                dropped++;
                continue;
            }
            totals.put(designId, sofar + quantity);
        }

        if (dropped > 0) {
            log.warn("Dropped {} of {} inventory rows without a usable part number or quantity",
                    dropped, rows.size());
        }

        List<PartRecord> out = new ArrayList<>(totals.size());
        totals.forEach((id, qty) -> out.add(new PartRecord(id, qty)));
        return out;
    }

    /**
     * Extracts the leading digit run of a part number.
     *
     * @param raw part number as read from the file
     * @return positive design id, or {@code null} when none can be derived
     */
    static Integer designId(final Object raw) {
        String text = StringUtils.trimToEmpty(Objects.toString(raw, null));
        Matcher m = LEADING_DIGITS.matcher(text);
        if (!m.find()) {
            return null;
        }
        try {
            int id = Integer.parseInt(m.group(1));
            return id > 0 ? id : null;
        } catch (NumberFormatException ex) {
            return null;   // longer than an int
        }
    }

    static Long quantity(final Object raw) {
        if (raw instanceof Number n) {
            long value = n.longValue();
            return value >= 0 ? value : null;
        }
        String text = StringUtils.trimToNull(Objects.toString(raw, null));
        if (text == null) {
            return null;
        }
        try {
            long value = Long.parseLong(text);
            return value >= 0 ? value : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
