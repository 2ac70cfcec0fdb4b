package com.bricks.sorter.input;

import com.bricks.sorter.model.PartRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads one inventory file format and reduces it to canonical part records.
 *
 * <p>Dispatch is a literal prefix test on the first bytes of the file; the raw
 * rows keep the format's own column names and are reduced by
 * {@link PartNormalizer} using {@link #identityColumn()} and
 * {@link #quantityColumn()}.</p>
 */
public interface InventoryAdapter {

    /**
     * @return short format name used in log lines
     */
    String name();

    /**
     * @return the literal text every file of this format starts with
     */
    String signature();

    /**
     * @return file extension offered in upload dialogs, e.g. ".csv"
     */
    String extension();

    /**
     * @return raw column holding the part number
     */
    String identityColumn();

    /**
     * @return raw column holding the piece count
     */
    String quantityColumn();

    /**
     * Cheap prefix test against the head of a file.
     *
     * @param head first bytes of the file (may be shorter than the signature)
     * @return {@code true} iff {@code head} starts with {@link #signature()}
     */
    default boolean matchSignature(final byte[] head) {
        byte[] magic = signature().getBytes(StandardCharsets.UTF_8);
        if (head == null || head.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (head[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param file inventory file whose signature matched
     * @return rows keyed by the format's column names; may be empty but never {@code null}
     * @throws IOException if the file cannot be read or is structurally invalid
     */
    List<Map<String, Object>> parse(Path file) throws IOException;

    /**
     * Reduces raw rows to one record per design id, ascending.
     *
     * @param rows output of {@link #parse(Path)}
     * @return canonical records
     */
    default List<PartRecord> normalize(final List<Map<String, Object>> rows) {
        return PartNormalizer.normalize(rows, identityColumn(), quantityColumn());
    }
}
