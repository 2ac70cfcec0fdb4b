package com.bricks.sorter.error;

/**
 * A catalog call (set inventory, part breadcrumbs or part image) failed.
 *
 * <p>The enrichment phase recovers from it with fallback labels or a missing
 * image; it only reaches a caller if a lookup is used outside that phase.</p>
 */
public class RemoteLookupException extends SorterException {

    public RemoteLookupException(String message) {
        super(message, "REMOTE_LOOKUP_FAILED");
    }

    public RemoteLookupException(String message, Throwable cause) {
        super(message, "REMOTE_LOOKUP_FAILED", cause);
    }
}
