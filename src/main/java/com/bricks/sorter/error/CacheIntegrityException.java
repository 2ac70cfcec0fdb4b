package com.bricks.sorter.error;

/**
 * The part cache was asked to store the same design id twice in one batch.
 * Signals a programming error; never recovered from.
 */
public class CacheIntegrityException extends SorterException {

    public CacheIntegrityException(String message) {
        super(message, "CACHE_INTEGRITY");
    }
}
