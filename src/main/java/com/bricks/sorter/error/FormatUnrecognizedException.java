package com.bricks.sorter.error;

/**
 * No inventory adapter accepted the input: neither a set number could be
 * resolved nor did any file signature match and parse.
 */
public class FormatUnrecognizedException extends SorterException {

    public FormatUnrecognizedException(String message) {
        super(message, "FORMAT_UNRECOGNIZED");
    }
}
