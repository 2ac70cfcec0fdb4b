package com.bricks.sorter.error;

/**
 * A clustering parameter is out of range, e.g. more clusters than parts.
 */
public class InvalidParameterException extends SorterException {

    public InvalidParameterException(String message) {
        super(message, "INVALID_PARAMETER");
    }
}
