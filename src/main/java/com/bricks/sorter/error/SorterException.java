package com.bricks.sorter.error;

/**
 * Base type of every failure the sorting pipeline reports.
 *
 * <p>Carries a stable error code so the REST layer can build an
 * {@link ErrorResponse} without inspecting the concrete type.</p>
 */
public abstract class SorterException extends RuntimeException {

    private final String code;

    protected SorterException(String message, String code) {
        super(message);
        this.code = code;
    }

    protected SorterException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Returns the application error code.
     *
     * @return error code, e.g. {@code FORMAT_UNRECOGNIZED}
     */
    public String code() {
        return code;
    }
}
