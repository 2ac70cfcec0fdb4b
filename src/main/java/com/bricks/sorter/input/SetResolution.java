package com.bricks.sorter.input;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of looking up a set number.
 *
 * @param status {@link Status#FETCHED} when {@code path} holds the set inventory
 * @param path   materialized inventory file, {@code null} unless fetched
 * @param reason why the set number could not be used, {@code null} when fetched
 */
public record SetResolution(Status status, Path path, String reason) {

    public enum Status { FETCHED, NOT_APPLICABLE }

    public static SetResolution fetched(final Path path) {
        return new SetResolution(Status.FETCHED, Objects.requireNonNull(path, "path"), null);
    }

    public static SetResolution notApplicable(final String reason) {
        return new SetResolution(Status.NOT_APPLICABLE, null, reason);
    }

    public boolean isFetched() {
        return status == Status.FETCHED;
    }
}
