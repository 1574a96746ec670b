/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel.exceptions;

/**
 * Thrown if the parent pointer of an object disagrees with the aggregation listing it. This can't be caused by a
 * rejected operation, only by a single-parent invariant that was already broken before.
 */
public class InvariantViolationException extends RuntimeException {
    public InvariantViolationException(String message) {
        super(message);
    }
}
