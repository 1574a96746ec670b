/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel.exceptions;

/**
 * An exception that gets thrown if a class of the data model declares its aggregations in a way that makes
 * children impossible to route to exactly one of them
 */
public class IllegalDataModelException extends RuntimeException {
    public IllegalDataModelException(Class<?> clazz, String message) {
        super(clazz.getSimpleName() + " " + message);
    }
}
