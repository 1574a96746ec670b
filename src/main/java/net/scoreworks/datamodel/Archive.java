/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;


/**
 * Hook for an external codec. Data model objects expose each scalar attribute by name and each {@link Aggregation}
 * through it, the same code path serving reading and writing. The byte format is entirely up to the implementation.
 */
public interface Archive {

    /**
     * @return true if values are read from the archive into objects
     */
    boolean isReading();

    /**
     * When writing, stores value under name and returns it. When reading, returns the stored value, ignoring value
     */
    @Nullable
    String readWrite(String name, @Nullable String value);

    @Nullable
    Instant readWrite(String name, @Nullable Instant value);

    /**
     * Reads a string attribute without an object to write from. Used to construct children before they read themselves
     */
    @Nullable
    String readString(String name);

    /**
     * @return a new nested archive appended under name, the child writes itself into it
     */
    Archive writeChild(String name);

    /**
     * @return nested archives stored under name in their original order
     */
    List<Archive> readChildren(String name);
}
