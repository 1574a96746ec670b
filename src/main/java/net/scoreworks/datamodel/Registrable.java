/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel;

/**
 * Specifies methods an identifier-bearing object must have to take part in a {@link PublicObjectRegistry}.
 */
public interface Registrable {

    String getPublicId();

    /**
     * @return true if the registry of the object's scope maps its identifier to this very instance
     */
    boolean isRegistered();

    /**
     * Registers the object under its identifier. Registering an already registered object is a no-op
     * @return false if the identifier is taken by another object
     */
    boolean register();

    /**
     * Removes the registry entry of this object. Entries of other objects sharing the identifier are kept
     * @return false if this object was not registered
     */
    boolean deregister();
}
