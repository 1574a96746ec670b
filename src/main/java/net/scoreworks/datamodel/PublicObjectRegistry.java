/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel;

import org.apache.commons.collections4.map.AbstractReferenceMap.ReferenceStrength;
import org.apache.commons.collections4.map.ReferenceMap;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;


/**
 * Maps public identifiers to the live {@link PublicObject}s of one {@link ModelScope}. No two objects can be
 * registered under the same identifier at the same time.
 * <p>
 * Entries don't own their objects: values are weakly referenced, so an object nobody holds any longer silently
 * leaves the registry. Methods are synchronized, which keeps lookups consistent with concurrent (de)registrations.
 */
public class PublicObjectRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(PublicObjectRegistry.class);

    private final Map<String, PublicObject> objects = new ReferenceMap<>(ReferenceStrength.HARD, ReferenceStrength.WEAK);

    public boolean register(PublicObject object) {
        return register(object.getPublicId(), object);
    }

    /**
     * Registering the same object under the same identifier again is a no-op
     * @return false if publicId is blank or registered to another object
     */
    public synchronized boolean register(String publicId, PublicObject object) {
        if (StringUtils.isBlank(publicId) || object == null)
            return false;
        PublicObject existing = objects.get(publicId);
        if (existing == object)
            return true;
        if (existing != null) {
            LOGGER.warn("Duplicate public identifier {}: already registered to another {}", publicId, existing.getClass().getSimpleName());
            return false;
        }
        objects.put(publicId, object);
        LOGGER.debug("Registered {}", publicId);
        return true;
    }

    @Nullable
    public synchronized PublicObject find(String publicId) {
        if (publicId == null)
            return null;
        return objects.get(publicId);
    }

    /**
     * @return the object registered under publicId if it is of the given type, otherwise null
     */
    @Nullable
    public <P extends PublicObject> P find(String publicId, Class<P> type) {
        PublicObject object = find(publicId);
        return type.isInstance(object) ? type.cast(object) : null;
    }

    public boolean contains(String publicId) {
        return find(publicId) != null;
    }

    /**
     * @return false if nothing was registered under publicId
     */
    public synchronized boolean unregister(String publicId) {
        if (publicId == null)
            return false;
        boolean removed = objects.remove(publicId) != null;
        if (removed)
            LOGGER.debug("Unregistered {}", publicId);
        return removed;
    }

    /**
     * Removes the entry of object, leaving an entry of another object with the same identifier untouched
     * @return false if object was not registered
     */
    public synchronized boolean unregister(PublicObject object) {
        if (object == null || objects.get(object.getPublicId()) != object)
            return false;
        return unregister(object.getPublicId());
    }

    public synchronized int size() {
        return objects.size();
    }

    public synchronized void clear() {
        objects.clear();
    }
}
