/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel;

import org.jetbrains.annotations.Nullable;

/**
 * Base interface for every class of the data model. Defines the capabilities each object shares: equality and
 * assignment of its scalar attributes, cloning, and membership in at most one owning {@link PublicObject}.
 * <p>
 * {@link Object#equals(Object)} of a data model class compares scalar attributes only. Children held in
 * {@link Aggregation}s are never part of the comparison.
 */
public interface ModelObject {

    /**
     * @return the object owning this one in one of its {@link Aggregation}s, or null if unattached
     */
    @Nullable
    PublicObject getParent();

    /**
     * Copies the scalar attributes of other into this object. Children are not touched.
     * @return false if other is of a different runtime type
     */
    boolean assign(ModelObject other);

    /**
     * @return a copy with the same scalar attributes, no parent and empty aggregations. A cloned
     * {@link PublicObject} shares the identifier of its original but is not registered
     */
    ModelObject clone();

    /**
     * Adds this object to the aggregation of parent that accepts its type
     * @return false if already attached or parent holds no aggregation for this type
     */
    boolean attachTo(PublicObject parent);

    /**
     * Removes this object from parent. Its identifier, if any, stays registered
     * @return false if this object is not attached to parent
     */
    boolean detachFrom(PublicObject parent);

    /**
     * Removes this object from its current parent
     * @return false if this object is not attached
     */
    boolean detach();

    /**
     * Tells the parent that the scalar attributes of this object changed in place
     * @return false if this object is not attached
     */
    boolean update();

    void accept(Visitor visitor);

    /**
     * Reads or writes every scalar attribute and every aggregation of this object
     */
    void serialize(Archive archive);
}
