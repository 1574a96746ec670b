/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel;

import net.scoreworks.datamodel.exceptions.InvariantViolationException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;


/**
 * Base class for each class in the data model. Holds the back-reference to the owning {@link PublicObject} and
 * implements the attach/detach protocol on top of the owner's {@link Aggregation}s.
 * <p>
 * The back-reference is weak: an object is owned by the aggregation it is listed in, never by its child.
 */
public abstract class AbstractModelObject implements ModelObject {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractModelObject.class);

    /**
     * Reference to the owner. Only written by the {@link Aggregation} listing this object
     */
    private transient WeakReference<PublicObject> parent;

    @Override
    @Nullable
    public PublicObject getParent() {
        return parent == null ? null : parent.get();
    }

    void setParent(@Nullable PublicObject parent) {
        this.parent = parent == null ? null : new WeakReference<>(parent);
    }

    @Override
    public boolean attachTo(PublicObject parent) {
        if (parent == null)
            return false;
        PublicObject current = getParent();
        if (current != null) {
            LOGGER.warn("{} is already attached to {}", this, current);
            return false;
        }
        Aggregation<?, ?> aggregation = parent.aggregationFor(this);
        if (aggregation == null) {
            LOGGER.warn("{} can not hold objects of type {}", parent.getClass().getSimpleName(), getClass().getSimpleName());
            return false;
        }
        return aggregation.attach(this);
    }

    @Override
    public boolean detachFrom(PublicObject parent) {
        if (parent == null || getParent() != parent) {
            LOGGER.warn("{} is not attached to {}", this, parent);
            return false;
        }
        Aggregation<?, ?> aggregation = parent.aggregationFor(this);
        //the parent pointer says we are a child of parent, so parent must list us
        if (aggregation == null || !aggregation.detach(this))
            throw new InvariantViolationException(this + " points to parent " + parent + " which does not list it");
        return true;
    }

    @Override
    public boolean detach() {
        PublicObject current = getParent();
        if (current == null) {
            LOGGER.debug("{} is not attached, nothing to detach", this);
            return false;
        }
        return detachFrom(current);
    }

    @Override
    public boolean update() {
        PublicObject current = getParent();
        if (current == null)
            return false;
        return current.updateChild(this);
    }

    /**
     * Objects without aggregations are visited as leaves regardless of the traversal mode
     */
    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }

    /**
     * Narrows the return type of {@link Object#clone()} and makes it public. Implementations construct
     * a fresh instance rather than relying on {@link Cloneable}
     */
    @Override
    public abstract ModelObject clone();

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
