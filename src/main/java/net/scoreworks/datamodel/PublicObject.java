/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel;

import net.scoreworks.datamodel.exceptions.IllegalDataModelException;
import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;


/**
 * Base class for data model classes that carry a public identifier and can hold children. The identifier is unique
 * within the {@link PublicObjectRegistry} of the object's {@link ModelScope}. Registering an object and attaching it
 * to a parent are independent: detaching keeps the registration, {@link #destroy()} removes it.
 * <p>
 * Subclasses declare their child collections in their constructor with
 * {@link #aggregation(String, Class, Function)}. Attaching, detaching, updating and visiting children is
 * implemented here on top of these declarations.
 */
public abstract class PublicObject extends AbstractModelObject implements Registrable {
    private static final Logger LOGGER = LoggerFactory.getLogger(PublicObject.class);

    private final transient ModelScope scope;
    private final String publicId;

    /**
     * All aggregations in declaration order, which is also the order children are visited and serialized in
     */
    private final transient List<Aggregation<?, ?>> aggregations = new ArrayList<>();

    protected PublicObject(ModelScope scope, String publicId) {
        this.scope = Validate.notNull(scope, "scope");
        this.publicId = Validate.notBlank(publicId, "publicId");
    }

    /**
     * Registers a freshly constructed object if registration is enabled in its scope. Meant to be called by the
     * static factories of subclasses
     * @return object, or null if its identifier is already taken
     */
    @Nullable
    protected static <P extends PublicObject> P created(P object) {
        ModelScope scope = object.getScope();
        if (!scope.isRegistrationEnabled())
            return object;
        if (scope.getRegistry().contains(object.getPublicId())) {
            LOGGER.warn("Can not create {}: public identifier {} is already taken", object.getClass().getSimpleName(), object.getPublicId());
            return null;
        }
        return object.register() ? object : null;
    }

    /**
     * Declare a child collection. Must be called from the constructor of a subclass
     * @param name name the children are serialized with
     * @param type class-type of the children. Types of different aggregations of one class must not overlap
     * @param keyFunction secondary key of the children used by {@link Aggregation#find(Object)}
     */
    protected <T extends AbstractModelObject, K> Aggregation<T, K> aggregation(String name, Class<T> type, Function<T, K> keyFunction) {
        for (Aggregation<?, ?> existing : aggregations) {
            if (existing.getName().equals(name))
                throw new IllegalDataModelException(getClass(), "declares aggregation \"" + name + "\" twice");
            if (existing.getType().isAssignableFrom(type) || type.isAssignableFrom(existing.getType()))
                throw new IllegalDataModelException(getClass(), "declares aggregations \"" + existing.getName()
                        + "\" and \"" + name + "\" with overlapping types");
        }
        Aggregation<T, K> aggregation = new Aggregation<>(this, name, type, keyFunction);
        aggregations.add(aggregation);
        return aggregation;
    }

    public ModelScope getScope() {
        return scope;
    }

    @Override
    public String getPublicId() {
        return publicId;
    }

    @Override
    public boolean isRegistered() {
        return scope.getRegistry().find(publicId) == this;
    }

    @Override
    public boolean register() {
        return scope.getRegistry().register(this);
    }

    @Override
    public boolean deregister() {
        return scope.getRegistry().unregister(this);
    }

    public List<Aggregation<?, ?>> getAggregations() {
        return Collections.unmodifiableList(aggregations);
    }

    /**
     * @return all children of all aggregations in declaration and insertion order
     */
    public List<ModelObject> getChildren() {
        List<ModelObject> children = new ArrayList<>();
        for (Aggregation<?, ?> aggregation : aggregations) {
            children.addAll(aggregation.asList());
        }
        return children;
    }

    /**
     * Called when the scalar attributes of child changed in place. If child is a detached copy of a member (same
     * secondary key), the member takes over its attributes. Membership is never changed.
     * @return false if neither child nor a member with its key is listed by this object
     */
    public boolean updateChild(ModelObject child) {
        if (child == null)
            return false;
        Aggregation<?, ?> aggregation = aggregationFor(child);
        if (aggregation == null)
            return false;
        AbstractModelObject member = aggregation.member(child);
        if (member == null) {
            LOGGER.warn("{} is not a member of {}", child, aggregation);
            return false;
        }
        if (member != child && !member.assign(child))
            return false;
        scope.publish(new Notification(Notification.Operation.UPDATE, this, member));
        return true;
    }

    /**
     * Ends the life of this object: detaches it from its parent, unlinks all children and removes its registry entry.
     * The children are unlinked without notifications and keep their own registrations
     */
    public void destroy() {
        if (getParent() != null)
            detach();
        for (Aggregation<?, ?> aggregation : aggregations) {
            aggregation.clear();
        }
        deregister();
        LOGGER.debug("Destroyed {}", this);
    }

    /**
     * Visits this object and then the children of each aggregation for {@link Visitor.TraversalMode#TOP_DOWN}, or
     * the children first for {@link Visitor.TraversalMode#BOTTOM_UP}
     */
    @Override
    public void accept(Visitor visitor) {
        if (visitor.getTraversal() == Visitor.TraversalMode.TOP_DOWN && !visitor.visit(this))
            return;
        //copy so that visitors may restructure the tree
        for (ModelObject child : getChildren()) {
            child.accept(visitor);
        }
        if (visitor.getTraversal() == Visitor.TraversalMode.BOTTOM_UP)
            visitor.visit(this);
        else
            visitor.finished();
    }

    @Override
    public void serialize(Archive archive) {
        archive.readWrite("publicID", publicId);
    }

    @Override
    public abstract PublicObject clone();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + publicId + "]";
    }

    @Nullable
    Aggregation<?, ?> aggregationFor(ModelObject child) {
        for (Aggregation<?, ?> aggregation : aggregations) {
            if (aggregation.accepts(child))
                return aggregation;
        }
        return null;
    }
}
