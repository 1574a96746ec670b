/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel;

import org.apache.commons.lang3.Validate;


/**
 * Immutable record of a change of the data model, published to a {@link Notifier}. The parent is the object holding
 * the changed object in one of its {@link Aggregation}s at the time of the change.
 */
public final class Notification {

    public enum Operation {
        ADD,
        REMOVE,
        UPDATE
    }

    private final Operation operation;
    private final PublicObject parent;
    private final String parentId;
    private final ModelObject object;

    public Notification(Operation operation, PublicObject parent, ModelObject object) {
        this.operation = Validate.notNull(operation, "operation");
        this.parent = Validate.notNull(parent, "parent");
        this.parentId = parent.getPublicId();
        this.object = Validate.notNull(object, "object");
    }

    public Operation getOperation() {
        return operation;
    }

    public PublicObject getParent() {
        return parent;
    }

    public String getParentId() {
        return parentId;
    }

    public ModelObject getObject() {
        return object;
    }

    @Override
    public String toString() {
        return operation + " " + object + " @ " + parentId;
    }
}
