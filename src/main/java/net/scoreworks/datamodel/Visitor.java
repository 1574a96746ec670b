/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel;

/**
 * Externally supplied traversal logic. Data model objects hand themselves and the children of their
 * {@link Aggregation}s to the visitor in insertion order.
 */
public interface Visitor {

    enum TraversalMode {
        /** parents before their children */
        TOP_DOWN,
        /** children before their parents */
        BOTTOM_UP
    }

    TraversalMode getTraversal();

    /**
     * Visit an object that can hold children
     * @return false to skip the children of object. Ignored for {@link TraversalMode#BOTTOM_UP}
     */
    boolean visit(PublicObject object);

    /**
     * Visit a leaf object
     */
    void visit(ModelObject object);

    /**
     * Invoked after all children of a {@link PublicObject} were visited top-down
     */
    default void finished() {}
}
