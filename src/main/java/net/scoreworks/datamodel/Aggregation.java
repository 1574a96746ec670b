/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel;

import net.scoreworks.datamodel.exceptions.InvariantViolationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;


/**
 * Ordered, owning collection of children held by a {@link PublicObject}. Each element is exclusively owned by the
 * holder: an object that already has a parent is rejected instead of being reparented. Every successful add or
 * remove keeps the parent pointer of the child and its membership in this list in sync and is published to the
 * {@link Notifier} of the holder's {@link ModelScope}.
 * @param <T> class-type of the children
 * @param <K> class-type of the secondary key the children can be looked up by
 */
public class Aggregation<T extends AbstractModelObject, K> implements Iterable<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Aggregation.class);

    private final PublicObject holder;
    private final String name;
    private final Class<T> type;
    private final Function<T, K> keyFunction;
    private final List<T> elements = new ArrayList<>();

    Aggregation(PublicObject holder, String name, Class<T> type, Function<T, K> keyFunction) {
        this.holder = holder;
        this.name = name;
        this.type = type;
        this.keyFunction = keyFunction;
    }

    public String getName() {
        return name;
    }

    public Class<T> getType() {
        return type;
    }

    /**
     * Appends child and makes the holder its parent. A {@link PublicObject} child gets registered in the holder's
     * scope if registration is enabled there.
     * @return false if child already has a parent (including this holder), is an ancestor of the holder, shares its
     * secondary key with a listed child, belongs to another scope or its identifier is registered to another object
     */
    public boolean add(T child) {
        if (child == null)
            return false;
        PublicObject current = child.getParent();
        if (current != null) {
            if (current == holder)
                LOGGER.warn("{} is already listed in {}", child, this);
            else
                LOGGER.warn("{} can not be added to {}: already has another parent {}", child, this, current);
            return false;
        }
        if (indexOf(child) >= 0)
            throw new InvariantViolationException(child + " is listed in " + this + " but has no parent");
        for (PublicObject ancestor = holder; ancestor != null; ancestor = ancestor.getParent()) {
            if (ancestor == child) {
                LOGGER.warn("{} can not be added to {}: it is an ancestor of the holder", child, this);
                return false;
            }
        }
        if (find(keyOf(child)) != null) {
            LOGGER.warn("{} can not be added to {}: an element with key {} is already listed", child, this, keyOf(child));
            return false;
        }
        if (child instanceof PublicObject) {
            PublicObject publicChild = (PublicObject) child;
            if (publicChild.getScope() != holder.getScope()) {
                LOGGER.warn("{} can not be added to {}: it belongs to another scope", child, this);
                return false;
            }
            if (holder.getScope().isRegistrationEnabled() && !publicChild.register())
                return false;
        }
        elements.add(child);
        child.setParent(holder);
        holder.getScope().publishTree(Notification.Operation.ADD, child);
        return true;
    }

    /**
     * Removes child and clears its parent pointer. The identifier of the child stays registered
     * @return false if child is not listed
     */
    public boolean remove(T child) {
        int index = indexOf(child);
        if (index < 0)
            return false;
        return removeAt(index);
    }

    /**
     * @return false if index is out of bounds
     */
    public boolean removeAt(int index) {
        if (index < 0 || index >= elements.size())
            return false;
        T child = elements.get(index);
        if (child.getParent() != holder)
            throw new InvariantViolationException(child + " is listed in " + this + " but points to parent " + child.getParent());
        //publish before unlinking so that consumers still see the parent
        holder.getScope().publishTree(Notification.Operation.REMOVE, child);
        elements.remove(index);
        child.setParent(null);
        return true;
    }

    /**
     * @return false if no child with that key is listed
     */
    public boolean removeByKey(K key) {
        T child = find(key);
        return child != null && remove(child);
    }

    /**
     * @return the first child whose secondary key equals key, or null
     */
    @Nullable
    public T find(K key) {
        for (T element : elements) {
            if (Objects.equals(keyFunction.apply(element), key))
                return element;
        }
        return null;
    }

    public K keyOf(T child) {
        return keyFunction.apply(child);
    }

    public int count() {
        return elements.size();
    }

    /**
     * @throws IndexOutOfBoundsException if index is out of range
     */
    public T at(int index) {
        return elements.get(Objects.checkIndex(index, elements.size()));
    }

    /**
     * @return position of that very instance, or -1
     */
    public int indexOf(T child) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) == child)
                return i;
        }
        return -1;
    }

    public boolean contains(T child) {
        return indexOf(child) >= 0;
    }

    public List<T> asList() {
        return Collections.unmodifiableList(elements);
    }

    @NotNull
    @Override
    public Iterator<T> iterator() {
        return asList().iterator();
    }

    /**
     * Reads the children stored under the name of this aggregation and adds them, or writes the current children.
     * @param factory creates an empty child from its nested archive when reading, may return null to skip it
     */
    public void serialize(Archive archive, Function<Archive, T> factory) {
        if (archive.isReading()) {
            for (Archive nested : archive.readChildren(name)) {
                T child = factory.apply(nested);
                if (child == null) {
                    LOGGER.warn("Skipping element of {} that could not be created", this);
                    continue;
                }
                child.serialize(nested);
                if (!add(child)) {
                    LOGGER.warn("Dropping {} read into {}: it could not be added", child, this);
                    if (child instanceof PublicObject)
                        ((PublicObject) child).deregister();
                }
            }
        }
        else {
            for (T element : elements) {
                element.serialize(archive.writeChild(name));
            }
        }
    }


    //==========PACKAGE-PRIVATE METHODS============================================

    boolean accepts(ModelObject object) {
        return type.isInstance(object);
    }

    boolean attach(ModelObject object) {
        return add(type.cast(object));
    }

    boolean detach(ModelObject object) {
        return remove(type.cast(object));
    }

    /**
     * @return candidate itself if listed, otherwise the listed child sharing its key, or null
     */
    @Nullable
    T member(ModelObject candidate) {
        if (!accepts(candidate))
            return null;
        T typed = type.cast(candidate);
        if (contains(typed))
            return typed;
        return find(keyOf(typed));
    }

    /**
     * Unlinks every child without publishing notifications. Used when the holder is destroyed
     */
    void clear() {
        for (T element : elements) {
            element.setParent(null);
        }
        elements.clear();
    }

    @Override
    public String toString() {
        return holder + "." + name;
    }
}
