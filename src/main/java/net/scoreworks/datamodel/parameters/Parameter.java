/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel.parameters;

import net.scoreworks.datamodel.Aggregation;
import net.scoreworks.datamodel.Archive;
import net.scoreworks.datamodel.ModelObject;
import net.scoreworks.datamodel.ModelScope;
import net.scoreworks.datamodel.PublicObject;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;


/**
 * A single name/value pair of a {@link ParameterSet}
 */
public class Parameter extends PublicObject {
    private String name = "";
    private String value;

    private final Aggregation<Comment, CommentIndex> comments = aggregation("comment", Comment.class, Comment::getIndex);

    protected Parameter(ModelScope scope, String publicId) {
        super(scope, publicId);
    }

    public static Parameter create(ModelScope scope) {
        return create(scope, scope.generatePublicId(Parameter.class));
    }

    /**
     * @return null if publicId is already taken in scope
     */
    @Nullable
    public static Parameter create(ModelScope scope, String publicId) {
        return created(new Parameter(scope, publicId));
    }

    @Nullable
    public static Parameter find(ModelScope scope, String publicId) {
        return scope.findByIdentifier(publicId, Parameter.class);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @Nullable
    public String getValue() {
        return value;
    }

    public void setValue(@Nullable String value) {
        this.value = value;
    }

    public boolean add(Comment comment) {
        return comments.add(comment);
    }

    public boolean remove(Comment comment) {
        return comments.remove(comment);
    }

    public boolean removeComment(int index) {
        return comments.removeAt(index);
    }

    public boolean removeComment(CommentIndex index) {
        return comments.removeByKey(index);
    }

    public int commentCount() {
        return comments.count();
    }

    public Comment comment(int index) {
        return comments.at(index);
    }

    @Nullable
    public Comment comment(CommentIndex index) {
        return comments.find(index);
    }

    @Nullable
    public ParameterSet parameterSet() {
        PublicObject parent = getParent();
        return parent instanceof ParameterSet ? (ParameterSet) parent : null;
    }

    @Override
    public boolean assign(ModelObject other) {
        if (other == null || other.getClass() != getClass())
            return false;
        Parameter parameter = (Parameter) other;
        name = parameter.name;
        value = parameter.value;
        return true;
    }

    @Override
    public Parameter clone() {
        Parameter clone = new Parameter(getScope(), getPublicId());
        clone.assign(this);
        return clone;
    }

    @Override
    public void serialize(Archive archive) {
        super.serialize(archive);
        name = archive.readWrite("name", name);
        value = archive.readWrite("value", value);
        comments.serialize(archive, nested -> new Comment());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || o.getClass() != getClass())
            return false;
        Parameter other = (Parameter) o;
        return getPublicId().equals(other.getPublicId())
                && Objects.equals(name, other.name)
                && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getPublicId(), name, value);
    }
}
