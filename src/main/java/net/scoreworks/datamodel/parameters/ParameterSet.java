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

import java.time.Instant;
import java.util.Objects;


/**
 * Named collection of {@link Parameter}s configuring one module, optionally derived from a base set. Owned by a
 * {@link Config}.
 */
public class ParameterSet extends PublicObject {
    private String baseID = "";
    private String moduleID = "";
    private Instant created;

    private final Aggregation<Parameter, String> parameters = aggregation("parameter", Parameter.class, Parameter::getPublicId);
    private final Aggregation<Comment, CommentIndex> comments = aggregation("comment", Comment.class, Comment::getIndex);

    protected ParameterSet(ModelScope scope, String publicId) {
        super(scope, publicId);
    }

    public static ParameterSet create(ModelScope scope) {
        return create(scope, scope.generatePublicId(ParameterSet.class));
    }

    /**
     * @return null if publicId is already taken in scope
     */
    @Nullable
    public static ParameterSet create(ModelScope scope, String publicId) {
        return created(new ParameterSet(scope, publicId));
    }

    @Nullable
    public static ParameterSet find(ModelScope scope, String publicId) {
        return scope.findByIdentifier(publicId, ParameterSet.class);
    }

    public String getBaseID() {
        return baseID;
    }

    public void setBaseID(String baseID) {
        this.baseID = baseID;
    }

    public String getModuleID() {
        return moduleID;
    }

    public void setModuleID(String moduleID) {
        this.moduleID = moduleID;
    }

    /**
     * @return creation time, null if not set
     */
    @Nullable
    public Instant getCreated() {
        return created;
    }

    public void setCreated(@Nullable Instant created) {
        this.created = created;
    }

    /**
     * @return false if parameter already has a parent or its identifier is taken by another object
     */
    public boolean add(Parameter parameter) {
        return parameters.add(parameter);
    }

    public boolean add(Comment comment) {
        return comments.add(comment);
    }

    public boolean remove(Parameter parameter) {
        return parameters.remove(parameter);
    }

    public boolean remove(Comment comment) {
        return comments.remove(comment);
    }

    /**
     * @return false if index is out of bounds
     */
    public boolean removeParameter(int index) {
        return parameters.removeAt(index);
    }

    public boolean removeComment(int index) {
        return comments.removeAt(index);
    }

    public boolean removeComment(CommentIndex index) {
        return comments.removeByKey(index);
    }

    public int parameterCount() {
        return parameters.count();
    }

    public int commentCount() {
        return comments.count();
    }

    public Parameter parameter(int index) {
        return parameters.at(index);
    }

    public Comment comment(int index) {
        return comments.at(index);
    }

    @Nullable
    public Comment comment(CommentIndex index) {
        return comments.find(index);
    }

    @Nullable
    public Parameter findParameter(String publicId) {
        return parameters.find(publicId);
    }

    @Nullable
    public Config config() {
        PublicObject parent = getParent();
        return parent instanceof Config ? (Config) parent : null;
    }

    @Override
    public boolean assign(ModelObject other) {
        if (other == null || other.getClass() != getClass())
            return false;
        ParameterSet parameterSet = (ParameterSet) other;
        baseID = parameterSet.baseID;
        moduleID = parameterSet.moduleID;
        created = parameterSet.created;
        return true;
    }

    @Override
    public ParameterSet clone() {
        ParameterSet clone = new ParameterSet(getScope(), getPublicId());
        clone.assign(this);
        return clone;
    }

    @Override
    public void serialize(Archive archive) {
        super.serialize(archive);
        baseID = archive.readWrite("baseID", baseID);
        moduleID = archive.readWrite("moduleID", moduleID);
        created = archive.readWrite("created", created);
        parameters.serialize(archive, nested -> {
            String publicId = nested.readString("publicID");
            return publicId == null ? Parameter.create(getScope()) : Parameter.create(getScope(), publicId);
        });
        comments.serialize(archive, nested -> new Comment());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || o.getClass() != getClass())
            return false;
        ParameterSet other = (ParameterSet) o;
        return getPublicId().equals(other.getPublicId())
                && Objects.equals(baseID, other.baseID)
                && Objects.equals(moduleID, other.moduleID)
                && Objects.equals(created, other.created);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getPublicId(), baseID, moduleID, created);
    }
}
