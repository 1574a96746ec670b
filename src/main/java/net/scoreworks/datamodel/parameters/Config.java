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


/**
 * Root of the configuration tree, holding all {@link ParameterSet}s of a document
 */
public class Config extends PublicObject {
    public static final String DEFAULT_PUBLIC_ID = "Config";

    private final Aggregation<ParameterSet, String> parameterSets = aggregation("parameterSet", ParameterSet.class, ParameterSet::getPublicId);

    protected Config(ModelScope scope, String publicId) {
        super(scope, publicId);
    }

    /**
     * @return null if {@value #DEFAULT_PUBLIC_ID} is already taken in scope
     */
    @Nullable
    public static Config create(ModelScope scope) {
        return create(scope, DEFAULT_PUBLIC_ID);
    }

    @Nullable
    public static Config create(ModelScope scope, String publicId) {
        return created(new Config(scope, publicId));
    }

    public boolean add(ParameterSet parameterSet) {
        return parameterSets.add(parameterSet);
    }

    public boolean remove(ParameterSet parameterSet) {
        return parameterSets.remove(parameterSet);
    }

    public boolean removeParameterSet(int index) {
        return parameterSets.removeAt(index);
    }

    public int parameterSetCount() {
        return parameterSets.count();
    }

    public ParameterSet parameterSet(int index) {
        return parameterSets.at(index);
    }

    @Nullable
    public ParameterSet findParameterSet(String publicId) {
        return parameterSets.find(publicId);
    }

    /**
     * The configuration is a root, it can't be attached anywhere
     */
    @Override
    public boolean attachTo(PublicObject parent) {
        return false;
    }

    @Override
    public boolean assign(ModelObject other) {
        return other != null && other.getClass() == getClass();
    }

    @Override
    public Config clone() {
        return new Config(getScope(), getPublicId());
    }

    @Override
    public void serialize(Archive archive) {
        super.serialize(archive);
        parameterSets.serialize(archive, nested -> {
            String publicId = nested.readString("publicID");
            return publicId == null ? ParameterSet.create(getScope()) : ParameterSet.create(getScope(), publicId);
        });
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || o.getClass() != getClass())
            return false;
        return getPublicId().equals(((Config) o).getPublicId());
    }

    @Override
    public int hashCode() {
        return getPublicId().hashCode();
    }
}
