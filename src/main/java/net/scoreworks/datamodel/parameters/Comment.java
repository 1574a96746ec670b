/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel.parameters;

import net.scoreworks.datamodel.AbstractModelObject;
import net.scoreworks.datamodel.Archive;
import net.scoreworks.datamodel.ModelObject;
import net.scoreworks.datamodel.PublicObject;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;


/**
 * Free text annotation of a {@link ParameterSet} or {@link Parameter}. Comments carry no public identifier, they
 * are addressed by their {@link CommentIndex} within the owner.
 */
public class Comment extends AbstractModelObject {
    private String id;
    private String text = "";
    private Instant start;
    private Instant end;

    public Comment() {}

    public Comment(String id, String text) {
        this.id = id;
        this.text = text;
    }

    public CommentIndex getIndex() {
        return new CommentIndex(id);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    @Nullable
    public Instant getStart() {
        return start;
    }

    public void setStart(@Nullable Instant start) {
        this.start = start;
    }

    @Nullable
    public Instant getEnd() {
        return end;
    }

    public void setEnd(@Nullable Instant end) {
        this.end = end;
    }

    /**
     * @return the owning parameter set, or null if unattached or owned by a {@link Parameter}
     */
    @Nullable
    public ParameterSet parameterSet() {
        PublicObject parent = getParent();
        return parent instanceof ParameterSet ? (ParameterSet) parent : null;
    }

    /**
     * @return the owning parameter, or null if unattached or owned by a {@link ParameterSet}
     */
    @Nullable
    public Parameter parameter() {
        PublicObject parent = getParent();
        return parent instanceof Parameter ? (Parameter) parent : null;
    }

    @Override
    public boolean assign(ModelObject other) {
        if (other == null || other.getClass() != getClass())
            return false;
        Comment comment = (Comment) other;
        id = comment.id;
        text = comment.text;
        start = comment.start;
        end = comment.end;
        return true;
    }

    @Override
    public Comment clone() {
        Comment clone = new Comment();
        clone.assign(this);
        return clone;
    }

    @Override
    public void serialize(Archive archive) {
        id = archive.readWrite("id", id);
        text = archive.readWrite("text", text);
        start = archive.readWrite("start", start);
        end = archive.readWrite("end", end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || o.getClass() != getClass())
            return false;
        Comment other = (Comment) o;
        return Objects.equals(id, other.id)
                && Objects.equals(text, other.text)
                && Objects.equals(start, other.start)
                && Objects.equals(end, other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, text, start, end);
    }

    @Override
    public String toString() {
        return "Comment[" + id + "]";
    }
}
