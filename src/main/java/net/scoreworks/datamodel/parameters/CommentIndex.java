/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel.parameters;

import java.util.Objects;


/**
 * Secondary key of a {@link Comment} within the aggregation holding it
 */
public final class CommentIndex {
    private final String id;

    public CommentIndex(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof CommentIndex)) {
            return false;
        }
        CommentIndex other = (CommentIndex) o;
        return Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return String.valueOf(id);
    }
}
