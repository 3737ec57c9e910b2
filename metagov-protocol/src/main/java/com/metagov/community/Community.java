package com.metagov.community;

import java.util.Objects;

/**
 * Tenant boundary for plugin configuration and identity scoping. Identified externally by its slug.
 */
public final class Community {

    private final long id;
    private final String slug;
    private final String readableName;

    public Community(long id, String slug, String readableName) {
        this.id = id;
        this.slug = Objects.requireNonNull(slug, "slug");
        this.readableName = readableName != null ? readableName : "";
    }

    public long getId() {
        return id;
    }

    public String getSlug() {
        return slug;
    }

    public String getReadableName() {
        return readableName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Community that = (Community) o;
        return id == that.id && slug.equals(that.slug);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, slug);
    }

    @Override
    public String toString() {
        if (!readableName.isEmpty()) {
            return readableName + " (" + slug + ")";
        }
        return slug;
    }
}
