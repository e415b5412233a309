package com.iptv.gateway.core.model;

import java.util.Objects;

/**
 * Catalog category. Identity is the id scoped within its content kind.
 * Pure domain object with no framework dependencies.
 */
public class Category {

    private final String id;
    private final String name;
    private final String parentId;
    private final ContentKind contentKind;

    public Category(String id, String name, String parentId, ContentKind contentKind) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.parentId = parentId;
        this.contentKind = Objects.requireNonNull(contentKind, "contentKind must not be null");
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getParentId() {
        return parentId;
    }

    public ContentKind getContentKind() {
        return contentKind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Category that = (Category) o;
        return Objects.equals(id, that.id) && contentKind == that.contentKind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, contentKind);
    }
}
