package com.guidestore.addressing;

import java.util.Objects;

/**
 * Canonical document path plus an optional hierarchical section slug.
 */
public final class Address {

    private final String documentPath;
    private final String sectionSlug;
    private final Namespace namespace;

    Address(String documentPath, String sectionSlug) {
        this.documentPath = documentPath;
        this.sectionSlug = sectionSlug;
        this.namespace = Namespace.of(documentPath);
    }

    public String getDocumentPath() {
        return documentPath;
    }

    public String getSectionSlug() {
        return sectionSlug;
    }

    public boolean hasSection() {
        return sectionSlug != null;
    }

    public Namespace getNamespace() {
        return namespace;
    }

    public Address documentOnly() {
        return sectionSlug == null ? this : new Address(documentPath, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Address)) return false;
        Address other = (Address) o;
        return documentPath.equals(other.documentPath) && Objects.equals(sectionSlug, other.sectionSlug);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentPath, sectionSlug);
    }

    @Override
    public String toString() {
        return sectionSlug == null ? documentPath : documentPath + "#" + sectionSlug;
    }
}
