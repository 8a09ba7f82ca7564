package com.guidestore.addressing;

/**
 * Path-prefix namespaces and the policy each one enforces.
 */
public enum Namespace {
    COORDINATOR("/coordinator/", "coordinator", true, true),
    ARCHIVED("/archived/", "archived", false, false),
    DOCS("/", "docs", false, false);

    private final String prefix;
    private final String folder;
    private final boolean sequentialOnly;
    private final boolean autoArchive;

    Namespace(String prefix, String folder, boolean sequentialOnly, boolean autoArchive) {
        this.prefix = prefix;
        this.folder = folder;
        this.sequentialOnly = sequentialOnly;
        this.autoArchive = autoArchive;
    }

    /**
     * Namespace owning a canonical (slash-rooted) path. Anything outside the
     * reserved prefixes belongs to DOCS.
     */
    public static Namespace of(String canonicalPath) {
        if (canonicalPath == null) {
            return DOCS;
        }
        if (canonicalPath.startsWith(COORDINATOR.prefix) || canonicalPath.equals("/coordinator")) {
            return COORDINATOR;
        }
        if (canonicalPath.startsWith(ARCHIVED.prefix) || canonicalPath.equals("/archived")) {
            return ARCHIVED;
        }
        return DOCS;
    }

    /** Path below this namespace's prefix, without a leading slash. */
    public String relativePath(String canonicalPath) {
        if (canonicalPath.length() <= prefix.length()) {
            return "";
        }
        return canonicalPath.substring(prefix.length());
    }

    public String getPrefix() {
        return prefix;
    }

    /** Folder under the workspace root holding this namespace's files. */
    public String getFolder() {
        return folder;
    }

    /** Tasks may only be taken in document order; fragments are rejected. */
    public boolean isSequentialOnly() {
        return sequentialOnly;
    }

    public boolean isAutoArchive() {
        return autoArchive;
    }
}
