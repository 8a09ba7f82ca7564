package com.guidestore.sections;

/**
 * Outcome of a structural edit: the complete rewritten document plus the
 * section it produced or touched.
 */
public final class SectionEdit {

    private final SectionOperation operation;
    private final String content;
    private final String slug;
    private final String path;
    private final int depth;
    private final String removedContent;

    SectionEdit(SectionOperation operation, String content, String slug, String path, int depth, String removedContent) {
        this.operation = operation;
        this.content = content;
        this.slug = slug;
        this.path = path;
        this.depth = depth;
        this.removedContent = removedContent;
    }

    public SectionOperation getOperation() {
        return operation;
    }

    /** Full document text after the edit. */
    public String getContent() {
        return content;
    }

    public String getSlug() {
        return slug;
    }

    public String getPath() {
        return path;
    }

    public int getDepth() {
        return depth;
    }

    /** Only set for {@link SectionOperation#REMOVE}. */
    public String getRemovedContent() {
        return removedContent;
    }
}
