package com.guidestore.sections;

/**
 * One parsed heading and the character offsets of its section.
 *
 * <pre>
 * startOffset -> "## Title"      (lineEnd is the end of this line, before the newline)
 * bodyOffset  -> body text ...
 *                ### Child ...   (firstChildOffset, or endOffset when there are no children)
 * endOffset   -> next heading with depth &lt;= this one, or end of document
 * </pre>
 */
public final class Heading {

    private final int index;
    private final String slug;
    private final String path;
    private final String title;
    private final int depth;
    private final int parentIndex;
    private final int startOffset;
    private final int lineEnd;
    private final int bodyOffset;
    private final int ownBodyEnd;
    private final int endOffset;

    Heading(int index, String slug, String path, String title, int depth, int parentIndex,
            int startOffset, int lineEnd, int bodyOffset, int ownBodyEnd, int endOffset) {
        this.index = index;
        this.slug = slug;
        this.path = path;
        this.title = title;
        this.depth = depth;
        this.parentIndex = parentIndex;
        this.startOffset = startOffset;
        this.lineEnd = lineEnd;
        this.bodyOffset = bodyOffset;
        this.ownBodyEnd = ownBodyEnd;
        this.endOffset = endOffset;
    }

    public int getIndex() {
        return index;
    }

    /** Unique within the document. */
    public String getSlug() {
        return slug;
    }

    /** Ancestor slugs below the document title joined by '/', e.g. {@code tasks/implement-caching}. */
    public String getPath() {
        return path;
    }

    public String getTitle() {
        return title;
    }

    public int getDepth() {
        return depth;
    }

    /** -1 for top-level headings. */
    public int getParentIndex() {
        return parentIndex;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getLineEnd() {
        return lineEnd;
    }

    public int getBodyOffset() {
        return bodyOffset;
    }

    public int getOwnBodyEnd() {
        return ownBodyEnd;
    }

    public int getEndOffset() {
        return endOffset;
    }

    @Override
    public String toString() {
        return "#".repeat(depth) + " " + title + " {" + path + "}";
    }
}
