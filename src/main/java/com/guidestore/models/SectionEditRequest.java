package com.guidestore.models;

/**
 * One structural edit. {@code section} may be {@code slug}, {@code #slug}
 * or {@code /doc.md#slug}; {@code depth} overrides the default heading depth
 * of inserted sections. A {@code version} token from an earlier read makes
 * the edit fail with a conflict if the document changed since.
 */
public class SectionEditRequest {
    private String document;
    private String operation;
    private String section;
    private String title;
    private String content;
    private Integer depth;
    private String version;

    public SectionEditRequest() {}

    public SectionEditRequest(String document, String operation, String section, String title, String content) {
        this.document = document;
        this.operation = operation;
        this.section = section;
        this.title = title;
        this.content = content;
    }

    public String getDocument() { return document; }
    public void setDocument(String document) { this.document = document; }

    public String getOperation() { return operation; }
    public void setOperation(String operation) { this.operation = operation; }

    public String getSection() { return section; }
    public void setSection(String section) { this.section = section; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public Integer getDepth() { return depth; }
    public void setDepth(Integer depth) { this.depth = depth; }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }
}
