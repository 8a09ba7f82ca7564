package com.guidestore.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one section edit. {@code action} is one of
 * {@code created}, {@code edited}, {@code removed}, {@code moved};
 * {@code movedFrom} is set only for moves.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SectionEditResult {
    private String document;
    private String operation;
    private String action;
    private String section;
    private String sectionPath;
    private int depth;
    private String removedContent;
    private String diff;
    private String version;
    private String movedFrom;

    public SectionEditResult() {}

    public String getMovedFrom() { return movedFrom; }
    public void setMovedFrom(String movedFrom) { this.movedFrom = movedFrom; }

    public String getDocument() { return document; }
    public void setDocument(String document) { this.document = document; }

    public String getOperation() { return operation; }
    public void setOperation(String operation) { this.operation = operation; }

    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }

    public String getSection() { return section; }
    public void setSection(String section) { this.section = section; }

    public String getSectionPath() { return sectionPath; }
    public void setSectionPath(String sectionPath) { this.sectionPath = sectionPath; }

    public int getDepth() { return depth; }
    public void setDepth(int depth) { this.depth = depth; }

    public String getRemovedContent() { return removedContent; }
    public void setRemovedContent(String removedContent) { this.removedContent = removedContent; }

    public String getDiff() { return diff; }
    public void setDiff(String diff) { this.diff = diff; }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }
}
