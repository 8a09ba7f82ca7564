package com.guidestore.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.guidestore.errors.ErrorDetails;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-operation outcomes of a section batch. Operations run in order and
 * each one succeeds or fails on its own.
 */
public class BatchEditResult {
    private final String document;
    private final List<Entry> results = new ArrayList<>();

    public BatchEditResult(String document) {
        this.document = document;
    }

    public String getDocument() { return document; }

    public List<Entry> getResults() { return results; }

    public int getSucceeded() {
        return (int) results.stream().filter(Entry::isSuccess).count();
    }

    public int getFailed() {
        return results.size() - getSucceeded();
    }

    public void add(Entry entry) {
        results.add(entry);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {
        private final int index;
        private final boolean success;
        private final SectionEditResult result;
        private final ErrorDetails error;

        private Entry(int index, boolean success, SectionEditResult result, ErrorDetails error) {
            this.index = index;
            this.success = success;
            this.result = result;
            this.error = error;
        }

        public static Entry ok(int index, SectionEditResult result) {
            return new Entry(index, true, result, null);
        }

        public static Entry failed(int index, ErrorDetails error) {
            return new Entry(index, false, null, error);
        }

        public int getIndex() { return index; }
        public boolean isSuccess() { return success; }
        public SectionEditResult getResult() { return result; }
        public ErrorDetails getError() { return error; }
    }
}
