package com.guidestore.errors;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The file changed between snapshot and write. The caller decides whether to
 * re-read and retry.
 */
public class ConflictException extends GuideStoreException {

    public ConflictException(String path, Object expectedVersion, Object actualVersion) {
        super(ErrorCode.CONFLICT, "Document was modified concurrently: " + path, context(path, expectedVersion, actualVersion));
    }

    private static Map<String, Object> context(String path, Object expected, Object actual) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("path", path);
        ctx.put("expectedVersion", String.valueOf(expected));
        ctx.put("actualVersion", actual == null ? "missing" : actual.toString());
        return ctx;
    }
}
