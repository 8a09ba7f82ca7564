package com.guidestore.errors;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.Map;

/**
 * Serializable error body: {error, code, category, context}.
 */
public class ErrorDetails {

    private final String error;
    private final String code;
    private final String category;
    private final Map<String, Object> context;
    private final int httpStatus;

    private ErrorDetails(String error, ErrorCode code, Map<String, Object> context) {
        this.error = error;
        this.code = code.name();
        this.category = code.getCategory().name();
        this.context = context;
        this.httpStatus = code.getHttpStatus();
    }

    public static ErrorDetails from(Throwable t) {
        if (t instanceof GuideStoreException) {
            GuideStoreException e = (GuideStoreException) t;
            return new ErrorDetails(messageOf(e), e.getCode(), e.getContext());
        }
        if (t instanceof SecurityException) {
            return new ErrorDetails(messageOf(t), ErrorCode.INVALID_PATH, Collections.emptyMap());
        }
        return new ErrorDetails(messageOf(t), ErrorCode.INTERNAL, Collections.emptyMap());
    }

    private static String messageOf(Throwable t) {
        String m = t.getMessage();
        if (m == null || m.isBlank()) {
            m = t.getClass().getSimpleName();
        }
        return m;
    }

    public String getError() {
        return error;
    }

    public String getCode() {
        return code;
    }

    public String getCategory() {
        return category;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    @JsonIgnore
    public int getHttpStatus() {
        return httpStatus;
    }
}
