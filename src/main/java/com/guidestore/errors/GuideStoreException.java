package com.guidestore.errors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception carrying a stable {@link ErrorCode} and an immutable
 * map of diagnostic context.
 */
public class GuideStoreException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> context;

    public GuideStoreException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public GuideStoreException(ErrorCode code, String message, Throwable cause) {
        this(code, message, null, cause);
    }

    public GuideStoreException(ErrorCode code, String message, Map<String, ?> context) {
        this(code, message, context, null);
    }

    public GuideStoreException(ErrorCode code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.context = copy(context);
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /**
     * Wraps an unexpected I/O failure as an INTERNAL error, keeping the
     * original message in the context.
     */
    public static GuideStoreException internal(String message, Throwable cause) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("detail", cause != null ? String.valueOf(cause.getMessage()) : "");
        return new GuideStoreException(ErrorCode.INTERNAL, message, ctx, cause);
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> m = new LinkedHashMap<>();
        input.forEach(m::put);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
            + "{code=" + code
            + ", message=" + getMessage()
            + (context.isEmpty() ? "" : ", context=" + context)
            + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
            + '}';
    }
}
