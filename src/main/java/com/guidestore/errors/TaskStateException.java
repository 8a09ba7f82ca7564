package com.guidestore.errors;

import java.util.Map;

public class TaskStateException extends GuideStoreException {

    public TaskStateException(ErrorCode code, String message) {
        super(code, message);
    }

    public TaskStateException(ErrorCode code, String message, Map<String, ?> context) {
        super(code, message, context);
    }
}
