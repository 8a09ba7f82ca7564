package com.guidestore.errors;

import java.util.Map;

/**
 * Raised when a path, section reference or request parameter cannot be
 * resolved. Always raised before any file I/O takes place.
 */
public class AddressingException extends GuideStoreException {

    public AddressingException(ErrorCode code, String message) {
        super(code, message);
    }

    public AddressingException(ErrorCode code, String message, Map<String, ?> context) {
        super(code, message, context);
    }

    public static AddressingException invalidPath(String path, String reason) {
        return new AddressingException(ErrorCode.INVALID_PATH,
            "Invalid path '" + path + "': " + reason, Map.of("path", String.valueOf(path)));
    }

    public static AddressingException missingParameter(String name) {
        return new AddressingException(ErrorCode.MISSING_PARAMETER,
            "Missing required parameter: " + name, Map.of("parameter", name));
    }

    public static AddressingException invalidParameter(String name, String reason) {
        return new AddressingException(ErrorCode.INVALID_PARAMETER,
            "Invalid parameter '" + name + "': " + reason, Map.of("parameter", name));
    }
}
