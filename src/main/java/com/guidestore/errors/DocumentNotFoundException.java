package com.guidestore.errors;

import java.util.Map;

public class DocumentNotFoundException extends GuideStoreException {

    public DocumentNotFoundException(String path) {
        super(ErrorCode.DOCUMENT_NOT_FOUND, "Document not found: " + path, Map.of("path", path));
    }
}
