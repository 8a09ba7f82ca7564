package com.guidestore.errors;

import java.util.Map;

/** Filesystem failure while relocating a document into the archive. */
public class ArchiveIoException extends GuideStoreException {

    public ArchiveIoException(String message, Map<String, ?> context, Throwable cause) {
        super(ErrorCode.ARCHIVE_IO, message, context, cause);
    }
}
