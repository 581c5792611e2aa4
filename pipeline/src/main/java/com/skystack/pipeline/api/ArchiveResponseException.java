package com.skystack.pipeline.api;

public class ArchiveResponseException extends IllegalStateException {
    public ArchiveResponseException(String message) {
        super(message);
    }

    public ArchiveResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
