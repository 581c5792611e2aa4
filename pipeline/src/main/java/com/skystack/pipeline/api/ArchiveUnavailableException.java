package com.skystack.pipeline.api;

import java.io.IOException;
import java.net.URI;

public class ArchiveUnavailableException extends IOException {
    private final int statusCode;

    public ArchiveUnavailableException(URI uri, int statusCode) {
        super("Archive request failed with status " + statusCode + " for " + uri);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
