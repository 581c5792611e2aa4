package com.skystack.pipeline.api;

import com.skystack.core.model.ExposureRecord;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.List;

// IOException: unreachable or non-2xx, always transient. InvalidQueryException: the archive rejected the parameters.
public interface ArchiveClient {
    List<ExposureRecord> query(ArchiveQuery query) throws IOException, InterruptedException;

    InputStream download(URI url) throws IOException, InterruptedException;
}
