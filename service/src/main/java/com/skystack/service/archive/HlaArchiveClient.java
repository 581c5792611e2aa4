package com.skystack.service.archive;

import com.skystack.core.model.ExposureRecord;
import com.skystack.pipeline.api.ArchiveClient;
import com.skystack.pipeline.api.ArchiveQuery;
import com.skystack.pipeline.api.ArchiveUnavailableException;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public final class HlaArchiveClient implements ArchiveClient {
    private static final Logger LOGGER = Logger.getLogger(HlaArchiveClient.class.getName());

    public static final URI DEFAULT_ENDPOINT = URI.create("https://hla.stsci.edu/cgi-bin/hlaSIAP.cgi");
    static final String IMAGE_FORMAT = "image/jpeg";

    private final HttpClient httpClient;
    private final URI endpoint;
    private final Duration timeout;

    public HlaArchiveClient(HttpClient httpClient, Duration timeout) {
        this(httpClient, DEFAULT_ENDPOINT, timeout);
    }

    public HlaArchiveClient(HttpClient httpClient, URI endpoint, Duration timeout) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    @Override
    public List<ExposureRecord> query(ArchiveQuery query) throws IOException, InterruptedException {
        URI uri = queryUri(endpoint, query);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/x-votable+xml,text/xml")
                .build();
        HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        if (response.statusCode() / 100 != 2) {
            throw new ArchiveUnavailableException(uri, response.statusCode());
        }
        List<ExposureRecord> records = VoTableParser.parse(response.body());
        LOGGER.fine("Archive returned " + records.size() + " rows for " + uri);
        return records;
    }

    @Override
    public InputStream download(URI url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(url)
                .GET()
                .timeout(timeout)
                .build();
        HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        if (response.statusCode() / 100 != 2) {
            response.body().close();
            throw new ArchiveUnavailableException(url, response.statusCode());
        }
        return response.body();
    }

    static URI queryUri(URI endpoint, ArchiveQuery query) {
        StringBuilder uri = new StringBuilder(endpoint.toString())
                .append("?POS=").append(plain(query.center().rightAscension()))
                .append(',').append(plain(query.center().declination()))
                .append("&size=").append(plain(query.radiusDegrees()))
                .append("&imagetype=").append(encode(query.productType()))
                .append("&inst=").append(encode(query.instrument()))
                .append("&format=").append(IMAGE_FORMAT)
                .append("&autoscale=").append(plain(query.autoscale()))
                .append("&asinh=").append(query.asinh());
        if (!query.spectralElements().isEmpty()) {
            uri.append("&spectral_elt=").append(query.spectralElements().stream()
                    .map(HlaArchiveClient::encode)
                    .collect(Collectors.joining(",")));
        }
        return URI.create(uri.toString());
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
