package dev.badgersnacks.albionmarket.sources;

import dev.badgersnacks.albionmarket.catalog.CatalogJsonCodec;
import dev.badgersnacks.albionmarket.catalog.RawItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Downloads the formatted item dump published by the ao-bin-dumps project.
 */
public class HttpRawCatalogSource implements RawCatalogSource {

    public static final String DEFAULT_URL =
            "https://raw.githubusercontent.com/broderickhyman/ao-bin-dumps/master/formatted/items.json";

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpRawCatalogSource.class);
    private static final String USER_AGENT = "albion-market-resolver";

    private final URI uri;
    private final HttpClient httpClient;
    private final CatalogJsonCodec codec;

    public HttpRawCatalogSource(URI uri) {
        this(uri, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(20)).build(), new CatalogJsonCodec());
    }

    public HttpRawCatalogSource(URI uri, HttpClient httpClient, CatalogJsonCodec codec) {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public List<RawItem> fetch() throws IOException {
        LOGGER.info("Fetching item dump from {}", uri);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while fetching " + uri);
        }
        try (InputStream body = response.body()) {
            if (response.statusCode() != 200) {
                throw new IOException("Failed to fetch item dump from " + uri + ": HTTP " + response.statusCode());
            }
            List<RawItem> items = codec.readRawItems(body);
            LOGGER.info("Fetched {} raw items", items.size());
            return items;
        }
    }
}
