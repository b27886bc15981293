package de.bsommerfeld.g11n.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches bundles over HTTP relative to a base URI, e.g.
 * {@code https://cdn.example.com/i18n/} + {@code locales/en/common.json}.
 *
 * <p>
 * Requests are sent asynchronously. Any status outside 2xx is treated as a
 * missing document and yields an empty tree.
 */
public class HttpBundleLoader extends AbstractJsonBundleLoader {

    private static final Logger LOG = LoggerFactory.getLogger(HttpBundleLoader.class);

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final URI baseUri;
    private final Duration timeout;

    public HttpBundleLoader(HttpClient httpClient, URI baseUri, LoadPathTemplate template, ObjectMapper mapper,
            boolean debug, Duration timeout) {
        super(template, mapper, debug);
        this.httpClient = httpClient;
        this.baseUri = withTrailingSlash(baseUri);
        this.timeout = timeout;
    }

    public HttpBundleLoader(URI baseUri, LoadPathTemplate template) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(DEFAULT_TIMEOUT)
                .build(), baseUri, template, new ObjectMapper(), false, DEFAULT_TIMEOUT);
    }

    @Override
    protected CompletableFuture<byte[]> read(String path) {
        URI uri = resolve(path);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> {
                    int status = response.statusCode();
                    if (status < 200 || status >= 300) {
                        LOG.warn("Failed to fetch translations: HTTP {} from {}", status, uri);
                        return null;
                    }
                    return response.body();
                });
    }

    @Override
    protected String describe(String path) {
        return resolve(path).toString();
    }

    URI resolve(String path) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        return baseUri.resolve(relative);
    }

    private static URI withTrailingSlash(URI uri) {
        String text = uri.toString();
        return text.endsWith("/") ? uri : URI.create(text + "/");
    }
}
