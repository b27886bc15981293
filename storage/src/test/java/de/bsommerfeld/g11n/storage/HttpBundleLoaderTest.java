package de.bsommerfeld.g11n.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests request construction and status handling with a mocked
 * {@link HttpClient}.
 */
@ExtendWith(MockitoExtension.class)
class HttpBundleLoaderTest {

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<byte[]> response;

    private HttpBundleLoader loader() {
        return new HttpBundleLoader(httpClient, URI.create("https://cdn.example.com/i18n"),
                LoadPathTemplate.defaultTemplate(), new ObjectMapper(), false, Duration.ofSeconds(2));
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) {
        when(response.statusCode()).thenReturn(status);
        if (status >= 200 && status < 300) {
            when(response.body()).thenReturn(body.getBytes(StandardCharsets.UTF_8));
        }
        when(httpClient.sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenReturn(CompletableFuture.completedFuture(response));
    }

    @Test
    @SuppressWarnings("unchecked")
    void load_shouldRequestResolvedPathRelativeToBaseUri() throws Exception {
        respond(200, "{\"hello\": \"Hola\"}");

        Map<String, Object> tree = loader().load("es", "common").get(1, TimeUnit.SECONDS);

        assertEquals("Hola", tree.get("hello"));
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).sendAsync(request.capture(), any(HttpResponse.BodyHandler.class));
        assertEquals(URI.create("https://cdn.example.com/i18n/locales/es/common.json"), request.getValue().uri());
        assertEquals(Duration.ofSeconds(2), request.getValue().timeout().orElseThrow());
    }

    @Test
    void load_shouldYieldEmptyTreeForErrorStatus() throws Exception {
        respond(404, null);

        assertTrue(loader().load("es", "common").get(1, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    void load_shouldYieldEmptyTreeWhenRequestFails() throws Exception {
        when(httpClient.sendAsync(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenReturn(CompletableFuture.failedFuture(new java.io.IOException("connection refused")));

        assertTrue(loader().load("es", "common").get(1, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void resolve_shouldIgnoreLeadingSlash() {
        assertEquals(URI.create("https://cdn.example.com/i18n/locales/en/common.json"),
                loader().resolve("/locales/en/common.json"));
    }
}
