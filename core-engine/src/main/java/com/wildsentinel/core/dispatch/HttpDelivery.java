package com.wildsentinel.core.dispatch;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Single-attempt JSON {@code POST} shared by the HTTP-based channels.
 *
 * <p>
 * Response classification: 2xx succeeds; 408, 429 and 5xx are transient;
 * every other status is permanent. I/O errors and timeouts are transient; a
 * malformed URL is permanent.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpDelivery {

    private final HttpClient client;
    private final Duration timeout;

    public HttpDelivery(HttpClient client, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    public HttpDelivery(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), timeout);
    }

    /**
     * POST {@code json} to {@code url}.
     *
     * @throws TransientDeliveryException on timeouts, I/O errors and
     *                                    retryable status codes
     * @throws PermanentDeliveryException on malformed URLs and client errors
     */
    public void postJson(String url, String json, Map<String, String> headers) throws DeliveryException {
        URI uri = parse(url);
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        headers.forEach(request::header);

        HttpResponse<String> response;
        try {
            response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientDeliveryException("Timed out after " + timeout + " posting to " + uri.getHost(), e);
        } catch (IOException e) {
            throw new TransientDeliveryException("I/O error posting to " + uri.getHost() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientDeliveryException("Interrupted posting to " + uri.getHost(), e);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        String message = "HTTP " + status + " from " + uri.getHost();
        if (status == 408 || status == 429 || status >= 500) {
            throw new TransientDeliveryException(message);
        }
        throw new PermanentDeliveryException(message);
    }

    private static URI parse(String url) throws PermanentDeliveryException {
        if (url == null || url.isBlank()) {
            throw new PermanentDeliveryException("No URL configured");
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new PermanentDeliveryException("Malformed webhook URL: " + url);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new PermanentDeliveryException("Malformed webhook URL: " + url, e);
        }
    }
}
