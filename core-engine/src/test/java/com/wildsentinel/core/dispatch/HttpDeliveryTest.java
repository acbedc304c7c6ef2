package com.wildsentinel.core.dispatch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link HttpDelivery} status classification.
 */
@ExtendWith(MockitoExtension.class)
class HttpDeliveryTest {

    private static final String URL = "https://hooks.example.org/wildlife";

    @Mock
    private HttpClient client;

    @Mock
    private HttpResponse<String> response;

    private HttpDelivery delivery;

    @BeforeEach
    void setUp() {
        delivery = new HttpDelivery(client, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should accept a 2xx response and send the headers given")
    void shouldAcceptSuccess() throws Exception {
        when(response.statusCode()).thenReturn(204);
        doReturn(response).when(client).send(any(HttpRequest.class), any());

        assertThatCode(() -> delivery.postJson(URL, "{}", Map.of("X-Sentinel-Signature", "sha256=ab")))
                .doesNotThrowAnyException();

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(client).send(request.capture(), any());
        assertThat(request.getValue().method()).isEqualTo("POST");
        assertThat(request.getValue().uri().toString()).isEqualTo(URL);
        assertThat(request.getValue().headers().firstValue("X-Sentinel-Signature")).hasValue("sha256=ab");
        assertThat(request.getValue().headers().firstValue("Content-Type")).hasValue("application/json");
    }

    @ParameterizedTest(name = "HTTP {0} is transient")
    @ValueSource(ints = { 408, 429, 500, 502, 503 })
    @DisplayName("Should classify timeouts, throttling and server errors as transient")
    void shouldClassifyTransient(int status) throws Exception {
        when(response.statusCode()).thenReturn(status);
        doReturn(response).when(client).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> delivery.postJson(URL, "{}", Map.of()))
                .isInstanceOf(TransientDeliveryException.class)
                .hasMessage("HTTP " + status + " from hooks.example.org");
    }

    @ParameterizedTest(name = "HTTP {0} is permanent")
    @ValueSource(ints = { 400, 401, 404, 410 })
    @DisplayName("Should classify other client errors as permanent")
    void shouldClassifyPermanent(int status) throws Exception {
        when(response.statusCode()).thenReturn(status);
        doReturn(response).when(client).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> delivery.postJson(URL, "{}", Map.of()))
                .isInstanceOf(PermanentDeliveryException.class);
    }

    @Test
    @DisplayName("Should treat I/O errors and timeouts as transient")
    void shouldTreatIoErrorsAsTransient() throws Exception {
        doThrow(new HttpTimeoutException("timed out")).when(client).send(any(HttpRequest.class), any());
        assertThatThrownBy(() -> delivery.postJson(URL, "{}", Map.of()))
                .isInstanceOf(TransientDeliveryException.class)
                .hasMessageContaining("Timed out");

        doThrow(new IOException("connection reset")).when(client).send(any(HttpRequest.class), any());
        assertThatThrownBy(() -> delivery.postJson(URL, "{}", Map.of()))
                .isInstanceOf(TransientDeliveryException.class)
                .hasMessageContaining("connection reset");
    }

    @ParameterizedTest(name = "\"{0}\" is rejected")
    @ValueSource(strings = { "", "   ", "not a url", "ftp://files.example.org/x", "https:///no-host" })
    @DisplayName("Should reject missing or malformed URLs without calling out")
    void shouldRejectBadUrls(String url) {
        assertThatThrownBy(() -> delivery.postJson(url, "{}", Map.of()))
                .isInstanceOf(PermanentDeliveryException.class);
        verifyNoInteractions(client);
    }
}
