package ru.oparin.forge.service.provider;

import org.junit.jupiter.api.Test;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import ru.oparin.forge.exception.InvalidProviderRequestException;
import ru.oparin.forge.exception.ProviderApiException;
import ru.oparin.forge.exception.ProviderException;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderErrorHandlerTest {

    private final ProviderErrorHandler errorHandler = new ProviderErrorHandler();

    @Test
    void providerExceptionsPassThrough() {
        InvalidProviderRequestException original = new InvalidProviderRequestException("luma", "prompt", "Prompt is required");

        assertThat(errorHandler.translate("luma", original)).isSameAs(original);
    }

    @Test
    void timeoutBecomesGatewayTimeout() {
        ProviderException error = errorHandler.translate("stability", new TimeoutException("Did not observe any item"));

        assertThat(error.getErrorCode()).isEqualTo(504);
        assertThat(error.getStatus()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
    }

    @Test
    void connectionFailureBecomesServiceUnavailableWithCause() {
        WebClientRequestException cause = new WebClientRequestException(new IOException("Connection reset"),
                HttpMethod.GET, URI.create("http://runway.test/v1/tasks/1"), new HttpHeaders());

        ProviderException error = errorHandler.translate("runway", cause);

        assertThat(error).isInstanceOf(ProviderApiException.class);
        assertThat(error.getErrorCode()).isEqualTo(503);
        assertThat(error.getCause()).isSameAs(cause);
    }

    @Test
    void responseExceptionKeepsStatusAndBody() {
        WebClientResponseException cause = WebClientResponseException.create(429, "Too Many Requests", new HttpHeaders(),
                "{\"error\":\"rate limited\"}".getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);

        ProviderApiException error = (ProviderApiException) errorHandler.translate("ideogram", cause);

        assertThat(error.getErrorCode()).isEqualTo(429);
        assertThat(error.getErrorMessage()).isEqualTo("{\"error\":\"rate limited\"}");
        assertThat(error.getMessage()).isEqualTo("[ideogram] 429: {\"error\":\"rate limited\"}");
    }

    @Test
    void undecodableBodyBecomesMalformedResponse() {
        ProviderApiException error = (ProviderApiException) errorHandler.translate("luma",
                new DecodingException("JSON decoding error: Unexpected character"));

        assertThat(error.getErrorCode()).isEqualTo(500);
        assertThat(error.getErrorMessage()).startsWith("Malformed response from provider:");
    }

    @Test
    void unknownErrorIsWrapped() {
        ProviderException error = errorHandler.translate("openai", new IllegalStateException("boom"));

        assertThat(error).isInstanceOf(ProviderApiException.class);
        assertThat(error.getErrorCode()).isEqualTo(500);
        assertThat(error.getCause()).isInstanceOf(IllegalStateException.class);
    }
}
