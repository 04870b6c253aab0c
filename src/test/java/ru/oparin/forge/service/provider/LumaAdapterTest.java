package ru.oparin.forge.service.provider;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.forge.config.properties.ImageProvidersProperties;
import ru.oparin.forge.exception.InvalidProviderRequestException;
import ru.oparin.forge.exception.ProviderApiException;
import ru.oparin.forge.exception.ProviderCancelledException;
import ru.oparin.forge.exception.ProviderTimeoutException;
import ru.oparin.forge.exception.UnsupportedProviderOperationException;
import ru.oparin.forge.mapper.LumaMapper;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.service.job.JobEngine;
import ru.oparin.forge.support.StubExchangeFunction;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LumaAdapterTest {

    private static final String API_KEY = "luma-key";
    private static final String ENDPOINT = "/v1/images/generations";
    private static final String PENDING = "{\"id\":\"gen-1\",\"state\":\"dreaming\"}";

    private StubExchangeFunction exchange;
    private LumaAdapter adapter;

    @BeforeEach
    void setUp() {
        ImageProvidersProperties properties = new ImageProvidersProperties();
        properties.getLuma().setUrl("http://luma.test/");
        exchange = new StubExchangeFunction();
        ProviderHttpClient httpClient = new ProviderHttpClient(exchange.webClient(), new ProviderErrorHandler());
        adapter = new LumaAdapter(properties, httpClient, new ModelCatalogCache(), new LumaMapper(), new JobEngine());
    }

    @Test
    void blankPromptFailsBeforeAnyNetworkCall() {
        ImageGenerationRequest request = ImageGenerationRequest.builder().prompt("   ").build();

        StepVerifier.create(adapter.processImageGeneration(ENDPOINT, request, API_KEY))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(InvalidProviderRequestException.class);
                    assertThat(((InvalidProviderRequestException) error).getField()).isEqualTo("prompt");
                    assertThat(((InvalidProviderRequestException) error).getProviderName()).isEqualTo("luma");
                })
                .verify();

        assertThat(exchange.getRequestCount()).isZero();
    }

    @Test
    void pollsUntilCompletedAndReturnsImageUrl() {
        exchange.thenJson(HttpStatus.CREATED, "{\"id\":\"gen-1\",\"state\":\"queued\"}")
                .thenJson(HttpStatus.OK, PENDING)
                .thenJson(HttpStatus.OK, PENDING)
                .thenJson(HttpStatus.OK, "{\"id\":\"gen-1\",\"state\":\"completed\",\"assets\":{\"image\":\"https://cdn.luma/img.jpg\"}}");

        StepVerifier.withVirtualTime(() -> adapter.processImageGeneration(ENDPOINT, request("a lighthouse"), API_KEY))
                .thenAwait(Duration.ofSeconds(15))
                .assertNext(response -> {
                    assertThat(response.getData()).hasSize(1);
                    assertThat(response.getData().get(0).getUrl()).isEqualTo("https://cdn.luma/img.jpg");
                    assertThat(response.getData().get(0).getRevisedPrompt()).isEqualTo("a lighthouse");
                })
                .verifyComplete();

        List<ClientRequest> requests = exchange.getRequests();
        assertThat(requests).hasSize(4);
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(requests.get(0).url().toString()).isEqualTo("http://luma.test/dream-machine/v1/generations/image");
        assertThat(requests.get(1).url().toString()).isEqualTo("http://luma.test/dream-machine/v1/generations/gen-1");
        assertThat(requests).allSatisfy(request ->
                assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer " + API_KEY));
    }

    @Test
    void waitsFiveSecondsBeforeEachPoll() {
        exchange.thenJson(HttpStatus.OK, "{\"id\":\"gen-1\"}").thenAlwaysJson(HttpStatus.OK, PENDING);

        StepVerifier.withVirtualTime(() -> adapter.processImageGeneration(ENDPOINT, request("a lighthouse"), API_KEY))
                .expectSubscription()
                .thenAwait(Duration.ofMillis(4999))
                .then(() -> assertThat(exchange.countRequests(HttpMethod.GET)).isZero())
                .thenAwait(Duration.ofMillis(1))
                .then(() -> assertThat(exchange.countRequests(HttpMethod.GET)).isEqualTo(1))
                .thenCancel()
                .verify();
    }

    @Test
    void neverCompletingGenerationTimesOutAfterSixtyPolls() {
        exchange.thenJson(HttpStatus.CREATED, "{\"id\":\"gen-1\"}").thenAlwaysJson(HttpStatus.OK, PENDING);

        StepVerifier.withVirtualTime(() -> adapter.processImageGeneration(ENDPOINT, request("a lighthouse"), API_KEY))
                .thenAwait(Duration.ofMinutes(10))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ProviderTimeoutException.class);
                    assertThat(((ProviderTimeoutException) error).getErrorCode()).isEqualTo(408);
                })
                .verify();

        assertThat(exchange.countRequests(HttpMethod.GET)).isEqualTo(60);
    }

    @Test
    void failedGenerationSurfacesFailureReason() {
        exchange.thenJson(HttpStatus.CREATED, "{\"id\":\"gen-1\"}")
                .thenJson(HttpStatus.OK, "{\"id\":\"gen-1\",\"state\":\"failed\",\"failure_reason\":\"prompt rejected\"}");

        StepVerifier.withVirtualTime(() -> adapter.processImageGeneration(ENDPOINT, request("a lighthouse"), API_KEY))
                .thenAwait(Duration.ofSeconds(5))
                .expectErrorSatisfies(error -> {
                    ProviderApiException apiError = (ProviderApiException) error;
                    assertThat(apiError.getErrorCode()).isEqualTo(500);
                    assertThat(apiError.getErrorMessage()).isEqualTo("Generation failed: prompt rejected");
                })
                .verify();
    }

    @Test
    void completedWithoutImageFailsWithoutFurtherPolling() {
        exchange.thenJson(HttpStatus.CREATED, "{\"id\":\"gen-1\"}")
                .thenJson(HttpStatus.OK, "{\"id\":\"gen-1\",\"state\":\"completed\",\"assets\":{}}")
                .thenAlwaysJson(HttpStatus.OK, PENDING);

        StepVerifier.withVirtualTime(() -> adapter.processImageGeneration(ENDPOINT, request("a lighthouse"), API_KEY))
                .thenAwait(Duration.ofMinutes(1))
                .expectErrorSatisfies(error -> assertThat(((ProviderApiException) error).getErrorCode()).isEqualTo(500))
                .verify();

        assertThat(exchange.getRequestCount()).isEqualTo(2);
    }

    @Test
    void completedWithEmptyImageFails() {
        exchange.thenJson(HttpStatus.CREATED, "{\"id\":\"gen-1\"}")
                .thenJson(HttpStatus.OK, "{\"id\":\"gen-1\",\"state\":\"completed\",\"assets\":{\"image\":\"\"}}");

        StepVerifier.withVirtualTime(() -> adapter.processImageGeneration(ENDPOINT, request("a lighthouse"), API_KEY))
                .thenAwait(Duration.ofSeconds(5))
                .expectErrorSatisfies(error -> assertThat(((ProviderApiException) error).getErrorCode()).isEqualTo(500))
                .verify();

        assertThat(exchange.getRequestCount()).isEqualTo(2);
    }

    @Test
    void statusCheckErrorIsReportedWithBody() {
        exchange.thenJson(HttpStatus.CREATED, "{\"id\":\"gen-1\"}")
                .thenJson(HttpStatus.NOT_FOUND, "{\"detail\":\"no such generation\"}");

        StepVerifier.withVirtualTime(() -> adapter.processImageGeneration(ENDPOINT, request("a lighthouse"), API_KEY))
                .thenAwait(Duration.ofSeconds(5))
                .expectErrorSatisfies(error -> {
                    ProviderApiException apiError = (ProviderApiException) error;
                    assertThat(apiError.getErrorCode()).isEqualTo(404);
                    assertThat(apiError.getErrorMessage()).startsWith("Error checking generation status:")
                            .contains("no such generation");
                })
                .verify();
    }

    @Test
    void rejectedSubmissionIsNotRetried() {
        exchange.thenJson(HttpStatus.UNAUTHORIZED, "{\"detail\":\"invalid key\"}");

        StepVerifier.create(adapter.processImageGeneration(ENDPOINT, request("a lighthouse"), API_KEY))
                .expectErrorSatisfies(error -> {
                    ProviderApiException apiError = (ProviderApiException) error;
                    assertThat(apiError.getErrorCode()).isEqualTo(401);
                    assertThat(apiError.getMessage()).startsWith("[luma] 401:");
                })
                .verify();

        assertThat(exchange.getRequestCount()).isEqualTo(1);
    }

    @Test
    void submissionWithoutIdIsFatal() {
        exchange.thenJson(HttpStatus.CREATED, "{\"state\":\"queued\"}");

        StepVerifier.create(adapter.processImageGeneration(ENDPOINT, request("a lighthouse"), API_KEY))
                .expectErrorSatisfies(error -> assertThat(((ProviderApiException) error).getErrorMessage())
                        .isEqualTo("No generation ID returned from Luma AI API"))
                .verify();
    }

    @Test
    void cancellationStopsPolling() {
        exchange.thenJson(HttpStatus.CREATED, "{\"id\":\"gen-1\"}").thenAlwaysJson(HttpStatus.OK, PENDING);

        StepVerifier.withVirtualTime(() -> adapter.processImageGeneration(ENDPOINT, request("a lighthouse"), API_KEY,
                        Mono.delay(Duration.ofSeconds(12))))
                .thenAwait(Duration.ofSeconds(12))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ProviderCancelledException.class);
                    assertThat(((ProviderCancelledException) error).getErrorCode()).isEqualTo(499);
                })
                .verify();

        assertThat(exchange.countRequests(HttpMethod.GET)).isEqualTo(2);
    }

    @Test
    void emptyCancelSignalDoesNotCancel() {
        exchange.thenJson(HttpStatus.CREATED, "{\"id\":\"gen-1\"}")
                .thenJson(HttpStatus.OK, "{\"id\":\"gen-1\",\"state\":\"completed\",\"assets\":{\"image\":\"https://cdn.luma/img.jpg\"}}");

        StepVerifier.withVirtualTime(() -> adapter.processImageGeneration(ENDPOINT, request("a lighthouse"), API_KEY,
                        Mono.empty()))
                .thenAwait(Duration.ofSeconds(5))
                .assertNext(response -> assertThat(response.getData().get(0).getUrl()).isEqualTo("https://cdn.luma/img.jpg"))
                .verifyComplete();
    }

    @Test
    void catalogIsServedFromCacheOnSecondCall() {
        List<String> first = adapter.listModels(API_KEY, null, null).block();
        List<String> second = adapter.listModels(API_KEY, "http://luma.test", null).block();

        assertThat(first).containsExactly("photon-1", "photon-flash-1");
        assertThat(second).isSameAs(first);
        assertThat(exchange.getRequestCount()).isZero();
    }

    @Test
    void textOperationsAreUnsupported() {
        StepVerifier.create(adapter.processCompletion("/v1/chat/completions", null, API_KEY))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(UnsupportedProviderOperationException.class);
                    assertThat(((UnsupportedProviderOperationException) error).getEndpoint()).isEqualTo("/v1/chat/completions");
                })
                .verify();
        StepVerifier.create(adapter.processEmbeddings("/v1/embeddings", null, API_KEY))
                .expectError(UnsupportedProviderOperationException.class)
                .verify();
    }

    @Test
    void modelIdIsRequired() {
        assertThatThrownBy(() -> adapter.getModelId(request("a lighthouse")))
                .isInstanceOf(InvalidProviderRequestException.class)
                .hasMessage("Model ID not found in payload");
        assertThat(adapter.getModelId(request("a lighthouse").toBuilder().model("photon-1").build())).isEqualTo("photon-1");
    }

    private static ImageGenerationRequest request(String prompt) {
        return ImageGenerationRequest.builder().prompt(prompt).size("1792x1024").build();
    }
}
