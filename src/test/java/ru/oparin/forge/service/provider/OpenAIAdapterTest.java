package ru.oparin.forge.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.test.StepVerifier;
import ru.oparin.forge.config.properties.ImageProvidersProperties;
import ru.oparin.forge.exception.InvalidProviderRequestException;
import ru.oparin.forge.exception.ProviderApiException;
import ru.oparin.forge.mapper.OpenAIMapper;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.model.enums.ImageSource;
import ru.oparin.forge.support.StubExchangeFunction;

import java.net.ConnectException;
import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAIAdapterTest {

    private static final String API_KEY = "sk-test";
    private static final String MODELS = "{\"data\":[{\"id\":\"gpt-4o\"},{\"id\":\"gpt-image-1\"},{\"id\":\"dall-e-3\"},"
            + "{\"id\":\"dall-e-2\"},{\"id\":\"text-embedding-3-small\"}]}";

    private StubExchangeFunction exchange;
    private ModelCatalogCache cache;
    private OpenAIAdapter adapter;

    @BeforeEach
    void setUp() {
        ImageProvidersProperties properties = new ImageProvidersProperties();
        properties.getOpenai().setUrl("http://openai.test/v1");
        exchange = new StubExchangeFunction();
        cache = new ModelCatalogCache();
        ProviderHttpClient httpClient = new ProviderHttpClient(exchange.webClient(), new ProviderErrorHandler());
        adapter = new OpenAIAdapter(properties, httpClient, cache, new OpenAIMapper());
    }

    @Test
    void liveCatalogIsFilteredAndCached() {
        exchange.thenJson(HttpStatus.OK, MODELS);

        List<String> first = adapter.listModels(API_KEY, null, null).block();
        List<String> second = adapter.listModels(API_KEY, null, null).block();

        assertThat(first).containsExactly("dall-e-2", "dall-e-3", "gpt-image-1");
        assertThat(second).isEqualTo(first);
        assertThat(exchange.getRequestCount()).isEqualTo(1);
        assertThat(exchange.getRequests().get(0).url().toString()).isEqualTo("http://openai.test/v1/models");
    }

    @Test
    void catalogIsCachedPerBaseUrlAndCredential() {
        exchange.thenJson(HttpStatus.OK, MODELS)
                .thenJson(HttpStatus.OK, "{\"data\":[{\"id\":\"dall-e-3\"}]}")
                .thenJson(HttpStatus.OK, "{\"data\":[{\"id\":\"gpt-image-1\"}]}");

        adapter.listModels(API_KEY, null, null).block();
        List<String> proxy = adapter.listModels(API_KEY, "http://proxy.test/v1", Map.of("owner", "me")).block();
        List<String> otherKey = adapter.listModels("sk-other", null, null).block();

        assertThat(proxy).containsExactly("dall-e-3");
        assertThat(otherKey).containsExactly("gpt-image-1");
        assertThat(exchange.getRequestCount()).isEqualTo(3);
        assertThat(exchange.getRequests().get(1).url().toString()).isEqualTo("http://proxy.test/v1/models?owner=me");
    }

    @Test
    void failedFetchIsNotCached() {
        exchange.thenJson(HttpStatus.INTERNAL_SERVER_ERROR, "upstream down").thenJson(HttpStatus.OK, MODELS);

        StepVerifier.create(adapter.listModels(API_KEY, null, null))
                .expectErrorSatisfies(error -> assertThat(((ProviderApiException) error).getErrorCode()).isEqualTo(500))
                .verify();
        assertThat(cache.get("openai", API_KEY, "http://openai.test/v1")).isEmpty();

        StepVerifier.create(adapter.listModels(API_KEY, null, null))
                .assertNext(models -> assertThat(models).contains("dall-e-3"))
                .verifyComplete();
        assertThat(exchange.getRequestCount()).isEqualTo(2);
    }

    @Test
    void blankPromptFailsBeforeAnyNetworkCall() {
        ImageGenerationRequest request = ImageGenerationRequest.builder().prompt(" ").model("dall-e-3").build();

        StepVerifier.create(adapter.processImageGeneration("/v1/images/generations", request, API_KEY))
                .expectError(InvalidProviderRequestException.class)
                .verify();

        assertThat(exchange.getRequestCount()).isZero();
    }

    @Test
    void base64ImagesBecomeDataUris() {
        exchange.thenJson(HttpStatus.OK, "{\"created\":1700000000,\"data\":[{\"b64_json\":\"aGVsbG8=\"}]}");
        ImageGenerationRequest request = ImageGenerationRequest.builder()
                .prompt("a watercolor bird")
                .responseFormat("b64_json")
                .build();

        StepVerifier.create(adapter.processImageGeneration("/v1/images/generations", request, API_KEY))
                .assertNext(response -> {
                    assertThat(response.getData().get(0).getUrl()).isEqualTo("data:image/png;base64,aGVsbG8=");
                    assertThat(response.getData().get(0).getSource()).isEqualTo(ImageSource.DATA_URI);
                    assertThat(response.getData().get(0).getRevisedPrompt()).isEqualTo("a watercolor bird");
                })
                .verifyComplete();

        assertThat(exchange.getRequests().get(0).url().toString()).isEqualTo("http://openai.test/v1/images/generations");
    }

    @Test
    void urlImagesKeepRevisedPrompt() {
        exchange.thenJson(HttpStatus.OK, "{\"data\":[{\"url\":\"https://oai.cdn/x.png\",\"revised_prompt\":\"a detailed watercolor bird\"}]}");

        StepVerifier.create(adapter.processImageGeneration("/v1/images/generations",
                        ImageGenerationRequest.builder().prompt("a watercolor bird").build(), API_KEY))
                .assertNext(response -> {
                    assertThat(response.getData().get(0).getUrl()).isEqualTo("https://oai.cdn/x.png");
                    assertThat(response.getData().get(0).getRevisedPrompt()).isEqualTo("a detailed watercolor bird");
                })
                .verifyComplete();
    }

    @Test
    void completionIsForwarded() throws Exception {
        exchange.thenJson(HttpStatus.OK, "{\"id\":\"chatcmpl-1\",\"object\":\"chat.completion\"}");
        JsonNode payload = new ObjectMapper().readTree("{\"model\":\"gpt-4o\",\"messages\":[]}");

        StepVerifier.create(adapter.processCompletion("chat/completions", payload, API_KEY))
                .assertNext(body -> assertThat(body.get("id").asText()).isEqualTo("chatcmpl-1"))
                .verifyComplete();

        assertThat(exchange.getRequests().get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(exchange.getRequests().get(0).url().toString()).isEqualTo("http://openai.test/v1/chat/completions");
    }

    @Test
    void transportFailureKeepsCause() {
        ConnectException cause = new ConnectException("Connection refused");
        exchange.thenError(new WebClientRequestException(cause, HttpMethod.POST,
                URI.create("http://openai.test/v1/embeddings"), new HttpHeaders()));

        StepVerifier.create(adapter.processEmbeddings("/embeddings", new ObjectMapper().createObjectNode(), API_KEY))
                .expectErrorSatisfies(error -> {
                    ProviderApiException apiError = (ProviderApiException) error;
                    assertThat(apiError.getErrorCode()).isEqualTo(503);
                    assertThat(apiError.getProviderName()).isEqualTo("openai");
                    assertThat(apiError.getCause()).isInstanceOf(WebClientRequestException.class);
                    assertThat(apiError.getCause().getCause()).isSameAs(cause);
                })
                .verify();
    }
}
