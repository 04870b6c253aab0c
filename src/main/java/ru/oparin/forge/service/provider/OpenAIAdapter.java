package ru.oparin.forge.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import ru.oparin.forge.config.properties.ImageProvidersProperties;
import ru.oparin.forge.exception.ProviderApiException;
import ru.oparin.forge.mapper.OpenAIMapper;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.model.dto.image.ImageGenerationResponse;
import ru.oparin.forge.model.dto.openai.OpenAIImageResponseDTO;
import ru.oparin.forge.model.dto.openai.OpenAIModelListDTO;
import ru.oparin.forge.model.enums.ProviderType;
import ru.oparin.forge.service.provider.ProviderConstants.OpenAI;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Адаптер OpenAI-совместимого API.
 * <p>
 * В отличие от остальных провайдеров поддерживает текстовые операции: completion и embeddings
 * передаются провайдеру как есть. Список моделей загружается из API и фильтруется до моделей изображений.
 */
@Slf4j
@Component
public class OpenAIAdapter extends AbstractProviderAdapter {

    private final OpenAIMapper mapper;

    public OpenAIAdapter(ImageProvidersProperties properties,
                         ProviderHttpClient httpClient,
                         ModelCatalogCache modelCatalogCache,
                         OpenAIMapper mapper) {
        super(properties.getOpenai().getUrl(), httpClient, modelCatalogCache);
        this.mapper = mapper;
    }

    @Override
    public String getProviderName() {
        return OpenAI.PROVIDER_NAME;
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.OPENAI;
    }

    @Override
    protected Mono<List<String>> loadModels(String credential, String baseUrl, Map<String, String> queryParams) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl + OpenAI.MODELS_PATH);
        if (queryParams != null) {
            queryParams.forEach((name, value) -> uri.queryParam(name, value));
        }
        return getHttpClient().getJson(getProviderName(), uri.build().toUriString(), bearerAuth(credential),
                        OpenAIModelListDTO.class, "%s", Set.of())
                .map(mapper::filterImageModels)
                .doOnNext(models -> log.info("Загружен каталог моделей {}: {} моделей изображений", getProviderName(), models.size()));
    }

    @Override
    public Mono<JsonNode> processCompletion(String endpoint, JsonNode payload, String credential) {
        return forward(endpoint, payload, credential);
    }

    @Override
    public Mono<JsonNode> processEmbeddings(String endpoint, JsonNode payload, String credential) {
        return forward(endpoint, payload, credential);
    }

    @Override
    protected Mono<ImageGenerationResponse> generate(ImageGenerationRequest request, String credential) {
        return getHttpClient().postJson(getProviderName(), getBaseUrl() + OpenAI.IMAGES_PATH, bearerAuth(credential),
                        mapper.createRequest(request), OpenAIImageResponseDTO.class, ProviderHttpClient.OK_ONLY)
                .flatMap(response -> {
                    ImageGenerationResponse result = CollectionUtils.isEmpty(response.getData())
                            ? ImageGenerationResponse.of(List.of())
                            : mapper.toResponse(response, request.getPrompt());
                    if (result.getData().isEmpty()) {
                        return Mono.error(new ProviderApiException(getProviderName(), HttpStatus.INTERNAL_SERVER_ERROR.value(),
                                String.format(ProviderConstants.ErrorMessages.NO_IMAGE_DATA, "OpenAI")));
                    }
                    return Mono.just(result);
                });
    }

    private Mono<JsonNode> forward(String endpoint, JsonNode payload, String credential) {
        String path = endpoint.startsWith("/") ? endpoint : "/" + endpoint;
        return getHttpClient().postJson(getProviderName(), getBaseUrl() + path, bearerAuth(credential),
                payload, JsonNode.class, ProviderHttpClient.OK_ONLY);
    }
}
