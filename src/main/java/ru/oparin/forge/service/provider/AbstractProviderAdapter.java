package ru.oparin.forge.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import reactor.core.publisher.Mono;
import ru.oparin.forge.exception.InvalidProviderRequestException;
import ru.oparin.forge.exception.UnsupportedProviderOperationException;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.model.dto.image.ImageGenerationResponse;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Базовый класс адаптеров: проверка запроса, кеш каталога моделей и отказ от текстовых операций.
 * <p>
 * Хранит только неизменяемые параметры, заданные при создании.
 */
@Slf4j
@Getter
public abstract class AbstractProviderAdapter implements ProviderAdapter {

    private final String baseUrl;
    private final ProviderHttpClient httpClient;
    private final ModelCatalogCache modelCatalogCache;

    protected AbstractProviderAdapter(String baseUrl, ProviderHttpClient httpClient, ModelCatalogCache modelCatalogCache) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.httpClient = httpClient;
        this.modelCatalogCache = modelCatalogCache;
    }

    @Override
    public Mono<List<String>> listModels(String credential, String baseUrl, Map<String, String> queryParams) {
        String effectiveBaseUrl = resolveBaseUrl(baseUrl);
        return Mono.defer(() -> modelCatalogCache.get(getProviderName(), credential, effectiveBaseUrl)
                .map(models -> {
                    log.debug("Каталог моделей {} взят из кеша ({})", getProviderName(), effectiveBaseUrl);
                    return Mono.just(models);
                })
                .orElseGet(() -> loadModels(credential, effectiveBaseUrl, queryParams)
                        .map(models -> modelCatalogCache.put(getProviderName(), credential, effectiveBaseUrl, models))));
    }

    /**
     * Загрузить каталог моделей. Вызывается только при промахе кеша.
     */
    protected abstract Mono<List<String>> loadModels(String credential, String baseUrl, Map<String, String> queryParams);

    @Override
    public Mono<JsonNode> processCompletion(String endpoint, JsonNode payload, String credential) {
        return Mono.error(new UnsupportedProviderOperationException(getProviderName(), endpoint,
                String.format(ProviderConstants.ErrorMessages.COMPLETION_NOT_SUPPORTED, getProviderName(), endpoint)));
    }

    @Override
    public Mono<JsonNode> processEmbeddings(String endpoint, JsonNode payload, String credential) {
        return Mono.error(new UnsupportedProviderOperationException(getProviderName(), endpoint,
                String.format(ProviderConstants.ErrorMessages.EMBEDDINGS_NOT_SUPPORTED, getProviderName(), endpoint)));
    }

    @Override
    public final Mono<ImageGenerationResponse> processImageGeneration(String endpoint, ImageGenerationRequest request,
                                                                      String credential) {
        if (request == null || !request.hasPrompt()) {
            log.warn("Запрос к {} без промпта отклонен", getProviderName());
            return Mono.error(new InvalidProviderRequestException(getProviderName(), "prompt",
                    ProviderConstants.ErrorMessages.PROMPT_REQUIRED));
        }
        log.info("Генерация изображения через {} ({}), модель: {}, размер: {}",
                getProviderName(), endpoint, request.getModel(), request.getSize());
        return Mono.defer(() -> generate(request, credential));
    }

    /**
     * Выполнить генерацию для уже проверенного запроса.
     */
    protected abstract Mono<ImageGenerationResponse> generate(ImageGenerationRequest request, String credential);

    /**
     * Базовый URL из аргумента или из конфигурации.
     */
    protected String resolveBaseUrl(String requestedBaseUrl) {
        return requestedBaseUrl == null || requestedBaseUrl.isBlank() ? baseUrl : stripTrailingSlash(requestedBaseUrl);
    }

    protected static Consumer<HttpHeaders> bearerAuth(String credential) {
        return headers -> headers.setBearerAuth(credential);
    }

    private static String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
