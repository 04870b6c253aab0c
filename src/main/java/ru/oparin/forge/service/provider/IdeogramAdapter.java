package ru.oparin.forge.service.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import reactor.core.publisher.Mono;
import ru.oparin.forge.config.properties.ImageProvidersProperties;
import ru.oparin.forge.exception.ProviderApiException;
import ru.oparin.forge.mapper.IdeogramMapper;
import ru.oparin.forge.model.dto.ideogram.IdeogramResponseDTO;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.model.dto.image.ImageGenerationResponse;
import ru.oparin.forge.model.enums.ProviderType;
import ru.oparin.forge.service.provider.ProviderConstants.Ideogram;

import java.util.List;
import java.util.Map;

/**
 * Адаптер Ideogram. Генерация синхронная: изображения приходят в ответе на запрос генерации.
 */
@Slf4j
@Component
public class IdeogramAdapter extends AbstractProviderAdapter {

    private final IdeogramMapper mapper;

    public IdeogramAdapter(ImageProvidersProperties properties,
                           ProviderHttpClient httpClient,
                           ModelCatalogCache modelCatalogCache,
                           IdeogramMapper mapper) {
        super(properties.getIdeogram().getUrl(), httpClient, modelCatalogCache);
        this.mapper = mapper;
    }

    @Override
    public String getProviderName() {
        return Ideogram.PROVIDER_NAME;
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.IDEOGRAM;
    }

    @Override
    protected Mono<List<String>> loadModels(String credential, String baseUrl, Map<String, String> queryParams) {
        return Mono.just(Ideogram.MODELS);
    }

    @Override
    protected Mono<ImageGenerationResponse> generate(ImageGenerationRequest request, String credential) {
        return getHttpClient().postJson(getProviderName(), getBaseUrl() + Ideogram.GENERATE_PATH,
                        headers -> headers.set(Ideogram.AUTH_HEADER, credential),
                        mapper.createRequest(request), IdeogramResponseDTO.class, ProviderHttpClient.OK_ONLY)
                .flatMap(response -> {
                    ImageGenerationResponse result = CollectionUtils.isEmpty(response.getData())
                            ? ImageGenerationResponse.of(List.of())
                            : mapper.toResponse(response, request.getPrompt());
                    if (result.getData().isEmpty()) {
                        return Mono.error(new ProviderApiException(getProviderName(), HttpStatus.INTERNAL_SERVER_ERROR.value(),
                                String.format(ProviderConstants.ErrorMessages.NO_IMAGE_DATA, "Ideogram")));
                    }
                    log.info("Ideogram вернул {} изображений", result.getData().size());
                    return Mono.just(result);
                });
    }
}
