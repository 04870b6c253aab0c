package ru.oparin.forge.service.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import ru.oparin.forge.config.properties.ImageProvidersProperties;
import ru.oparin.forge.exception.ProviderApiException;
import ru.oparin.forge.mapper.StabilityMapper;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.model.dto.image.ImageGenerationResponse;
import ru.oparin.forge.model.enums.ProviderType;
import ru.oparin.forge.service.provider.ProviderConstants.Stability;

import java.util.List;
import java.util.Map;

/**
 * Адаптер Stability AI (v2beta).
 * <p>
 * Генерация синхронная: multipart форма, в ответ приходят байты изображения,
 * которые возвращаются вызывающей стороне как data URI.
 */
@Slf4j
@Component
public class StabilityAdapter extends AbstractProviderAdapter {

    private final StabilityMapper mapper;

    public StabilityAdapter(ImageProvidersProperties properties,
                            ProviderHttpClient httpClient,
                            ModelCatalogCache modelCatalogCache,
                            StabilityMapper mapper) {
        super(properties.getStability().getUrl(), httpClient, modelCatalogCache);
        this.mapper = mapper;
    }

    @Override
    public String getProviderName() {
        return Stability.PROVIDER_NAME;
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.STABILITY;
    }

    @Override
    protected Mono<List<String>> loadModels(String credential, String baseUrl, Map<String, String> queryParams) {
        return Mono.just(Stability.MODELS);
    }

    @Override
    protected Mono<ImageGenerationResponse> generate(ImageGenerationRequest request, String credential) {
        String endpointPath = mapper.getModelEndpoint(mapper.resolveModel(request));
        String outputFormat = mapper.resolveOutputFormat(request.getResponseFormat());
        String url = getBaseUrl() + String.format(Stability.GENERATE_PATH_TEMPLATE, endpointPath);

        return getHttpClient().postMultipart(getProviderName(), url,
                        headers -> {
                            headers.setBearerAuth(credential);
                            headers.setAccept(List.of(MediaType.parseMediaType("image/*")));
                        },
                        mapper.createFormData(request), Stability.REQUEST_TIMEOUT)
                .flatMap(imageBytes -> {
                    if (imageBytes.length == 0) {
                        return Mono.error(new ProviderApiException(getProviderName(), HttpStatus.INTERNAL_SERVER_ERROR.value(),
                                String.format(ProviderConstants.ErrorMessages.NO_IMAGE_DATA, "Stability AI")));
                    }
                    log.info("Stability AI вернул изображение {} ({} байт)", outputFormat, imageBytes.length);
                    return Mono.just(mapper.toResponse(imageBytes, outputFormat, request.getPrompt()));
                });
    }
}
