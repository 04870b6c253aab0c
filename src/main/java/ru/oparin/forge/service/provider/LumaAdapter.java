package ru.oparin.forge.service.provider;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import ru.oparin.forge.config.properties.ImageProvidersProperties;
import ru.oparin.forge.exception.ProviderApiException;
import ru.oparin.forge.mapper.LumaMapper;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.model.dto.image.ImageGenerationResponse;
import ru.oparin.forge.model.dto.luma.LumaGenerationDTO;
import ru.oparin.forge.model.enums.ProviderType;
import ru.oparin.forge.service.job.JobEngine;
import ru.oparin.forge.service.job.JobStatus;
import ru.oparin.forge.service.job.PollSchedule;
import ru.oparin.forge.service.job.PollingStrategy;
import ru.oparin.forge.service.provider.ProviderConstants.Luma;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Адаптер Luma AI (Dream Machine).
 * <p>
 * Генерация асинхронная: создание генерации, затем опрос ее состояния каждые 5 секунд, не более 60 раз.
 */
@Slf4j
@Component
public class LumaAdapter extends AbstractProviderAdapter {

    private final LumaMapper mapper;
    private final JobEngine jobEngine;

    public LumaAdapter(ImageProvidersProperties properties,
                       ProviderHttpClient httpClient,
                       ModelCatalogCache modelCatalogCache,
                       LumaMapper mapper,
                       JobEngine jobEngine) {
        super(properties.getLuma().getUrl(), httpClient, modelCatalogCache);
        this.mapper = mapper;
        this.jobEngine = jobEngine;
    }

    @Override
    public String getProviderName() {
        return Luma.PROVIDER_NAME;
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.LUMA;
    }

    @Override
    protected Mono<List<String>> loadModels(String credential, String baseUrl, Map<String, String> queryParams) {
        return Mono.just(Luma.MODELS);
    }

    @Override
    protected Mono<ImageGenerationResponse> generate(ImageGenerationRequest request, String credential) {
        return jobEngine.execute(new GenerationJob(request, credential))
                .map(imageUrl -> mapper.toResponse(imageUrl, request.getPrompt()));
    }

    @RequiredArgsConstructor
    private class GenerationJob implements PollingStrategy<LumaGenerationDTO, String> {

        private final ImageGenerationRequest request;
        private final String credential;

        @Override
        public String getProviderName() {
            return Luma.PROVIDER_NAME;
        }

        @Override
        public Mono<String> submit() {
            return getHttpClient().postJson(getProviderName(), getBaseUrl() + Luma.SUBMIT_PATH, bearerAuth(credential),
                            mapper.createRequest(request), LumaGenerationDTO.class, ProviderHttpClient.OK_OR_CREATED)
                    .flatMap(generation -> {
                        if (generation.getId() == null || generation.getId().isBlank()) {
                            return Mono.error(new ProviderApiException(getProviderName(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value(),
                                    String.format(ProviderConstants.ErrorMessages.NO_JOB_ID, "generation ID", "Luma AI")));
                        }
                        return Mono.just(generation.getId());
                    });
        }

        @Override
        public Mono<LumaGenerationDTO> fetchStatus(String generationId) {
            String url = getBaseUrl() + String.format(Luma.STATUS_PATH_TEMPLATE, generationId);
            return getHttpClient().getJson(getProviderName(), url, bearerAuth(credential), LumaGenerationDTO.class,
                    ProviderConstants.ErrorMessages.STATUS_ERROR, Set.of());
        }

        @Override
        public JobStatus<String> classify(LumaGenerationDTO generation) {
            String state = generation.getState();
            if (Luma.STATE_COMPLETED.equals(state)) {
                return JobStatus.succeeded(mapper.extractImageUrl(generation), state);
            }
            if (Luma.STATE_FAILED.equals(state)) {
                return JobStatus.failed(generation.getFailureReason(), state);
            }
            return JobStatus.pending(state);
        }

        @Override
        public PollSchedule getSchedule() {
            return PollSchedule.delayed(Luma.POLL_INTERVAL, Luma.MAX_POLL_ATTEMPTS);
        }
    }
}
