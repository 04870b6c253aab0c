package ru.oparin.forge.service.provider;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import ru.oparin.forge.config.properties.ImageProvidersProperties;
import ru.oparin.forge.exception.ProviderApiException;
import ru.oparin.forge.mapper.BlackForestMapper;
import ru.oparin.forge.model.dto.blackforest.BlackForestPollingDTO;
import ru.oparin.forge.model.dto.blackforest.BlackForestSubmissionDTO;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.model.dto.image.ImageGenerationResponse;
import ru.oparin.forge.model.enums.ProviderType;
import ru.oparin.forge.service.job.JobEngine;
import ru.oparin.forge.service.job.JobStatus;
import ru.oparin.forge.service.job.PollSchedule;
import ru.oparin.forge.service.job.PollingStrategy;
import ru.oparin.forge.service.provider.ProviderConstants.BlackForest;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Адаптер Black Forest Labs (Flux).
 * <p>
 * Генерация асинхронная: POST /v1/{model} возвращает polling_url, который опрашивается до статуса Ready.
 * Первый опрос выполняется сразу, далее каждые 2 секунды, не более 30 раз.
 */
@Slf4j
@Component
public class BlackForestAdapter extends AbstractProviderAdapter {

    private final BlackForestMapper mapper;
    private final JobEngine jobEngine;

    public BlackForestAdapter(ImageProvidersProperties properties,
                              ProviderHttpClient httpClient,
                              ModelCatalogCache modelCatalogCache,
                              BlackForestMapper mapper,
                              JobEngine jobEngine) {
        super(properties.getBlackforest().getUrl(), httpClient, modelCatalogCache);
        this.mapper = mapper;
        this.jobEngine = jobEngine;
    }

    @Override
    public String getProviderName() {
        return BlackForest.PROVIDER_NAME;
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.BLACKFOREST;
    }

    @Override
    protected Mono<List<String>> loadModels(String credential, String baseUrl, Map<String, String> queryParams) {
        return Mono.just(BlackForest.MODELS);
    }

    @Override
    protected Mono<ImageGenerationResponse> generate(ImageGenerationRequest request, String credential) {
        return jobEngine.execute(new GenerationJob(request, credential))
                .map(imageUrl -> mapper.toResponse(imageUrl, request.getPrompt()));
    }

    /**
     * Задача генерации одного изображения. Идентификатор задачи - polling_url.
     */
    @RequiredArgsConstructor
    private class GenerationJob implements PollingStrategy<BlackForestPollingDTO, String> {

        private final ImageGenerationRequest request;
        private final String credential;

        @Override
        public String getProviderName() {
            return BlackForest.PROVIDER_NAME;
        }

        @Override
        public Mono<String> submit() {
            String url = getBaseUrl() + String.format(BlackForest.SUBMIT_PATH_TEMPLATE, mapper.resolveModel(request));
            return getHttpClient().postJson(getProviderName(), url, auth(), mapper.createRequest(request),
                            BlackForestSubmissionDTO.class, ProviderHttpClient.OK_ONLY)
                    .flatMap(submission -> {
                        if (submission.getPollingUrl() == null || submission.getPollingUrl().isBlank()) {
                            return Mono.error(new ProviderApiException(getProviderName(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value(),
                                    String.format(ProviderConstants.ErrorMessages.NO_JOB_ID, "polling URL", "Black Forest Labs")));
                        }
                        log.debug("Black Forest Labs: задача {} создана", submission.getId());
                        return Mono.just(submission.getPollingUrl());
                    });
        }

        @Override
        public Mono<BlackForestPollingDTO> fetchStatus(String pollingUrl) {
            return getHttpClient().getJson(getProviderName(), pollingUrl, auth(), BlackForestPollingDTO.class,
                    ProviderConstants.ErrorMessages.POLLING_ERROR, Set.of());
        }

        @Override
        public JobStatus<String> classify(BlackForestPollingDTO polling) {
            String status = polling.getStatus();
            if (BlackForest.STATUS_READY.equals(status)) {
                return JobStatus.succeeded(mapper.extractImageUrl(polling), status);
            }
            if (BlackForest.FAILURE_STATUSES.contains(status)) {
                String reason = polling.getError() == null && !BlackForest.STATUS_ERROR.equals(status)
                        ? status
                        : polling.getError();
                return JobStatus.failed(reason, status);
            }
            return JobStatus.pending(status);
        }

        @Override
        public PollSchedule getSchedule() {
            return PollSchedule.immediate(BlackForest.POLL_INTERVAL, BlackForest.MAX_POLL_ATTEMPTS);
        }

        private Consumer<HttpHeaders> auth() {
            return headers -> headers.set(BlackForest.AUTH_HEADER, credential);
        }
    }
}
