package ru.oparin.forge.service.provider;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import ru.oparin.forge.config.properties.ImageProvidersProperties;
import ru.oparin.forge.exception.ProviderApiException;
import ru.oparin.forge.mapper.RunwayMapper;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.model.dto.image.ImageGenerationResponse;
import ru.oparin.forge.model.dto.runway.RunwayTaskDTO;
import ru.oparin.forge.model.enums.ProviderType;
import ru.oparin.forge.service.job.JobEngine;
import ru.oparin.forge.service.job.JobStatus;
import ru.oparin.forge.service.job.PollSchedule;
import ru.oparin.forge.service.job.PollingStrategy;
import ru.oparin.forge.service.provider.ProviderConstants.Runway;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Адаптер Runway.
 * <p>
 * Генерация асинхронная: POST /v1/text_to_image создает задачу, GET /v1/tasks/{id} опрашивается
 * каждые 2 секунды, не более 60 раз.
 */
@Slf4j
@Component
public class RunwayAdapter extends AbstractProviderAdapter {

    private final RunwayMapper mapper;
    private final JobEngine jobEngine;

    public RunwayAdapter(ImageProvidersProperties properties,
                         ProviderHttpClient httpClient,
                         ModelCatalogCache modelCatalogCache,
                         RunwayMapper mapper,
                         JobEngine jobEngine) {
        super(properties.getRunway().getUrl(), httpClient, modelCatalogCache);
        this.mapper = mapper;
        this.jobEngine = jobEngine;
    }

    @Override
    public String getProviderName() {
        return Runway.PROVIDER_NAME;
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.RUNWAY;
    }

    @Override
    protected Mono<List<String>> loadModels(String credential, String baseUrl, Map<String, String> queryParams) {
        return Mono.just(Runway.MODELS);
    }

    @Override
    protected Mono<ImageGenerationResponse> generate(ImageGenerationRequest request, String credential) {
        return jobEngine.execute(new GenerationJob(request, credential))
                .map(imageUrl -> mapper.toResponse(imageUrl, request.getPrompt()));
    }

    @RequiredArgsConstructor
    private class GenerationJob implements PollingStrategy<RunwayTaskDTO, String> {

        private final ImageGenerationRequest request;
        private final String credential;

        @Override
        public String getProviderName() {
            return Runway.PROVIDER_NAME;
        }

        @Override
        public Mono<String> submit() {
            return getHttpClient().postJson(getProviderName(), getBaseUrl() + Runway.SUBMIT_PATH, bearerAuth(credential),
                            mapper.createRequest(request), RunwayTaskDTO.class, ProviderHttpClient.OK_OR_CREATED)
                    .flatMap(task -> {
                        if (task.getId() == null || task.getId().isBlank()) {
                            return Mono.error(new ProviderApiException(getProviderName(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value(),
                                    String.format(ProviderConstants.ErrorMessages.NO_JOB_ID, "task ID", "Runway")));
                        }
                        return Mono.just(task.getId());
                    });
        }

        @Override
        public Mono<RunwayTaskDTO> fetchStatus(String taskId) {
            String url = getBaseUrl() + String.format(Runway.TASK_PATH_TEMPLATE, taskId);
            return getHttpClient().getJson(getProviderName(), url, bearerAuth(credential), RunwayTaskDTO.class,
                    ProviderConstants.ErrorMessages.TASK_STATUS_ERROR, Set.of());
        }

        @Override
        public JobStatus<String> classify(RunwayTaskDTO task) {
            String status = task.getStatus();
            if (Runway.STATUS_SUCCEEDED.equals(status)) {
                return JobStatus.succeeded(mapper.extractImageUrl(task), status);
            }
            if (Runway.STATUS_FAILED.equals(status)) {
                return JobStatus.failed(mapper.extractFailureReason(task), status);
            }
            return JobStatus.pending(status);
        }

        @Override
        public PollSchedule getSchedule() {
            return PollSchedule.delayed(Runway.POLL_INTERVAL, Runway.MAX_POLL_ATTEMPTS);
        }
    }
}
