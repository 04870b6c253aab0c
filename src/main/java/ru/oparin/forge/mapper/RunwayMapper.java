package ru.oparin.forge.mapper;

import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.model.dto.image.ImageGenerationResponse;
import ru.oparin.forge.model.dto.image.ImageItem;
import ru.oparin.forge.model.dto.runway.RunwayRequestDTO;
import ru.oparin.forge.model.dto.runway.RunwayTaskDTO;
import ru.oparin.forge.service.provider.ProviderConstants.Runway;
import ru.oparin.forge.util.ImageSizeUtils;

import java.util.Map;

/**
 * Маппер канонического запроса в формат Runway API и обратно.
 */
@Component
public class RunwayMapper {

    private static final String DEFAULT_RATIO = "1:1";

    private static final Map<String, String> SIZE_TO_RATIO = Map.of(
            "256x256", "1:1",
            "512x512", "1:1",
            "1024x1024", "1:1",
            "1792x1024", "16:9",
            "1024x1792", "9:16",
            "1536x1024", "3:2",
            "1024x1536", "2:3",
            "1920x1080", "16:9");

    public String resolveModel(ImageGenerationRequest request) {
        return request.getModel() != null && !request.getModel().isBlank() ? request.getModel() : Runway.DEFAULT_MODEL;
    }

    /**
     * Создать тело запроса text-to-image. Seed передается, только если задан и не равен 0.
     */
    public RunwayRequestDTO createRequest(ImageGenerationRequest request) {
        Integer seed = request.getSeed();
        return RunwayRequestDTO.builder()
                .model(resolveModel(request))
                .promptText(request.getPrompt())
                .ratio(convertSizeToRatio(request.getSize()))
                .seed(seed != null && seed != 0 ? seed : null)
                .build();
    }

    /**
     * Размер OpenAI в соотношение сторон Runway. Нераспознанный размер - 1:1.
     */
    public String convertSizeToRatio(String size) {
        return SIZE_TO_RATIO.getOrDefault(ImageSizeUtils.sizeOrDefault(size), DEFAULT_RATIO);
    }

    /**
     * @return первый URL из output или null, если output пустой
     */
    public String extractImageUrl(RunwayTaskDTO task) {
        return CollectionUtils.isEmpty(task.getOutput()) ? null : task.getOutput().get(0);
    }

    /**
     * Причина ошибки задачи: error или failure, в зависимости от версии API.
     */
    public String extractFailureReason(RunwayTaskDTO task) {
        return task.getError() != null ? task.getError() : task.getFailure();
    }

    public ImageGenerationResponse toResponse(String imageUrl, String prompt) {
        return ImageGenerationResponse.of(ImageItem.remote(imageUrl, prompt));
    }
}
