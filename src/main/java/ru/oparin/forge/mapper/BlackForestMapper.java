package ru.oparin.forge.mapper;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import ru.oparin.forge.model.dto.blackforest.BlackForestPollingDTO;
import ru.oparin.forge.model.dto.blackforest.BlackForestRequestDTO;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.model.dto.image.ImageGenerationResponse;
import ru.oparin.forge.model.dto.image.ImageItem;
import ru.oparin.forge.service.provider.ProviderConstants.BlackForest;
import ru.oparin.forge.util.ImageSizeUtils;

/**
 * Маппер канонического запроса в формат Black Forest Labs API и обратно.
 */
@Component
public class BlackForestMapper {

    /**
     * Модель из запроса или модель по умолчанию.
     */
    public String resolveModel(ImageGenerationRequest request) {
        return request.getModel() != null && !request.getModel().isBlank() ? request.getModel() : BlackForest.DEFAULT_MODEL;
    }

    /**
     * Создать тело запроса на создание задачи. Размер передается явными шириной и высотой.
     */
    public BlackForestRequestDTO createRequest(ImageGenerationRequest request) {
        ImageSizeUtils.Dimensions dimensions = ImageSizeUtils.parse(request.getSize());
        return BlackForestRequestDTO.builder()
                .prompt(request.getPrompt())
                .width(dimensions.getWidth())
                .height(dimensions.getHeight())
                .promptUpsampling(false)
                .seed(request.getSeed() != null ? request.getSeed() : BlackForest.DEFAULT_SEED)
                .safetyTolerance(BlackForest.SAFETY_TOLERANCE)
                .outputFormat(BlackForest.OUTPUT_FORMAT)
                .build();
    }

    /**
     * Извлечь URL изображения из ответа на опрос.
     *
     * @return URL или null, если результата в ответе нет
     */
    public String extractImageUrl(BlackForestPollingDTO polling) {
        if (polling.getResult() == null || !StringUtils.hasText(polling.getResult().getSample())) {
            return null;
        }
        return polling.getResult().getSample();
    }

    public ImageGenerationResponse toResponse(String imageUrl, String prompt) {
        return ImageGenerationResponse.of(ImageItem.remote(imageUrl, prompt));
    }
}
