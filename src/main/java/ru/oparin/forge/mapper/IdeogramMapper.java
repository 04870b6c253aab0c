package ru.oparin.forge.mapper;

import org.springframework.stereotype.Component;
import ru.oparin.forge.model.dto.ideogram.IdeogramRequestDTO;
import ru.oparin.forge.model.dto.ideogram.IdeogramResponseDTO;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.model.dto.image.ImageGenerationResponse;
import ru.oparin.forge.model.dto.image.ImageItem;
import ru.oparin.forge.service.provider.ProviderConstants.Ideogram;
import ru.oparin.forge.util.ImageSizeUtils;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Маппер канонического запроса в формат Ideogram API и обратно.
 */
@Component
public class IdeogramMapper {

    private static final String DEFAULT_SPEED = "TURBO";
    private static final String DEFAULT_ASPECT_RATIO = "ASPECT_1_1";
    private static final String DEFAULT_STYLE = "GENERAL";

    private static final Map<String, String> QUALITY_TO_SPEED = Map.of(
            "standard", "TURBO",
            "hd", "STANDARD");

    private static final Map<String, String> SIZE_TO_ASPECT_RATIO = Map.of(
            "256x256", "ASPECT_1_1",
            "512x512", "ASPECT_1_1",
            "1024x1024", "ASPECT_1_1",
            "1792x1024", "ASPECT_16_9",
            "1024x1792", "ASPECT_9_16",
            "1536x1024", "ASPECT_3_2",
            "1024x1536", "ASPECT_2_3");

    private static final Map<String, String> STYLE_TO_STYLE_TYPE = Map.of(
            "vivid", "GENERAL",
            "natural", "REALISTIC");

    public String resolveModel(ImageGenerationRequest request) {
        return request.getModel() != null && !request.getModel().isBlank() ? request.getModel() : Ideogram.DEFAULT_MODEL;
    }

    /**
     * Создать тело запроса генерации. Модель передается, только если отличается от модели по умолчанию,
     * стиль - только если задан.
     */
    public IdeogramRequestDTO createRequest(ImageGenerationRequest request) {
        String model = resolveModel(request);
        return IdeogramRequestDTO.builder()
                .prompt(request.getPrompt())
                .renderingSpeed(mapQualityToSpeed(request.getQuality()))
                .model(Ideogram.DEFAULT_MODEL.equals(model) ? null : model)
                .aspectRatio(convertSizeToAspectRatio(request.getSize()))
                .styleType(request.getStyle() != null ? mapStyle(request.getStyle()) : null)
                .build();
    }

    /**
     * Качество OpenAI в скорость рендеринга Ideogram. Без учета регистра, по умолчанию TURBO.
     */
    public String mapQualityToSpeed(String quality) {
        if (quality == null) {
            return DEFAULT_SPEED;
        }
        return QUALITY_TO_SPEED.getOrDefault(quality.toLowerCase(Locale.ROOT), DEFAULT_SPEED);
    }

    /**
     * Размер OpenAI в соотношение сторон Ideogram. Нераспознанный размер - квадрат.
     */
    public String convertSizeToAspectRatio(String size) {
        return SIZE_TO_ASPECT_RATIO.getOrDefault(ImageSizeUtils.sizeOrDefault(size), DEFAULT_ASPECT_RATIO);
    }

    public String mapStyle(String style) {
        return STYLE_TO_STYLE_TYPE.getOrDefault(style.toLowerCase(Locale.ROOT), DEFAULT_STYLE);
    }

    /**
     * Преобразовать ответ Ideogram в канонический. Берутся все изображения с URL;
     * если Ideogram переписал промпт, он попадает в revised_prompt.
     */
    public ImageGenerationResponse toResponse(IdeogramResponseDTO response, String prompt) {
        List<ImageItem> items = response.getData().stream()
                .filter(Objects::nonNull)
                .filter(image -> image.getUrl() != null)
                .map(image -> ImageItem.remote(image.getUrl(),
                        image.getPrompt() != null && !image.getPrompt().isBlank() ? image.getPrompt() : prompt))
                .toList();
        return ImageGenerationResponse.of(items);
    }
}
