package ru.oparin.forge.mapper;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.model.dto.image.ImageGenerationResponse;
import ru.oparin.forge.model.dto.image.ImageItem;
import ru.oparin.forge.model.dto.luma.LumaGenerationDTO;
import ru.oparin.forge.model.dto.luma.LumaRequestDTO;
import ru.oparin.forge.service.provider.ProviderConstants.Luma;
import ru.oparin.forge.util.ImageSizeUtils;

import java.util.Map;

/**
 * Маппер канонического запроса в формат Luma Dream Machine API и обратно.
 */
@Component
public class LumaMapper {

    private static final String DEFAULT_ASPECT_RATIO = "1:1";

    private static final Map<String, String> SIZE_TO_ASPECT_RATIO = Map.of(
            "256x256", "1:1",
            "512x512", "1:1",
            "1024x1024", "1:1",
            "1792x1024", "16:9",
            "1024x1792", "9:16",
            "1536x1024", "3:2",
            "1024x1536", "2:3",
            "1920x1080", "16:9");

    public String resolveModel(ImageGenerationRequest request) {
        return request.getModel() != null && !request.getModel().isBlank() ? request.getModel() : Luma.DEFAULT_MODEL;
    }

    public LumaRequestDTO createRequest(ImageGenerationRequest request) {
        return LumaRequestDTO.builder()
                .prompt(request.getPrompt())
                .model(resolveModel(request))
                .aspectRatio(convertSizeToAspectRatio(request.getSize()))
                .build();
    }

    /**
     * Размер OpenAI в соотношение сторон Luma. Нераспознанный размер - 1:1.
     */
    public String convertSizeToAspectRatio(String size) {
        return SIZE_TO_ASPECT_RATIO.getOrDefault(ImageSizeUtils.sizeOrDefault(size), DEFAULT_ASPECT_RATIO);
    }

    /**
     * @return URL изображения или null, если в ответе нет assets.image
     */
    public String extractImageUrl(LumaGenerationDTO generation) {
        if (generation.getAssets() == null || !StringUtils.hasText(generation.getAssets().getImage())) {
            return null;
        }
        return generation.getAssets().getImage();
    }

    public ImageGenerationResponse toResponse(String imageUrl, String prompt) {
        return ImageGenerationResponse.of(ImageItem.remote(imageUrl, prompt));
    }
}
