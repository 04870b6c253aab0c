package ru.oparin.forge.mapper;

import org.springframework.http.HttpEntity;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.model.dto.image.ImageGenerationResponse;
import ru.oparin.forge.model.dto.image.ImageItem;
import ru.oparin.forge.service.provider.ProviderConstants.Stability;
import ru.oparin.forge.util.ImageSizeUtils;

import java.util.Locale;
import java.util.Map;

/**
 * Маппер канонического запроса в multipart форму Stability AI v2beta и обратно.
 */
@Component
public class StabilityMapper {

    private static final String DEFAULT_ENDPOINT = "stable-image/generate/ultra";
    private static final String DEFAULT_ASPECT_RATIO = "1:1";
    private static final String DEFAULT_STYLE_PRESET = "enhance";

    /**
     * Пустая файловая часть, без которой Stability отклоняет форму.
     */
    static final String EMPTY_FILE_PART = "none";

    private static final Map<String, String> MODEL_ENDPOINTS = Map.of(
            "stable-image-ultra", "stable-image/generate/ultra",
            "stable-image-core", "stable-image/generate/core",
            "stable-diffusion-v1-6", "stable-image/generate/sd3",
            "stable-diffusion-xl-1024-v1-0", "stable-image/generate/sdxl",
            "stable-diffusion-3-medium", "stable-image/generate/sd3",
            "stable-diffusion-3-large", "stable-image/generate/sd3");

    private static final Map<String, String> SIZE_TO_ASPECT_RATIO = Map.of(
            "256x256", "1:1",
            "512x512", "1:1",
            "1024x1024", "1:1",
            "1792x1024", "16:9",
            "1024x1792", "9:16",
            "1536x1024", "3:2",
            "1024x1536", "2:3");

    private static final Map<String, String> STYLE_TO_PRESET = Map.of(
            "vivid", "enhance",
            "natural", "photographic");

    public String resolveModel(ImageGenerationRequest request) {
        return request.getModel() != null && !request.getModel().isBlank() ? request.getModel() : Stability.DEFAULT_MODEL;
    }

    /**
     * Путь эндпоинта генерации для модели. Неизвестная модель идет в ultra.
     */
    public String getModelEndpoint(String model) {
        return MODEL_ENDPOINTS.getOrDefault(model, DEFAULT_ENDPOINT);
    }

    /**
     * Формат файла результата: для response_format=url - png, иначе значение передается как есть.
     */
    public String resolveOutputFormat(String responseFormat) {
        if (responseFormat == null || ImageGenerationRequest.DEFAULT_RESPONSE_FORMAT.equals(responseFormat)) {
            return Stability.DEFAULT_OUTPUT_FORMAT;
        }
        return responseFormat;
    }

    /**
     * Размер OpenAI в соотношение сторон Stability. Нераспознанный размер - 1:1.
     */
    public String convertSizeToAspectRatio(String size) {
        return SIZE_TO_ASPECT_RATIO.getOrDefault(ImageSizeUtils.sizeOrDefault(size), DEFAULT_ASPECT_RATIO);
    }

    public String mapStyle(String style) {
        return STYLE_TO_PRESET.getOrDefault(style.toLowerCase(Locale.ROOT), DEFAULT_STYLE_PRESET);
    }

    /**
     * Собрать multipart форму запроса. aspect_ratio передается только моделям ultra и core.
     */
    public MultiValueMap<String, HttpEntity<?>> createFormData(ImageGenerationRequest request) {
        String model = resolveModel(request).toLowerCase(Locale.ROOT);

        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("prompt", request.getPrompt());
        builder.part("output_format", resolveOutputFormat(request.getResponseFormat()));
        if (model.contains("ultra") || model.contains("core")) {
            builder.part("aspect_ratio", convertSizeToAspectRatio(request.getSize()));
        }
        if (request.getSeed() != null && request.getSeed() != 0) {
            builder.part("seed", String.valueOf(request.getSeed()));
        }
        if (request.getNegativePrompt() != null && !request.getNegativePrompt().isBlank()) {
            builder.part("negative_prompt", request.getNegativePrompt());
        }
        if (request.getStyle() != null && !request.getStyle().isBlank()) {
            builder.part("style_preset", mapStyle(request.getStyle()));
        }
        builder.part(EMPTY_FILE_PART, new byte[0])
                .filename(EMPTY_FILE_PART)
                .contentType(MediaType.APPLICATION_OCTET_STREAM);
        return builder.build();
    }

    /**
     * Байты изображения в канонический ответ с data URI.
     */
    public ImageGenerationResponse toResponse(byte[] imageBytes, String outputFormat, String prompt) {
        return ImageGenerationResponse.of(ImageItem.dataUri("image/" + outputFormat, imageBytes, prompt));
    }
}
