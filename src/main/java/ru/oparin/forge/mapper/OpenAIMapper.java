package ru.oparin.forge.mapper;

import org.springframework.stereotype.Component;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.model.dto.image.ImageGenerationResponse;
import ru.oparin.forge.model.dto.image.ImageItem;
import ru.oparin.forge.model.dto.openai.OpenAIImageRequestDTO;
import ru.oparin.forge.model.dto.openai.OpenAIImageResponseDTO;
import ru.oparin.forge.model.dto.openai.OpenAIModelListDTO;
import ru.oparin.forge.service.provider.ProviderConstants.OpenAI;

import java.util.List;
import java.util.Objects;

/**
 * Маппер для OpenAI-совместимого API изображений.
 */
@Component
public class OpenAIMapper {

    public String resolveModel(ImageGenerationRequest request) {
        return request.getModel() != null && !request.getModel().isBlank() ? request.getModel() : OpenAI.DEFAULT_MODEL;
    }

    public OpenAIImageRequestDTO createRequest(ImageGenerationRequest request) {
        return OpenAIImageRequestDTO.builder()
                .model(resolveModel(request))
                .prompt(request.getPrompt())
                .n(1)
                .size(request.getSize())
                .quality(request.getQuality())
                .style(request.getStyle())
                .responseFormat(request.getResponseFormat())
                .build();
    }

    /**
     * Преобразовать ответ в канонический. Изображения в base64 превращаются в data URI;
     * отсутствующий revised_prompt заменяется исходным промптом.
     */
    public ImageGenerationResponse toResponse(OpenAIImageResponseDTO response, String prompt) {
        List<ImageItem> items = response.getData().stream()
                .filter(Objects::nonNull)
                .filter(image -> image.getUrl() != null || image.getB64Json() != null)
                .map(image -> {
                    String revisedPrompt = image.getRevisedPrompt() != null ? image.getRevisedPrompt() : prompt;
                    return image.getB64Json() != null
                            ? ImageItem.dataUri(OpenAI.B64_MIME_TYPE, image.getB64Json(), revisedPrompt)
                            : ImageItem.remote(image.getUrl(), revisedPrompt);
                })
                .toList();
        return ImageGenerationResponse.of(items);
    }

    /**
     * Оставить только модели генерации изображений.
     */
    public List<String> filterImageModels(OpenAIModelListDTO modelList) {
        if (modelList.getData() == null) {
            return List.of();
        }
        return modelList.getData().stream()
                .map(OpenAIModelListDTO.Model::getId)
                .filter(Objects::nonNull)
                .filter(id -> OpenAI.IMAGE_MODEL_PREFIXES.stream().anyMatch(id::startsWith))
                .sorted()
                .toList();
    }
}
