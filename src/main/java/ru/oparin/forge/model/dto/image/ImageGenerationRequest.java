package ru.oparin.forge.model.dto.image;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Канонический запрос генерации изображения в формате OpenAI.
 * Один экземпляр на вызов, после создания не изменяется.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ImageGenerationRequest {

    public static final String DEFAULT_SIZE = "1024x1024";
    public static final String DEFAULT_RESPONSE_FORMAT = "url";

    /** Описание изображения (промпт), обязательное поле */
    String prompt;

    /** Идентификатор модели провайдера; если не указан, адаптер берет свою модель по умолчанию */
    String model;

    /** Размер в формате "ШxВ" */
    @Builder.Default
    String size = DEFAULT_SIZE;

    /** Качество: standard, hd */
    String quality;

    /** Стиль: vivid, natural */
    String style;

    Integer seed;

    /** Формат ответа: url, b64_json или конкретный формат файла (png, jpeg, webp) */
    @Builder.Default
    @JsonProperty("response_format")
    String responseFormat = DEFAULT_RESPONSE_FORMAT;

    @JsonProperty("negative_prompt")
    String negativePrompt;

    /**
     * Признак того, что промпт задан и не пустой.
     */
    public boolean hasPrompt() {
        return prompt != null && !prompt.isBlank();
    }
}
