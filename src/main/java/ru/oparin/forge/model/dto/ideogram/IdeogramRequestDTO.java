package ru.oparin.forge.model.dto.ideogram;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO запроса генерации в Ideogram API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IdeogramRequestDTO {

    private String prompt;

    /**
     * Скорость рендеринга: TURBO, DEFAULT, QUALITY.
     */
    @JsonProperty("rendering_speed")
    private String renderingSpeed;

    /**
     * Модель, передается только если отличается от модели по умолчанию.
     */
    private String model;

    @JsonProperty("aspect_ratio")
    private String aspectRatio;

    @JsonProperty("style_type")
    private String styleType;
}
