package ru.oparin.forge.model.dto.blackforest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO запроса на создание задачи генерации в Black Forest Labs API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BlackForestRequestDTO {

    private String prompt;

    private Integer width;

    private Integer height;

    /**
     * Автоматическое улучшение промпта на стороне провайдера.
     */
    @JsonProperty("prompt_upsampling")
    private Boolean promptUpsampling;

    private Integer seed;

    /**
     * Уровень толерантности модерации (0 - самый строгий).
     */
    @JsonProperty("safety_tolerance")
    private Integer safetyTolerance;

    /**
     * Формат результата: jpeg или png.
     */
    @JsonProperty("output_format")
    private String outputFormat;
}
