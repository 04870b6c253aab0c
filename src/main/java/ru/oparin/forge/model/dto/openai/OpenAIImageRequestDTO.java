package ru.oparin.forge.model.dto.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO запроса /images/generations OpenAI-совместимого API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OpenAIImageRequestDTO {

    private String model;

    private String prompt;

    private Integer n;

    private String size;

    private String quality;

    private String style;

    @JsonProperty("response_format")
    private String responseFormat;
}
