package ru.oparin.forge.model.dto.luma;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO запроса на генерацию изображения в Luma Dream Machine API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LumaRequestDTO {

    private String prompt;

    private String model;

    @JsonProperty("aspect_ratio")
    private String aspectRatio;
}
