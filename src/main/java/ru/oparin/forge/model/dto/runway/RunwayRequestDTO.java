package ru.oparin.forge.model.dto.runway;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO запроса text-to-image в Runway API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunwayRequestDTO {

    private String model;

    @JsonProperty("prompt_text")
    private String promptText;

    private String ratio;

    private Integer seed;
}
