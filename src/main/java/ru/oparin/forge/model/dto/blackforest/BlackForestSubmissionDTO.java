package ru.oparin.forge.model.dto.blackforest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ответ Black Forest Labs на создание задачи.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BlackForestSubmissionDTO {

    private String id;

    /**
     * Полный URL для опроса статуса задачи.
     */
    @JsonProperty("polling_url")
    private String pollingUrl;
}
