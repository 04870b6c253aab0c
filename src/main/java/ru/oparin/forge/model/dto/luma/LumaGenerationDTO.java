package ru.oparin.forge.model.dto.luma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Генерация Luma AI: ответ на создание и на опрос статуса имеет одинаковую структуру.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LumaGenerationDTO {

    private String id;

    /**
     * Состояние генерации: queued, dreaming, completed, failed.
     */
    private String state;

    @JsonProperty("failure_reason")
    private String failureReason;

    private Assets assets;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Assets {
        private String image;
    }
}
