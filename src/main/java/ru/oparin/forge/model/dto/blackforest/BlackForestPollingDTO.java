package ru.oparin.forge.model.dto.blackforest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ответ Black Forest Labs на опрос статуса задачи.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BlackForestPollingDTO {

    private String id;

    /**
     * Статус задачи: Pending, Ready, Error, Content Moderated, Request Moderated, Task not found.
     */
    private String status;

    /**
     * Результат, присутствует только при статусе Ready.
     */
    private Result result;

    /**
     * Описание ошибки при статусе Error.
     */
    private String error;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Result {
        /**
         * Подписанный URL сгенерированного изображения.
         */
        private String sample;

        private String prompt;
    }
}
