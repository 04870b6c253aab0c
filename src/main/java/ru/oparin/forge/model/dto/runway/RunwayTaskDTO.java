package ru.oparin.forge.model.dto.runway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Задача Runway: ответ на создание задачи и на опрос /v1/tasks/{id}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunwayTaskDTO {

    private String id;

    /**
     * Статус задачи: PENDING, THROTTLED, RUNNING, SUCCEEDED, FAILED, CANCELLED.
     */
    private String status;

    /**
     * URL результатов, заполнено при SUCCEEDED.
     */
    private List<String> output;

    private String error;

    /**
     * Причина ошибки в текущей версии API (раньше передавалась в error).
     */
    private String failure;
}
