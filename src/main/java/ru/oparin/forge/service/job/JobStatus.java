package ru.oparin.forge.service.job;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import ru.oparin.forge.model.enums.JobState;

/**
 * Результат классификации одного ответа на опрос статуса.
 *
 * @param <R> тип результата задачи (например, URL изображения)
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JobStatus<R> {

    private final JobState state;

    /**
     * Результат, только для SUCCEEDED. Если null при SUCCEEDED - провайдер нарушил контракт.
     */
    private final R result;

    private final String failureReason;

    /**
     * Статус в словаре провайдера, для логов.
     */
    private final String rawStatus;

    public static <R> JobStatus<R> pending(String rawStatus) {
        return new JobStatus<>(JobState.PENDING, null, null, rawStatus);
    }

    /**
     * Провайдер сообщил об успехе.
     *
     * @param result извлеченный результат или null, если поле результата в ответе отсутствует
     */
    public static <R> JobStatus<R> succeeded(R result, String rawStatus) {
        return new JobStatus<>(JobState.SUCCEEDED, result, null, rawStatus);
    }

    public static <R> JobStatus<R> failed(String failureReason, String rawStatus) {
        return new JobStatus<>(JobState.FAILED, null, failureReason, rawStatus);
    }
}
