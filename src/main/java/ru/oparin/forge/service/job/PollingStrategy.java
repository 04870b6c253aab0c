package ru.oparin.forge.service.job;

import reactor.core.publisher.Mono;

/**
 * Протокол асинхронной задачи конкретного провайдера: как создать задачу, как опросить ее статус
 * и как прочитать ответ на опрос. Сам цикл опроса реализован один раз в {@link JobEngine}.
 * <p>
 * Экземпляр создается на один вызов адаптера и содержит только неизменяемые данные этого вызова.
 *
 * @param <S> тип ответа провайдера на опрос статуса
 * @param <R> тип результата задачи
 */
public interface PollingStrategy<S, R> {

    String getProviderName();

    /**
     * Создать задачу. Вызывается ровно один раз, без повторов.
     *
     * @return идентификатор задачи, по которому выполняется опрос
     */
    Mono<String> submit();

    /**
     * Запросить статус задачи.
     *
     * @return ответ провайдера; пустой результат означает, что провайдер ответил HTTP статусом,
     * который он использует как "задача еще выполняется"
     */
    Mono<S> fetchStatus(String jobId);

    /**
     * Классифицировать ответ провайдера: выполняется, успех с результатом или ошибка.
     */
    JobStatus<R> classify(S status);

    PollSchedule getSchedule();
}
