package ru.oparin.forge.service.job;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import ru.oparin.forge.exception.ProviderApiException;
import ru.oparin.forge.exception.ProviderTimeoutException;
import ru.oparin.forge.service.provider.ProviderConstants;

/**
 * Движок асинхронных задач провайдеров: создание задачи, опрос с фиксированным интервалом, конечное состояние.
 * <p>
 * Переходы: SUBMITTED -> PENDING* -> SUCCEEDED | FAILED | TIMED_OUT.
 * <ul>
 *   <li>Успех с результатом - результат возвращается</li>
 *   <li>Успех без результата - ошибка 500, без повтора</li>
 *   <li>Явная ошибка провайдера - ошибка 500 с причиной от провайдера, без повтора</li>
 *   <li>Любой другой статус - следующий опрос после паузы</li>
 *   <li>Исчерпан лимит опросов - ошибка 408, больше запросов не выполняется</li>
 * </ul>
 * HTTP ошибки опроса и создания задачи приходят из {@link PollingStrategy} и не повторяются.
 * Между опросами поток не блокируется: ожидание выполняется через {@link Mono#delay}.
 */
@Slf4j
@Component
public class JobEngine {

    /**
     * Статус для логов, когда провайдер ответил HTTP статусом "еще выполняется" без тела.
     */
    static final String HTTP_PENDING_STATUS = "HTTP_PENDING";

    /**
     * Создать задачу и дождаться ее конечного состояния.
     *
     * @param strategy протокол задачи конкретного провайдера
     * @return результат задачи
     */
    public <S, R> Mono<R> execute(PollingStrategy<S, R> strategy) {
        PollSchedule schedule = strategy.getSchedule();
        return Mono.defer(strategy::submit)
                .flatMap(jobId -> {
                    PollingJob<R> job = new PollingJob<>(jobId, schedule.getMaxAttempts());
                    log.info("Задача {} создана у провайдера {}, опрос каждые {} с, максимум {} попыток",
                            jobId, strategy.getProviderName(), schedule.getInterval().toSeconds(), schedule.getMaxAttempts());
                    return poll(strategy, job, schedule.isDelayFirstPoll());
                });
    }

    private <S, R> Mono<R> poll(PollingStrategy<S, R> strategy, PollingJob<R> job, boolean delayBeforePoll) {
        if (job.isExhausted()) {
            job.markTimedOut();
            log.warn("Задача {} провайдера {} не завершилась за {} опросов, последний статус: {}",
                    job.getId(), strategy.getProviderName(), job.getAttemptsMade(), job.getLastRawStatus());
            return Mono.error(new ProviderTimeoutException(strategy.getProviderName(),
                    ProviderConstants.ErrorMessages.POLLING_TIMEOUT));
        }

        Mono<Long> pause = delayBeforePoll
                ? Mono.delay(strategy.getSchedule().getInterval())
                : Mono.just(0L);

        return pause
                .then(Mono.defer(() -> strategy.fetchStatus(job.getId())))
                .map(strategy::classify)
                .defaultIfEmpty(JobStatus.<R>pending(HTTP_PENDING_STATUS))
                .flatMap(status -> switch (status.getState()) {
                    case SUCCEEDED -> onSucceeded(strategy, job, status);
                    case FAILED -> onFailed(strategy, job, status);
                    default -> onPending(strategy, job, status);
                });
    }

    private <S, R> Mono<R> onSucceeded(PollingStrategy<S, R> strategy, PollingJob<R> job, JobStatus<R> status) {
        if (status.getResult() == null) {
            job.markFailed(ProviderConstants.ErrorMessages.COMPLETED_WITHOUT_OUTPUT, status.getRawStatus());
            log.error("Задача {} провайдера {} завершена со статусом {}, но результат отсутствует",
                    job.getId(), strategy.getProviderName(), status.getRawStatus());
            return Mono.error(new ProviderApiException(strategy.getProviderName(),
                    HttpStatus.INTERNAL_SERVER_ERROR.value(), ProviderConstants.ErrorMessages.COMPLETED_WITHOUT_OUTPUT));
        }
        job.markSucceeded(status.getResult(), status.getRawStatus());
        log.info("Задача {} провайдера {} завершена успешно после {} опросов",
                job.getId(), strategy.getProviderName(), job.getAttemptsMade() + 1);
        return Mono.just(job.getResult());
    }

    private <S, R> Mono<R> onFailed(PollingStrategy<S, R> strategy, PollingJob<R> job, JobStatus<R> status) {
        String reason = status.getFailureReason() == null || status.getFailureReason().isBlank()
                ? ProviderConstants.ErrorMessages.UNKNOWN_FAILURE
                : status.getFailureReason();
        job.markFailed(reason, status.getRawStatus());
        log.error("Задача {} провайдера {} завершилась с ошибкой ({}): {}",
                job.getId(), strategy.getProviderName(), status.getRawStatus(), reason);
        return Mono.error(new ProviderApiException(strategy.getProviderName(),
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                String.format(ProviderConstants.ErrorMessages.GENERATION_FAILED, reason)));
    }

    private <S, R> Mono<R> onPending(PollingStrategy<S, R> strategy, PollingJob<R> job, JobStatus<R> status) {
        job.markPending(status.getRawStatus());
        log.debug("Задача {} провайдера {} еще не готова (попытка {}/{}): {}",
                job.getId(), strategy.getProviderName(), job.getAttemptsMade(), job.getMaxAttempts(), status.getRawStatus());
        return poll(strategy, job, true);
    }
}
