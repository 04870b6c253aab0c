package ru.oparin.forge.service.job;

import lombok.Getter;
import lombok.ToString;
import ru.oparin.forge.model.enums.JobState;

/**
 * Задача провайдера в процессе опроса.
 * Принадлежит одному вызову адаптера и изменяется только циклом опроса этого вызова.
 *
 * @param <R> тип результата задачи
 */
@Getter
@ToString(exclude = "result")
public class PollingJob<R> {

    /**
     * Непрозрачный идентификатор задачи (id или URL опроса).
     */
    private final String id;

    private final int maxAttempts;

    private JobState state = JobState.SUBMITTED;

    private int attemptsMade;

    private R result;

    private String failureReason;

    private String lastRawStatus;

    public PollingJob(String id, int maxAttempts) {
        this.id = id;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Проверить, исчерпан ли лимит опросов.
     */
    public boolean isExhausted() {
        return attemptsMade >= maxAttempts;
    }

    /**
     * Учесть опрос, после которого задача все еще выполняется.
     */
    public void markPending(String rawStatus) {
        assertNotTerminal();
        this.attemptsMade++;
        this.lastRawStatus = rawStatus;
        this.state = JobState.PENDING;
    }

    public void markSucceeded(R result, String rawStatus) {
        assertNotTerminal();
        this.result = result;
        this.lastRawStatus = rawStatus;
        this.state = JobState.SUCCEEDED;
    }

    public void markFailed(String failureReason, String rawStatus) {
        assertNotTerminal();
        this.failureReason = failureReason;
        this.lastRawStatus = rawStatus;
        this.state = JobState.FAILED;
    }

    public void markTimedOut() {
        assertNotTerminal();
        this.state = JobState.TIMED_OUT;
    }

    private void assertNotTerminal() {
        if (JobState.isTerminal(state)) {
            throw new IllegalStateException("Job " + id + " is already in terminal state " + state);
        }
    }
}
