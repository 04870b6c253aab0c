package ru.oparin.forge.service.job;

import lombok.Value;

import java.time.Duration;

/**
 * Фиксированное расписание опроса задачи провайдера: без экспоненциальной задержки.
 */
@Value
public class PollSchedule {

    /**
     * Пауза между опросами.
     */
    Duration interval;

    /**
     * Максимальное количество опросов, после которого задача считается зависшей.
     */
    int maxAttempts;

    /**
     * Делать ли паузу перед первым опросом. Если false, первый опрос выполняется сразу после создания задачи.
     */
    boolean delayFirstPoll;

    /**
     * Пауза перед каждым опросом, включая первый.
     */
    public static PollSchedule delayed(Duration interval, int maxAttempts) {
        return new PollSchedule(interval, maxAttempts, true);
    }

    /**
     * Первый опрос сразу, далее пауза перед каждым следующим.
     */
    public static PollSchedule immediate(Duration interval, int maxAttempts) {
        return new PollSchedule(interval, maxAttempts, false);
    }
}
