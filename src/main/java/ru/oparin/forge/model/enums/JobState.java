package ru.oparin.forge.model.enums;

/**
 * Состояния асинхронной задачи генерации на стороне провайдера.
 */
public enum JobState {

    /**
     * Задача только что создана, опросов еще не было.
     */
    SUBMITTED,

    /**
     * Задача выполняется, провайдер еще не вернул результат.
     */
    PENDING,

    /**
     * Задача завершена успешно, результат получен.
     */
    SUCCEEDED,

    /**
     * Провайдер сообщил об ошибке генерации.
     */
    FAILED,

    /**
     * Исчерпан лимит попыток опроса.
     */
    TIMED_OUT;

    /**
     * Проверить, является ли состояние конечным.
     *
     * @param state состояние для проверки
     * @return true для SUCCEEDED, FAILED и TIMED_OUT
     */
    public static boolean isTerminal(JobState state) {
        return state == SUCCEEDED || state == FAILED || state == TIMED_OUT;
    }
}
