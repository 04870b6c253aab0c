package ru.oparin.forge.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Некорректный запрос от вызывающей стороны (нет промпта, нет модели).
 * Выбрасывается до любого сетевого вызова.
 */
@Getter
public class InvalidProviderRequestException extends ProviderException {

    /**
     * Имя поля запроса, из-за которого запрос отклонен.
     */
    private final String field;

    public InvalidProviderRequestException(String providerName, String field, String message) {
        super(providerName, HttpStatus.BAD_REQUEST.value(), message);
        this.field = field;
    }
}
