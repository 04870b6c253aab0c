package ru.oparin.forge.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Базовое исключение адаптеров провайдеров генерации изображений.
 * Всегда содержит имя провайдера, к которому относится ошибка, и числовой код.
 */
@Getter
public class ProviderException extends RuntimeException {

    /**
     * Имя провайдера, на стороне которого произошла ошибка.
     */
    private final String providerName;

    /**
     * Код ошибки: HTTP статус от провайдера или синтезированный код (500, 408 и т.д.).
     */
    private final int errorCode;

    public ProviderException(String providerName, int errorCode, String message) {
        super(message);
        this.providerName = providerName;
        this.errorCode = errorCode;
    }

    public ProviderException(String providerName, int errorCode, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
        this.errorCode = errorCode;
    }

    /**
     * HTTP статус, соответствующий коду ошибки.
     *
     * @return статус или null, если код не является стандартным HTTP статусом
     */
    public HttpStatus getStatus() {
        return HttpStatus.resolve(errorCode);
    }
}
