package ru.oparin.forge.service.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import ru.oparin.forge.exception.ProviderApiException;
import ru.oparin.forge.exception.ProviderException;

import java.util.concurrent.TimeoutException;

/**
 * Обработчик ошибок для адаптеров провайдеров.
 * Переводит ошибки транспорта и кодеков в таксономию {@link ProviderException},
 * так что вызывающая сторона всегда видит ошибку с именем провайдера и кодом.
 */
@Slf4j
@Component
public class ProviderErrorHandler {

    /**
     * Преобразовать ошибку в исключение из таксономии провайдеров.
     * Ошибки, уже относящиеся к таксономии, возвращаются без изменений.
     */
    public ProviderException translate(String providerName, Throwable error) {
        if (error instanceof ProviderException providerError) {
            return providerError;
        }

        if (isTimeoutError(error)) {
            log.warn("Timeout при запросе к провайдеру {}: {}", providerName, error.getMessage());
            return new ProviderApiException(providerName, HttpStatus.GATEWAY_TIMEOUT.value(),
                    ProviderConstants.ErrorMessages.REQUEST_TIMEOUT, error);
        }

        if (error instanceof WebClientRequestException) {
            log.warn("Ошибка подключения к провайдеру {}: {}", providerName, error.getMessage());
            return new ProviderApiException(providerName, HttpStatus.SERVICE_UNAVAILABLE.value(),
                    String.format(ProviderConstants.ErrorMessages.CONNECTION_ERROR, error.getMessage()), error);
        }

        if (error instanceof WebClientResponseException webError) {
            String responseBody = webError.getResponseBodyAsString();
            log.warn("Ошибка от провайдера {}. Статус: {}, тело: {}", providerName, webError.getStatusCode(), responseBody);
            return new ProviderApiException(providerName, webError.getStatusCode().value(),
                    responseBody.isEmpty() ? webError.getStatusText() : responseBody, error);
        }

        if (error instanceof CodecException) {
            log.warn("Не удалось разобрать ответ провайдера {}: {}", providerName, error.getMessage());
            return new ProviderApiException(providerName, HttpStatus.INTERNAL_SERVER_ERROR.value(),
                    String.format(ProviderConstants.ErrorMessages.MALFORMED_RESPONSE, error.getMessage()), error);
        }

        log.error("Неизвестная ошибка при работе с провайдером {}: {}", providerName, error.getMessage(), error);
        return new ProviderApiException(providerName, HttpStatus.INTERNAL_SERVER_ERROR.value(),
                String.format(ProviderConstants.ErrorMessages.UNKNOWN_ERROR, error.getMessage()), error);
    }

    /**
     * Проверить, является ли ошибка таймаутом.
     */
    private boolean isTimeoutError(Throwable error) {
        return error instanceof TimeoutException
                || (error.getCause() != null && error.getCause() instanceof TimeoutException)
                || (error.getMessage() != null && error.getMessage().toLowerCase().contains("timeout"));
    }
}
