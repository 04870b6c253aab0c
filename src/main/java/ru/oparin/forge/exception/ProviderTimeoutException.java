package ru.oparin.forge.exception;

import org.springframework.http.HttpStatus;

/**
 * Задача не дошла до конечного состояния за отведенное провайдеру число опросов.
 */
public class ProviderTimeoutException extends ProviderApiException {

    public ProviderTimeoutException(String providerName, String message) {
        super(providerName, HttpStatus.REQUEST_TIMEOUT.value(), message);
    }
}
