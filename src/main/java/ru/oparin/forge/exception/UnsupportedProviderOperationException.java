package ru.oparin.forge.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Провайдер не поддерживает запрошенный тип операции (completion или embeddings у провайдера изображений).
 * Это отказ в возможности, а не временная ошибка: повторять запрос к этому провайдеру бессмысленно.
 */
@Getter
public class UnsupportedProviderOperationException extends ProviderException {

    private final String endpoint;

    public UnsupportedProviderOperationException(String providerName, String endpoint, String message) {
        super(providerName, HttpStatus.NOT_IMPLEMENTED.value(), message);
        this.endpoint = endpoint;
    }
}
