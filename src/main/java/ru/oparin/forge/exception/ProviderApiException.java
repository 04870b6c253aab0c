package ru.oparin.forge.exception;

/**
 * Провайдер ответил, но сообщил об ошибке: неуспешный HTTP статус, состояние задачи "failed"
 * или ответ без ожидаемых данных. Ядро такие ошибки не повторяет.
 */
public class ProviderApiException extends ProviderException {

    public ProviderApiException(String providerName, int errorCode, String message) {
        super(providerName, errorCode, message);
    }

    public ProviderApiException(String providerName, int errorCode, String message, Throwable cause) {
        super(providerName, errorCode, message, cause);
    }

    @Override
    public String getMessage() {
        return String.format("[%s] %d: %s", getProviderName(), getErrorCode(), super.getMessage());
    }

    /**
     * Сообщение провайдера без префикса с именем и кодом.
     */
    public String getErrorMessage() {
        return super.getMessage();
    }
}
