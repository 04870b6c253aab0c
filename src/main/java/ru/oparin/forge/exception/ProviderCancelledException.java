package ru.oparin.forge.exception;

/**
 * Генерация прервана внешним сигналом отмены до получения результата.
 */
public class ProviderCancelledException extends ProviderException {

    /**
     * Нестандартный код "client closed request".
     */
    public static final int CANCELLED_CODE = 499;

    public ProviderCancelledException(String providerName) {
        super(providerName, CANCELLED_CODE, "Image generation was cancelled");
    }
}
