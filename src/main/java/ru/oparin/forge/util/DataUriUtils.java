package ru.oparin.forge.util;

import lombok.experimental.UtilityClass;

import java.util.Base64;

/**
 * Утилиты для построения data URI из бинарных данных изображений.
 */
@UtilityClass
public class DataUriUtils {

    private static final String DATA_URL_PREFIX = "data:";
    private static final String DATA_URL_SEPARATOR = ";base64,";

    /**
     * Закодировать байты в base64 и построить data URI.
     *
     * @param mimeType MIME тип изображения
     * @param bytes    содержимое
     * @return строка вида data:image/png;base64,...
     */
    public static String toDataUri(String mimeType, byte[] bytes) {
        return toDataUri(mimeType, Base64.getEncoder().encodeToString(bytes));
    }

    /**
     * Построить data URI из уже закодированных base64 данных.
     */
    public static String toDataUri(String mimeType, String base64Data) {
        return DATA_URL_PREFIX + mimeType + DATA_URL_SEPARATOR + base64Data;
    }
}
