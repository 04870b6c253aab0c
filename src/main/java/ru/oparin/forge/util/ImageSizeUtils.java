package ru.oparin.forge.util;

import lombok.Value;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.service.provider.ProviderConstants;

/**
 * Утилиты для работы с размером изображения в формате OpenAI ("1024x1024").
 */
@Slf4j
@UtilityClass
public class ImageSizeUtils {

    private static final String SEPARATOR = "x";

    /**
     * Размер из запроса или размер по умолчанию, если не задан.
     */
    public static String sizeOrDefault(String size) {
        return size == null || size.isBlank() ? ImageGenerationRequest.DEFAULT_SIZE : size;
    }

    /**
     * Разобрать размер "ШxВ" в ширину и высоту.
     * Некорректное значение не является ошибкой: возвращается 1024x1024.
     *
     * @param size размер в формате "ШxВ"
     * @return ширина и высота
     */
    public static Dimensions parse(String size) {
        String value = sizeOrDefault(size);
        if (!value.contains(SEPARATOR)) {
            return defaultDimensions();
        }
        String[] parts = value.split(SEPARATOR);
        if (parts.length != 2) {
            log.warn("Некорректный размер изображения: {}, используем 1024x1024", value);
            return defaultDimensions();
        }
        try {
            return new Dimensions(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException e) {
            log.warn("Некорректный размер изображения: {}, используем 1024x1024", value);
            return defaultDimensions();
        }
    }

    private static Dimensions defaultDimensions() {
        return new Dimensions(ProviderConstants.DEFAULT_DIMENSION, ProviderConstants.DEFAULT_DIMENSION);
    }

    /**
     * Ширина и высота изображения в пикселях.
     */
    @Value
    public static class Dimensions {
        int width;
        int height;
    }
}
