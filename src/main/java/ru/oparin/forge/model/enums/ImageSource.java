package ru.oparin.forge.model.enums;

/**
 * Вид ссылки на изображение в ответе.
 */
public enum ImageSource {
    /** Внешний URL на стороне провайдера */
    REMOTE_URL,
    /** data URI с base64 содержимым */
    DATA_URI
}
