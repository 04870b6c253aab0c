package ru.oparin.forge.model.dto.image;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import ru.oparin.forge.model.enums.ImageSource;
import ru.oparin.forge.util.DataUriUtils;

/**
 * Одно изображение в каноническом ответе.
 * Поле url содержит либо внешний URL, либо data URI; вид ссылки хранится отдельно и не сериализуется.
 */
@Value
public class ImageItem {

    String url;

    @JsonProperty("revised_prompt")
    String revisedPrompt;

    @JsonIgnore
    ImageSource source;

    /**
     * Изображение, доступное по внешнему URL провайдера.
     */
    public static ImageItem remote(String url, String revisedPrompt) {
        return new ImageItem(url, revisedPrompt, ImageSource.REMOTE_URL);
    }

    /**
     * Изображение, переданное провайдером в виде байтов.
     *
     * @param mimeType MIME тип, например image/png
     * @param bytes    содержимое изображения
     */
    public static ImageItem dataUri(String mimeType, byte[] bytes, String revisedPrompt) {
        return new ImageItem(DataUriUtils.toDataUri(mimeType, bytes), revisedPrompt, ImageSource.DATA_URI);
    }

    /**
     * Изображение, уже закодированное провайдером в base64.
     */
    public static ImageItem dataUri(String mimeType, String base64Data, String revisedPrompt) {
        return new ImageItem(DataUriUtils.toDataUri(mimeType, base64Data), revisedPrompt, ImageSource.DATA_URI);
    }
}
