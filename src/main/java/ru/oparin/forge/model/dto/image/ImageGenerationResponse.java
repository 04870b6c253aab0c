package ru.oparin.forge.model.dto.image;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Канонический ответ генерации в формате OpenAI: {created, data: [{url, revised_prompt}]}.
 */
@Value
public class ImageGenerationResponse {

    /** Время создания ответа, секунды Unix */
    long created;

    List<ImageItem> data;

    public ImageGenerationResponse(long created, List<ImageItem> data) {
        this.created = created;
        this.data = List.copyOf(data);
    }

    /**
     * Ответ с текущим временем создания.
     */
    public static ImageGenerationResponse of(List<ImageItem> data) {
        return new ImageGenerationResponse(Instant.now().getEpochSecond(), data);
    }

    public static ImageGenerationResponse of(ImageItem item) {
        return of(List.of(item));
    }
}
