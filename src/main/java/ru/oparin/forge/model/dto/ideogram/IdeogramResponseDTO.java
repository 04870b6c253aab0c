package ru.oparin.forge.model.dto.ideogram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Ответ Ideogram API со сгенерированными изображениями.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IdeogramResponseDTO {

    private String created;

    private List<Image> data;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Image {

        private String url;

        /**
         * Промпт, с которым реально выполнялась генерация (может быть переписан провайдером).
         */
        private String prompt;

        private String resolution;

        private Integer seed;

        @JsonProperty("is_image_safe")
        private Boolean imageSafe;
    }
}
