package ru.oparin.forge.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Конфигурационные свойства провайдеров генерации изображений.
 * Настройки загружаются из application.yml с префиксом image-providers.
 * <p>
 * API ключи здесь не хранятся: ключ передается в каждый вызов адаптера.
 */
@Getter
@Setter
@Validated
@Configuration
@ConfigurationProperties(prefix = "image-providers")
public class ImageProvidersProperties {

    @Valid
    @NotNull
    private Api blackforest = new Api("https://api.bfl.ai");

    @Valid
    @NotNull
    private Api ideogram = new Api("https://api.ideogram.ai");

    @Valid
    @NotNull
    private Api luma = new Api("https://api.lumalabs.ai");

    @Valid
    @NotNull
    private Api runway = new Api("https://api.dev.runwayml.com");

    @Valid
    @NotNull
    private Api stability = new Api("https://api.stability.ai");

    @Valid
    @NotNull
    private Api openai = new Api("https://api.openai.com/v1");

    /**
     * Настройки HTTP клиента, общие для всех провайдеров.
     */
    @Valid
    @NotNull
    private Http http = new Http();

    /**
     * Настройки API провайдера.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Api {
        /**
         * Базовый URL API провайдера.
         */
        @NotBlank
        private String url;
    }

    /**
     * Настройки пула соединений и таймаутов HTTP клиента.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Http {
        /**
         * Таймаут подключения в миллисекундах.
         */
        @Positive
        private int connectTimeoutMs = 30_000;

        /**
         * Таймаут ожидания ответа на один запрос в миллисекундах.
         */
        @Positive
        private long responseTimeoutMs = 120_000;

        /**
         * Максимальное количество соединений в пуле.
         */
        @Positive
        private int maxConnections = 200;

        /**
         * Время простоя соединения в пуле, после которого оно закрывается, в миллисекундах.
         */
        @Positive
        private long maxIdleTimeMs = 30_000;
    }
}
