package ru.oparin.forge.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Провайдеры генерации изображений, для которых есть адаптеры.
 */
@Getter
@RequiredArgsConstructor
public enum ProviderType {
    /**
     * Black Forest Labs (Flux), асинхронная генерация с опросом polling_url.
     */
    BLACKFOREST("blackforest", "Black Forest Labs"),

    /**
     * Ideogram, синхронная генерация.
     */
    IDEOGRAM("ideogram", "Ideogram"),

    /**
     * Luma AI (Dream Machine), асинхронная генерация.
     */
    LUMA("luma", "Luma AI"),

    /**
     * Runway, асинхронная генерация через задачи.
     */
    RUNWAY("runway", "Runway"),

    /**
     * Stability AI, синхронная генерация с бинарным ответом.
     */
    STABILITY("stability", "Stability AI"),

    /**
     * OpenAI-совместимый провайдер, синхронная генерация.
     */
    OPENAI("openai", "OpenAI");

    private final String code;
    private final String displayName;
}
