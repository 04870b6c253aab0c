package ru.oparin.forge.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.oparin.forge.model.enums.ProviderType;
import ru.oparin.forge.service.provider.ProviderAdapter;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Конфигурация для регистрации адаптеров провайдеров генерации изображений.
 */
@Slf4j
@Configuration
public class ProviderAdapterConfig {

    /**
     * Создать Map всех доступных адаптеров по типу провайдера.
     *
     * @param adapters все адаптеры из контекста
     * @return Map адаптеров
     * @throws IllegalStateException если два адаптера объявляют один и тот же тип провайдера
     */
    @Bean
    public Map<ProviderType, ProviderAdapter> providerAdapters(List<ProviderAdapter> adapters) {
        Map<ProviderType, ProviderAdapter> result = new EnumMap<>(ProviderType.class);
        for (ProviderAdapter adapter : adapters) {
            ProviderAdapter previous = result.put(adapter.getProviderType(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters for provider " + adapter.getProviderType()
                        + ": " + previous.getClass().getSimpleName() + " and " + adapter.getClass().getSimpleName());
            }
            log.info("Зарегистрирован адаптер провайдера {}: {}",
                    adapter.getProviderType().getDisplayName(), adapter.getClass().getSimpleName());
        }
        return result;
    }
}
