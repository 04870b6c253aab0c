package ru.oparin.forge.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.oparin.forge.service.provider.ModelCatalogCache;

import java.util.List;

/**
 * Конфигурация кеширования для приложения.
 */
@Configuration
public class CacheConfig {

    /**
     * Кеш каталогов моделей провайдеров. Без TTL и ограничения размера:
     * запись живет до явной инвалидации.
     */
    @Bean
    public Cache<ModelCatalogCache.Key, List<String>> modelCatalogStore() {
        return Caffeine.newBuilder().build();
    }
}
