package ru.oparin.forge.service.provider;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Кеш списков моделей, которые вернули провайдеры.
 * <p>
 * Ключ - (провайдер, API ключ, базовый URL). Значение перезаписывается целиком при каждой успешной загрузке
 * и хранится как неизменяемый список, поэтому читатель никогда не видит частично записанную запись.
 */
@Slf4j
@Component
@RequiredArgsConstructor(onConstructor_ = @Autowired)
public class ModelCatalogCache {

    private final Cache<Key, List<String>> store;

    /**
     * Кеш с собственным хранилищем, для использования вне Spring контекста.
     */
    public ModelCatalogCache() {
        this(Caffeine.newBuilder().build());
    }

    /**
     * Получить закешированный каталог.
     *
     * @return каталог или пустой Optional, если загрузки для ключа еще не было
     */
    public Optional<List<String>> get(String providerName, String credential, String baseUrl) {
        return Optional.ofNullable(store.getIfPresent(new Key(providerName, credential, baseUrl)));
    }

    /**
     * Сохранить каталог, полностью заменив предыдущее значение.
     *
     * @return сохраненный неизменяемый список
     */
    public List<String> put(String providerName, String credential, String baseUrl, List<String> models) {
        List<String> snapshot = List.copyOf(models);
        store.put(new Key(providerName, credential, baseUrl), snapshot);
        log.debug("Каталог моделей {} для {} сохранен в кеш: {} моделей", providerName, baseUrl, snapshot.size());
        return snapshot;
    }

    /**
     * Удалить каталог для одного ключа.
     */
    public void invalidate(String providerName, String credential, String baseUrl) {
        store.invalidate(new Key(providerName, credential, baseUrl));
    }

    /**
     * Удалить все каталоги провайдера.
     */
    public void invalidateAll(String providerName) {
        store.asMap().keySet().removeIf(key -> Objects.equals(key.getProviderName(), providerName));
        log.info("Кеш каталогов моделей {} очищен", providerName);
    }

    /**
     * Ключ кеша каталога моделей.
     */
    @Value
    public static class Key {
        String providerName;
        @ToString.Exclude
        String credential;
        String baseUrl;
    }
}
