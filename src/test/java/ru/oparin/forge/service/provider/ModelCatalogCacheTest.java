package ru.oparin.forge.service.provider;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelCatalogCacheTest {

    private final ModelCatalogCache cache = new ModelCatalogCache();

    @Test
    void storedCatalogIsAnIsolatedSnapshot() {
        List<String> source = new ArrayList<>(List.of("a", "b"));
        cache.put("luma", "key", "http://luma.test", source);
        source.add("c");

        List<String> cached = cache.get("luma", "key", "http://luma.test").orElseThrow();
        assertThat(cached).containsExactly("a", "b");
        assertThatThrownBy(() -> cached.add("d")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void newFetchOverwritesInsteadOfMerging() {
        cache.put("openai", "key", "http://openai.test", List.of("dall-e-2"));
        cache.put("openai", "key", "http://openai.test", List.of("dall-e-3"));

        assertThat(cache.get("openai", "key", "http://openai.test")).contains(List.of("dall-e-3"));
    }

    @Test
    void keyIncludesCredentialAndBaseUrl() {
        cache.put("openai", "key", "http://openai.test", List.of("dall-e-3"));

        assertThat(cache.get("openai", "other", "http://openai.test")).isEmpty();
        assertThat(cache.get("openai", "key", "http://proxy.test")).isEmpty();
        assertThat(cache.get("luma", "key", "http://openai.test")).isEmpty();
    }

    @Test
    void invalidationRemovesEntries() {
        cache.put("openai", "k1", "http://openai.test", List.of("dall-e-3"));
        cache.put("openai", "k2", "http://openai.test", List.of("dall-e-3"));
        cache.put("luma", "k1", "http://luma.test", List.of("photon-1"));

        cache.invalidate("openai", "k1", "http://openai.test");
        assertThat(cache.get("openai", "k1", "http://openai.test")).isEmpty();
        assertThat(cache.get("openai", "k2", "http://openai.test")).isPresent();

        cache.invalidateAll("openai");
        assertThat(cache.get("openai", "k2", "http://openai.test")).isEmpty();
        assertThat(cache.get("luma", "k1", "http://luma.test")).isPresent();
    }

    @Test
    void providerWideInvalidationToleratesKeysWithoutProviderName() {
        cache.put(null, "k1", "http://proxy.test", List.of("custom"));
        cache.put("openai", "k1", "http://openai.test", List.of("dall-e-3"));

        cache.invalidateAll("openai");

        assertThat(cache.get("openai", "k1", "http://openai.test")).isEmpty();
        assertThat(cache.get(null, "k1", "http://proxy.test")).contains(List.of("custom"));
    }

    @Test
    void credentialIsNotPrintedInKey() {
        assertThat(new ModelCatalogCache.Key("openai", "sk-secret", "http://openai.test").toString())
                .doesNotContain("sk-secret");
    }
}
