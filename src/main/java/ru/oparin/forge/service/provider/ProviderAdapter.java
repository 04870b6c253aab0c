package ru.oparin.forge.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.forge.exception.InvalidProviderRequestException;
import ru.oparin.forge.exception.ProviderCancelledException;
import ru.oparin.forge.exception.UnsupportedProviderOperationException;
import ru.oparin.forge.model.dto.image.ImageGenerationRequest;
import ru.oparin.forge.model.dto.image.ImageGenerationResponse;
import ru.oparin.forge.model.enums.ProviderType;

import java.util.List;
import java.util.Map;

/**
 * Единый интерфейс адаптеров провайдеров генерации изображений.
 * <p>
 * Вызывающая сторона работает с каноническим запросом в формате OpenAI и получает канонический ответ.
 * Провайдеры отличаются протоколом:
 * <ul>
 *   <li>Синхронная генерация за один запрос (Ideogram, Stability, OpenAI)</li>
 *   <li>Создание задачи и опрос ее статуса (Black Forest Labs, Luma, Runway)</li>
 * </ul>
 * Все ошибки приходят как подклассы {@link ru.oparin.forge.exception.ProviderException}.
 * <p>
 * Адаптер не хранит состояния между вызовами, кроме кеша каталогов моделей,
 * поэтому один экземпляр можно использовать из любого количества параллельных вызовов.
 */
public interface ProviderAdapter {

    /**
     * Имя провайдера для ошибок, логов и ключей кеша.
     */
    String getProviderName();

    ProviderType getProviderType();

    /**
     * Получить идентификатор модели из запроса.
     *
     * @throws InvalidProviderRequestException если модель не указана
     */
    default String getModelId(ImageGenerationRequest request) {
        if (request == null || request.getModel() == null || request.getModel().isBlank()) {
            throw new InvalidProviderRequestException(getProviderName(), "model",
                    ProviderConstants.ErrorMessages.MODEL_REQUIRED);
        }
        return request.getModel();
    }

    /**
     * Получить список моделей провайдера.
     * <p>
     * Результат кешируется по (провайдер, ключ, базовый URL); повторный вызов с тем же ключом
     * возвращает тот же список без обращения к провайдеру.
     *
     * @param credential  API ключ
     * @param baseUrl     базовый URL; если null, используется URL из конфигурации
     * @param queryParams дополнительные параметры запроса списка, может быть null
     */
    Mono<List<String>> listModels(String credential, String baseUrl, Map<String, String> queryParams);

    /**
     * Выполнить запрос текстового completion.
     *
     * @return ответ провайдера; у провайдеров только изображений - ошибка {@link UnsupportedProviderOperationException}
     */
    Mono<JsonNode> processCompletion(String endpoint, JsonNode payload, String credential);

    /**
     * Выполнить запрос embeddings.
     *
     * @return ответ провайдера; у провайдеров только изображений - ошибка {@link UnsupportedProviderOperationException}
     */
    Mono<JsonNode> processEmbeddings(String endpoint, JsonNode payload, String credential);

    /**
     * Сгенерировать изображение.
     * <p>
     * Пустой промпт отклоняется с {@link InvalidProviderRequestException} до любого сетевого вызова.
     * Для асинхронных провайдеров время ожидания ограничено числом опросов; по его исчерпании -
     * {@link ru.oparin.forge.exception.ProviderTimeoutException}.
     *
     * @param endpoint   эндпоинт, по которому пришел запрос, для логов
     * @param request    канонический запрос
     * @param credential API ключ
     */
    Mono<ImageGenerationResponse> processImageGeneration(String endpoint, ImageGenerationRequest request, String credential);

    /**
     * Сгенерировать изображение с возможностью отмены.
     * <p>
     * Если сигнал отмены пришел раньше результата, текущий сетевой запрос или пауза между опросами
     * прерываются, и вызов завершается {@link ProviderCancelledException}.
     * Отменой считается только первый элемент сигнала; завершение сигнала без элементов отменой не является.
     *
     * @param cancelSignal сигнал отмены; null - без отмены
     */
    default Mono<ImageGenerationResponse> processImageGeneration(String endpoint, ImageGenerationRequest request,
                                                                 String credential, Publisher<?> cancelSignal) {
        Mono<ImageGenerationResponse> generation = processImageGeneration(endpoint, request, credential);
        if (cancelSignal == null) {
            return generation;
        }
        return generation
                .takeUntilOther(Flux.from(cancelSignal).take(1).concatWith(Flux.never()))
                .switchIfEmpty(Mono.error(() -> new ProviderCancelledException(getProviderName())));
    }
}
