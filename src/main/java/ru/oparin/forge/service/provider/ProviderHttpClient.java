package ru.oparin.forge.service.provider;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import ru.oparin.forge.config.properties.ImageProvidersProperties;
import ru.oparin.forge.exception.ProviderApiException;
import ru.oparin.forge.exception.ProviderException;

import java.time.Duration;
import java.util.Set;
import java.util.function.Consumer;

/**
 * HTTP клиент для вызовов API провайдеров: создание задачи, опрос статуса, получение бинарного результата.
 * <p>
 * Каждый вызов - отдельный обмен на соединении из общего пула Reactor Netty; соединение не удерживается
 * между опросами. Повторов на уровне транспорта нет: любая ошибка уходит вызывающему адаптеру
 * в виде {@link ProviderApiException} с сохраненной причиной.
 */
@Slf4j
@Component
public class ProviderHttpClient {

    /**
     * Статусы успешного создания задачи: часть провайдеров отвечает 201.
     */
    public static final Set<Integer> OK_OR_CREATED = Set.of(HttpStatus.OK.value(), HttpStatus.CREATED.value());

    public static final Set<Integer> OK_ONLY = Set.of(HttpStatus.OK.value());

    private final WebClient webClient;
    private final ProviderErrorHandler errorHandler;

    @Autowired
    public ProviderHttpClient(WebClient.Builder webClientBuilder,
                              ImageProvidersProperties properties,
                              ProviderErrorHandler errorHandler) {
        ImageProvidersProperties.Http http = properties.getHttp();

        ConnectionProvider connectionProvider = ConnectionProvider.builder("image-providers")
                .maxConnections(http.getMaxConnections())
                .maxIdleTime(Duration.ofMillis(http.getMaxIdleTimeMs()))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .responseTimeout(Duration.ofMillis(http.getResponseTimeoutMs()))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, http.getConnectTimeoutMs());

        this.webClient = webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
        this.errorHandler = errorHandler;
    }

    public ProviderHttpClient(WebClient webClient, ProviderErrorHandler errorHandler) {
        this.webClient = webClient;
        this.errorHandler = errorHandler;
    }

    /**
     * Отправить JSON запрос и получить JSON ответ.
     *
     * @param providerName     имя провайдера для ошибок и логов
     * @param uri              полный URL
     * @param headers          заголовки запроса (авторизация и т.п.)
     * @param body             тело запроса
     * @param responseType     тип ответа
     * @param acceptedStatuses HTTP статусы, считающиеся успехом
     * @return тело ответа; любой другой статус завершается ошибкой с телом ответа в сообщении
     */
    public <T> Mono<T> postJson(String providerName, String uri, Consumer<HttpHeaders> headers, Object body,
                                Class<T> responseType, Set<Integer> acceptedStatuses) {
        log.debug("POST {} ({})", uri, providerName);
        return webClient.post()
                .uri(uri)
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .<T>exchangeToMono(response -> readJson(providerName, response, responseType, acceptedStatuses, "%s", Set.of()))
                .onErrorMap(error -> !(error instanceof ProviderException),
                        error -> errorHandler.translate(providerName, error));
    }

    /**
     * Выполнить GET запрос и получить JSON ответ.
     *
     * @param errorTemplate   шаблон сообщения об ошибке, параметр - тело ответа
     * @param pendingStatuses HTTP статусы, которые провайдер использует как "задача еще выполняется";
     *                        для них результат пустой
     */
    public <T> Mono<T> getJson(String providerName, String uri, Consumer<HttpHeaders> headers, Class<T> responseType,
                               String errorTemplate, Set<Integer> pendingStatuses) {
        log.debug("GET {} ({})", uri, providerName);
        return webClient.get()
                .uri(uri)
                .headers(headers)
                .accept(MediaType.APPLICATION_JSON)
                .<T>exchangeToMono(response -> readJson(providerName, response, responseType, OK_ONLY, errorTemplate, pendingStatuses))
                .onErrorMap(error -> !(error instanceof ProviderException),
                        error -> errorHandler.translate(providerName, error));
    }

    /**
     * Отправить multipart форму и получить бинарный ответ (изображение).
     *
     * @param timeout таймаут всего обмена
     */
    public Mono<byte[]> postMultipart(String providerName, String uri, Consumer<HttpHeaders> headers,
                                      MultiValueMap<String, HttpEntity<?>> parts, Duration timeout) {
        log.debug("POST multipart {} ({})", uri, providerName);
        return webClient.post()
                .uri(uri)
                .headers(headers)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(parts))
                .<byte[]>exchangeToMono(response -> {
                    if (response.statusCode().value() != HttpStatus.OK.value()) {
                        return this.<byte[]>errorFromResponse(providerName, response, "%s");
                    }
                    return response.bodyToMono(byte[].class)
                            .switchIfEmpty(Mono.error(() -> new ProviderApiException(providerName,
                                    HttpStatus.INTERNAL_SERVER_ERROR.value(), ProviderConstants.ErrorMessages.EMPTY_RESPONSE)));
                })
                .timeout(timeout)
                .onErrorMap(error -> !(error instanceof ProviderException),
                        error -> errorHandler.translate(providerName, error));
    }

    private <T> Mono<T> readJson(String providerName, ClientResponse response, Class<T> responseType,
                                 Set<Integer> acceptedStatuses, String errorTemplate, Set<Integer> pendingStatuses) {
        int status = response.statusCode().value();
        if (pendingStatuses.contains(status)) {
            log.debug("Провайдер {} ответил статусом {}, задача еще выполняется", providerName, status);
            return response.releaseBody().then(Mono.empty());
        }
        if (!acceptedStatuses.contains(status)) {
            return errorFromResponse(providerName, response, errorTemplate);
        }
        return response.bodyToMono(responseType)
                .switchIfEmpty(Mono.error(() -> new ProviderApiException(providerName,
                        HttpStatus.INTERNAL_SERVER_ERROR.value(), ProviderConstants.ErrorMessages.EMPTY_RESPONSE)));
    }

    private <T> Mono<T> errorFromResponse(String providerName, ClientResponse response, String errorTemplate) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(errorBody -> {
                    log.error("Ошибка API провайдера {}: статус {}, тело: {}", providerName, status, errorBody);
                    return Mono.error(new ProviderApiException(providerName, status,
                            String.format(errorTemplate, errorBody)));
                });
    }
}
