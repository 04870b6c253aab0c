package ru.oparin.forge.service.provider;

import java.time.Duration;
import java.util.List;

/**
 * Константы для адаптеров провайдеров генерации изображений.
 * Централизованное хранение путей, заголовков авторизации, каталогов моделей и параметров опроса.
 */
public final class ProviderConstants {

    private ProviderConstants() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Размер изображения по умолчанию, если размер не задан или не распознан.
     */
    public static final int DEFAULT_DIMENSION = 1024;

    /**
     * Константы для Black Forest Labs.
     */
    public static final class BlackForest {
        private BlackForest() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String PROVIDER_NAME = "blackforest";

        /**
         * Шаблон пути создания задачи, параметр - модель.
         */
        public static final String SUBMIT_PATH_TEMPLATE = "/v1/%s";

        public static final String AUTH_HEADER = "x-key";

        public static final String DEFAULT_MODEL = "flux-pro-1.1";

        public static final int DEFAULT_SEED = 42;

        public static final int SAFETY_TOLERANCE = 2;

        public static final String OUTPUT_FORMAT = "jpeg";

        /**
         * Первый опрос сразу после создания задачи, далее пауза 2 секунды; 30 попыток, около минуты.
         */
        public static final Duration POLL_INTERVAL = Duration.ofSeconds(2);
        public static final int MAX_POLL_ATTEMPTS = 30;

        public static final String STATUS_READY = "Ready";
        public static final String STATUS_ERROR = "Error";

        /**
         * Статусы, после которых задача не будет завершена успешно.
         */
        public static final List<String> FAILURE_STATUSES = List.of(
                STATUS_ERROR, "Content Moderated", "Request Moderated", "Task not found");

        public static final List<String> MODELS = List.of(
                "flux-pro-1.1",
                "flux-pro",
                "flux-dev",
                "flux-schnell");
    }

    /**
     * Константы для Ideogram.
     */
    public static final class Ideogram {
        private Ideogram() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String PROVIDER_NAME = "ideogram";

        public static final String GENERATE_PATH = "/v1/ideogram-v3/generate";

        public static final String AUTH_HEADER = "Api-Key";

        public static final String DEFAULT_MODEL = "ideogram-v3";

        public static final List<String> MODELS = List.of(
                "ideogram-v3",
                "ideogram-v2",
                "ideogram-v1-turbo",
                "ideogram-v1");
    }

    /**
     * Константы для Luma AI.
     */
    public static final class Luma {
        private Luma() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String PROVIDER_NAME = "luma";

        public static final String SUBMIT_PATH = "/dream-machine/v1/generations/image";

        public static final String STATUS_PATH_TEMPLATE = "/dream-machine/v1/generations/%s";

        public static final String DEFAULT_MODEL = "photon-1";

        /**
         * Пауза 5 секунд перед каждым опросом; 60 попыток, до 5 минут.
         */
        public static final Duration POLL_INTERVAL = Duration.ofSeconds(5);
        public static final int MAX_POLL_ATTEMPTS = 60;

        public static final String STATE_COMPLETED = "completed";
        public static final String STATE_FAILED = "failed";

        public static final List<String> MODELS = List.of(
                "photon-1",
                "photon-flash-1");
    }

    /**
     * Константы для Runway.
     */
    public static final class Runway {
        private Runway() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String PROVIDER_NAME = "runway";

        public static final String SUBMIT_PATH = "/v1/text_to_image";

        public static final String TASK_PATH_TEMPLATE = "/v1/tasks/%s";

        public static final String DEFAULT_MODEL = "gen4_image";

        /**
         * Пауза 2 секунды перед каждым опросом; 60 попыток, до 2 минут.
         */
        public static final Duration POLL_INTERVAL = Duration.ofSeconds(2);
        public static final int MAX_POLL_ATTEMPTS = 60;

        public static final String STATUS_SUCCEEDED = "SUCCEEDED";
        public static final String STATUS_FAILED = "FAILED";

        public static final List<String> MODELS = List.of(
                "gen4_image",
                "gen3_image",
                "gen2_image");
    }

    /**
     * Константы для Stability AI.
     */
    public static final class Stability {
        private Stability() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String PROVIDER_NAME = "stability";

        public static final String GENERATE_PATH_TEMPLATE = "/v2beta/%s";

        public static final String DEFAULT_MODEL = "stable-image-ultra";

        public static final String DEFAULT_OUTPUT_FORMAT = "png";

        /**
         * Таймаут синхронного запроса генерации.
         */
        public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

        public static final List<String> MODELS = List.of(
                "stable-image-ultra",
                "stable-image-core",
                "stable-diffusion-v1-6",
                "stable-diffusion-xl-1024-v1-0",
                "stable-diffusion-3-medium",
                "stable-diffusion-3-large");
    }

    /**
     * Константы для OpenAI-совместимого провайдера.
     */
    public static final class OpenAI {
        private OpenAI() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String PROVIDER_NAME = "openai";

        public static final String IMAGES_PATH = "/images/generations";

        public static final String MODELS_PATH = "/models";

        public static final String DEFAULT_MODEL = "dall-e-3";

        public static final String RESPONSE_FORMAT_B64 = "b64_json";

        public static final String B64_MIME_TYPE = "image/png";

        /**
         * Префиксы идентификаторов моделей, генерирующих изображения.
         */
        public static final List<String> IMAGE_MODEL_PREFIXES = List.of("dall-e", "gpt-image");
    }

    /**
     * Сообщения об ошибках, которые уходят вызывающей стороне в исключениях.
     */
    public static final class ErrorMessages {
        private ErrorMessages() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String PROMPT_REQUIRED = "Prompt is required for image generation";
        public static final String MODEL_REQUIRED = "Model ID not found in payload";
        public static final String COMPLETION_NOT_SUPPORTED = "%s doesn't support text completion endpoint: %s";
        public static final String EMBEDDINGS_NOT_SUPPORTED = "%s doesn't support embeddings endpoint: %s";
        public static final String NO_JOB_ID = "No %s returned from %s API";
        public static final String NO_IMAGE_DATA = "No image data returned from %s API";
        public static final String COMPLETED_WITHOUT_OUTPUT = "Generation completed but no output found";
        public static final String GENERATION_FAILED = "Generation failed: %s";
        public static final String UNKNOWN_FAILURE = "Unknown error";
        public static final String POLLING_TIMEOUT = "Image generation timed out. Maximum polling attempts reached.";
        public static final String STATUS_ERROR = "Error checking generation status: %s";
        public static final String POLLING_ERROR = "Error polling for results: %s";
        public static final String TASK_STATUS_ERROR = "Error checking task status: %s";
        public static final String EMPTY_RESPONSE = "Empty response from provider";
        public static final String MALFORMED_RESPONSE = "Malformed response from provider: %s";
        public static final String CONNECTION_ERROR = "Network error while calling provider: %s";
        public static final String REQUEST_TIMEOUT = "Provider did not respond in time";
        public static final String UNKNOWN_ERROR = "Unexpected error while calling provider: %s";
    }
}
