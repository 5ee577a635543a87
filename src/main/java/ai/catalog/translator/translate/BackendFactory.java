package ai.catalog.translator.translate;

import ai.catalog.translator.config.LlmProvider;
import ai.catalog.translator.config.Secrets;
import ai.catalog.translator.model.ProviderConfig;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiStreamingChatModel;
import dev.langchain4j.model.ollama.OllamaStreamingChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provides backend clients for provider configurations based on the translation mode.
 * Clients are cached per provider configuration.
 */
public class BackendFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackendFactory.class);
    private static final Duration HTTP_TIMEOUT = Duration.ofMinutes(2);

    private final TranslationMode mode;
    private final Secrets secrets;
    private final String ollamaBaseUrl;
    private final BackendClient dryRunClient = new EchoBackendClient();
    private final BackendClient mockClient = new MockBackendClient();
    private final Map<ProviderConfig, BackendClient> clients = new ConcurrentHashMap<>();

    public BackendFactory(TranslationMode mode, Secrets secrets, String ollamaBaseUrl) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.secrets = Objects.requireNonNull(secrets, "secrets");
        this.ollamaBaseUrl = Objects.requireNonNull(ollamaBaseUrl, "ollamaBaseUrl");
    }

    /**
     * @throws UnconfiguredProviderException when the vendor is unknown or lacks credentials
     */
    public BackendClient select(ProviderConfig provider) {
        Objects.requireNonNull(provider, "provider");
        LlmProvider vendor = resolveVendor(provider);
        if (vendor == LlmProvider.MOCK) {
            return mockClient;
        }
        return switch (mode) {
            case DRY_RUN -> dryRunClient;
            case MOCK -> mockClient;
            case PRODUCTION -> clients.computeIfAbsent(provider, key -> createClient(vendor, key));
        };
    }

    private LlmProvider resolveVendor(ProviderConfig provider) {
        try {
            return LlmProvider.from(provider.vendor());
        } catch (IllegalArgumentException ex) {
            throw new UnconfiguredProviderException("Unknown provider '%s' for model '%s'".formatted(provider.vendor(), provider.model()));
        }
    }

    private BackendClient createClient(LlmProvider vendor, ProviderConfig provider) {
        StreamingChatModel model = switch (vendor) {
            case OPENAI -> createOpenAiModel(provider);
            case ANTHROPIC -> createAnthropicModel(provider);
            case GEMINI -> createGeminiModel(provider);
            case OLLAMA -> createOllamaModel(provider);
            case MOCK -> throw new IllegalStateException("mock vendor has no chat model");
        };
        return new LangChainBackendClient(model, vendor.id(), provider.model());
    }

    private StreamingChatModel createOpenAiModel(ProviderConfig provider) {
        String apiKey = requireApiKey(LlmProvider.OPENAI);
        LOGGER.info("Using OpenAI model '{}'", provider.model());
        return OpenAiStreamingChatModel.builder()
                .apiKey(apiKey)
                .modelName(provider.model())
                .temperature(provider.temperature())
                .maxTokens(provider.maxTokens())
                .timeout(HTTP_TIMEOUT)
                .build();
    }

    private StreamingChatModel createAnthropicModel(ProviderConfig provider) {
        String apiKey = requireApiKey(LlmProvider.ANTHROPIC);
        LOGGER.info("Using Anthropic model '{}'", provider.model());
        return AnthropicStreamingChatModel.builder()
                .apiKey(apiKey)
                .modelName(provider.model())
                .temperature(provider.temperature())
                .maxTokens(provider.maxTokens())
                .timeout(HTTP_TIMEOUT)
                .build();
    }

    private StreamingChatModel createGeminiModel(ProviderConfig provider) {
        String apiKey = requireApiKey(LlmProvider.GEMINI);
        LOGGER.info("Using Gemini model '{}'", provider.model());
        return GoogleAiGeminiStreamingChatModel.builder()
                .apiKey(apiKey)
                .modelName(provider.model())
                .temperature(provider.temperature())
                .maxOutputTokens(provider.maxTokens())
                .timeout(HTTP_TIMEOUT)
                .build();
    }

    private StreamingChatModel createOllamaModel(ProviderConfig provider) {
        LOGGER.info("Using Ollama model '{}' via {}", provider.model(), ollamaBaseUrl);
        return OllamaStreamingChatModel.builder()
                .baseUrl(ollamaBaseUrl)
                .modelName(provider.model())
                .temperature(provider.temperature())
                .numPredict(provider.maxTokens())
                .timeout(HTTP_TIMEOUT)
                .build();
    }

    private String requireApiKey(LlmProvider vendor) {
        return secrets.apiKeyFor(vendor)
                .orElseThrow(() -> new UnconfiguredProviderException(
                        "%s_API_KEY must be provided to use %s".formatted(vendor.name(), vendor.id())));
    }
}
