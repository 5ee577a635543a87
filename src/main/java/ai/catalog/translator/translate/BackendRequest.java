package ai.catalog.translator.translate;

import ai.catalog.translator.model.ProviderConfig;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Payload of one backend call: the provider selection, system and user prompts, and the entries the
 * prompts were built from (keyed exactly as they appear in the prompt).
 */
public record BackendRequest(ProviderConfig provider,
                             String systemPrompt,
                             String userPrompt,
                             String targetLocale,
                             Map<String, String> entries) {

    public BackendRequest {
        provider = Objects.requireNonNull(provider, "provider");
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        userPrompt = Objects.requireNonNull(userPrompt, "userPrompt");
        targetLocale = targetLocale == null ? "" : targetLocale;
        entries = entries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public BackendRequest(ProviderConfig provider, String systemPrompt, String userPrompt) {
        this(provider, systemPrompt, userPrompt, "", Map.of());
    }

    public String model() {
        return provider.model();
    }

    public double temperature() {
        return provider.temperature();
    }

    public int maxTokens() {
        return provider.maxTokens();
    }

    public boolean extendedReasoning() {
        return provider.reasoningBudget().isPresent();
    }

    public BackendRequest withProvider(ProviderConfig newProvider) {
        return new BackendRequest(newProvider, systemPrompt, userPrompt, targetLocale, entries);
    }
}
