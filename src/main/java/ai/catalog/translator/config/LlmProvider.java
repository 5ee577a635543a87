package ai.catalog.translator.config;

import java.util.Locale;

/**
 * Supported large language model vendors.
 */
public enum LlmProvider {
    OPENAI,
    ANTHROPIC,
    GEMINI,
    OLLAMA,
    MOCK;

    public static LlmProvider from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("LLM provider must be provided");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "openai" -> OPENAI;
            case "anthropic", "claude" -> ANTHROPIC;
            case "gemini", "google" -> GEMINI;
            case "ollama" -> OLLAMA;
            case "mock" -> MOCK;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
