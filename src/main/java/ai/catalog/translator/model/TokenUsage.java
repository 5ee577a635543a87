package ai.catalog.translator.model;

/**
 * Token counts reported by a backend. {@code isFinal} separates the authoritative end-of-call total
 * from in-flight estimates.
 */
public record TokenUsage(long inputTokens,
                         long outputTokens,
                         long cacheCreationInputTokens,
                         long cacheReadInputTokens,
                         boolean isFinal) {

    public static final TokenUsage EMPTY = new TokenUsage(0, 0, 0, 0, false);

    public TokenUsage {
        if (inputTokens < 0 || outputTokens < 0 || cacheCreationInputTokens < 0 || cacheReadInputTokens < 0) {
            throw new IllegalArgumentException("token counts must not be negative");
        }
    }

    public static TokenUsage of(long inputTokens, long outputTokens) {
        return new TokenUsage(inputTokens, outputTokens, 0, 0, false);
    }

    public long totalTokens() {
        return inputTokens + outputTokens;
    }

    public TokenUsage plus(TokenUsage other) {
        return new TokenUsage(inputTokens + other.inputTokens,
                outputTokens + other.outputTokens,
                cacheCreationInputTokens + other.cacheCreationInputTokens,
                cacheReadInputTokens + other.cacheReadInputTokens,
                isFinal);
    }

    public TokenUsage asFinal() {
        return new TokenUsage(inputTokens, outputTokens, cacheCreationInputTokens, cacheReadInputTokens, true);
    }
}
