package ai.catalog.translator.translate;

/**
 * Mode controlling which backends serve translation calls.
 */
public enum TranslationMode {
    PRODUCTION,
    DRY_RUN,
    MOCK;

    public static TranslationMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRODUCTION;
        }
        String normalized = raw.trim().replace('-', '_');
        for (TranslationMode mode : values()) {
            if (mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported translation mode: " + raw);
    }

    /**
     * Offline modes never contact a vendor and need no API keys.
     */
    public boolean offline() {
        return this != PRODUCTION;
    }
}
