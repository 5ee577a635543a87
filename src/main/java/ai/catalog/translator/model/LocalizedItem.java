package ai.catalog.translator.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One translation unit decoded from a backend reply.
 */
public record LocalizedItem(String key, String text, Optional<String> comment) {

    public LocalizedItem {
        key = Objects.requireNonNull(key, "key");
        text = text == null ? "" : text;
        comment = comment == null ? Optional.empty() : comment.filter(value -> !value.isBlank());
    }

    public LocalizedItem(String key, String text) {
        this(key, text, Optional.empty());
    }

    public boolean isUsable() {
        return !key.isBlank() && !text.isBlank();
    }

    public LocalizedItem withKey(String newKey) {
        return new LocalizedItem(newKey, text, comment);
    }
}
