package ai.catalog.translator.consensus;

import java.util.Objects;

/**
 * One provider's translation of a key.
 */
public record Candidate(String provider, String text) {

    public Candidate {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(text, "text");
    }
}
