package ai.catalog.translator.prompt;

import java.util.Objects;

/**
 * System and user prompt of one backend call.
 */
public record Prompt(String system, String user) {

    public Prompt {
        Objects.requireNonNull(system, "system");
        Objects.requireNonNull(user, "user");
    }
}
