package ai.catalog.translator.prompt;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Raw system and user templates with {@code {placeholder}} markers.
 */
public record PromptTemplates(String system, String user) {

    public static final String SYSTEM_RESOURCE = "prompts/system-prompt.txt";
    public static final String USER_RESOURCE = "prompts/user-prompt.txt";

    public PromptTemplates {
        Objects.requireNonNull(system, "system");
        Objects.requireNonNull(user, "user");
    }

    /**
     * Loads the templates bundled on the classpath.
     *
     * @throws IllegalStateException when a template resource is missing
     */
    public static PromptTemplates loadDefault() {
        return new PromptTemplates(read(SYSTEM_RESOURCE), read(USER_RESOURCE));
    }

    static String read(String resource) {
        ClassLoader loader = PromptTemplates.class.getClassLoader();
        try (InputStream input = loader.getResourceAsStream(resource)) {
            if (input == null) {
                throw new IllegalStateException("Prompt template not found on classpath: " + resource);
            }
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read prompt template " + resource, ex);
        }
    }
}
