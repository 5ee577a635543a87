package ai.catalog.translator.catalog;

import java.util.List;

/**
 * Free-text translation rules (glossary entries, style notes) for a target locale, in the order
 * they should appear in the prompt.
 */
@FunctionalInterface
public interface RuleProvider {

    List<String> rulesFor(String locale);
}
