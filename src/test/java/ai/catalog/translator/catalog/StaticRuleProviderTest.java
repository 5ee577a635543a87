package ai.catalog.translator.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StaticRuleProviderTest {

    private final StaticRuleProvider provider = new StaticRuleProvider(Map.of(
            "*", List.of("Keep product names"),
            "pt", List.of("Use você"),
            "pt_BR", List.of("Prefer Brazilian spelling")));

    @Test
    void regionalLocalesInheritLanguageRules() {
        assertThat(provider.rulesFor("pt-BR")).containsExactly("Keep product names", "Use você", "Prefer Brazilian spelling");
        assertThat(provider.rulesFor("pt")).containsExactly("Keep product names", "Use você");
    }

    @Test
    void unknownLocalesGetOnlyTheSharedRules() {
        assertThat(provider.rulesFor("ko")).containsExactly("Keep product names");
        assertThat(StaticRuleProvider.empty().rulesFor("ko")).isEmpty();
    }
}
