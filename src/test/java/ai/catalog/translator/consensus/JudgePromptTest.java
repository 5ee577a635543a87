package ai.catalog.translator.consensus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class JudgePromptTest {

    private static final List<Candidate> CANDIDATES = List.of(
            new Candidate("openai:gpt-4o", "안녕하세요"),
            new Candidate("anthropic:claude", "안녕"));

    @Test
    void listsNumberedCandidatesWithTheirProviders() {
        String prompt = JudgePrompt.format("Hello", "ko", CANDIDATES);

        assertThat(prompt)
                .contains("Original text: Hello")
                .contains("Target language: ko")
                .contains("1. [openai:gpt-4o]: 안녕하세요")
                .contains("2. [anthropic:claude]: 안녕")
                .endsWith("Respond with only the number.");
    }

    @Test
    void readsTheFirstNumberInTheReply() {
        assertThat(JudgePrompt.parseSelection("2", 2)).isEqualTo(1);
        assertThat(JudgePrompt.parseSelection("The best is 1.", 2)).isZero();
    }

    @Test
    void rejectsRepliesWithoutAValidSelection() {
        assertThatThrownBy(() -> JudgePrompt.parseSelection("none of them", 2)).isInstanceOf(JudgeParseException.class);
        assertThatThrownBy(() -> JudgePrompt.parseSelection("3", 2)).isInstanceOf(JudgeParseException.class);
        assertThatThrownBy(() -> JudgePrompt.parseSelection("0", 2)).isInstanceOf(JudgeParseException.class);
        assertThatThrownBy(() -> JudgePrompt.parseSelection(null, 2)).isInstanceOf(JudgeParseException.class);
    }

    @Test
    void fallbackPrefersTheLongestAndThenTheEarliest() {
        LongestCandidateSelector selector = new LongestCandidateSelector();

        assertThat(selector.select("greeting", CANDIDATES).provider()).isEqualTo("openai:gpt-4o");
        assertThat(selector.select("tie", List.of(new Candidate("a", "xy"), new Candidate("b", "zw"))).provider())
                .isEqualTo("a");
    }

    @Test
    void fallbackCountsCodePointsRatherThanUtf16Units() {
        LongestCandidateSelector selector = new LongestCandidateSelector();

        Candidate chosen = selector.select("emoji", List.of(new Candidate("a", "abc"), new Candidate("b", "😀😀")));

        assertThat(chosen.text()).isEqualTo("abc");
    }
}
