package ai.catalog.translator.consensus;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formats the comparison prompt sent to the judge and reads its numeric answer.
 */
public final class JudgePrompt {

    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private JudgePrompt() {
    }

    public static String format(String sourceText, String targetLocale, List<Candidate> candidates) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Evaluate the following translations and select the best one.\n\n");
        prompt.append("Original text: ").append(sourceText).append('\n');
        prompt.append("Target language: ").append(targetLocale).append("\n\n");
        prompt.append("Candidates:\n");
        for (int index = 0; index < candidates.size(); index++) {
            Candidate candidate = candidates.get(index);
            prompt.append(index + 1).append(". [").append(candidate.provider()).append("]: ")
                    .append(candidate.text()).append('\n');
        }
        prompt.append("\nSelect the number of the best translation based on accuracy, fluency, and naturalness.\n");
        prompt.append("Respond with only the number.");
        return prompt.toString();
    }

    /**
     * Returns the zero-based index named by the first integer in the reply.
     *
     * @throws JudgeParseException when the reply has no integer or it is out of range
     */
    public static int parseSelection(String reply, int candidateCount) {
        if (reply == null) {
            throw new JudgeParseException("Judge returned no reply");
        }
        Matcher matcher = NUMBER.matcher(reply);
        if (!matcher.find()) {
            throw new JudgeParseException("Judge reply contains no selection: " + abbreviate(reply));
        }
        int selection;
        try {
            selection = Integer.parseInt(matcher.group());
        } catch (NumberFormatException ex) {
            throw new JudgeParseException("Judge selection is not a number: " + matcher.group());
        }
        if (selection < 1 || selection > candidateCount) {
            throw new JudgeParseException("Judge selected %d but only %d candidate(s) exist".formatted(selection, candidateCount));
        }
        return selection - 1;
    }

    private static String abbreviate(String reply) {
        String trimmed = reply.strip();
        return trimmed.length() <= 80 ? trimmed : trimmed.substring(0, 77) + "...";
    }
}
