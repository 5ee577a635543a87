package ai.catalog.translator.consensus;

import java.util.List;

/**
 * Chooses the candidate with the most code points; the earliest provider wins a tie. This is a
 * reproducible tie-break, not a measure of quality.
 */
public class LongestCandidateSelector implements FallbackSelector {

    @Override
    public Candidate select(String key, List<Candidate> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("candidates must not be empty");
        }
        Candidate longest = candidates.get(0);
        int longestLength = codePoints(longest.text());
        for (Candidate candidate : candidates) {
            int length = codePoints(candidate.text());
            if (length > longestLength) {
                longest = candidate;
                longestLength = length;
            }
        }
        return longest;
    }

    private static int codePoints(String text) {
        return text.codePointCount(0, text.length());
    }
}
