package ai.catalog.translator.consensus;

import java.util.List;

/**
 * Picks a candidate when the judge cannot: its reply had no valid selection or the call failed.
 */
@FunctionalInterface
public interface FallbackSelector {

    /**
     * @param candidates at least two distinct candidates, in provider order
     */
    Candidate select(String key, List<Candidate> candidates);
}
