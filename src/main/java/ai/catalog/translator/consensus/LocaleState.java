package ai.catalog.translator.consensus;

/**
 * Progress of one locale through the consensus engine.
 */
public enum LocaleState {
    PENDING,
    RUNNING,
    CONSENSUS,
    DIRECT,
    RESOLVED,
    FAILED;

    public boolean isTerminal() {
        return this == RESOLVED || this == FAILED;
    }
}
