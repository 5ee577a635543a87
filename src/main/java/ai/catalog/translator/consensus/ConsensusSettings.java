package ai.catalog.translator.consensus;

import ai.catalog.translator.model.ProviderConfig;
import java.util.List;
import java.util.Objects;

/**
 * Providers, judge and dispatch rules of the consensus engine.
 *
 * @param consensusThreshold minimum number of configured providers for which agreement is
 *                           sought; below it sequential mode stops at the first success
 * @param fallbackOnFailure  when false a failing provider fails the whole locale
 */
public record ConsensusSettings(List<ProviderConfig> providers,
                                ProviderConfig judge,
                                ExecutionMode executionMode,
                                int consensusThreshold,
                                boolean fallbackOnFailure) {

    public static final ProviderConfig DEFAULT_JUDGE = new ProviderConfig("openai", "gpt-5", 0.3);
    public static final int DEFAULT_CONSENSUS_THRESHOLD = 2;

    public ConsensusSettings {
        Objects.requireNonNull(providers, "providers");
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("providers must not be empty");
        }
        providers = List.copyOf(providers);
        judge = judge == null ? DEFAULT_JUDGE : judge;
        executionMode = executionMode == null ? ExecutionMode.PARALLEL : executionMode;
        if (consensusThreshold < 1) {
            throw new IllegalArgumentException("consensusThreshold must be at least 1");
        }
    }

    public static ConsensusSettings single(ProviderConfig provider) {
        return new ConsensusSettings(List.of(provider), DEFAULT_JUDGE, ExecutionMode.SEQUENTIAL, DEFAULT_CONSENSUS_THRESHOLD, true);
    }

    public boolean needsConsensus() {
        return providers.size() >= consensusThreshold;
    }
}
