package ai.catalog.translator.translate;

import ai.catalog.translator.model.TokenUsage;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/**
 * Running token totals. Updates are plain sums, so concurrent units may add in any order.
 * A child accumulator forwards every delta to its parent, which lets each backend call keep its own
 * totals while the request keeps the grand total.
 */
public final class TokenUsageAccumulator {

    private final LongAdder input = new LongAdder();
    private final LongAdder output = new LongAdder();
    private final LongAdder cacheCreation = new LongAdder();
    private final LongAdder cacheRead = new LongAdder();
    private final AtomicBoolean finalReported = new AtomicBoolean();
    private final TokenUsageAccumulator parent;

    public TokenUsageAccumulator() {
        this(null);
    }

    private TokenUsageAccumulator(TokenUsageAccumulator parent) {
        this.parent = parent;
    }

    public TokenUsageAccumulator child() {
        return new TokenUsageAccumulator(this);
    }

    public void add(TokenUsage delta) {
        if (delta == null) {
            return;
        }
        input.add(delta.inputTokens());
        output.add(delta.outputTokens());
        cacheCreation.add(delta.cacheCreationInputTokens());
        cacheRead.add(delta.cacheReadInputTokens());
        if (parent != null) {
            parent.add(delta);
        }
    }

    /**
     * Current totals flagged as interim.
     */
    public TokenUsage snapshot() {
        return new TokenUsage(input.sum(), output.sum(), cacheCreation.sum(), cacheRead.sum(), false);
    }

    /**
     * Returns the final totals the first time it is called and empty afterwards.
     */
    public Optional<TokenUsage> reportFinal() {
        if (finalReported.compareAndSet(false, true)) {
            return Optional.of(snapshot().asFinal());
        }
        return Optional.empty();
    }

    public boolean isFinalReported() {
        return finalReported.get();
    }
}
