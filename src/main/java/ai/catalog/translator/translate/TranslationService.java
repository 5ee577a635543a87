package ai.catalog.translator.translate;

import ai.catalog.translator.decode.DecoderListener;
import ai.catalog.translator.decode.StreamingResponseDecoder;
import ai.catalog.translator.model.LocalizedItem;
import ai.catalog.translator.model.TokenUsage;
import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one backend call through the streaming decoder, verifies the decoded items against the
 * requested keys and retries failed attempts with exponential backoff.
 */
public class TranslationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationService.class);
    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile("(?:retry in |retryDelay\"?:\\s*\")([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);

    private final RetryPolicy retryPolicy;
    private final Duration attemptTimeout;
    private final ExecutorService executor;

    /**
     * Creates a service that calls backends on the caller's thread without a timeout.
     */
    public TranslationService(RetryPolicy retryPolicy) {
        this(retryPolicy, null, null);
    }

    /**
     * @param attemptTimeout bound of a single attempt; {@code null} disables it
     * @param executor       runs attempts when a timeout is set
     */
    public TranslationService(RetryPolicy retryPolicy, Duration attemptTimeout, ExecutorService executor) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        if (attemptTimeout != null && (attemptTimeout.isZero() || attemptTimeout.isNegative())) {
            throw new IllegalArgumentException("attemptTimeout must be positive");
        }
        if (attemptTimeout != null && executor == null) {
            throw new IllegalArgumentException("executor is required when attemptTimeout is set");
        }
        this.attemptTimeout = attemptTimeout;
        this.executor = executor;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    /**
     * @param sourceKeys keys requested from the backend, without prefix
     * @param keyPrefix  prefix the prompt added to every key as {@code prefix.key}
     * @throws RetriesExhaustedException when every attempt failed
     * @throws UnconfiguredProviderException immediately, without retrying
     */
    public BatchResult translate(BackendClient client,
                                 BackendRequest request,
                                 Set<String> sourceKeys,
                                 Optional<String> keyPrefix,
                                 TokenUsageAccumulator usage,
                                 TranslationListener listener) {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(sourceKeys, "sourceKeys");
        TranslationListener callbacks = listener == null ? TranslationListener.NO_OP : listener;
        TokenUsageAccumulator unitUsage = usage == null ? new TokenUsageAccumulator() : usage.child();
        Optional<String> prefix = keyPrefix == null ? Optional.empty() : keyPrefix;
        String label = request.provider().label();
        int maxAttempts = retryPolicy.maxAttempts();

        TranslationException lastFailure = null;
        int attemptsMade = 0;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            attemptsMade = attempt;
            try {
                List<LocalizedItem> items = attempt(client, request, prefix, unitUsage, callbacks);
                BatchResult result = verify(label, items, sourceKeys, prefix, attempt);
                unitUsage.reportFinal().ifPresent(total -> callbacks.onTokenUsage(label, total));
                return result;
            } catch (UnconfiguredProviderException ex) {
                throw ex;
            } catch (TranslationException ex) {
                lastFailure = ex;
            } catch (RuntimeException ex) {
                lastFailure = new ProviderException(label, "%s call failed: %s".formatted(label, ex.getMessage()), ex);
            }
            if (attempt == maxAttempts || Thread.currentThread().isInterrupted()) {
                break;
            }
            Duration delay = calculateRetryDelay(lastFailure, attempt);
            LOGGER.warn("[{}/{}] {} failed: {}. Retrying in {} ms...", attempt, maxAttempts, label, lastFailure.getMessage(), delay.toMillis());
            if (!sleep(delay)) {
                break;
            }
        }
        LOGGER.error("{} failed after {} attempt(s)", label, attemptsMade);
        throw new RetriesExhaustedException(label, attemptsMade, lastFailure);
    }

    /**
     * Sends one request without decoding or retrying it, bounded by the attempt timeout when one
     * is set.
     *
     * @throws ProviderException when the call fails or times out
     */
    public BackendResponse send(BackendClient client, BackendRequest request, BackendListener listener) {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(request, "request");
        BackendListener callbacks = listener == null ? BackendListener.NO_OP : listener;
        try {
            return call(client, request, callbacks, new AtomicBoolean());
        } catch (TranslationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            String label = request.provider().label();
            throw new ProviderException(label, "%s call failed: %s".formatted(label, ex.getMessage()), ex);
        }
    }

    private List<LocalizedItem> attempt(BackendClient client,
                                        BackendRequest request,
                                        Optional<String> prefix,
                                        TokenUsageAccumulator unitUsage,
                                        TranslationListener callbacks) {
        String label = request.provider().label();
        AtomicBoolean abandoned = new AtomicBoolean();
        AtomicBoolean usageReported = new AtomicBoolean();
        StreamingResponseDecoder decoder = new StreamingResponseDecoder(new DecoderListener() {
            @Override
            public void onItem(LocalizedItem item) {
                callbacks.onItemTranslated(request.targetLocale(), label, item.withKey(stripPrefix(item.key(), prefix)));
            }

            @Override
            public void onReasoningStart() {
                callbacks.onReasoningStart(label);
            }

            @Override
            public void onReasoningDelta(String text) {
                callbacks.onReasoningDelta(label, text);
            }

            @Override
            public void onReasoningEnd() {
                callbacks.onReasoningEnd(label);
            }
        });
        BackendListener backendListener = new BackendListener() {
            @Override
            public void onText(String delta) {
                if (abandoned.get()) {
                    return;
                }
                callbacks.onRawChunk(label, delta);
                decoder.feed(delta);
            }

            @Override
            public void onReasoningStart() {
                if (!abandoned.get()) {
                    callbacks.onReasoningStart(label);
                }
            }

            @Override
            public void onReasoningDelta(String delta) {
                if (!abandoned.get()) {
                    callbacks.onReasoningDelta(label, delta);
                }
            }

            @Override
            public void onReasoningEnd() {
                if (!abandoned.get()) {
                    callbacks.onReasoningEnd(label);
                }
            }

            @Override
            public void onUsage(TokenUsage delta) {
                usageReported.set(true);
                unitUsage.add(delta);
                if (!abandoned.get()) {
                    callbacks.onTokenUsage(label, unitUsage.snapshot());
                }
            }
        };

        BackendResponse response = call(client, request, backendListener, abandoned);
        if (!usageReported.get()) {
            unitUsage.add(response.usage());
            callbacks.onTokenUsage(label, unitUsage.snapshot());
        }
        return decoder.finish(response.text());
    }

    private BackendResponse call(BackendClient client, BackendRequest request, BackendListener listener, AtomicBoolean abandoned) {
        if (attemptTimeout == null) {
            return client.send(request, listener);
        }
        String label = request.provider().label();
        Future<BackendResponse> future = executor.submit(() -> client.send(request, listener));
        try {
            return future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            abandoned.set(true);
            future.cancel(true);
            throw new ProviderException(label, "%s timed out after %d ms".formatted(label, attemptTimeout.toMillis()), ex);
        } catch (InterruptedException ex) {
            abandoned.set(true);
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException(label, "%s call interrupted".formatted(label), ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof TranslationException translationException) {
                throw translationException;
            }
            throw new ProviderException(label, "%s call failed: %s".formatted(label, cause.getMessage()), cause);
        }
    }

    private BatchResult verify(String label, List<LocalizedItem> decoded, Set<String> sourceKeys, Optional<String> prefix, int attempt) {
        List<LocalizedItem> usable = decoded.stream()
                .filter(LocalizedItem::isUsable)
                .collect(Collectors.toList());
        if (usable.isEmpty()) {
            throw new VerificationFailedException("No usable translation items in response from " + label);
        }

        List<String> warnings = new ArrayList<>();
        List<LocalizedItem> accepted = new ArrayList<>();
        for (LocalizedItem item : usable) {
            String key = stripPrefix(item.key(), prefix);
            if (sourceKeys.contains(key)) {
                accepted.add(item.withKey(key));
            } else {
                warnings.add("Unexpected key '%s' in response from %s".formatted(key, label));
            }
        }
        Set<String> returned = accepted.stream().map(LocalizedItem::key).collect(Collectors.toSet());
        Set<String> missing = new LinkedHashSet<>();
        for (String key : sourceKeys) {
            if (!returned.contains(key)) {
                missing.add(key);
                warnings.add("Missing key '%s' in response from %s".formatted(key, label));
            }
        }
        if (!missing.isEmpty()) {
            LOGGER.warn("{} returned {} of {} keys; missing: {}", label, accepted.size(), sourceKeys.size(), missing);
        }
        return new BatchResult(label, accepted, missing, warnings, attempt);
    }

    private static String stripPrefix(String key, Optional<String> prefix) {
        if (prefix.isEmpty()) {
            return key;
        }
        String marker = prefix.get() + ".";
        return key.startsWith(marker) ? key.substring(marker.length()) : key;
    }

    private boolean sleep(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Translation retry interrupted");
            return false;
        }
    }

    private Duration calculateRetryDelay(Throwable throwable, int failedAttempt) {
        if (isRateLimitError(throwable)) {
            Optional<Duration> providerDelay = extractProviderRetryAfter(throwable);
            if (providerDelay.isPresent()) {
                return providerDelay.get();
            }
        }
        return retryPolicy.backoffAfter(failedAttempt);
    }

    private boolean isRateLimitError(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && (message.contains("RESOURCE_EXHAUSTED") || message.contains("429"))) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private Optional<Duration> extractProviderRetryAfter(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            String message = cause.getMessage();
            if (message != null) {
                Matcher matcher = RETRY_DELAY_PATTERN.matcher(message);
                if (matcher.find()) {
                    double seconds = Double.parseDouble(matcher.group(1));
                    return Optional.of(Duration.ofMillis(Math.max(0, (long) (seconds * 1000))));
                }
            }
            cause = cause.getCause();
        }
        return Optional.empty();
    }
}
