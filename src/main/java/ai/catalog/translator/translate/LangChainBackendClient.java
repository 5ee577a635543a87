package ai.catalog.translator.translate;

import ai.catalog.translator.model.TokenUsage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Backend client backed by a LangChain4j {@link StreamingChatModel}.
 *
 * <p>Only partial response text is streamed. The 1.1 handler has no callback for a vendor's
 * separate reasoning channel, so this client never calls the reasoning methods of
 * {@link BackendListener}. Reasoning that a model writes inline as a {@code <thinking>} block is
 * still reported, because it arrives as ordinary text and the response decoder picks it up.
 */
public class LangChainBackendClient implements BackendClient {

    private final StreamingChatModel model;
    private final String providerName;
    private final String modelName;

    public LangChainBackendClient(StreamingChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public BackendResponse send(BackendRequest request, BackendListener listener) {
        Objects.requireNonNull(request, "request");
        BackendListener callbacks = listener == null ? BackendListener.NO_OP : listener;
        List<ChatMessage> messages = new ArrayList<>();
        if (!request.systemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.systemPrompt()));
        }
        messages.add(UserMessage.from(request.userPrompt()));

        CompletableFuture<ChatResponse> completion = new CompletableFuture<>();
        try {
            model.chat(ChatRequest.builder().messages(messages).build(), new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String partialResponse) {
                    callbacks.onText(partialResponse);
                }

                @Override
                public void onCompleteResponse(ChatResponse completeResponse) {
                    completion.complete(completeResponse);
                }

                @Override
                public void onError(Throwable error) {
                    completion.completeExceptionally(error);
                }
            });
            ChatResponse response = completion.get();
            TokenUsage usage = toUsage(response.tokenUsage());
            callbacks.onUsage(usage);
            String text = response.aiMessage() == null ? "" : response.aiMessage().text();
            return new BackendResponse(text, usage);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProviderException(providerName, "%s call interrupted".formatted(providerName), ex);
        } catch (ExecutionException ex) {
            throw translateFailure(ex.getCause() == null ? ex : ex.getCause());
        } catch (RuntimeException ex) {
            throw translateFailure(ex);
        }
    }

    private TranslationException translateFailure(Throwable failure) {
        if (failure instanceof TranslationException translationException) {
            return translationException;
        }
        if (isModelMissing(failure)) {
            return new UnconfiguredProviderException("%s model '%s' is not available.".formatted(providerName, modelName));
        }
        return new ProviderException(providerName, "%s call failed: %s".formatted(providerName, failure.getMessage()), failure);
    }

    private static TokenUsage toUsage(dev.langchain4j.model.output.TokenUsage usage) {
        if (usage == null) {
            return TokenUsage.EMPTY;
        }
        return TokenUsage.of(valueOrZero(usage.inputTokenCount()), valueOrZero(usage.outputTokenCount()));
    }

    private static long valueOrZero(Integer value) {
        return value == null ? 0L : value.longValue();
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
