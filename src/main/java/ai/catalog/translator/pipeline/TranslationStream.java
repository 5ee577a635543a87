package ai.catalog.translator.pipeline;

import ai.catalog.translator.model.TranslationOutput;
import ai.catalog.translator.model.TranslationResult;
import ai.catalog.translator.translate.TranslationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Single-pass sequence of outputs produced by a running pipeline. Elements arrive in the order
 * the pipeline yields them; {@link #hasNext()} blocks until the next one is available or the run
 * has ended. A failed run rethrows its failure from {@link #hasNext()} once earlier outputs have
 * been consumed.
 */
public final class TranslationStream implements Iterator<TranslationOutput>, AutoCloseable {

    private static final Object END = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final CompletableFuture<TranslationResult> result = new CompletableFuture<>();
    private volatile Thread worker;
    private TranslationOutput next;
    private boolean finished;

    void attach(Thread workerThread) {
        this.worker = workerThread;
    }

    void publish(TranslationOutput output) {
        queue.add(output);
    }

    void complete(TranslationResult finalResult) {
        result.complete(finalResult);
        queue.add(END);
    }

    void fail(Throwable failure) {
        result.completeExceptionally(failure);
        queue.add(new Failure(failure));
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        Object element;
        try {
            element = queue.take();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Interrupted while waiting for translation output", ex);
        }
        if (element == END) {
            finished = true;
            return false;
        }
        if (element instanceof Failure failure) {
            finished = true;
            throw propagate(failure.cause());
        }
        next = (TranslationOutput) element;
        return true;
    }

    @Override
    public TranslationOutput next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        TranslationOutput current = next;
        next = null;
        return current;
    }

    public Stream<TranslationOutput> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    /**
     * Waits for the run to end and returns its final state.
     */
    public TranslationResult result() {
        try {
            return result.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Interrupted while waiting for translation result", ex);
        } catch (ExecutionException ex) {
            throw propagate(ex.getCause());
        }
    }

    /**
     * Interrupts the run if it is still in progress.
     */
    @Override
    public void close() {
        Thread current = worker;
        if (current != null && current.isAlive() && !result.isDone()) {
            current.interrupt();
        }
    }

    private static RuntimeException propagate(Throwable cause) {
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new TranslationException("Translation pipeline failed", cause);
    }

    private record Failure(Throwable cause) {
    }
}
