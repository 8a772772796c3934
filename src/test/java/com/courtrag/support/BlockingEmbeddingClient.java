package com.courtrag.support;

import com.courtrag.service.embedding.EmbeddingClient;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Delegates to another client, but holds the embedding of any text containing
 * the marker passed to {@link #holdOn(String)} until {@link #release()}.
 */
public class BlockingEmbeddingClient implements EmbeddingClient {

    private static final long WAIT_SECONDS = 10;

    private final EmbeddingClient delegate;

    private volatile String marker;
    private volatile CountDownLatch held = new CountDownLatch(1);
    private volatile CountDownLatch released = new CountDownLatch(1);

    public BlockingEmbeddingClient(EmbeddingClient delegate) {
        this.delegate = delegate;
    }

    public void holdOn(String marker) {
        this.held = new CountDownLatch(1);
        this.released = new CountDownLatch(1);
        this.marker = marker;
    }

    /**
     * @return true once a text with the marker is being held
     */
    public boolean awaitHeld() throws InterruptedException {
        return held.await(WAIT_SECONDS, TimeUnit.SECONDS);
    }

    public void release() {
        marker = null;
        released.countDown();
    }

    @Override
    public float[] embed(String text) {
        String current = marker;
        if (current != null && text.contains(current)) {
            held.countDown();
            try {
                if (!released.await(WAIT_SECONDS, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("embedding of '" + current + "' was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while held", e);
            }
        }
        return delegate.embed(text);
    }
}
