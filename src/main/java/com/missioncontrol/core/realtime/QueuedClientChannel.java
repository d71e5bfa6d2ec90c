package com.missioncontrol.core.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ClientChannel} that hands every frame and heartbeat to a bounded, ordered outbound
 * queue drained by one writer thread per connection.
 * <p>
 * {@link #send} and {@link #sendHeartbeat} only enqueue. When the queue already holds
 * {@code maxQueuedFrames} entries they throw, and the caller drops the connection. A write
 * that fails on the writer thread closes the channel; {@link #isOpen()} reports false from
 * then on, so the next publish or heartbeat unregisters it.
 */
public class QueuedClientChannel implements ClientChannel {

    private static final Logger log = LoggerFactory.getLogger(QueuedClientChannel.class);

    private static final long WRITER_IDLE_SECONDS = 30;

    private final ClientChannel delegate;
    private final String name;
    private final int maxQueuedFrames;
    private final ThreadPoolExecutor writer;
    private final AtomicBoolean closed = new AtomicBoolean();

    public QueuedClientChannel(ClientChannel delegate, String name, int maxQueuedFrames) {
        if (maxQueuedFrames < 1) {
            throw new IllegalArgumentException("maxQueuedFrames must be at least 1");
        }
        this.delegate = delegate;
        this.name = name;
        this.maxQueuedFrames = maxQueuedFrames;
        this.writer = new ThreadPoolExecutor(1, 1, WRITER_IDLE_SECONDS, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(maxQueuedFrames), r -> {
                    Thread t = new Thread(r, "ws-writer-" + name);
                    t.setDaemon(true);
                    return t;
                }, new ThreadPoolExecutor.AbortPolicy());
        this.writer.allowCoreThreadTimeOut(true);
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && delegate.isOpen();
    }

    @Override
    public void send(String frame) throws IOException {
        enqueue(() -> delegate.send(frame));
    }

    @Override
    public void sendHeartbeat() throws IOException {
        enqueue(delegate::sendHeartbeat);
    }

    /** Number of writes waiting behind the one in flight. */
    public int queuedFrames() {
        return writer.getQueue().size();
    }

    /**
     * Discards pending writes, interrupts the one in flight and closes the underlying
     * transport off the calling thread.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        writer.shutdownNow();
        CompletableFuture.runAsync(delegate::close)
                .exceptionally(e -> {
                    log.debug("Closing {} failed: {}", name, e.getMessage());
                    return null;
                });
    }

    private void enqueue(Write write) throws IOException {
        if (closed.get()) {
            throw new IOException("Channel " + name + " is closed");
        }
        try {
            writer.execute(() -> perform(write));
        } catch (RejectedExecutionException e) {
            throw new IOException("Outbound queue of " + name + " is full (" + maxQueuedFrames + " frames)", e);
        }
    }

    private void perform(Write write) {
        if (closed.get()) {
            return;
        }
        try {
            write.run();
        } catch (IOException | RuntimeException e) {
            log.warn("Write to {} failed, closing: {}", name, e.getMessage());
            close();
        }
    }

    @FunctionalInterface
    private interface Write {
        void run() throws IOException;
    }
}
