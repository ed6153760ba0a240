package io.agentic.core.provider;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bounded hand-off between a producer thread reading from a provider and one consumer.
 *
 * <p>The consumer side synthesizes an error event when the producer finishes without emitting a
 * terminal event, or when nothing arrives within the idle timeout.
 */
public final class QueueLlmStream implements LlmStream {
    private static final long POLL_SLICE_MS = 50;

    private final BlockingQueue<StreamEvent> queue;
    private final Duration idleTimeout;
    private final AtomicBoolean producerFinished = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicReference<Runnable> onClose = new AtomicReference<>(() -> {
    });
    private StreamEvent terminal;

    public QueueLlmStream(int capacity, Duration idleTimeout) {
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout must not be null");
    }

    /**
     * Stream whose events are all available up front, already finished by its producer.
     */
    public static QueueLlmStream completed(List<StreamEvent> events, Duration idleTimeout) {
        QueueLlmStream stream = new QueueLlmStream(events.size(), idleTimeout);
        for (StreamEvent event : events) {
            stream.queue.add(event);
        }
        stream.finish();
        return stream;
    }

    public void onClose(Runnable action) {
        onClose.set(Objects.requireNonNull(action, "action must not be null"));
    }

    /**
     * Producer side. Blocks while the queue is full; returns {@code false} once the consumer closed
     * the stream, in which case the producer should stop.
     */
    public boolean emit(StreamEvent event) throws InterruptedException {
        Objects.requireNonNull(event, "event must not be null");
        while (!closed.get()) {
            if (queue.offer(event, POLL_SLICE_MS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Producer side: no more events will be emitted.
     */
    public void finish() {
        producerFinished.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public StreamEvent next() throws InterruptedException {
        if (terminal != null) {
            return terminal;
        }
        long deadline = System.nanoTime() + idleTimeout.toNanos();
        while (true) {
            boolean finishedBeforePoll = producerFinished.get();
            StreamEvent event = queue.poll(POLL_SLICE_MS, TimeUnit.MILLISECONDS);
            if (event != null) {
                if (event.isTerminal()) {
                    terminal = event;
                }
                return event;
            }
            if (finishedBeforePoll) {
                return fail("stream ended without a terminal event");
            }
            if (closed.get()) {
                return fail("stream was closed");
            }
            if (System.nanoTime() - deadline >= 0) {
                close();
                return fail("no stream event within " + idleTimeout.toMillis() + " ms");
            }
        }
    }

    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        queue.clear();
        onClose.get().run();
    }

    private StreamEvent fail(String reason) {
        terminal = StreamEvent.error(new LlmBackendException(reason));
        return terminal;
    }
}
