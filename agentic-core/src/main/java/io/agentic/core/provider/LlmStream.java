package io.agentic.core.provider;

/**
 * Single-pass sequence of {@link StreamEvent}s ending with exactly one terminal event.
 * Not restartable: a retry needs a new {@link LlmBackend#chatStream} call.
 */
public interface LlmStream extends AutoCloseable {

    /**
     * Blocks for the next event, but never longer than the stream's idle timeout. Once a terminal
     * event has been returned, every further call returns that same event.
     */
    StreamEvent next() throws InterruptedException;

    /**
     * Stops the producer and cancels the underlying provider call. Idempotent.
     */
    @Override
    void close();
}
