package io.agentic.core.api;

import io.agentic.core.provider.CancellationToken;
import io.undertow.server.AbstractServerConnection;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.ServerConnection;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xnio.IoUtils;
import org.xnio.conduits.StreamSourceConduit;

/**
 * Cancels a turn when its client goes away while the handler is busy with the backend.
 *
 * <p>An HTTP/1.1 connection is not read while a request is being handled, so a client close would
 * only show up at the next write. The watch polls the connection's raw source for end-of-stream
 * instead; it must only be started once the request body has been consumed and must be closed
 * before the response is completed.
 */
final class ClientDisconnectWatch implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ClientDisconnectWatch.class);

    private final HttpServerExchange exchange;
    private final CancellationToken cancellation = new CancellationToken();
    private final ByteBuffer readBuffer = ByteBuffer.allocate(1);
    private volatile ScheduledFuture<?> polling;
    private boolean watching = true;

    private ClientDisconnectWatch(HttpServerExchange exchange) {
        this.exchange = exchange;
    }

    static ClientDisconnectWatch start(HttpServerExchange exchange, ScheduledExecutorService scheduler, Duration interval) {
        ClientDisconnectWatch watch = new ClientDisconnectWatch(exchange);
        ServerConnection connection = exchange.getConnection();
        connection.addCloseListener(closed -> watch.disconnected("connection closed"));
        if (connection instanceof AbstractServerConnection serverConnection) {
            StreamSourceConduit source = serverConnection.getOriginalSourceConduit();
            long millis = Math.max(1, interval.toMillis());
            watch.polling = scheduler.scheduleWithFixedDelay(() -> watch.poll(source), millis, millis, TimeUnit.MILLISECONDS);
        }
        return watch;
    }

    CancellationToken cancellation() {
        return cancellation;
    }

    @Override
    public synchronized void close() {
        watching = false;
        if (polling != null) {
            polling.cancel(false);
        }
    }

    private synchronized void poll(StreamSourceConduit source) {
        if (!watching) {
            return;
        }
        readBuffer.clear();
        try {
            int read = source.read(readBuffer);
            if (read < 0) {
                disconnected("end of stream");
            } else if (read > 0) {
                // A pipelined request was consumed; stop looking and close after this response.
                exchange.setPersistent(false);
                stopPolling();
            }
        } catch (IOException e) {
            disconnected(e.getMessage());
        }
    }

    private void disconnected(String reason) {
        synchronized (this) {
            if (!watching) {
                return;
            }
            stopPolling();
        }
        LOG.info("Client disconnected from {} ({})", exchange.getRequestPath(), reason);
        cancellation.cancel();
        IoUtils.safeClose(exchange.getConnection());
    }

    private synchronized void stopPolling() {
        watching = false;
        if (polling != null) {
            polling.cancel(false);
        }
    }
}
