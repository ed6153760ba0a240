package io.agentic.core.provider;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signals that the caller of a turn is gone. Actions registered with {@link #onCancel(Runnable)}
 * run once, on the cancelling thread, or immediately when the token is already cancelled.
 */
public final class CancellationToken {
    private static final Logger LOG = LoggerFactory.getLogger(CancellationToken.class);

    private final List<Runnable> actions = new ArrayList<>();
    private volatile boolean cancelled;

    /**
     * A token nobody else holds, so it is never cancelled.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void onCancel(Runnable action) {
        Objects.requireNonNull(action, "action must not be null");
        synchronized (actions) {
            if (!cancelled) {
                actions.add(action);
                return;
            }
        }
        runQuietly(action);
    }

    public void cancel() {
        List<Runnable> pending;
        synchronized (actions) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            pending = new ArrayList<>(actions);
            actions.clear();
        }
        pending.forEach(CancellationToken::runQuietly);
    }

    private static void runQuietly(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.warn("Cancellation action failed", e);
        }
    }
}
