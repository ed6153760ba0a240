package io.agentic.core.api;

import org.slf4j.MDC;

/**
 * Correlation id of the request being handled on the current thread, exposed to log patterns as
 * {@code %X{request_id}}.
 */
public final class RequestContext {
    public static final String MDC_KEY = "request_id";

    private RequestContext() {
    }

    public static void setRequestId(String requestId) {
        if (requestId != null) {
            MDC.put(MDC_KEY, requestId);
        }
    }

    public static void clear() {
        MDC.remove(MDC_KEY);
    }
}
