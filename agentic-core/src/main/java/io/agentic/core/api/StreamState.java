package io.agentic.core.api;

enum StreamState {
    OPEN,
    STREAMING,
    DONE,
    FAILED
}
