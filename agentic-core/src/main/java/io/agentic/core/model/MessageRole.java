package io.agentic.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;

public enum MessageRole {
    @JsonProperty("system")
    SYSTEM,
    @JsonProperty("user")
    USER,
    @JsonProperty("assistant")
    ASSISTANT;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
