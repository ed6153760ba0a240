package io.agentic.core.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.agentic.core.model.ChatMessage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps every conversation in one JSON document keyed by conversation id.
 */
public final class FileConversationStore implements ConversationStore {
    private static final TypeReference<LinkedHashMap<String, List<ChatMessage>>> CONVERSATIONS =
        new TypeReference<>() {
        };

    private final Path path;
    private final ObjectMapper mapper;
    private final Clock clock;

    public FileConversationStore(Path path) {
        this(path, Clock.systemUTC());
    }

    public FileConversationStore(Path path, Clock clock) {
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        this.path = path.toAbsolutePath();
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized Optional<List<ChatMessage>> get(String conversationId) throws IOException {
        List<ChatMessage> transcript = load().get(Transcripts.requireId(conversationId));
        return transcript == null ? Optional.empty() : Optional.of(List.copyOf(transcript));
    }

    @Override
    public synchronized void put(String conversationId, List<ChatMessage> messages) throws IOException {
        String id = Transcripts.requireId(conversationId);
        List<ChatMessage> normalized = Transcripts.normalizeForWrite(messages, clock.instant());
        Map<String, List<ChatMessage>> all = load();
        all.put(id, normalized);
        save(all);
    }

    private Map<String, List<ChatMessage>> load() throws IOException {
        if (!Files.exists(path)) {
            return new LinkedHashMap<>();
        }
        String json = Files.readString(path);
        if (json.isBlank()) {
            return new LinkedHashMap<>();
        }
        return mapper.readValue(json, CONVERSATIONS);
    }

    private void save(Map<String, List<ChatMessage>> conversations) throws IOException {
        Files.createDirectories(path.getParent());
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(conversations);
        Files.writeString(temp, json + System.lineSeparator());
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
    }
}
