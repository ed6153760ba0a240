package io.agentic.core.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.agentic.core.model.ChatMessage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public final class SqliteConversationStore implements ConversationStore {
    private static final TypeReference<List<ChatMessage>> CHAT_MESSAGES = new TypeReference<>() {
    };

    private final String jdbcUrl;
    private final ObjectMapper mapper;
    private final Clock clock;

    public SqliteConversationStore(Path dbPath) throws IOException {
        this(dbPath, Clock.systemUTC());
    }

    public SqliteConversationStore(Path dbPath, Clock clock) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        init();
    }

    @Override
    public synchronized Optional<List<ChatMessage>> get(String conversationId) throws IOException {
        String sql = "SELECT transcript_json FROM conversations WHERE id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, Transcripts.requireId(conversationId));
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                List<ChatMessage> transcript = mapper.readValue(resultSet.getString("transcript_json"), CHAT_MESSAGES);
                return Optional.of(List.copyOf(transcript));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load conversation " + conversationId, e);
        }
    }

    @Override
    public synchronized void put(String conversationId, List<ChatMessage> messages) throws IOException {
        String id = Transcripts.requireId(conversationId);
        Instant now = clock.instant();
        List<ChatMessage> normalized = Transcripts.normalizeForWrite(messages, now);
        String sql = """
            INSERT INTO conversations (id, updated_at, transcript_json)
            VALUES (?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                updated_at = excluded.updated_at,
                transcript_json = excluded.transcript_json
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            connection.setAutoCommit(false);
            statement.setString(1, id);
            statement.setString(2, now.toString());
            statement.setString(3, mapper.writeValueAsString(normalized));
            statement.executeUpdate();
            connection.commit();
        } catch (SQLException e) {
            throw new IOException("Failed to store conversation " + id, e);
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS conversations (
                id TEXT PRIMARY KEY,
                updated_at TEXT NOT NULL,
                transcript_json TEXT NOT NULL
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite conversation store", e);
        }
    }
}
