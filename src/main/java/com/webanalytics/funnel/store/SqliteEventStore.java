package com.webanalytics.funnel.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webanalytics.funnel.model.StepOccurrence;
import com.webanalytics.funnel.model.VisitorEvent;
import com.webanalytics.funnel.query.SqlFragment;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Event store backed by an append-only SQLite table.
 *
 * Writes go through one long-lived connection and are idempotent on event_id.
 * Each query opens its own connection so independent step queries can run side by side.
 */
@Slf4j
@Component
public class SqliteEventStore implements EventStore {

    public static final String EVENTS_TABLE = "events";

    private final SqliteConnectionFactory connectionFactory;
    private final ObjectMapper objectMapper;
    private final int queryTimeoutSeconds;

    private Connection connection;
    private PreparedStatement insertStatement;
    private final AtomicLong writeCount = new AtomicLong(0);

    public SqliteEventStore(
            SqliteConnectionFactory connectionFactory,
            ObjectMapper objectMapper,
            @Value("${funnel.query.timeout-seconds:30}") int queryTimeoutSeconds
    ) {
        this.connectionFactory = connectionFactory;
        this.objectMapper = objectMapper;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @PostConstruct
    public void initialize() throws SQLException {
        log.info("Initializing event store in {}", connectionFactory.getDatabasePath());

        connection = connectionFactory.open();
        connection.setAutoCommit(true);

        createTable();

        String insertSql = """
            INSERT OR IGNORE INTO events
            (event_id, website_id, session_id, anonymous_id, event_name, path, referrer, event_time,
             country, city, device_type, browser_name, os_name, language, screen_resolution,
             utm_source, utm_medium, utm_campaign, utm_term, utm_content, properties)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        insertStatement = connection.prepareStatement(insertSql);

        log.info("Event store initialized successfully");
    }

    private void createTable() throws SQLException {
        String createTableSql = """
            CREATE TABLE IF NOT EXISTS events (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                event_id TEXT UNIQUE,
                website_id TEXT NOT NULL,
                session_id TEXT NOT NULL,
                anonymous_id TEXT,
                event_name TEXT NOT NULL,
                path TEXT,
                referrer TEXT,
                event_time INTEGER NOT NULL,
                country TEXT,
                city TEXT,
                device_type TEXT,
                browser_name TEXT,
                os_name TEXT,
                language TEXT,
                screen_resolution TEXT,
                utm_source TEXT,
                utm_medium TEXT,
                utm_campaign TEXT,
                utm_term TEXT,
                utm_content TEXT,
                properties TEXT,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """;

        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSql);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_events_site_time ON events (website_id, event_time)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_events_site_session ON events (website_id, session_id, event_time)");
            log.info("Table 'events' created or already exists");
        }
    }

    @Override
    public synchronized boolean append(VisitorEvent event) {
        try {
            int i = 1;
            insertStatement.setString(i++, event.getEventId());
            insertStatement.setString(i++, event.getWebsiteId());
            insertStatement.setString(i++, event.getSessionId());
            insertStatement.setString(i++, event.getAnonymousId());
            insertStatement.setString(i++, event.getEventName());
            insertStatement.setString(i++, event.getPath());
            insertStatement.setString(i++, event.getReferrer());
            insertStatement.setLong(i++, event.getEventTime().toEpochMilli());
            insertStatement.setString(i++, event.getCountry());
            insertStatement.setString(i++, event.getCity());
            insertStatement.setString(i++, event.getDeviceType());
            insertStatement.setString(i++, event.getBrowserName());
            insertStatement.setString(i++, event.getOsName());
            insertStatement.setString(i++, event.getLanguage());
            insertStatement.setString(i++, event.getScreenResolution());
            insertStatement.setString(i++, event.getUtmSource());
            insertStatement.setString(i++, event.getUtmMedium());
            insertStatement.setString(i++, event.getUtmCampaign());
            insertStatement.setString(i++, event.getUtmTerm());
            insertStatement.setString(i++, event.getUtmContent());
            insertStatement.setString(i, propertiesJson(event));

            boolean stored = insertStatement.executeUpdate() > 0;
            if (stored) {
                long count = writeCount.incrementAndGet();
                log.debug("Appended event {} for session {} (total writes: {})",
                        event.getEventName(), event.getSessionId(), count);
            } else {
                log.debug("Ignored duplicate event {}", event.getEventId());
            }
            return stored;
        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to append event {} for session {}", event.getEventId(), event.getSessionId(), e);
            throw new StorageException("Event write failed", e);
        }
    }

    @Override
    public List<StepOccurrence> queryOccurrences(SqlFragment query) {
        try (Connection readConnection = connectionFactory.open();
             PreparedStatement statement = readConnection.prepareStatement(query.sql())) {
            statement.setQueryTimeout(queryTimeoutSeconds);
            bind(statement, query.parameters());

            List<StepOccurrence> rows = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    rows.add(new StepOccurrence(
                            rs.getInt("step_number"),
                            rs.getString("session_id"),
                            Instant.ofEpochMilli(rs.getLong("first_occurrence")),
                            rs.getString("referrer")
                    ));
                }
            }
            log.debug("Occurrence query returned {} rows", rows.size());
            return rows;
        } catch (SQLException e) {
            throw new StorageException("Occurrence query failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long queryCount(SqlFragment query) {
        try (Connection readConnection = connectionFactory.open();
             PreparedStatement statement = readConnection.prepareStatement(query.sql())) {
            statement.setQueryTimeout(queryTimeoutSeconds);
            bind(statement, query.parameters());
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new StorageException("Count query failed: " + e.getMessage(), e);
        }
    }

    static void bind(PreparedStatement statement, List<Object> parameters) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            Object value = parameters.get(i);
            if (value == null) {
                statement.setNull(i + 1, Types.VARCHAR);
            } else if (value instanceof Integer v) {
                statement.setInt(i + 1, v);
            } else if (value instanceof Long v) {
                statement.setLong(i + 1, v);
            } else if (value instanceof Double v) {
                statement.setDouble(i + 1, v);
            } else {
                statement.setString(i + 1, value.toString());
            }
        }
    }

    private String propertiesJson(VisitorEvent event) throws JsonProcessingException {
        if (event.getProperties() == null || event.getProperties().isEmpty()) {
            return null;
        }
        return objectMapper.writeValueAsString(event.getProperties());
    }

    public long getWriteCount() {
        return writeCount.get();
    }

    @PreDestroy
    public void close() {
        try {
            if (insertStatement != null) {
                insertStatement.close();
            }
            if (connection != null) {
                connection.close();
            }
            log.info("Event store closed (total writes: {})", writeCount.get());
        } catch (SQLException e) {
            log.error("Error closing event store", e);
        }
    }
}
