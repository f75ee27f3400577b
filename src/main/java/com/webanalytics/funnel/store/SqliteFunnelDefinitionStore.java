package com.webanalytics.funnel.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webanalytics.funnel.model.AttributeFilter;
import com.webanalytics.funnel.model.FunnelDefinition;
import com.webanalytics.funnel.model.FunnelStep;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Funnel definitions stored as rows with JSON-encoded steps and filters.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SqliteFunnelDefinitionStore implements FunnelDefinitionStore {

    private static final TypeReference<List<FunnelStep>> STEPS_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<AttributeFilter>> FILTERS_TYPE = new TypeReference<>() {};

    private static final String SELECT_COLUMNS =
            "SELECT id, website_id, name, description, steps, filters, is_active, ignore_historic_data, "
                    + "created_at, updated_at, deleted_at "
                    + "FROM funnel_definitions ";

    private final SqliteConnectionFactory connectionFactory;
    private final ObjectMapper objectMapper;

    @PostConstruct
    public void initialize() throws SQLException {
        String createTableSql = """
            CREATE TABLE IF NOT EXISTS funnel_definitions (
                id TEXT PRIMARY KEY,
                website_id TEXT NOT NULL,
                name TEXT NOT NULL,
                description TEXT,
                steps TEXT NOT NULL,
                filters TEXT,
                is_active INTEGER NOT NULL DEFAULT 1,
                ignore_historic_data INTEGER NOT NULL DEFAULT 0,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL,
                deleted_at INTEGER
            )
            """;
        try (Connection connection = connectionFactory.open();
             Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSql);
            addColumnIfMissing(connection, "ignore_historic_data", "INTEGER NOT NULL DEFAULT 0");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_funnels_website ON funnel_definitions (website_id)");
            log.info("Table 'funnel_definitions' created or already exists");
        }
    }

    @Override
    public Optional<FunnelDefinition> findActive(String websiteId, String funnelId) {
        String sql = SELECT_COLUMNS + "WHERE id = ? AND website_id = ? AND deleted_at IS NULL";
        try (Connection connection = connectionFactory.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, funnelId);
            statement.setString(2, websiteId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new StorageException("Failed to load funnel " + funnelId, e);
        }
    }

    @Override
    public List<FunnelDefinition> listActive(String websiteId) {
        String sql = SELECT_COLUMNS + "WHERE website_id = ? AND deleted_at IS NULL ORDER BY created_at DESC";
        try (Connection connection = connectionFactory.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, websiteId);
            List<FunnelDefinition> result = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    result.add(map(rs));
                }
            }
            return result;
        } catch (SQLException | JsonProcessingException e) {
            throw new StorageException("Failed to list funnels of website " + websiteId, e);
        }
    }

    @Override
    public FunnelDefinition create(FunnelDefinition definition) {
        Instant now = Instant.now();
        FunnelDefinition stored = FunnelDefinition.builder()
                .id(UUID.randomUUID().toString())
                .websiteId(definition.getWebsiteId())
                .name(definition.getName())
                .description(definition.getDescription())
                .steps(definition.getSteps())
                .filters(definition.getFilters() == null ? new ArrayList<>() : definition.getFilters())
                .active(true)
                .ignoreHistoricData(definition.isIgnoreHistoricData())
                .createdAt(now)
                .updatedAt(now)
                .build();

        String sql = """
            INSERT INTO funnel_definitions
            (id, website_id, name, description, steps, filters, is_active, ignore_historic_data, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, 1, ?, ?, ?)
            """;
        try (Connection connection = connectionFactory.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, stored.getId());
            statement.setString(2, stored.getWebsiteId());
            statement.setString(3, stored.getName());
            statement.setString(4, stored.getDescription());
            statement.setString(5, objectMapper.writeValueAsString(stored.getSteps()));
            statement.setString(6, objectMapper.writeValueAsString(stored.getFilters()));
            statement.setInt(7, stored.isIgnoreHistoricData() ? 1 : 0);
            statement.setLong(8, now.toEpochMilli());
            statement.setLong(9, now.toEpochMilli());
            statement.executeUpdate();

            log.info("Funnel {} created for website {} ({} steps)",
                    stored.getId(), stored.getWebsiteId(), stored.getSteps().size());
            return stored;
        } catch (SQLException | JsonProcessingException e) {
            throw new StorageException("Failed to create funnel", e);
        }
    }

    @Override
    public boolean softDelete(String websiteId, String funnelId) {
        String sql = "UPDATE funnel_definitions SET deleted_at = ?, is_active = 0, updated_at = ? "
                + "WHERE id = ? AND website_id = ? AND deleted_at IS NULL";
        long now = Instant.now().toEpochMilli();
        try (Connection connection = connectionFactory.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, now);
            statement.setLong(2, now);
            statement.setString(3, funnelId);
            statement.setString(4, websiteId);
            boolean deleted = statement.executeUpdate() > 0;
            if (deleted) {
                log.info("Funnel {} of website {} soft-deleted", funnelId, websiteId);
            }
            return deleted;
        } catch (SQLException e) {
            throw new StorageException("Failed to delete funnel " + funnelId, e);
        }
    }

    // Tables created before a column existed get it added in place.
    private static void addColumnIfMissing(Connection connection, String column, String definition) throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA table_info(funnel_definitions)")) {
            while (rs.next()) {
                if (column.equals(rs.getString("name"))) {
                    return;
                }
            }
        }
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("ALTER TABLE funnel_definitions ADD COLUMN " + column + " " + definition);
            log.info("Added column '{}' to table 'funnel_definitions'", column);
        }
    }

    private FunnelDefinition map(ResultSet rs) throws SQLException, JsonProcessingException {
        String filtersJson = rs.getString("filters");
        long deletedAt = rs.getLong("deleted_at");
        boolean deleted = !rs.wasNull();
        return FunnelDefinition.builder()
                .id(rs.getString("id"))
                .websiteId(rs.getString("website_id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .steps(objectMapper.readValue(rs.getString("steps"), STEPS_TYPE))
                .filters(filtersJson == null ? new ArrayList<>() : objectMapper.readValue(filtersJson, FILTERS_TYPE))
                .active(rs.getInt("is_active") == 1)
                .ignoreHistoricData(rs.getInt("ignore_historic_data") == 1)
                .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
                .updatedAt(Instant.ofEpochMilli(rs.getLong("updated_at")))
                .deletedAt(deleted ? Instant.ofEpochMilli(deletedAt) : null)
                .build();
    }
}
