package com.webanalytics.funnel.store;

import com.webanalytics.funnel.model.Website;
import com.webanalytics.funnel.referrer.Hosts;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class SqliteWebsiteStore implements WebsiteStore {

    private final SqliteConnectionFactory connectionFactory;

    @PostConstruct
    public void initialize() throws SQLException {
        try (Connection connection = connectionFactory.open();
             Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS websites (id TEXT PRIMARY KEY, domain TEXT NOT NULL)");
        }
    }

    @Override
    public Optional<Website> findById(String websiteId) {
        try (Connection connection = connectionFactory.open();
             PreparedStatement statement = connection.prepareStatement("SELECT id, domain FROM websites WHERE id = ?")) {
            statement.setString(1, websiteId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next()
                        ? Optional.of(new Website(rs.getString("id"), rs.getString("domain")))
                        : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load website " + websiteId, e);
        }
    }

    @Override
    public Website save(Website website) {
        String host = Hosts.hostOf(website.domain());
        if (host == null) {
            throw new IllegalArgumentException("Not a host name or URL: " + website.domain());
        }
        Website normalized = new Website(website.id(), host);
        try (Connection connection = connectionFactory.open();
             PreparedStatement statement = connection.prepareStatement(
                     "INSERT OR REPLACE INTO websites (id, domain) VALUES (?, ?)")) {
            statement.setString(1, normalized.id());
            statement.setString(2, normalized.domain());
            statement.executeUpdate();
            log.info("Website {} registered with domain {}", normalized.id(), normalized.domain());
            return normalized;
        } catch (SQLException e) {
            throw new StorageException("Failed to save website " + website.id(), e);
        }
    }
}
