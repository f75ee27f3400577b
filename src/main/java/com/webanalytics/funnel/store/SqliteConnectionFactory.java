package com.webanalytics.funnel.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.sqlite.SQLiteConfig;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens connections to the SQLite file shared by the event store and the metadata stores.
 *
 * WAL journaling lets the per-step readers run while the ingest writer holds its
 * connection.
 */
@Slf4j
@Component
public class SqliteConnectionFactory {

    private final String databasePath;
    private final int busyTimeoutMs;

    public SqliteConnectionFactory(
            @Value("${storage.database.path:./data/analytics.db}") String databasePath,
            @Value("${storage.busy-timeout-ms:5000}") int busyTimeoutMs
    ) {
        this.databasePath = databasePath;
        this.busyTimeoutMs = busyTimeoutMs;

        File parent = new File(databasePath).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            log.warn("Could not create directory {} for database", parent);
        }
        log.info("Using SQLite database {} (busy timeout {} ms)", databasePath, busyTimeoutMs);
    }

    public Connection open() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(busyTimeoutMs);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        return DriverManager.getConnection("jdbc:sqlite:" + databasePath, config.toProperties());
    }

    public String getDatabasePath() {
        return databasePath;
    }
}
