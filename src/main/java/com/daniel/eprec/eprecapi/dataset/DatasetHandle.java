package com.daniel.eprec.eprecapi.dataset;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

import org.sqlite.SQLiteConfig; // Driver-specific open flags (read-only mode).
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.daniel.eprec.eprecapi.config.EprecProperties;

@Component
// Opens a fresh connection to whatever snapshot currently sits at the configured path.
// Holds no connection between calls; callers close what open() returns.

public class DatasetHandle {

    private final Path databasePath;

    @Autowired // Spring uses this one; the other constructor is for direct wiring in tests.
    public DatasetHandle(EprecProperties properties) {
        this(properties.databasePath());
    }

    public DatasetHandle(Path databasePath) {
        this.databasePath = databasePath;
    }

    public Path databasePath() {
        return databasePath;
    }

    public Connection open() {
        // sqlite-jdbc would silently create an empty database for a missing path, so check first.
        if (!Files.isRegularFile(databasePath)) {
            throw new StorageOpenException("Snapshot not found: " + databasePath, null);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        try {
            return DriverManager.getConnection("jdbc:sqlite:" + databasePath, config.toProperties());
        } catch (SQLException ex) {
            throw new StorageOpenException("Cannot open snapshot " + databasePath, ex);
        }
    }
}
