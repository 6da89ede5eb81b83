package com.daniel.eprec.eprecapi.config;

import java.nio.file.Path;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
// Binds external config values (e.g., from application.properties) to fields in this class

@ConfigurationProperties(prefix = "eprec")
public class EprecProperties {

    static final String DEFAULT_REPO_URL = "https://github.com/sudoghut/eplot-data-compiler.git";
    static final String DEFAULT_REPO_DIR = "./eplot-data-compiler";
    static final String DEFAULT_DATABASE_FILE = "data.db";
    static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofHours(24);

    private String repoUrl = DEFAULT_REPO_URL;
    private String repoDir = DEFAULT_REPO_DIR;
    private String databaseFile = DEFAULT_DATABASE_FILE;
    private String branch = "main";
    private String remoteName = "origin";
    private Duration refreshInterval = DEFAULT_REFRESH_INTERVAL;
    private Duration initialDelay = Duration.ZERO;
    private boolean syncEnabled = true;

    public String getRepoUrl() {
        return repoUrl;
    }

    public void setRepoUrl(String repoUrl) {
        this.repoUrl = repoUrl;
    }

    public String getRepoDir() {
        return repoDir;
    }

    public void setRepoDir(String repoDir) {
        this.repoDir = repoDir;
    }

    public String getDatabaseFile() {
        return databaseFile;
    }

    public void setDatabaseFile(String databaseFile) {
        this.databaseFile = databaseFile;
    }

    public String getBranch() {
        return branch;
    }

    public void setBranch(String branch) {
        this.branch = branch;
    }

    public String getRemoteName() {
        return remoteName;
    }

    public void setRemoteName(String remoteName) {
        this.remoteName = remoteName;
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }

    public void setRefreshInterval(Duration refreshInterval) {
        this.refreshInterval = refreshInterval;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public boolean isSyncEnabled() {
        return syncEnabled;
    }

    public void setSyncEnabled(boolean syncEnabled) {
        this.syncEnabled = syncEnabled;
    }

    public Path repoRoot() {
        // Absolute root so the clone staging dir and the snapshot path are resolved against the same place.
        String dir = repoDir == null || repoDir.trim().isEmpty() ? DEFAULT_REPO_DIR : repoDir.trim();
        return Path.of(dir).toAbsolutePath().normalize();
    }

    public Path databasePath() {
        String file = databaseFile == null || databaseFile.trim().isEmpty() ? DEFAULT_DATABASE_FILE : databaseFile.trim();
        return repoRoot().resolve(file).normalize();
    }

    public String effectiveRepoUrl() {
        if (repoUrl == null || repoUrl.trim().isEmpty()) {
            return DEFAULT_REPO_URL;
        }
        return repoUrl.trim();
    }

    public String effectiveBranch() {
        if (branch == null || branch.trim().isEmpty()) {
            return "main";
        }
        return branch.trim();
    }

    public String effectiveRemoteName() {
        if (remoteName == null || remoteName.trim().isEmpty()) {
            return "origin";
        }
        return remoteName.trim();
    }

    // A zero or negative interval would make the refresh loop spin, so it falls back to the daily default.
    public Duration effectiveRefreshInterval() {
        if (refreshInterval == null || refreshInterval.isZero() || refreshInterval.isNegative()) {
            return DEFAULT_REFRESH_INTERVAL;
        }
        return refreshInterval;
    }

    public Duration effectiveInitialDelay() {
        if (initialDelay == null || initialDelay.isNegative()) {
            return Duration.ZERO;
        }
        return initialDelay;
    }
}
