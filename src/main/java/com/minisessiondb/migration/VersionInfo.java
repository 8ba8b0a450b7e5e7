package com.minisessiondb.migration;

import java.util.Collections;
import java.util.List;

/**
 * 持久化版本与最新版本的对比
 */
public final class VersionInfo {

    private final int current;

    private final int latest;

    private final List<String> migrationSteps;

    public VersionInfo(int current, int latest, List<String> migrationSteps) {
        this.current = current;
        this.latest = latest;
        this.migrationSteps = Collections.unmodifiableList(migrationSteps);
    }

    public int getCurrent() {
        return current;
    }

    public int getLatest() {
        return latest;
    }

    public boolean isUpToDate() {
        return current == latest;
    }

    public boolean isMigrationRequired() {
        return current < latest;
    }

    public List<String> getMigrationSteps() {
        return migrationSteps;
    }

    @Override
    public String toString() {
        return "VersionInfo{" +
                "current=" + current +
                ", latest=" + latest +
                ", migrationRequired=" + isMigrationRequired() +
                '}';
    }
}
