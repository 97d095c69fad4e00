package io.cronrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class CronRelayConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DB_FILE_NAME = "cronrelay.db";
    public static final String SETTINGS_FILE_NAME = "cronrelay-settings.json";

    private final Path rootDir;
    private final SchedulerSettings settings;

    public CronRelayConfig(Path rootDir, SchedulerSettings settings) {
        this.rootDir = rootDir;
        this.settings = settings == null ? SchedulerSettings.defaults() : settings;
    }

    /**
     * Resolves the data root and reads {@code cronrelay-settings.json} beneath it once.
     * A missing settings file yields {@link SchedulerSettings#defaults()}.
     */
    public static CronRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        return new CronRelayConfig(base, SchedulerSettings.load(base.resolve(SETTINGS_FILE_NAME)));
    }

    public static CronRelayConfig fromRoot(String root, SchedulerSettings settings) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new CronRelayConfig(resolved.toAbsolutePath().normalize(), settings);
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve(DB_FILE_NAME);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public SchedulerSettings settings() {
        return settings;
    }
}
