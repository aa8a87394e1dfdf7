package io.tagkeeper.config;

import io.tagkeeper.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tunables read from {@code tagkeeper-settings.json}. Missing or out-of-range
 * values fall back to defaults.
 */
public record TagKeeperSettings(
        String owner,
        String tagScheme,
        int workerThreads,
        int repairMaxAttempts,
        long ledgerTimeoutMs,
        long defaultIntervalMs,
        int defaultAlertThreshold,
        long stopTimeoutMs
) {
    public static final String SCHEME_ROLLING = "rolling";
    public static final String SCHEME_HMAC = "hmac";

    public static TagKeeperSettings defaults() {
        return new TagKeeperSettings(
                "tagkeeper",
                SCHEME_ROLLING,
                4,
                3,
                5_000L,
                60L * 60L * 1000L,
                80,
                2_000L
        );
    }

    public static TagKeeperSettings load(Path file) {
        TagKeeperSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read settings file: " + file, e);
        }
    }

    static TagKeeperSettings fromFile(SettingsFile file, TagKeeperSettings defaults) {
        if (file == null) {
            return defaults;
        }
        String owner = file.owner() == null || file.owner().isBlank() ? defaults.owner() : file.owner().trim();
        String scheme = sanitizeScheme(file.tagScheme(), defaults.tagScheme());
        int workers = sanitizeInt(file.workerThreads(), defaults.workerThreads(), 1);
        int attempts = sanitizeInt(file.repairMaxAttempts(), defaults.repairMaxAttempts(), 1);
        long ledgerTimeout = sanitizeLong(file.ledgerTimeoutMs(), defaults.ledgerTimeoutMs(), 100L);
        long interval = sanitizeLong(file.defaultIntervalMs(), defaults.defaultIntervalMs(), 1L);
        int threshold = file.defaultAlertThreshold() == null
                ? defaults.defaultAlertThreshold()
                : Math.max(0, Math.min(100, file.defaultAlertThreshold()));
        long stopTimeout = sanitizeLong(file.stopTimeoutMs(), defaults.stopTimeoutMs(), 0L);
        return new TagKeeperSettings(owner, scheme, workers, attempts, ledgerTimeout, interval, threshold, stopTimeout);
    }

    public List<String> diff(TagKeeperSettings other) {
        List<String> out = new ArrayList<>();
        if (other == null) {
            return out;
        }
        if (!owner.equals(other.owner())) out.add("owner");
        if (!tagScheme.equals(other.tagScheme())) out.add("tagScheme");
        if (workerThreads != other.workerThreads()) out.add("workerThreads");
        if (repairMaxAttempts != other.repairMaxAttempts()) out.add("repairMaxAttempts");
        if (ledgerTimeoutMs != other.ledgerTimeoutMs()) out.add("ledgerTimeoutMs");
        if (defaultIntervalMs != other.defaultIntervalMs()) out.add("defaultIntervalMs");
        if (defaultAlertThreshold != other.defaultAlertThreshold()) out.add("defaultAlertThreshold");
        if (stopTimeoutMs != other.stopTimeoutMs()) out.add("stopTimeoutMs");
        return out;
    }

    private static String sanitizeScheme(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (SCHEME_ROLLING.equals(normalized) || SCHEME_HMAC.equals(normalized)) {
            return normalized;
        }
        throw new IllegalArgumentException("Unknown tag scheme: " + raw);
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    record SettingsFile(
            String owner,
            String tagScheme,
            Integer workerThreads,
            Integer repairMaxAttempts,
            Long ledgerTimeoutMs,
            Long defaultIntervalMs,
            Integer defaultAlertThreshold,
            Long stopTimeoutMs
    ) {
    }
}
