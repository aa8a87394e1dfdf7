package io.tagkeeper.model;

import java.time.Instant;
import java.util.List;

public record SystemReport(
        Instant timestamp,
        String version,
        int checked,
        int verified,
        int compromised,
        int repaired,
        int integrityScore,
        List<Verification> details
) {
    public SystemReport {
        details = details == null ? List.of() : List.copyOf(details);
    }

    public static int score(int checked, int verified, int repaired) {
        if (checked <= 0) {
            return 100;
        }
        return (int) Math.round(100.0d * (verified + repaired) / checked);
    }

    public boolean breaches(int threshold) {
        return integrityScore < threshold;
    }
}
