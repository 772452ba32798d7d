package com.modelkeeper.versioning;

import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.temporal.IsoFields;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Tiered retention: every backup younger than {@code keepAllDays}, the newest backup per ISO week
 * until {@code weeklyUntilDays}, the newest per calendar month until {@code monthlyUntilDays},
 * nothing older.
 */
public record RetentionPolicy(int keepAllDays, int weeklyUntilDays, int monthlyUntilDays) {

    public RetentionPolicy {
        if (keepAllDays < 0 || weeklyUntilDays < keepAllDays || monthlyUntilDays < weeklyUntilDays) {
            throw new IllegalArgumentException("retention tiers must be non-negative and increasing: "
                    + keepAllDays + "/" + weeklyUntilDays + "/" + monthlyUntilDays);
        }
    }

    public static RetentionPolicy defaults() {
        return new RetentionPolicy(30, 180, 365);
    }

    /**
     * Returns the version ids that the sweep must delete.
     *
     * @param backups creation time per version id
     */
    public Set<String> expired(Map<String, LocalDateTime> backups, LocalDateTime now) {
        LocalDateTime keepAllCutoff = now.minusDays(keepAllDays);
        LocalDateTime weeklyCutoff = now.minusDays(weeklyUntilDays);
        LocalDateTime monthlyCutoff = now.minusDays(monthlyUntilDays);

        Map<String, String> newestPerWeek = new HashMap<>();
        Map<String, String> newestPerMonth = new HashMap<>();
        Set<String> expired = new LinkedHashSet<>();

        for (Map.Entry<String, LocalDateTime> backup : backups.entrySet()) {
            LocalDateTime createdAt = backup.getValue();
            if (createdAt.isAfter(keepAllCutoff)) {
                continue;
            }
            if (createdAt.isAfter(weeklyCutoff)) {
                keepNewest(newestPerWeek, weekKey(createdAt), backup.getKey(), backups, expired);
            } else if (createdAt.isAfter(monthlyCutoff)) {
                keepNewest(newestPerMonth, YearMonth.from(createdAt).toString(), backup.getKey(), backups, expired);
            } else {
                expired.add(backup.getKey());
            }
        }
        return expired;
    }

    private static void keepNewest(
            Map<String, String> bucketWinners,
            String bucket,
            String candidate,
            Map<String, LocalDateTime> backups,
            Set<String> expired) {
        String current = bucketWinners.get(bucket);
        if (current == null) {
            bucketWinners.put(bucket, candidate);
            return;
        }
        if (isNewer(candidate, current, backups)) {
            bucketWinners.put(bucket, candidate);
            expired.add(current);
        } else {
            expired.add(candidate);
        }
    }

    private static boolean isNewer(String candidate, String current, Map<String, LocalDateTime> backups) {
        int byTime = backups.get(candidate).compareTo(backups.get(current));
        return byTime != 0 ? byTime > 0 : ArtifactStore.VERSION_ORDER.compare(candidate, current) > 0;
    }

    private static String weekKey(LocalDateTime createdAt) {
        return createdAt.get(IsoFields.WEEK_BASED_YEAR) + "-W" + createdAt.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }
}
