package com.example.backupstorage.monitor;

import static com.example.backupstorage.testutil.Backups.backup;
import static com.example.backupstorage.testutil.Backups.compressed;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.backupstorage.backup.Backup.BackupMetadata;
import com.example.backupstorage.backup.Backup.BackupStatus;
import com.example.backupstorage.backup.Backup.CompressionType;
import com.example.backupstorage.monitor.Reports.DatabaseStorageDetail;
import com.example.backupstorage.monitor.Reports.HealthIssue;
import com.example.backupstorage.monitor.Reports.HealthLevel;
import com.example.backupstorage.monitor.Reports.HealthReport;
import com.example.backupstorage.monitor.Reports.HealthSummary;
import com.example.backupstorage.monitor.Reports.OptimizationReport;
import com.example.backupstorage.monitor.Reports.Priority;
import com.example.backupstorage.monitor.Reports.QuotaStatus;
import com.example.backupstorage.monitor.Reports.QuotaWarning;
import com.example.backupstorage.monitor.Reports.TrendDirection;
import com.example.backupstorage.monitor.Reports.TrendReport;
import com.example.backupstorage.monitor.Reports.UsageReport;
import com.example.backupstorage.monitor.StorageMonitor.MonitorException;
import com.example.backupstorage.notify.Notifications.Alert;
import com.example.backupstorage.notify.Notifications.AlertSeverity;
import com.example.backupstorage.notify.Notifications.AlertType;
import com.example.backupstorage.storage.MultiStorageProvider;
import com.example.backupstorage.storage.Storage.ProviderType;
import com.example.backupstorage.testutil.Backups.InMemoryBackupManager;
import com.example.backupstorage.testutil.FakeStorageProvider;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class StorageMonitorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final long GIB = 1024L * 1024 * 1024;

    private static Instant ago(Duration d) {
        return NOW.minus(d);
    }

    private static StorageMonitor monitor(List<BackupMetadata> backups, QuotaSettings quotas) {
        return new StorageMonitor(new InMemoryBackupManager(backups), quotas, CLOCK);
    }

    private static BackupMetadata withChecksum(String id, long size, String checksum) {
        return BackupMetadata.builder(id, "shop", ago(Duration.ofDays(1)))
                .size(size)
                .compressedSize(size / 2)
                .compression(CompressionType.GZIP)
                .checksum(checksum)
                .status(BackupStatus.COMPLETED)
                .build();
    }

    // ---- uso ------------------------------------------------------------------

    @Test
    void usage_sums_sizes_and_partitions_by_age() throws Exception {
        List<BackupMetadata> backups = List.of(
                compressed("b1", "shop", ago(Duration.ofHours(1)), 1000, 500, CompressionType.GZIP),
                compressed("b2", "shop", ago(Duration.ofDays(3)), 3000, 1500, CompressionType.GZIP),
                backup("b3", "crm", ago(Duration.ofDays(20)), 2000),
                BackupMetadata.builder("b4", "crm", ago(Duration.ofDays(100)))
                        .size(4000).compressedSize(4000).storageLocation("s3://bucket/backups/b4/")
                        .status(BackupStatus.COMPLETED).build());

        UsageReport usage = monitor(backups, QuotaSettings.disabled()).getStorageUsage();

        assertEquals(4, usage.totalBackups());
        assertEquals(10_000, usage.totalSize());
        assertEquals(8_000, usage.totalCompressedSize());
        assertEquals(0.8, usage.compressionRatio(), 1e-9);
        assertEquals(2_500, usage.averageBackupSize());
        assertEquals("b4", usage.largestBackup().id());
        assertEquals("b1", usage.smallestBackup().id());

        assertEquals(1000, usage.storageByAge().daily().totalSize());
        assertEquals(3000, usage.storageByAge().weekly().totalSize());
        assertEquals(2000, usage.storageByAge().monthly().totalSize());
        assertEquals(4000, usage.storageByAge().older().totalSize());
        assertEquals(usage.totalBackups(), usage.storageByAge().totalCount());

        assertEquals(3, usage.storageByProvider().get("local").backupCount());
        assertEquals(4000, usage.storageByProvider().get("s3").totalSize());
        assertEquals(List.of("crm", "shop"), List.copyOf(usage.storageByDatabase().keySet()));
        assertEquals(ago(Duration.ofDays(3)), usage.storageByDatabase().get("shop").oldestBackup());
        assertEquals(NOW, usage.generatedAt());
    }

    @Test
    void empty_catalog_reports_zeroes() throws Exception {
        UsageReport usage = monitor(List.of(), QuotaSettings.disabled()).getStorageUsage();

        assertEquals(0, usage.totalBackups());
        assertEquals(0.0, usage.compressionRatio());
        assertEquals(0, usage.averageBackupSize());
        assertNull(usage.largestBackup());
        assertTrue(usage.storageByDatabase().isEmpty());
    }

    @Test
    void usage_by_database_estimates_growth_from_two_or_more_backups() throws Exception {
        List<BackupMetadata> backups = List.of(
                backup("s1", "shop", ago(Duration.ofDays(2)), 1000),
                backup("s2", "shop", NOW, 3000),
                backup("c1", "crm", ago(Duration.ofDays(40)), 500));

        Map<String, DatabaseStorageDetail> details = monitor(backups, QuotaSettings.disabled()).getStorageUsageByDatabase();

        DatabaseStorageDetail shop = details.get("shop");
        assertEquals(2000, shop.growth().dailyGrowth());
        assertEquals(14_000, shop.growth().weeklyGrowth());
        assertEquals(60_000, shop.growth().monthlyGrowth());
        assertEquals(Map.of("completed", 2), shop.statusCounts());
        assertEquals(Map.of("daily", 1, "weekly", 1), shop.ageCounts());

        assertNull(details.get("crm").growth());
        assertEquals(Map.of("older", 1), details.get("crm").ageCounts());
    }

    @Test
    void listing_failure_raises_monitor_exception() {
        InMemoryBackupManager manager = new InMemoryBackupManager(List.of());
        manager.failWith = new IOException("catálogo indisponível");
        StorageMonitor monitor = new StorageMonitor(manager, QuotaSettings.disabled(), CLOCK);

        MonitorException e = assertThrows(MonitorException.class, monitor::getStorageUsage);
        assertTrue(e.getMessage().contains("catálogo indisponível"));
        assertThrows(MonitorException.class, monitor::checkStorageQuotas);
        assertThrows(MonitorException.class, monitor::generateStorageAlerts);
    }

    // ---- quotas ---------------------------------------------------------------

    @Test
    void total_quota_at_95_percent_is_critical() throws Exception {
        StorageMonitor monitor = monitor(List.of(backup("b1", "shop", ago(Duration.ofDays(1)), 95)),
                QuotaSettings.total(100));

        QuotaStatus status = monitor.checkStorageQuotas();

        assertTrue(status.quotaEnabled());
        assertEquals(95.0, status.usagePercentage(), 1e-9);
        assertEquals(5, status.availableStorage());
        assertFalse(status.quotaExceeded());
        assertEquals(1, status.warnings().size());
        QuotaWarning warning = status.warnings().get(0);
        assertEquals("total", warning.type());
        assertEquals(AlertSeverity.CRITICAL, warning.severity());
        assertEquals("Total storage usage is at 95.0% of quota", warning.message());
        assertEquals("Immediate action required: Clean up old backups or increase quota", warning.recommendedAction());
        assertNotNull(status.estimatedTimeToFull());
    }

    @Test
    void database_and_provider_quotas_use_their_own_thresholds() throws Exception {
        QuotaSettings quotas = new QuotaSettings(true, 0,
                Map.of("shop", 1000L, "crm", 0L),
                Map.of(ProviderType.LOCAL, 1000L, ProviderType.S3, 5000L));
        StorageMonitor monitor = monitor(List.of(backup("b1", "shop", ago(Duration.ofDays(1)), 920)), quotas);

        QuotaStatus status = monitor.checkStorageQuotas();

        assertEquals(92.0, status.databaseQuotas().get("shop").usagePercentage(), 1e-9);
        assertFalse(status.databaseQuotas().containsKey("crm"));
        assertEquals(0, status.providerQuotas().get("s3").used());
        assertEquals(2, status.warnings().size());

        QuotaWarning db = status.warnings().get(0);
        assertEquals("database", db.type());
        assertEquals(AlertSeverity.WARNING, db.severity());
        assertEquals("Database shop is using 92.0% of its storage quota", db.message());

        QuotaWarning provider = status.warnings().get(1);
        assertEquals("provider", provider.type());
        assertEquals("local", provider.target());
        assertEquals(0, status.totalQuota());
        assertNull(status.estimatedTimeToFull());
    }

    @Test
    void disabled_quotas_produce_no_warnings() throws Exception {
        QuotaStatus status = monitor(List.of(backup("b1", "shop", NOW, 95)), QuotaSettings.disabled()).checkStorageQuotas();

        assertFalse(status.quotaEnabled());
        assertEquals(95, status.usedStorage());
        assertTrue(status.warnings().isEmpty());
    }

    @Test
    void exceeded_quota_has_nothing_available() throws Exception {
        QuotaStatus status = monitor(List.of(backup("b1", "shop", NOW, 150)), QuotaSettings.total(100)).checkStorageQuotas();

        assertTrue(status.quotaExceeded());
        assertEquals(0, status.availableStorage());
        assertNull(status.estimatedTimeToFull());
    }

    // ---- otimização -----------------------------------------------------------

    @Test
    void uncompressed_backups_drive_a_high_priority_recommendation() throws Exception {
        List<BackupMetadata> backups = List.of(
                backup("raw-1", "shop", ago(Duration.ofDays(1)), 1000),
                backup("raw-2", "shop", ago(Duration.ofDays(2)), 2000),
                compressed("gz-1", "shop", ago(Duration.ofDays(3)), 1000, 300, CompressionType.GZIP),
                compressed("gz-2", "shop", ago(Duration.ofDays(4)), 1000, 500, CompressionType.GZIP),
                compressed("zs-1", "crm", ago(Duration.ofDays(5)), 1000, 950, CompressionType.ZSTD));

        OptimizationReport report = monitor(backups, QuotaSettings.disabled()).getStorageOptimizationRecommendations();

        assertEquals(List.of("raw-1", "raw-2"), report.compression().uncompressedBackups());
        assertEquals(3, report.compression().compressedBackups());
        assertEquals(List.of("zs-1"), report.compression().poorlyCompressedBackups());
        assertEquals((0.3 + 0.5 + 0.95) / 3, report.compression().averageCompressionRatio(), 1e-9);
        assertEquals(900, report.compression().potentialSavings());
        assertEquals("gzip", report.compression().recommendedAlgorithm());

        assertEquals(1, report.recommendations().size());
        assertEquals(Priority.HIGH, report.recommendations().get(0).priority());
        assertEquals("Enable compression for 2 uncompressed backups", report.recommendations().get(0).description());
        assertEquals(900, report.totalPotentialSavings());
    }

    @Test
    void duplicates_by_checksum_save_all_but_one_copy() throws Exception {
        List<BackupMetadata> backups = List.of(
                withChecksum("d1", 100, "abc"),
                withChecksum("d2", 100, "abc"),
                withChecksum("d3", 100, "abc"),
                withChecksum("u1", 50, "def"));

        OptimizationReport report = monitor(backups, QuotaSettings.disabled()).getStorageOptimizationRecommendations();

        assertEquals(1, report.duplication().duplicateGroups().size());
        assertEquals(List.of("d1", "d2", "d3"), report.duplication().duplicateGroups().get(0).backupIds());
        assertEquals(200, report.duplication().potentialSavings());
        assertEquals(3, report.duplication().recommendations().size());
        assertEquals(Priority.LOW, report.recommendations().get(0).priority());
        assertEquals(200, report.totalPotentialSavings());
    }

    @Test
    void backups_older_than_ninety_days_are_retention_candidates() throws Exception {
        List<BackupMetadata> backups = List.of(
                compressed("old", "shop", ago(Duration.ofDays(100)), 500, 200, CompressionType.GZIP),
                compressed("new", "shop", ago(Duration.ofDays(10)), 700, 300, CompressionType.GZIP));

        OptimizationReport report = monitor(backups, QuotaSettings.disabled()).getStorageOptimizationRecommendations();

        assertEquals(List.of("old"), report.retention().eligibleForCleanup());
        assertEquals(500, report.retention().potentialSavings());
        assertEquals(0.5, report.retention().effectiveness(), 1e-9);
        assertEquals("Apply a 90-day retention policy to remove 1 backups",
                report.retention().databaseRecommendations().get(0).recommendation());
        assertEquals(Priority.MEDIUM, report.recommendations().get(0).priority());
    }

    // ---- tendências -----------------------------------------------------------

    @Test
    void trends_cover_only_the_window() throws Exception {
        List<BackupMetadata> backups = List.of(
                backup("s1", "shop", ago(Duration.ofDays(20)), 100),
                backup("s2", "shop", ago(Duration.ofDays(15)), 100),
                backup("s3", "shop", ago(Duration.ofDays(5)), 300),
                backup("s4", "shop", ago(Duration.ofDays(1)), 300),
                backup("legacy", "shop", ago(Duration.ofDays(40)), 1000));

        TrendReport trends = monitor(backups, QuotaSettings.disabled()).getStorageTrends(Duration.ofDays(30));

        assertEquals(4, trends.backupCount());
        assertEquals(800, trends.storageGrowth());
        assertEquals(800 / 30.0, trends.growthRatePerDay(), 1e-9);
        assertEquals(TrendDirection.INCREASING, trends.databaseTrends().get("shop").trend());
        assertEquals(200, trends.databaseTrends().get("shop").firstHalfSize());
        assertEquals(TrendDirection.INCREASING, trends.frequency().trend());
        assertEquals(4 / 30.0, trends.frequency().dailyAverage(), 1e-9);
        assertEquals(Reports.CompressionDirection.STABLE, trends.compression().trend());
        assertEquals(1800, trends.prediction().currentUsage());
        assertEquals(2600, trends.prediction().predicted30Days());
        assertEquals(0.6, trends.prediction().confidence(), 1e-9);
        assertEquals(ago(Duration.ofDays(30)), trends.start());
    }

    private static List<BackupMetadata> compressionWindow(long lastCompressedSize) {
        return List.of(
                compressed("c1", "shop", ago(Duration.ofDays(4)), 1000, 500, CompressionType.GZIP),
                compressed("c2", "shop", ago(Duration.ofDays(3)), 1000, 500, CompressionType.GZIP),
                compressed("c3", "shop", ago(Duration.ofDays(2)), 1000, 500, CompressionType.GZIP),
                compressed("c4", "shop", ago(Duration.ofDays(1)), 1000, lastCompressedSize, CompressionType.ZSTD));
    }

    @ParameterizedTest
    @CsvSource({
            "474, IMPROVING",
            "476, STABLE",
            "524, STABLE",
            "526, DEGRADING"})
    void compression_trend_compares_first_and_last_quarter(long lastCompressedSize, String expected) throws Exception {
        TrendReport trends = monitor(compressionWindow(lastCompressedSize), QuotaSettings.disabled())
                .getStorageTrends(Duration.ofDays(30));

        assertEquals(Reports.CompressionDirection.valueOf(expected), trends.compression().trend());
        assertEquals(0.5, trends.compression().firstQuarterRatio(), 1e-9);
        assertEquals(lastCompressedSize / 1000.0, trends.compression().lastQuarterRatio(), 1e-9);
        assertEquals((1500 + lastCompressedSize) / 4000.0, trends.compression().averageRatio(), 1e-9);
        assertEquals(Map.of("gzip", 3, "zstd", 1), trends.compression().algorithmUsage());
    }

    @Test
    void compression_average_is_reported_even_with_few_backups() throws Exception {
        List<BackupMetadata> backups = List.of(
                compressed("c1", "shop", ago(Duration.ofDays(2)), 1000, 300, CompressionType.GZIP),
                compressed("c2", "shop", ago(Duration.ofDays(1)), 3000, 1500, CompressionType.GZIP));

        TrendReport trends = monitor(backups, QuotaSettings.disabled()).getStorageTrends(Duration.ofDays(30));

        assertEquals(Reports.CompressionDirection.INSUFFICIENT_DATA, trends.compression().trend());
        assertEquals(1800 / 4000.0, trends.compression().averageRatio(), 1e-9);
    }

    @ParameterizedTest
    @CsvSource({
            "3, DECREASING",
            "4, STABLE",
            "6, STABLE",
            "7, INCREASING"})
    void frequency_trend_compares_the_two_halves_of_the_period(int recentCount, String expected) throws Exception {
        List<BackupMetadata> backups = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            backups.add(backup("old-" + i, "shop", ago(Duration.ofDays(20 + i)), 100));
        }
        for (int i = 0; i < recentCount; i++) {
            backups.add(backup("new-" + i, "shop", ago(Duration.ofDays(1 + i)), 100));
        }

        TrendReport trends = monitor(backups, QuotaSettings.disabled()).getStorageTrends(Duration.ofDays(30));

        assertEquals(TrendDirection.valueOf(expected), trends.frequency().trend());
    }

    @ParameterizedTest
    @CsvSource({
            "899, DECREASING",
            "901, STABLE",
            "1099, STABLE",
            "1101, INCREASING"})
    void database_trend_uses_a_ten_percent_band(long secondSize, String expected) throws Exception {
        List<BackupMetadata> backups = List.of(
                backup("d1", "shop", ago(Duration.ofDays(10)), 1000),
                backup("d2", "shop", ago(Duration.ofDays(1)), secondSize));

        TrendReport trends = monitor(backups, QuotaSettings.disabled()).getStorageTrends(Duration.ofDays(30));

        assertEquals(TrendDirection.valueOf(expected), trends.databaseTrends().get("shop").trend());
        assertEquals(secondSize, trends.databaseTrends().get("shop").secondHalfSize());
    }

    @ParameterizedTest
    @CsvSource({
            "4, 0.5",
            "5, 0.6",
            "9, 0.6",
            "10, 0.8"})
    void prediction_confidence_grows_with_history(int count, double expected) throws Exception {
        List<BackupMetadata> backups = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            backups.add(backup("p" + i, "shop", ago(Duration.ofDays(1 + i)), 100));
        }

        TrendReport trends = monitor(backups, QuotaSettings.disabled()).getStorageTrends(Duration.ofDays(30));

        assertEquals(expected, trends.prediction().confidence(), 1e-9);
    }

    @Test
    void predictions_extend_the_daily_rate() throws Exception {
        List<BackupMetadata> backups = List.of(
                backup("s1", "shop", ago(Duration.ofDays(20)), 100),
                backup("s2", "shop", ago(Duration.ofDays(15)), 100),
                backup("s3", "shop", ago(Duration.ofDays(5)), 300),
                backup("s4", "shop", ago(Duration.ofDays(1)), 300),
                backup("legacy", "shop", ago(Duration.ofDays(40)), 1000));

        TrendReport trends = monitor(backups, QuotaSettings.total(2000)).getStorageTrends(Duration.ofDays(30));

        assertEquals(1800 + 2400, trends.prediction().predicted90Days());
        assertEquals(1800 + Math.round(800 / 30.0 * 365), trends.prediction().predicted365Days());
        // 200 bytes restantes a 800/30 bytes por dia
        assertEquals(Duration.ofHours(180), trends.prediction().timeToQuota());
    }

    @Test
    void no_growth_in_the_window_leaves_predictions_at_zero() throws Exception {
        List<BackupMetadata> backups = List.of(backup("legacy", "shop", ago(Duration.ofDays(40)), 1000));

        TrendReport trends = monitor(backups, QuotaSettings.total(5000)).getStorageTrends(Duration.ofDays(30));

        assertEquals(0.0, trends.growthRatePerDay(), 1e-9);
        assertEquals(1000, trends.prediction().currentUsage());
        assertEquals(0, trends.prediction().predicted30Days());
        assertEquals(0, trends.prediction().predicted90Days());
        assertEquals(0, trends.prediction().predicted365Days());
        assertNull(trends.prediction().timeToQuota());
    }

    @Test
    void short_windows_report_insufficient_data() throws Exception {
        TrendReport trends = monitor(List.of(backup("s1", "shop", ago(Duration.ofDays(1)), 100)), QuotaSettings.total(1000))
                .getStorageTrends(Duration.ofDays(7));

        assertEquals(TrendDirection.INSUFFICIENT_DATA, trends.databaseTrends().get("shop").trend());
        assertEquals(TrendDirection.INSUFFICIENT_DATA, trends.frequency().trend());
        assertEquals(Reports.CompressionDirection.INSUFFICIENT_DATA, trends.compression().trend());
        assertEquals(0.5, trends.prediction().confidence(), 1e-9);
        assertNotNull(trends.prediction().timeToQuota());
    }

    @Test
    void non_positive_period_is_rejected() {
        StorageMonitor monitor = monitor(List.of(), QuotaSettings.disabled());

        assertThrows(IllegalArgumentException.class, () -> monitor.getStorageTrends(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> monitor.getStorageTrends(Duration.ofDays(-1)));
    }

    // ---- alertas --------------------------------------------------------------

    @Test
    void alerts_cover_usage_compression_and_quota() throws Exception {
        StorageMonitor monitor = monitor(List.of(backup("big", "shop", ago(Duration.ofDays(1)), 11 * GIB)),
                QuotaSettings.total(11 * GIB + GIB / 2));

        List<Alert> alerts = monitor.generateStorageAlerts();

        assertEquals(3, alerts.size());
        Alert usage = alerts.get(0);
        assertEquals("storage-usage-" + NOW.getEpochSecond(), usage.id());
        assertEquals(AlertType.STORAGE_QUOTA, usage.type());
        assertEquals("High Storage Usage", usage.title());
        assertEquals(11 * GIB, usage.metadata().get("total_size"));

        Alert compression = alerts.get(1);
        assertEquals(AlertType.PERFORMANCE, compression.type());
        assertEquals(AlertSeverity.INFO, compression.severity());

        Alert quota = alerts.get(2);
        assertEquals("quota-total-total-" + NOW.getEpochSecond(), quota.id());
        assertEquals(AlertSeverity.CRITICAL, quota.severity());
        assertEquals("Storage Quota Warning", quota.title());
    }

    @Test
    void healthy_catalog_raises_no_alerts() throws Exception {
        List<Alert> alerts = monitor(List.of(
                compressed("b1", "shop", NOW, 1000, 400, CompressionType.ZSTD)), QuotaSettings.total(100_000))
                .generateStorageAlerts();

        assertTrue(alerts.isEmpty());
    }

    // ---- saúde ----------------------------------------------------------------

    @Test
    void listing_failure_makes_health_critical_without_throwing() {
        InMemoryBackupManager manager = new InMemoryBackupManager(List.of());
        manager.failWith = new IOException("connection refused");
        StorageMonitor monitor = new StorageMonitor(manager, QuotaSettings.disabled(), CLOCK);

        HealthReport report = monitor.monitorStorageHealthWithDetails();

        assertEquals(HealthLevel.CRITICAL, report.overallHealth());
        assertEquals(HealthLevel.CRITICAL, report.providerHealth().get("catalog").status());
        assertFalse(report.connectivityTests().get(0).success());
        HealthIssue issue = report.issues().get(0);
        assertEquals("connectivity", issue.type());
        assertEquals(AlertSeverity.CRITICAL, issue.severity());
        assertTrue(issue.description().contains("connection refused"));
    }

    @Test
    void quota_warnings_degrade_health_and_recommendations_stay_informational() {
        StorageMonitor monitor = monitor(List.of(backup("b1", "shop", NOW, 90)), QuotaSettings.total(100));

        HealthReport report = monitor.monitorStorageHealthWithDetails();

        assertEquals(HealthLevel.WARNING, report.overallHealth());
        assertTrue(report.issues().stream().anyMatch(i -> i.type().equals("quota") && i.severity() == AlertSeverity.WARNING));
        assertTrue(report.issues().stream().anyMatch(i -> i.type().equals("performance") && i.severity() == AlertSeverity.INFO));
        assertEquals(1, report.performance().backupCount());
    }

    @Test
    void clean_catalog_is_healthy() {
        HealthReport report = monitor(List.of(compressed("b1", "shop", NOW, 1000, 400, CompressionType.GZIP)),
                QuotaSettings.disabled()).monitorStorageHealthWithDetails();

        assertEquals(HealthLevel.HEALTHY, report.overallHealth());
        assertTrue(report.issues().isEmpty());
        assertTrue(report.connectivityTests().get(0).success());
    }

    @Test
    void provider_health_checks_feed_the_report() {
        FakeStorageProvider primary = new FakeStorageProvider("primary");
        FakeStorageProvider mirror = new FakeStorageProvider("mirror");
        mirror.failHealth = FakeStorageProvider.backendError("mirror");
        MultiStorageProvider storage = new MultiStorageProvider(List.of(primary, mirror), Duration.ofSeconds(5), Runnable::run);
        StorageMonitor monitor = new StorageMonitor(new InMemoryBackupManager(List.of()), QuotaSettings.disabled(), CLOCK,
                ProviderType.LOCAL, storage, Duration.ofSeconds(5));

        HealthReport report = monitor.monitorStorageHealthWithDetails();

        assertEquals(HealthLevel.WARNING, report.overallHealth());
        assertEquals(HealthLevel.HEALTHY, report.providerHealth().get("primary").status());
        assertEquals(HealthLevel.CRITICAL, report.providerHealth().get("mirror").status());
        assertEquals("Storage provider health check failed: mirror", report.issues().get(0).description());

        primary.failHealth = FakeStorageProvider.backendError("primary");
        assertEquals(HealthLevel.CRITICAL, monitor.monitorStorageHealthWithDetails().overallHealth());
    }

    @Test
    void summary_counts_issues_and_lists_their_resolutions() {
        InMemoryBackupManager manager = new InMemoryBackupManager(List.of());
        manager.failWith = new IOException("timeout");
        HealthSummary summary = new StorageMonitor(manager, QuotaSettings.disabled(), CLOCK).getStorageHealthSummary();

        assertEquals(HealthLevel.CRITICAL, summary.overallHealth());
        assertEquals(1, summary.criticalIssues());
        assertEquals(0, summary.warningIssues());
        assertEquals(List.of("Check storage provider configuration and connectivity"), summary.topRecommendations());
    }
}
