package com.example.backupstorage.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.backupstorage.monitor.QuotaSettings;
import com.example.backupstorage.notify.Notifications.AlertSeverity;
import com.example.backupstorage.notify.Notifications.AlertType;
import com.example.backupstorage.notify.Notifications.FileFormat;
import com.example.backupstorage.notify.Notifications.NotificationConfig;
import com.example.backupstorage.storage.Storage.ProviderType;
import com.example.backupstorage.storage.StorageConfig;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AppConfigTest {

    @Test
    void defaults_to_single_local_provider() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.LOCAL_STORAGE_DIR, "/var/backups"));

        List<StorageConfig> configs = config.storageConfigs();
        assertEquals(1, configs.size());
        assertEquals(ProviderType.LOCAL, configs.get(0).provider());
        assertEquals("/var/backups", configs.get(0).local().basePath());
        assertEquals(0755, configs.get(0).local().permissions());
        assertEquals(Duration.ofSeconds(30), config.replicationTimeout());
        assertEquals(Duration.ofSeconds(300), config.monitorInterval());
    }

    @Test
    void provider_list_keeps_order_and_drops_duplicates() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.BACKUP_STORAGE_PROVIDERS, "s3, local, s3",
                AppConfig.AWS_S3_BUCKET, "backups-prod",
                AppConfig.AWS_S3_REGION, "SA-EAST-1"));

        assertEquals(List.of(ProviderType.S3, ProviderType.LOCAL), config.storageProviders());
        StorageConfig s3 = config.storageConfigs().get(0);
        assertEquals("backups-prod", s3.s3().bucket());
        assertEquals("sa-east-1", s3.s3().region());
    }

    @Test
    void unknown_provider_fails_early() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.BACKUP_STORAGE_PROVIDERS, "ftp"));
        ConfigValidationException e = assertThrows(ConfigValidationException.class, config::storageProviders);
        assertEquals(AppConfig.BACKUP_STORAGE_PROVIDERS, e.violations().get(0).field());
    }

    @Test
    void numeric_settings_are_clamped() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.STORAGE_REPLICATION_TIMEOUT_SECONDS, "5000"));
        assertEquals(Duration.ofSeconds(600), config.replicationTimeout());

        config.override(AppConfig.STORAGE_REPLICATION_TIMEOUT_SECONDS, "abc");
        assertEquals(Duration.ofSeconds(30), config.replicationTimeout());
    }

    @Test
    void quotas_parse_megabyte_maps() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.QUOTA_ENABLED, "true",
                AppConfig.QUOTA_TOTAL_MB, "100",
                AppConfig.QUOTA_DATABASES, "shop=10, crm=20",
                AppConfig.QUOTA_PROVIDERS, "s3=50"));

        QuotaSettings quotas = config.quotaSettings();
        assertTrue(quotas.enabled());
        assertEquals(100L * 1024 * 1024, quotas.totalQuota());
        assertEquals(10L * 1024 * 1024, quotas.databaseQuotas().get("shop"));
        assertEquals(50L * 1024 * 1024, quotas.providerQuotas().get(ProviderType.S3));
    }

    @Test
    void malformed_quota_names_the_key() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.QUOTA_ENABLED, "yes",
                AppConfig.QUOTA_DATABASES, "shop"));
        ConfigValidationException e = assertThrows(ConfigValidationException.class, config::quotaSettings);
        assertEquals(AppConfig.QUOTA_DATABASES, e.violations().get(0).field());
    }

    @Test
    void quotas_disabled_by_default() {
        assertFalse(AppConfig.fromMap(Map.of()).quotaSettings().enabled());
    }

    @Test
    void notification_config_builds_channels_and_filters() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.NOTIFY_ENABLED, "true",
                AppConfig.NOTIFY_MIN_SEVERITY, "warning",
                AppConfig.NOTIFY_EXCLUDE_TYPES, "performance,retention_policy",
                AppConfig.NOTIFY_WEEKDAYS, "1",
                AppConfig.NOTIFY_TIMEZONE, "America/Sao_Paulo",
                AppConfig.NOTIFY_SLACK_WEBHOOK_URL, "https://hooks.slack.test/x",
                AppConfig.NOTIFY_FILE_PATH, "/tmp/alerts.log",
                AppConfig.NOTIFY_FILE_FORMAT, "json",
                AppConfig.NOTIFY_RATE_MAX_PER_HOUR, "10"));

        NotificationConfig n = config.notificationConfig();
        assertTrue(n.enabled());
        assertEquals(AlertSeverity.WARNING, n.filters().minSeverity());
        assertEquals(Set.of(AlertType.PERFORMANCE, AlertType.RETENTION_POLICY), n.filters().excludeTypes());
        assertTrue(n.filters().weekdaysOnly());
        assertFalse(n.filters().businessHoursOnly());
        assertEquals(ZoneId.of("America/Sao_Paulo"), n.filters().zone());
        assertTrue(n.slack().isEnabled());
        assertEquals(FileFormat.JSON, n.file().format());
        assertNull(n.email());
        assertNull(n.webhook());
        assertEquals(10, n.rateLimit().maxPerHour());
    }

    @Test
    void invalid_severity_is_a_validation_error() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.NOTIFY_ENABLED, "true",
                AppConfig.NOTIFY_MIN_SEVERITY, "loud"));
        assertThrows(ConfigValidationException.class, config::notificationConfig);
    }

    @Test
    void to_string_does_not_leak_secrets() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.AWS_SECRET_ACCESS_KEY, "very-secret",
                AppConfig.AWS_ACCESS_KEY_ID, "AKIA123",
                AppConfig.AZURE_STORAGE_KEY, "azure-secret"));
        String s = config.toString();
        assertFalse(s.contains("very-secret"));
        assertFalse(s.contains("azure-secret"));
        assertTrue(s.contains("awsCreds=set"));
    }
}
