package com.example.backupstorage.notify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.backupstorage.common.OperationContext;
import com.example.backupstorage.notify.Channels.DeliveryException;
import com.example.backupstorage.notify.Channels.NotificationChannel;
import com.example.backupstorage.notify.NotificationManager.DispatchReport;
import com.example.backupstorage.notify.Notifications.Alert;
import com.example.backupstorage.notify.Notifications.AlertSeverity;
import com.example.backupstorage.notify.Notifications.AlertType;
import com.example.backupstorage.notify.Notifications.EmailConfig;
import com.example.backupstorage.notify.Notifications.FileConfig;
import com.example.backupstorage.notify.Notifications.FileFormat;
import com.example.backupstorage.notify.Notifications.NotificationConfig;
import com.example.backupstorage.notify.Notifications.NotificationFilters;
import com.example.backupstorage.notify.Notifications.NotificationMessage;
import com.example.backupstorage.notify.Notifications.RateLimit;
import com.example.backupstorage.notify.Notifications.WebhookConfig;
import com.example.backupstorage.testutil.MutableClock;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

class NotificationManagerTest {

    // 2026-01-05 é uma segunda-feira
    private static final Instant MONDAY_10H = Instant.parse("2026-01-05T10:00:00Z");
    private static final Instant MONDAY_20H = Instant.parse("2026-01-05T20:00:00Z");
    private static final Instant SATURDAY_10H = Instant.parse("2026-01-10T10:00:00Z");

    private final MutableClock clock = new MutableClock(MONDAY_10H, ZoneOffset.UTC);

    /** Canal que grava o que recebeu e pode falhar sob comando. */
    static class RecordingChannel implements NotificationChannel {
        final String type;
        final boolean enabled;
        final List<NotificationMessage> received = new CopyOnWriteArrayList<>();
        volatile IOException failWith;

        RecordingChannel(String type, boolean enabled) {
            this.type = type;
            this.enabled = enabled;
        }

        @Override public String type() { return type; }

        @Override public boolean isEnabled() { return enabled; }

        @Override
        public void send(NotificationMessage message, OperationContext ctx) throws IOException {
            if (failWith != null) {
                throw failWith;
            }
            received.add(message);
        }
    }

    private static Alert alert(AlertType type, AlertSeverity severity, Instant at) {
        return new Alert(type.wire() + "-" + at.getEpochSecond(), type, severity, "Disk almost full",
                "Storage at 92%", at, null);
    }

    private static NotificationConfig config(NotificationFilters filters, RateLimit rateLimit) {
        return new NotificationConfig(true, null, null, null, null, null, filters, rateLimit);
    }

    private NotificationManager manager(NotificationConfig config, NotificationChannel... channels) {
        return new NotificationManager(config, clock, Runnable::run, List.of(channels));
    }

    // ---- filtros ----------------------------------------------------------------

    @Test
    void business_hours_and_weekdays_filters() {
        NotificationFilters filters = new NotificationFilters(null, null, null, true, true, ZoneOffset.UTC);
        NotificationManager manager = manager(config(filters, null));

        assertTrue(manager.shouldNotify(alert(AlertType.STORAGE_QUOTA, AlertSeverity.WARNING, MONDAY_10H)));
        assertFalse(manager.shouldNotify(alert(AlertType.STORAGE_QUOTA, AlertSeverity.WARNING, MONDAY_20H)));
        assertFalse(manager.shouldNotify(alert(AlertType.STORAGE_QUOTA, AlertSeverity.WARNING, SATURDAY_10H)));
        assertFalse(manager.shouldNotify(alert(AlertType.STORAGE_QUOTA, AlertSeverity.WARNING,
                Instant.parse("2026-01-05T17:00:00Z"))));
    }

    @Test
    void business_hours_follow_the_configured_zone() {
        NotificationFilters filters = new NotificationFilters(null, null, null, true, false, ZoneId.of("America/Sao_Paulo"));
        NotificationManager manager = manager(config(filters, null));

        // 10:00Z = 07:00 em São Paulo
        assertFalse(manager.shouldNotify(alert(AlertType.PERFORMANCE, AlertSeverity.INFO, MONDAY_10H)));
        assertTrue(manager.shouldNotify(alert(AlertType.PERFORMANCE, AlertSeverity.INFO, Instant.parse("2026-01-05T14:00:00Z"))));
    }

    @Test
    void severity_and_type_filters_combine_with_and() {
        NotificationFilters filters = new NotificationFilters(AlertSeverity.WARNING,
                Set.of(AlertType.STORAGE_QUOTA, AlertType.SYSTEM_HEALTH), Set.of(AlertType.SYSTEM_HEALTH),
                false, false, ZoneOffset.UTC);
        NotificationManager manager = manager(config(filters, null));

        assertTrue(manager.shouldNotify(alert(AlertType.STORAGE_QUOTA, AlertSeverity.WARNING, MONDAY_10H)));
        assertFalse(manager.shouldNotify(alert(AlertType.STORAGE_QUOTA, AlertSeverity.INFO, MONDAY_10H)));
        assertFalse(manager.shouldNotify(alert(AlertType.PERFORMANCE, AlertSeverity.CRITICAL, MONDAY_10H)));
        assertFalse(manager.shouldNotify(alert(AlertType.SYSTEM_HEALTH, AlertSeverity.CRITICAL, MONDAY_10H)));
    }

    // ---- envio ------------------------------------------------------------------

    @Test
    void delivers_to_every_enabled_channel() {
        RecordingChannel slack = new RecordingChannel("slack", true);
        RecordingChannel email = new RecordingChannel("email", false);
        RecordingChannel file = new RecordingChannel("file", true);
        NotificationManager manager = manager(config(null, null), slack, email, file);

        DispatchReport report = manager.sendNotification(alert(AlertType.STORAGE_QUOTA, AlertSeverity.WARNING, MONDAY_10H));

        assertTrue(report.attempted());
        assertEquals(2, report.delivered());
        assertEquals(1, slack.received.size());
        assertTrue(email.received.isEmpty());
        NotificationMessage message = file.received.get(0);
        assertEquals("#ff9900", message.color());
        assertEquals(":warning:", message.icon());
        assertEquals(List.of("slack", "file"), manager.enabledChannels().stream().map(NotificationChannel::type).toList());
    }

    @Test
    void one_failing_channel_does_not_block_the_others() throws Exception {
        RecordingChannel broken = new RecordingChannel("webhook", true);
        broken.failWith = new DeliveryException("webhook", "webhook retornou HTTP 502");
        RecordingChannel file = new RecordingChannel("file", true);
        NotificationManager manager = manager(config(null, null), broken, file);

        DispatchReport report = manager.sendNotification(alert(AlertType.BACKUP_FAILURE, AlertSeverity.CRITICAL, MONDAY_10H));

        assertEquals(1, report.delivered());
        assertEquals(1, report.failures().size());
        assertEquals("webhook", report.failures().get(0).channel());
        assertFalse(report.allFailed());
        report.throwIfAllFailed();
        assertEquals(1, file.received.size());
    }

    @Test
    void all_channels_failing_is_reported() {
        RecordingChannel a = new RecordingChannel("slack", true);
        RecordingChannel b = new RecordingChannel("teams", true);
        a.failWith = new DeliveryException("slack", "slack retornou HTTP 500");
        b.failWith = new DeliveryException("teams", "teams retornou HTTP 500");
        NotificationManager manager = manager(config(null, null), a, b);

        DispatchReport report = manager.sendNotification(alert(AlertType.SYSTEM_HEALTH, AlertSeverity.CRITICAL, MONDAY_10H));

        assertTrue(report.allFailed());
        DeliveryException e = assertThrows(DeliveryException.class, report::throwIfAllFailed);
        assertEquals("all", e.channelType());
        assertEquals(2, e.getSuppressed().length);
    }

    @Test
    void unexpected_runtime_errors_become_channel_failures() {
        NotificationChannel exploding = new RecordingChannel("webhook", true) {
            @Override
            public void send(NotificationMessage message, OperationContext ctx) {
                throw new IllegalStateException("bug");
            }
        };
        NotificationManager manager = manager(config(null, null), exploding);

        DispatchReport report = manager.sendNotification(alert(AlertType.PERFORMANCE, AlertSeverity.INFO, MONDAY_10H));

        assertTrue(report.allFailed());
        assertTrue(report.failures().get(0).error() instanceof DeliveryException);
    }

    @Test
    void disabled_config_skips_without_touching_channels() {
        RecordingChannel file = new RecordingChannel("file", true);
        NotificationManager manager = manager(NotificationConfig.disabled(), file);

        DispatchReport report = manager.sendNotification(alert(AlertType.PERFORMANCE, AlertSeverity.INFO, MONDAY_10H));

        assertTrue(report.disabled());
        assertFalse(report.attempted());
        assertTrue(file.received.isEmpty());
    }

    @Test
    void filtered_alerts_are_skipped() {
        RecordingChannel file = new RecordingChannel("file", true);
        NotificationFilters filters = new NotificationFilters(AlertSeverity.CRITICAL, null, null, false, false, null);
        NotificationManager manager = manager(config(filters, null), file);

        DispatchReport report = manager.sendNotification(alert(AlertType.PERFORMANCE, AlertSeverity.INFO, MONDAY_10H));

        assertTrue(report.filtered());
        assertTrue(file.received.isEmpty());
    }

    @Test
    void alert_without_type_or_severity_is_rejected() {
        NotificationManager manager = manager(config(null, null), new RecordingChannel("file", true));
        Alert noType = new Alert("x-1", null, AlertSeverity.INFO, "t", "m", MONDAY_10H, null);
        Alert noSeverity = new Alert("x-2", AlertType.PERFORMANCE, null, "t", "m", MONDAY_10H, null);

        assertThrows(IllegalArgumentException.class, () -> manager.sendNotification(noType));
        assertThrows(IllegalArgumentException.class, () -> manager.sendNotification(noSeverity));
    }

    // ---- rate limit -------------------------------------------------------------

    @Test
    void hourly_limit_uses_a_sliding_window() {
        RecordingChannel file = new RecordingChannel("file", true);
        NotificationManager manager = manager(config(null, new RateLimit(2, 0, Duration.ZERO)), file);
        Alert alert = alert(AlertType.STORAGE_QUOTA, AlertSeverity.WARNING, MONDAY_10H);

        assertTrue(manager.sendNotification(alert).attempted());
        clock.advance(Duration.ofMinutes(10));
        assertTrue(manager.sendNotification(alert).attempted());
        clock.advance(Duration.ofMinutes(10));
        assertTrue(manager.sendNotification(alert).rateLimited());

        clock.advance(Duration.ofMinutes(41));
        assertTrue(manager.sendNotification(alert).attempted());
        assertEquals(3, file.received.size());
    }

    @Test
    void daily_limit_caps_total_sends() {
        NotificationManager.RateLimiter limiter = new NotificationManager.RateLimiter(new RateLimit(0, 2, Duration.ZERO));

        assertTrue(limiter.tryAcquire(AlertType.PERFORMANCE, MONDAY_10H));
        assertTrue(limiter.tryAcquire(AlertType.PERFORMANCE, MONDAY_10H.plusSeconds(7200)));
        assertFalse(limiter.tryAcquire(AlertType.PERFORMANCE, MONDAY_10H.plusSeconds(14_400)));
        assertTrue(limiter.tryAcquire(AlertType.PERFORMANCE, MONDAY_10H.plus(Duration.ofHours(25))));
    }

    @Test
    void cooldown_applies_per_alert_type() {
        NotificationManager.RateLimiter limiter = new NotificationManager.RateLimiter(new RateLimit(0, 0, Duration.ofMinutes(15)));

        assertTrue(limiter.tryAcquire(AlertType.STORAGE_QUOTA, MONDAY_10H));
        assertFalse(limiter.tryAcquire(AlertType.STORAGE_QUOTA, MONDAY_10H.plusSeconds(60)));
        assertTrue(limiter.tryAcquire(AlertType.SYSTEM_HEALTH, MONDAY_10H.plusSeconds(60)));
        assertTrue(limiter.tryAcquire(AlertType.STORAGE_QUOTA, MONDAY_10H.plus(Duration.ofMinutes(15))));
    }

    // ---- construção ----------------------------------------------------------------

    @Test
    void builds_channels_in_fixed_order_and_skips_absent_configs() {
        NotificationConfig config = new NotificationConfig(true,
                new EmailConfig("smtp.example.com", 587, null, null, "alerts@example.com", List.of(), null, true),
                WebhookConfig.of("https://hooks.example.com/backup"),
                null, null,
                new FileConfig("/tmp/alerts.log", FileFormat.TEXT),
                null, null);

        List<NotificationChannel> channels = NotificationManager.buildChannels(config, new OkHttpClient(), (c, s, b, t) -> { });
        try (NotificationManager manager = new NotificationManager(config, clock, Runnable::run, channels)) {
            assertEquals(List.of("email", "webhook", "file"), manager.channels().stream().map(NotificationChannel::type).toList());
            assertEquals(List.of("webhook", "file"), manager.enabledChannels().stream().map(NotificationChannel::type).toList());
        }
    }
}
