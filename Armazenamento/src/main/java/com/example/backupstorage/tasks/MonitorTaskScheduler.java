package com.example.backupstorage.tasks;

import com.example.backupstorage.monitor.Reports.HealthIssue;
import com.example.backupstorage.monitor.Reports.HealthReport;
import com.example.backupstorage.monitor.StorageMonitor;
import com.example.backupstorage.notify.NotificationManager;
import com.example.backupstorage.notify.NotificationManager.DispatchReport;
import com.example.backupstorage.notify.Notifications.Alert;
import com.example.backupstorage.notify.Notifications.AlertSeverity;
import com.example.backupstorage.notify.Notifications.AlertType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ciclo periódico do monitor: gera alertas de armazenamento, converte problemas de saúde
 * críticos/de aviso em alertas system-health e entrega tudo pelo NotificationManager.
 * Erros de um ciclo são logados e não interrompem o agendamento.
 */
public final class MonitorTaskScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MonitorTaskScheduler.class);

    private final StorageMonitor monitor;
    private final NotificationManager notifications;
    private final Clock clock;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    /** Resumo de um ciclo. */
    public record CycleResult(int alertsGenerated, int delivered, int skipped, int failed, String error) {
        public boolean succeeded() {
            return error == null;
        }
    }

    public MonitorTaskScheduler(StorageMonitor monitor, NotificationManager notifications, Clock clock, Duration interval) {
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.notifications = Objects.requireNonNull(notifications, "notifications");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.toMillis() < 1) {
            throw new IllegalArgumentException("Intervalo do monitor deve ser positivo: " + interval);
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "storage-monitor");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(this::runQuietly, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Monitor de armazenamento iniciado. Intervalo: {}ms", interval.toMillis());
    }

    private void runQuietly() {
        CycleResult result = runOnce();
        if (!result.succeeded()) {
            log.warn("Ciclo do monitor terminou com erro: {}", result.error());
        }
    }

    /** Executa um ciclo completo de forma síncrona. Nunca lança. */
    public CycleResult runOnce() {
        List<Alert> alerts = new ArrayList<>();
        String error = null;
        try {
            alerts.addAll(monitor.generateStorageAlerts());
        } catch (Exception e) {
            error = "Falha ao gerar alertas de armazenamento: " + e.getMessage();
            log.warn(error);
        }
        try {
            alerts.addAll(healthAlerts(monitor.monitorStorageHealthWithDetails()));
        } catch (RuntimeException e) {
            error = "Falha ao avaliar saúde do armazenamento: " + e.getMessage();
            log.warn(error, e);
        }

        int delivered = 0;
        int skipped = 0;
        int failed = 0;
        for (Alert alert : alerts) {
            try {
                DispatchReport report = notifications.sendNotification(alert);
                if (!report.attempted()) {
                    skipped++;
                } else if (report.allFailed()) {
                    failed++;
                } else {
                    delivered++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("Falha ao enviar alerta {}: {}", alert.id(), e.getMessage());
            }
        }
        log.info("[MONITOR] Ciclo concluído: alertas={} entregues={} ignorados={} falhas={}",
                alerts.size(), delivered, skipped, failed);
        return new CycleResult(alerts.size(), delivered, skipped, failed, error);
    }

    List<Alert> healthAlerts(HealthReport report) {
        Instant now = clock.instant();
        List<Alert> alerts = new ArrayList<>();
        int seq = 0;
        for (HealthIssue issue : report.issues()) {
            // quota já sai de generateStorageAlerts como storage-quota
            if (issue.severity() == AlertSeverity.INFO || "quota".equals(issue.type())) {
                continue;
            }
            seq++;
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("issue_type", issue.type());
            metadata.put("impact", issue.impact());
            metadata.put("actions", issue.resolution() != null ? List.of(issue.resolution()) : List.of());
            alerts.add(new Alert(AlertType.SYSTEM_HEALTH.wire() + "-" + seq + "-" + now.getEpochSecond(),
                    AlertType.SYSTEM_HEALTH, issue.severity(), "Storage Health: " + issue.type(),
                    issue.description(), now, metadata));
        }
        return alerts;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Forçando encerramento do monitor...");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
