package com.example.backupstorage;

import com.example.backupstorage.backup.Backup.BackupManager;
import com.example.backupstorage.config.AppConfig;
import com.example.backupstorage.monitor.StorageMonitor;
import com.example.backupstorage.notify.NotificationManager;
import com.example.backupstorage.storage.MultiStorageProvider;
import com.example.backupstorage.storage.ProviderBackedBackupManager;
import com.example.backupstorage.storage.StorageProviderFactory;
import com.example.backupstorage.tasks.MonitorTaskScheduler;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entrada headless: carrega a configuração, monta os providers, o monitor e as notificações
 * e roda o ciclo do monitor até o shutdown.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        new Main().run();
    }

    public void run() throws Exception {
        AppConfig config = AppConfig.load();
        log.info("Configuração carregada: {}", config);
        Clock clock = Clock.systemUTC();

        StorageProviderFactory factory = new StorageProviderFactory();
        MultiStorageProvider storage = factory.createMulti(config.storageConfigs(), config.replicationTimeout());
        log.info("Storage pronto: providers={} primário={}", storage.providers().size(), storage.primary().name());

        BackupManager backups = new ProviderBackedBackupManager(storage, Duration.ofMinutes(2));
        StorageMonitor monitor = new StorageMonitor(backups, config.quotaSettings(), clock,
                storage.primary().type(), storage, Duration.ofSeconds(30));
        NotificationManager notifications = new NotificationManager(config.notificationConfig(), clock);
        MonitorTaskScheduler scheduler = new MonitorTaskScheduler(monitor, notifications, clock, config.monitorInterval());
        scheduler.start();

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            shutdown(scheduler, notifications, storage);
            latch.countDown();
        }));

        log.info("Monitor de armazenamento headless iniciado.");
        latch.await();
    }

    private void shutdown(AutoCloseable... closeables) {
        for (AutoCloseable closeable : closeables) {
            if (closeable == null) continue;
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Falha ao encerrar {}: {}", closeable.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
