package com.example.backupstorage.monitor;

import com.example.backupstorage.backup.Backup.BackupFilter;
import com.example.backupstorage.backup.Backup.BackupManager;
import com.example.backupstorage.backup.Backup.BackupMetadata;
import com.example.backupstorage.backup.Backup.CompressionType;
import com.example.backupstorage.common.OperationCancelledException;
import com.example.backupstorage.common.OperationContext;
import com.example.backupstorage.monitor.Reports.AgeBreakdown;
import com.example.backupstorage.monitor.Reports.AgeGroupUsage;
import com.example.backupstorage.monitor.Reports.AlgorithmStats;
import com.example.backupstorage.monitor.Reports.BackupFrequencyTrend;
import com.example.backupstorage.monitor.Reports.BackupSummary;
import com.example.backupstorage.monitor.Reports.CompressionAnalysis;
import com.example.backupstorage.monitor.Reports.CompressionDirection;
import com.example.backupstorage.monitor.Reports.CompressionTrend;
import com.example.backupstorage.monitor.Reports.ConnectivityTest;
import com.example.backupstorage.monitor.Reports.DatabaseQuota;
import com.example.backupstorage.monitor.Reports.DatabaseStorageDetail;
import com.example.backupstorage.monitor.Reports.DatabaseTrend;
import com.example.backupstorage.monitor.Reports.DatabaseUsage;
import com.example.backupstorage.monitor.Reports.DuplicateGroup;
import com.example.backupstorage.monitor.Reports.DuplicationAnalysis;
import com.example.backupstorage.monitor.Reports.GrowthInfo;
import com.example.backupstorage.monitor.Reports.HealthIssue;
import com.example.backupstorage.monitor.Reports.HealthLevel;
import com.example.backupstorage.monitor.Reports.HealthReport;
import com.example.backupstorage.monitor.Reports.HealthSummary;
import com.example.backupstorage.monitor.Reports.OptimizationReport;
import com.example.backupstorage.monitor.Reports.PerformanceMetrics;
import com.example.backupstorage.monitor.Reports.Priority;
import com.example.backupstorage.monitor.Reports.ProviderHealth;
import com.example.backupstorage.monitor.Reports.ProviderQuota;
import com.example.backupstorage.monitor.Reports.ProviderUsage;
import com.example.backupstorage.monitor.Reports.QuotaStatus;
import com.example.backupstorage.monitor.Reports.QuotaWarning;
import com.example.backupstorage.monitor.Reports.Recommendation;
import com.example.backupstorage.monitor.Reports.RetentionAnalysis;
import com.example.backupstorage.monitor.Reports.RetentionRecommendation;
import com.example.backupstorage.monitor.Reports.TrendDirection;
import com.example.backupstorage.monitor.Reports.TrendReport;
import com.example.backupstorage.monitor.Reports.UsagePrediction;
import com.example.backupstorage.monitor.Reports.UsageReport;
import com.example.backupstorage.notify.Notifications.Alert;
import com.example.backupstorage.notify.Notifications.AlertSeverity;
import com.example.backupstorage.notify.Notifications.AlertType;
import com.example.backupstorage.storage.MultiStorageProvider;
import com.example.backupstorage.storage.Storage.HealthCheckResult;
import com.example.backupstorage.storage.Storage.HealthStatus;
import com.example.backupstorage.storage.Storage.ProviderType;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Métricas de uso, quota, otimização, saúde e tendência derivadas da listagem do BackupManager.
 *
 * <p>Tudo é recalculado a cada chamada a partir de um único snapshot da listagem e do "agora" do Clock
 * injetado; sem estado mutável compartilhado, pode ser chamado de várias threads.
 */
public final class StorageMonitor {

    private static final Logger log = LoggerFactory.getLogger(StorageMonitor.class);

    static final Duration DAILY = Duration.ofHours(24);
    static final Duration WEEKLY = Duration.ofDays(7);
    static final Duration MONTHLY = Duration.ofDays(30);
    static final Duration RETENTION_AGE = Duration.ofDays(90);
    static final long HIGH_USAGE_BYTES = 10L * 1024 * 1024 * 1024;
    private static final double MILLIS_PER_DAY = 86_400_000.0;
    private static final String PROBE_TARGET = "catalog";

    /** Falha ao obter a listagem; nenhum relatório parcial é produzido. */
    public static class MonitorException extends IOException {
        private static final long serialVersionUID = 1L;

        public MonitorException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private final BackupManager backupManager;
    private final QuotaSettings quotas;
    private final Clock clock;
    private final ProviderType defaultProvider;
    private final MultiStorageProvider storage;
    private final Duration healthTimeout;

    public StorageMonitor(BackupManager backupManager, QuotaSettings quotas, Clock clock) {
        this(backupManager, quotas, clock, ProviderType.LOCAL, null, Duration.ofSeconds(30));
    }

    /**
     * @param storage opcional; quando presente, o health check de cada provider entra no relatório de saúde
     */
    public StorageMonitor(BackupManager backupManager,
                          QuotaSettings quotas,
                          Clock clock,
                          ProviderType defaultProvider,
                          MultiStorageProvider storage,
                          Duration healthTimeout) {
        this.backupManager = Objects.requireNonNull(backupManager, "backupManager");
        this.quotas = quotas != null ? quotas : QuotaSettings.disabled();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultProvider = defaultProvider != null ? defaultProvider : ProviderType.LOCAL;
        this.storage = storage;
        this.healthTimeout = healthTimeout != null ? healthTimeout : Duration.ofSeconds(30);
    }

    // ---- Uso -------------------------------------------------------------------

    public UsageReport getStorageUsage() throws MonitorException {
        Instant now = clock.instant();
        return usageOf(listAll("uso de armazenamento"), now);
    }

    public Map<String, DatabaseStorageDetail> getStorageUsageByDatabase() throws MonitorException {
        Instant now = clock.instant();
        List<BackupMetadata> backups = listAll("uso por banco");

        Map<String, List<BackupMetadata>> byDatabase = new TreeMap<>();
        for (BackupMetadata b : backups) {
            byDatabase.computeIfAbsent(b.databaseName(), k -> new ArrayList<>()).add(b);
        }

        Map<String, DatabaseStorageDetail> result = new TreeMap<>();
        for (Map.Entry<String, List<BackupMetadata>> entry : byDatabase.entrySet()) {
            List<BackupMetadata> list = entry.getValue();
            long total = 0;
            long compressed = 0;
            Instant oldest = null;
            Instant newest = null;
            Map<String, Integer> statusCounts = new TreeMap<>();
            Map<String, Integer> ageCounts = new TreeMap<>();
            for (BackupMetadata b : list) {
                total += b.size();
                compressed += b.compressedSize();
                oldest = oldest == null || b.createdAt().isBefore(oldest) ? b.createdAt() : oldest;
                newest = newest == null || b.createdAt().isAfter(newest) ? b.createdAt() : newest;
                statusCounts.merge(b.status().wire(), 1, Integer::sum);
                ageCounts.merge(ageBucket(b, now), 1, Integer::sum);
            }
            GrowthInfo growth = null;
            if (list.size() >= 2 && newest.isAfter(oldest)) {
                double elapsedDays = Duration.between(oldest, newest).toMillis() / MILLIS_PER_DAY;
                long daily = (long) (total / elapsedDays);
                growth = new GrowthInfo(daily, daily * 7, daily * 30);
            }
            result.put(entry.getKey(), new DatabaseStorageDetail(entry.getKey(), list.size(), total, compressed,
                    ratio(compressed, total), oldest, newest, statusCounts, ageCounts, growth));
        }
        return result;
    }

    UsageReport usageOf(List<BackupMetadata> backups, Instant now) {
        long total = 0;
        long compressed = 0;
        BackupMetadata largest = null;
        BackupMetadata smallest = null;
        Map<String, long[]> providers = new TreeMap<>();
        Map<String, List<BackupMetadata>> databases = new TreeMap<>();
        long[][] ages = new long[4][2];

        for (BackupMetadata b : backups) {
            total += b.size();
            compressed += b.compressedSize();
            if (largest == null || b.size() > largest.size()) largest = b;
            if (smallest == null || b.size() < smallest.size()) smallest = b;

            long[] p = providers.computeIfAbsent(providerOf(b), k -> new long[3]);
            p[0]++;
            p[1] += b.size();
            p[2] += b.compressedSize();

            databases.computeIfAbsent(b.databaseName(), k -> new ArrayList<>()).add(b);

            int bucket = ageIndex(b, now);
            ages[bucket][0]++;
            ages[bucket][1] += b.size();
        }

        Map<String, ProviderUsage> byProvider = new TreeMap<>();
        providers.forEach((name, p) -> byProvider.put(name,
                new ProviderUsage(name, (int) p[0], p[1], p[2], ratio(p[2], p[1]))));

        Map<String, DatabaseUsage> byDatabase = new TreeMap<>();
        databases.forEach((name, list) -> {
            long size = list.stream().mapToLong(BackupMetadata::size).sum();
            long comp = list.stream().mapToLong(BackupMetadata::compressedSize).sum();
            Instant oldest = list.stream().map(BackupMetadata::createdAt).min(Comparator.naturalOrder()).orElse(null);
            Instant newest = list.stream().map(BackupMetadata::createdAt).max(Comparator.naturalOrder()).orElse(null);
            byDatabase.put(name, new DatabaseUsage(name, list.size(), size, comp, ratio(comp, size), oldest, newest));
        });

        AgeBreakdown age = new AgeBreakdown(
                new AgeGroupUsage((int) ages[0][0], ages[0][1]),
                new AgeGroupUsage((int) ages[1][0], ages[1][1]),
                new AgeGroupUsage((int) ages[2][0], ages[2][1]),
                new AgeGroupUsage((int) ages[3][0], ages[3][1]));

        return new UsageReport(backups.size(), total, compressed, ratio(compressed, total),
                backups.isEmpty() ? 0 : total / backups.size(),
                summary(largest), summary(smallest), byProvider, byDatabase, age, now);
    }

    // ---- Quotas ----------------------------------------------------------------

    public QuotaStatus checkStorageQuotas() throws MonitorException {
        Instant now = clock.instant();
        return quotaOf(listAll("verificação de quotas"), now);
    }

    QuotaStatus quotaOf(List<BackupMetadata> backups, Instant now) {
        UsageReport usage = usageOf(backups, now);
        long used = usage.totalSize();
        if (!quotas.enabled()) {
            return new QuotaStatus(false, 0, used, 0, 0.0, false, Map.of(), Map.of(), List.of(), null, now);
        }

        List<QuotaWarning> warnings = new ArrayList<>();

        Map<String, DatabaseQuota> databaseQuotas = new TreeMap<>();
        quotas.databaseQuotas().forEach((db, quota) -> {
            if (quota <= 0) return;
            DatabaseUsage du = usage.storageByDatabase().get(db);
            long dbUsed = du != null ? du.totalSize() : 0;
            double pct = percentage(dbUsed, quota);
            databaseQuotas.put(db, new DatabaseQuota(db, quota, dbUsed, Math.max(0, quota - dbUsed), pct, dbUsed > quota));
            if (pct >= 90.0) {
                warnings.add(warning("database", db, dbUsed, quota, pct,
                        String.format(Locale.ROOT, "Database %s is using %.1f%% of its storage quota", db, pct)));
            }
        });

        Map<String, ProviderQuota> providerQuotas = new TreeMap<>();
        quotas.providerQuotas().forEach((provider, quota) -> {
            if (quota <= 0) return;
            ProviderUsage pu = usage.storageByProvider().get(provider.tag());
            long pUsed = pu != null ? pu.totalSize() : 0;
            double pct = percentage(pUsed, quota);
            providerQuotas.put(provider.tag(), new ProviderQuota(provider.tag(), quota, pUsed,
                    Math.max(0, quota - pUsed), pct, pUsed > quota));
            if (pct >= 85.0) {
                warnings.add(warning("provider", provider.tag(), pUsed, quota, pct,
                        String.format(Locale.ROOT, "Provider %s is using %.1f%% of its storage quota", provider.tag(), pct)));
            }
        });

        long totalQuota = quotas.totalQuota();
        long available = 0;
        double pct = 0.0;
        boolean exceeded = false;
        Duration timeToFull = null;
        if (totalQuota > 0) {
            available = Math.max(0, totalQuota - used);
            pct = percentage(used, totalQuota);
            exceeded = used > totalQuota;
            if (pct >= 80.0) {
                warnings.add(warning("total", "total", used, totalQuota, pct,
                        String.format(Locale.ROOT, "Total storage usage is at %.1f%% of quota", pct)));
            }
            if (available > 0) {
                double rate = trendsOf(backups, MONTHLY, now).growthRatePerDay();
                if (rate > 0) {
                    timeToFull = daysToDuration(available / rate);
                }
            }
        }
        return new QuotaStatus(true, totalQuota, used, available, pct, exceeded, databaseQuotas, providerQuotas,
                warnings, timeToFull, now);
    }

    private static QuotaWarning warning(String type, String target, long used, long quota, double pct, String message) {
        AlertSeverity severity = pct >= 95.0 ? AlertSeverity.CRITICAL : AlertSeverity.WARNING;
        return new QuotaWarning(type, target, used, quota, pct, severity, message, quotaRecommendation(pct));
    }

    static String quotaRecommendation(double pct) {
        if (pct >= 95.0) return "Immediate action required: Clean up old backups or increase quota";
        if (pct >= 90.0) return "Review retention policies and clean up old backups";
        if (pct >= 85.0) return "Monitor usage closely and consider cleanup";
        return "Monitor usage trends";
    }

    // ---- Otimização ------------------------------------------------------------

    public OptimizationReport getStorageOptimizationRecommendations() throws MonitorException {
        Instant now = clock.instant();
        return optimizationOf(listAll("recomendações de otimização"), now);
    }

    OptimizationReport optimizationOf(List<BackupMetadata> backups, Instant now) {
        CompressionAnalysis compression = analyzeCompression(backups);
        RetentionAnalysis retention = analyzeRetention(backups, now);
        DuplicationAnalysis duplication = analyzeDuplication(backups);

        List<Recommendation> recommendations = new ArrayList<>();
        if (!compression.uncompressedBackups().isEmpty()) {
            recommendations.add(new Recommendation("compression", Priority.HIGH,
                    String.format(Locale.ROOT, "Enable compression for %d uncompressed backups", compression.uncompressedBackups().size()),
                    "Enable compression in backup configuration", "low", "immediate", compression.potentialSavings()));
        }
        if (!retention.eligibleForCleanup().isEmpty()) {
            recommendations.add(new Recommendation("retention", Priority.MEDIUM,
                    String.format(Locale.ROOT, "Clean up %d old backups eligible for removal", retention.eligibleForCleanup().size()),
                    "Apply retention policies or manually delete old backups", "low", "immediate", retention.potentialSavings()));
        }
        if (!duplication.duplicateGroups().isEmpty()) {
            recommendations.add(new Recommendation("deduplication", Priority.LOW,
                    String.format(Locale.ROOT, "Implement deduplication to save %d bytes from duplicate backups", duplication.potentialSavings()),
                    "Implement backup deduplication system", "medium", "long", duplication.potentialSavings()));
        }
        // as técnicas se sobrepõem; o total é um teto
        long totalSavings = recommendations.stream().mapToLong(Recommendation::estimatedSavings).sum();
        return new OptimizationReport(compression, retention, duplication, recommendations, totalSavings, now);
    }

    private CompressionAnalysis analyzeCompression(List<BackupMetadata> backups) {
        List<String> uncompressed = new ArrayList<>();
        List<String> poorly = new ArrayList<>();
        Map<String, long[]> algorithms = new TreeMap<>();
        long uncompressedSize = 0;
        double ratioSum = 0;
        int ratioCount = 0;
        int compressedCount = 0;

        for (BackupMetadata b : backups) {
            long[] stats = algorithms.computeIfAbsent(b.compressionType().wire(), k -> new long[3]);
            stats[0]++;
            stats[1] += b.size();
            stats[2] += b.compressedSize();
            if (b.compressionType() == CompressionType.NONE) {
                uncompressed.add(b.id());
                uncompressedSize += b.size();
                continue;
            }
            compressedCount++;
            if (b.size() > 0) {
                double r = b.compressionRatio();
                ratioSum += r;
                ratioCount++;
                if (r > 0.9) {
                    poorly.add(b.id());
                }
            }
        }

        Map<String, AlgorithmStats> byAlgorithm = new TreeMap<>();
        String recommended = CompressionType.GZIP.wire();
        double best = Double.MAX_VALUE;
        for (Map.Entry<String, long[]> e : algorithms.entrySet()) {
            long[] s = e.getValue();
            double avg = ratio(s[2], s[1]);
            byAlgorithm.put(e.getKey(), new AlgorithmStats((int) s[0], s[1], s[2], avg));
            if (!e.getKey().equals(CompressionType.NONE.wire()) && s[1] > 0 && avg < best) {
                best = avg;
                recommended = e.getKey();
            }
        }
        return new CompressionAnalysis(backups.size(), compressedCount, uncompressed, poorly,
                ratioCount > 0 ? ratioSum / ratioCount : 0.0, byAlgorithm, recommended, Math.round(uncompressedSize * 0.3));
    }

    private RetentionAnalysis analyzeRetention(List<BackupMetadata> backups, Instant now) {
        Instant cutoff = now.minus(RETENTION_AGE);
        List<String> eligible = new ArrayList<>();
        long savings = 0;
        Map<String, long[]> perDatabase = new TreeMap<>();
        for (BackupMetadata b : backups) {
            if (b.createdAt().isBefore(cutoff)) {
                eligible.add(b.id());
                savings += b.size();
                long[] d = perDatabase.computeIfAbsent(b.databaseName(), k -> new long[2]);
                d[0]++;
                d[1] += b.size();
            }
        }
        List<RetentionRecommendation> perDb = new ArrayList<>();
        perDatabase.forEach((db, d) -> perDb.add(new RetentionRecommendation(db, (int) d[0], d[1],
                String.format(Locale.ROOT, "Apply a %d-day retention policy to remove %d backups", RETENTION_AGE.toDays(), d[0]))));
        double effectiveness = backups.isEmpty() ? 1.0 : 1.0 - (double) eligible.size() / backups.size();
        return new RetentionAnalysis(backups.size(), eligible, savings, effectiveness, perDb);
    }

    private DuplicationAnalysis analyzeDuplication(List<BackupMetadata> backups) {
        Map<String, List<BackupMetadata>> byChecksum = new LinkedHashMap<>();
        for (BackupMetadata b : backups) {
            if (b.checksum() != null && !b.checksum().isBlank()) {
                byChecksum.computeIfAbsent(b.checksum(), k -> new ArrayList<>()).add(b);
            }
        }
        List<DuplicateGroup> groups = new ArrayList<>();
        long savings = 0;
        for (Map.Entry<String, List<BackupMetadata>> e : byChecksum.entrySet()) {
            List<BackupMetadata> group = e.getValue();
            if (group.size() < 2) {
                continue;
            }
            long total = group.stream().mapToLong(BackupMetadata::size).sum();
            long groupSavings = total - group.get(0).size();
            savings += groupSavings;
            groups.add(new DuplicateGroup(e.getKey(), group.stream().map(BackupMetadata::id).toList(),
                    group.size(), total, groupSavings));
        }
        List<String> recommendations = groups.isEmpty() ? List.of() : List.of(
                "Consider implementing backup deduplication",
                "Review backup creation processes to avoid duplicates",
                "Implement content-based deduplication at storage level");
        return new DuplicationAnalysis(groups, savings, recommendations);
    }

    // ---- Saúde -----------------------------------------------------------------

    /**
     * Sonda a listagem, incorpora avisos de quota e achados de otimização e, se houver storage
     * ligado, o health check de cada provider. Falha da sonda vira saúde crítica, não exceção.
     */
    public HealthReport monitorStorageHealthWithDetails() {
        Instant now = clock.instant();
        HealthLevel overall = HealthLevel.HEALTHY;
        Map<String, ProviderHealth> providerHealth = new LinkedHashMap<>();
        List<ConnectivityTest> tests = new ArrayList<>();
        List<HealthIssue> issues = new ArrayList<>();

        long started = System.nanoTime();
        List<BackupMetadata> backups;
        try {
            backups = backupManager.listBackups(BackupFilter.all());
        } catch (IOException | RuntimeException e) {
            Duration latency = Duration.ofNanos(System.nanoTime() - started);
            String error = message(e);
            log.warn("Sonda de conectividade do catálogo falhou: {}", error);
            providerHealth.put(PROBE_TARGET, new ProviderHealth(PROBE_TARGET, HealthLevel.CRITICAL, latency, 1.0, error, now));
            tests.add(new ConnectivityTest(PROBE_TARGET, "list", false, latency, error));
            issues.add(new HealthIssue("connectivity", AlertSeverity.CRITICAL,
                    "Storage provider connectivity failed: " + error,
                    "Backup operations may fail",
                    "Check storage provider configuration and connectivity"));
            overall = HealthLevel.CRITICAL;
            overall = overall.worst(checkProviders(providerHealth, tests, issues, now));
            return new HealthReport(overall, providerHealth, tests, new PerformanceMetrics(latency, 0, 0), issues, now);
        }
        Duration latency = Duration.ofNanos(System.nanoTime() - started);
        providerHealth.put(PROBE_TARGET, new ProviderHealth(PROBE_TARGET, HealthLevel.HEALTHY, latency, 0.0, null, now));
        tests.add(new ConnectivityTest(PROBE_TARGET, "list", true, latency, null));

        QuotaStatus quota = quotaOf(backups, now);
        for (QuotaWarning w : quota.warnings()) {
            issues.add(new HealthIssue("quota", w.severity(), w.message(),
                    "Storage operations may be limited or fail", w.recommendedAction()));
            overall = overall.worst(w.severity() == AlertSeverity.CRITICAL ? HealthLevel.CRITICAL : HealthLevel.WARNING);
        }

        OptimizationReport optimization = optimizationOf(backups, now);
        for (Recommendation r : optimization.recommendations()) {
            if (r.priority() == Priority.HIGH) {
                // informativo: não altera a saúde geral
                issues.add(new HealthIssue("performance", AlertSeverity.INFO, r.description(),
                        "Storage efficiency could be improved", r.action()));
            }
        }

        overall = overall.worst(checkProviders(providerHealth, tests, issues, now));
        long total = backups.stream().mapToLong(BackupMetadata::size).sum();
        return new HealthReport(overall, providerHealth, tests, new PerformanceMetrics(latency, backups.size(), total),
                issues, now);
    }

    /** Health check dos providers do storage ligado; devolve o nível a ser combinado com o geral. */
    private HealthLevel checkProviders(Map<String, ProviderHealth> providerHealth, List<ConnectivityTest> tests,
                                       List<HealthIssue> issues, Instant now) {
        if (storage == null) {
            return HealthLevel.HEALTHY;
        }
        long started = System.nanoTime();
        Map<String, HealthCheckResult> results;
        try {
            results = storage.checkHealth(OperationContext.withTimeout(healthTimeout, clock));
        } catch (OperationCancelledException e) {
            log.warn("Health check dos providers não concluiu: {}", e.getMessage());
            issues.add(new HealthIssue("connectivity", AlertSeverity.WARNING,
                    "Provider health check did not complete: " + e.getMessage(),
                    "Provider availability is unknown",
                    "Check storage provider latency and network connectivity"));
            return HealthLevel.WARNING;
        }
        Duration latency = Duration.ofNanos(System.nanoTime() - started);
        int applicable = 0;
        int failed = 0;
        List<String> failedNames = new ArrayList<>();
        for (Map.Entry<String, HealthCheckResult> e : results.entrySet()) {
            HealthCheckResult r = e.getValue();
            if (r.status() == HealthStatus.NOT_APPLICABLE) {
                continue;
            }
            applicable++;
            boolean ok = r.status() == HealthStatus.HEALTHY;
            if (!ok) {
                failed++;
                failedNames.add(e.getKey());
            }
            providerHealth.put(e.getKey(), new ProviderHealth(e.getKey(), ok ? HealthLevel.HEALTHY : HealthLevel.CRITICAL,
                    latency, ok ? 0.0 : 1.0, r.error(), now));
            tests.add(new ConnectivityTest(e.getKey(), "health_check", ok, latency, r.error()));
        }
        if (failed == 0) {
            return HealthLevel.HEALTHY;
        }
        boolean allFailed = failed == applicable;
        AlertSeverity severity = allFailed ? AlertSeverity.CRITICAL : AlertSeverity.WARNING;
        issues.add(new HealthIssue("connectivity", severity,
                "Storage provider health check failed: " + String.join(", ", failedNames),
                allFailed ? "Backup operations may fail" : "Backup redundancy is reduced",
                "Check storage provider configuration and connectivity"));
        return allFailed ? HealthLevel.CRITICAL : HealthLevel.WARNING;
    }

    public HealthSummary getStorageHealthSummary() {
        HealthReport report = monitorStorageHealthWithDetails();
        int critical = 0;
        int warning = 0;
        Set<String> actions = new LinkedHashSet<>();
        for (HealthIssue issue : report.issues()) {
            if (issue.severity() == AlertSeverity.CRITICAL) {
                critical++;
            } else if (issue.severity() == AlertSeverity.WARNING) {
                warning++;
            } else {
                continue;
            }
            if (issue.resolution() != null && !issue.resolution().isBlank()) {
                actions.add(issue.resolution());
            }
        }
        List<String> top = actions.stream().limit(5).toList();
        return new HealthSummary(report.overallHealth(), critical, warning, top, report.checkedAt());
    }

    // ---- Tendências ------------------------------------------------------------

    public TrendReport getStorageTrends(Duration period) throws MonitorException {
        Objects.requireNonNull(period, "period");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Período de tendência deve ser positivo: " + period);
        }
        Instant now = clock.instant();
        return trendsOf(listAll("tendências de armazenamento"), period, now);
    }

    TrendReport trendsOf(List<BackupMetadata> all, Duration period, Instant now) {
        Instant start = now.minus(period);
        List<BackupMetadata> window = new ArrayList<>();
        for (BackupMetadata b : all) {
            if (!b.createdAt().isBefore(start) && !b.createdAt().isAfter(now)) {
                window.add(b);
            }
        }
        window.sort(Comparator.comparing(BackupMetadata::createdAt).thenComparing(BackupMetadata::id));

        long growth = window.stream().mapToLong(BackupMetadata::size).sum();
        double periodDays = period.toMillis() / MILLIS_PER_DAY;
        double rate = periodDays > 0 ? growth / periodDays : 0.0;

        Map<String, List<BackupMetadata>> byDatabase = new TreeMap<>();
        for (BackupMetadata b : window) {
            byDatabase.computeIfAbsent(b.databaseName(), k -> new ArrayList<>()).add(b);
        }
        Map<String, DatabaseTrend> databaseTrends = new TreeMap<>();
        byDatabase.forEach((db, list) -> databaseTrends.put(db, databaseTrend(db, list)));

        return new TrendReport(period, start, now, window.size(), growth, rate, databaseTrends,
                frequencyTrend(window, period, periodDays, now), compressionTrend(window),
                prediction(all, rate), now);
    }

    private static DatabaseTrend databaseTrend(String db, List<BackupMetadata> ordered) {
        int half = ordered.size() / 2;
        long first = 0;
        long second = 0;
        for (int i = 0; i < ordered.size(); i++) {
            if (i < half) first += ordered.get(i).size();
            else second += ordered.get(i).size();
        }
        TrendDirection trend;
        if (ordered.size() < 2) {
            trend = TrendDirection.INSUFFICIENT_DATA;
        } else if (first == 0) {
            trend = second > 0 ? TrendDirection.INCREASING : TrendDirection.STABLE;
        } else if (second > first * 1.1) {
            trend = TrendDirection.INCREASING;
        } else if (second < first * 0.9) {
            trend = TrendDirection.DECREASING;
        } else {
            trend = TrendDirection.STABLE;
        }
        return new DatabaseTrend(db, ordered.size(), first + second, first, second, trend);
    }

    private static BackupFrequencyTrend frequencyTrend(List<BackupMetadata> window, Duration period, double days, Instant now) {
        int n = window.size();
        double daily = days > 0 ? n / days : 0.0;
        double weekly = days > 0 ? n / (days / 7.0) : 0.0;
        double monthly = days > 0 ? n / (days / 30.0) : 0.0;
        TrendDirection trend = TrendDirection.INSUFFICIENT_DATA;
        if (days >= 14) {
            Instant mid = now.minus(period.dividedBy(2));
            int before = 0;
            for (BackupMetadata b : window) {
                if (b.createdAt().isBefore(mid)) before++;
            }
            int after = n - before;
            if (before == 0) {
                trend = after > 0 ? TrendDirection.INCREASING : TrendDirection.STABLE;
            } else if (after > before * 1.2) {
                trend = TrendDirection.INCREASING;
            } else if (after < before * 0.8) {
                trend = TrendDirection.DECREASING;
            } else {
                trend = TrendDirection.STABLE;
            }
        }
        return new BackupFrequencyTrend(daily, weekly, monthly, trend);
    }

    private static CompressionTrend compressionTrend(List<BackupMetadata> window) {
        Map<String, Integer> usage = new TreeMap<>();
        for (BackupMetadata b : window) {
            usage.merge(b.compressionType().wire(), 1, Integer::sum);
        }
        double average = aggregateRatio(window);
        if (window.size() < 4) {
            return new CompressionTrend(CompressionDirection.INSUFFICIENT_DATA, average, 0.0, 0.0, usage);
        }
        int quarter = window.size() / 4;
        double first = aggregateRatio(window.subList(0, quarter));
        double last = aggregateRatio(window.subList(window.size() - quarter, window.size()));
        CompressionDirection trend;
        if (last < first * 0.95) {
            trend = CompressionDirection.IMPROVING;
        } else if (last > first * 1.05) {
            trend = CompressionDirection.DEGRADING;
        } else {
            trend = CompressionDirection.STABLE;
        }
        return new CompressionTrend(trend, average, first, last, usage);
    }

    private UsagePrediction prediction(List<BackupMetadata> all, double ratePerDay) {
        long current = all.stream().mapToLong(BackupMetadata::size).sum();
        double confidence = all.size() >= 10 ? 0.8 : all.size() >= 5 ? 0.6 : 0.5;
        if (ratePerDay <= 0) {
            return new UsagePrediction(current, 0, 0, 0, null, confidence);
        }
        Duration timeToQuota = null;
        if (quotas.enabled() && quotas.totalQuota() > 0) {
            long remaining = quotas.totalQuota() - current;
            timeToQuota = remaining > 0 ? daysToDuration(remaining / ratePerDay) : Duration.ZERO;
        }
        return new UsagePrediction(current,
                current + Math.round(ratePerDay * 30),
                current + Math.round(ratePerDay * 90),
                current + Math.round(ratePerDay * 365),
                timeToQuota, confidence);
    }

    // ---- Alertas ---------------------------------------------------------------

    public List<Alert> generateStorageAlerts() throws MonitorException {
        Instant now = clock.instant();
        List<BackupMetadata> backups = listAll("geração de alertas");
        UsageReport usage = usageOf(backups, now);
        long epoch = now.getEpochSecond();
        List<Alert> alerts = new ArrayList<>();

        if (usage.totalSize() > HIGH_USAGE_BYTES) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("total_size", usage.totalSize());
            metadata.put("actions", List.of("Review retention policies", "Enable compression", "Clean up old backups"));
            alerts.add(new Alert("storage-usage-" + epoch, AlertType.STORAGE_QUOTA, AlertSeverity.WARNING,
                    "High Storage Usage",
                    String.format(Locale.ROOT, "Total backup storage usage is %.2f GiB", usage.totalSize() / (1024.0 * 1024 * 1024)),
                    now, metadata));
        }
        if (usage.compressionRatio() > 0.8) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("compression_ratio", usage.compressionRatio());
            metadata.put("actions", List.of("Review compression algorithm", "Check backup content types"));
            alerts.add(new Alert("compression-" + epoch, AlertType.PERFORMANCE, AlertSeverity.INFO,
                    "Poor Compression Efficiency",
                    String.format(Locale.ROOT, "Overall compression ratio is %.2f", usage.compressionRatio()),
                    now, metadata));
        }
        if (quotas.enabled()) {
            for (QuotaWarning w : quotaOf(backups, now).warnings()) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("target", w.target());
                metadata.put("usage_percentage", w.usagePercentage());
                metadata.put("actions", List.of(w.recommendedAction()));
                alerts.add(new Alert("quota-" + w.type() + "-" + w.target() + "-" + epoch, AlertType.STORAGE_QUOTA,
                        w.severity(), "Storage Quota Warning", w.message(), now, metadata));
            }
        }
        return alerts;
    }

    // ---- Helpers ---------------------------------------------------------------

    private List<BackupMetadata> listAll(String operation) throws MonitorException {
        try {
            return backupManager.listBackups(BackupFilter.all());
        } catch (IOException | RuntimeException e) {
            throw new MonitorException("Falha ao listar backups para " + operation + ": " + message(e), e);
        }
    }

    private String providerOf(BackupMetadata b) {
        return ProviderType.fromLocation(b.storageLocation(), defaultProvider).tag();
    }

    private static int ageIndex(BackupMetadata b, Instant now) {
        Duration age = Duration.between(b.createdAt(), now);
        if (age.compareTo(DAILY) <= 0) return 0;
        if (age.compareTo(WEEKLY) <= 0) return 1;
        if (age.compareTo(MONTHLY) <= 0) return 2;
        return 3;
    }

    private static String ageBucket(BackupMetadata b, Instant now) {
        switch (ageIndex(b, now)) {
            case 0: return "daily";
            case 1: return "weekly";
            case 2: return "monthly";
            default: return "older";
        }
    }

    private static double aggregateRatio(List<BackupMetadata> backups) {
        long size = 0;
        long compressed = 0;
        for (BackupMetadata b : backups) {
            size += b.size();
            compressed += b.compressedSize();
        }
        return ratio(compressed, size);
    }

    static double ratio(long compressed, long size) {
        return size > 0 ? (double) compressed / size : 0.0;
    }

    private static double percentage(long used, long quota) {
        return quota > 0 ? used * 100.0 / quota : 0.0;
    }

    private static Duration daysToDuration(double days) {
        return Duration.ofSeconds(Math.round(days * 86_400));
    }

    private static BackupSummary summary(BackupMetadata b) {
        return b == null ? null : new BackupSummary(b.id(), b.databaseName(), b.size(), b.createdAt());
    }

    private static String message(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
