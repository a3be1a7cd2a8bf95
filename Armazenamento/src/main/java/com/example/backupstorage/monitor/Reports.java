package com.example.backupstorage.monitor;

import com.example.backupstorage.notify.Notifications.AlertSeverity;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Relatórios expostos pelo StorageMonitor. Todos são snapshots somente-leitura,
 * serializáveis em JSON (snake_case) e reconstruíveis a partir dele.
 */
public final class Reports {

    private Reports() {}

    // ---- Enums de classificação -----------------------------------------------

    public enum HealthLevel {
        HEALTHY("healthy"),
        WARNING("warning"),
        CRITICAL("critical");

        private final String wire;

        HealthLevel(String wire) { this.wire = wire; }

        @JsonValue
        public String wire() { return wire; }

        /** O pior dos dois; nunca rebaixa. */
        public HealthLevel worst(HealthLevel other) {
            return other.ordinal() > ordinal() ? other : this;
        }

        @JsonCreator
        public static HealthLevel fromWire(String raw) {
            for (HealthLevel h : values()) {
                if (h.wire.equalsIgnoreCase(raw)) return h;
            }
            throw new IllegalArgumentException("Nível de saúde desconhecido: " + raw);
        }
    }

    public enum Priority {
        HIGH("high"),
        MEDIUM("medium"),
        LOW("low");

        private final String wire;

        Priority(String wire) { this.wire = wire; }

        @JsonValue
        public String wire() { return wire; }

        @JsonCreator
        public static Priority fromWire(String raw) {
            for (Priority p : values()) {
                if (p.wire.equalsIgnoreCase(raw)) return p;
            }
            throw new IllegalArgumentException("Prioridade desconhecida: " + raw);
        }
    }

    public enum TrendDirection {
        INCREASING("increasing"),
        DECREASING("decreasing"),
        STABLE("stable"),
        INSUFFICIENT_DATA("insufficient-data");

        private final String wire;

        TrendDirection(String wire) { this.wire = wire; }

        @JsonValue
        public String wire() { return wire; }

        @JsonCreator
        public static TrendDirection fromWire(String raw) {
            for (TrendDirection t : values()) {
                if (t.wire.equalsIgnoreCase(raw)) return t;
            }
            throw new IllegalArgumentException("Tendência desconhecida: " + raw);
        }
    }

    public enum CompressionDirection {
        IMPROVING("improving"),
        STABLE("stable"),
        DEGRADING("degrading"),
        INSUFFICIENT_DATA("insufficient-data");

        private final String wire;

        CompressionDirection(String wire) { this.wire = wire; }

        @JsonValue
        public String wire() { return wire; }

        @JsonCreator
        public static CompressionDirection fromWire(String raw) {
            for (CompressionDirection c : values()) {
                if (c.wire.equalsIgnoreCase(raw)) return c;
            }
            throw new IllegalArgumentException("Tendência de compressão desconhecida: " + raw);
        }
    }

    // ---- Uso -------------------------------------------------------------------

    public record BackupSummary(@JsonProperty("id") String id,
                                @JsonProperty("database_name") String databaseName,
                                @JsonProperty("size") long size,
                                @JsonProperty("created_at") Instant createdAt) {}

    public record ProviderUsage(@JsonProperty("provider") String provider,
                                @JsonProperty("backup_count") int backupCount,
                                @JsonProperty("total_size") long totalSize,
                                @JsonProperty("compressed_size") long compressedSize,
                                @JsonProperty("compression_ratio") double compressionRatio) {}

    public record DatabaseUsage(@JsonProperty("database_name") String databaseName,
                                @JsonProperty("backup_count") int backupCount,
                                @JsonProperty("total_size") long totalSize,
                                @JsonProperty("compressed_size") long compressedSize,
                                @JsonProperty("compression_ratio") double compressionRatio,
                                @JsonProperty("oldest_backup") Instant oldestBackup,
                                @JsonProperty("newest_backup") Instant newestBackup) {}

    public record AgeGroupUsage(@JsonProperty("backup_count") int backupCount,
                                @JsonProperty("total_size") long totalSize) {}

    /** Partição por idade: diário ≤24h, semanal ≤7d, mensal ≤30d, o resto é antigo. */
    public record AgeBreakdown(@JsonProperty("daily") AgeGroupUsage daily,
                               @JsonProperty("weekly") AgeGroupUsage weekly,
                               @JsonProperty("monthly") AgeGroupUsage monthly,
                               @JsonProperty("older") AgeGroupUsage older) {

        @JsonIgnore
        public int totalCount() {
            return daily.backupCount() + weekly.backupCount() + monthly.backupCount() + older.backupCount();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record UsageReport(@JsonProperty("total_backups") int totalBackups,
                              @JsonProperty("total_size") long totalSize,
                              @JsonProperty("total_compressed_size") long totalCompressedSize,
                              @JsonProperty("compression_ratio") double compressionRatio,
                              @JsonProperty("average_backup_size") long averageBackupSize,
                              @JsonProperty("largest_backup") BackupSummary largestBackup,
                              @JsonProperty("smallest_backup") BackupSummary smallestBackup,
                              @JsonProperty("storage_by_provider") Map<String, ProviderUsage> storageByProvider,
                              @JsonProperty("storage_by_database") Map<String, DatabaseUsage> storageByDatabase,
                              @JsonProperty("storage_by_age") AgeBreakdown storageByAge,
                              @JsonProperty("generated_at") Instant generatedAt) {}

    public record GrowthInfo(@JsonProperty("daily_growth") long dailyGrowth,
                             @JsonProperty("weekly_growth") long weeklyGrowth,
                             @JsonProperty("monthly_growth") long monthlyGrowth) {}

    /** Detalhe por banco: histogramas de status e idade e crescimento estimado (nulo com menos de 2 backups). */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DatabaseStorageDetail(@JsonProperty("database_name") String databaseName,
                                        @JsonProperty("backup_count") int backupCount,
                                        @JsonProperty("total_size") long totalSize,
                                        @JsonProperty("compressed_size") long compressedSize,
                                        @JsonProperty("compression_ratio") double compressionRatio,
                                        @JsonProperty("oldest_backup") Instant oldestBackup,
                                        @JsonProperty("newest_backup") Instant newestBackup,
                                        @JsonProperty("status_counts") Map<String, Integer> statusCounts,
                                        @JsonProperty("age_counts") Map<String, Integer> ageCounts,
                                        @JsonProperty("growth") GrowthInfo growth) {}

    // ---- Quotas ----------------------------------------------------------------

    public record DatabaseQuota(@JsonProperty("database_name") String databaseName,
                                @JsonProperty("quota") long quota,
                                @JsonProperty("used") long used,
                                @JsonProperty("available") long available,
                                @JsonProperty("usage_percentage") double usagePercentage,
                                @JsonProperty("exceeded") boolean exceeded) {}

    public record ProviderQuota(@JsonProperty("provider") String provider,
                                @JsonProperty("quota") long quota,
                                @JsonProperty("used") long used,
                                @JsonProperty("available") long available,
                                @JsonProperty("usage_percentage") double usagePercentage,
                                @JsonProperty("exceeded") boolean exceeded) {}

    public record QuotaWarning(@JsonProperty("type") String type,
                               @JsonProperty("target") String target,
                               @JsonProperty("current_usage") long currentUsage,
                               @JsonProperty("quota") long quota,
                               @JsonProperty("usage_percentage") double usagePercentage,
                               @JsonProperty("severity") AlertSeverity severity,
                               @JsonProperty("message") String message,
                               @JsonProperty("recommended_action") String recommendedAction) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record QuotaStatus(@JsonProperty("quota_enabled") boolean quotaEnabled,
                              @JsonProperty("total_quota") long totalQuota,
                              @JsonProperty("used_storage") long usedStorage,
                              @JsonProperty("available_storage") long availableStorage,
                              @JsonProperty("usage_percentage") double usagePercentage,
                              @JsonProperty("quota_exceeded") boolean quotaExceeded,
                              @JsonProperty("database_quotas") Map<String, DatabaseQuota> databaseQuotas,
                              @JsonProperty("provider_quotas") Map<String, ProviderQuota> providerQuotas,
                              @JsonProperty("warnings") List<QuotaWarning> warnings,
                              @JsonProperty("estimated_time_to_full") Duration estimatedTimeToFull,
                              @JsonProperty("generated_at") Instant generatedAt) {}

    // ---- Otimização ------------------------------------------------------------

    public record AlgorithmStats(@JsonProperty("backup_count") int backupCount,
                                 @JsonProperty("total_size") long totalSize,
                                 @JsonProperty("compressed_size") long compressedSize,
                                 @JsonProperty("average_ratio") double averageRatio) {}

    public record CompressionAnalysis(@JsonProperty("total_backups") int totalBackups,
                                      @JsonProperty("compressed_backups") int compressedBackups,
                                      @JsonProperty("uncompressed_backups") List<String> uncompressedBackups,
                                      @JsonProperty("poorly_compressed_backups") List<String> poorlyCompressedBackups,
                                      @JsonProperty("average_compression_ratio") double averageCompressionRatio,
                                      @JsonProperty("by_algorithm") Map<String, AlgorithmStats> byAlgorithm,
                                      @JsonProperty("recommended_algorithm") String recommendedAlgorithm,
                                      @JsonProperty("potential_savings") long potentialSavings) {}

    public record RetentionRecommendation(@JsonProperty("database_name") String databaseName,
                                          @JsonProperty("eligible_backups") int eligibleBackups,
                                          @JsonProperty("potential_savings") long potentialSavings,
                                          @JsonProperty("recommendation") String recommendation) {}

    public record RetentionAnalysis(@JsonProperty("total_backups") int totalBackups,
                                    @JsonProperty("eligible_for_cleanup") List<String> eligibleForCleanup,
                                    @JsonProperty("potential_savings") long potentialSavings,
                                    @JsonProperty("effectiveness") double effectiveness,
                                    @JsonProperty("database_recommendations") List<RetentionRecommendation> databaseRecommendations) {}

    public record DuplicateGroup(@JsonProperty("checksum") String checksum,
                                 @JsonProperty("backup_ids") List<String> backupIds,
                                 @JsonProperty("backup_count") int backupCount,
                                 @JsonProperty("total_size") long totalSize,
                                 @JsonProperty("potential_savings") long potentialSavings) {}

    public record DuplicationAnalysis(@JsonProperty("duplicate_groups") List<DuplicateGroup> duplicateGroups,
                                      @JsonProperty("potential_savings") long potentialSavings,
                                      @JsonProperty("recommendations") List<String> recommendations) {}

    public record Recommendation(@JsonProperty("type") String type,
                                 @JsonProperty("priority") Priority priority,
                                 @JsonProperty("description") String description,
                                 @JsonProperty("action") String action,
                                 @JsonProperty("impact") String impact,
                                 @JsonProperty("implementation_time") String implementationTime,
                                 @JsonProperty("estimated_savings") long estimatedSavings) {}

    /**
     * total_potential_savings soma as três análises; as técnicas se sobrepõem, então o total é um teto otimista.
     */
    public record OptimizationReport(@JsonProperty("compression") CompressionAnalysis compression,
                                     @JsonProperty("retention") RetentionAnalysis retention,
                                     @JsonProperty("duplication") DuplicationAnalysis duplication,
                                     @JsonProperty("recommendations") List<Recommendation> recommendations,
                                     @JsonProperty("total_potential_savings") long totalPotentialSavings,
                                     @JsonProperty("generated_at") Instant generatedAt) {}

    // ---- Saúde -----------------------------------------------------------------

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ProviderHealth(@JsonProperty("provider") String provider,
                                 @JsonProperty("status") HealthLevel status,
                                 @JsonProperty("latency") Duration latency,
                                 @JsonProperty("error_rate") double errorRate,
                                 @JsonProperty("last_error") String lastError,
                                 @JsonProperty("last_checked") Instant lastChecked) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ConnectivityTest(@JsonProperty("target") String target,
                                   @JsonProperty("operation") String operation,
                                   @JsonProperty("success") boolean success,
                                   @JsonProperty("latency") Duration latency,
                                   @JsonProperty("error") String error) {}

    public record PerformanceMetrics(@JsonProperty("probe_latency") Duration probeLatency,
                                     @JsonProperty("backup_count") int backupCount,
                                     @JsonProperty("total_size") long totalSize) {}

    public record HealthIssue(@JsonProperty("type") String type,
                              @JsonProperty("severity") AlertSeverity severity,
                              @JsonProperty("description") String description,
                              @JsonProperty("impact") String impact,
                              @JsonProperty("resolution") String resolution) {}

    public record HealthReport(@JsonProperty("overall_health") HealthLevel overallHealth,
                               @JsonProperty("provider_health") Map<String, ProviderHealth> providerHealth,
                               @JsonProperty("connectivity_tests") List<ConnectivityTest> connectivityTests,
                               @JsonProperty("performance") PerformanceMetrics performance,
                               @JsonProperty("issues") List<HealthIssue> issues,
                               @JsonProperty("checked_at") Instant checkedAt) {}

    public record HealthSummary(@JsonProperty("overall_health") HealthLevel overallHealth,
                                @JsonProperty("critical_issues") int criticalIssues,
                                @JsonProperty("warning_issues") int warningIssues,
                                @JsonProperty("top_recommendations") List<String> topRecommendations,
                                @JsonProperty("checked_at") Instant checkedAt) {}

    // ---- Tendências ------------------------------------------------------------

    public record DatabaseTrend(@JsonProperty("database_name") String databaseName,
                                @JsonProperty("backup_count") int backupCount,
                                @JsonProperty("total_size") long totalSize,
                                @JsonProperty("first_half_size") long firstHalfSize,
                                @JsonProperty("second_half_size") long secondHalfSize,
                                @JsonProperty("trend") TrendDirection trend) {}

    public record BackupFrequencyTrend(@JsonProperty("daily_average") double dailyAverage,
                                       @JsonProperty("weekly_average") double weeklyAverage,
                                       @JsonProperty("monthly_average") double monthlyAverage,
                                       @JsonProperty("trend") TrendDirection trend) {}

    /** averageRatio cobre a janela inteira; os ratios de quartil só existem com 4 ou mais backups. */
    public record CompressionTrend(@JsonProperty("trend") CompressionDirection trend,
                                   @JsonProperty("average_ratio") double averageRatio,
                                   @JsonProperty("first_quarter_ratio") double firstQuarterRatio,
                                   @JsonProperty("last_quarter_ratio") double lastQuarterRatio,
                                   @JsonProperty("algorithm_usage") Map<String, Integer> algorithmUsage) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record UsagePrediction(@JsonProperty("current_usage") long currentUsage,
                                  @JsonProperty("predicted_30_days") long predicted30Days,
                                  @JsonProperty("predicted_90_days") long predicted90Days,
                                  @JsonProperty("predicted_365_days") long predicted365Days,
                                  @JsonProperty("time_to_quota") Duration timeToQuota,
                                  @JsonProperty("confidence") double confidence) {}

    public record TrendReport(@JsonProperty("period") Duration period,
                              @JsonProperty("start") Instant start,
                              @JsonProperty("end") Instant end,
                              @JsonProperty("backup_count") int backupCount,
                              @JsonProperty("storage_growth") long storageGrowth,
                              @JsonProperty("growth_rate_per_day") double growthRatePerDay,
                              @JsonProperty("database_trends") Map<String, DatabaseTrend> databaseTrends,
                              @JsonProperty("frequency") BackupFrequencyTrend frequency,
                              @JsonProperty("compression") CompressionTrend compression,
                              @JsonProperty("prediction") UsagePrediction prediction,
                              @JsonProperty("generated_at") Instant generatedAt) {}
}
