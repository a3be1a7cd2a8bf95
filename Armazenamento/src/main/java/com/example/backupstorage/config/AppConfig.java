package com.example.backupstorage.config;

import com.example.backupstorage.monitor.QuotaSettings;
import com.example.backupstorage.notify.Notifications.AlertSeverity;
import com.example.backupstorage.notify.Notifications.AlertType;
import com.example.backupstorage.notify.Notifications.EmailConfig;
import com.example.backupstorage.notify.Notifications.FileConfig;
import com.example.backupstorage.notify.Notifications.FileFormat;
import com.example.backupstorage.notify.Notifications.NotificationConfig;
import com.example.backupstorage.notify.Notifications.NotificationFilters;
import com.example.backupstorage.notify.Notifications.RateLimit;
import com.example.backupstorage.notify.Notifications.SlackConfig;
import com.example.backupstorage.notify.Notifications.TeamsConfig;
import com.example.backupstorage.notify.Notifications.WebhookConfig;
import com.example.backupstorage.storage.Storage.ProviderType;
import com.example.backupstorage.storage.StorageConfig;
import com.example.backupstorage.storage.StorageConfig.AzureSettings;
import com.example.backupstorage.storage.StorageConfig.GcsSettings;
import com.example.backupstorage.storage.StorageConfig.LocalSettings;
import com.example.backupstorage.storage.StorageConfig.S3Settings;
import io.github.cdimascio.dotenv.Dotenv;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * AppConfig
 * ----------
 * Carrega as configurações do armazenamento, das quotas e das notificações e monta os records tipados.
 *
 * PRINCÍPIOS:
 * - Precedência previsível: System properties > variáveis de ambiente > .env.
 * - Getters numéricos com limites; valor malformado volta ao padrão.
 * - Valor malformado em lista/mapa falha cedo com ConfigValidationException nomeando a chave.
 * - Sem vazamento de segredos em logs (toString() sanitizado).
 */
public final class AppConfig {

    // ======= ARMAZENAMENTO =======

    /** Lista separada por vírgula (local, s3, azure, gcs). O primeiro é o primário. Padrão "local". */
    public static final String BACKUP_STORAGE_PROVIDERS = "BACKUP_STORAGE_PROVIDERS";
    public static final String LOCAL_STORAGE_DIR = "LOCAL_STORAGE_DIR";
    /** Modo octal do diretório local, ex.: 755. */
    public static final String LOCAL_STORAGE_PERMISSIONS = "LOCAL_STORAGE_PERMISSIONS";

    public static final String AWS_S3_BUCKET = "AWS_S3_BUCKET";
    public static final String AWS_S3_REGION = "AWS_S3_REGION";
    public static final String AWS_S3_PREFIX = "AWS_S3_PREFIX";
    /** Endpoint alternativo do S3 (MinIO, Wasabi etc.). */
    public static final String AWS_S3_ENDPOINT = "AWS_S3_ENDPOINT";
    /** Credenciais AWS opcionais. NÃO logar. */
    public static final String AWS_ACCESS_KEY_ID = "AWS_ACCESS_KEY_ID";
    public static final String AWS_SECRET_ACCESS_KEY = "AWS_SECRET_ACCESS_KEY";
    public static final String AWS_SESSION_TOKEN = "AWS_SESSION_TOKEN";

    public static final String AZURE_STORAGE_ACCOUNT = "AZURE_STORAGE_ACCOUNT";
    /** NÃO logar. */
    public static final String AZURE_STORAGE_KEY = "AZURE_STORAGE_KEY";
    public static final String AZURE_STORAGE_CONTAINER = "AZURE_STORAGE_CONTAINER";

    public static final String GCS_BUCKET = "GCS_BUCKET";
    public static final String GCS_CREDENTIALS_PATH = "GCS_CREDENTIALS_PATH";
    public static final String GCS_PROJECT_ID = "GCS_PROJECT_ID";

    /** Prazo (s) da replicação para os secundários. Limites [1, 600]; padrão 30. */
    public static final String STORAGE_REPLICATION_TIMEOUT_SECONDS = "STORAGE_REPLICATION_TIMEOUT_SECONDS";

    // ======= QUOTAS =======

    public static final String QUOTA_ENABLED = "QUOTA_ENABLED";
    public static final String QUOTA_TOTAL_MB = "QUOTA_TOTAL_MB";
    /** Formato: banco=MB,banco=MB */
    public static final String QUOTA_DATABASES = "QUOTA_DATABASES";
    /** Formato: provider=MB,provider=MB */
    public static final String QUOTA_PROVIDERS = "QUOTA_PROVIDERS";

    // ======= NOTIFICAÇÕES =======

    public static final String NOTIFY_ENABLED = "NOTIFY_ENABLED";
    public static final String NOTIFY_MIN_SEVERITY = "NOTIFY_MIN_SEVERITY";
    public static final String NOTIFY_ALERT_TYPES = "NOTIFY_ALERT_TYPES";
    public static final String NOTIFY_EXCLUDE_TYPES = "NOTIFY_EXCLUDE_TYPES";
    public static final String NOTIFY_BUSINESS_HOURS = "NOTIFY_BUSINESS_HOURS";
    public static final String NOTIFY_WEEKDAYS = "NOTIFY_WEEKDAYS";
    /** Fuso usado pelos filtros de horário; padrão UTC. */
    public static final String NOTIFY_TIMEZONE = "NOTIFY_TIMEZONE";

    public static final String NOTIFY_EMAIL_SMTP_HOST = "NOTIFY_EMAIL_SMTP_HOST";
    public static final String NOTIFY_EMAIL_SMTP_PORT = "NOTIFY_EMAIL_SMTP_PORT";
    public static final String NOTIFY_EMAIL_USERNAME = "NOTIFY_EMAIL_USERNAME";
    /** NÃO logar. */
    public static final String NOTIFY_EMAIL_PASSWORD = "NOTIFY_EMAIL_PASSWORD";
    public static final String NOTIFY_EMAIL_FROM = "NOTIFY_EMAIL_FROM";
    /** Destinatários separados por vírgula. */
    public static final String NOTIFY_EMAIL_TO = "NOTIFY_EMAIL_TO";
    public static final String NOTIFY_EMAIL_SUBJECT = "NOTIFY_EMAIL_SUBJECT";
    public static final String NOTIFY_EMAIL_TLS = "NOTIFY_EMAIL_TLS";

    /** URLs de webhook carregam tokens. NÃO logar. */
    public static final String NOTIFY_WEBHOOK_URL = "NOTIFY_WEBHOOK_URL";
    public static final String NOTIFY_WEBHOOK_METHOD = "NOTIFY_WEBHOOK_METHOD";
    /** Formato: Nome=valor,Nome=valor */
    public static final String NOTIFY_WEBHOOK_HEADERS = "NOTIFY_WEBHOOK_HEADERS";
    public static final String NOTIFY_WEBHOOK_TIMEOUT_SECONDS = "NOTIFY_WEBHOOK_TIMEOUT_SECONDS";

    public static final String NOTIFY_SLACK_WEBHOOK_URL = "NOTIFY_SLACK_WEBHOOK_URL";
    public static final String NOTIFY_SLACK_CHANNEL = "NOTIFY_SLACK_CHANNEL";
    public static final String NOTIFY_SLACK_USERNAME = "NOTIFY_SLACK_USERNAME";
    public static final String NOTIFY_SLACK_ICON_EMOJI = "NOTIFY_SLACK_ICON_EMOJI";

    public static final String NOTIFY_TEAMS_WEBHOOK_URL = "NOTIFY_TEAMS_WEBHOOK_URL";

    public static final String NOTIFY_FILE_PATH = "NOTIFY_FILE_PATH";
    /** "text" (padrão) ou "json". */
    public static final String NOTIFY_FILE_FORMAT = "NOTIFY_FILE_FORMAT";

    public static final String NOTIFY_RATE_MAX_PER_HOUR = "NOTIFY_RATE_MAX_PER_HOUR";
    public static final String NOTIFY_RATE_MAX_PER_DAY = "NOTIFY_RATE_MAX_PER_DAY";
    public static final String NOTIFY_RATE_COOLDOWN_SECONDS = "NOTIFY_RATE_COOLDOWN_SECONDS";

    // ======= AGENDAMENTO =======

    /** Intervalo (s) entre ciclos do monitor. Limites [10, 86400]; padrão 300. */
    public static final String MONITOR_INTERVAL_SECONDS = "MONITOR_INTERVAL_SECONDS";

    private static final long MB = 1024L * 1024L;

    /** Overrides em runtime (ex.: testes). Têm precedência sobre qualquer fonte. */
    private final ConcurrentHashMap<String, String> overrides = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, String> values;

    private AppConfig(Map<String, String> values) {
        this.values = new ConcurrentHashMap<>(values);
    }

    /**
     * Carrega de três fontes, nesta precedência:
     * 1) System properties
     * 2) Variáveis de ambiente
     * 3) Arquivo .env (se existir)
     */
    public static AppConfig load() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        Map<String, String> map = new ConcurrentHashMap<>();
        System.getenv().forEach(map::put);
        System.getProperties().forEach((k, v) -> {
            if (k != null && v != null) {
                map.put(String.valueOf(k), String.valueOf(v));
            }
        });
        dotenv.entries().forEach(e -> map.putIfAbsent(e.getKey(), e.getValue()));
        return new AppConfig(map);
    }

    /** Útil para testes: cria AppConfig a partir de um Map já resolvido. */
    public static AppConfig fromMap(Map<String, String> values) {
        return new AppConfig(values);
    }

    // ======= API BÁSICA =======

    public Optional<String> find(String key) {
        Objects.requireNonNull(key, "key");
        String override = overrides.get(key);
        if (override != null) {
            return Optional.of(override);
        }
        String value = values.get(key);
        return value != null && !value.isBlank() ? Optional.of(value.trim()) : Optional.empty();
    }

    public String getOrDefault(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /** Seta/remove override em runtime. value==null remove. */
    public void override(String key, String value) {
        if (value == null) {
            overrides.remove(key);
        } else {
            overrides.put(key, value);
        }
    }

    // ======= ARMAZENAMENTO =======

    public List<ProviderType> storageProviders() {
        List<ProviderType> result = new ArrayList<>();
        for (String raw : csv(getOrDefault(BACKUP_STORAGE_PROVIDERS, "local"))) {
            ProviderType type;
            try {
                type = ProviderType.fromTag(raw);
            } catch (IllegalArgumentException e) {
                throw new ConfigValidationException(BACKUP_STORAGE_PROVIDERS, "unknown storage provider: " + raw);
            }
            if (!result.contains(type)) {
                result.add(type);
            }
        }
        if (result.isEmpty()) {
            throw new ConfigValidationException(BACKUP_STORAGE_PROVIDERS, "at least one storage provider is required");
        }
        return result;
    }

    /** Uma StorageConfig por provider listado, na mesma ordem. A validação fica com a factory. */
    public List<StorageConfig> storageConfigs() {
        List<StorageConfig> configs = new ArrayList<>();
        for (ProviderType type : storageProviders()) {
            configs.add(storageConfig(type));
        }
        return configs;
    }

    public StorageConfig storageConfig(ProviderType type) {
        switch (type) {
            case LOCAL:
                return StorageConfig.local(new LocalSettings(localStorageDir(), localPermissions()));
            case S3:
                return StorageConfig.s3(new S3Settings(
                        find(AWS_S3_BUCKET).orElse(null),
                        getOrDefault(AWS_S3_REGION, "us-east-1").toLowerCase(Locale.ROOT),
                        find(AWS_S3_PREFIX).orElse(null),
                        find(AWS_S3_ENDPOINT).orElse(null),
                        find(AWS_ACCESS_KEY_ID).orElse(null),
                        find(AWS_SECRET_ACCESS_KEY).orElse(null),
                        find(AWS_SESSION_TOKEN).orElse(null)));
            case AZURE:
                return StorageConfig.azure(new AzureSettings(
                        find(AZURE_STORAGE_ACCOUNT).orElse(null),
                        find(AZURE_STORAGE_KEY).orElse(null),
                        find(AZURE_STORAGE_CONTAINER).orElse(null),
                        null));
            case GCS:
                return StorageConfig.gcs(new GcsSettings(
                        find(GCS_BUCKET).orElse(null),
                        find(GCS_CREDENTIALS_PATH).orElse(null),
                        find(GCS_PROJECT_ID).orElse(null),
                        null));
            default:
                throw new ConfigValidationException(BACKUP_STORAGE_PROVIDERS, "unsupported storage provider: " + type);
        }
    }

    /** Padrão: $HOME/backup-storage */
    public String localStorageDir() {
        return find(LOCAL_STORAGE_DIR)
                .orElseGet(() -> System.getProperty("user.home") + "/backup-storage");
    }

    public int localPermissions() {
        String raw = getOrDefault(LOCAL_STORAGE_PERMISSIONS, "755");
        try {
            return Integer.parseInt(raw, 8);
        } catch (NumberFormatException e) {
            throw new ConfigValidationException(LOCAL_STORAGE_PERMISSIONS, "permissions must be an octal mode, got: " + raw);
        }
    }

    public Duration replicationTimeout() {
        return Duration.ofSeconds(longConfig(STORAGE_REPLICATION_TIMEOUT_SECONDS, 30, 1, 600));
    }

    // ======= QUOTAS =======

    public QuotaSettings quotaSettings() {
        if (!bool(QUOTA_ENABLED, false)) {
            return QuotaSettings.disabled();
        }
        long total = longConfig(QUOTA_TOTAL_MB, 0, 0, Long.MAX_VALUE / MB) * MB;

        Map<String, Long> databases = new LinkedHashMap<>();
        pairs(QUOTA_DATABASES).forEach((db, mb) -> databases.put(db, megabytes(QUOTA_DATABASES, mb)));

        Map<ProviderType, Long> providers = new EnumMap<>(ProviderType.class);
        pairs(QUOTA_PROVIDERS).forEach((tag, mb) -> {
            ProviderType type;
            try {
                type = ProviderType.fromTag(tag);
            } catch (IllegalArgumentException e) {
                throw new ConfigValidationException(QUOTA_PROVIDERS, "unknown storage provider: " + tag);
            }
            providers.put(type, megabytes(QUOTA_PROVIDERS, mb));
        });
        return new QuotaSettings(true, total, databases, providers);
    }

    // ======= NOTIFICAÇÕES =======

    public NotificationConfig notificationConfig() {
        if (!bool(NOTIFY_ENABLED, false)) {
            return NotificationConfig.disabled();
        }
        return new NotificationConfig(true, emailConfig(), webhookConfig(), slackConfig(), teamsConfig(), fileConfig(),
                notificationFilters(), rateLimit());
    }

    public NotificationFilters notificationFilters() {
        AlertSeverity min = null;
        Optional<String> rawMin = find(NOTIFY_MIN_SEVERITY);
        if (rawMin.isPresent()) {
            try {
                min = AlertSeverity.fromWire(rawMin.get());
            } catch (IllegalArgumentException e) {
                throw new ConfigValidationException(NOTIFY_MIN_SEVERITY, "severity must be info, warning or critical");
            }
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(getOrDefault(NOTIFY_TIMEZONE, "UTC"));
        } catch (DateTimeException e) {
            throw new ConfigValidationException(NOTIFY_TIMEZONE, "invalid time zone: " + e.getMessage());
        }
        return new NotificationFilters(min, alertTypes(NOTIFY_ALERT_TYPES), alertTypes(NOTIFY_EXCLUDE_TYPES),
                bool(NOTIFY_BUSINESS_HOURS, false), bool(NOTIFY_WEEKDAYS, false), zone);
    }

    /** Nulo quando nenhuma chave de e-mail foi definida. */
    public EmailConfig emailConfig() {
        if (find(NOTIFY_EMAIL_SMTP_HOST).isEmpty() && find(NOTIFY_EMAIL_TO).isEmpty()) {
            return null;
        }
        return new EmailConfig(
                find(NOTIFY_EMAIL_SMTP_HOST).orElse(null),
                intConfig(NOTIFY_EMAIL_SMTP_PORT, 587, 1, 65535),
                find(NOTIFY_EMAIL_USERNAME).orElse(null),
                find(NOTIFY_EMAIL_PASSWORD).orElse(null),
                find(NOTIFY_EMAIL_FROM).orElse(null),
                csv(getOrDefault(NOTIFY_EMAIL_TO, "")),
                find(NOTIFY_EMAIL_SUBJECT).orElse(null),
                bool(NOTIFY_EMAIL_TLS, true));
    }

    public WebhookConfig webhookConfig() {
        return find(NOTIFY_WEBHOOK_URL)
                .map(url -> new WebhookConfig(url,
                        find(NOTIFY_WEBHOOK_METHOD).orElse(null),
                        pairs(NOTIFY_WEBHOOK_HEADERS),
                        Duration.ofSeconds(longConfig(NOTIFY_WEBHOOK_TIMEOUT_SECONDS, 30, 1, 300))))
                .orElse(null);
    }

    public SlackConfig slackConfig() {
        return find(NOTIFY_SLACK_WEBHOOK_URL)
                .map(url -> new SlackConfig(url,
                        find(NOTIFY_SLACK_CHANNEL).orElse(null),
                        find(NOTIFY_SLACK_USERNAME).orElse(null),
                        find(NOTIFY_SLACK_ICON_EMOJI).orElse(null)))
                .orElse(null);
    }

    public TeamsConfig teamsConfig() {
        return find(NOTIFY_TEAMS_WEBHOOK_URL).map(TeamsConfig::new).orElse(null);
    }

    public FileConfig fileConfig() {
        return find(NOTIFY_FILE_PATH)
                .map(path -> new FileConfig(path, FileFormat.fromWire(find(NOTIFY_FILE_FORMAT).orElse(null))))
                .orElse(null);
    }

    public RateLimit rateLimit() {
        return new RateLimit(
                intConfig(NOTIFY_RATE_MAX_PER_HOUR, 0, 0, 10_000),
                intConfig(NOTIFY_RATE_MAX_PER_DAY, 0, 0, 100_000),
                Duration.ofSeconds(longConfig(NOTIFY_RATE_COOLDOWN_SECONDS, 0, 0, 86_400)));
    }

    public Duration monitorInterval() {
        return Duration.ofSeconds(longConfig(MONITOR_INTERVAL_SECONDS, 300, 10, 86_400));
    }

    // ======= HELPERS TIPADOS =======

    /** "true/1/yes" (case-insensitive) → true; senão, false. */
    public boolean bool(String key, boolean def) {
        String raw = getOrDefault(key, Boolean.toString(def));
        return raw.equalsIgnoreCase("true")
                || raw.equalsIgnoreCase("1")
                || raw.equalsIgnoreCase("yes");
    }

    /** Parser long com faixa [min, max]; se inválido, retorna default. */
    private long longConfig(String key, long def, long min, long max) {
        String raw = getOrDefault(key, Long.toString(def));
        try {
            long v = Long.parseLong(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    private int intConfig(String key, int def, int min, int max) {
        return (int) longConfig(key, def, min, max);
    }

    private static List<String> csv(String raw) {
        List<String> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }

    /** "a=1,b=2" em mapa ordenado; item sem "=" é erro de configuração. */
    private Map<String, String> pairs(String key) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String item : csv(getOrDefault(key, ""))) {
            int eq = item.indexOf('=');
            if (eq <= 0) {
                throw new ConfigValidationException(key, "expected name=value, got: " + item);
            }
            out.put(item.substring(0, eq).trim(), item.substring(eq + 1).trim());
        }
        return out;
    }

    private static long megabytes(String key, String raw) {
        try {
            long mb = Long.parseLong(raw);
            if (mb < 0 || mb > Long.MAX_VALUE / MB) {
                throw new ConfigValidationException(key, "quota out of range: " + raw);
            }
            return mb * MB;
        } catch (NumberFormatException e) {
            throw new ConfigValidationException(key, "quota must be a number of MB, got: " + raw);
        }
    }

    private Set<AlertType> alertTypes(String key) {
        Set<AlertType> out = EnumSet.noneOf(AlertType.class);
        for (String raw : csv(getOrDefault(key, ""))) {
            try {
                out.add(AlertType.fromWire(raw));
            } catch (IllegalArgumentException e) {
                throw new ConfigValidationException(key, "unknown alert type: " + raw);
            }
        }
        return out;
    }

    // ======= LOGGING SEGURO =======

    @Override
    public String toString() {
        String providers = safe(() -> storageProviders().toString());
        String region = safe(() -> find(AWS_S3_REGION).orElse("unset"));
        return "AppConfig{" +
                "providers=" + providers +
                ", localDir=" + safe(this::localStorageDir) +
                ", region=" + region +
                ", awsCreds=" + (find(AWS_ACCESS_KEY_ID).isPresent() ? "set" : "unset") +
                ", azureKey=" + (find(AZURE_STORAGE_KEY).isPresent() ? "set" : "unset") +
                ", quotas=" + bool(QUOTA_ENABLED, false) +
                ", notify=" + bool(NOTIFY_ENABLED, false) +
                ", monitorInterval=" + monitorInterval().getSeconds() + "s" +
                "}";
    }

    /** Não deixa toString() explodir caso um getter lance. */
    private static String safe(Supplier<String> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            return "error:" + e.getClass().getSimpleName();
        }
    }
}
