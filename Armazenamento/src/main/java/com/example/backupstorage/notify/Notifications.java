package com.example.backupstorage.notify;

import com.example.backupstorage.config.ConfigValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Tipos de alerta, configuração dos canais e a mensagem neutra entregue a eles.
 */
public final class Notifications {

    private Notifications() {}

    // ---- Alertas -------------------------------------------------------------

    public enum AlertSeverity {
        INFO(1, "info"),
        WARNING(2, "warning"),
        CRITICAL(3, "critical");

        private final int level;
        private final String wire;

        AlertSeverity(int level, String wire) {
            this.level = level;
            this.wire = wire;
        }

        public int level() { return level; }

        @JsonValue
        public String wire() { return wire; }

        public boolean isAtLeast(AlertSeverity other) {
            return level >= other.level;
        }

        @JsonCreator
        public static AlertSeverity fromWire(String raw) {
            String v = Objects.requireNonNull(raw, "raw").trim().toLowerCase(Locale.ROOT);
            for (AlertSeverity s : values()) {
                if (s.wire.equals(v)) {
                    return s;
                }
            }
            throw new IllegalArgumentException("Severidade desconhecida: " + raw);
        }
    }

    public enum AlertType {
        BACKUP_FAILURE("backup-failure"),
        VALIDATION_FAILURE("validation-failure"),
        STORAGE_QUOTA("storage-quota"),
        PERFORMANCE("performance"),
        SYSTEM_HEALTH("system-health"),
        RETENTION_POLICY("retention-policy");

        private final String wire;

        AlertType(String wire) { this.wire = wire; }

        @JsonValue
        public String wire() { return wire; }

        @JsonCreator
        public static AlertType fromWire(String raw) {
            String v = Objects.requireNonNull(raw, "raw").trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (AlertType t : values()) {
                if (t.wire.equals(v)) {
                    return t;
                }
            }
            throw new IllegalArgumentException("Tipo de alerta desconhecido: " + raw);
        }
    }

    /**
     * Aviso estruturado para o operador. Imutável; consumido uma vez pelo NotificationManager.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Alert(@JsonProperty("id") String id,
                        @JsonProperty("type") AlertType type,
                        @JsonProperty("severity") AlertSeverity severity,
                        @JsonProperty("title") String title,
                        @JsonProperty("message") String message,
                        @JsonProperty("timestamp") Instant timestamp,
                        @JsonProperty("metadata") Map<String, Object> metadata) {

        public Alert {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(timestamp, "timestamp");
            title = title == null ? "" : title;
            message = message == null ? "" : message;
            metadata = metadata == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        }

        /** Id no formato &lt;tipo&gt;-&lt;epoch seconds&gt;. */
        public static Alert of(AlertType type, AlertSeverity severity, String title, String message, Instant timestamp) {
            return of(type, severity, title, message, timestamp, Map.of());
        }

        public static Alert of(AlertType type, AlertSeverity severity, String title, String message, Instant timestamp,
                               Map<String, Object> metadata) {
            Objects.requireNonNull(type, "type");
            return new Alert(type.wire() + "-" + timestamp.getEpochSecond(), type, severity, title, message, timestamp, metadata);
        }
    }

    // ---- Filtros e limites -------------------------------------------------

    /**
     * Filtros globais, combinados com AND. minSeverity nulo aceita todas; alertTypes vazio aceita todos.
     */
    public record NotificationFilters(AlertSeverity minSeverity,
                                      Set<AlertType> alertTypes,
                                      Set<AlertType> excludeTypes,
                                      boolean businessHoursOnly,
                                      boolean weekdaysOnly,
                                      ZoneId zone) {

        public NotificationFilters {
            alertTypes = alertTypes == null || alertTypes.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(alertTypes));
            excludeTypes = excludeTypes == null || excludeTypes.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(excludeTypes));
            zone = zone == null ? ZoneOffset.UTC : zone;
        }

        public static NotificationFilters none() {
            return new NotificationFilters(null, null, null, false, false, ZoneOffset.UTC);
        }
    }

    /** Limites de envio; zero desativa o respectivo limite. */
    public record RateLimit(int maxPerHour, int maxPerDay, Duration cooldown) {
        public RateLimit {
            if (maxPerHour < 0 || maxPerDay < 0) {
                throw new ConfigValidationException("rate_limit", "limits must be >= 0");
            }
            cooldown = cooldown == null ? Duration.ZERO : cooldown;
            if (cooldown.isNegative()) {
                throw new ConfigValidationException("rate_limit.cooldown", "cooldown must be >= 0");
            }
        }

        public static RateLimit unlimited() {
            return new RateLimit(0, 0, Duration.ZERO);
        }

        public boolean isUnlimited() {
            return maxPerHour == 0 && maxPerDay == 0 && cooldown.isZero();
        }
    }

    // ---- Configuração dos canais -------------------------------------------

    public record EmailConfig(String smtpHost,
                              int smtpPort,
                              String username,
                              String password,
                              String from,
                              List<String> to,
                              String subject,
                              boolean useTls) {

        public EmailConfig {
            to = to == null ? List.of() : List.copyOf(to);
            if (smtpPort < 0 || smtpPort > 65535) {
                throw new ConfigValidationException("email.smtp_port", "port must be between 0 and 65535");
            }
            smtpPort = smtpPort == 0 ? 587 : smtpPort;
        }

        public boolean isEnabled() {
            return notBlank(smtpHost) && notBlank(from) && !to.isEmpty();
        }

        @Override
        public String toString() {
            return "EmailConfig{host=" + smtpHost + ", port=" + smtpPort + ", from=" + from + ", to=" + to.size()
                    + " destinatários, tls=" + useTls + ", password=" + (password != null ? "set" : "unset") + "}";
        }
    }

    public record WebhookConfig(String url, String method, Map<String, String> headers, Duration timeout) {
        public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

        public WebhookConfig {
            method = method == null || method.isBlank() ? "POST" : method.trim().toUpperCase(Locale.ROOT);
            if (!method.equals("POST") && !method.equals("PUT") && !method.equals("PATCH")) {
                throw new ConfigValidationException("webhook.method", "method must be POST, PUT or PATCH");
            }
            headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
            timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
        }

        public static WebhookConfig of(String url) {
            return new WebhookConfig(url, null, null, null);
        }

        public boolean isEnabled() {
            return notBlank(url);
        }

        @Override
        public String toString() {
            return "WebhookConfig{url=" + (url != null ? "set" : "unset") + ", method=" + method
                    + ", headers=" + headers.keySet() + ", timeout=" + timeout + "}";
        }
    }

    public record SlackConfig(String webhookUrl, String channel, String username, String iconEmoji) {
        public static SlackConfig of(String webhookUrl) {
            return new SlackConfig(webhookUrl, null, null, null);
        }

        public boolean isEnabled() {
            return notBlank(webhookUrl);
        }

        @Override
        public String toString() {
            return "SlackConfig{webhook=" + (webhookUrl != null ? "set" : "unset") + ", channel=" + channel + "}";
        }
    }

    public record TeamsConfig(String webhookUrl) {
        public boolean isEnabled() {
            return notBlank(webhookUrl);
        }

        @Override
        public String toString() {
            return "TeamsConfig{webhook=" + (webhookUrl != null ? "set" : "unset") + "}";
        }
    }

    public enum FileFormat {
        TEXT, JSON;

        public static FileFormat fromWire(String raw) {
            if (raw == null || raw.isBlank()) {
                return TEXT;
            }
            switch (raw.trim().toLowerCase(Locale.ROOT)) {
                case "json": return JSON;
                case "text": return TEXT;
                default: throw new ConfigValidationException("file.format", "format must be 'json' or 'text'");
            }
        }
    }

    public record FileConfig(String path, FileFormat format) {
        public FileConfig {
            format = format == null ? FileFormat.TEXT : format;
        }

        public boolean isEnabled() {
            return notBlank(path);
        }
    }

    /**
     * Configuração completa. Canais nulos ficam ausentes; canais incompletos ficam desabilitados.
     */
    public record NotificationConfig(boolean enabled,
                                     EmailConfig email,
                                     WebhookConfig webhook,
                                     SlackConfig slack,
                                     TeamsConfig teams,
                                     FileConfig file,
                                     NotificationFilters filters,
                                     RateLimit rateLimit) {

        public NotificationConfig {
            filters = filters == null ? NotificationFilters.none() : filters;
            rateLimit = rateLimit == null ? RateLimit.unlimited() : rateLimit;
        }

        public static NotificationConfig disabled() {
            return new NotificationConfig(false, null, null, null, null, null, null, null);
        }
    }

    // ---- Mensagem ------------------------------------------------------------

    /**
     * Renderização neutra de um Alert, construída uma vez e reutilizada por todos os canais.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record NotificationMessage(@JsonProperty("alert_id") String alertId,
                                      @JsonProperty("alert_type") AlertType alertType,
                                      @JsonProperty("title") String title,
                                      @JsonProperty("message") String message,
                                      @JsonProperty("severity") AlertSeverity severity,
                                      @JsonProperty("color") String color,
                                      @JsonProperty("icon") String icon,
                                      @JsonProperty("timestamp") Instant timestamp,
                                      @JsonProperty("metadata") Map<String, Object> metadata) {

        public static NotificationMessage from(Alert alert) {
            return new NotificationMessage(alert.id(), alert.type(), alert.title(), alert.message(), alert.severity(),
                    colorFor(alert.severity()), iconFor(alert.severity()), alert.timestamp(), alert.metadata());
        }

        public static String colorFor(AlertSeverity severity) {
            switch (severity) {
                case CRITICAL: return "#ff0000";
                case WARNING: return "#ff9900";
                default: return "#439fe0";
            }
        }

        public static String iconFor(AlertSeverity severity) {
            switch (severity) {
                case CRITICAL: return ":rotating_light:";
                case WARNING: return ":warning:";
                default: return ":information_source:";
            }
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
