package com.example.backupstorage.notify;

import com.example.backupstorage.common.Json;
import com.example.backupstorage.common.OperationCancelledException;
import com.example.backupstorage.common.OperationContext;
import com.example.backupstorage.notify.Notifications.EmailConfig;
import com.example.backupstorage.notify.Notifications.FileConfig;
import com.example.backupstorage.notify.Notifications.FileFormat;
import com.example.backupstorage.notify.Notifications.NotificationMessage;
import com.example.backupstorage.notify.Notifications.SlackConfig;
import com.example.backupstorage.notify.Notifications.TeamsConfig;
import com.example.backupstorage.notify.Notifications.WebhookConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Canais de entrega de alertas: contrato comum e as implementações Email, Webhook, Slack, Teams e File.
 *
 * <p>Um canal sem os campos obrigatórios se declara desabilitado e é ignorado pelo NotificationManager.
 * Falhas de entrega viram {@link DeliveryException}; prazo/cancelamento vira {@link OperationCancelledException}.
 */
public final class Channels {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private Channels() {}

    public interface NotificationChannel {
        String type();

        boolean isEnabled();

        void send(NotificationMessage message, OperationContext ctx) throws IOException;
    }

    /** Falha de um canal específico; isolada dos demais canais. */
    public static class DeliveryException extends IOException {
        private static final long serialVersionUID = 1L;

        private final String channelType;

        public DeliveryException(String channelType, String message) {
            super(message);
            this.channelType = channelType;
        }

        public DeliveryException(String channelType, String message, Throwable cause) {
            super(message, cause);
            this.channelType = channelType;
        }

        public String channelType() {
            return channelType;
        }
    }

    /** OkHttpClient padrão dos canais HTTP; o prazo de cada envio é aplicado por chamada. */
    public static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
                .callTimeout(DEFAULT_TIMEOUT)
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(DEFAULT_TIMEOUT)
                .writeTimeout(DEFAULT_TIMEOUT)
                .build();
    }

    // ---- HTTP ------------------------------------------------------------------

    /**
     * Base dos canais que entregam JSON por HTTP. O timeout da chamada é o menor entre o configurado
     * e o restante do prazo do contexto; cancelar o contexto aborta a chamada em curso.
     */
    abstract static class HttpChannel implements NotificationChannel {

        protected final OkHttpClient httpClient;
        protected final ObjectMapper mapper = Json.mapper();

        HttpChannel(OkHttpClient httpClient) {
            this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        }

        protected abstract String url();

        protected abstract ObjectNode payload(NotificationMessage message);

        protected String method() {
            return "POST";
        }

        protected Map<String, String> headers() {
            return Map.of();
        }

        protected Duration timeout() {
            return DEFAULT_TIMEOUT;
        }

        @Override
        public void send(NotificationMessage message, OperationContext ctx) throws IOException {
            Objects.requireNonNull(message, "message");
            if (!isEnabled()) {
                throw new DeliveryException(type(), "Canal " + type() + " não configurado");
            }
            String operation = "envio " + type();
            ctx.ensureActive(operation);

            String body;
            try {
                body = mapper.writeValueAsString(payload(message));
            } catch (JsonProcessingException e) {
                throw new DeliveryException(type(), "Falha ao serializar payload " + type(), e);
            }

            Request request;
            try {
                Request.Builder builder = new Request.Builder()
                        .url(url())
                        .header("Content-Type", "application/json")
                        .method(method(), RequestBody.create(body, JSON));
                headers().forEach(builder::header);
                request = builder.build();
            } catch (IllegalArgumentException e) {
                throw new DeliveryException(type(), "Destino inválido para o canal " + type() + ": " + e.getMessage(), e);
            }

            Duration bound = timeout();
            Duration remaining = ctx.remaining().orElse(bound);
            if (remaining.compareTo(bound) < 0) {
                bound = remaining;
            }
            if (bound.toMillis() < 1) {
                bound = Duration.ofMillis(1);
            }
            Call call = httpClient.newBuilder().callTimeout(bound).build().newCall(request);

            try (OperationContext.Registration ignored = ctx.onCancel(call::cancel);
                 Response response = call.execute()) {
                if (!response.isSuccessful()) {
                    ResponseBody rb = response.body();
                    String detail = rb != null ? truncate(rb.string()) : "";
                    throw new DeliveryException(type(), type() + " retornou HTTP " + response.code()
                            + (detail.isEmpty() ? "" : " - " + detail));
                }
            } catch (DeliveryException e) {
                throw e;
            } catch (IOException e) {
                IOException classified = ctx.classify(operation, e);
                if (classified instanceof OperationCancelledException) {
                    throw classified;
                }
                throw new DeliveryException(type(), "Falha ao entregar notificação via " + type() + ": " + e.getMessage(), e);
            }
        }

        private static String truncate(String s) {
            return s.length() > 200 ? s.substring(0, 200) + "..." : s;
        }
    }

    /** POST (ou PUT/PATCH) do NotificationMessage como JSON para uma URL arbitrária. */
    public static final class WebhookChannel extends HttpChannel {
        private final WebhookConfig config;

        public WebhookChannel(WebhookConfig config) {
            this(config, defaultClient());
        }

        public WebhookChannel(WebhookConfig config, OkHttpClient httpClient) {
            super(httpClient);
            this.config = Objects.requireNonNull(config, "config");
        }

        @Override public String type() { return "webhook"; }

        @Override public boolean isEnabled() { return config.isEnabled(); }

        @Override protected String url() { return config.url(); }

        @Override protected String method() { return config.method(); }

        @Override protected Map<String, String> headers() { return config.headers(); }

        @Override protected Duration timeout() { return config.timeout(); }

        @Override
        protected ObjectNode payload(NotificationMessage message) {
            return mapper.valueToTree(message);
        }
    }

    public static final class SlackChannel extends HttpChannel {
        private final SlackConfig config;

        public SlackChannel(SlackConfig config) {
            this(config, defaultClient());
        }

        public SlackChannel(SlackConfig config, OkHttpClient httpClient) {
            super(httpClient);
            this.config = Objects.requireNonNull(config, "config");
        }

        @Override public String type() { return "slack"; }

        @Override public boolean isEnabled() { return config.isEnabled(); }

        @Override protected String url() { return config.webhookUrl(); }

        @Override
        protected ObjectNode payload(NotificationMessage message) {
            ObjectNode root = mapper.createObjectNode();
            root.put("text", message.icon() + " " + message.title());
            ObjectNode attachment = root.putArray("attachments").addObject();
            attachment.put("color", message.color());
            attachment.put("title", message.title());
            attachment.put("text", message.message());
            attachment.put("ts", message.timestamp().getEpochSecond());
            ArrayNode fields = attachment.putArray("fields");
            field(fields, "Alert ID", message.alertId());
            field(fields, "Type", message.alertType().wire());
            field(fields, "Severity", message.severity().wire());
            if (notBlank(config.channel())) root.put("channel", config.channel());
            if (notBlank(config.username())) root.put("username", config.username());
            if (notBlank(config.iconEmoji())) root.put("icon_emoji", config.iconEmoji());
            return root;
        }

        private static void field(ArrayNode fields, String title, String value) {
            fields.addObject().put("title", title).put("value", value).put("short", true);
        }
    }

    /** Cartão MessageCard para webhooks de entrada do Teams. */
    public static final class TeamsChannel extends HttpChannel {
        private final TeamsConfig config;

        public TeamsChannel(TeamsConfig config) {
            this(config, defaultClient());
        }

        public TeamsChannel(TeamsConfig config, OkHttpClient httpClient) {
            super(httpClient);
            this.config = Objects.requireNonNull(config, "config");
        }

        @Override public String type() { return "teams"; }

        @Override public boolean isEnabled() { return config.isEnabled(); }

        @Override protected String url() { return config.webhookUrl(); }

        @Override
        protected ObjectNode payload(NotificationMessage message) {
            ObjectNode root = mapper.createObjectNode();
            root.put("@type", "MessageCard");
            root.put("@context", "http://schema.org/extensions");
            root.put("summary", message.title());
            root.put("themeColor", message.color().startsWith("#") ? message.color().substring(1) : message.color());
            ObjectNode section = root.putArray("sections").addObject();
            section.put("activityTitle", message.title());
            section.put("activitySubtitle", "Alert ID: " + message.alertId());
            section.put("text", message.message());
            ArrayNode facts = section.putArray("facts");
            facts.addObject().put("name", "Type").put("value", message.alertType().wire());
            facts.addObject().put("name", "Severity").put("value", message.severity().wire());
            facts.addObject().put("name", "Time").put("value", DateTimeFormatter.ISO_INSTANT.format(message.timestamp()));
            return root;
        }
    }

    // ---- Email -----------------------------------------------------------------

    /** Envio SMTP propriamente dito; separado para permitir troca em testes. */
    @FunctionalInterface
    public interface MailTransport {
        void send(EmailConfig config, String subject, String body, Duration timeout) throws IOException;
    }

    /** MailTransport sobre Jakarta Mail (implementação Angus). */
    public static final class JakartaMailTransport implements MailTransport {

        @Override
        public void send(EmailConfig config, String subject, String body, Duration timeout) throws IOException {
            Properties props = new Properties();
            props.put("mail.smtp.host", config.smtpHost());
            props.put("mail.smtp.port", String.valueOf(config.smtpPort()));
            props.put("mail.smtp.starttls.enable", String.valueOf(config.useTls()));
            String millis = String.valueOf(Math.max(1, timeout.toMillis()));
            props.put("mail.smtp.connectiontimeout", millis);
            props.put("mail.smtp.timeout", millis);
            props.put("mail.smtp.writetimeout", millis);

            boolean auth = notBlank(config.username());
            props.put("mail.smtp.auth", String.valueOf(auth));
            Session session = auth
                    ? Session.getInstance(props, new Authenticator() {
                        @Override
                        protected PasswordAuthentication getPasswordAuthentication() {
                            return new PasswordAuthentication(config.username(), config.password());
                        }
                    })
                    : Session.getInstance(props);

            try {
                MimeMessage mail = new MimeMessage(session);
                mail.setFrom(new InternetAddress(config.from()));
                for (String to : config.to()) {
                    mail.addRecipient(Message.RecipientType.TO, new InternetAddress(to));
                }
                mail.setSubject(subject, StandardCharsets.UTF_8.name());
                mail.setText(body, StandardCharsets.UTF_8.name());
                Transport.send(mail);
            } catch (MessagingException e) {
                throw new IOException("Falha SMTP em " + config.smtpHost() + ":" + config.smtpPort() + ": " + e.getMessage(), e);
            }
        }
    }

    public static final class EmailChannel implements NotificationChannel {
        private final EmailConfig config;
        private final MailTransport transport;

        public EmailChannel(EmailConfig config) {
            this(config, new JakartaMailTransport());
        }

        public EmailChannel(EmailConfig config, MailTransport transport) {
            this.config = Objects.requireNonNull(config, "config");
            this.transport = Objects.requireNonNull(transport, "transport");
        }

        @Override public String type() { return "email"; }

        @Override public boolean isEnabled() { return config.isEnabled(); }

        @Override
        public void send(NotificationMessage message, OperationContext ctx) throws IOException {
            if (!isEnabled()) {
                throw new DeliveryException(type(), "Configuração de e-mail incompleta");
            }
            ctx.ensureActive("envio email");
            Duration timeout = ctx.remaining().filter(r -> r.compareTo(DEFAULT_TIMEOUT) < 0).orElse(DEFAULT_TIMEOUT);
            try {
                transport.send(config, subject(message), body(message), timeout);
            } catch (IOException e) {
                IOException classified = ctx.classify("envio email", e);
                if (classified instanceof OperationCancelledException) {
                    throw classified;
                }
                throw new DeliveryException(type(), "Falha ao enviar e-mail: " + e.getMessage(), e);
            }
        }

        String subject(NotificationMessage message) {
            return notBlank(config.subject()) ? config.subject() : "Backup System Alert: " + message.title();
        }

        static String body(NotificationMessage message) {
            return "Backup System Alert\n\n"
                    + "Alert ID: " + message.alertId() + "\n"
                    + "Type: " + message.alertType().wire() + "\n"
                    + "Severity: " + message.severity().wire() + "\n"
                    + "Time: " + DateTimeFormatter.ISO_INSTANT.format(message.timestamp()) + "\n\n"
                    + message.title() + "\n\n"
                    + "Details:\n"
                    + message.message() + "\n\n"
                    + "This is an automated message from the backup storage system.\n";
        }
    }

    // ---- Arquivo ---------------------------------------------------------------

    /**
     * Log local só de acréscimo, um registro por alerta: linha legível ou um objeto JSON por linha.
     */
    public static final class FileChannel implements NotificationChannel {
        private final FileConfig config;
        private final ObjectMapper mapper = Json.mapper();

        public FileChannel(FileConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        @Override public String type() { return "file"; }

        @Override public boolean isEnabled() { return config.isEnabled(); }

        @Override
        public void send(NotificationMessage message, OperationContext ctx) throws IOException {
            if (!isEnabled()) {
                throw new DeliveryException(type(), "Caminho do arquivo de notificações não configurado");
            }
            ctx.ensureActive("envio file");
            String line = config.format() == FileFormat.JSON ? mapper.writeValueAsString(message) : textLine(message);
            Path path = Path.of(config.path());
            synchronized (this) {
                try {
                    Path parent = path.toAbsolutePath().getParent();
                    if (parent != null) {
                        Files.createDirectories(parent);
                    }
                    try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                            StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                        w.write(line);
                        w.write('\n');
                    }
                } catch (IOException e) {
                    throw new DeliveryException(type(), "Falha ao gravar notificação em " + path + ": " + e.getMessage(), e);
                }
            }
        }

        static String textLine(NotificationMessage message) {
            return message.severity().wire().toUpperCase(Locale.ROOT) + ": " + message.title()
                    + " — " + message.message() + " [" + message.alertType().wire() + "]";
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
