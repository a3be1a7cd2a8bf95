package com.example.backupstorage.notify;

import com.example.backupstorage.common.OperationContext;
import com.example.backupstorage.notify.Channels.DeliveryException;
import com.example.backupstorage.notify.Channels.EmailChannel;
import com.example.backupstorage.notify.Channels.FileChannel;
import com.example.backupstorage.notify.Channels.MailTransport;
import com.example.backupstorage.notify.Channels.NotificationChannel;
import com.example.backupstorage.notify.Channels.SlackChannel;
import com.example.backupstorage.notify.Channels.TeamsChannel;
import com.example.backupstorage.notify.Channels.WebhookChannel;
import com.example.backupstorage.notify.Notifications.Alert;
import com.example.backupstorage.notify.Notifications.AlertType;
import com.example.backupstorage.notify.Notifications.NotificationConfig;
import com.example.backupstorage.notify.Notifications.NotificationFilters;
import com.example.backupstorage.notify.Notifications.NotificationMessage;
import com.example.backupstorage.notify.Notifications.RateLimit;
import java.io.IOException;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filtra, limita e entrega alertas a todos os canais habilitados.
 *
 * <p>Política de falha: a falha de um canal nunca impede os outros. {@link #sendNotification} devolve
 * um {@link DispatchReport} com o resultado de cada canal; {@link DispatchReport#throwIfAllFailed()}
 * só lança quando todos os canais tentados falharam.
 */
public final class NotificationManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NotificationManager.class);

    static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(60);
    private static final int BUSINESS_HOURS_START = 9;
    private static final int BUSINESS_HOURS_END = 17;

    private final NotificationConfig config;
    private final Clock clock;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final List<NotificationChannel> channels;
    private final RateLimiter rateLimiter;

    /** Canais construídos a partir da configuração, com clientes padrão e pool próprio. */
    public NotificationManager(NotificationConfig config, Clock clock) {
        this(config, clock, null, buildChannels(config, Channels.defaultClient(), new Channels.JakartaMailTransport()));
    }

    /**
     * Construtor com canais e executor injetados (útil para testes). Executor nulo cria um pool próprio,
     * encerrado em {@link #close()}.
     */
    public NotificationManager(NotificationConfig config, Clock clock, Executor executor, List<NotificationChannel> channels) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.channels = List.copyOf(Objects.requireNonNull(channels, "channels"));
        if (executor == null) {
            this.ownedExecutor = Executors.newCachedThreadPool(daemonThreads());
            this.executor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
            this.executor = executor;
        }
        this.rateLimiter = new RateLimiter(config.rateLimit());

        for (NotificationChannel channel : this.channels) {
            if (channel.isEnabled()) {
                log.info("Canal de notificação {} habilitado", channel.type());
            } else {
                log.debug("Canal de notificação {} desabilitado: configuração incompleta", channel.type());
            }
        }
    }

    /** Canais na ordem Email, Webhook, Slack, Teams, File; configs nulas não geram canal. */
    public static List<NotificationChannel> buildChannels(NotificationConfig config, OkHttpClient httpClient,
                                                          MailTransport mailTransport) {
        List<NotificationChannel> list = new ArrayList<>();
        if (config.email() != null) list.add(new EmailChannel(config.email(), mailTransport));
        if (config.webhook() != null) list.add(new WebhookChannel(config.webhook(), httpClient));
        if (config.slack() != null) list.add(new SlackChannel(config.slack(), httpClient));
        if (config.teams() != null) list.add(new TeamsChannel(config.teams(), httpClient));
        if (config.file() != null) list.add(new FileChannel(config.file()));
        return list;
    }

    public List<NotificationChannel> channels() {
        return channels;
    }

    public List<NotificationChannel> enabledChannels() {
        return channels.stream().filter(NotificationChannel::isEnabled).toList();
    }

    /**
     * Avalia os filtros globais com semântica AND. Não consome cota de rate limit.
     */
    public boolean shouldNotify(Alert alert) {
        Objects.requireNonNull(alert, "alert");
        NotificationFilters filters = config.filters();

        if (filters.minSeverity() != null && !alert.severity().isAtLeast(filters.minSeverity())) {
            return false;
        }
        if (!filters.alertTypes().isEmpty() && !filters.alertTypes().contains(alert.type())) {
            return false;
        }
        if (filters.excludeTypes().contains(alert.type())) {
            return false;
        }
        ZonedDateTime local = alert.timestamp().atZone(filters.zone());
        if (filters.businessHoursOnly()) {
            int hour = local.getHour();
            if (hour < BUSINESS_HOURS_START || hour >= BUSINESS_HOURS_END) {
                return false;
            }
        }
        if (filters.weekdaysOnly()) {
            DayOfWeek day = local.getDayOfWeek();
            if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
                return false;
            }
        }
        return true;
    }

    public DispatchReport sendNotification(Alert alert) {
        return sendNotification(alert, OperationContext.withTimeout(DEFAULT_SEND_TIMEOUT, clock));
    }

    /**
     * Entrega o alerta a todos os canais habilitados, em paralelo, e aguarda todos terminarem.
     *
     * @throws IllegalArgumentException se o alerta não tiver tipo ou severidade
     */
    public DispatchReport sendNotification(Alert alert, OperationContext ctx) {
        Objects.requireNonNull(alert, "alert");
        Objects.requireNonNull(ctx, "ctx");
        if (alert.type() == null || alert.severity() == null) {
            throw new IllegalArgumentException("Alerta sem tipo ou severidade: " + alert.id());
        }
        if (!config.enabled()) {
            log.debug("Notificações desabilitadas; alerta {} ignorado", alert.id());
            return DispatchReport.skipped(alert.id(), true, false, false);
        }
        if (!shouldNotify(alert)) {
            log.debug("Alerta {} descartado pelos filtros", alert.id());
            return DispatchReport.skipped(alert.id(), false, true, false);
        }
        if (!rateLimiter.tryAcquire(alert.type(), clock.instant())) {
            log.debug("Alerta {} descartado pelo limite de envio", alert.id());
            return DispatchReport.skipped(alert.id(), false, false, true);
        }

        NotificationMessage message = NotificationMessage.from(alert);
        List<NotificationChannel> targets = enabledChannels();
        List<CompletableFuture<ChannelOutcome>> futures = new ArrayList<>(targets.size());
        for (NotificationChannel channel : targets) {
            CompletableFuture<ChannelOutcome> future;
            try {
                future = CompletableFuture.supplyAsync(() -> deliver(channel, message, ctx), executor);
            } catch (RejectedExecutionException e) {
                future = CompletableFuture.completedFuture(ChannelOutcome.failed(channel.type(),
                        new DeliveryException(channel.type(), "Executor recusou o envio", e)));
            }
            futures.add(future);
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

        List<ChannelOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();
        DispatchReport report = new DispatchReport(alert.id(), false, false, false, outcomes);
        if (report.allFailed()) {
            log.error("Alerta {} não foi entregue em nenhum dos {} canais", alert.id(), outcomes.size());
        } else {
            log.info("Alerta {} entregue em {}/{} canais", alert.id(), report.delivered(), outcomes.size());
        }
        return report;
    }

    private static ChannelOutcome deliver(NotificationChannel channel, NotificationMessage message, OperationContext ctx) {
        try {
            channel.send(message, ctx);
            return ChannelOutcome.succeeded(channel.type());
        } catch (IOException e) {
            log.warn("Falha no canal {} para alerta {}: {}", channel.type(), message.alertId(), e.getMessage());
            return ChannelOutcome.failed(channel.type(), e);
        } catch (RuntimeException e) {
            log.warn("Erro inesperado no canal {} para alerta {}", channel.type(), message.alertId(), e);
            return ChannelOutcome.failed(channel.type(),
                    new DeliveryException(channel.type(), "Erro inesperado no canal " + channel.type() + ": " + e.getMessage(), e));
        }
    }

    @Override
    public void close() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdownNow();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Pool de notificações não terminou em 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "notify-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // ---- Resultado -------------------------------------------------------------

    public record ChannelOutcome(String channel, boolean success, IOException error) {
        static ChannelOutcome succeeded(String channel) {
            return new ChannelOutcome(channel, true, null);
        }

        static ChannelOutcome failed(String channel, IOException error) {
            return new ChannelOutcome(channel, false, error);
        }
    }

    /**
     * Resultado de um envio. Sem outcomes quando o alerta foi descartado (desabilitado, filtrado ou limitado)
     * ou quando não há canal habilitado.
     */
    public record DispatchReport(String alertId,
                                 boolean disabled,
                                 boolean filtered,
                                 boolean rateLimited,
                                 List<ChannelOutcome> outcomes) {

        public DispatchReport {
            outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        }

        static DispatchReport skipped(String alertId, boolean disabled, boolean filtered, boolean rateLimited) {
            return new DispatchReport(alertId, disabled, filtered, rateLimited, List.of());
        }

        public boolean attempted() {
            return !outcomes.isEmpty();
        }

        public int delivered() {
            return (int) outcomes.stream().filter(ChannelOutcome::success).count();
        }

        public List<ChannelOutcome> failures() {
            return outcomes.stream().filter(o -> !o.success()).toList();
        }

        public boolean allFailed() {
            return attempted() && delivered() == 0;
        }

        /** Lança quando todos os canais tentados falharam; as falhas individuais vão como suppressed. */
        public void throwIfAllFailed() throws DeliveryException {
            if (!allFailed()) {
                return;
            }
            DeliveryException aggregate = new DeliveryException("all",
                    "Alerta " + alertId + " falhou em todos os " + outcomes.size() + " canais");
            for (ChannelOutcome o : outcomes) {
                if (o.error() != null) {
                    aggregate.addSuppressed(o.error());
                }
            }
            throw aggregate;
        }
    }

    // ---- Rate limit ------------------------------------------------------------

    /** Janelas deslizantes de 1h e 24h mais cooldown por tipo de alerta. */
    static final class RateLimiter {
        private static final Duration HOUR = Duration.ofHours(1);
        private static final Duration DAY = Duration.ofDays(1);

        private final RateLimit limit;
        private final Deque<Instant> sent = new ArrayDeque<>();
        private final Map<AlertType, Instant> lastByType = new EnumMap<>(AlertType.class);

        RateLimiter(RateLimit limit) {
            this.limit = Objects.requireNonNull(limit, "limit");
        }

        synchronized boolean tryAcquire(AlertType type, Instant now) {
            if (limit.isUnlimited()) {
                return true;
            }
            while (!sent.isEmpty() && !sent.peekFirst().isAfter(now.minus(DAY))) {
                sent.pollFirst();
            }
            if (limit.maxPerDay() > 0 && sent.size() >= limit.maxPerDay()) {
                return false;
            }
            if (limit.maxPerHour() > 0) {
                Instant hourAgo = now.minus(HOUR);
                long lastHour = sent.stream().filter(t -> t.isAfter(hourAgo)).count();
                if (lastHour >= limit.maxPerHour()) {
                    return false;
                }
            }
            Instant last = lastByType.get(type);
            if (!limit.cooldown().isZero() && last != null && now.isBefore(last.plus(limit.cooldown()))) {
                return false;
            }
            sent.addLast(now);
            lastByType.put(type, now);
            return true;
        }
    }
}
