package com.example.backupstorage.common;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sinal de prazo/cancelamento passado pelo chamador para toda operação de rede
 * (store/retrieve/delete/list nos providers e send nos canais).
 *
 * <p>Thread-safe: pode ser cancelado de outra thread enquanto a operação roda.
 */
public final class OperationContext {

    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> cancelListeners = new CopyOnWriteArrayList<>();

    private OperationContext(Clock clock, Instant deadline) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.deadline = deadline;
    }

    /** Contexto sem prazo; só termina por cancel(). */
    public static OperationContext none() {
        return new OperationContext(Clock.systemUTC(), null);
    }

    public static OperationContext withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static OperationContext withTimeout(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout negativo: " + timeout);
        }
        return new OperationContext(clock, clock.instant().plus(timeout));
    }

    public static OperationContext withDeadline(Instant deadline, Clock clock) {
        return new OperationContext(clock, Objects.requireNonNull(deadline, "deadline"));
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Tempo restante até o prazo. Vazio quando não há prazo; Duration.ZERO quando já expirou.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public boolean isActive() {
        return !isCancelled() && !isExpired() && !Thread.currentThread().isInterrupted();
    }

    /** Cancela e dispara os listeners uma única vez. */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable listener : cancelListeners) {
                listener.run();
            }
        }
    }

    /** Listener registrado via {@link #onCancel(Runnable)}; close() remove o registro. */
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Registra ação a executar no cancelamento (ex.: abortar uma chamada HTTP em curso).
     * Se o contexto já estiver cancelado, executa imediatamente.
     */
    public Registration onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        cancelListeners.add(listener);
        if (cancelled.get()) {
            listener.run();
        }
        return () -> cancelListeners.remove(listener);
    }

    /** Listeners de cancelamento ainda registrados. */
    public int cancelListenerCount() {
        return cancelListeners.size();
    }

    /**
     * Contexto derivado com prazo no máximo {@code timeout} a partir de agora (nunca além do prazo deste).
     * Cancelar este contexto cancela o filho; cancelar o filho não afeta este.
     */
    public OperationContext child(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        Instant bound = clock.instant().plus(timeout);
        if (deadline != null && deadline.isBefore(bound)) {
            bound = deadline;
        }
        OperationContext child = new OperationContext(clock, bound);
        Registration link = onCancel(child::cancel);
        child.cancelListeners.add(link::close);
        return child;
    }

    /**
     * Lança OperationCancelledException se a operação não deve continuar.
     *
     * @param operation descrição curta usada na mensagem
     */
    public void ensureActive(String operation) throws OperationCancelledException {
        if (cancelled.get()) {
            throw new OperationCancelledException("Operação cancelada: " + operation, false);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new OperationCancelledException("Thread interrompida durante: " + operation, false);
        }
        if (isExpired()) {
            throw new OperationCancelledException("Prazo esgotado durante: " + operation, true);
        }
    }

    /**
     * Traduz uma falha de I/O ocorrida depois do cancelamento/prazo em OperationCancelledException.
     * Retorna o próprio erro quando o contexto ainda está ativo.
     */
    public IOException classify(String operation, IOException failure) {
        if (failure instanceof OperationCancelledException) {
            return failure;
        }
        if (cancelled.get() || Thread.currentThread().isInterrupted()) {
            return new OperationCancelledException("Operação cancelada: " + operation, false, failure);
        }
        if (isExpired()) {
            return new OperationCancelledException("Prazo esgotado durante: " + operation, true, failure);
        }
        return failure;
    }
}
