package com.example.backupstorage.storage;

import com.example.backupstorage.backup.Backup.BackupArtifact;
import com.example.backupstorage.backup.Backup.BackupMetadata;
import com.example.backupstorage.common.OperationCancelledException;
import com.example.backupstorage.common.OperationContext;
import com.example.backupstorage.storage.Storage.HealthCheckResult;
import com.example.backupstorage.storage.Storage.ProviderType;
import com.example.backupstorage.storage.Storage.StorageException;
import com.example.backupstorage.storage.Storage.StorageFilter;
import com.example.backupstorage.storage.Storage.StorageProvider;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compõe N providers em ordem primário/secundários.
 *
 * <ul>
 *   <li>store: grava no primário e replica nos secundários sem falhar por eles; se o primário falhar,
 *       tenta os secundários em ordem.</li>
 *   <li>retrieve: primeiro provider que responder.</li>
 *   <li>delete: sucesso se ao menos um provider apagar.</li>
 *   <li>list/getMetadata: somente o primário.</li>
 * </ul>
 */
public final class MultiStorageProvider implements StorageProvider {

    private static final Logger log = LoggerFactory.getLogger(MultiStorageProvider.class);

    public static final Duration DEFAULT_REPLICATION_TIMEOUT = Duration.ofSeconds(30);

    /** Resultado da réplica em um secundário. */
    public enum ReplicaStatus { SUCCEEDED, FAILED, TIMED_OUT, CANCELLED }

    public record ReplicaOutcome(String provider, ReplicaStatus status, String error) {}

    /**
     * Onde o backup ficou durável e o que aconteceu com cada secundário.
     * failedOver=true quando o primário falhou e um secundário assumiu a gravação.
     */
    public record ReplicationReport(String durableProvider, boolean failedOver, List<ReplicaOutcome> replicas) {
        public ReplicationReport {
            replicas = List.copyOf(replicas);
        }

        public boolean fullyReplicated() {
            return !failedOver && replicas.stream().allMatch(r -> r.status() == ReplicaStatus.SUCCEEDED);
        }
    }

    private volatile List<StorageProvider> providers;
    private final Duration replicationTimeout;
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    public MultiStorageProvider(List<StorageProvider> providers) {
        this(providers, DEFAULT_REPLICATION_TIMEOUT);
    }

    public MultiStorageProvider(List<StorageProvider> providers, Duration replicationTimeout) {
        this(providers, replicationTimeout, null);
    }

    /**
     * @param executor executor da replicação; null cria um pool próprio encerrado em close()
     */
    public MultiStorageProvider(List<StorageProvider> providers, Duration replicationTimeout, Executor executor) {
        Objects.requireNonNull(providers, "providers");
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("MultiStorageProvider exige ao menos um provider");
        }
        Set<String> names = new HashSet<>();
        for (StorageProvider p : providers) {
            Objects.requireNonNull(p, "provider");
            if (!names.add(p.name())) {
                throw new IllegalArgumentException("Nome de provider duplicado: " + p.name());
            }
        }
        this.providers = List.copyOf(providers);
        this.replicationTimeout = replicationTimeout != null ? replicationTimeout : DEFAULT_REPLICATION_TIMEOUT;
        if (executor != null) {
            this.executor = executor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newCachedThreadPool(daemonThreads());
            this.executor = ownedExecutor;
        }
    }

    @Override
    public String name() {
        return "multi";
    }

    @Override
    public ProviderType type() {
        return primary().type();
    }

    public List<StorageProvider> providers() {
        return providers;
    }

    public StorageProvider primary() {
        return providers.get(0);
    }

    /** Promove o provider do índice a primário, mantendo a ordem relativa dos demais. */
    public synchronized void setPrimary(int index) {
        List<StorageProvider> current = providers;
        if (index < 0 || index >= current.size()) {
            throw new IllegalArgumentException("Índice de provider inválido: " + index + " (total " + current.size() + ")");
        }
        List<StorageProvider> reordered = new ArrayList<>(current.size());
        reordered.add(current.get(index));
        for (int i = 0; i < current.size(); i++) {
            if (i != index) {
                reordered.add(current.get(i));
            }
        }
        this.providers = List.copyOf(reordered);
        log.info("Provider primário alterado para {}", reordered.get(0).name());
    }

    @Override
    public void store(BackupArtifact backup, OperationContext ctx) throws IOException {
        storeWithReport(backup, ctx);
    }

    public ReplicationReport storeWithReport(BackupArtifact backup, OperationContext ctx) throws IOException {
        Objects.requireNonNull(backup, "backup");
        List<StorageProvider> chain = providers;
        StorageProvider primary = chain.get(0);
        try {
            primary.store(backup, ctx);
            return new ReplicationReport(primary.name(), false, replicate(chain.subList(1, chain.size()), backup, ctx));
        } catch (OperationCancelledException e) {
            throw e;
        } catch (IOException e) {
            log.warn("Falha no provider primário {} ao gravar backup {}: {}", primary.name(), backup.id(), e.getMessage());
            StorageException aggregate = new StorageException(StorageException.Kind.BACKEND, name(),
                    "Falha ao gravar backup " + backup.id() + " em todos os " + chain.size() + " providers");
            aggregate.addSuppressed(e);
            for (StorageProvider secondary : chain.subList(1, chain.size())) {
                try {
                    secondary.store(backup, ctx);
                    log.warn("Backup {} gravado no secundário {} após falha do primário", backup.id(), secondary.name());
                    return new ReplicationReport(secondary.name(), true, List.of());
                } catch (OperationCancelledException cancelled) {
                    throw cancelled;
                } catch (IOException ex) {
                    log.warn("Falha no provider {} ao gravar backup {}: {}", secondary.name(), backup.id(), ex.getMessage());
                    aggregate.addSuppressed(ex);
                }
            }
            throw aggregate;
        }
    }

    /**
     * Réplica concorrente nos secundários, limitada por replicationTimeout. Cada réplica roda com um
     * contexto filho; o filho de uma réplica que estoura o prazo é cancelado para que ela aborte.
     */
    private List<ReplicaOutcome> replicate(List<StorageProvider> secondaries, BackupArtifact backup, OperationContext ctx) {
        if (secondaries.isEmpty()) {
            return List.of();
        }
        List<OperationContext> contexts = new ArrayList<>(secondaries.size());
        List<CompletableFuture<ReplicaOutcome>> futures = new ArrayList<>(secondaries.size());
        for (StorageProvider secondary : secondaries) {
            OperationContext replicaCtx = ctx.child(replicationTimeout);
            contexts.add(replicaCtx);
            futures.add(CompletableFuture.supplyAsync(() -> replicaStore(secondary, backup, replicaCtx), executor));
        }
        long deadline = System.nanoTime() + replicationTimeout.toNanos();
        List<ReplicaOutcome> outcomes = new ArrayList<>(secondaries.size());
        try {
            for (int i = 0; i < futures.size(); i++) {
                String name = secondaries.get(i).name();
                CompletableFuture<ReplicaOutcome> future = futures.get(i);
                try {
                    long left = Math.max(0L, deadline - System.nanoTime());
                    outcomes.add(future.get(left, TimeUnit.NANOSECONDS));
                } catch (TimeoutException e) {
                    contexts.get(i).cancel();
                    future.cancel(true);
                    log.warn("Réplica do backup {} no provider {} excedeu {}s", backup.id(), name, replicationTimeout.toSeconds());
                    outcomes.add(new ReplicaOutcome(name, ReplicaStatus.TIMED_OUT, "timeout após " + replicationTimeout));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    contexts.get(i).cancel();
                    future.cancel(true);
                    outcomes.add(new ReplicaOutcome(name, ReplicaStatus.CANCELLED, "thread interrompida"));
                } catch (ExecutionException e) {
                    outcomes.add(new ReplicaOutcome(name, ReplicaStatus.FAILED, String.valueOf(e.getCause())));
                }
            }
        } finally {
            // desfaz o vínculo dos filhos com o contexto do chamador
            contexts.forEach(OperationContext::cancel);
        }
        return outcomes;
    }

    private static ReplicaOutcome replicaStore(StorageProvider secondary, BackupArtifact backup, OperationContext ctx) {
        try {
            secondary.store(backup, ctx);
            return new ReplicaOutcome(secondary.name(), ReplicaStatus.SUCCEEDED, null);
        } catch (OperationCancelledException e) {
            log.warn("Réplica do backup {} em {} cancelada: {}", backup.id(), secondary.name(), e.getMessage());
            return new ReplicaOutcome(secondary.name(), ReplicaStatus.CANCELLED, e.getMessage());
        } catch (IOException | RuntimeException e) {
            log.warn("Falha ao replicar backup {} em {}: {}", backup.id(), secondary.name(), e.getMessage());
            return new ReplicaOutcome(secondary.name(), ReplicaStatus.FAILED, e.getMessage());
        }
    }

    @Override
    public BackupArtifact retrieve(String id, OperationContext ctx) throws IOException {
        List<StorageProvider> chain = providers;
        List<IOException> failures = new ArrayList<>();
        for (StorageProvider provider : chain) {
            try {
                return provider.retrieve(id, ctx);
            } catch (OperationCancelledException e) {
                throw e;
            } catch (IOException e) {
                log.debug("Provider {} não entregou backup {}: {}", provider.name(), id, e.getMessage());
                failures.add(e);
            }
        }
        throw aggregate("recuperar", id, failures);
    }

    @Override
    public void delete(String id, OperationContext ctx) throws IOException {
        List<StorageProvider> chain = providers;
        List<IOException> failures = new ArrayList<>();
        int deleted = 0;
        for (StorageProvider provider : chain) {
            try {
                provider.delete(id, ctx);
                deleted++;
            } catch (OperationCancelledException e) {
                throw e;
            } catch (IOException e) {
                log.warn("Falha ao apagar backup {} no provider {}: {}", id, provider.name(), e.getMessage());
                failures.add(e);
            }
        }
        if (deleted == 0) {
            throw aggregate("apagar", id, failures);
        }
    }

    @Override
    public List<BackupMetadata> list(StorageFilter filter, OperationContext ctx) throws IOException {
        return primary().list(filter, ctx);
    }

    @Override
    public BackupMetadata getMetadata(String id, OperationContext ctx) throws IOException {
        return primary().getMetadata(id, ctx);
    }

    @Override
    public boolean supportsHealthCheck() {
        return true;
    }

    /** Falha apenas quando todos os providers aplicáveis falharam. */
    @Override
    public void healthCheck(OperationContext ctx) throws IOException {
        Map<String, HealthCheckResult> results = checkHealth(ctx);
        long applicable = results.values().stream().filter(r -> r.status() != Storage.HealthStatus.NOT_APPLICABLE).count();
        long failed = results.values().stream().filter(r -> r.status() == Storage.HealthStatus.FAILED).count();
        if (applicable > 0 && failed == applicable) {
            throw new StorageException(StorageException.Kind.BACKEND, name(), "Todos os providers falharam no health check: " + results);
        }
    }

    /** Health check por provider; providers sem a capacidade aparecem como NOT_APPLICABLE. */
    public Map<String, HealthCheckResult> checkHealth(OperationContext ctx) throws OperationCancelledException {
        Map<String, HealthCheckResult> results = new LinkedHashMap<>();
        for (StorageProvider provider : providers) {
            if (!provider.supportsHealthCheck()) {
                results.put(provider.name(), HealthCheckResult.notApplicable());
                continue;
            }
            try {
                provider.healthCheck(ctx);
                results.put(provider.name(), HealthCheckResult.healthy());
            } catch (OperationCancelledException e) {
                throw e;
            } catch (IOException | RuntimeException e) {
                log.warn("Health check falhou para provider {}: {}", provider.name(), e.getMessage());
                results.put(provider.name(), HealthCheckResult.failed(e));
            }
        }
        return results;
    }

    @Override
    public Map<String, String> storageInfo() {
        List<StorageProvider> chain = providers;
        Map<String, String> info = new LinkedHashMap<>();
        info.put("provider", name());
        info.put("primary", chain.get(0).name());
        info.put("providers", Integer.toString(chain.size()));
        info.put("replication_timeout_seconds", Long.toString(replicationTimeout.toSeconds()));
        for (StorageProvider p : chain) {
            p.storageInfo().forEach((k, v) -> info.put(p.name() + "." + k, v));
        }
        return info;
    }

    @Override
    public void close() {
        for (StorageProvider provider : providers) {
            try {
                provider.close();
            } catch (Exception e) {
                log.warn("Falha ao fechar provider {}: {}", provider.name(), e.getMessage());
            }
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    private StorageException aggregate(String operation, String id, List<IOException> failures) {
        boolean allMissing = !failures.isEmpty() && failures.stream().allMatch(f ->
                f instanceof StorageException && ((StorageException) f).kind() == StorageException.Kind.NOT_FOUND);
        StorageException aggregate = new StorageException(
                allMissing ? StorageException.Kind.NOT_FOUND : StorageException.Kind.BACKEND, name(),
                "Falha ao " + operation + " backup " + id + " em todos os " + failures.size() + " providers");
        failures.forEach(aggregate::addSuppressed);
        return aggregate;
    }

    private static java.util.concurrent.ThreadFactory daemonThreads() {
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "storage-replica-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
