package com.example.backupstorage.storage;

import com.example.backupstorage.config.ConfigValidationException;
import com.example.backupstorage.storage.Storage.LocalStorageProvider;
import com.example.backupstorage.storage.Storage.ObjectConnector;
import com.example.backupstorage.storage.Storage.ObjectStorageProvider;
import com.example.backupstorage.storage.Storage.ProviderType;
import com.example.backupstorage.storage.Storage.S3Connector;
import com.example.backupstorage.storage.Storage.StorageException;
import com.example.backupstorage.storage.Storage.StorageProvider;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Constrói providers validados a partir de StorageConfig.
 *
 * <p>Azure e GCS dependem de um conector registrado (o SDK de cada nuvem fica fora deste módulo).
 * S3 usa o AWS SDK v2 por padrão, mas aceita conector registrado.
 */
public final class StorageProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(StorageProviderFactory.class);

    /** Cria o conector opaco de um object store a partir da configuração já validada. */
    @FunctionalInterface
    public interface ConnectorFactory {
        ObjectConnector create(StorageConfig config) throws IOException;
    }

    private final Map<ProviderType, ConnectorFactory> connectors;

    public StorageProviderFactory() {
        this(Map.of());
    }

    public StorageProviderFactory(Map<ProviderType, ConnectorFactory> connectors) {
        Objects.requireNonNull(connectors, "connectors");
        this.connectors = connectors.isEmpty() ? new EnumMap<>(ProviderType.class) : new EnumMap<>(connectors);
    }

    public static List<ProviderType> supportedProviders() {
        return List.of(ProviderType.values());
    }

    /**
     * Valida a configuração sem tocar em rede ou disco.
     *
     * @throws ConfigValidationException se faltar campo obrigatório ou conector
     */
    public void validate(StorageConfig config) {
        Objects.requireNonNull(config, "config");
        config.validate();
        ProviderType type = config.provider();
        if ((type == ProviderType.AZURE || type == ProviderType.GCS) && !connectors.containsKey(type)) {
            throw new ConfigValidationException("provider", "no connector registered for " + type.tag() + " storage");
        }
    }

    public StorageProvider create(StorageConfig config) throws IOException {
        return create(config, config.provider().tag());
    }

    public StorageProvider create(StorageConfig config, String name) throws IOException {
        validate(config);
        switch (config.provider()) {
            case LOCAL:
                return new LocalStorageProvider(name, config.local());
            case S3: {
                ConnectorFactory custom = connectors.get(ProviderType.S3);
                ObjectConnector connector = custom != null ? custom.create(config) : new S3Connector(config.s3());
                return new ObjectStorageProvider(name, ProviderType.S3, config.s3().prefix(), connector);
            }
            case AZURE:
                return new ObjectStorageProvider(name, ProviderType.AZURE, config.azure().prefix(),
                        connectors.get(ProviderType.AZURE).create(config));
            case GCS:
                return new ObjectStorageProvider(name, ProviderType.GCS, config.gcs().prefix(),
                        connectors.get(ProviderType.GCS).create(config));
            default:
                throw new ConfigValidationException("provider", "unsupported storage provider: " + config.provider());
        }
    }

    /**
     * Cria um provider por configuração, na ordem recebida. Falhas individuais são registradas e puladas;
     * só falha se nenhum provider puder ser criado.
     */
    public List<StorageProvider> createAll(List<StorageConfig> configs) throws IOException {
        if (configs == null || configs.isEmpty()) {
            throw new ConfigValidationException("storage", "at least one storage configuration is required");
        }
        List<StorageProvider> created = new ArrayList<>();
        List<ConfigValidationException.Violation> violations = new ArrayList<>();
        List<IOException> ioFailures = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < configs.size(); i++) {
            StorageConfig config = configs.get(i);
            String tag = config.provider().tag();
            int count = seen.merge(tag, 1, Integer::sum);
            String name = count == 1 ? tag : tag + "-" + count;
            try {
                created.add(create(config, name));
            } catch (ConfigValidationException e) {
                log.warn("Configuração de storage #{} ({}) inválida: {}", i, tag, e.getMessage());
                violations.addAll(e.violations());
            } catch (IOException e) {
                log.warn("Falha ao criar provider de storage #{} ({}): {}", i, tag, e.getMessage());
                ioFailures.add(e);
            }
        }
        if (!created.isEmpty()) {
            return created;
        }
        if (ioFailures.isEmpty()) {
            throw new ConfigValidationException(violations);
        }
        StorageException aggregate = new StorageException(StorageException.Kind.BACKEND, "factory",
                "Nenhum provider de storage pôde ser criado (" + configs.size() + " configurações)");
        ioFailures.forEach(aggregate::addSuppressed);
        throw aggregate;
    }

    public MultiStorageProvider createMulti(List<StorageConfig> configs, Duration replicationTimeout) throws IOException {
        return new MultiStorageProvider(createAll(configs), replicationTimeout);
    }

    public MultiStorageProvider createMulti(List<StorageConfig> configs, Duration replicationTimeout, Executor executor)
            throws IOException {
        return new MultiStorageProvider(createAll(configs), replicationTimeout, executor);
    }
}
