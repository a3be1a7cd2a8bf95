package com.example.backupstorage.storage;

import com.example.backupstorage.backup.Backup.BackupFilter;
import com.example.backupstorage.backup.Backup.BackupManager;
import com.example.backupstorage.backup.Backup.BackupMetadata;
import com.example.backupstorage.common.OperationContext;
import com.example.backupstorage.storage.Storage.StorageFilter;
import com.example.backupstorage.storage.Storage.StorageProvider;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * BackupManager apoiado na listagem de um StorageProvider, para quando nenhum gerenciador externo é ligado.
 * Retorna do mais recente para o mais antigo.
 */
public final class ProviderBackedBackupManager implements BackupManager {

    private final StorageProvider provider;
    private final Duration listTimeout;

    public ProviderBackedBackupManager(StorageProvider provider, Duration listTimeout) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.listTimeout = Objects.requireNonNull(listTimeout, "listTimeout");
    }

    @Override
    public List<BackupMetadata> listBackups(BackupFilter filter) throws IOException {
        BackupFilter effective = filter != null ? filter : BackupFilter.all();
        StorageFilter storageFilter = new StorageFilter(null, effective.databaseName(), effective.createdAfter(),
                effective.createdBefore(), effective.status(), 0);
        List<BackupMetadata> result = new ArrayList<>();
        for (BackupMetadata m : provider.list(storageFilter, OperationContext.withTimeout(listTimeout))) {
            if (effective.matches(m)) {
                result.add(m);
            }
        }
        result.sort(Comparator.comparing(BackupMetadata::createdAt).reversed());
        return result;
    }
}
