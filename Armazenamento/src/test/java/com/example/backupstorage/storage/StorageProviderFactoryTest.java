package com.example.backupstorage.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.backupstorage.config.ConfigValidationException;
import com.example.backupstorage.storage.Storage.LocalStorageProvider;
import com.example.backupstorage.storage.Storage.ObjectStorageProvider;
import com.example.backupstorage.storage.Storage.ProviderType;
import com.example.backupstorage.storage.Storage.StorageProvider;
import com.example.backupstorage.testutil.InMemoryObjectConnector;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StorageProviderFactoryTest {

    @TempDir
    Path tmp;

    private StorageConfig local(String dir) {
        return StorageConfig.local(StorageConfig.LocalSettings.of(tmp.resolve(dir).toString()));
    }

    private static StorageConfig azure() {
        return StorageConfig.azure(new StorageConfig.AzureSettings("acct", "key", "backups", null));
    }

    @Test
    void creates_local_provider() throws Exception {
        StorageProvider provider = new StorageProviderFactory().create(local("a"));

        LocalStorageProvider localProvider = assertInstanceOf(LocalStorageProvider.class, provider);
        assertEquals("local", provider.name());
        assertEquals(tmp.resolve("a").toAbsolutePath().normalize(), localProvider.basePath());
    }

    @Test
    void azure_without_connector_is_a_configuration_error() {
        StorageProviderFactory factory = new StorageProviderFactory();

        ConfigValidationException e = assertThrows(ConfigValidationException.class, () -> factory.create(azure()));

        assertEquals("provider", e.violations().get(0).field());
    }

    @Test
    void invalid_configuration_is_rejected_before_io() {
        StorageConfig noBucket = StorageConfig.s3(new StorageConfig.S3Settings(null, "us-east-1", null, null, null, null, null));

        ConfigValidationException e = assertThrows(ConfigValidationException.class,
                () -> new StorageProviderFactory().validate(noBucket));

        assertEquals("s3.bucket", e.violations().get(0).field());
    }

    @Test
    void registered_connectors_back_object_store_providers() throws Exception {
        InMemoryObjectConnector blob = new InMemoryObjectConnector("azure://");
        InMemoryObjectConnector s3 = new InMemoryObjectConnector("s3://");
        StorageProviderFactory factory = new StorageProviderFactory(Map.of(
                ProviderType.AZURE, config -> blob,
                ProviderType.S3, config -> s3));

        StorageProvider azureProvider = factory.create(azure());
        StorageProvider s3Provider = factory.create(StorageConfig.s3(
                new StorageConfig.S3Settings("bucket", "us-east-1", "daily", null, null, null, null)));

        assertInstanceOf(ObjectStorageProvider.class, azureProvider);
        assertEquals(ProviderType.AZURE, azureProvider.type());
        assertEquals("daily/", s3Provider.storageInfo().get("prefix"));
    }

    @Test
    void create_all_names_duplicates_and_skips_invalid_entries() throws Exception {
        List<StorageProvider> providers = new StorageProviderFactory().createAll(List.of(
                local("a"), azure(), local("b")));

        assertEquals(List.of("local", "local-2"), providers.stream().map(StorageProvider::name).toList());
    }

    @Test
    void create_all_fails_when_nothing_can_be_built() {
        StorageProviderFactory factory = new StorageProviderFactory();

        ConfigValidationException e = assertThrows(ConfigValidationException.class,
                () -> factory.createAll(List.of(azure())));
        assertTrue(e.getMessage().contains("azure"));

        assertThrows(ConfigValidationException.class, () -> factory.createAll(List.of()));
    }

    @Test
    void create_multi_keeps_configuration_order() throws Exception {
        try (MultiStorageProvider multi = new StorageProviderFactory()
                .createMulti(List.of(local("primary"), local("mirror")), Duration.ofSeconds(5))) {
            assertEquals("local", multi.primary().name());
            assertEquals(2, multi.providers().size());
            assertEquals("5", multi.storageInfo().get("replication_timeout_seconds"));
        }
    }

    @Test
    void every_provider_type_is_supported() {
        assertEquals(List.of(ProviderType.LOCAL, ProviderType.S3, ProviderType.AZURE, ProviderType.GCS),
                StorageProviderFactory.supportedProviders());
    }
}
