package com.example.backupstorage.storage;

import com.example.backupstorage.config.ConfigValidationException;
import com.example.backupstorage.storage.Storage.ProviderType;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuração de um backend: tag do provider mais as configurações específicas.
 * Validada antes da construção do provider e imutável depois disso.
 */
public record StorageConfig(ProviderType provider,
                            LocalSettings local,
                            S3Settings s3,
                            AzureSettings azure,
                            GcsSettings gcs) {

    public StorageConfig {
        Objects.requireNonNull(provider, "provider");
    }

    public static StorageConfig local(LocalSettings settings) {
        return new StorageConfig(ProviderType.LOCAL, settings, null, null, null);
    }

    public static StorageConfig s3(S3Settings settings) {
        return new StorageConfig(ProviderType.S3, null, settings, null, null);
    }

    public static StorageConfig azure(AzureSettings settings) {
        return new StorageConfig(ProviderType.AZURE, null, null, settings, null);
    }

    public static StorageConfig gcs(GcsSettings settings) {
        return new StorageConfig(ProviderType.GCS, null, null, null, settings);
    }

    /**
     * Valida os campos obrigatórios do provider selecionado.
     *
     * @throws ConfigValidationException nomeando cada campo ausente
     */
    public void validate() {
        ConfigValidationException.Collector errors = new ConfigValidationException.Collector();
        switch (provider) {
            case LOCAL:
                errors.require(local != null, "local", "local storage configuration is required");
                if (local != null) {
                    errors.requireText(local.basePath(), "local.base_path", "base path is required for local storage");
                    errors.require(local.permissions() >= 0 && local.permissions() <= 0777,
                            "local.permissions", "permissions must be an octal mode between 000 and 777");
                }
                break;
            case S3:
                errors.require(s3 != null, "s3", "S3 configuration is required");
                if (s3 != null) {
                    errors.requireText(s3.bucket(), "s3.bucket", "S3 bucket name is required");
                    errors.requireText(s3.region(), "s3.region", "S3 region is required");
                    boolean partialCreds = (s3.accessKey() == null) != (s3.secretKey() == null);
                    errors.require(!partialCreds, "s3.access_key", "access key and secret key must be set together");
                }
                break;
            case AZURE:
                errors.require(azure != null, "azure", "Azure configuration is required");
                if (azure != null) {
                    errors.requireText(azure.accountName(), "azure.account_name", "Azure account name is required");
                    errors.requireText(azure.accountKey(), "azure.account_key", "Azure account key is required");
                    errors.requireText(azure.containerName(), "azure.container_name", "Azure container name is required");
                }
                break;
            case GCS:
                errors.require(gcs != null, "gcs", "GCS configuration is required");
                if (gcs != null) {
                    errors.requireText(gcs.bucket(), "gcs.bucket", "GCS bucket name is required");
                    errors.requireText(gcs.credentialsPath(), "gcs.credentials_path", "GCS credentials path is required");
                }
                break;
            default:
                errors.require(false, "provider", "unsupported storage provider: " + provider);
        }
        errors.throwIfAny();
    }

    /** Backend local. permissions em octal (padrão 0755). */
    public record LocalSettings(String basePath, int permissions) {
        public static final int DEFAULT_PERMISSIONS = 0755;

        public static LocalSettings of(String basePath) {
            return new LocalSettings(basePath, DEFAULT_PERMISSIONS);
        }
    }

    /** Backend S3 (ou compatível via endpoint). Credenciais opcionais: sem elas usa a cadeia padrão da AWS. */
    public record S3Settings(String bucket,
                             String region,
                             String prefix,
                             String endpoint,
                             String accessKey,
                             String secretKey,
                             String sessionToken) {
        public static final String DEFAULT_PREFIX = "backups/";

        public S3Settings {
            prefix = normalizePrefix(prefix);
        }

        public Optional<String> endpointOverride() {
            return Optional.ofNullable(endpoint).filter(s -> !s.isBlank());
        }

        @Override
        public String toString() {
            return "S3Settings{bucket=" + bucket + ", region=" + region + ", prefix=" + prefix
                    + ", endpoint=" + (endpoint != null ? endpoint : "default")
                    + ", creds=" + (accessKey != null ? "set" : "unset") + "}";
        }
    }

    public record AzureSettings(String accountName, String accountKey, String containerName, String prefix) {
        public AzureSettings {
            prefix = normalizePrefix(prefix);
        }

        @Override
        public String toString() {
            return "AzureSettings{account=" + accountName + ", container=" + containerName + ", prefix=" + prefix + "}";
        }
    }

    public record GcsSettings(String bucket, String credentialsPath, String projectId, String prefix) {
        public GcsSettings {
            prefix = normalizePrefix(prefix);
        }
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return S3Settings.DEFAULT_PREFIX;
        }
        String p = prefix.trim();
        return p.endsWith("/") ? p : p + "/";
    }
}
