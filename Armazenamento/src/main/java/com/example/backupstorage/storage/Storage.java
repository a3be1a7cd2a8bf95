package com.example.backupstorage.storage;

import com.example.backupstorage.backup.Backup.BackupArtifact;
import com.example.backupstorage.backup.Backup.BackupMetadata;
import com.example.backupstorage.backup.Backup.BackupStatus;
import com.example.backupstorage.backup.Backup.CompressionType;
import com.example.backupstorage.common.Json;
import com.example.backupstorage.common.OperationCancelledException;
import com.example.backupstorage.common.OperationContext;
import com.example.backupstorage.storage.StorageConfig.S3Settings;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * Centraliza o contrato de storage de backups e os backends concretos (local e object stores).
 */
public final class Storage {

    private Storage() {}

    // ---- Tipos de provider -------------------------------------------------

    public enum ProviderType {
        LOCAL("local", null),
        S3("s3", "s3://"),
        AZURE("azure", "azure://"),
        GCS("gcs", "gs://");

        private final String tag;
        private final String scheme;

        ProviderType(String tag, String scheme) {
            this.tag = tag;
            this.scheme = scheme;
        }

        public String tag() { return tag; }

        public static ProviderType fromTag(String raw) {
            String v = Objects.requireNonNull(raw, "raw").trim().toLowerCase(Locale.ROOT);
            for (ProviderType t : values()) {
                if (t.tag.equals(v)) {
                    return t;
                }
            }
            throw new IllegalArgumentException("Provider de storage desconhecido: " + raw);
        }

        /** Deduz o provider pelo esquema do storage_location; sem esquema conhecido devolve fallback. */
        public static ProviderType fromLocation(String location, ProviderType fallback) {
            if (location != null) {
                for (ProviderType t : values()) {
                    if (t.scheme != null && location.startsWith(t.scheme)) {
                        return t;
                    }
                }
            }
            return fallback;
        }
    }

    // ---- Filtro ------------------------------------------------------------

    /**
     * Filtro de list(). Campos nulos (ou maxItems &lt;= 0) não restringem; os demais combinam com AND.
     */
    public record StorageFilter(String prefix,
                                String databaseName,
                                Instant createdAfter,
                                Instant createdBefore,
                                BackupStatus status,
                                int maxItems) {

        public static StorageFilter all() {
            return new StorageFilter(null, null, null, null, null, 0);
        }

        public static StorageFilter withPrefix(String prefix) {
            return new StorageFilter(prefix, null, null, null, null, 0);
        }

        public StorageFilter limit(int max) {
            return new StorageFilter(prefix, databaseName, createdAfter, createdBefore, status, max);
        }

        public boolean matches(BackupMetadata m) {
            if (prefix != null && !prefix.isEmpty() && !m.id().startsWith(prefix)) return false;
            if (databaseName != null && !databaseName.equals(m.databaseName())) return false;
            if (createdAfter != null && m.createdAt().isBefore(createdAfter)) return false;
            if (createdBefore != null && m.createdAt().isAfter(createdBefore)) return false;
            return status == null || status == m.status();
        }
    }

    // ---- Erros -------------------------------------------------------------

    /**
     * Operação de backend tentada e falha. BACKEND é candidata a retry/failover; as demais não.
     */
    public static class StorageException extends IOException {

        private static final long serialVersionUID = 1L;

        public enum Kind { NOT_FOUND, BACKEND, CORRUPTION, UNSUPPORTED }

        private final Kind kind;
        private final String provider;

        public StorageException(Kind kind, String provider, String message) {
            super(message);
            this.kind = Objects.requireNonNull(kind, "kind");
            this.provider = provider;
        }

        public StorageException(Kind kind, String provider, String message, Throwable cause) {
            super(message, cause);
            this.kind = Objects.requireNonNull(kind, "kind");
            this.provider = provider;
        }

        public static StorageException notFound(String provider, String id) {
            return new StorageException(Kind.NOT_FOUND, provider, "Backup não encontrado em " + provider + ": " + id);
        }

        public Kind kind() { return kind; }

        public String provider() { return provider; }

        public boolean retryable() { return kind == Kind.BACKEND; }
    }

    // ---- Health check ------------------------------------------------------

    public enum HealthStatus { HEALTHY, FAILED, NOT_APPLICABLE }

    public record HealthCheckResult(HealthStatus status, String error) {
        public static HealthCheckResult healthy() { return new HealthCheckResult(HealthStatus.HEALTHY, null); }
        public static HealthCheckResult notApplicable() { return new HealthCheckResult(HealthStatus.NOT_APPLICABLE, null); }
        public static HealthCheckResult failed(Throwable error) {
            String msg = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            return new HealthCheckResult(HealthStatus.FAILED, msg);
        }
    }

    // ---- Contrato ----------------------------------------------------------

    /**
     * Contrato uniforme sobre um backend físico. Toda operação de rede recebe um OperationContext
     * e lança OperationCancelledException (nunca StorageException) quando ele expira ou é cancelado.
     */
    public interface StorageProvider extends AutoCloseable {

        String name();

        ProviderType type();

        void store(BackupArtifact backup, OperationContext ctx) throws IOException;

        BackupArtifact retrieve(String id, OperationContext ctx) throws IOException;

        void delete(String id, OperationContext ctx) throws IOException;

        List<BackupMetadata> list(StorageFilter filter, OperationContext ctx) throws IOException;

        BackupMetadata getMetadata(String id, OperationContext ctx) throws IOException;

        /** Capacidade opcional; quando false, healthCheck() não deve ser chamado. */
        default boolean supportsHealthCheck() {
            return false;
        }

        default void healthCheck(OperationContext ctx) throws IOException {
            throw new UnsupportedOperationException("Health check não suportado por " + name());
        }

        default Map<String, String> storageInfo() {
            return Map.of("provider", type().tag(), "name", name());
        }

        @Override
        default void close() throws Exception {
            // default no-op
        }
    }

    // ---- Codificação do artefato --------------------------------------------

    /** Serialização, compressão e checksum do artefato. */
    static final class ArtifactCodec {

        static final String METADATA_FILE = "metadata.json";
        private static final HexFormat HEX = HexFormat.of();

        private ArtifactCodec() {}

        static String payloadName(CompressionType compression) {
            switch (compression) {
                case GZIP: return "backup.json.gz";
                case ZSTD: return "backup.json.zst";
                default: return "backup.json";
            }
        }

        /** SHA-256 sobre o conteúdo (id, banco, snapshot, definições); independe de metadados mutáveis. */
        static String checksum(BackupArtifact artifact) throws IOException {
            ObjectMapper mapper = Json.mapper();
            ObjectNode content = mapper.createObjectNode();
            content.put("id", artifact.id());
            content.put("database_name", artifact.metadata().databaseName());
            content.set("schema_snapshot", artifact.schemaSnapshot());
            content.set("data_definitions", mapper.valueToTree(artifact.dataDefinitions()));
            try {
                MessageDigest digest = MessageDigest.getInstance("SHA-256");
                return HEX.formatHex(digest.digest(mapper.writeValueAsBytes(content)));
            } catch (NoSuchAlgorithmException e) {
                throw new IOException("SHA-256 indisponível", e);
            }
        }

        static byte[] encode(BackupArtifact artifact, String provider) throws IOException {
            byte[] raw = Json.mapper().writeValueAsBytes(artifact);
            CompressionType compression = artifact.metadata().compressionType();
            switch (compression) {
                case NONE:
                    return raw;
                case GZIP: {
                    ByteArrayOutputStream out = new ByteArrayOutputStream();
                    try (OutputStream gz = new GZIPOutputStream(out)) {
                        gz.write(raw);
                    }
                    return out.toByteArray();
                }
                case ZSTD: {
                    ByteArrayOutputStream out = new ByteArrayOutputStream();
                    try (ZstdOutputStream zstd = new ZstdOutputStream(out, 3)) {
                        zstd.write(raw);
                    }
                    return out.toByteArray();
                }
                default:
                    throw new StorageException(StorageException.Kind.UNSUPPORTED, provider,
                            "Compressão " + compression.wire() + " não suportada pelo storage");
            }
        }

        static BackupArtifact decode(byte[] payload, CompressionType compression, String provider) throws IOException {
            try {
                byte[] raw;
                switch (compression) {
                    case GZIP:
                        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(payload))) {
                            raw = in.readAllBytes();
                        }
                        break;
                    case ZSTD:
                        try (InputStream in = new ZstdInputStream(new ByteArrayInputStream(payload))) {
                            raw = in.readAllBytes();
                        }
                        break;
                    case NONE:
                        raw = payload;
                        break;
                    default:
                        throw new StorageException(StorageException.Kind.UNSUPPORTED, provider,
                                "Compressão " + compression.wire() + " não suportada pelo storage");
                }
                return Json.mapper().readValue(raw, BackupArtifact.class);
            } catch (StorageException e) {
                throw e;
            } catch (IOException e) {
                throw new StorageException(StorageException.Kind.CORRUPTION, provider,
                        "Conteúdo do backup ilegível em " + provider + ": " + e.getMessage(), e);
            }
        }

        static byte[] encodeMetadata(BackupMetadata metadata) throws IOException {
            return Json.mapper().writeValueAsBytes(metadata);
        }

        static BackupMetadata decodeMetadata(byte[] raw, String provider) throws StorageException {
            try {
                return Json.mapper().readValue(raw, BackupMetadata.class);
            } catch (IOException | RuntimeException e) {
                throw new StorageException(StorageException.Kind.CORRUPTION, provider,
                        "metadata.json ilegível em " + provider + ": " + e.getMessage(), e);
            }
        }
    }

    // ---- Base comum ----------------------------------------------------------

    /**
     * Fluxo comum de store/retrieve/list sobre primitivas de objeto por backup
     * (um "diretório" por id com o payload e o metadata.json).
     */
    public abstract static class AbstractStorageProvider implements StorageProvider {

        private static final Logger log = LoggerFactory.getLogger(AbstractStorageProvider.class);

        private final String name;
        private final ProviderType type;

        protected AbstractStorageProvider(String name, ProviderType type) {
            this.name = Objects.requireNonNull(name, "name");
            this.type = Objects.requireNonNull(type, "type");
        }

        @Override public String name() { return name; }

        @Override public ProviderType type() { return type; }

        protected abstract void writeObject(String id, String file, byte[] content, Map<String, String> userMetadata,
                                            OperationContext ctx) throws IOException;

        protected abstract Optional<byte[]> readObject(String id, String file, OperationContext ctx) throws IOException;

        /** Remove todos os objetos do backup; false se não havia nada. */
        protected abstract boolean deleteObjects(String id, OperationContext ctx) throws IOException;

        protected abstract List<byte[]> readAllMetadata(OperationContext ctx) throws IOException;

        protected abstract String locationFor(String id);

        @Override
        public void store(BackupArtifact backup, OperationContext ctx) throws IOException {
            Objects.requireNonNull(backup, "backup");
            Objects.requireNonNull(ctx, "ctx");
            String id = backup.id();
            ctx.ensureActive("store " + id + " em " + name);

            BackupMetadata metadata = backup.metadata()
                    .withChecksum(ArtifactCodec.checksum(backup))
                    .withStorageLocation(locationFor(id));
            byte[] payload = ArtifactCodec.encode(backup.withMetadata(metadata), name);
            Map<String, String> userMetadata = userMetadata(metadata);
            try {
                writeObject(id, ArtifactCodec.payloadName(metadata.compressionType()), payload, userMetadata, ctx);
                ctx.ensureActive("store " + id + " em " + name);
                // metadata.json por último: marca o backup como completo no backend
                writeObject(id, ArtifactCodec.METADATA_FILE, ArtifactCodec.encodeMetadata(metadata), userMetadata, ctx);
            } catch (StorageException e) {
                throw e;
            } catch (IOException e) {
                throw failure(ctx, "store", id, e);
            }
            log.debug("Backup {} gravado em {} ({} bytes)", id, name, payload.length);
        }

        @Override
        public BackupArtifact retrieve(String id, OperationContext ctx) throws IOException {
            BackupMetadata metadata = getMetadata(id, ctx);
            byte[] payload;
            try {
                payload = readObject(id, ArtifactCodec.payloadName(metadata.compressionType()), ctx)
                        .orElseThrow(() -> StorageException.notFound(name, id));
            } catch (StorageException e) {
                throw e;
            } catch (IOException e) {
                throw failure(ctx, "retrieve", id, e);
            }
            BackupArtifact artifact = ArtifactCodec.decode(payload, metadata.compressionType(), name);
            String actual = ArtifactCodec.checksum(artifact);
            if (metadata.checksum() != null && !metadata.checksum().equals(actual)) {
                throw new StorageException(StorageException.Kind.CORRUPTION, name,
                        "Checksum divergente para backup " + id + " em " + name);
            }
            return artifact.withMetadata(metadata);
        }

        @Override
        public void delete(String id, OperationContext ctx) throws IOException {
            Objects.requireNonNull(id, "id");
            ctx.ensureActive("delete " + id + " em " + name);
            boolean existed;
            try {
                existed = deleteObjects(id, ctx);
            } catch (StorageException e) {
                throw e;
            } catch (IOException e) {
                throw failure(ctx, "delete", id, e);
            }
            if (!existed) {
                throw StorageException.notFound(name, id);
            }
        }

        @Override
        public List<BackupMetadata> list(StorageFilter filter, OperationContext ctx) throws IOException {
            StorageFilter effective = filter != null ? filter : StorageFilter.all();
            ctx.ensureActive("list em " + name);
            List<byte[]> blobs;
            try {
                blobs = readAllMetadata(ctx);
            } catch (StorageException e) {
                throw e;
            } catch (IOException e) {
                throw failure(ctx, "list", "*", e);
            }
            List<BackupMetadata> result = new ArrayList<>();
            for (byte[] blob : blobs) {
                try {
                    BackupMetadata m = ArtifactCodec.decodeMetadata(blob, name);
                    if (effective.matches(m)) {
                        result.add(m);
                    }
                } catch (StorageException e) {
                    log.warn("Ignorando metadata ilegível em {}: {}", name, e.getMessage());
                }
            }
            result.sort(Comparator.comparing(BackupMetadata::createdAt).reversed().thenComparing(BackupMetadata::id));
            if (effective.maxItems() > 0 && result.size() > effective.maxItems()) {
                return new ArrayList<>(result.subList(0, effective.maxItems()));
            }
            return result;
        }

        @Override
        public BackupMetadata getMetadata(String id, OperationContext ctx) throws IOException {
            Objects.requireNonNull(id, "id");
            ctx.ensureActive("getMetadata " + id + " em " + name);
            Optional<byte[]> raw;
            try {
                raw = readObject(id, ArtifactCodec.METADATA_FILE, ctx);
            } catch (StorageException e) {
                throw e;
            } catch (IOException e) {
                throw failure(ctx, "getMetadata", id, e);
            }
            return ArtifactCodec.decodeMetadata(raw.orElseThrow(() -> StorageException.notFound(name, id)), name);
        }

        /** Cancelamento passa intacto; o resto vira StorageException(BACKEND). */
        protected IOException failure(OperationContext ctx, String operation, String id, IOException cause) {
            IOException classified = ctx.classify(operation + " " + id + " em " + name, cause);
            if (classified instanceof OperationCancelledException) {
                return classified;
            }
            return new StorageException(StorageException.Kind.BACKEND, name,
                    "Falha em " + operation + " de " + id + " no provider " + name + ": " + cause.getMessage(), cause);
        }

        private static Map<String, String> userMetadata(BackupMetadata m) {
            Map<String, String> meta = new LinkedHashMap<>();
            meta.put("backup-id", m.id());
            meta.put("database-name", m.databaseName());
            meta.put("compression", m.compressionType().wire());
            if (m.checksum() != null) {
                meta.put("backup-checksum", m.checksum());
            }
            return meta;
        }
    }

    // ---- Local ---------------------------------------------------------------

    /**
     * Backend em filesystem: base/&lt;id sanitizado&gt;/{payload, metadata.json}.
     */
    public static final class LocalStorageProvider extends AbstractStorageProvider {

        private static final Logger log = LoggerFactory.getLogger(LocalStorageProvider.class);
        private static final String HEALTH_FILE = ".health_check";

        private final Path basePath;
        private final int permissions;

        public LocalStorageProvider(StorageConfig.LocalSettings settings) throws IOException {
            this("local", settings);
        }

        public LocalStorageProvider(String name, StorageConfig.LocalSettings settings) throws IOException {
            super(name, ProviderType.LOCAL);
            Objects.requireNonNull(settings, "settings");
            this.basePath = Path.of(settings.basePath()).toAbsolutePath().normalize();
            this.permissions = settings.permissions();
            Files.createDirectories(basePath);
            applyPermissions(basePath);
        }

        public Path basePath() { return basePath; }

        static String sanitize(String id) {
            return id.replace("/", "_").replace("\\", "_").replace("..", "_");
        }

        private Path dir(String id) {
            return basePath.resolve(sanitize(id));
        }

        @Override
        protected void writeObject(String id, String file, byte[] content, Map<String, String> userMetadata,
                                   OperationContext ctx) throws IOException {
            Path dir = dir(id);
            if (!Files.isDirectory(dir)) {
                Files.createDirectories(dir);
                applyPermissions(dir);
            }
            Path target = dir.resolve(file);
            Path tmp = Files.createTempFile(dir, file, ".tmp");
            try {
                Files.write(tmp, content);
                try {
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    log.debug("ATOMIC_MOVE indisponível ({}), movendo sem atomicidade", e.getMessage());
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        }

        @Override
        protected Optional<byte[]> readObject(String id, String file, OperationContext ctx) throws IOException {
            Path path = dir(id).resolve(file);
            if (!Files.isRegularFile(path)) {
                return Optional.empty();
            }
            return Optional.of(Files.readAllBytes(path));
        }

        @Override
        protected boolean deleteObjects(String id, OperationContext ctx) throws IOException {
            Path dir = dir(id);
            if (!Files.exists(dir)) {
                return false;
            }
            try (Stream<Path> walk = Files.walk(dir)) {
                List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
                for (Path p : paths) {
                    Files.deleteIfExists(p);
                }
            }
            return true;
        }

        @Override
        protected List<byte[]> readAllMetadata(OperationContext ctx) throws IOException {
            List<byte[]> blobs = new ArrayList<>();
            try (DirectoryStream<Path> dirs = Files.newDirectoryStream(basePath, Files::isDirectory)) {
                for (Path dir : dirs) {
                    ctx.ensureActive("list em " + name());
                    Path meta = dir.resolve(ArtifactCodec.METADATA_FILE);
                    if (Files.isRegularFile(meta)) {
                        blobs.add(Files.readAllBytes(meta));
                    }
                }
            }
            return blobs;
        }

        @Override
        protected String locationFor(String id) {
            return dir(id).toString();
        }

        @Override
        public boolean supportsHealthCheck() {
            return true;
        }

        /** Escreve, relê e remove um arquivo de sonda na base. */
        @Override
        public void healthCheck(OperationContext ctx) throws IOException {
            ctx.ensureActive("health check em " + name());
            Path probe = basePath.resolve(HEALTH_FILE);
            byte[] expected = ("ok " + Instant.now()).getBytes(java.nio.charset.StandardCharsets.UTF_8);
            try {
                Files.write(probe, expected);
                byte[] read = Files.readAllBytes(probe);
                if (!Arrays.equals(expected, read)) {
                    throw new StorageException(StorageException.Kind.BACKEND, name(),
                            "Conteúdo divergente no arquivo de health check em " + basePath);
                }
            } finally {
                Files.deleteIfExists(probe);
            }
        }

        @Override
        public Map<String, String> storageInfo() {
            Map<String, String> info = new LinkedHashMap<>();
            info.put("provider", type().tag());
            info.put("name", name());
            info.put("base_path", basePath.toString());
            info.put("permissions", String.format("%04o", permissions));
            return info;
        }

        private void applyPermissions(Path dir) throws IOException {
            if (!Files.getFileStore(dir).supportsFileAttributeView("posix")) {
                return;
            }
            Files.setPosixFilePermissions(dir, toPosix(permissions));
        }

        static Set<PosixFilePermission> toPosix(int mode) {
            PosixFilePermission[] order = {
                    PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_EXECUTE,
                    PosixFilePermission.GROUP_READ, PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_EXECUTE,
                    PosixFilePermission.OTHERS_READ, PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_EXECUTE
            };
            Set<PosixFilePermission> perms = EnumSet.noneOf(PosixFilePermission.class);
            for (int i = 0; i < order.length; i++) {
                if ((mode & (0400 >> i)) != 0) {
                    perms.add(order[i]);
                }
            }
            return perms;
        }
    }

    // ---- Object stores -------------------------------------------------------

    /**
     * Conector opaco para um object store (SDK do S3, Azure Blob, GCS). Chaves são caminhos completos.
     */
    public interface ObjectConnector extends AutoCloseable {

        void put(String key, byte[] content, Map<String, String> metadata, OperationContext ctx) throws IOException;

        Optional<byte[]> get(String key, OperationContext ctx) throws IOException;

        void delete(String key, OperationContext ctx) throws IOException;

        List<String> listKeys(String prefix, OperationContext ctx) throws IOException;

        /** Sonda de conectividade barata. */
        void ping(OperationContext ctx) throws IOException;

        /** URI externa para a chave (ex.: s3://bucket/key). */
        String location(String key);

        default Map<String, String> describe() {
            return Map.of();
        }

        @Override
        default void close() throws Exception {
            // default no-op
        }
    }

    /**
     * Backend sobre um ObjectConnector: &lt;prefix&gt;&lt;id sanitizado&gt;/{payload, metadata.json}.
     */
    public static final class ObjectStorageProvider extends AbstractStorageProvider {

        private final ObjectConnector connector;
        private final String prefix;

        public ObjectStorageProvider(String name, ProviderType type, String prefix, ObjectConnector connector) {
            super(name, type);
            this.connector = Objects.requireNonNull(connector, "connector");
            this.prefix = prefix == null ? "" : prefix;
        }

        static String sanitize(String id) {
            return id.replace(" ", "_").replace("\\", "_");
        }

        private String dirKey(String id) {
            return prefix + sanitize(id) + "/";
        }

        /** Extrai o id sanitizado de uma chave &lt;prefix&gt;&lt;id&gt;/arquivo. */
        String extractBackupId(String key) {
            if (!key.startsWith(prefix)) {
                return null;
            }
            String rest = key.substring(prefix.length());
            int slash = rest.indexOf('/');
            return slash > 0 ? rest.substring(0, slash) : null;
        }

        @Override
        protected void writeObject(String id, String file, byte[] content, Map<String, String> userMetadata,
                                   OperationContext ctx) throws IOException {
            connector.put(dirKey(id) + file, content, userMetadata, ctx);
        }

        @Override
        protected Optional<byte[]> readObject(String id, String file, OperationContext ctx) throws IOException {
            return connector.get(dirKey(id) + file, ctx);
        }

        @Override
        protected boolean deleteObjects(String id, OperationContext ctx) throws IOException {
            List<String> keys = connector.listKeys(dirKey(id), ctx);
            for (String key : keys) {
                ctx.ensureActive("delete " + key);
                connector.delete(key, ctx);
            }
            return !keys.isEmpty();
        }

        @Override
        protected List<byte[]> readAllMetadata(OperationContext ctx) throws IOException {
            List<byte[]> blobs = new ArrayList<>();
            for (String key : connector.listKeys(prefix, ctx)) {
                if (extractBackupId(key) != null && key.endsWith("/" + ArtifactCodec.METADATA_FILE)) {
                    ctx.ensureActive("list em " + name());
                    connector.get(key, ctx).ifPresent(blobs::add);
                }
            }
            return blobs;
        }

        @Override
        protected String locationFor(String id) {
            return connector.location(dirKey(id));
        }

        @Override
        public boolean supportsHealthCheck() {
            return true;
        }

        @Override
        public void healthCheck(OperationContext ctx) throws IOException {
            ctx.ensureActive("health check em " + name());
            try {
                connector.ping(ctx);
            } catch (StorageException e) {
                throw e;
            } catch (IOException e) {
                throw failure(ctx, "health check", "-", e);
            }
        }

        @Override
        public Map<String, String> storageInfo() {
            Map<String, String> info = new LinkedHashMap<>();
            info.put("provider", type().tag());
            info.put("name", name());
            info.put("prefix", prefix);
            info.putAll(connector.describe());
            return info;
        }

        @Override
        public void close() throws Exception {
            connector.close();
        }
    }

    // ---- S3 ------------------------------------------------------------------

    /** Política de retentativa do conector S3; backoff exponencial limitado. */
    public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(8));

        public RetryPolicy {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts deve ser >= 1");
            }
            Objects.requireNonNull(initialBackoff, "initialBackoff");
            Objects.requireNonNull(maxBackoff, "maxBackoff");
        }
    }

    /**
     * ObjectConnector sobre o AWS SDK v2. O prazo do contexto vira apiCallTimeout de cada requisição.
     */
    public static final class S3Connector implements ObjectConnector {

        private static final Logger log = LoggerFactory.getLogger(S3Connector.class);

        private final S3Settings settings;
        private final S3Client client;
        private final RetryPolicy retryPolicy;

        public S3Connector(S3Settings settings) {
            this(settings, createClient(settings), RetryPolicy.DEFAULT);
        }

        /** Permite injetar o client (útil para testes). */
        public S3Connector(S3Settings settings, S3Client client, RetryPolicy retryPolicy) {
            this.settings = Objects.requireNonNull(settings, "settings");
            this.client = Objects.requireNonNull(client, "client");
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        }

        @Override
        public void put(String key, byte[] content, Map<String, String> metadata, OperationContext ctx) throws IOException {
            withRetry("PUT", key, ctx, () -> {
                PutObjectRequest request = PutObjectRequest.builder()
                        .bucket(settings.bucket())
                        .key(key)
                        .contentLength((long) content.length)
                        .contentType(key.endsWith(".json") ? "application/json" : "application/octet-stream")
                        .metadata(metadata)
                        .overrideConfiguration(overrides(ctx))
                        .build();
                client.putObject(request, RequestBody.fromBytes(content));
                return null;
            });
        }

        @Override
        public Optional<byte[]> get(String key, OperationContext ctx) throws IOException {
            return withRetry("GET", key, ctx, () -> {
                GetObjectRequest request = GetObjectRequest.builder()
                        .bucket(settings.bucket())
                        .key(key)
                        .overrideConfiguration(overrides(ctx))
                        .build();
                try {
                    return Optional.of(client.getObjectAsBytes(request).asByteArray());
                } catch (NoSuchKeyException e) {
                    return Optional.empty();
                } catch (S3Exception e) {
                    if (e.statusCode() == 404) {
                        return Optional.empty();
                    }
                    throw e;
                }
            });
        }

        @Override
        public void delete(String key, OperationContext ctx) throws IOException {
            withRetry("DELETE", key, ctx, () -> {
                client.deleteObject(DeleteObjectRequest.builder()
                        .bucket(settings.bucket())
                        .key(key)
                        .overrideConfiguration(overrides(ctx))
                        .build());
                return null;
            });
        }

        @Override
        public List<String> listKeys(String prefix, OperationContext ctx) throws IOException {
            List<String> keys = new ArrayList<>();
            String token = null;
            do {
                final String continuation = token;
                ListObjectsV2Response page = withRetry("LIST", prefix, ctx, () -> client.listObjectsV2(
                        ListObjectsV2Request.builder()
                                .bucket(settings.bucket())
                                .prefix(prefix)
                                .continuationToken(continuation)
                                .overrideConfiguration(overrides(ctx))
                                .build()));
                for (S3Object object : page.contents()) {
                    keys.add(object.key());
                }
                token = Boolean.TRUE.equals(page.isTruncated()) ? page.nextContinuationToken() : null;
            } while (token != null);
            return keys;
        }

        /** HEAD no bucket e uma listagem de no máximo 1 objeto. */
        @Override
        public void ping(OperationContext ctx) throws IOException {
            withRetry("HEAD", settings.bucket(), ctx, () -> {
                client.headBucket(HeadBucketRequest.builder()
                        .bucket(settings.bucket())
                        .overrideConfiguration(overrides(ctx))
                        .build());
                client.listObjectsV2(ListObjectsV2Request.builder()
                        .bucket(settings.bucket())
                        .maxKeys(1)
                        .overrideConfiguration(overrides(ctx))
                        .build());
                return null;
            });
        }

        @Override
        public String location(String key) {
            return "s3://" + settings.bucket() + "/" + key;
        }

        @Override
        public Map<String, String> describe() {
            Map<String, String> info = new LinkedHashMap<>();
            info.put("bucket", settings.bucket());
            info.put("region", settings.region());
            settings.endpointOverride().ifPresent(e -> info.put("endpoint", e));
            return info;
        }

        @Override
        public void close() {
            client.close();
        }

        private AwsRequestOverrideConfiguration overrides(OperationContext ctx) {
            AwsRequestOverrideConfiguration.Builder builder = AwsRequestOverrideConfiguration.builder();
            ctx.remaining().ifPresent(left -> builder.apiCallTimeout(left.isZero() ? Duration.ofMillis(1) : left));
            return builder.build();
        }

        @FunctionalInterface
        private interface S3Call<T> {
            T call();
        }

        private <T> T withRetry(String operation, String key, OperationContext ctx, S3Call<T> call) throws IOException {
            long backoffMillis = retryPolicy.initialBackoff().toMillis();
            for (int attempt = 1; ; attempt++) {
                ctx.ensureActive(operation + " " + key);
                try {
                    return call.call();
                } catch (AbortedException aborted) {
                    boolean interrupted = Thread.interrupted();
                    if (interrupted) {
                        Thread.currentThread().interrupt();
                    }
                    throw new OperationCancelledException("Requisição S3 abortada durante " + operation + " de " + key,
                            false, aborted);
                } catch (SdkException e) {
                    IOException failure = ctx.classify(operation + " " + key,
                            new IOException("Falha no " + operation + " de " + key + ": " + errorMessage(e), e));
                    if (failure instanceof OperationCancelledException || !retryable(e) || attempt >= retryPolicy.maxAttempts()) {
                        throw failure;
                    }
                    log.warn("Falha no {} de {} (tentativa {}/{}): {}. Retentando em {} ms...",
                            operation, key, attempt, retryPolicy.maxAttempts(), errorMessage(e), backoffMillis);
                    sleep(backoffMillis, ctx, operation + " " + key);
                    backoffMillis = Math.min(backoffMillis * 2, retryPolicy.maxBackoff().toMillis());
                }
            }
        }

        private static boolean retryable(SdkException e) {
            if (e instanceof S3Exception) {
                int status = ((S3Exception) e).statusCode();
                return status >= 500 || status == 429;
            }
            return e instanceof SdkClientException;
        }

        private static void sleep(long millis, OperationContext ctx, String operation) throws OperationCancelledException {
            long bounded = ctx.remaining().map(left -> Math.min(left.toMillis(), millis)).orElse(millis);
            if (bounded <= 0) {
                return;
            }
            try {
                Thread.sleep(bounded);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("Thread interrompida durante backoff de " + operation, false, ie);
            }
        }

        private static String errorMessage(Throwable e) {
            String msg = e.getMessage();
            return msg == null || msg.isBlank() ? e.getClass().getSimpleName() : msg;
        }

        public static S3Client createClient(S3Settings settings) {
            S3ClientBuilder builder = S3Client.builder()
                    .region(Region.of(settings.region()))
                    .credentialsProvider(credentialsProvider(settings));
            settings.endpointOverride().ifPresent(endpoint -> builder.endpointOverride(URI.create(endpoint)).forcePathStyle(true));
            return builder.build();
        }

        private static AwsCredentialsProvider credentialsProvider(S3Settings settings) {
            if (settings.accessKey() == null || settings.secretKey() == null) {
                return DefaultCredentialsProvider.create();
            }
            AwsCredentials credentials;
            if (settings.sessionToken() != null && !settings.sessionToken().isBlank()) {
                credentials = AwsSessionCredentials.create(settings.accessKey(), settings.secretKey(), settings.sessionToken());
            } else {
                credentials = AwsBasicCredentials.create(settings.accessKey(), settings.secretKey());
            }
            return StaticCredentialsProvider.create(credentials);
        }
    }
}
