package com.example.backupstorage.backup;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Modelo de backup consumido pela camada de armazenamento: metadados, artefato,
 * filtros de consulta e o contrato do BackupManager externo.
 */
public final class Backup {

    private Backup() {}

    // ---- Status ----------------------------------------------------------

    /** Ciclo de vida de um backup. Só avança: pending → in-progress → completed|failed. */
    public enum BackupStatus {
        PENDING("pending"),
        IN_PROGRESS("in-progress"),
        COMPLETED("completed"),
        FAILED("failed");

        private final String wire;

        BackupStatus(String wire) { this.wire = wire; }

        @JsonValue
        public String wire() { return wire; }

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }

        public boolean canAdvanceTo(BackupStatus next) {
            Objects.requireNonNull(next, "next");
            switch (this) {
                case PENDING:
                    return next == IN_PROGRESS || next == FAILED;
                case IN_PROGRESS:
                    return next == COMPLETED || next == FAILED;
                default:
                    return false;
            }
        }

        @JsonCreator
        public static BackupStatus fromWire(String raw) {
            for (BackupStatus s : values()) {
                if (s.wire.equalsIgnoreCase(raw) || s.name().equalsIgnoreCase(raw)) {
                    return s;
                }
            }
            throw new IllegalArgumentException("Status de backup desconhecido: " + raw);
        }
    }

    /** Algoritmo aplicado ao conteúdo do backup. */
    public enum CompressionType {
        NONE("none"),
        GZIP("gzip"),
        LZ4("lz4"),
        ZSTD("zstd");

        private final String wire;

        CompressionType(String wire) { this.wire = wire; }

        @JsonValue
        public String wire() { return wire; }

        @JsonCreator
        public static CompressionType fromWire(String raw) {
            if (raw == null || raw.isBlank()) {
                return NONE;
            }
            String v = raw.trim().toLowerCase(Locale.ROOT);
            for (CompressionType t : values()) {
                if (t.wire.equals(v)) {
                    return t;
                }
            }
            throw new IllegalArgumentException("Compressão desconhecida: " + raw);
        }
    }

    // ---- Metadados -------------------------------------------------------

    /**
     * Metadados de um backup. Imutável; as transições produzem novas instâncias.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record BackupMetadata(
            @JsonProperty("id") String id,
            @JsonProperty("database_name") String databaseName,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("created_by") String createdBy,
            @JsonProperty("description") String description,
            @JsonProperty("tags") List<String> tags,
            @JsonProperty("size") long size,
            @JsonProperty("compressed_size") long compressedSize,
            @JsonProperty("compression_type") CompressionType compressionType,
            @JsonProperty("encryption_enabled") boolean encryptionEnabled,
            @JsonProperty("storage_location") String storageLocation,
            @JsonProperty("checksum") String checksum,
            @JsonProperty("status") BackupStatus status) {

        public BackupMetadata {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(databaseName, "databaseName");
            Objects.requireNonNull(createdAt, "createdAt");
            if (id.isBlank()) {
                throw new IllegalArgumentException("id vazio");
            }
            if (size < 0 || compressedSize < 0) {
                throw new IllegalArgumentException("Tamanhos negativos para backup " + id);
            }
            tags = tags == null ? List.of() : List.copyOf(tags);
            compressionType = compressionType == null ? CompressionType.NONE : compressionType;
            status = status == null ? BackupStatus.PENDING : status;
        }

        /** compressedSize/size, ou 0 quando size é 0. */
        @JsonIgnore
        public double compressionRatio() {
            return size > 0 ? (double) compressedSize / size : 0.0;
        }

        public BackupMetadata withStorageLocation(String location) {
            return new BackupMetadata(id, databaseName, createdAt, createdBy, description, tags, size,
                    compressedSize, compressionType, encryptionEnabled, location, checksum, status);
        }

        public BackupMetadata withChecksum(String value) {
            return new BackupMetadata(id, databaseName, createdAt, createdBy, description, tags, size,
                    compressedSize, compressionType, encryptionEnabled, storageLocation, value, status);
        }

        /**
         * Avança o status. Transições para trás ou a partir de estados terminais falham.
         */
        public BackupMetadata advanceTo(BackupStatus next) {
            if (!status.canAdvanceTo(next)) {
                throw new IllegalStateException("Transição inválida de " + status.wire() + " para " + next.wire()
                        + " no backup " + id);
            }
            return new BackupMetadata(id, databaseName, createdAt, createdBy, description, tags, size,
                    compressedSize, compressionType, encryptionEnabled, storageLocation, checksum, next);
        }

        public static Builder builder(String id, String databaseName, Instant createdAt) {
            return new Builder(id, databaseName, createdAt);
        }
    }

    /** Builder para metadados; útil em testes e na montagem a partir de listagens. */
    public static final class Builder {
        private final String id;
        private final String databaseName;
        private final Instant createdAt;
        private String createdBy;
        private String description;
        private List<String> tags = new ArrayList<>();
        private long size;
        private long compressedSize;
        private CompressionType compressionType = CompressionType.NONE;
        private boolean encryptionEnabled;
        private String storageLocation;
        private String checksum;
        private BackupStatus status = BackupStatus.PENDING;

        private Builder(String id, String databaseName, Instant createdAt) {
            this.id = id;
            this.databaseName = databaseName;
            this.createdAt = createdAt;
        }

        public Builder createdBy(String v) { this.createdBy = v; return this; }
        public Builder description(String v) { this.description = v; return this; }
        public Builder tags(List<String> v) { this.tags = new ArrayList<>(v); return this; }
        public Builder size(long v) { this.size = v; return this; }
        public Builder compressedSize(long v) { this.compressedSize = v; return this; }
        public Builder compression(CompressionType v) { this.compressionType = v; return this; }
        public Builder encryptionEnabled(boolean v) { this.encryptionEnabled = v; return this; }
        public Builder storageLocation(String v) { this.storageLocation = v; return this; }
        public Builder checksum(String v) { this.checksum = v; return this; }
        public Builder status(BackupStatus v) { this.status = v; return this; }

        public BackupMetadata build() {
            return new BackupMetadata(id, databaseName, createdAt, createdBy, description, tags, size,
                    compressedSize, compressionType, encryptionEnabled, storageLocation, checksum, status);
        }
    }

    // ---- Artefato --------------------------------------------------------

    /**
     * Conteúdo persistido de um backup: snapshot do schema e as definições de dados.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record BackupArtifact(
            @JsonProperty("metadata") BackupMetadata metadata,
            @JsonProperty("schema_snapshot") JsonNode schemaSnapshot,
            @JsonProperty("data_definitions") List<String> dataDefinitions) {

        public BackupArtifact {
            Objects.requireNonNull(metadata, "metadata");
            dataDefinitions = dataDefinitions == null ? List.of() : List.copyOf(dataDefinitions);
        }

        @JsonIgnore
        public String id() {
            return metadata.id();
        }

        public BackupArtifact withMetadata(BackupMetadata updated) {
            return new BackupArtifact(updated, schemaSnapshot, dataDefinitions);
        }
    }

    // ---- Consulta --------------------------------------------------------

    /**
     * Filtro de listagem do BackupManager. Campos nulos não filtram; os demais combinam com AND.
     */
    public record BackupFilter(String databaseName,
                               Instant createdAfter,
                               Instant createdBefore,
                               BackupStatus status,
                               List<String> tags) {

        public BackupFilter {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }

        public static BackupFilter all() {
            return new BackupFilter(null, null, null, null, null);
        }

        public static BackupFilter createdAfter(Instant lowerBound) {
            return new BackupFilter(null, lowerBound, null, null, null);
        }

        public static BackupFilter forDatabase(String databaseName) {
            return new BackupFilter(databaseName, null, null, null, null);
        }

        public boolean matches(BackupMetadata m) {
            if (databaseName != null && !databaseName.equals(m.databaseName())) return false;
            if (createdAfter != null && m.createdAt().isBefore(createdAfter)) return false;
            if (createdBefore != null && m.createdAt().isAfter(createdBefore)) return false;
            if (status != null && status != m.status()) return false;
            return m.tags().containsAll(tags);
        }
    }

    /**
     * Fonte de verdade dos metadados de backup. Externa a este módulo: apenas consultada.
     */
    public interface BackupManager {

        List<BackupMetadata> listBackups(BackupFilter filter) throws IOException;

        default List<BackupMetadata> getBackupsByDatabase(String databaseName) throws IOException {
            return listBackups(BackupFilter.forDatabase(Objects.requireNonNull(databaseName, "databaseName")));
        }
    }

    // ---- Rollback --------------------------------------------------------

    /** Backup concluído elegível como ponto de rollback. */
    public record RollbackPoint(String backupId, String databaseName, Instant createdAt, String description) {}

    /**
     * Lista pontos de rollback a partir do BackupManager. Planejamento e execução do rollback
     * ficam com o colaborador externo.
     */
    public static final class RollbackCatalog {

        private final BackupManager backupManager;

        public RollbackCatalog(BackupManager backupManager) {
            this.backupManager = Objects.requireNonNull(backupManager, "backupManager");
        }

        /** Backups COMPLETED do banco, do mais antigo para o mais recente. */
        public List<RollbackPoint> listRollbackPoints(String databaseName) throws IOException {
            List<RollbackPoint> points = new ArrayList<>();
            for (BackupMetadata m : backupManager.getBackupsByDatabase(databaseName)) {
                if (m.status() == BackupStatus.COMPLETED) {
                    points.add(new RollbackPoint(m.id(), m.databaseName(), m.createdAt(), m.description()));
                }
            }
            points.sort(Comparator.comparing(RollbackPoint::createdAt).thenComparing(RollbackPoint::backupId));
            return points;
        }
    }
}
