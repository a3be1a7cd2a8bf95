package com.example.backupstorage.monitor;

import com.example.backupstorage.config.ConfigValidationException;
import com.example.backupstorage.storage.Storage.ProviderType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Limites de armazenamento em bytes. Zero (ou ausente) significa sem limite para aquele alvo.
 * Nada é avaliado quando enabled=false.
 */
public record QuotaSettings(boolean enabled,
                            long totalQuota,
                            Map<String, Long> databaseQuotas,
                            Map<ProviderType, Long> providerQuotas) {

    public QuotaSettings {
        if (totalQuota < 0) {
            throw new ConfigValidationException("quota.total", "quota must be >= 0");
        }
        databaseQuotas = databaseQuotas == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(databaseQuotas));
        providerQuotas = providerQuotas == null || providerQuotas.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(providerQuotas));
        databaseQuotas.forEach((db, q) -> {
            if (q == null || q < 0) {
                throw new ConfigValidationException("quota.databases." + db, "quota must be >= 0");
            }
        });
        providerQuotas.forEach((p, q) -> {
            if (q == null || q < 0) {
                throw new ConfigValidationException("quota.providers." + p.tag(), "quota must be >= 0");
            }
        });
    }

    public static QuotaSettings disabled() {
        return new QuotaSettings(false, 0, Map.of(), Map.of());
    }

    public static QuotaSettings total(long bytes) {
        return new QuotaSettings(true, bytes, Map.of(), Map.of());
    }
}
