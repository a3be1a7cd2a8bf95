package com.example.backupstorage.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Configuração inválida ou incompleta, detectada antes de qualquer I/O.
 * Sempre corrigível pelo operador; a mensagem nomeia o campo ofensor.
 */
public class ConfigValidationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final List<Violation> violations;

    public ConfigValidationException(String field, String message) {
        this(List.of(new Violation(field, message)));
    }

    public ConfigValidationException(List<Violation> violations) {
        super(describe(violations));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> violations() {
        return violations;
    }

    /** Lança se houver ao menos uma violação acumulada. */
    public static void throwIfAny(List<Violation> violations) {
        if (!violations.isEmpty()) {
            throw new ConfigValidationException(violations);
        }
    }

    private static String describe(List<Violation> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("violations vazio");
        }
        if (violations.size() == 1) {
            return violations.get(0).toString();
        }
        return violations.size() + " erros de validação: " + violations.get(0)
                + " (e mais " + (violations.size() - 1) + ")";
    }

    /** Um campo e a restrição que ele viola. */
    public record Violation(String field, String message) {
        public Violation {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String toString() {
            return field + ": " + message;
        }
    }

    /** Acumulador usado pelos validate() para reportar todos os problemas de uma vez. */
    public static final class Collector {
        private final List<Violation> violations = new ArrayList<>();

        public Collector require(boolean condition, String field, String message) {
            if (!condition) {
                violations.add(new Violation(field, message));
            }
            return this;
        }

        public Collector requireText(String value, String field, String message) {
            return require(value != null && !value.isBlank(), field, message);
        }

        public void throwIfAny() {
            ConfigValidationException.throwIfAny(violations);
        }
    }
}
