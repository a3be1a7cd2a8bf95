package com.example.backupstorage.common;

import java.io.InterruptedIOException;

/**
 * Operação abortada por cancelamento explícito, prazo expirado ou thread interrompida.
 * Nunca representa falha reportada pelo backend.
 */
public class OperationCancelledException extends InterruptedIOException {

    private static final long serialVersionUID = 1L;

    private final boolean deadlineExceeded;

    public OperationCancelledException(String message, boolean deadlineExceeded) {
        super(message);
        this.deadlineExceeded = deadlineExceeded;
    }

    public OperationCancelledException(String message, boolean deadlineExceeded, Throwable cause) {
        this(message, deadlineExceeded);
        initCause(cause);
    }

    /** true quando o motivo foi o prazo, false quando foi cancelamento/interrupção. */
    public boolean deadlineExceeded() {
        return deadlineExceeded;
    }
}
