package com.example.backupstorage.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.backupstorage.testutil.MutableClock;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class OperationContextTest {

    @Test
    void deadline_expires_with_clock() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC);
        OperationContext ctx = OperationContext.withTimeout(Duration.ofSeconds(10), clock);

        assertTrue(ctx.isActive());
        assertEquals(Duration.ofSeconds(10), ctx.remaining().orElseThrow());

        clock.advance(Duration.ofSeconds(11));
        assertTrue(ctx.isExpired());
        assertEquals(Duration.ZERO, ctx.remaining().orElseThrow());

        OperationCancelledException e = assertThrows(OperationCancelledException.class, () -> ctx.ensureActive("store"));
        assertTrue(e.deadlineExceeded());
    }

    @Test
    void cancel_runs_listeners_once() throws Exception {
        OperationContext ctx = OperationContext.none();
        AtomicInteger calls = new AtomicInteger();
        ctx.onCancel(calls::incrementAndGet);

        ctx.cancel();
        ctx.cancel();
        assertEquals(1, calls.get());

        ctx.onCancel(calls::incrementAndGet);
        assertEquals(2, calls.get());

        OperationCancelledException e = assertThrows(OperationCancelledException.class, () -> ctx.ensureActive("list"));
        assertFalse(e.deadlineExceeded());
    }

    @Test
    void classify_keeps_backend_errors_while_active() {
        OperationContext ctx = OperationContext.none();
        IOException backend = new IOException("connection reset");
        assertSame(backend, ctx.classify("retrieve", backend));

        ctx.cancel();
        IOException classified = ctx.classify("retrieve", backend);
        assertTrue(classified instanceof OperationCancelledException);
        assertSame(backend, classified.getCause());
    }

    @Test
    void context_without_deadline_never_expires() {
        OperationContext ctx = OperationContext.none();
        assertTrue(ctx.deadline().isEmpty());
        assertTrue(ctx.remaining().isEmpty());
        assertFalse(ctx.isExpired());
    }

    @Test
    void removed_listener_is_not_run_on_cancel() {
        OperationContext ctx = OperationContext.none();
        AtomicInteger calls = new AtomicInteger();
        OperationContext.Registration registration = ctx.onCancel(calls::incrementAndGet);

        registration.close();
        ctx.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void child_deadline_never_exceeds_parent() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC);
        OperationContext parent = OperationContext.withTimeout(Duration.ofSeconds(10), clock);

        assertEquals(Duration.ofSeconds(3), parent.child(Duration.ofSeconds(3)).remaining().orElseThrow());
        assertEquals(Duration.ofSeconds(10), parent.child(Duration.ofMinutes(5)).remaining().orElseThrow());
    }

    @Test
    void child_cancel_does_not_reach_parent() {
        OperationContext parent = OperationContext.none();
        OperationContext child = parent.child(Duration.ofSeconds(30));
        OperationContext sibling = parent.child(Duration.ofSeconds(30));

        child.cancel();
        assertFalse(parent.isCancelled());
        assertFalse(sibling.isCancelled());

        parent.cancel();
        assertTrue(sibling.isCancelled());
    }
}
