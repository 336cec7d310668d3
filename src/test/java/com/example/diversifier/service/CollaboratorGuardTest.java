package com.example.diversifier.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class CollaboratorGuardTest {

    private CollaboratorGuard guard;
    private final CountDownLatch never = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        guard = new CollaboratorGuard(2, 1);
        ReflectionTestUtils.setField(guard, "timeoutMs", 100L);
    }

    @AfterEach
    void tearDown() {
        never.countDown();
        guard.shutdown();
    }

    @Test
    void testCall_ReturnsValue() {
        assertEquals("ok", guard.call("kv", () -> "ok"));
    }

    @Test
    void testCall_SlowCollaboratorTimesOut() {
        long start = System.currentTimeMillis();

        RecoverableCollaboratorFailure e = assertThrows(RecoverableCollaboratorFailure.class,
                () -> guard.call("kv", this::blockForever));

        assertTrue(System.currentTimeMillis() - start < 2_000);
        assertEquals("kv", e.getCollaborator());
        assertInstanceOf(TimeoutException.class, e.getCause());
        assertTrue(e.isUnresponsive());
    }

    @Test
    void testCall_TimedOutCallIsInterrupted() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThrows(RecoverableCollaboratorFailure.class, () -> guard.call("catalog", () -> {
            try {
                never.await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return null;
        }));

        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    void testCall_HungCollaboratorDoesNotStarveOthers() {
        // Given: both catalog threads are stuck
        for (int i = 0; i < 2; i++) {
            assertThrows(RecoverableCollaboratorFailure.class,
                    () -> guard.call("candidate-supplier", () -> {
                        awaitUninterruptibly();
                        return null;
                    }));
        }

        // When
        String answer = guard.call("session-store", () -> "healthy");

        // Then
        assertEquals("healthy", answer);
    }

    @Test
    void testCall_FullQueueIsRejected() {
        // two stuck threads plus one queued call fill the catalog pool
        for (int i = 0; i < 3; i++) {
            assertThrows(RecoverableCollaboratorFailure.class,
                    () -> guard.call("candidate-supplier", () -> {
                        awaitUninterruptibly();
                        return null;
                    }));
        }

        RecoverableCollaboratorFailure e = assertThrows(RecoverableCollaboratorFailure.class,
                () -> guard.call("candidate-supplier", () -> "late"));

        assertInstanceOf(RejectedExecutionException.class, e.getCause());
        assertTrue(e.isUnresponsive());
    }

    @Test
    void testCall_WrapsFailure() {
        RecoverableCollaboratorFailure e = assertThrows(RecoverableCollaboratorFailure.class,
                () -> guard.call("catalog", () -> {
                    throw new IllegalStateException("no route to host");
                }));

        assertEquals("catalog", e.getCollaborator());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertFalse(e.isUnresponsive());
    }

    @Test
    void testCall_PassesRecoverableFailureThrough() {
        RecoverableCollaboratorFailure original = new RecoverableCollaboratorFailure("session-store", "circuit open");

        RecoverableCollaboratorFailure e = assertThrows(RecoverableCollaboratorFailure.class,
                () -> guard.call("other", () -> {
                    throw original;
                }));

        assertSame(original, e);
    }

    private String blockForever() {
        try {
            never.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return "late";
    }

    // ignores interrupts, like a driver stuck on a socket read
    private void awaitUninterruptibly() {
        while (never.getCount() > 0) {
            try {
                never.await();
            } catch (InterruptedException e) {
                // keep waiting
            }
        }
    }
}
