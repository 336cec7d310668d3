package com.example.diversifier.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.util.Map;
import java.util.concurrent.*;
import java.util.function.Supplier;

/**
 * Runs I/O-bound collaborator calls on bounded pools and waits at most
 * {@code app.collaborators.timeout-ms} for each of them.
 *
 * <p>Every collaborator name gets its own pool and queue, so a hung catalog
 * cannot starve session store calls. A timed out call is interrupted and a
 * full queue is rejected straight away.
 */
@Component
public class CollaboratorGuard {

    private static final Logger logger = LoggerFactory.getLogger(CollaboratorGuard.class);

    private final Map<String, ExecutorService> pools = new ConcurrentHashMap<>();
    private final int threadsPerCollaborator;
    private final int queueCapacity;

    @Value("${app.collaborators.timeout-ms:2000}")
    private long timeoutMs;

    public CollaboratorGuard(@Value("${app.collaborators.max-threads:8}") int threadsPerCollaborator,
                             @Value("${app.collaborators.queue-capacity:64}") int queueCapacity) {
        this.threadsPerCollaborator = threadsPerCollaborator > 0 ? threadsPerCollaborator : 8;
        this.queueCapacity = queueCapacity > 0 ? queueCapacity : 64;
    }

    private ExecutorService createExecutorService(String collaborator) {
        return new ThreadPoolExecutor(threadsPerCollaborator, threadsPerCollaborator, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), r -> {
                    Thread t = new Thread(r, "collaborator-" + collaborator);
                    t.setDaemon(true);
                    return t;
                });
    }

    /**
     * Executes {@code call} with the configured timeout.
     *
     * @throws RecoverableCollaboratorFailure on timeout, failure, rejection or interruption
     */
    public <T> T call(String collaborator, Supplier<T> call) {
        Future<T> future;
        try {
            future = pools.computeIfAbsent(collaborator, this::createExecutorService).submit((Callable<T>) call::get);
        } catch (RejectedExecutionException e) {
            logger.warn("{} call rejected, {} calls already waiting", collaborator, queueCapacity);
            throw new RecoverableCollaboratorFailure(collaborator, "saturated", e);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("{} call timed out after {}ms", collaborator, timeoutMs);
            throw new RecoverableCollaboratorFailure(collaborator, "timed out after " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RecoverableCollaboratorFailure) {
                throw (RecoverableCollaboratorFailure) cause;
            }
            throw new RecoverableCollaboratorFailure(collaborator, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RecoverableCollaboratorFailure(collaborator, "interrupted while waiting", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        pools.values().forEach(ExecutorService::shutdownNow);
    }
}
