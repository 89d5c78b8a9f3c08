package com.notiflow.notification.common.health;

import com.notiflow.notification.common.exception.HealthCheckTimeoutException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs independent health checks concurrently.
 */
public final class HealthChecks {

    private HealthChecks() {
    }

    /**
     * Runs every check on {@code executor} and returns once all of them passed. Fails as
     * soon as the first check fails, without waiting for the remaining ones, and gives up
     * once {@code timeout} has elapsed.
     *
     * <p>The executor must not be one whose threads may themselves be waiting in here;
     * nested calls on a bounded pool can starve each other until the deadline.
     *
     * @throws HealthCheckTimeoutException if the checks did not all finish in time
     * @throws RuntimeException the first failure, unwrapped from the completion wrapper
     */
    public static void runAll(List<Runnable> checks, Executor executor, Duration timeout) {
        CompletableFuture<Void> outcome = new CompletableFuture<>();
        CompletableFuture<?>[] running = new CompletableFuture<?>[checks.size()];
        for (int i = 0; i < checks.size(); i++) {
            running[i] = CompletableFuture.runAsync(checks.get(i), executor)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        outcome.completeExceptionally(unwrap(error));
                    }
                });
        }
        CompletableFuture.allOf(running).whenComplete((ignored, error) -> outcome.complete(null));

        try {
            outcome.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancelAll(running);
            throw new HealthCheckTimeoutException(
                "Health checks did not finish within " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(running);
            throw new HealthCheckTimeoutException("Interrupted while waiting for health checks", e);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Health check failed", cause);
        }
    }

    private static void cancelAll(CompletableFuture<?>[] running) {
        for (CompletableFuture<?> future : running) {
            future.cancel(true);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
