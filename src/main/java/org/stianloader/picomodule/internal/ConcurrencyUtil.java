package org.stianloader.picomodule.internal;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;

import org.jetbrains.annotations.NotNull;

public class ConcurrencyUtil {

    /**
     * A task that polls whether the future it completes was cancelled.
     *
     * @param <T> The type of the result
     */
    @FunctionalInterface
    public interface CancellableTask<T> {
        T call(@NotNull BooleanSupplier cancelled) throws Exception;
    }

    /**
     * Run a task on the given executor. The task is skipped if the returned future was completed
     * (for example cancelled) before the executor got around to running it.
     *
     * @param <T> The type of the result
     * @param source The task to run
     * @param executor The executor to run the task on
     * @return A future that completes with the result of the task
     */
    @NotNull
    public static <T> CompletableFuture<T> schedule(@NotNull Callable<T> source, @NotNull Executor executor) {
        Objects.requireNonNull(source, "source may not be null");

        CompletableFuture<T> cf = new CompletableFuture<>();
        executor.execute(() -> {
            if (cf.isDone()) {
                return;
            }
            try {
                cf.complete(source.call());
            } catch (Throwable t) {
                cf.completeExceptionally(t);
            }
        });
        return cf;
    }

    /**
     * Variant of {@link #schedule(Callable, Executor)} for long running tasks. The task receives a probe that
     * reports whether the returned future was completed in the meantime, which is the case once a caller cancelled it.
     * The task is expected to poll the probe between its phases and stop early.
     *
     * @param <T> The type of the result
     * @param task The task to run
     * @param executor The executor to run the task on
     * @return A future that completes with the result of the task
     */
    @NotNull
    public static <T> CompletableFuture<T> scheduleCancellable(@NotNull CancellableTask<T> task, @NotNull Executor executor) {
        Objects.requireNonNull(task, "task may not be null");

        CompletableFuture<T> cf = new CompletableFuture<>();
        executor.execute(() -> {
            if (cf.isDone()) {
                return;
            }
            try {
                cf.complete(task.call(cf::isDone));
            } catch (Throwable t) {
                cf.completeExceptionally(t);
            }
        });
        return cf;
    }

    /**
     * Run {@code taskCount} tasks with at most {@code concurrency} of them in flight at any time.
     * Each lane is scheduled on the executor once and pulls task indices from a shared cursor until
     * none are left, so the executor never sees more than {@code concurrency} submissions.
     *
     * <p>The task must not throw; failures are expected to be recorded by the task itself. Should a task
     * throw anyways, the lane it ran on stops and the returned future completes exceptionally once
     * all lanes are done.
     *
     * @param taskCount The amount of tasks
     * @param concurrency The maximum amount of concurrently running tasks, at least 1
     * @param task The task, receiving the task index
     * @param executor The executor to run the lanes on
     * @return A future that completes once every lane finished
     */
    @NotNull
    public static CompletableFuture<Void> runBounded(int taskCount, int concurrency, @NotNull IntConsumer task, @NotNull Executor executor) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
        AtomicInteger cursor = new AtomicInteger();
        int lanes = Math.max(1, Math.min(concurrency, taskCount));
        CompletableFuture<?>[] futures = new CompletableFuture<?>[lanes];
        for (int i = 0; i < lanes; i++) {
            futures[i] = ConcurrencyUtil.schedule(() -> {
                for (int index = cursor.getAndIncrement(); index < taskCount; index = cursor.getAndIncrement()) {
                    task.accept(index);
                }
                return null;
            }, executor);
        }
        return CompletableFuture.allOf(futures);
    }
}
