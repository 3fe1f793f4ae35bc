package com.mineralink.harvester.worker;

import com.mineralink.harvester.util.LayerLogContext;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A bounded pool of named daemon threads that runs independent tasks in parallel.
 * <p>
 * Tasks inherit the log context of the thread that submitted them, so lines logged while fetching a chunk are still
 * prefixed with the layer they belong to. A task that fails makes {@link #awaitAll(List)} fail with the task's
 * exception, checked exceptions wrapped as unchecked.
 */
public class Worker implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(Worker.class);
  private final ExecutorService executor;

  /**
   * Constructs a new worker pool.
   *
   * @param prefix  name to give threads in this pool, followed by {@code -N}
   * @param threads maximum number of tasks to run at once
   */
  public Worker(String prefix, int threads) {
    if (threads < 1) {
      throw new IllegalArgumentException("Worker " + prefix + " needs at least 1 thread, got " + threads);
    }
    this.executor = Executors.newFixedThreadPool(threads, new NamedThreadFactory(prefix));
  }

  /** Schedules {@code task} on this pool and returns a future that completes with its result. */
  public <T> CompletableFuture<T> submit(Callable<T> task) {
    Callable<T> withContext = LayerLogContext.carry(task);
    return CompletableFuture.supplyAsync(() -> {
      try {
        return withContext.call();
      } catch (Exception e) {
        LOGGER.error("Task on {} failed", Thread.currentThread().getName(), e);
        throw unchecked(e);
      }
    }, executor);
  }

  /**
   * Blocks until all {@code futures} complete and returns their results in order.
   *
   * @throws RuntimeException the exception of the first task to fail, or a {@link TaskFailedException} if interrupted
   */
  public static <T> List<T> awaitAll(List<CompletableFuture<T>> futures) {
    try {
      joinFutures(new ArrayList<>(futures)).get();
    } catch (ExecutionException e) {
      throw unchecked(e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TaskFailedException(e);
    }
    return futures.stream().map(CompletableFuture::join).toList();
  }

  private static RuntimeException unchecked(Throwable e) {
    if (e instanceof RuntimeException runtimeException) {
      return runtimeException;
    } else if (e instanceof Error error) {
      throw error;
    } else if (e instanceof IOException ioe) {
      return new UncheckedIOException(ioe);
    }
    return new TaskFailedException(e);
  }

  /**
   * Returns a future that completes successfully when all {@code futures} complete, or fails immediately when the first
   * one fails.
   */
  public static CompletableFuture<Void> joinFutures(Collection<CompletableFuture<?>> futures) {
    CompletableFuture<Void> result = CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
    // fail fast on exceptions
    for (CompletableFuture<?> f : futures) {
      f.whenComplete((res, ex) -> {
        if (ex != null) {
          result.completeExceptionally(ex);
          futures.forEach(other -> other.cancel(true));
        }
      });
    }
    return result;
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  /** A task on a worker pool failed with a checked exception, or waiting for one was interrupted. */
  public static class TaskFailedException extends RuntimeException {

    TaskFailedException(Throwable cause) {
      super(cause);
    }
  }

  /** A thread factory that prepends {@code name-} to all thread names. */
  private static class NamedThreadFactory implements ThreadFactory {

    private final ThreadGroup group;
    private final AtomicInteger threadNumber = new AtomicInteger(1);
    private final String namePrefix;

    private NamedThreadFactory(String name) {
      group = Thread.currentThread().getThreadGroup();
      namePrefix = name + "-";
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(group, r, namePrefix + threadNumber.getAndIncrement(), 0);
      t.setDaemon(true);
      t.setPriority(Thread.NORM_PRIORITY);
      return t;
    }
  }
}
