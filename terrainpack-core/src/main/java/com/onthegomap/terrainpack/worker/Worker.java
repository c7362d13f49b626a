package com.onthegomap.terrainpack.worker;

import com.onthegomap.terrainpack.util.LogUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Processes numbered slices of work on a fixed pool of daemon threads named {@code <prefix>-<n>}.
 * <p>
 * Each thread claims the next unprocessed slice until none are left. The first failure cancels the remaining
 * threads and is rethrown from {@link #await()}.
 */
public class Worker {

  private static final Logger LOGGER = LoggerFactory.getLogger(Worker.class);

  private final String prefix;
  private final CompletableFuture<Void> done;

  private Worker(String prefix, int threads, int slices, IntConsumer task) {
    this.prefix = prefix;
    AtomicInteger next = new AtomicInteger();
    AtomicInteger threadNumber = new AtomicInteger(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads, runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + threadNumber.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    });
    String parentStage = LogUtil.getStage();
    List<CompletableFuture<Void>> futures = new ArrayList<>(threads);
    for (int i = 0; i < threads; i++) {
      futures.add(CompletableFuture.runAsync(() -> {
        LogUtil.setStage(parentStage, prefix);
        try {
          int slice;
          while (!Thread.currentThread().isInterrupted() && (slice = next.getAndIncrement()) < slices) {
            task.accept(slice);
          }
        } finally {
          LogUtil.clearStage();
        }
      }, pool));
    }
    pool.shutdown();
    done = CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
    for (var future : futures) {
      future.whenComplete((result, error) -> {
        if (error != null && done.completeExceptionally(error)) {
          LOGGER.error("{} worker failed, stopping the others", prefix, error);
          pool.shutdownNow();
        }
      });
    }
  }

  /**
   * Starts {@code threads} threads that call {@code task} once for each slice index in {@code [0, slices)}.
   *
   * @return a handle to {@link #await()} completion
   */
  public static Worker forSlices(String prefix, int threads, int slices, IntConsumer task) {
    return new Worker(prefix, Math.max(1, Math.min(threads, slices)), slices, task);
  }

  /**
   * Blocks until every slice is processed.
   *
   * @throws RuntimeException       the first exception a task threw, unchecked ones as-is
   * @throws CancellationException  if the calling thread was interrupted while waiting
   */
  public void await() {
    try {
      done.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      } else if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException(prefix + " worker failed", cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException(prefix + " interrupted");
    }
  }
}
