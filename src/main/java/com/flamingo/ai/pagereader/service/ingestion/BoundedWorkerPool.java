package com.flamingo.ai.pagereader.service.ingestion;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Runs one batch of independent work items on a fixed number of threads. A failing item is logged
 * and left out of the result; the rest of the batch carries on. Interrupting the caller cancels
 * every item still in flight.
 */
@Slf4j
public class BoundedWorkerPool {

  private final String name;
  private final int workers;

  public BoundedWorkerPool(String name, int workers) {
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be positive: " + workers);
    }
    this.name = name;
    this.workers = workers;
  }

  /**
   * Applies {@code task} to every item and waits for all of them.
   *
   * @param items work items
   * @param task work per item; a null result counts as skipped
   * @return successful results in item order and the number of failed items
   * @throws InterruptedException if the caller is interrupted while waiting
   */
  public <T, R> BatchOutcome<R> process(List<T> items, Function<T, R> task)
      throws InterruptedException {
    if (items.isEmpty()) {
      return new BatchOutcome<>(List.of(), 0);
    }

    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(name + "-");
    threadFactory.setDaemon(true);
    ExecutorService executor =
        Executors.newFixedThreadPool(Math.min(workers, items.size()), threadFactory);
    try {
      List<Callable<R>> calls = new ArrayList<>(items.size());
      for (T item : items) {
        calls.add(() -> task.apply(item));
      }

      List<R> results = new ArrayList<>(items.size());
      int failed = 0;
      for (Future<R> future : executor.invokeAll(calls)) {
        try {
          R result = future.get();
          if (result != null) {
            results.add(result);
          } else {
            failed++;
          }
        } catch (ExecutionException e) {
          failed++;
          Throwable cause = e.getCause() != null ? e.getCause() : e;
          log.warn("{} item failed: {}", name, cause.getMessage());
        }
      }
      return new BatchOutcome<>(results, failed);
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Result of one batch.
   *
   * @param results non-null results of the items that succeeded
   * @param failed items that threw or returned null
   */
  public record BatchOutcome<R>(List<R> results, int failed) {

    public BatchOutcome {
      results = List.copyOf(results);
    }
  }
}
