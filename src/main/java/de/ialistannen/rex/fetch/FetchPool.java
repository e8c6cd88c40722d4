package de.ialistannen.rex.fetch;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.ialistannen.rex.fetch.SkippedTaskException.Reason;
import de.ialistannen.rex.fetch.TaskOutcome.Failed;
import de.ialistannen.rex.fetch.TaskOutcome.Succeeded;
import de.ialistannen.rex.registry.RateLimitedException;
import de.ialistannen.rex.registry.UnauthorizedException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs batches of fetch tasks on a fixed number of worker threads.
 * <p>
 * Every task yields exactly one outcome, stored at the task's input position. Rate limited tasks are retried with
 * backoff. Once a task is denied access, queued tasks of the same group are skipped.
 */
public class FetchPool implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(FetchPool.class);

  private final ExecutorService executor;
  private final int concurrency;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;

  public FetchPool(int concurrency, RetryPolicy retryPolicy) {
    this(concurrency, retryPolicy, Sleeper.SYSTEM);
  }

  public FetchPool(int concurrency, RetryPolicy retryPolicy, Sleeper sleeper) {
    if (concurrency < 1) {
      throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
    }
    this.concurrency = concurrency;
    this.retryPolicy = retryPolicy;
    this.sleeper = sleeper;

    this.executor = Executors.newFixedThreadPool(
      concurrency,
      new ThreadFactoryBuilder()
        .setNameFormat("rex-fetch-%d")
        .setDaemon(true)
        .build()
    );
  }

  public int concurrency() {
    return concurrency;
  }

  /**
   * Runs all tasks and waits for them to finish.
   *
   * @param tasks the tasks. Their positions must be {@code 0..tasks.size() - 1}.
   * @param body the work to do per item
   * @param cancellation cancels tasks that have not started yet
   * @param progress notified after each finished task
   * @param <I> the item type
   * @param <T> the result type
   * @return one outcome per task, indexed by the task's position
   * @throws InterruptedException if interrupted while waiting. Queued tasks are cancelled.
   */
  public <I, T> List<TaskOutcome<T>> run(
    List<FetchTask<I>> tasks,
    TaskBody<I, T> body,
    CancellationSignal cancellation,
    ProgressListener progress
  ) throws InterruptedException {
    AtomicReferenceArray<TaskOutcome<T>> outcomes = new AtomicReferenceArray<>(tasks.size());
    Set<String> deniedGroups = ConcurrentHashMap.newKeySet();
    CountDownLatch done = new CountDownLatch(tasks.size());
    AtomicInteger completed = new AtomicInteger();

    for (FetchTask<I> task : tasks) {
      executor.execute(() -> {
        try {
          outcomes.set(task.position(), runTask(task, body, cancellation, deniedGroups));
        } catch (Error e) {
          LOGGER.error("Fetching {} '{}' crashed", task.kind(), task.target(), e);
          outcomes.set(
            task.position(),
            new Failed<>(new ExecutionException("Task for '" + task.target() + "' crashed", e))
          );
        } finally {
          try {
            progress.onProgress(completed.incrementAndGet(), tasks.size());
          } finally {
            done.countDown();
          }
        }
      });
    }

    try {
      done.await();
    } catch (InterruptedException e) {
      LOGGER.info("Interrupted while waiting for {} task(s), cancelling the rest", done.getCount());
      cancellation.cancel();
      throw e;
    }

    List<TaskOutcome<T>> result = new ArrayList<>(tasks.size());
    for (int i = 0; i < tasks.size(); i++) {
      result.add(outcomes.get(i));
    }
    return result;
  }

  private <I, T> TaskOutcome<T> runTask(
    FetchTask<I> task,
    TaskBody<I, T> body,
    CancellationSignal cancellation,
    Set<String> deniedGroups
  ) {
    if (cancellation.isCancelled()) {
      return new Failed<>(new SkippedTaskException(Reason.CANCELLED, String.valueOf(task.target())));
    }
    if (deniedGroups.contains(task.group())) {
      return new Failed<>(new SkippedTaskException(Reason.UNAUTHORIZED, String.valueOf(task.target())));
    }

    try {
      return new Succeeded<>(runWithRetry(task, body, cancellation));
    } catch (UnauthorizedException e) {
      deniedGroups.add(task.group());
      LOGGER.warn("Access denied for {} '{}', skipping the rest of '{}'", task.kind(), task.target(), task.group());
      return new Failed<>(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return new Failed<>(e);
    } catch (Exception e) {
      LOGGER.warn("Fetching {} '{}' failed: {}", task.kind(), task.target(), e.getMessage());
      LOGGER.debug("Failure details", e);
      return new Failed<>(e);
    }
  }

  private <I, T> T runWithRetry(FetchTask<I> task, TaskBody<I, T> body, CancellationSignal cancellation)
    throws Exception {
    int attempt = 1;
    while (true) {
      try {
        return body.run(task.target());
      } catch (RateLimitedException e) {
        if (attempt >= retryPolicy.maxAttempts() || cancellation.isCancelled()) {
          throw e;
        }
        Duration wait = retryPolicy.backoff(attempt, e.retryAfter());
        LOGGER.info(
          "Rate limited on '{}' (attempt {}/{}), retrying in {} ms",
          task.target(),
          attempt,
          retryPolicy.maxAttempts(),
          wait.toMillis()
        );
        sleeper.sleep(wait);
        attempt++;
      }
    }
  }

  @Override
  public void close() {
    executor.shutdown();
  }

  /**
   * The work done for a single item.
   *
   * @param <I> the item type
   * @param <T> the result type
   */
  @FunctionalInterface
  public interface TaskBody<I, T> {

    T run(I item) throws Exception;
  }
}
