package de.ialistannen.rex.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.ialistannen.rex.fetch.SkippedTaskException.Reason;
import de.ialistannen.rex.fetch.TaskOutcome.Failed;
import de.ialistannen.rex.fetch.TaskOutcome.Succeeded;
import de.ialistannen.rex.registry.RateLimitedException;
import de.ialistannen.rex.registry.TransportException;
import de.ialistannen.rex.registry.UnauthorizedException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FetchPoolTest {

  @ParameterizedTest
  @ValueSource(ints = {1, 4, 8, 16})
  void keepsInputOrderUnderRandomLatency(int concurrency) throws InterruptedException {
    List<FetchTask<Integer>> tasks = tasks(40, it -> "repo");

    List<TaskOutcome<String>> outcomes;
    try (FetchPool pool = new FetchPool(concurrency, RetryPolicy.noRetries())) {
      outcomes = pool.run(
        tasks,
        item -> {
          Thread.sleep(ThreadLocalRandom.current().nextInt(15));
          return "item-" + item;
        },
        new CancellationSignal(),
        ProgressListener.NONE
      );
    }

    FetchResult<String> result = FetchResult.collect(tasks, outcomes, String::valueOf);
    assertThat(result.failures()).isEmpty();
    assertThat(result.successes()).containsExactlyElementsOf(
      IntStream.range(0, 40).mapToObj(it -> "item-" + it).toList()
    );
  }

  @Test
  void neverRunsMoreThanConcurrencyTasksAtOnce() throws InterruptedException {
    AtomicInteger running = new AtomicInteger();
    AtomicInteger maxRunning = new AtomicInteger();

    try (FetchPool pool = new FetchPool(3, RetryPolicy.noRetries())) {
      pool.run(
        tasks(20, it -> "repo"),
        item -> {
          int now = running.incrementAndGet();
          maxRunning.accumulateAndGet(now, Math::max);
          Thread.sleep(5);
          running.decrementAndGet();
          return item;
        },
        new CancellationSignal(),
        ProgressListener.NONE
      );
    }

    assertThat(maxRunning.get()).isBetween(1, 3);
  }

  @Test
  void recordsFailuresNextToSuccesses() throws InterruptedException {
    List<FetchTask<Integer>> tasks = tasks(5, it -> "repo");

    List<TaskOutcome<String>> outcomes;
    try (FetchPool pool = new FetchPool(4, RetryPolicy.noRetries())) {
      outcomes = pool.run(
        tasks,
        item -> {
          if (item % 2 == 0) {
            throw new TransportException("connection reset for " + item);
          }
          return "ok-" + item;
        },
        new CancellationSignal(),
        ProgressListener.NONE
      );
    }

    FetchResult<String> result = FetchResult.collect(tasks, outcomes, it -> "tag-" + it);
    assertThat(result.successes()).containsExactly("ok-1", "ok-3");
    assertThat(result.failures())
      .extracting(FetchFailure::item)
      .containsExactly("tag-0", "tag-2", "tag-4");
    assertThat(result.failures())
      .allSatisfy(it -> assertThat(it.error()).isInstanceOf(TransportException.class));
    assertThat(result.hasFailures()).isTrue();
  }

  @Test
  void recordsCrashedTasksAsFailures() throws InterruptedException {
    List<FetchTask<Integer>> tasks = tasks(3, it -> "repo");

    List<TaskOutcome<Integer>> outcomes;
    try (FetchPool pool = new FetchPool(2, RetryPolicy.noRetries())) {
      outcomes = pool.run(
        tasks,
        item -> {
          if (item == 1) {
            throw new StackOverflowError("deep manifest");
          }
          return item;
        },
        new CancellationSignal(),
        ProgressListener.NONE
      );
    }

    FetchResult<Integer> result = FetchResult.collect(tasks, outcomes, String::valueOf);
    assertThat(result.successes()).containsExactly(0, 2);
    assertThat(result.failures()).singleElement().satisfies(it -> {
      assertThat(it.item()).isEqualTo("1");
      assertThat(it.error()).isInstanceOf(ExecutionException.class).hasCauseInstanceOf(StackOverflowError.class);
    });
  }

  @Test
  void collectRejectsMissingOutcomes() {
    List<FetchTask<Integer>> tasks = tasks(2, it -> "repo");
    List<TaskOutcome<Integer>> outcomes = new ArrayList<>();
    outcomes.add(new Succeeded<>(0));
    outcomes.add(null);

    assertThatThrownBy(() -> FetchResult.collect(tasks, outcomes, String::valueOf))
      .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void skipsGroupAfterAccessWasDenied() throws InterruptedException {
    List<FetchTask<Integer>> tasks = tasks(6, it -> it < 4 ? "private" : "public");
    AtomicInteger calls = new AtomicInteger();

    List<TaskOutcome<Integer>> outcomes;
    try (FetchPool pool = new FetchPool(1, RetryPolicy.noRetries())) {
      outcomes = pool.run(
        tasks,
        item -> {
          calls.incrementAndGet();
          if (item < 4) {
            throw new UnauthorizedException("private:" + item, 401);
          }
          return item;
        },
        new CancellationSignal(),
        ProgressListener.NONE
      );
    }

    assertThat(calls.get()).isEqualTo(3);
    assertThat(outcomes.get(0)).isInstanceOfSatisfying(
      Failed.class,
      it -> assertThat(it.error()).isInstanceOf(UnauthorizedException.class)
    );
    for (int i = 1; i < 4; i++) {
      assertThat(skipReason(outcomes.get(i))).contains(Reason.UNAUTHORIZED);
    }
    assertThat(outcomes.subList(4, 6)).containsExactly(new Succeeded<>(4), new Succeeded<>(5));
  }

  @Test
  void cancellationSkipsQueuedTasks() throws InterruptedException {
    List<FetchTask<Integer>> tasks = tasks(10, it -> "repo");
    CancellationSignal cancellation = new CancellationSignal();
    List<Integer> progress = Collections.synchronizedList(new ArrayList<>());

    List<TaskOutcome<Integer>> outcomes;
    try (FetchPool pool = new FetchPool(1, RetryPolicy.noRetries())) {
      outcomes = pool.run(
        tasks,
        item -> {
          if (item == 2) {
            cancellation.cancel();
          }
          return item;
        },
        cancellation,
        (completed, total) -> progress.add(completed)
      );
    }

    assertThat(outcomes.subList(0, 3)).containsExactly(new Succeeded<>(0), new Succeeded<>(1), new Succeeded<>(2));
    for (int i = 3; i < 10; i++) {
      assertThat(skipReason(outcomes.get(i))).contains(Reason.CANCELLED);
    }
    assertThat(progress).hasSize(10).contains(10);
  }

  @Test
  void retriesRateLimitedTasksWithBackoff() throws InterruptedException {
    List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());
    AtomicInteger attempts = new AtomicInteger();
    RetryPolicy policy = new RetryPolicy(4, Duration.ofSeconds(1), Duration.ofSeconds(30), true);

    List<TaskOutcome<String>> outcomes;
    try (FetchPool pool = new FetchPool(2, policy, sleeps::add)) {
      outcomes = pool.run(
        tasks(1, it -> "repo"),
        item -> {
          int attempt = attempts.incrementAndGet();
          if (attempt == 1) {
            throw new RateLimitedException("repo", Optional.of(Duration.ofSeconds(5)));
          }
          if (attempt == 2) {
            throw new RateLimitedException("repo", Optional.empty());
          }
          return "done";
        },
        new CancellationSignal(),
        ProgressListener.NONE
      );
    }

    assertThat(outcomes).containsExactly(new Succeeded<>("done"));
    assertThat(sleeps).containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(2));
  }

  @Test
  void givesUpAfterMaxAttempts() throws InterruptedException {
    List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());
    RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(1), true);
    Set<Thread> workers = ConcurrentHashMap.newKeySet();

    List<TaskOutcome<String>> outcomes;
    try (FetchPool pool = new FetchPool(1, policy, sleeps::add)) {
      outcomes = pool.run(
        tasks(1, it -> "repo"),
        item -> {
          workers.add(Thread.currentThread());
          throw new RateLimitedException("repo", Optional.empty());
        },
        new CancellationSignal(),
        ProgressListener.NONE
      );
    }

    assertThat(outcomes.get(0)).isInstanceOfSatisfying(
      Failed.class,
      it -> assertThat(it.error()).isInstanceOf(RateLimitedException.class)
    );
    assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    assertThat(workers).allSatisfy(it -> assertThat(it.getName()).startsWith("rex-fetch-"));
  }

  @Test
  void emptyBatchReturnsImmediately() throws InterruptedException {
    try (FetchPool pool = new FetchPool(2, RetryPolicy.noRetries())) {
      List<TaskOutcome<Object>> outcomes = pool.run(
        List.of(),
        item -> item,
        new CancellationSignal(),
        ProgressListener.NONE
      );

      assertThat(outcomes).isEmpty();
    }
  }

  private static Optional<Reason> skipReason(TaskOutcome<?> outcome) {
    if (outcome instanceof Failed<?> failed && failed.error() instanceof SkippedTaskException skipped) {
      return Optional.of(skipped.reason());
    }
    return Optional.empty();
  }

  private static List<FetchTask<Integer>> tasks(int count, IntFunction<String> group) {
    return IntStream.range(0, count)
      .mapToObj(it -> new FetchTask<>(it, it, group.apply(it), TaskKind.TAG_METADATA))
      .toList();
  }
}
