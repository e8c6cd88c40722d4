package de.ialistannen.rex.fetch;

import de.ialistannen.rex.fetch.TaskOutcome.Failed;
import de.ialistannen.rex.fetch.TaskOutcome.Succeeded;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * The outcome of a batch. Both lists are in input order.
 *
 * @param successes the fetched values
 * @param failures the items that could not be fetched
 * @param <T> the value type
 */
public record FetchResult<T>(List<T> successes, List<FetchFailure> failures) {

  public FetchResult {
    successes = List.copyOf(successes);
    failures = List.copyOf(failures);
  }

  public static <T> FetchResult<T> empty() {
    return new FetchResult<>(List.of(), List.of());
  }

  /**
   * Splits the outcomes of a batch.
   *
   * @param tasks the tasks, in input order
   * @param outcomes one outcome per task, at the task's position
   * @param itemName names an item for the failure list
   * @param <I> the item type
   * @param <T> the value type
   * @return the result
   * @throws IllegalStateException if a task has no outcome
   */
  public static <I, T> FetchResult<T> collect(
    List<FetchTask<I>> tasks,
    List<TaskOutcome<T>> outcomes,
    Function<I, String> itemName
  ) {
    if (tasks.size() != outcomes.size()) {
      throw new IllegalArgumentException(
        "Got " + outcomes.size() + " outcomes for " + tasks.size() + " tasks"
      );
    }
    List<T> successes = new ArrayList<>();
    List<FetchFailure> failures = new ArrayList<>();

    for (FetchTask<I> task : tasks) {
      TaskOutcome<T> outcome = outcomes.get(task.position());
      if (outcome instanceof Succeeded<T> succeeded) {
        successes.add(succeeded.value());
      } else if (outcome instanceof Failed<T> failed) {
        failures.add(new FetchFailure(itemName.apply(task.target()), failed.error()));
      } else {
        throw new IllegalStateException("No outcome for task at position " + task.position());
      }
    }

    return new FetchResult<>(successes, failures);
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
