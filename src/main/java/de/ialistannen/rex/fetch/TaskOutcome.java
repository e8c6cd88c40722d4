package de.ialistannen.rex.fetch;

/**
 * How a single task ended.
 *
 * @param <T> the result type
 */
public sealed interface TaskOutcome<T> permits TaskOutcome.Succeeded, TaskOutcome.Failed {

  record Succeeded<T>(T value) implements TaskOutcome<T> {

  }

  record Failed<T>(Exception error) implements TaskOutcome<T> {

  }
}
