package de.ialistannen.rex.fetch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets a caller stop a running batch. Tasks that have not started yet are skipped, running ones finish.
 */
public class CancellationSignal {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
