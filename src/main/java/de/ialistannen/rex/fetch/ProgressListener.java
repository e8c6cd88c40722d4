package de.ialistannen.rex.fetch;

/**
 * Notified whenever a task of a batch finished, successfully or not. Called from worker threads.
 */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (completed, total) -> {
  };

  void onProgress(int completed, int total);
}
